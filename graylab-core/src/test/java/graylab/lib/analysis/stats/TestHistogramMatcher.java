/*-
 * #%L
 * This file is part of GrayLab.
 * %%
 * Copyright (C) 2024 - 2025 GrayLab developers
 * %%
 * GrayLab is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * GrayLab is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with GrayLab.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package graylab.lib.analysis.stats;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.OptionalInt;
import java.util.Random;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import graylab.lib.common.InvalidParameterException;
import graylab.lib.images.GrayImage;

@SuppressWarnings("javadoc")
public class TestHistogramMatcher {
	
	/**
	 * 16x16 image containing every intensity exactly once.
	 */
	private static GrayImage createRampImage() {
		int[] values = new int[256];
		for (int i = 0; i < values.length; i++)
			values[i] = i;
		return GrayImage.create(values, 16, 16);
	}
	
	private static GrayImage createRandomImage(long seed, int width, int height, int min, int max) {
		var rng = new Random(seed);
		int[] values = new int[width * height];
		for (int i = 0; i < values.length; i++)
			values[i] = min + rng.nextInt(max - min + 1);
		return GrayImage.create(values, width, height);
	}
	
	@Test
	public void test_identityForSameHistogram() {
		var image = createRampImage();
		var cdf = HistogramMatcher.computeHistogram(image).getCumulative();
		var mapping = HistogramMatcher.findMonotonicMapping(cdf, cdf);
		assertTrue(mapping.isComplete());
		assertEquals(IntensityMapping.identity(), mapping);
		for (int i = 0; i < 256; i++)
			assertEquals(OptionalInt.of(i), mapping.get(i));
		assertEquals(image, HistogramMatcher.applyMapping(image, mapping));
	}
	
	@ParameterizedTest
	@ValueSource(longs = {1L, 42L, 1234L, 98765L})
	public void test_monotonic(long seed) {
		var imageA = createRandomImage(seed, 40, 30, 20, 180);
		var imageB = createRandomImage(seed + 1, 25, 25, 60, 255);
		var mapping = HistogramMatcher.match(imageA, imageB).mapping();
		int last = -1;
		for (var entry : mapping.toList()) {
			if (entry.isEmpty())
				continue;
			assertTrue(entry.getAsInt() >= last);
			last = entry.getAsInt();
		}
	}
	
	@Test
	public void test_trailingTailIsAbsent() {
		double[] cdfA = new double[256];
		double[] cdfB = new double[256];
		for (int i = 0; i < 256; i++) {
			cdfA[i] = (i + 1) / 256.0;
			cdfB[i] = 0.5;
		}
		var mapping = HistogramMatcher.findMonotonicMapping(cdfA, cdfB);
		assertEquals(128, mapping.getMappedCount());
		assertFalse(mapping.isComplete());
		assertEquals(OptionalInt.of(0), mapping.get(127));
		for (int i = 128; i < 256; i++)
			assertTrue(mapping.get(i).isEmpty());
		
		var image = GrayImage.create(new int[] {5, 127, 128, 255}, 2, 2);
		assertArrayEquals(new int[] {0, 0, 0, 0}, HistogramMatcher.applyMapping(image, mapping).getValues());
	}
	
	@Test
	public void test_match() {
		var imageA = GrayImage.create(new int[] {0, 0, 255, 255}, 2, 2);
		var imageB = GrayImage.create(new int[] {10, 10, 20, 20, 10, 20}, 3, 2);
		var result = HistogramMatcher.match(imageA, imageB);
		assertEquals(OptionalInt.of(10), result.mapping().get(0));
		assertEquals(OptionalInt.of(10), result.mapping().get(128));
		assertEquals(OptionalInt.of(20), result.mapping().get(255));
		assertArrayEquals(new int[] {10, 10, 20, 20}, result.matched().getValues());
		assertEquals(4, result.histogramA().getCountSum());
		assertEquals(6, result.histogramB().getCountSum());
	}
	
	@Test
	public void test_applyMapping() {
		var mapping = IntensityMapping.of(0, 0, 5, 5, 9);
		var image = GrayImage.create(new int[] {0, 1, 2, 3, 4, 5, 200}, 7, 1);
		assertArrayEquals(new int[] {0, 0, 5, 5, 9, 0, 0}, HistogramMatcher.applyMapping(image, mapping).getValues());
	}
	
	@Test
	public void test_invalid() {
		assertThrows(InvalidParameterException.class, () -> HistogramMatcher.findMonotonicMapping(new double[255], new double[256]));
		assertThrows(InvalidParameterException.class, () -> HistogramMatcher.findMonotonicMapping(new double[256], new double[10]));
		assertThrows(NullPointerException.class, () -> HistogramMatcher.findMonotonicMapping((double[])null, new double[256]));
		assertThrows(InvalidParameterException.class, () -> IntensityMapping.of(3, 2));
		assertThrows(InvalidParameterException.class, () -> IntensityMapping.of(256));
	}

}
