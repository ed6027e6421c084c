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

package graylab.opencv.pyramids;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Random;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import graylab.lib.common.GeneralTools;
import graylab.lib.common.InvalidParameterException;
import graylab.lib.images.FloatImage;
import graylab.lib.images.GrayImage;

@SuppressWarnings("javadoc")
public class TestPyramidEngine {
	
	private static GrayImage createTestImage(int width, int height, long seed) {
		var rng = new Random(seed);
		int[] values = new int[width * height];
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++) {
				double v = 128 + 60 * Math.sin(x / 7.0) * Math.cos(y / 5.0) + rng.nextGaussian() * 20;
				values[y * width + x] = GeneralTools.clipToUInt8(v);
			}
		}
		return GrayImage.create(values, width, height);
	}
	
	private static int maxAbsDifference(GrayImage a, GrayImage b) {
		int[] va = a.getValues();
		int[] vb = b.getValues();
		int max = 0;
		for (int i = 0; i < va.length; i++)
			max = Math.max(max, Math.abs(va[i] - vb[i]));
		return max;
	}
	
	@Test
	public void test_gaussianSizes() {
		var image = createTestImage(256, 256, 1L);
		var pyramid = PyramidEngine.buildGaussianPyramid(image, 4);
		assertEquals(4, pyramid.size());
		int[] expected = {256, 128, 64, 32};
		for (int i = 0; i < expected.length; i++) {
			assertEquals(expected[i], pyramid.getLevel(i).getWidth());
			assertEquals(expected[i], pyramid.getLevel(i).getHeight());
		}
		assertSame(image, pyramid.getLevel(0));
	}
	
	@Test
	public void test_gaussianOddSizes() {
		var image = createTestImage(101, 67, 2L);
		var pyramid = PyramidEngine.buildGaussianPyramid(image, 10);
		// floor(log2(67)) - 2 = 4, but 67 -> 34 -> 17 -> 9 stops at 3 levels
		assertEquals(3, pyramid.size());
		assertEquals(51, pyramid.getLevel(1).getWidth());
		assertEquals(34, pyramid.getLevel(1).getHeight());
		assertEquals(26, pyramid.getLevel(2).getWidth());
		assertEquals(17, pyramid.getLevel(2).getHeight());
	}
	
	@Test
	public void test_smallImageHasOneLevel() {
		var image = createTestImage(12, 12, 3L);
		var laplacian = PyramidEngine.buildLaplacianPyramid(image, 4);
		assertEquals(1, laplacian.size());
		assertEquals(FloatImage.fromGray(image), laplacian.getLevel(0));
		assertEquals(image, PyramidEngine.reconstruct(laplacian));
	}
	
	@Test
	public void test_gaussianPreservesMean() {
		var image = GrayImage.filled(64, 48, 77);
		var pyramid = PyramidEngine.buildGaussianPyramid(image, 3);
		for (var level : pyramid.levels())
			assertEquals(77, level.mean(), 1e-9);
	}
	
	@ParameterizedTest
	@CsvSource({
		"256, 256, 4",
		"200, 150, 4",
		"97, 131, 3",
		"64, 64, 6",
		"33, 70, 2"
	})
	public void test_roundTrip(int width, int height, int levels) {
		var image = createTestImage(width, height, width * 31L + height);
		var laplacian = PyramidEngine.buildLaplacianPyramid(image, levels);
		var reconstructed = PyramidEngine.reconstruct(laplacian);
		assertTrue(image.sameSize(reconstructed));
		assertTrue(maxAbsDifference(image, reconstructed) <= 2);
	}
	
	@Test
	public void test_laplacianLevels() {
		var image = createTestImage(128, 96, 4L);
		var gaussian = PyramidEngine.buildGaussianPyramid(image, 3);
		var laplacian = PyramidEngine.buildLaplacianPyramid(gaussian);
		assertEquals(gaussian.size(), laplacian.size());
		for (int i = 0; i < gaussian.size(); i++) {
			assertTrue(gaussian.getLevel(i).sameSize(laplacian.getLevel(i)));
		}
		// Coarsest level is the coarsest Gaussian level
		assertEquals(FloatImage.fromGray(gaussian.getLevel(2)), laplacian.getLevel(2));
		
		// Residuals are centered around zero, and may be negative
		var stats = new DescriptiveStatistics();
		for (float v : laplacian.getLevel(0).getPixels())
			stats.addValue(v);
		assertEquals(0, stats.getMean(), 2.0);
		assertTrue(stats.getMin() < 0);
	}
	
	@Test
	public void test_displayPyramid() {
		var image = createTestImage(128, 128, 5L);
		var laplacian = PyramidEngine.buildLaplacianPyramid(image, 4);
		var display = laplacian.toDisplay();
		assertEquals(laplacian.size(), display.size());
		int last = laplacian.size() - 1;
		for (int i = 0; i < last; i++) {
			float[] residual = laplacian.getLevel(i).getPixels();
			int[] values = display.getLevel(i).getValues();
			for (int j = 0; j < residual.length; j++)
				assertEquals(GeneralTools.clipToUInt8((double)residual[j] + DisplayPyramid.RESIDUAL_OFFSET), values[j]);
		}
		// Coarsest level has no offset
		assertEquals(laplacian.getLevel(last).toGray(1.0, 0.0), display.getLevel(last));
	}
	
	@Test
	public void test_floatPyramid() {
		float[] values = new float[64 * 64];
		for (int i = 0; i < values.length; i++)
			values[i] = (i % 64) < 32 ? 1f : 0f;
		var mask = FloatImage.create(values, 64, 64);
		List<FloatImage> pyramid = PyramidEngine.buildGaussianPyramid(mask, 3);
		assertEquals(3, pyramid.size());
		for (var level : pyramid) {
			assertTrue(level.min() >= -1e-6);
			assertTrue(level.max() <= 1 + 1e-6);
		}
		assertEquals(16, pyramid.get(2).getWidth());
	}
	
	@Test
	public void test_invalidLevels() {
		var image = createTestImage(64, 64, 6L);
		assertThrows(InvalidParameterException.class, () -> PyramidEngine.buildGaussianPyramid(image, 0));
	}

}
