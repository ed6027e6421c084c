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

package graylab.opencv.frequency;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Random;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import graylab.lib.common.InvalidParameterException;
import graylab.lib.images.FloatImage;
import graylab.lib.images.GrayImage;

@SuppressWarnings("javadoc")
public class TestFrequencyDomainFilter {
	
	private static GrayImage createRandomImage(int width, int height, long seed) {
		var rng = new Random(seed);
		int[] values = new int[width * height];
		for (int i = 0; i < values.length; i++)
			values[i] = rng.nextInt(256);
		return GrayImage.create(values, width, height);
	}
	
	private static float sum(FloatImage image) {
		float sum = 0;
		for (float v : image.getPixels())
			sum += v;
		return sum;
	}
	
	@ParameterizedTest
	@CsvSource({
		"32, 32, true, true",
		"32, 32, false, false",
		"17, 23, true, false",
		"17, 23, false, true",
		"1, 9, true, true"
	})
	public void test_roundTrip(int width, int height, boolean center, boolean log) {
		var image = createRandomImage(width, height, width * 100L + height);
		var result = FrequencyDomainFilter.transform(image, center, log);
		assertEquals(image, result.reconstructed());
		assertTrue(image.sameSize(result.magnitudeSpectrum()));
	}
	
	@Test
	public void test_spectrumOfConstantImage() {
		var image = GrayImage.filled(9, 6, 100);
		
		var centered = FrequencyDomainFilter.transform(image, true, false).magnitudeSpectrum();
		assertEquals(255, centered.getPixel(4, 3));
		assertEquals(255, centered.mean() * 9 * 6, 1e-6);
		
		var uncentered = FrequencyDomainFilter.transform(image, false, true).magnitudeSpectrum();
		assertEquals(255, uncentered.getPixel(0, 0));
		assertEquals(0, uncentered.getPixel(4, 3));
	}
	
	@Test
	public void test_spectrumOfZeroImage() {
		var image = GrayImage.filled(8, 8, 0);
		var result = FrequencyDomainFilter.transform(image, true, true);
		assertEquals(GrayImage.filled(8, 8, 0), result.magnitudeSpectrum());
		assertEquals(image, result.reconstructed());
	}
	
	@ParameterizedTest
	@CsvSource({"32, 32", "31, 17", "8, 45"})
	public void test_dcOnly(int width, int height) {
		var image = createRandomImage(width, height, 7L);
		var params = FrequencyFilterParams.lowPass(0, MaskProfile.IDEAL);
		var result = FrequencyDomainFilter.applyFilter(image, params);
		assertEquals(1f, sum(result.mask()));
		double mean = image.mean();
		for (int v : result.filtered().getValues())
			assertEquals(mean, v, 1.0);
	}
	
	@Test
	public void test_filterOutputIsRounded() {
		// Mean is 0.6, DC magnitude is 3
		var image = GrayImage.fromRows(new int[][] {{1, 1, 1, 0, 0}});
		var params = FrequencyFilterParams.lowPass(0, MaskProfile.IDEAL);
		var result = FrequencyDomainFilter.applyFilter(image, params);
		assertEquals(GrayImage.fromRows(new int[][] {{1, 1, 1, 1, 1}}), result.filtered());
		// 20 * log(4) = 27.73
		assertEquals(28, result.magnitudeSpectrum().getPixel(2, 0));
		assertEquals(28, result.filteredSpectrum().getPixel(2, 0));
		
		var paramsDc = FrequencyFilterParams.builder(FrequencyFilterType.LOW_PASS)
				.radius(0)
				.addDc(true)
				.build();
		assertEquals(GrayImage.filled(5, 1, 129), FrequencyDomainFilter.applyFilter(image, paramsDc).filtered());
	}
	
	@Test
	public void test_allPass() {
		var image = createRandomImage(24, 20, 8L);
		var params = FrequencyFilterParams.lowPass(1000, MaskProfile.IDEAL);
		var result = FrequencyDomainFilter.applyFilter(image, params);
		assertEquals(image, result.filtered());
		assertEquals(result.magnitudeSpectrum(), result.filteredSpectrum());
	}
	
	@Test
	public void test_highPassWithDc() {
		var image = GrayImage.filled(32, 32, 90);
		var params = FrequencyFilterParams.builder(FrequencyFilterType.HIGH_PASS)
				.radius(5)
				.addDc(true)
				.build();
		var result = FrequencyDomainFilter.applyFilter(image, params);
		assertEquals(GrayImage.filled(32, 32, 128), result.filtered());
		
		var paramsNoDc = FrequencyFilterParams.highPass(5, MaskProfile.IDEAL);
		assertEquals(GrayImage.filled(32, 32, 0), FrequencyDomainFilter.applyFilter(image, paramsNoDc).filtered());
	}
	
	@Test
	public void test_filteredSpectrumIsAttenuated() {
		var image = createRandomImage(40, 30, 9L);
		var params = FrequencyFilterParams.bandPass(3, 8, MaskProfile.GAUSSIAN);
		var result = FrequencyDomainFilter.applyFilter(image, params);
		int[] spectrum = result.magnitudeSpectrum().getValues();
		int[] filtered = result.filteredSpectrum().getValues();
		for (int i = 0; i < spectrum.length; i++)
			assertTrue(filtered[i] <= spectrum[i]);
		// DC is attenuated by the band pass
		assertTrue(result.filteredSpectrum().getPixel(20, 15) < result.magnitudeSpectrum().getPixel(20, 15));
		assertEquals(FrequencyDomainFilter.createMask(30, 40, params), result.mask());
	}
	
	@Test
	public void test_idealMasks() {
		var lowPass = FrequencyDomainFilter.createMask(5, 5, FrequencyFilterParams.lowPass(1, MaskProfile.IDEAL));
		assertEquals(5f, sum(lowPass));
		assertEquals(1f, lowPass.getValue(2, 2));
		assertEquals(1f, lowPass.getValue(3, 2));
		assertEquals(0f, lowPass.getValue(3, 3));
		
		var highPass = FrequencyDomainFilter.createMask(5, 5, FrequencyFilterParams.highPass(1, MaskProfile.IDEAL));
		assertEquals(20f, sum(highPass));
		
		// Even sizes are centered at size / 2
		var even = FrequencyDomainFilter.createMask(4, 6, FrequencyFilterParams.lowPass(0, MaskProfile.IDEAL));
		assertEquals(1f, even.getValue(3, 2));
		assertEquals(1f, sum(even));
		
		var band = FrequencyDomainFilter.createMask(7, 7, FrequencyFilterParams.bandPass(1, 2, MaskProfile.IDEAL));
		assertEquals(12f, sum(band));
		assertEquals(0f, band.getValue(3, 3));
	}
	
	@Test
	public void test_gaussianMasks() {
		var lowPass = FrequencyDomainFilter.createMask(21, 21, FrequencyFilterParams.lowPass(4, MaskProfile.GAUSSIAN));
		assertEquals(1f, lowPass.getValue(10, 10), 1e-6);
		assertEquals(Math.exp(-0.5), lowPass.getValue(14, 10), 1e-6);
		
		var highPass = FrequencyDomainFilter.createMask(21, 21, FrequencyFilterParams.highPass(4, MaskProfile.GAUSSIAN));
		assertEquals(0f, highPass.getValue(10, 10), 1e-6);
		assertEquals(1 - Math.exp(-0.5), highPass.getValue(10, 14), 1e-6);
		
		var band = FrequencyDomainFilter.createMask(21, 21, FrequencyFilterParams.bandPass(2, 6, MaskProfile.GAUSSIAN));
		assertEquals(1f, band.getValue(14, 10), 1e-6);
		assertEquals(Math.exp(-0.5), band.getValue(15, 10), 1e-6);
		assertTrue(band.getValue(10, 10) < 0.01f);
	}
	
	@Test
	public void test_parameterDefaults() {
		var params = FrequencyFilterParams.builder(FrequencyFilterType.BAND_PASS).build();
		assertEquals(MaskProfile.IDEAL, params.getProfile());
		assertEquals(30, params.getRadius());
		assertEquals(10, params.getInnerRadius());
		assertEquals(50, params.getOuterRadius());
		assertFalse(params.isAddDc());
		
		assertEquals(MaskProfile.GAUSSIAN, FrequencyFilterParams.builder(FrequencyFilterType.LOW_PASS).gaussian(true).build().getProfile());
	}
	
	@Test
	public void test_invalidParameters() {
		assertThrows(InvalidParameterException.class, () -> FrequencyFilterParams.lowPass(-1, MaskProfile.IDEAL));
		assertThrows(InvalidParameterException.class, () -> FrequencyFilterParams.highPass(Double.NaN, MaskProfile.IDEAL));
		assertThrows(InvalidParameterException.class, () -> FrequencyFilterParams.lowPass(0, MaskProfile.GAUSSIAN));
		assertThrows(InvalidParameterException.class, () -> FrequencyFilterParams.bandPass(10, 5, MaskProfile.IDEAL));
		assertThrows(InvalidParameterException.class, () -> FrequencyFilterParams.bandPass(-1, 5, MaskProfile.IDEAL));
		assertThrows(InvalidParameterException.class, () -> FrequencyFilterParams.bandPass(5, 5, MaskProfile.GAUSSIAN));
		// Equal radii are allowed for an ideal ring
		FrequencyFilterParams.bandPass(5, 5, MaskProfile.IDEAL);
	}
	
	@Test
	public void test_parseNames() {
		assertEquals(FrequencyFilterType.LOW_PASS, FrequencyFilterType.fromString("low_pass"));
		assertEquals(FrequencyFilterType.BAND_PASS, FrequencyFilterType.fromString("band-pass"));
		assertEquals(FrequencyFilterType.HIGH_PASS, FrequencyFilterType.fromString("High Pass"));
		assertEquals(MaskProfile.GAUSSIAN, MaskProfile.fromString("gaussian"));
		assertThrows(InvalidParameterException.class, () -> FrequencyFilterType.fromString("notch"));
	}

}
