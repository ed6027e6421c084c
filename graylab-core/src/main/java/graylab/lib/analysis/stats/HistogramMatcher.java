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

import java.util.Arrays;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import graylab.lib.common.InvalidParameterException;
import graylab.lib.images.GrayImage;

/**
 * Static methods to match the intensity distribution of one image to another.
 * <p>
 * The mapping is found by a two-pointer sweep over the cumulative histograms: a pointer into 
 * the target distribution only ever moves forward, which makes the mapping monotonic.
 */
public class HistogramMatcher {
	
	private final static Logger logger = LoggerFactory.getLogger(HistogramMatcher.class);
	
	// Suppressed default constructor for non-instantiability
	private HistogramMatcher() {
		throw new AssertionError();
	}
	
	/**
	 * Compute the 256-bin histogram of an image.
	 * @param image
	 * @return
	 */
	public static IntensityHistogram computeHistogram(GrayImage image) {
		return IntensityHistogram.fromImage(image);
	}
	
	/**
	 * Find a monotonic mapping from intensities of A to intensities of B.
	 * <p>
	 * For each intensity {@code a}, the result is the first intensity {@code b} at or after 
	 * the previous match where {@code cdfB[b] >= cdfA[a]}. If no such {@code b} exists, 
	 * {@code a} and all higher intensities are left unmapped.
	 * 
	 * @param cdfA cumulative distribution of the source, length 256
	 * @param cdfB cumulative distribution of the target, length 256
	 * @return
	 * @throws InvalidParameterException if either array does not have 256 entries
	 */
	public static IntensityMapping findMonotonicMapping(double[] cdfA, double[] cdfB) throws InvalidParameterException {
		Objects.requireNonNull(cdfA, "Source CDF must not be null");
		Objects.requireNonNull(cdfB, "Target CDF must not be null");
		int n = IntensityHistogram.N_BINS;
		if (cdfA.length != n || cdfB.length != n)
			throw new InvalidParameterException("Cumulative histograms must have " + n + " entries, but got " + cdfA.length + " and " + cdfB.length);
		
		int[] mapped = new int[n];
		int p = 0;
		int a = 0;
		for (; a < n; a++) {
			while (p < n && cdfB[p] < cdfA[a])
				p++;
			if (p == n)
				break;
			mapped[a] = p;
		}
		if (a < n)
			logger.debug("No mapping found for intensities {}-{}", a, n - 1);
		return IntensityMapping.of(Arrays.copyOf(mapped, a));
	}
	
	/**
	 * Find the monotonic mapping between two histograms.
	 * @param source
	 * @param target
	 * @return
	 * @see #findMonotonicMapping(double[], double[])
	 */
	public static IntensityMapping findMonotonicMapping(IntensityHistogram source, IntensityHistogram target) {
		return findMonotonicMapping(source.getCumulative(), target.getCumulative());
	}
	
	/**
	 * Apply a mapping to every pixel of an image. Unmapped intensities become 0.
	 * @param image
	 * @param mapping
	 * @return
	 */
	public static GrayImage applyMapping(GrayImage image, IntensityMapping mapping) {
		Objects.requireNonNull(image, "Image must not be null");
		Objects.requireNonNull(mapping, "Mapping must not be null");
		byte[] lut = new byte[IntensityHistogram.N_BINS];
		for (int i = 0; i < lut.length; i++)
			lut[i] = (byte)mapping.apply(i);
		byte[] pixels = image.getPixels();
		for (int i = 0; i < pixels.length; i++)
			pixels[i] = lut[pixels[i] & 0xFF];
		return GrayImage.create(pixels, image.getWidth(), image.getHeight());
	}
	
	/**
	 * Match the intensity distribution of {@code imageA} to that of {@code imageB}.
	 * The images do not need to have the same dimensions.
	 * @param imageA the image to remap
	 * @param imageB the image providing the target distribution
	 * @return
	 */
	public static HistogramMatchResult match(GrayImage imageA, GrayImage imageB) {
		Objects.requireNonNull(imageA, "Source image must not be null");
		Objects.requireNonNull(imageB, "Target image must not be null");
		var histA = computeHistogram(imageA);
		var histB = computeHistogram(imageB);
		var mapping = findMonotonicMapping(histA, histB);
		logger.trace("Matched {} to {}: {}", histA, histB, mapping);
		return new HistogramMatchResult(histA, histB, mapping, applyMapping(imageA, mapping));
	}

}
