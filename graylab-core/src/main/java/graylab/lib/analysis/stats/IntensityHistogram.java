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

import java.util.Objects;

import graylab.lib.common.InvalidParameterException;
import graylab.lib.images.GrayImage;

/**
 * 256-bin histogram of an 8-bit image, with derived normalized and cumulative forms.
 * <p>
 * The cumulative histogram is computed from integer running counts, so it is non-decreasing 
 * and its final entry is exactly 1.
 */
public class IntensityHistogram {
	
	/**
	 * Number of bins, one per 8-bit intensity.
	 */
	public static final int N_BINS = 256;
	
	private final long[] counts;
	private final long countSum;
	private final long maxCount;
	private final double[] normalized;
	private final double[] cumulative;
	
	private IntensityHistogram(long[] counts) {
		this.counts = counts;
		long sum = 0;
		long max = 0;
		for (long c : counts) {
			sum += c;
			max = Math.max(max, c);
		}
		this.countSum = sum;
		this.maxCount = max;
		this.normalized = new double[N_BINS];
		this.cumulative = new double[N_BINS];
		long running = 0;
		for (int i = 0; i < N_BINS; i++) {
			running += counts[i];
			normalized[i] = (double)counts[i] / sum;
			cumulative[i] = (double)running / sum;
		}
	}
	
	/**
	 * Count the intensities of an image.
	 * @param image
	 * @return
	 */
	public static IntensityHistogram fromImage(GrayImage image) {
		Objects.requireNonNull(image, "Image must not be null");
		long[] counts = new long[N_BINS];
		for (byte b : image.getPixels())
			counts[b & 0xFF]++;
		return new IntensityHistogram(counts);
	}
	
	/**
	 * Create a histogram from existing counts.
	 * @param counts 256 non-negative counts, not all zero
	 * @return
	 */
	public static IntensityHistogram fromCounts(long[] counts) {
		Objects.requireNonNull(counts, "Counts must not be null");
		if (counts.length != N_BINS)
			throw new InvalidParameterException("Histogram requires " + N_BINS + " bins, but got " + counts.length);
		long sum = 0;
		for (long c : counts) {
			if (c < 0)
				throw new InvalidParameterException("Histogram counts must not be negative");
			sum += c;
		}
		if (sum == 0)
			throw new InvalidParameterException("Histogram must contain at least one count");
		return new IntensityHistogram(counts.clone());
	}
	
	/**
	 * Get the count for a single intensity.
	 * @param ind intensity in the range 0-255
	 * @return
	 */
	public long getCountsForBin(int ind) {
		return counts[ind];
	}
	
	/**
	 * Get a copy of all counts.
	 * @return
	 */
	public long[] getCounts() {
		return counts.clone();
	}
	
	/**
	 * Sum of all counts, i.e. the number of pixels.
	 * @return
	 */
	public long getCountSum() {
		return countSum;
	}
	
	/**
	 * Largest count in any bin.
	 * @return
	 */
	public long getMaxCount() {
		return maxCount;
	}
	
	/**
	 * Get the probability mass function, i.e. each count divided by the sum of all counts.
	 * @return
	 */
	public double[] getNormalizedCounts() {
		return normalized.clone();
	}
	
	/**
	 * Get the cumulative distribution function.
	 * @return
	 */
	public double[] getCumulative() {
		return cumulative.clone();
	}
	
	/**
	 * Get the cumulative distribution scaled so that its final value equals {@link #getMaxCount()}.
	 * Useful for overlaying the cumulative curve on a plot of the raw counts.
	 * @return
	 */
	public double[] getScaledCumulative() {
		double[] scaled = new double[N_BINS];
		for (int i = 0; i < N_BINS; i++)
			scaled[i] = cumulative[i] * maxCount;
		return scaled;
	}
	
	/**
	 * Lowest intensity with a non-zero count.
	 * @return
	 */
	public int getMinValue() {
		for (int i = 0; i < N_BINS; i++) {
			if (counts[i] > 0)
				return i;
		}
		return -1;
	}
	
	/**
	 * Highest intensity with a non-zero count.
	 * @return
	 */
	public int getMaxValue() {
		for (int i = N_BINS - 1; i >= 0; i--) {
			if (counts[i] > 0)
				return i;
		}
		return -1;
	}

	@Override
	public String toString() {
		return "IntensityHistogram [n=" + countSum + ", min=" + getMinValue() + ", max=" + getMaxValue() + "]";
	}

}
