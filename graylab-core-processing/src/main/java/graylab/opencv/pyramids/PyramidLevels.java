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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import graylab.lib.common.InvalidParameterException;

/**
 * Level-count rules shared by all pyramid construction.
 */
public final class PyramidLevels {
	
	private final static Logger logger = LoggerFactory.getLogger(PyramidLevels.class);
	
	/**
	 * Smallest permitted dimension for any level other than the first.
	 */
	public static final int MIN_LEVEL_SIZE = 16;
	
	// Suppressed default constructor for non-instantiability
	private PyramidLevels() {
		throw new AssertionError();
	}
	
	/**
	 * Maximum number of levels for an image of the specified size, 
	 * {@code max(1, floor(log2(min(rows, cols))) - 2)}.
	 * @param rows
	 * @param cols
	 * @return
	 */
	public static int maxLevels(int rows, int cols) {
		int minDim = Math.min(rows, cols);
		if (minDim < 1)
			throw new InvalidParameterException("Image dimensions must be positive, but were " + cols + " x " + rows);
		int log2 = 31 - Integer.numberOfLeadingZeros(minDim);
		return Math.max(1, log2 - 2);
	}
	
	/**
	 * Clamp a requested level count to the maximum feasible for an image size.
	 * @param rows
	 * @param cols
	 * @param requested requested number of levels, at least 1
	 * @return {@code min(requested, maxLevels(rows, cols))}
	 * @throws InvalidParameterException if {@code requested < 1}
	 */
	public static int computeLevels(int rows, int cols, int requested) throws InvalidParameterException {
		if (requested < 1)
			throw new InvalidParameterException("Number of pyramid levels must be >= 1, but was " + requested);
		int max = maxLevels(rows, cols);
		if (requested > max) {
			logger.debug("Requested {} levels for {} x {} image, using {}", requested, cols, rows, max);
			return max;
		}
		return requested;
	}
	
	/**
	 * Size of the next, coarser level along one axis.
	 * @param size
	 * @return {@code (size + 1) / 2}
	 */
	public static int nextLevelSize(int size) {
		return (size + 1) / 2;
	}
	
	/**
	 * Check whether another level can be added below one with the specified size.
	 * @param rows
	 * @param cols
	 * @return true if the next level's smaller dimension would be at least {@link #MIN_LEVEL_SIZE}
	 */
	public static boolean canDownsample(int rows, int cols) {
		return Math.min(nextLevelSize(rows), nextLevelSize(cols)) >= MIN_LEVEL_SIZE;
	}

}
