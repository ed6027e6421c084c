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

package graylab.lib.images;

import graylab.lib.common.DimensionMismatchException;

/**
 * A minimal single-channel 2D image, accessed by pixel coordinate.
 * <p>
 * Pixels are addressed as (x, y) with x the column and y the row; y grows downwards.
 */
public interface SimpleImage {
	
	/**
	 * Get the value of the pixel at the specified location, as a float.
	 * @param x column
	 * @param y row
	 * @return
	 */
	float getValue(int x, int y);
	
	/**
	 * Image width in pixels (number of columns).
	 * @return
	 */
	int getWidth();
	
	/**
	 * Image height in pixels (number of rows).
	 * @return
	 */
	int getHeight();
	
	/**
	 * Check whether another image has the same width and height.
	 * @param other
	 * @return
	 */
	default boolean sameSize(SimpleImage other) {
		return getWidth() == other.getWidth() && getHeight() == other.getHeight();
	}
	
	/**
	 * Throw a {@link DimensionMismatchException} if two images do not share dimensions.
	 * @param first
	 * @param second
	 * @throws DimensionMismatchException
	 */
	static void requireSameSize(SimpleImage first, SimpleImage second) throws DimensionMismatchException {
		if (!first.sameSize(second))
			throw DimensionMismatchException.of(first.getWidth(), first.getHeight(), second.getWidth(), second.getHeight());
	}

}
