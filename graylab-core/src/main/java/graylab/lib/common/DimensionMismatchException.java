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

package graylab.lib.common;

/**
 * Exception thrown when two images that should share dimensions do not.
 */
public class DimensionMismatchException extends IllegalArgumentException {

	private static final long serialVersionUID = 1L;
	
	/**
	 * Constructor.
	 * @param message
	 */
	public DimensionMismatchException(String message) {
		super(message);
	}
	
	/**
	 * Create an exception describing two mismatched sizes.
	 * @param width1
	 * @param height1
	 * @param width2
	 * @param height2
	 * @return
	 */
	public static DimensionMismatchException of(int width1, int height1, int width2, int height2) {
		return new DimensionMismatchException(String.format(
				"Image dimensions differ: %d x %d and %d x %d", width1, height1, width2, height2));
	}

}
