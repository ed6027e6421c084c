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

package graylab.opencv.ops;

import java.util.Locale;

import graylab.lib.common.InvalidParameterException;

/**
 * 3x3 rank filters that can be chained with {@link ImageOps.Filters#sequence(String)}.
 */
public enum MorphologyType {
	
	/**
	 * Minimum filter (erosion).
	 */
	MIN,
	
	/**
	 * Maximum filter (dilation).
	 */
	MAX;
	
	/**
	 * Parse a filter from its name: "min" or "minimum", "max" or "maximum".
	 * @param name
	 * @return
	 * @throws InvalidParameterException if the name is not recognized
	 */
	public static MorphologyType fromString(String name) throws InvalidParameterException {
		if (name == null)
			throw new InvalidParameterException("No filter specified");
		return switch (name.strip().toLowerCase(Locale.ROOT)) {
			case "min", "minimum" -> MIN;
			case "max", "maximum" -> MAX;
			default -> throw new InvalidParameterException("Unknown filter type: '" + name + "'");
		};
	}

}
