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

package graylab.opencv.blending;

import java.util.Locale;

import graylab.lib.common.InvalidParameterException;

/**
 * Shape of the weight mask used to combine two images.
 */
public enum BlendMaskType {
	
	/**
	 * Smooth Gaussian falloff around a point on the horizontal center line.
	 */
	SMOOTH,
	
	/**
	 * Hard vertical split, with weight 1 to the left of the split column.
	 */
	SPLIT;
	
	/**
	 * Parse a mask type from its name. 
	 * Accepts "smooth" or "full" for {@link #SMOOTH}, and "split" or "half" for {@link #SPLIT}.
	 * @param name
	 * @return
	 * @throws InvalidParameterException if the name is not recognized
	 */
	public static BlendMaskType fromString(String name) throws InvalidParameterException {
		if (name == null)
			throw new InvalidParameterException("No blend mask type specified");
		return switch (name.strip().toLowerCase(Locale.ROOT)) {
			case "smooth", "full" -> SMOOTH;
			case "split", "half" -> SPLIT;
			default -> throw new InvalidParameterException("Unknown blend mask type: '" + name + "'");
		};
	}

}
