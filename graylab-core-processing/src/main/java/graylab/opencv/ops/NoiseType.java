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

import graylab.lib.common.GeneralTools;

/**
 * Kinds of synthetic noise.
 */
public enum NoiseType {
	
	/**
	 * Random pixels set to 0 or 255.
	 */
	SALT_PEPPER,
	
	/**
	 * Additive zero-mean Gaussian noise.
	 */
	GAUSSIAN;
	
	/**
	 * Parse a noise type from its name, e.g. "salt-pepper" or "gaussian".
	 * @param name
	 * @return
	 * @throws graylab.lib.common.InvalidParameterException if the name is not recognized
	 */
	public static NoiseType fromString(String name) {
		return GeneralTools.parseEnum(NoiseType.class, name);
	}

}
