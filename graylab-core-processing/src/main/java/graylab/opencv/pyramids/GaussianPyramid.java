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

import java.util.List;
import java.util.Objects;

import graylab.lib.common.InvalidParameterException;
import graylab.lib.images.GrayImage;

/**
 * Gaussian pyramid of 8-bit images. Level 0 is the full-resolution input; 
 * each subsequent level is blurred and downsampled by 2.
 * 
 * @param levels pyramid levels, from finest to coarsest
 */
public record GaussianPyramid(List<GrayImage> levels) {
	
	/**
	 * Constructor.
	 * @param levels at least one level
	 */
	public GaussianPyramid {
		Objects.requireNonNull(levels, "Levels must not be null");
		if (levels.isEmpty())
			throw new InvalidParameterException("A pyramid requires at least one level");
		levels = List.copyOf(levels);
	}
	
	/**
	 * Number of levels.
	 * @return
	 */
	public int size() {
		return levels.size();
	}
	
	/**
	 * Get a single level.
	 * @param level 0 for the finest level
	 * @return
	 */
	public GrayImage getLevel(int level) {
		return levels.get(level);
	}

}
