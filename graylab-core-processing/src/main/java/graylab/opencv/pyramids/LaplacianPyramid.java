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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import graylab.lib.common.InvalidParameterException;
import graylab.lib.images.FloatImage;
import graylab.lib.images.GrayImage;

/**
 * Laplacian pyramid, holding signed band-pass residuals in floating point.
 * <p>
 * Levels {@code 0..N-2} are {@code gaussian[i] - upsample(gaussian[i+1])}; the last level is the 
 * coarsest Gaussian level. This is the only form accepted by {@link PyramidEngine#reconstruct(LaplacianPyramid)}.
 * 
 * @param levels pyramid levels, from finest to coarsest
 */
public record LaplacianPyramid(List<FloatImage> levels) {
	
	/**
	 * Constructor.
	 * @param levels at least one level
	 */
	public LaplacianPyramid {
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
	public FloatImage getLevel(int level) {
		return levels.get(level);
	}
	
	/**
	 * Create an 8-bit version for display.
	 * Residual levels are offset by 128 and clipped; the coarsest level is only rounded.
	 * @return
	 */
	public DisplayPyramid toDisplay() {
		var display = new ArrayList<GrayImage>(levels.size());
		int last = levels.size() - 1;
		for (int i = 0; i <= last; i++)
			display.add(levels.get(i).toGray(1.0, i == last ? 0 : DisplayPyramid.RESIDUAL_OFFSET));
		return new DisplayPyramid(display);
	}

}
