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

import java.util.List;

import graylab.lib.images.FloatImage;
import graylab.lib.images.GrayImage;
import graylab.opencv.pyramids.DisplayPyramid;
import graylab.opencv.pyramids.LaplacianPyramid;

/**
 * Output of {@link BlendEngine#blend(GrayImage, GrayImage, int, double, BlendMaskType)}.
 * 
 * @param pyramid1 display form of the first image's Laplacian pyramid
 * @param pyramid2 display form of the second image's Laplacian pyramid
 * @param maskPyramid Gaussian pyramid of the blend mask, values in [0, 1]
 * @param blendedDisplay display form of the blended Laplacian pyramid
 * @param blendedPyramid the blended Laplacian pyramid
 * @param result the reconstructed composite
 */
public record BlendResult(DisplayPyramid pyramid1, DisplayPyramid pyramid2, List<FloatImage> maskPyramid,
		DisplayPyramid blendedDisplay, LaplacianPyramid blendedPyramid, GrayImage result) {
	
	/**
	 * Constructor.
	 */
	public BlendResult {
		maskPyramid = List.copyOf(maskPyramid);
	}
	
	/**
	 * Get the mask pyramid scaled to 0-255 for display.
	 * @return
	 */
	public List<GrayImage> maskDisplay() {
		return maskPyramid.stream().map(m -> m.toGray(255.0, 0.0)).toList();
	}

}
