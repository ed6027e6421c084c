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

import org.bytedeco.opencv.opencv_core.Mat;

/**
 * An operation that may be applied to a single-channel {@link Mat}.
 * <p>
 * Operations expect 8-bit input and produce 8-bit output, so they can be chained freely.
 * 
 * @see ImageOps
 */
@FunctionalInterface
public interface ImageOp {
	
	/**
	 * Apply operation to the image. The input may be modified (and the operation applied in-place), 
	 * therefore should be duplicated if a copy is required to be kept.
	 * 
	 * @param input input image
	 * @return output image, which may be the same as the input image
	 */
	public Mat apply(Mat input);

}
