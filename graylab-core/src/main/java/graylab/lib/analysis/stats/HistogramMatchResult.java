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

package graylab.lib.analysis.stats;

import graylab.lib.images.GrayImage;

/**
 * Output of {@link HistogramMatcher#match(GrayImage, GrayImage)}.
 * 
 * @param histogramA histogram of the source image
 * @param histogramB histogram of the target image
 * @param mapping monotonic mapping from source to target intensities
 * @param matched source image after applying the mapping
 */
public record HistogramMatchResult(IntensityHistogram histogramA, IntensityHistogram histogramB,
		IntensityMapping mapping, GrayImage matched) {}
