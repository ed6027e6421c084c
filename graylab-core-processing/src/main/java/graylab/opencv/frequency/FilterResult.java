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

package graylab.opencv.frequency;

import graylab.lib.images.FloatImage;
import graylab.lib.images.GrayImage;

/**
 * Output of {@link FrequencyDomainFilter#applyFilter(GrayImage, FrequencyFilterParams)}.
 * 
 * @param filtered the filtered image
 * @param magnitudeSpectrum centered log-magnitude spectrum of the input
 * @param filteredSpectrum centered log-magnitude spectrum after masking
 * @param mask the frequency mask, in centered coordinates
 */
public record FilterResult(GrayImage filtered, GrayImage magnitudeSpectrum, GrayImage filteredSpectrum, FloatImage mask) {}
