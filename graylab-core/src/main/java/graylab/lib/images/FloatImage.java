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

package graylab.lib.images;

import java.util.Arrays;
import java.util.Objects;

import graylab.lib.common.GeneralTools;
import graylab.lib.common.InvalidParameterException;

/**
 * Immutable single-channel image with 32-bit floating point samples.
 * <p>
 * Used wherever values can be negative or fractional: Laplacian residuals, blend masks and
 * frequency masks.
 */
public final class FloatImage implements SimpleImage {
	
	private final float[] data;
	private final int width;
	private final int height;
	
	private FloatImage(float[] data, int width, int height) {
		this.data = data;
		this.width = width;
		this.height = height;
	}
	
	/**
	 * Create an image from a float array in row-major order. The array is copied.
	 * @param data
	 * @param width
	 * @param height
	 * @return
	 */
	public static FloatImage create(float[] data, int width, int height) {
		Objects.requireNonNull(data, "Pixel data must not be null");
		if (width <= 0 || height <= 0)
			throw new InvalidParameterException("Image dimensions must be positive, but were " + width + " x " + height);
		if ((long)width * height != data.length)
			throw new InvalidParameterException("Expected " + ((long)width * height) + " pixels for " + width + " x " + height + " image, but got " + data.length);
		return new FloatImage(data.clone(), width, height);
	}
	
	/**
	 * Create a float image holding the values of an 8-bit image.
	 * @param image
	 * @return
	 */
	public static FloatImage fromGray(GrayImage image) {
		int[] values = image.getValues();
		float[] data = new float[values.length];
		for (int i = 0; i < values.length; i++)
			data[i] = values[i];
		return new FloatImage(data, image.getWidth(), image.getHeight());
	}

	@Override
	public float getValue(int x, int y) {
		return data[y * width + x];
	}

	@Override
	public int getWidth() {
		return width;
	}

	@Override
	public int getHeight() {
		return height;
	}
	
	/**
	 * Get a copy of the pixels, in row-major order.
	 * @return
	 */
	public float[] getPixels() {
		return data.clone();
	}
	
	/**
	 * Convert to 8-bit by multiplying each value by {@code scale}, adding {@code offset},
	 * then rounding and clipping to 0-255.
	 * @param scale
	 * @param offset
	 * @return
	 */
	public GrayImage toGray(double scale, double offset) {
		int[] values = new int[data.length];
		for (int i = 0; i < data.length; i++)
			values[i] = GeneralTools.clipToUInt8(data[i] * scale + offset);
		return GrayImage.create(values, width, height);
	}
	
	/**
	 * Minimum value, ignoring NaNs.
	 * @return
	 */
	public float min() {
		float min = Float.POSITIVE_INFINITY;
		for (float v : data) {
			if (v < min)
				min = v;
		}
		return min;
	}
	
	/**
	 * Maximum value, ignoring NaNs.
	 * @return
	 */
	public float max() {
		float max = Float.NEGATIVE_INFINITY;
		for (float v : data) {
			if (v > max)
				max = v;
		}
		return max;
	}

	@Override
	public int hashCode() {
		return Objects.hash(width, height, Arrays.hashCode(data));
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof FloatImage other))
			return false;
		return width == other.width && height == other.height && Arrays.equals(data, other.data);
	}

	@Override
	public String toString() {
		return "FloatImage (" + width + " x " + height + ")";
	}

}
