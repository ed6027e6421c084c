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

import graylab.lib.common.InvalidParameterException;

/**
 * Immutable 8-bit unsigned grayscale image.
 * <p>
 * Pixels are stored in row-major order. The backing array is never exposed: factory methods
 * copy the caller's data, and {@link #getPixels()} returns a copy.
 */
public final class GrayImage implements SimpleImage {
	
	private final byte[] data;
	private final int width;
	private final int height;
	
	private GrayImage(byte[] data, int width, int height) {
		this.data = data;
		this.width = width;
		this.height = height;
	}
	
	/**
	 * Create an image from unsigned bytes in row-major order.
	 * @param data pixel values, length must equal width * height
	 * @param width
	 * @param height
	 * @return
	 */
	public static GrayImage create(byte[] data, int width, int height) {
		Objects.requireNonNull(data, "Pixel data must not be null");
		checkSize(data.length, width, height);
		return new GrayImage(data.clone(), width, height);
	}
	
	/**
	 * Create an image from integer values in row-major order.
	 * Values must lie in the range 0-255.
	 * @param values
	 * @param width
	 * @param height
	 * @return
	 */
	public static GrayImage create(int[] values, int width, int height) {
		Objects.requireNonNull(values, "Pixel values must not be null");
		checkSize(values.length, width, height);
		byte[] bytes = new byte[values.length];
		for (int i = 0; i < values.length; i++) {
			int v = values[i];
			if (v < 0 || v > 255)
				throw new InvalidParameterException("Pixel value " + v + " at index " + i + " is outside the range 0-255");
			bytes[i] = (byte)v;
		}
		return new GrayImage(bytes, width, height);
	}
	
	/**
	 * Create an image from a 2D array of rows.
	 * @param rows rows of pixel values in the range 0-255; all rows must have the same length
	 * @return
	 */
	public static GrayImage fromRows(int[][] rows) {
		Objects.requireNonNull(rows, "Rows must not be null");
		if (rows.length == 0)
			throw new InvalidParameterException("At least one row is required");
		int width = rows[0].length;
		int height = rows.length;
		int[] values = new int[width * height];
		for (int y = 0; y < height; y++) {
			if (rows[y].length != width)
				throw new InvalidParameterException("Row " + y + " has length " + rows[y].length + ", expected " + width);
			System.arraycopy(rows[y], 0, values, y * width, width);
		}
		return create(values, width, height);
	}
	
	/**
	 * Create an image with every pixel set to the same value.
	 * @param width
	 * @param height
	 * @param value in the range 0-255
	 * @return
	 */
	public static GrayImage filled(int width, int height, int value) {
		if (value < 0 || value > 255)
			throw new InvalidParameterException("Fill value " + value + " is outside the range 0-255");
		checkSize(width * height, width, height);
		byte[] bytes = new byte[width * height];
		Arrays.fill(bytes, (byte)value);
		return new GrayImage(bytes, width, height);
	}
	
	private static void checkSize(int length, int width, int height) {
		if (width <= 0 || height <= 0)
			throw new InvalidParameterException("Image dimensions must be positive, but were " + width + " x " + height);
		if ((long)width * height != length)
			throw new InvalidParameterException("Expected " + ((long)width * height) + " pixels for " + width + " x " + height + " image, but got " + length);
	}
	
	/**
	 * Get the unsigned value of a pixel.
	 * @param x
	 * @param y
	 * @return a value in the range 0-255
	 */
	public int getPixel(int x, int y) {
		return data[y * width + x] & 0xFF;
	}

	@Override
	public float getValue(int x, int y) {
		return getPixel(x, y);
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
	 * Get a copy of the pixels as unsigned bytes, in row-major order.
	 * @return
	 */
	public byte[] getPixels() {
		return data.clone();
	}
	
	/**
	 * Get a copy of the pixels as integers in the range 0-255, in row-major order.
	 * @return
	 */
	public int[] getValues() {
		int[] values = new int[data.length];
		for (int i = 0; i < data.length; i++)
			values[i] = data[i] & 0xFF;
		return values;
	}
	
	/**
	 * Mean pixel value.
	 * @return
	 */
	public double mean() {
		long sum = 0;
		for (byte b : data)
			sum += b & 0xFF;
		return sum / (double)data.length;
	}

	@Override
	public int hashCode() {
		return Objects.hash(width, height, Arrays.hashCode(data));
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof GrayImage other))
			return false;
		return width == other.width && height == other.height && Arrays.equals(data, other.data);
	}

	@Override
	public String toString() {
		return "GrayImage (" + width + " x " + height + ")";
	}

}
