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

package graylab.opencv.tools;

import java.util.Arrays;
import java.util.function.DoubleUnaryOperator;

import org.bytedeco.javacpp.indexer.DoubleIndexer;
import org.bytedeco.javacpp.indexer.FloatIndexer;
import org.bytedeco.javacpp.indexer.Index;
import org.bytedeco.javacpp.indexer.Indexer;
import org.bytedeco.javacpp.indexer.UByteIndexer;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Rect;
import org.bytedeco.opencv.opencv_core.Scalar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import graylab.lib.common.InvalidParameterException;
import graylab.lib.images.FloatImage;
import graylab.lib.images.GrayImage;

/**
 * Collection of static methods to help with using OpenCV from Java.
 * <p>
 * Conversions to and from {@link GrayImage} and {@link FloatImage} always copy pixels, so 
 * callers never share native memory with the returned value types.
 */
public class OpenCVTools {
	
	private static Logger logger = LoggerFactory.getLogger(OpenCVTools.class);
	
	/**
	 * Border type used for filtering, matching OpenCV's default (reflect without repeating the edge pixel).
	 */
	public static final int DEFAULT_BORDER_TYPE = opencv_core.BORDER_DEFAULT;
	
	// Suppressed default constructor for non-instantiability
	private OpenCVTools() {
		throw new AssertionError();
	}
	
	/**
	 * Convert an 8-bit image to a single-channel {@code CV_8U} Mat.
	 * @param image
	 * @return a new Mat
	 */
	public static Mat grayToMat(GrayImage image) {
		var mat = new Mat(image.getHeight(), image.getWidth(), opencv_core.CV_8UC1);
		putPixelsUnsigned(mat, image.getValues());
		return mat;
	}
	
	/**
	 * Convert a float image to a single-channel {@code CV_32F} Mat.
	 * @param image
	 * @return a new Mat
	 */
	public static Mat floatToMat(FloatImage image) {
		var mat = new Mat(image.getHeight(), image.getWidth(), opencv_core.CV_32FC1);
		putPixelsFloat(mat, image.getPixels());
		return mat;
	}
	
	/**
	 * Convert an 8-bit image to a single-channel Mat with the specified depth.
	 * @param image
	 * @param depth OpenCV depth, e.g. {@code CV_32F} or {@code CV_64F}
	 * @return a new Mat
	 */
	public static Mat grayToMat(GrayImage image, int depth) {
		var mat = grayToMat(image);
		if (mat.depth() != depth)
			mat.convertTo(mat, depth);
		return mat;
	}
	
	/**
	 * Convert a single-channel Mat to an 8-bit image.
	 * Non-8-bit values are rounded to the nearest integer and saturated to the range 0-255.
	 * @param mat
	 * @return
	 */
	public static GrayImage matToGray(Mat mat) {
		checkSingleChannel(mat);
		Mat mat2;
		if (mat.depth() != opencv_core.CV_8U) {
			mat2 = new Mat();
			mat.convertTo(mat2, opencv_core.CV_8U);
		} else
			mat2 = ensureContinuous(mat, false);
		int[] values = new int[(int)mat2.total()];
		UByteIndexer idx = mat2.createIndexer();
		idx.get(0L, values);
		idx.release();
		if (mat2 != mat)
			mat2.close();
		return GrayImage.create(values, mat.cols(), mat.rows());
	}
	
	/**
	 * Convert a single-channel Mat to a float image.
	 * @param mat
	 * @return
	 */
	public static FloatImage matToFloat(Mat mat) {
		checkSingleChannel(mat);
		return FloatImage.create(extractFloats(mat), mat.cols(), mat.rows());
	}
	
	private static void checkSingleChannel(Mat mat) {
		if (mat.channels() != 1)
			throw new InvalidParameterException("Expected a single-channel Mat, but got " + mat.channels() + " channels");
	}
	
	/**
	 * Set pixels of a {@code CV_8U} Mat from integer values.
	 * Values are written in order; the Mat must be continuous.
	 * @param mat
	 * @param pixels
	 */
	public static void putPixelsUnsigned(Mat mat, int[] pixels) {
		Indexer indexer = mat.createIndexer();
		if (indexer instanceof UByteIndexer idx)
			idx.put(0L, pixels);
		else {
			indexer.release();
			throw new IllegalArgumentException("Expected a UByteIndexer, but instead got " + indexer.getClass());
		}
		indexer.release();
	}
	
	/**
	 * Set pixels of a {@code CV_32F} Mat from a float array.
	 * Values are written in order; the Mat must be continuous.
	 * @param mat
	 * @param pixels
	 */
	public static void putPixelsFloat(Mat mat, float[] pixels) {
		Indexer indexer = mat.createIndexer();
		if (indexer instanceof FloatIndexer idx)
			idx.put(0L, pixels);
		else {
			indexer.release();
			throw new IllegalArgumentException("Expected a FloatIndexer, but instead got " + indexer.getClass());
		}
		indexer.release();
	}
	
	/**
	 * Set pixels of a {@code CV_64F} Mat from a double array.
	 * Values are written in order; the Mat must be continuous.
	 * @param mat
	 * @param pixels
	 */
	public static void putPixelsDouble(Mat mat, double[] pixels) {
		Indexer indexer = mat.createIndexer();
		if (indexer instanceof DoubleIndexer idx)
			idx.put(0L, pixels);
		else {
			indexer.release();
			throw new IllegalArgumentException("Expected a DoubleIndexer, but instead got " + indexer.getClass());
		}
		indexer.release();
	}
	
	/**
	 * Ensure a Mat is continuous, cloning the data if required.
	 * 
	 * @param mat input Mat, which may or may not be continuous
	 * @param inPlace if true, set {@code mat} to contain the cloned data if required
	 * @return the original mat unchanged if it is already continuous, or cloned data that is continuous if required
	 * @see Mat#isContinuous()
	 */
	public static Mat ensureContinuous(Mat mat, boolean inPlace) {
		if (!mat.isContinuous()) {
			var mat2 = mat.clone();
			if (!inPlace) {
				return mat2;
			}
			mat.put(mat2);
		}
		return mat;
	}
	
	/**
	 * Extract pixels as a float array.
	 * @param mat
	 * @return
	 */
	public static float[] extractFloats(Mat mat) {
		float[] pixels = new float[(int)totalPixels(mat)];
		Mat mat2;
		if (mat.depth() != opencv_core.CV_32F) {
			mat2 = new Mat();
			mat.convertTo(mat2, opencv_core.CV_32F);
		} else
			mat2 = ensureContinuous(mat, false);
		
		FloatIndexer idx = mat2.createIndexer();
		idx.get(0L, pixels);
		idx.release();
		
		if (mat2 != mat)
			mat2.close();
		return pixels;
	}
	
	/**
	 * Extract pixels as a double array.
	 * @param mat
	 * @return
	 */
	public static double[] extractDoubles(Mat mat) {
		double[] pixels = new double[(int)totalPixels(mat)];
		Mat mat2;
		if (mat.depth() != opencv_core.CV_64F) {
			mat2 = new Mat();
			mat.convertTo(mat2, opencv_core.CV_64F);
		} else
			mat2 = ensureContinuous(mat, false);
		
		DoubleIndexer idx = mat2.createIndexer();
		idx.get(0L, pixels);
		idx.release();
		
		if (mat2 != mat)
			mat2.close();
		return pixels;
	}
	
	/**
	 * Return the total number of pixels in an image, counting each channel separately.
	 * @param mat
	 * @return
	 */
	static long totalPixels(Mat mat) {
		int nChannels = mat.channels();
		if (nChannels > 0)
			return mat.total() * nChannels;
		return mat.total();
	}
	
	/**
	 * Apply an operation to the pixels of an image.
	 * <p>
	 * No type conversion is applied; it is recommended to use floating point images, or otherwise check 
	 * that clipping, rounding and non-finite values are handled as expected.
	 * 
	 * @param mat image
	 * @param operator operator to apply to pixels of the image, in-place
	 */
	public static void apply(Mat mat, DoubleUnaryOperator operator) {
		Indexer indexer = mat.createIndexer();
		long[] sizes = indexer.sizes();
		long total = 1;
		for (long dim : sizes)
			total *= dim;
		var indexer2 = indexer.reindex(Index.create(total));
		long[] inds = new long[1];
		for (long i = 0; i < total; i++) {
			inds[0] = i;
			double val = indexer2.getDouble(inds);
			val = operator.applyAsDouble(val);
			indexer2.putDouble(inds, val);
		}
		indexer2.close();
		indexer.close();
	}
	
	/**
	 * Fill the pixels of an image with a specific value.
	 * @param mat input image
	 * @param value fill value
	 */
	public static void fill(Mat mat, double value) {
		mat.put(Scalar.all(value));
	}
	
	/**
	 * Get the mean of all pixels in an image, ignoring NaNs.
	 * @param mat
	 * @return
	 */
	public static double mean(Mat mat) {
		return Arrays.stream(extractDoubles(mat)).filter(d -> !Double.isNaN(d)).average().orElse(Double.NaN);
	}
	
	/**
	 * Get the minimum of all pixels in an image, ignoring NaNs.
	 * @param mat
	 * @return
	 */
	public static double minimum(Mat mat) {
		return Arrays.stream(extractDoubles(mat)).filter(d -> !Double.isNaN(d)).min().orElse(Double.NaN);
	}
	
	/**
	 * Get the maximum of all pixels in an image, ignoring NaNs.
	 * @param mat
	 * @return
	 */
	public static double maximum(Mat mat) {
		return Arrays.stream(extractDoubles(mat)).filter(d -> !Double.isNaN(d)).max().orElse(Double.NaN);
	}
	
	/**
	 * Circularly shift the rows and columns of an image.
	 * Element {@code (y, x)} of the input ends up at {@code ((y + shiftRows) mod rows, (x + shiftCols) mod cols)}.
	 * All channels are shifted together.
	 * 
	 * @param mat input image, unchanged
	 * @param shiftRows vertical shift, may be negative
	 * @param shiftCols horizontal shift, may be negative
	 * @return a new Mat
	 */
	public static Mat roll(Mat mat, int shiftRows, int shiftCols) {
		int rows = mat.rows();
		int cols = mat.cols();
		int sy = Math.floorMod(shiftRows, rows);
		int sx = Math.floorMod(shiftCols, cols);
		var dest = new Mat(rows, cols, mat.type());
		// Each block is {source start, length, destination start}
		int[][] rowBlocks = {{0, rows - sy, sy}, {rows - sy, sy, 0}};
		int[][] colBlocks = {{0, cols - sx, sx}, {cols - sx, sx, 0}};
		for (int[] rb : rowBlocks) {
			if (rb[1] == 0)
				continue;
			for (int[] cb : colBlocks) {
				if (cb[1] == 0)
					continue;
				var src = mat.apply(new Rect(cb[0], rb[0], cb[1], rb[1]));
				var dst = dest.apply(new Rect(cb[2], rb[2], cb[1], rb[1]));
				src.copyTo(dst);
				src.close();
				dst.close();
			}
		}
		return dest;
	}
	
	/**
	 * Move the zero-frequency element of a spectrum from {@code (0, 0)} to {@code (rows/2, cols/2)}.
	 * Valid for both odd and even sizes.
	 * @param mat
	 * @return a new Mat
	 * @see #ifftShift(Mat)
	 */
	public static Mat fftShift(Mat mat) {
		return roll(mat, mat.rows() / 2, mat.cols() / 2);
	}
	
	/**
	 * Inverse of {@link #fftShift(Mat)}.
	 * @param mat
	 * @return a new Mat
	 */
	public static Mat ifftShift(Mat mat) {
		return roll(mat, -(mat.rows() / 2), -(mat.cols() / 2));
	}
	
	/**
	 * Apply a 2D filter to an image, in-place.
	 * @param mat input image
	 * @param kernel filter kernel
	 * @param borderType OpenCV border type for boundary padding
	 */
	public static void filter2D(Mat mat, Mat kernel, int borderType) {
		opencv_imgproc.filter2D(mat, mat, -1, kernel, null, 0, borderType);
	}
	
	/**
	 * Apply a 2D filter to an image with the default border, in-place.
	 * @param mat input image
	 * @param kernel filter kernel
	 */
	public static void filter2D(Mat mat, Mat kernel) {
		filter2D(mat, kernel, DEFAULT_BORDER_TYPE);
	}
	
	/**
	 * Create a single-channel {@code CV_64F} Mat from rows of values.
	 * @param rows
	 * @return
	 */
	public static Mat doubleMat(double[][] rows) {
		int h = rows.length;
		int w = h == 0 ? 0 : rows[0].length;
		var mat = new Mat(h, w, opencv_core.CV_64FC1);
		double[] flat = new double[h * w];
		for (int y = 0; y < h; y++) {
			if (rows[y].length != w)
				throw new InvalidParameterException("Row " + y + " has length " + rows[y].length + ", expected " + w);
			System.arraycopy(rows[y], 0, flat, y * w, w);
		}
		putPixelsDouble(mat, flat);
		logger.trace("Created {}x{} matrix", h, w);
		return mat;
	}

}
