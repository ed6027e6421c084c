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

import org.bytedeco.javacpp.PointerScope;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Size;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import graylab.lib.images.FloatImage;
import graylab.lib.images.GrayImage;
import graylab.opencv.tools.OpenCVTools;

/**
 * Static methods to build Gaussian and Laplacian pyramids, and reconstruct images from them.
 * <p>
 * Downsampling uses OpenCV's {@code pyrDown} (5x5 Gaussian then decimation by 2), giving levels of 
 * size {@code (n + 1) / 2}. Upsampling always targets the exact size of the finer level, so odd 
 * dimensions are handled. Residuals are computed and summed in 32-bit float, and only the final 
 * reconstruction is rounded back to 8-bit.
 */
public class PyramidEngine {
	
	private final static Logger logger = LoggerFactory.getLogger(PyramidEngine.class);
	
	/**
	 * Default number of pyramid levels.
	 */
	public static final int DEFAULT_LEVELS = 4;
	
	// Suppressed default constructor for non-instantiability
	private PyramidEngine() {
		throw new AssertionError();
	}
	
	/**
	 * Build a Gaussian pyramid.
	 * <p>
	 * The level count is clamped by {@link PyramidLevels#computeLevels(int, int, int)}, and 
	 * construction stops early if the next level's smaller dimension would fall below 
	 * {@link PyramidLevels#MIN_LEVEL_SIZE}.
	 * 
	 * @param image the full-resolution image, used unchanged as level 0
	 * @param requestedLevels requested number of levels, at least 1
	 * @return
	 */
	public static GaussianPyramid buildGaussianPyramid(GrayImage image, int requestedLevels) {
		Objects.requireNonNull(image, "Image must not be null");
		int levels = PyramidLevels.computeLevels(image.getHeight(), image.getWidth(), requestedLevels);
		try (var scope = new PointerScope()) {
			var mats = buildGaussianMats(OpenCVTools.grayToMat(image), levels);
			var output = new ArrayList<GrayImage>(mats.size());
			output.add(image);
			for (int i = 1; i < mats.size(); i++)
				output.add(OpenCVTools.matToGray(mats.get(i)));
			return new GaussianPyramid(output);
		}
	}
	
	/**
	 * Build a Gaussian pyramid of a floating point image, such as a blend mask.
	 * The same level rules apply as for {@link #buildGaussianPyramid(GrayImage, int)}, so images of 
	 * the same size always give pyramids of the same length.
	 * 
	 * @param image
	 * @param requestedLevels
	 * @return
	 */
	public static List<FloatImage> buildGaussianPyramid(FloatImage image, int requestedLevels) {
		Objects.requireNonNull(image, "Image must not be null");
		int levels = PyramidLevels.computeLevels(image.getHeight(), image.getWidth(), requestedLevels);
		try (var scope = new PointerScope()) {
			var mats = buildGaussianMats(OpenCVTools.floatToMat(image), levels);
			var output = new ArrayList<FloatImage>(mats.size());
			output.add(image);
			for (int i = 1; i < mats.size(); i++)
				output.add(OpenCVTools.matToFloat(mats.get(i)));
			return List.copyOf(output);
		}
	}
	
	private static List<Mat> buildGaussianMats(Mat mat, int levels) {
		var mats = new ArrayList<Mat>(levels);
		mats.add(mat);
		while (mats.size() < levels) {
			var current = mats.get(mats.size() - 1);
			if (!PyramidLevels.canDownsample(current.rows(), current.cols())) {
				logger.debug("Stopping at {} levels, next level would be smaller than {} pixels", 
						mats.size(), PyramidLevels.MIN_LEVEL_SIZE);
				break;
			}
			var next = new Mat();
			opencv_imgproc.pyrDown(current, next);
			mats.add(next);
		}
		return mats;
	}
	
	/**
	 * Build a Laplacian pyramid from a Gaussian pyramid.
	 * @param gaussian
	 * @return a pyramid with the same number of levels
	 */
	public static LaplacianPyramid buildLaplacianPyramid(GaussianPyramid gaussian) {
		Objects.requireNonNull(gaussian, "Gaussian pyramid must not be null");
		int n = gaussian.size();
		try (var scope = new PointerScope()) {
			var levels = new ArrayList<FloatImage>(n);
			for (int i = 0; i < n - 1; i++) {
				var current = OpenCVTools.grayToMat(gaussian.getLevel(i), opencv_core.CV_32F);
				var coarser = OpenCVTools.grayToMat(gaussian.getLevel(i+1), opencv_core.CV_32F);
				var upsampled = upsample(coarser, current.rows(), current.cols());
				var residual = new Mat();
				opencv_core.subtract(current, upsampled, residual);
				levels.add(OpenCVTools.matToFloat(residual));
			}
			levels.add(FloatImage.fromGray(gaussian.getLevel(n - 1)));
			return new LaplacianPyramid(levels);
		}
	}
	
	/**
	 * Build a Gaussian pyramid and then its Laplacian pyramid.
	 * @param image
	 * @param requestedLevels
	 * @return
	 */
	public static LaplacianPyramid buildLaplacianPyramid(GrayImage image, int requestedLevels) {
		return buildLaplacianPyramid(buildGaussianPyramid(image, requestedLevels));
	}
	
	/**
	 * Reconstruct an image from a Laplacian pyramid.
	 * <p>
	 * Starting from the coarsest level, the running result is upsampled to the size of the next 
	 * finer level and that level's residual is added. The result is rounded and clipped to 8-bit.
	 * 
	 * @param laplacian
	 * @return an image with the dimensions of level 0
	 */
	public static GrayImage reconstruct(LaplacianPyramid laplacian) {
		Objects.requireNonNull(laplacian, "Laplacian pyramid must not be null");
		int n = laplacian.size();
		try (var scope = new PointerScope()) {
			var current = OpenCVTools.floatToMat(laplacian.getLevel(n - 1));
			for (int i = n - 2; i >= 0; i--) {
				var residual = OpenCVTools.floatToMat(laplacian.getLevel(i));
				var upsampled = upsample(current, residual.rows(), residual.cols());
				var sum = new Mat();
				opencv_core.add(upsampled, residual, sum);
				current = sum;
			}
			return OpenCVTools.matToGray(current);
		}
	}
	
	/**
	 * Upsample with an explicit target size, required for levels with odd dimensions.
	 */
	static Mat upsample(Mat mat, int rows, int cols) {
		var output = new Mat();
		opencv_imgproc.pyrUp(mat, output, new Size(cols, rows), opencv_core.BORDER_DEFAULT);
		return output;
	}

}
