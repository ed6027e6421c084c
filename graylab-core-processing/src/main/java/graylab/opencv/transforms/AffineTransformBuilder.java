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

package graylab.opencv.transforms;

import java.util.Objects;

import org.bytedeco.javacpp.PointerScope;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Scalar;
import org.bytedeco.opencv.opencv_core.Size;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import graylab.lib.geom.TransformMatrix;
import graylab.lib.images.GrayImage;
import graylab.opencv.tools.OpenCVTools;

/**
 * Static methods to build affine transform matrices and warp images through them.
 * <p>
 * Every centered transform is composed as {@code translate(center) * primitive * translate(-center)}.
 * Rotation uses the primitive {@code [[cos, sin, 0], [-sin, cos, 0], [0, 0, 1]]}; because image 
 * y coordinates grow downwards, a positive angle turns the image content counter-clockwise as 
 * displayed.
 * <p>
 * Warping uses bilinear interpolation for all transform kinds, and fills pixels that map 
 * outside the input with 0.
 */
public class AffineTransformBuilder {
	
	private final static Logger logger = LoggerFactory.getLogger(AffineTransformBuilder.class);
	
	// Suppressed default constructor for non-instantiability
	private AffineTransformBuilder() {
		throw new AssertionError();
	}
	
	/**
	 * Rotation about a center point.
	 * @param angleDegrees
	 * @param cx
	 * @param cy
	 * @return
	 */
	public static TransformMatrix rotation(double angleDegrees, double cx, double cy) {
		double theta = Math.toRadians(angleDegrees);
		double cos = Math.cos(theta);
		double sin = Math.sin(theta);
		var primitive = TransformMatrix.of(
				cos, sin, 0,
				-sin, cos, 0);
		return TransformMatrix.aboutCenter(primitive, cx, cy);
	}
	
	/**
	 * Translation. This is not centered.
	 * @param tx
	 * @param ty
	 * @return
	 */
	public static TransformMatrix translation(double tx, double ty) {
		return TransformMatrix.translation(tx, ty);
	}
	
	/**
	 * Scaling about a center point.
	 * @param scaleX
	 * @param scaleY
	 * @param cx
	 * @param cy
	 * @return
	 */
	public static TransformMatrix scaling(double scaleX, double scaleY, double cx, double cy) {
		var primitive = TransformMatrix.of(
				scaleX, 0, 0,
				0, scaleY, 0);
		return TransformMatrix.aboutCenter(primitive, cx, cy);
	}
	
	/**
	 * Shear about a center point.
	 * @param shearX
	 * @param shearY
	 * @param cx
	 * @param cy
	 * @return
	 */
	public static TransformMatrix shear(double shearX, double shearY, double cx, double cy) {
		var primitive = TransformMatrix.of(
				1, shearX, 0,
				shearY, 1, 0);
		return TransformMatrix.aboutCenter(primitive, cx, cy);
	}
	
	/**
	 * Create the matrix for a transform kind about an explicit center.
	 * @param type
	 * @param params
	 * @param cx
	 * @param cy
	 * @return
	 */
	public static TransformMatrix createMatrix(TransformType type, TransformParameters params, double cx, double cy) {
		Objects.requireNonNull(type, "Transform type must not be null");
		Objects.requireNonNull(params, "Transform parameters must not be null");
		return switch (type) {
			case ROTATION -> rotation(params.getAngle(), cx, cy);
			case TRANSLATION -> translation(params.getTx(), params.getTy());
			case SCALING -> scaling(params.getScaleX(), params.getScaleY(), cx, cy);
			case SHEAR -> shear(params.getShearX(), params.getShearY(), cx, cy);
		};
	}
	
	/**
	 * Create the matrix for a transform kind about the default center of an image with the 
	 * specified size, i.e. {@code (width / 2, height / 2)} using integer division.
	 * @param type
	 * @param params
	 * @param width
	 * @param height
	 * @return
	 */
	public static TransformMatrix createMatrix(TransformType type, TransformParameters params, int width, int height) {
		return createMatrix(type, params, (double)(width / 2), (double)(height / 2));
	}
	
	/**
	 * Warp an image through a forward transform.
	 * <p>
	 * Each output pixel {@code (x, y)} is sampled bilinearly from the input at {@code M^-1 (x, y)}.
	 * The output has the same size as the input; samples outside the input are 0.
	 * 
	 * @param image
	 * @param matrix the forward transform
	 * @return
	 */
	public static GrayImage apply(GrayImage image, TransformMatrix matrix) {
		Objects.requireNonNull(image, "Image must not be null");
		Objects.requireNonNull(matrix, "Transform matrix must not be null");
		try (var scope = new PointerScope()) {
			var mat = OpenCVTools.grayToMat(image);
			var matTransform = new Mat(2, 3, opencv_core.CV_64FC1);
			OpenCVTools.putPixelsDouble(matTransform, matrix.toFlat2x3());
			var matOutput = new Mat();
			opencv_imgproc.warpAffine(mat, matOutput, matTransform, 
					new Size(image.getWidth(), image.getHeight()),
					opencv_imgproc.INTER_LINEAR,
					opencv_core.BORDER_CONSTANT,
					Scalar.all(0.0));
			return OpenCVTools.matToGray(matOutput);
		}
	}
	
	/**
	 * Build the matrix for a transform kind about the image center, and apply it.
	 * @param image
	 * @param type
	 * @param params
	 * @return
	 */
	public static TransformResult transform(GrayImage image, TransformType type, TransformParameters params) {
		Objects.requireNonNull(image, "Image must not be null");
		var matrix = createMatrix(type, params, image.getWidth(), image.getHeight());
		logger.trace("Applying {} with {}", type, matrix);
		return new TransformResult(apply(image, matrix), matrix);
	}
	
	/**
	 * Build the matrix for a named transform kind about the image center, and apply it.
	 * @param image
	 * @param typeName one of "rotation", "translation", "scaling" or "shear"
	 * @param params
	 * @return
	 * @throws graylab.lib.common.InvalidParameterException if the name is not recognized
	 */
	public static TransformResult transform(GrayImage image, String typeName, TransformParameters params) {
		return transform(image, TransformType.fromString(typeName), params);
	}

}
