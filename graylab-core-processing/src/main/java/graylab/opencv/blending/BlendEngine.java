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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import graylab.lib.common.InvalidParameterException;
import graylab.lib.images.FloatImage;
import graylab.lib.images.GrayImage;
import graylab.lib.images.SimpleImage;
import graylab.opencv.pyramids.LaplacianPyramid;
import graylab.opencv.pyramids.PyramidEngine;
import graylab.opencv.pyramids.PyramidLevels;

/**
 * Static methods for multi-band blending of two images of the same size.
 * <p>
 * Both images are decomposed into Laplacian pyramids, the blend mask into a Gaussian pyramid with 
 * the same number of levels, and each level is combined as {@code l1 * m + l2 * (1 - m)} before 
 * reconstruction.
 */
public class BlendEngine {
	
	private final static Logger logger = LoggerFactory.getLogger(BlendEngine.class);
	
	/**
	 * Standard deviation of the smooth mask, in pixels.
	 */
	public static final double DEFAULT_SIGMA = 100.0;
	
	/**
	 * Default blend position, as a proportion of the image width.
	 */
	public static final double DEFAULT_POSITION = 0.5;
	
	// Suppressed default constructor for non-instantiability
	private BlendEngine() {
		throw new AssertionError();
	}
	
	/**
	 * Create a blend mask with values in [0, 1].
	 * <ul>
	 * <li>{@link BlendMaskType#SMOOTH}: {@code exp(-((x - cx)^2 + (y - cy)^2) / (2 sigma^2))} with 
	 * {@code cx = cols * position}, {@code cy = rows / 2} (integer division) and sigma {@link #DEFAULT_SIGMA}</li>
	 * <li>{@link BlendMaskType#SPLIT}: 1 for columns {@code x < cols * position}, 0 elsewhere</li>
	 * </ul>
	 * @param rows
	 * @param cols
	 * @param type
	 * @param position proportion of the width, in [0, 1]
	 * @return
	 */
	public static FloatImage createBlendMask(int rows, int cols, BlendMaskType type, double position) {
		Objects.requireNonNull(type, "Blend mask type must not be null");
		checkPosition(position);
		if (rows < 1 || cols < 1)
			throw new InvalidParameterException("Mask dimensions must be positive, but were " + cols + " x " + rows);
		double cx = cols * position;
		float[] mask = new float[rows * cols];
		switch (type) {
			case SMOOTH -> {
				int cy = rows / 2;
				double denom = 2 * DEFAULT_SIGMA * DEFAULT_SIGMA;
				for (int y = 0; y < rows; y++) {
					double dy = y - cy;
					for (int x = 0; x < cols; x++) {
						double dx = x - cx;
						mask[y * cols + x] = (float)Math.exp(-(dx * dx + dy * dy) / denom);
					}
				}
			}
			case SPLIT -> {
				for (int y = 0; y < rows; y++) {
					for (int x = 0; x < cols && x < cx; x++)
						mask[y * cols + x] = 1f;
				}
			}
		}
		return FloatImage.create(mask, cols, rows);
	}
	
	/**
	 * Blend two images using a multi-band pyramid.
	 * @param image1 image weighted by the mask
	 * @param image2 image weighted by one minus the mask
	 * @param levels requested number of pyramid levels; clamped according to the image size
	 * @param position blend position as a proportion of the width, in [0, 1]
	 * @param type mask type
	 * @return
	 * @throws graylab.lib.common.DimensionMismatchException if the images differ in size
	 * @throws InvalidParameterException if the position or level count is invalid
	 */
	public static BlendResult blend(GrayImage image1, GrayImage image2, int levels, double position, BlendMaskType type) {
		Objects.requireNonNull(image1, "First image must not be null");
		Objects.requireNonNull(image2, "Second image must not be null");
		Objects.requireNonNull(type, "Blend mask type must not be null");
		SimpleImage.requireSameSize(image1, image2);
		checkPosition(position);
		
		int rows = image1.getHeight();
		int cols = image1.getWidth();
		int nLevels = PyramidLevels.computeLevels(rows, cols, levels);
		
		var lap1 = PyramidEngine.buildLaplacianPyramid(image1, nLevels);
		var lap2 = PyramidEngine.buildLaplacianPyramid(image2, nLevels);
		var maskPyramid = PyramidEngine.buildGaussianPyramid(createBlendMask(rows, cols, type, position), nLevels);
		if (maskPyramid.size() != lap1.size())
			throw new IllegalStateException("Mask pyramid has " + maskPyramid.size() + " levels, but image pyramid has " + lap1.size());
		logger.debug("Blending {} x {} images with {} levels, {} mask at {}", cols, rows, lap1.size(), type, position);
		
		var blendedLevels = new ArrayList<FloatImage>(lap1.size());
		for (int i = 0; i < lap1.size(); i++)
			blendedLevels.add(blendLevel(lap1.getLevel(i), lap2.getLevel(i), maskPyramid.get(i)));
		var blended = new LaplacianPyramid(blendedLevels);
		
		return new BlendResult(
				lap1.toDisplay(),
				lap2.toDisplay(),
				maskPyramid,
				blended.toDisplay(),
				blended,
				PyramidEngine.reconstruct(blended));
	}
	
	/**
	 * Blend two images with a named mask type.
	 * @param image1
	 * @param image2
	 * @param levels
	 * @param position
	 * @param typeName "smooth", "full", "split" or "half"
	 * @return
	 * @see #blend(GrayImage, GrayImage, int, double, BlendMaskType)
	 */
	public static BlendResult blend(GrayImage image1, GrayImage image2, int levels, double position, String typeName) {
		return blend(image1, image2, levels, position, BlendMaskType.fromString(typeName));
	}
	
	static FloatImage blendLevel(FloatImage level1, FloatImage level2, FloatImage mask) {
		float[] p1 = level1.getPixels();
		float[] p2 = level2.getPixels();
		float[] m = mask.getPixels();
		float[] output = new float[p1.length];
		for (int i = 0; i < output.length; i++)
			output[i] = p1[i] * m[i] + p2[i] * (1f - m[i]);
		return FloatImage.create(output, level1.getWidth(), level1.getHeight());
	}
	
	private static void checkPosition(double position) {
		if (!(position >= 0 && position <= 1))
			throw new InvalidParameterException("Blend position must be between 0 and 1, but was " + position);
	}

}
