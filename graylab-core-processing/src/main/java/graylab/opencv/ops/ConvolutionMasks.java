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

import java.util.Arrays;
import java.util.Objects;

import org.bytedeco.opencv.opencv_core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import graylab.lib.common.GeneralTools;
import graylab.lib.common.InvalidParameterException;
import graylab.opencv.tools.OpenCVTools;

/**
 * Square convolution kernels, either predefined or supplied by the caller.
 * <p>
 * Kernel sizes are normalized with {@link GeneralTools#ensureOdd(int)}: an even size is 
 * increased to the next odd value.
 */
public class ConvolutionMasks {
	
	private final static Logger logger = LoggerFactory.getLogger(ConvolutionMasks.class);
	
	/**
	 * Standard deviation of the predefined Gaussian mask.
	 */
	public static final double GAUSSIAN_SIGMA = 1.0;
	
	/**
	 * Predefined masks.
	 */
	public static enum MaskType {
		
		/**
		 * 1 at the center, 0 elsewhere.
		 */
		IDENTITY,
		
		/**
		 * 1 at the top right corner, 0 elsewhere.
		 */
		SHIFT,
		
		/**
		 * Normalized Gaussian with sigma {@link ConvolutionMasks#GAUSSIAN_SIGMA}.
		 */
		GAUSSIAN,
		
		/**
		 * 3x3 Laplacian sharpening kernel, zero-padded to the requested size.
		 */
		SHARPEN;
		
		/**
		 * Parse a mask type from its name, ignoring case.
		 * @param name
		 * @return
		 * @throws InvalidParameterException if the name is not recognized
		 */
		public static MaskType fromString(String name) {
			return GeneralTools.parseEnum(MaskType.class, name);
		}
		
	}
	
	private static final double[][] SHARPEN_3x3 = {
			{0, -1, 0},
			{-1, 5, -1},
			{0, -1, 0}
	};
	
	// Suppressed default constructor for non-instantiability
	private ConvolutionMasks() {
		throw new AssertionError();
	}
	
	/**
	 * Create a predefined mask.
	 * @param type
	 * @param kernelSize requested size; even values are increased by one
	 * @return a new {@code size x size} array
	 * @throws InvalidParameterException if the size is less than 1, or less than 3 for {@link MaskType#SHARPEN}
	 */
	public static double[][] createMask(MaskType type, int kernelSize) throws InvalidParameterException {
		Objects.requireNonNull(type, "Mask type must not be null");
		int size = GeneralTools.ensureOdd(kernelSize);
		double[][] mask = new double[size][size];
		int center = size / 2;
		switch (type) {
			case IDENTITY -> mask[center][center] = 1;
			case SHIFT -> mask[0][size - 1] = 1;
			case GAUSSIAN -> {
				double sum = 0;
				for (int y = 0; y < size; y++) {
					for (int x = 0; x < size; x++) {
						double dx = x - center;
						double dy = y - center;
						double v = Math.exp(-0.5 * (dx * dx + dy * dy) / (GAUSSIAN_SIGMA * GAUSSIAN_SIGMA));
						mask[y][x] = v;
						sum += v;
					}
				}
				for (double[] row : mask) {
					for (int x = 0; x < size; x++)
						row[x] /= sum;
				}
			}
			case SHARPEN -> {
				if (size < 3)
					throw new InvalidParameterException("Sharpen mask requires a kernel size of at least 3, but was " + size);
				int pad = (size - 3) / 2;
				for (int y = 0; y < 3; y++)
					System.arraycopy(SHARPEN_3x3[y], 0, mask[y + pad], pad, 3);
			}
		}
		logger.trace("Created {} mask with size {}", type, size);
		return mask;
	}
	
	/**
	 * Validate a mask supplied by the caller.
	 * @param values square mask values
	 * @param kernelSize requested size; even values are increased by one
	 * @return a copy of the mask
	 * @throws InvalidParameterException if the mask is not square with the normalized kernel size, 
	 *                                   or contains non-finite values
	 */
	public static double[][] customMask(double[][] values, int kernelSize) throws InvalidParameterException {
		Objects.requireNonNull(values, "Mask values must not be null");
		int size = GeneralTools.ensureOdd(kernelSize);
		if (values.length != size)
			throw new InvalidParameterException("Custom mask has " + values.length + " rows, but kernel size is " + size);
		double[][] mask = new double[size][];
		for (int y = 0; y < size; y++) {
			if (values[y] == null || values[y].length != size)
				throw new InvalidParameterException("Custom mask row " + y + " does not have length " + size);
			for (double v : values[y]) {
				if (!Double.isFinite(v))
					throw new InvalidParameterException("Custom mask contains a non-finite value: " + Arrays.toString(values[y]));
			}
			mask[y] = values[y].clone();
		}
		return mask;
	}
	
	/**
	 * Convert a mask to a {@code CV_64F} kernel.
	 * @param mask
	 * @return
	 */
	public static Mat toMat(double[][] mask) {
		return OpenCVTools.doubleMat(mask);
	}

}
