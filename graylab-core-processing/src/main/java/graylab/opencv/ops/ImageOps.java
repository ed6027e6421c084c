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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.function.DoubleUnaryOperator;

import org.bytedeco.javacpp.PointerScope;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Size;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Splitter;

import graylab.lib.common.GeneralTools;
import graylab.lib.common.InvalidParameterException;
import graylab.lib.images.GrayImage;
import graylab.opencv.tools.OpenCVTools;

/**
 * Create and apply pixel and neighborhood operations on 8-bit images.
 * <p>
 * Ops are grouped by category: {@link Core}, {@link Intensity}, {@link Filters} and {@link Noise}.
 * Each op accepts a single-channel Mat and returns a {@code CV_8U} Mat.
 */
public class ImageOps {
	
	private final static Logger logger = LoggerFactory.getLogger(ImageOps.class);
	
	// Suppressed default constructor for non-instantiability
	private ImageOps() {
		throw new AssertionError();
	}
	
	/**
	 * Apply an op to an image.
	 * @param op
	 * @param image
	 * @return a new image; non-8-bit results are rounded and clipped
	 */
	public static GrayImage apply(ImageOp op, GrayImage image) {
		Objects.requireNonNull(op, "Op must not be null");
		Objects.requireNonNull(image, "Image must not be null");
		try (var scope = new PointerScope()) {
			var mat = OpenCVTools.grayToMat(image);
			return OpenCVTools.matToGray(op.apply(mat));
		}
	}
	
	static Mat ensure8U(Mat mat) {
		if (mat.depth() != opencv_core.CV_8U)
			mat.convertTo(mat, opencv_core.CV_8U);
		return mat;
	}
	
	
	/**
	 * Core operations.
	 */
	public static class Core {
		
		/**
		 * Apply a collection of ops sequentially, chaining the output of one op as the input for the next.
		 * @param ops
		 * @return an op that represents the result of chaining the other ops together
		 */
		public static ImageOp sequential(Collection<? extends ImageOp> ops) {
			if (ops.size() == 1)
				return ops.iterator().next();
			return new SequentialMultiOp(ops);
		}
		
		/**
		 * Apply an array of ops sequentially, chaining the output of one op as the input for the next.
		 * @param ops
		 * @return an op that represents the result of chaining the other ops together
		 */
		public static ImageOp sequential(ImageOp...ops) {
			return sequential(Arrays.asList(ops));
		}
		
		static class SequentialMultiOp implements ImageOp {
			
			private final List<ImageOp> ops;
			
			SequentialMultiOp(Collection<? extends ImageOp> ops) {
				this.ops = new ArrayList<>(ops);
			}

			@Override
			public Mat apply(Mat input) {
				for (var t : ops)
					input = t.apply(input);
				return input;
			}
			
		}
		
	}
	
	
	/**
	 * Point operations on intensities.
	 */
	public static class Intensity {
		
		/**
		 * Add a constant to every pixel, clipping to 0-255.
		 * @param value
		 * @return
		 */
		public static ImageOp brightness(double value) {
			if (!Double.isFinite(value))
				throw new InvalidParameterException("Brightness offset must be finite, but was " + value);
			return new LookupOp(v -> GeneralTools.clipValue(v + value, 0, 255));
		}
		
		/**
		 * Stretch intensities between the image minimum and maximum: 
		 * {@code ((p - min) * factor / (max - min)) * 255}, clipped and truncated to 8-bit.
		 * <p>
		 * A constant image is returned unchanged.
		 * @param factor
		 * @return
		 */
		public static ImageOp contrastStretch(double factor) {
			if (!Double.isFinite(factor))
				throw new InvalidParameterException("Contrast factor must be finite, but was " + factor);
			return new ContrastStretchOp(factor);
		}
		
		/**
		 * Gamma correction: {@code floor((p / 255)^gamma * 255)}.
		 * @param gamma a finite value &gt; 0
		 * @return
		 */
		public static ImageOp gamma(double gamma) {
			if (!Double.isFinite(gamma) || gamma <= 0)
				throw new InvalidParameterException("Gamma must be a finite value > 0, but was " + gamma);
			return new LookupOp(v -> GeneralTools.clipValue(Math.pow(v / 255.0, gamma) * 255.0, 0, 255));
		}
		
		/**
		 * Histogram equalization.
		 * @return
		 */
		public static ImageOp equalizeHistogram() {
			return new EqualizeHistogramOp();
		}
		
		/**
		 * Apply a function to each of the 256 possible intensities, using a lookup table.
		 * Function values are truncated to integers and must already lie in the range 0-255.
		 */
		static class LookupOp implements ImageOp {
			
			private final DoubleUnaryOperator fun;
			
			LookupOp(DoubleUnaryOperator fun) {
				this.fun = fun;
			}

			@Override
			public Mat apply(Mat input) {
				ensure8U(input);
				int[] table = new int[256];
				for (int i = 0; i < table.length; i++)
					table[i] = (int)Math.floor(fun.applyAsDouble(i));
				var lut = new Mat(1, 256, opencv_core.CV_8UC1);
				OpenCVTools.putPixelsUnsigned(lut, table);
				opencv_core.LUT(input, lut, input);
				lut.close();
				return input;
			}
			
		}
		
		static class ContrastStretchOp implements ImageOp {
			
			private final double factor;
			
			ContrastStretchOp(double factor) {
				this.factor = factor;
			}

			@Override
			public Mat apply(Mat input) {
				ensure8U(input);
				double min = OpenCVTools.minimum(input);
				double max = OpenCVTools.maximum(input);
				if (max == min) {
					logger.warn("Cannot stretch contrast of a constant image (value {}), returning input unchanged", min);
					return input;
				}
				double range = max - min;
				return new LookupOp(v -> GeneralTools.clipValue((v - min) * factor / range * 255.0, 0, 255)).apply(input);
			}
			
		}
		
		static class EqualizeHistogramOp implements ImageOp {

			@Override
			public Mat apply(Mat input) {
				ensure8U(input);
				opencv_imgproc.equalizeHist(input, input);
				return input;
			}
			
		}
		
	}
	
	
	/**
	 * Filtering operations.
	 */
	public static class Filters {
		
		/**
		 * Apply a 3x3 minimum filter (erosion).
		 * @return
		 */
		public static ImageOp minimum() {
			return new MinimumFilterOp();
		}
		
		/**
		 * Apply a 3x3 maximum filter (dilation).
		 * @return
		 */
		public static ImageOp maximum() {
			return new MaximumFilterOp();
		}
		
		/**
		 * Apply a 3x3 rank filter.
		 * @param type
		 * @return
		 */
		public static ImageOp morphology(MorphologyType type) {
			Objects.requireNonNull(type, "Filter type must not be null");
			return switch (type) {
				case MIN -> minimum();
				case MAX -> maximum();
			};
		}
		
		/**
		 * Parse a comma-separated list of filters, e.g. {@code "min,max,min"}, and apply them in order.
		 * @param sequence
		 * @return
		 * @throws InvalidParameterException if the sequence is empty or contains an unknown filter
		 */
		public static ImageOp sequence(String sequence) throws InvalidParameterException {
			return sequence(parseSequence(sequence));
		}
		
		/**
		 * Apply a list of 3x3 rank filters in order.
		 * @param types
		 * @return
		 */
		public static ImageOp sequence(List<MorphologyType> types) {
			if (types.isEmpty())
				throw new InvalidParameterException("Filter sequence must not be empty");
			return Core.sequential(types.stream().map(Filters::morphology).toList());
		}
		
		/**
		 * Parse a comma-separated list of filters.
		 * @param sequence
		 * @return
		 * @throws InvalidParameterException if the sequence is empty or contains an unknown filter
		 */
		public static List<MorphologyType> parseSequence(String sequence) throws InvalidParameterException {
			Objects.requireNonNull(sequence, "Filter sequence must not be null");
			var types = Splitter.on(',')
					.trimResults()
					.omitEmptyStrings()
					.splitToStream(sequence)
					.map(MorphologyType::fromString)
					.toList();
			if (types.isEmpty())
				throw new InvalidParameterException("Filter sequence must not be empty");
			return types;
		}
		
		/**
		 * Apply a median filter.
		 * @param kernelSize filter size; even values are increased by one
		 * @return
		 */
		public static ImageOp median(int kernelSize) {
			return new MedianFilterOp(GeneralTools.ensureOdd(kernelSize));
		}
		
		/**
		 * Apply an edge-preserving bilateral filter.
		 * @param diameter neighborhood diameter; if &lt;= 0 it is computed from sigmaSpace
		 * @param sigmaColor filter sigma in the intensity space
		 * @param sigmaSpace filter sigma in the coordinate space
		 * @return
		 */
		public static ImageOp bilateral(int diameter, double sigmaColor, double sigmaSpace) {
			if (!(sigmaColor > 0) || !(sigmaSpace > 0))
				throw new InvalidParameterException("Bilateral sigmas must be > 0, but were " + sigmaColor + " and " + sigmaSpace);
			return new BilateralFilterOp(diameter, sigmaColor, sigmaSpace);
		}
		
		/**
		 * Detect edges with the Canny algorithm, after Gaussian smoothing.
		 * The smoothing kernel size is {@code 2 * round(3 * sigma) + 1}.
		 * @param lowThreshold
		 * @param highThreshold
		 * @param sigma Gaussian sigma, &gt;= 0
		 * @return binary edge image (0 or 255)
		 */
		public static ImageOp canny(double lowThreshold, double highThreshold, double sigma) {
			if (!Double.isFinite(sigma) || sigma < 0)
				throw new InvalidParameterException("Canny sigma must be a finite value >= 0, but was " + sigma);
			if (lowThreshold < 0 || highThreshold < 0)
				throw new InvalidParameterException("Canny thresholds must be >= 0");
			return new CannyOp(lowThreshold, highThreshold, sigma);
		}
		
		/**
		 * Convolve with a square kernel.
		 * @param kernel kernel values, e.g. from {@link ConvolutionMasks}
		 * @param add128 if true, add 128 to the filtered values before clipping
		 * @return
		 */
		public static ImageOp convolve(double[][] kernel, boolean add128) {
			Objects.requireNonNull(kernel, "Kernel must not be null");
			return new ConvolutionOp(kernel, add128);
		}
		
		/**
		 * Convolve with a predefined mask.
		 * @param type
		 * @param kernelSize
		 * @param add128
		 * @return
		 */
		public static ImageOp convolve(ConvolutionMasks.MaskType type, int kernelSize, boolean add128) {
			return convolve(ConvolutionMasks.createMask(type, kernelSize), add128);
		}
		
		static Mat createSquareKernel() {
			return opencv_imgproc.getStructuringElement(opencv_imgproc.MORPH_RECT, new Size(3, 3));
		}
		
		static abstract class MorphOp implements ImageOp {
			
			@Override
			public Mat apply(Mat input) {
				ensure8U(input);
				var kernel = createSquareKernel();
				opencv_imgproc.morphologyEx(input, input, getOp(), kernel);
				kernel.close();
				return input;
			}
			
			protected abstract int getOp();
			
		}
		
		static class MinimumFilterOp extends MorphOp {

			@Override
			protected int getOp() {
				return opencv_imgproc.MORPH_ERODE;
			}
			
		}
		
		static class MaximumFilterOp extends MorphOp {

			@Override
			protected int getOp() {
				return opencv_imgproc.MORPH_DILATE;
			}
			
		}
		
		static class MedianFilterOp implements ImageOp {
			
			private final int kernelSize;
			
			MedianFilterOp(int kernelSize) {
				this.kernelSize = kernelSize;
			}

			@Override
			public Mat apply(Mat input) {
				ensure8U(input);
				opencv_imgproc.medianBlur(input, input, kernelSize);
				return input;
			}
			
		}
		
		static class BilateralFilterOp implements ImageOp {
			
			private final int diameter;
			private final double sigmaColor;
			private final double sigmaSpace;
			
			BilateralFilterOp(int diameter, double sigmaColor, double sigmaSpace) {
				this.diameter = diameter;
				this.sigmaColor = sigmaColor;
				this.sigmaSpace = sigmaSpace;
			}

			@Override
			public Mat apply(Mat input) {
				ensure8U(input);
				// Not in-place
				var output = new Mat();
				opencv_imgproc.bilateralFilter(input, output, diameter, sigmaColor, sigmaSpace);
				return output;
			}
			
		}
		
		static class CannyOp implements ImageOp {
			
			private final double lowThreshold;
			private final double highThreshold;
			private final double sigma;
			
			CannyOp(double lowThreshold, double highThreshold, double sigma) {
				this.lowThreshold = lowThreshold;
				this.highThreshold = highThreshold;
				this.sigma = sigma;
			}

			@Override
			public Mat apply(Mat input) {
				int kernelSize = (int)(2 * Math.round(3 * sigma) + 1);
				var blurred = new Mat();
				input.convertTo(blurred, opencv_core.CV_32F);
				if (kernelSize > 1)
					opencv_imgproc.GaussianBlur(blurred, blurred, new Size(kernelSize, kernelSize), sigma);
				blurred.convertTo(blurred, opencv_core.CV_8U);
				var edges = new Mat();
				opencv_imgproc.Canny(blurred, edges, lowThreshold, highThreshold);
				blurred.close();
				return edges;
			}
			
		}
		
		static class ConvolutionOp implements ImageOp {
			
			private final double[][] kernel;
			private final boolean add128;
			
			ConvolutionOp(double[][] kernel, boolean add128) {
				this.kernel = ConvolutionMasks.customMask(kernel, kernel.length);
				this.add128 = add128;
			}

			@Override
			public Mat apply(Mat input) {
				input.convertTo(input, opencv_core.CV_32F);
				var matKernel = ConvolutionMasks.toMat(kernel);
				OpenCVTools.filter2D(input, matKernel);
				matKernel.close();
				if (add128)
					input.convertTo(input, opencv_core.CV_8U, 1.0, 128.0);
				else
					input.convertTo(input, opencv_core.CV_8U);
				return input;
			}
			
		}
		
	}
	
	
	/**
	 * Synthetic noise.
	 * <p>
	 * Each op draws from its own {@link Random} created from a fixed seed, so applying the same op 
	 * to the same image always gives the same result.
	 */
	public static class Noise {
		
		/**
		 * Add noise with a random seed.
		 * @param type
		 * @param intensity probability of a pixel being replaced for {@link NoiseType#SALT_PEPPER}, 
		 *                  or standard deviation for {@link NoiseType#GAUSSIAN}
		 * @return
		 */
		public static ImageOp noise(NoiseType type, double intensity) {
			return noise(type, intensity, new Random().nextLong());
		}
		
		/**
		 * Add noise with a fixed seed.
		 * @param type
		 * @param intensity probability of a pixel being replaced for {@link NoiseType#SALT_PEPPER}, 
		 *                  or standard deviation for {@link NoiseType#GAUSSIAN}
		 * @param seed
		 * @return
		 */
		public static ImageOp noise(NoiseType type, double intensity, long seed) {
			Objects.requireNonNull(type, "Noise type must not be null");
			return switch (type) {
				case SALT_PEPPER -> saltAndPepper(intensity, seed);
				case GAUSSIAN -> gaussian(intensity, seed);
			};
		}
		
		/**
		 * Set each pixel with probability {@code probability} to either 0 or 255.
		 * @param probability in the range 0-1
		 * @param seed
		 * @return
		 */
		public static ImageOp saltAndPepper(double probability, long seed) {
			if (!(probability >= 0 && probability <= 1))
				throw new InvalidParameterException("Salt and pepper probability must be between 0 and 1, but was " + probability);
			return new SaltPepperNoiseOp(probability, seed);
		}
		
		/**
		 * Add zero-mean Gaussian noise, clipping and truncating to 8-bit.
		 * @param stdDev standard deviation, &gt;= 0
		 * @param seed
		 * @return
		 */
		public static ImageOp gaussian(double stdDev, long seed) {
			if (!Double.isFinite(stdDev) || stdDev < 0)
				throw new InvalidParameterException("Noise standard deviation must be a finite value >= 0, but was " + stdDev);
			return new GaussianNoiseOp(stdDev, seed);
		}
		
		static class SaltPepperNoiseOp implements ImageOp {
			
			private final double probability;
			private final long seed;
			
			SaltPepperNoiseOp(double probability, long seed) {
				this.probability = probability;
				this.seed = seed;
			}

			@Override
			public Mat apply(Mat input) {
				ensure8U(input);
				var rng = new Random(seed);
				OpenCVTools.apply(input, v -> rng.nextDouble() < probability ? (rng.nextBoolean() ? 255 : 0) : v);
				return input;
			}
			
		}
		
		static class GaussianNoiseOp implements ImageOp {
			
			private final double stdDev;
			private final long seed;
			
			GaussianNoiseOp(double stdDev, long seed) {
				this.stdDev = stdDev;
				this.seed = seed;
			}

			@Override
			public Mat apply(Mat input) {
				ensure8U(input);
				var rng = new Random(seed);
				OpenCVTools.apply(input, v -> Math.floor(GeneralTools.clipValue(v + rng.nextGaussian() * stdDev, 0, 255)));
				return input;
			}
			
		}
		
	}

}
