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

import java.util.Objects;

import org.bytedeco.javacpp.PointerScope;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.MatVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import graylab.lib.common.GeneralTools;
import graylab.lib.images.FloatImage;
import graylab.lib.images.GrayImage;
import graylab.opencv.tools.OpenCVTools;

/**
 * Static methods for Fourier transforms and radial frequency-domain filtering.
 * <p>
 * Transforms are computed in double precision with OpenCV's {@code dft}. Spectra are centered 
 * by a circular shift that moves the zero frequency to {@code (rows/2, cols/2)}; the shift is only 
 * applied to what is visualized or masked, and is always undone before inversion.
 */
public class FrequencyDomainFilter {
	
	private final static Logger logger = LoggerFactory.getLogger(FrequencyDomainFilter.class);
	
	// Suppressed default constructor for non-instantiability
	private FrequencyDomainFilter() {
		throw new AssertionError();
	}
	
	/**
	 * Compute the magnitude spectrum of an image, along with its inverse transform.
	 * 
	 * @param image
	 * @param centerSpectrum if true, shift the zero frequency to the center of the spectrum
	 * @param applyLog if true, display {@code log(1 + |F|)} rather than {@code |F|}
	 * @return the spectrum min-max normalized to 0-255 (all zeros if the magnitude is constant), 
	 *         and the reconstruction from the unshifted complex spectrum
	 */
	public static SpectrumResult transform(GrayImage image, boolean centerSpectrum, boolean applyLog) {
		Objects.requireNonNull(image, "Image must not be null");
		try (var scope = new PointerScope()) {
			var complex = forwardDFT(image);
			
			var magnitude = magnitude(complex);
			if (centerSpectrum)
				magnitude = OpenCVTools.fftShift(magnitude);
			if (applyLog)
				OpenCVTools.apply(magnitude, Math::log1p);
			normalizeMinMax(magnitude);
			
			var reconstructed = inverseDFT(complex);
			return new SpectrumResult(OpenCVTools.matToGray(magnitude), OpenCVTools.matToGray(reconstructed));
		}
	}
	
	/**
	 * Filter an image with a radial frequency mask.
	 * <p>
	 * The centered spectrum is multiplied by the mask from {@link #createMask(int, int, FrequencyFilterParams)}, 
	 * unshifted and inverted. The output is the magnitude of the inverse, optionally plus 128, 
	 * rounded to the nearest integer and clipped to 0-255. Spectra are rounded in the same way.
	 * 
	 * @param image
	 * @param params
	 * @return
	 */
	public static FilterResult applyFilter(GrayImage image, FrequencyFilterParams params) {
		Objects.requireNonNull(image, "Image must not be null");
		Objects.requireNonNull(params, "Filter parameters must not be null");
		int rows = image.getHeight();
		int cols = image.getWidth();
		var mask = createMask(rows, cols, params);
		logger.debug("Applying {} to {} x {} image", params, cols, rows);
		
		try (var scope = new PointerScope()) {
			var shifted = OpenCVTools.fftShift(forwardDFT(image));
			
			var matMask = OpenCVTools.floatToMat(mask);
			matMask.convertTo(matMask, opencv_core.CV_64F);
			var planes = new MatVector();
			opencv_core.split(shifted, planes);
			for (int c = 0; c < 2; c++)
				opencv_core.multiply(planes.get(c), matMask, planes.get(c));
			var filteredShifted = new Mat();
			opencv_core.merge(planes, filteredShifted);
			
			var spectrum = logSpectrum(shifted);
			var filteredSpectrum = logSpectrum(filteredShifted);
			
			var output = inverseDFT(OpenCVTools.ifftShift(filteredShifted));
			if (params.isAddDc())
				OpenCVTools.apply(output, v -> v + 128.0);
			
			return new FilterResult(
					OpenCVTools.matToGray(output),
					OpenCVTools.matToGray(spectrum),
					OpenCVTools.matToGray(filteredSpectrum),
					mask);
		}
	}
	
	/**
	 * Create a radial frequency mask, in centered coordinates.
	 * <p>
	 * The distance of each element from {@code (rows/2, cols/2)} (integer division) is {@code d}, and the mask is:
	 * <ul>
	 * <li>low pass: ideal {@code d <= r}; Gaussian {@code exp(-d^2 / (2 r^2))}</li>
	 * <li>high pass: ideal {@code d > r}; Gaussian {@code 1 - exp(-d^2 / (2 r^2))}</li>
	 * <li>band pass: ideal {@code inner <= d <= outer}; Gaussian centered at the mean of the radii, 
	 * with spread {@code (outer - inner) / 4}</li>
	 * </ul>
	 * 
	 * @param rows
	 * @param cols
	 * @param params
	 * @return mask with values in [0, 1]
	 */
	public static FloatImage createMask(int rows, int cols, FrequencyFilterParams params) {
		Objects.requireNonNull(params, "Filter parameters must not be null");
		int cy = rows / 2;
		int cx = cols / 2;
		boolean gaussian = params.getProfile() == MaskProfile.GAUSSIAN;
		float[] mask = new float[rows * cols];
		for (int y = 0; y < rows; y++) {
			for (int x = 0; x < cols; x++) {
				double d = Math.sqrt((y - cy) * (double)(y - cy) + (x - cx) * (double)(x - cx));
				mask[y * cols + x] = (float)maskValue(d, params, gaussian);
			}
		}
		return FloatImage.create(mask, cols, rows);
	}
	
	private static double maskValue(double d, FrequencyFilterParams params, boolean gaussian) {
		return switch (params.getFilterType()) {
			case LOW_PASS -> {
				double r = params.getRadius();
				if (gaussian)
					yield Math.exp(-(d * d) / (2 * r * r));
				yield d <= r ? 1 : 0;
			}
			case HIGH_PASS -> {
				double r = params.getRadius();
				if (gaussian)
					yield 1 - Math.exp(-(d * d) / (2 * r * r));
				yield d > r ? 1 : 0;
			}
			case BAND_PASS -> {
				double inner = params.getInnerRadius();
				double outer = params.getOuterRadius();
				if (gaussian) {
					double center = (inner + outer) / 2.0;
					double spread = (outer - inner) / 4.0;
					double diff = d - center;
					yield Math.exp(-(diff * diff) / (2 * spread * spread));
				}
				yield d >= inner && d <= outer ? 1 : 0;
			}
		};
	}
	
	/**
	 * Complex DFT as a 2-channel {@code CV_64F} Mat.
	 */
	private static Mat forwardDFT(GrayImage image) {
		var mat = OpenCVTools.grayToMat(image, opencv_core.CV_64F);
		var complex = new Mat();
		opencv_core.dft(mat, complex, opencv_core.DFT_COMPLEX_OUTPUT, 0);
		return complex;
	}
	
	/**
	 * Scaled inverse DFT, returning the magnitude of the result.
	 */
	private static Mat inverseDFT(Mat complex) {
		var inverse = new Mat();
		opencv_core.idft(complex, inverse, opencv_core.DFT_SCALE, 0);
		return magnitude(inverse);
	}
	
	private static Mat magnitude(Mat complex) {
		var planes = new MatVector();
		opencv_core.split(complex, planes);
		var magnitude = new Mat();
		opencv_core.magnitude(planes.get(0), planes.get(1), magnitude);
		return magnitude;
	}
	
	/**
	 * {@code 20 * log(|F| + 1)}, clipped to 0-255 when converted to 8-bit.
	 */
	private static Mat logSpectrum(Mat complex) {
		var spectrum = magnitude(complex);
		OpenCVTools.apply(spectrum, v -> GeneralTools.clipValue(20.0 * Math.log(v + 1.0), 0, 255));
		return spectrum;
	}
	
	/**
	 * Rescale values to 0-255 in-place. A constant input becomes all zeros.
	 */
	private static void normalizeMinMax(Mat mat) {
		double min = OpenCVTools.minimum(mat);
		double max = OpenCVTools.maximum(mat);
		if (max == min) {
			logger.debug("Spectrum magnitude is constant ({}), normalizing to 0", min);
			OpenCVTools.fill(mat, 0);
			return;
		}
		double scale = 255.0 / (max - min);
		OpenCVTools.apply(mat, v -> (v - min) * scale);
	}

}
