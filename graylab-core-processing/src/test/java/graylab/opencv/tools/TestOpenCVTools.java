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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.bytedeco.javacpp.PointerScope;
import org.bytedeco.javacpp.indexer.DoubleIndexer;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.opencv_core.Mat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import graylab.lib.common.InvalidParameterException;
import graylab.lib.images.FloatImage;
import graylab.lib.images.GrayImage;

@SuppressWarnings("javadoc")
public class TestOpenCVTools {
	
	private static double[][] createSequence(int rows, int cols) {
		double[][] values = new double[rows][cols];
		for (int y = 0; y < rows; y++) {
			for (int x = 0; x < cols; x++)
				values[y][x] = y * cols + x;
		}
		return values;
	}
	
	@Test
	public void test_grayConversion() {
		var image = GrayImage.fromRows(new int[][] {
			{0, 1, 2},
			{127, 128, 255}
		});
		try (var scope = new PointerScope()) {
			var mat = OpenCVTools.grayToMat(image);
			assertEquals(2, mat.rows());
			assertEquals(3, mat.cols());
			assertEquals(opencv_core.CV_8U, mat.depth());
			assertEquals(image, OpenCVTools.matToGray(mat));
			
			var mat32 = OpenCVTools.grayToMat(image, opencv_core.CV_32F);
			assertEquals(opencv_core.CV_32F, mat32.depth());
			assertEquals(FloatImage.fromGray(image), OpenCVTools.matToFloat(mat32));
		}
	}
	
	@Test
	public void test_matToGrayRoundsAndClips() {
		try (var scope = new PointerScope()) {
			var mat = OpenCVTools.doubleMat(new double[][] {{-10, 0.4, 0.6, 254.5, 300}});
			var image = OpenCVTools.matToGray(mat);
			assertEquals(0, image.getPixel(0, 0));
			assertEquals(0, image.getPixel(1, 0));
			assertEquals(1, image.getPixel(2, 0));
			assertEquals(255, image.getPixel(4, 0));
		}
	}
	
	@Test
	public void test_multichannelRejected() {
		try (var scope = new PointerScope()) {
			var mat = new Mat(2, 2, opencv_core.CV_8UC3);
			assertThrows(InvalidParameterException.class, () -> OpenCVTools.matToGray(mat));
		}
	}
	
	@Test
	public void test_apply() {
		try (var scope = new PointerScope()) {
			var mat = OpenCVTools.doubleMat(new double[][] {{1, 2}, {3, 4}});
			OpenCVTools.apply(mat, v -> v * v);
			assertArrayEquals(new double[] {1, 4, 9, 16}, OpenCVTools.extractDoubles(mat));
			assertEquals(7.5, OpenCVTools.mean(mat), 1e-9);
			assertEquals(1, OpenCVTools.minimum(mat));
			assertEquals(16, OpenCVTools.maximum(mat));
			OpenCVTools.fill(mat, 2.5);
			assertArrayEquals(new double[] {2.5, 2.5, 2.5, 2.5}, OpenCVTools.extractDoubles(mat));
		}
	}
	
	@Test
	public void test_roll() {
		try (var scope = new PointerScope()) {
			var mat = OpenCVTools.doubleMat(createSequence(2, 3));
			var rolled = OpenCVTools.roll(mat, 1, 1);
			assertArrayEquals(new double[] {
					5, 3, 4,
					2, 0, 1
			}, OpenCVTools.extractDoubles(rolled));
			// Input is unchanged
			assertArrayEquals(new double[] {0, 1, 2, 3, 4, 5}, OpenCVTools.extractDoubles(mat));
			
			var rolledBack = OpenCVTools.roll(rolled, -1, -4);
			assertArrayEquals(OpenCVTools.extractDoubles(mat), OpenCVTools.extractDoubles(rolledBack));
		}
	}
	
	@ParameterizedTest
	@CsvSource({"4, 4", "5, 3", "3, 6", "7, 7", "1, 5"})
	public void test_fftShift(int rows, int cols) {
		try (var scope = new PointerScope()) {
			var mat = OpenCVTools.doubleMat(createSequence(rows, cols));
			var shifted = OpenCVTools.fftShift(mat);
			double[] values = OpenCVTools.extractDoubles(shifted);
			// Zero frequency moves to the center
			assertEquals(0, values[(rows / 2) * cols + cols / 2]);
			
			var restored = OpenCVTools.ifftShift(shifted);
			assertArrayEquals(OpenCVTools.extractDoubles(mat), OpenCVTools.extractDoubles(restored));
		}
	}
	
	@Test
	public void test_fftShiftMultichannel() {
		try (var scope = new PointerScope()) {
			var mat = new Mat(3, 3, opencv_core.CV_64FC2);
			OpenCVTools.fill(mat, 0);
			DoubleIndexer indexer = mat.createIndexer();
			indexer.put(0, 0, 1, 7.0);
			indexer.close();
			var shifted = OpenCVTools.fftShift(mat);
			DoubleIndexer indexer2 = shifted.createIndexer();
			assertEquals(7.0, indexer2.get(1, 1, 1));
			assertEquals(0.0, indexer2.get(1, 1, 0));
			indexer2.close();
		}
	}
	
	@Test
	public void test_filter2D() {
		try (var scope = new PointerScope()) {
			var mat = OpenCVTools.doubleMat(createSequence(3, 3));
			var kernel = OpenCVTools.doubleMat(new double[][] {
				{0, 0, 0},
				{0, 2, 0},
				{0, 0, 0}
			});
			OpenCVTools.filter2D(mat, kernel);
			assertArrayEquals(new double[] {0, 2, 4, 6, 8, 10, 12, 14, 16}, OpenCVTools.extractDoubles(mat));
		}
	}
	
	@Test
	public void test_doubleMatRequiresRectangularRows() {
		assertThrows(InvalidParameterException.class, () -> OpenCVTools.doubleMat(new double[][] {{1, 2}, {3}}));
	}

}
