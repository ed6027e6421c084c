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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Random;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import graylab.lib.common.InvalidParameterException;
import graylab.lib.geom.TransformMatrix;
import graylab.lib.images.GrayImage;

@SuppressWarnings("javadoc")
public class TestAffineTransformBuilder {
	
	private static GrayImage createRandomImage(int width, int height, long seed) {
		var rng = new Random(seed);
		int[] values = new int[width * height];
		for (int i = 0; i < values.length; i++)
			values[i] = rng.nextInt(256);
		return GrayImage.create(values, width, height);
	}
	
	private static GrayImage createSinglePixel(int width, int height, int x, int y) {
		int[] values = new int[width * height];
		values[y * width + x] = 255;
		return GrayImage.create(values, width, height);
	}
	
	@ParameterizedTest
	@EnumSource(TransformType.class)
	public void test_defaultParametersGiveIdentity(TransformType type) {
		var image = createRandomImage(17, 12, 42L);
		var result = AffineTransformBuilder.transform(image, type, TransformParameters.defaults());
		assertTrue(result.matrix().almostEquals(TransformMatrix.identity(), 1e-12));
		assertEquals(image, result.image());
	}
	
	@Test
	public void test_rotationMatrix() {
		var matrix = AffineTransformBuilder.rotation(90, 0, 0);
		assertTrue(matrix.almostEquals(TransformMatrix.of(0, 1, 0, -1, 0, 0), 1e-12));
		
		// Center point is fixed
		var centered = AffineTransformBuilder.rotation(37, 10, 20);
		var p = centered.transformPoint(10, 20);
		assertEquals(10, p.getX(), 1e-9);
		assertEquals(20, p.getY(), 1e-9);
	}
	
	@Test
	public void test_rotatePixel() {
		var image = createSinglePixel(5, 5, 4, 2);
		var params = TransformParameters.builder().angle(90).build();
		var result = AffineTransformBuilder.transform(image, TransformType.ROTATION, params);
		var output = result.image();
		assertEquals(255, output.getPixel(2, 0), 1);
		assertEquals(0, output.getPixel(4, 2), 1);
		assertEquals(255, sum(output), 2);
		
		var p = result.matrix().transformPoint(4, 2);
		assertEquals(2, p.getX(), 1e-9);
		assertEquals(0, p.getY(), 1e-9);
	}
	
	@Test
	public void test_translate() {
		var image = GrayImage.fromRows(new int[][] {
			{10, 20, 30},
			{40, 50, 60}
		});
		var params = TransformParameters.builder().translation(1, 0).build();
		var output = AffineTransformBuilder.transform(image, "translation", params).image();
		assertEquals(GrayImage.fromRows(new int[][] {
			{0, 10, 20},
			{0, 40, 50}
		}), output);
	}
	
	@Test
	public void test_translateIsNotCentered() {
		var params = TransformParameters.builder().translation(3, -2).build();
		var matrix = AffineTransformBuilder.createMatrix(TransformType.TRANSLATION, params, 100, 50);
		assertEquals(TransformMatrix.translation(3, -2), matrix);
	}
	
	@Test
	public void test_scaleAboutCenter() {
		var params = TransformParameters.builder().scale(2, 0.5).build();
		var matrix = AffineTransformBuilder.createMatrix(TransformType.SCALING, params, 11, 8);
		// Default center uses integer division
		var center = matrix.transformPoint(5, 4);
		assertEquals(5, center.getX(), 1e-12);
		assertEquals(4, center.getY(), 1e-12);
		var p = matrix.transformPoint(6, 6);
		assertEquals(7, p.getX(), 1e-12);
		assertEquals(5, p.getY(), 1e-12);
	}
	
	@Test
	public void test_shear() {
		var params = TransformParameters.builder().shear(0.5, 0).build();
		var matrix = AffineTransformBuilder.createMatrix(TransformType.SHEAR, params, 0.0, 0.0);
		assertTrue(matrix.almostEquals(TransformMatrix.of(1, 0.5, 0, 0, 1, 0), 1e-12));
	}
	
	@Test
	public void test_outputSizeMatchesInput() {
		var image = createRandomImage(31, 19, 1L);
		var params = TransformParameters.builder().angle(30).scale(1.5, 0.75).shear(0.2, 0.1).build();
		for (var type : TransformType.values()) {
			var output = AffineTransformBuilder.transform(image, type, params).image();
			assertTrue(image.sameSize(output));
		}
	}
	
	@ParameterizedTest
	@ValueSource(strings = {"rotation", "ROTATION", "Shear", "scaling"})
	public void test_parseType(String name) {
		var image = createRandomImage(8, 8, 2L);
		var result = AffineTransformBuilder.transform(image, name, TransformParameters.defaults());
		assertEquals(image, result.image());
	}
	
	@ParameterizedTest
	@ValueSource(strings = {"", "rotate", "perspective"})
	public void test_unknownType(String name) {
		var image = createRandomImage(8, 8, 3L);
		assertThrows(InvalidParameterException.class, () -> AffineTransformBuilder.transform(image, name, TransformParameters.defaults()));
	}
	
	private static int sum(GrayImage image) {
		int sum = 0;
		for (int v : image.getValues())
			sum += v;
		return sum;
	}

}
