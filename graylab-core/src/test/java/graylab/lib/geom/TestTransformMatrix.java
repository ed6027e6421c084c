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

package graylab.lib.geom;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.awt.geom.AffineTransform;

import org.junit.jupiter.api.Test;

import graylab.lib.common.InvalidParameterException;

@SuppressWarnings("javadoc")
public class TestTransformMatrix {
	
	private static final double EPSILON = 1e-10;
	
	@Test
	public void test_fromRows() {
		var twoRows = TransformMatrix.fromRows(new double[][] {{1, 2, 3}, {4, 5, 6}});
		var threeRows = TransformMatrix.fromRows(new double[][] {{1, 2, 3}, {4, 5, 6}, {0, 0, 1}});
		assertEquals(twoRows, threeRows);
		assertArrayEquals(new double[] {0, 0, 1}, twoRows.toArray()[2]);
		assertEquals(6.0, twoRows.toArray()[1][2]);
		
		assertThrows(InvalidParameterException.class, () -> TransformMatrix.fromRows(new double[][] {{1, 2, 3}, {4, 5, 6}, {0, 1, 1}}));
		assertThrows(InvalidParameterException.class, () -> TransformMatrix.fromRows(new double[][] {{1, 2}, {4, 5}}));
		assertThrows(InvalidParameterException.class, () -> TransformMatrix.fromRows(new double[][] {{1, 2, 3}}));
	}
	
	@Test
	public void test_multiplyOrder() {
		var scale = TransformMatrix.of(2, 0, 0, 0, 2, 0);
		var shift = TransformMatrix.translation(1, 0);
		// Shift first, then scale
		var p = scale.multiply(shift).transformPoint(1, 1);
		assertEquals(4.0, p.getX(), EPSILON);
		assertEquals(2.0, p.getY(), EPSILON);
		// Scale first, then shift
		p = shift.multiply(scale).transformPoint(1, 1);
		assertEquals(3.0, p.getX(), EPSILON);
		assertEquals(2.0, p.getY(), EPSILON);
	}
	
	@Test
	public void test_aboutCenterKeepsCenterFixed() {
		var scale = TransformMatrix.of(3, 0, 0, 0, 0.5, 0);
		var matrix = TransformMatrix.aboutCenter(scale, 10, 20);
		var p = matrix.transformPoint(10, 20);
		assertEquals(10.0, p.getX(), EPSILON);
		assertEquals(20.0, p.getY(), EPSILON);
		p = matrix.transformPoint(11, 22);
		assertEquals(13.0, p.getX(), EPSILON);
		assertEquals(21.0, p.getY(), EPSILON);
	}
	
	@Test
	public void test_inverse() {
		var matrix = TransformMatrix.of(1, 0.5, 3, -0.25, 2, -4);
		assertTrue(matrix.multiply(matrix.inverse()).almostEquals(TransformMatrix.identity(), EPSILON));
		assertTrue(matrix.inverse().multiply(matrix).almostEquals(TransformMatrix.identity(), EPSILON));
		
		var singular = TransformMatrix.of(1, 2, 0, 2, 4, 0);
		assertThrows(InvalidParameterException.class, () -> singular.inverse());
	}
	
	@Test
	public void test_awtConversion() {
		var matrix = TransformMatrix.of(1, 2, 3, 4, 5, 6);
		AffineTransform transform = matrix.toAffineTransform();
		var expected = matrix.transformPoint(7, -2);
		var actual = transform.transform(new java.awt.geom.Point2D.Double(7, -2), null);
		assertEquals(expected.getX(), actual.getX(), EPSILON);
		assertEquals(expected.getY(), actual.getY(), EPSILON);
		assertEquals(matrix, TransformMatrix.fromAffineTransform(transform));
	}
	
	@Test
	public void test_almostEquals() {
		var matrix = TransformMatrix.of(1, 0, 5, 0, 1, -5);
		assertTrue(matrix.almostEquals(TransformMatrix.of(1 + 1e-9, 0, 5, 0, 1, -5 - 1e-9), 1e-8));
		assertFalse(matrix.almostEquals(TransformMatrix.of(1 + 1e-6, 0, 5, 0, 1, -5), 1e-8));
		// Signed zeros are treated as equal
		var signedZero = TransformMatrix.of(1, -0.0, 5, 0, 1, -5);
		assertTrue(matrix.almostEquals(signedZero, 0));
		assertFalse(matrix.almostEquals(TransformMatrix.of(1, Double.NaN, 5, 0, 1, -5), 1));
	}

}
