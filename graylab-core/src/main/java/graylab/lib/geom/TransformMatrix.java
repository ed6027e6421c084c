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

import java.awt.geom.AffineTransform;
import java.awt.geom.NoninvertibleTransformException;
import java.awt.geom.Point2D;
import java.util.Arrays;
import java.util.Objects;

import org.apache.commons.math3.util.Precision;

import graylab.lib.common.InvalidParameterException;

/**
 * Immutable 3x3 homogeneous matrix representing a 2D affine transform.
 * <p>
 * The bottom row is always {@code [0, 0, 1]}. Points are column vectors {@code (x, y, 1)},
 * so {@code a.multiply(b)} applies {@code b} first and then {@code a}.
 * <p>
 * Java's {@link AffineTransform} is initialized from a flattened array in column order, 
 * while this class stores rows; use {@link #toAffineTransform()} and 
 * {@link #fromAffineTransform(AffineTransform)} to convert rather than copying arrays directly.
 */
public final class TransformMatrix {
	
	private static final TransformMatrix IDENTITY = new TransformMatrix(1, 0, 0, 0, 1, 0);
	
	private final double m00, m01, m02;
	private final double m10, m11, m12;
	
	private TransformMatrix(double m00, double m01, double m02, double m10, double m11, double m12) {
		this.m00 = m00;
		this.m01 = m01;
		this.m02 = m02;
		this.m10 = m10;
		this.m11 = m11;
		this.m12 = m12;
	}
	
	/**
	 * The identity transform.
	 * @return
	 */
	public static TransformMatrix identity() {
		return IDENTITY;
	}
	
	/**
	 * Create a matrix from the top two rows, {@code [[m00, m01, m02], [m10, m11, m12]]}.
	 * @param m00
	 * @param m01
	 * @param m02
	 * @param m10
	 * @param m11
	 * @param m12
	 * @return
	 */
	public static TransformMatrix of(double m00, double m01, double m02, double m10, double m11, double m12) {
		return new TransformMatrix(m00, m01, m02, m10, m11, m12);
	}
	
	/**
	 * Create a matrix from a 2x3 array, or 3x3 if the last row is {@code [0, 0, 1]}.
	 * @param mat
	 * @return
	 * @throws InvalidParameterException if the input has the wrong shape or bottom row
	 */
	public static TransformMatrix fromRows(double[][] mat) throws InvalidParameterException {
		Objects.requireNonNull(mat, "Matrix must not be null");
		if (mat.length == 3) {
			if (mat[2] == null || !Arrays.equals(mat[2], new double[] {0.0, 0.0, 1.0}))
				throw new InvalidParameterException("Bottom row of an affine matrix must be [0, 0, 1], but was " + Arrays.toString(mat[2]));
		} else if (mat.length != 2)
			throw new InvalidParameterException("Transform matrix should have size double[2][3] or double[3][3]");
		if (mat[0] == null || mat[1] == null || mat[0].length != 3 || mat[1].length != 3)
			throw new InvalidParameterException("Transform matrix rows should have length 3");
		return new TransformMatrix(mat[0][0], mat[0][1], mat[0][2], mat[1][0], mat[1][1], mat[1][2]);
	}
	
	/**
	 * Create a pure translation.
	 * @param tx
	 * @param ty
	 * @return
	 */
	public static TransformMatrix translation(double tx, double ty) {
		return new TransformMatrix(1, 0, tx, 0, 1, ty);
	}
	
	/**
	 * Create a matrix that applies a transform about a center point, i.e. 
	 * {@code translate(cx, cy) * transform * translate(-cx, -cy)}.
	 * @param transform
	 * @param cx
	 * @param cy
	 * @return
	 */
	public static TransformMatrix aboutCenter(TransformMatrix transform, double cx, double cy) {
		return translation(cx, cy)
				.multiply(transform)
				.multiply(translation(-cx, -cy));
	}
	
	/**
	 * Create a matrix from a Java affine transform.
	 * @param transform
	 * @return
	 */
	public static TransformMatrix fromAffineTransform(AffineTransform transform) {
		return new TransformMatrix(
				transform.getScaleX(), transform.getShearX(), transform.getTranslateX(),
				transform.getShearY(), transform.getScaleY(), transform.getTranslateY());
	}
	
	/**
	 * Matrix product {@code this * other}.
	 * @param other
	 * @return
	 */
	public TransformMatrix multiply(TransformMatrix other) {
		return new TransformMatrix(
				m00 * other.m00 + m01 * other.m10,
				m00 * other.m01 + m01 * other.m11,
				m00 * other.m02 + m01 * other.m12 + m02,
				m10 * other.m00 + m11 * other.m10,
				m10 * other.m01 + m11 * other.m11,
				m10 * other.m02 + m11 * other.m12 + m12);
	}
	
	/**
	 * Compute the inverse transform.
	 * @return
	 * @throws InvalidParameterException if the matrix is singular
	 */
	public TransformMatrix inverse() throws InvalidParameterException {
		try {
			return fromAffineTransform(toAffineTransform().createInverse());
		} catch (NoninvertibleTransformException e) {
			throw new InvalidParameterException("Transform matrix is not invertible: " + this, e);
		}
	}
	
	/**
	 * Apply the transform to a point.
	 * @param x
	 * @param y
	 * @return
	 */
	public Point2D transformPoint(double x, double y) {
		return new Point2D.Double(
				m00 * x + m01 * y + m02,
				m10 * x + m11 * y + m12);
	}
	
	/**
	 * Get the full 3x3 matrix as a new array of rows.
	 * @return
	 */
	public double[][] toArray() {
		return new double[][] {
			{m00, m01, m02},
			{m10, m11, m12},
			{0.0, 0.0, 1.0}
		};
	}
	
	/**
	 * Get the top two rows, flattened in row order.
	 * @return
	 */
	public double[] toFlat2x3() {
		return new double[] {m00, m01, m02, m10, m11, m12};
	}
	
	/**
	 * Create an equivalent Java affine transform.
	 * @return
	 */
	public AffineTransform toAffineTransform() {
		return new AffineTransform(m00, m10, m01, m11, m02, m12);
	}
	
	/**
	 * Check whether every element differs from another matrix by at most {@code tolerance}.
	 * @param other
	 * @param tolerance
	 * @return
	 */
	public boolean almostEquals(TransformMatrix other, double tolerance) {
		double[] a = toFlat2x3();
		double[] b = other.toFlat2x3();
		for (int i = 0; i < a.length; i++) {
			if (!Precision.equals(a[i], b[i], tolerance))
				return false;
		}
		return true;
	}

	@Override
	public int hashCode() {
		return Arrays.hashCode(toFlat2x3());
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof TransformMatrix other))
			return false;
		return Arrays.equals(toFlat2x3(), other.toFlat2x3());
	}

	@Override
	public String toString() {
		return "TransformMatrix [" + Arrays.toString(new double[] {m00, m01, m02}) + ", "
				+ Arrays.toString(new double[] {m10, m11, m12}) + ", [0.0, 0.0, 1.0]]";
	}

}
