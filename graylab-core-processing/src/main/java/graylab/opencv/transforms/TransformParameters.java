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

/**
 * Immutable parameters for {@link AffineTransformBuilder}.
 * <p>
 * Only the values relevant to the requested {@link TransformType} are used. 
 * Defaults describe the identity for every kind.
 */
public class TransformParameters {
	
	private static final TransformParameters DEFAULT = builder().build();
	
	private final double angle;
	private final double tx, ty;
	private final double scaleX, scaleY;
	private final double shearX, shearY;
	
	private TransformParameters(Builder builder) {
		this.angle = builder.angle;
		this.tx = builder.tx;
		this.ty = builder.ty;
		this.scaleX = builder.scaleX;
		this.scaleY = builder.scaleY;
		this.shearX = builder.shearX;
		this.shearY = builder.shearY;
	}
	
	/**
	 * Parameters with all default values.
	 * @return
	 */
	public static TransformParameters defaults() {
		return DEFAULT;
	}
	
	/**
	 * Create a new builder.
	 * @return
	 */
	public static Builder builder() {
		return new Builder();
	}
	
	/**
	 * Rotation angle in degrees. Default 0.
	 * @return
	 */
	public double getAngle() {
		return angle;
	}

	/**
	 * Horizontal translation. Default 0.
	 * @return
	 */
	public double getTx() {
		return tx;
	}

	/**
	 * Vertical translation. Default 0.
	 * @return
	 */
	public double getTy() {
		return ty;
	}

	/**
	 * Horizontal scale factor. Default 1.
	 * @return
	 */
	public double getScaleX() {
		return scaleX;
	}

	/**
	 * Vertical scale factor. Default 1.
	 * @return
	 */
	public double getScaleY() {
		return scaleY;
	}

	/**
	 * Horizontal shear. Default 0.
	 * @return
	 */
	public double getShearX() {
		return shearX;
	}

	/**
	 * Vertical shear. Default 0.
	 * @return
	 */
	public double getShearY() {
		return shearY;
	}
	
	@Override
	public String toString() {
		return "TransformParameters [angle=" + angle + ", tx=" + tx + ", ty=" + ty + ", scaleX=" + scaleX
				+ ", scaleY=" + scaleY + ", shearX=" + shearX + ", shearY=" + shearY + "]";
	}

	
	/**
	 * Builder for {@link TransformParameters}.
	 */
	public static class Builder {
		
		private double angle = 0;
		private double tx = 0, ty = 0;
		private double scaleX = 1, scaleY = 1;
		private double shearX = 0, shearY = 0;
		
		private Builder() {}
		
		/**
		 * Rotation angle in degrees.
		 * @param angle
		 * @return this builder
		 */
		public Builder angle(double angle) {
			this.angle = angle;
			return this;
		}
		
		/**
		 * Translation.
		 * @param tx
		 * @param ty
		 * @return this builder
		 */
		public Builder translation(double tx, double ty) {
			this.tx = tx;
			this.ty = ty;
			return this;
		}
		
		/**
		 * Scale factors.
		 * @param scaleX
		 * @param scaleY
		 * @return this builder
		 */
		public Builder scale(double scaleX, double scaleY) {
			this.scaleX = scaleX;
			this.scaleY = scaleY;
			return this;
		}
		
		/**
		 * Shear factors.
		 * @param shearX
		 * @param shearY
		 * @return this builder
		 */
		public Builder shear(double shearX, double shearY) {
			this.shearX = shearX;
			this.shearY = shearY;
			return this;
		}
		
		/**
		 * Build the parameters.
		 * @return
		 */
		public TransformParameters build() {
			return new TransformParameters(this);
		}
		
	}

}
