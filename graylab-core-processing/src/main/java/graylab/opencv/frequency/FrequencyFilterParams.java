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

import graylab.lib.common.InvalidParameterException;

/**
 * Immutable parameters for {@link FrequencyDomainFilter#applyFilter(graylab.lib.images.GrayImage, FrequencyFilterParams)}.
 * <p>
 * Values are validated when built: radii must be finite and non-negative, the outer radius must 
 * not be smaller than the inner radius, and Gaussian profiles need a non-zero radius (or band width).
 */
public class FrequencyFilterParams {
	
	private final FrequencyFilterType filterType;
	private final MaskProfile profile;
	private final double radius;
	private final double innerRadius;
	private final double outerRadius;
	private final boolean addDc;
	
	private FrequencyFilterParams(Builder builder) {
		this.filterType = builder.filterType;
		this.profile = builder.profile;
		this.radius = builder.radius;
		this.innerRadius = builder.innerRadius;
		this.outerRadius = builder.outerRadius;
		this.addDc = builder.addDc;
	}
	
	/**
	 * Create a builder for the specified filter type.
	 * @param filterType
	 * @return
	 */
	public static Builder builder(FrequencyFilterType filterType) {
		return new Builder(filterType);
	}
	
	/**
	 * Low pass filter with the specified radius.
	 * @param radius
	 * @param profile
	 * @return
	 */
	public static FrequencyFilterParams lowPass(double radius, MaskProfile profile) {
		return builder(FrequencyFilterType.LOW_PASS).radius(radius).profile(profile).build();
	}
	
	/**
	 * High pass filter with the specified radius.
	 * @param radius
	 * @param profile
	 * @return
	 */
	public static FrequencyFilterParams highPass(double radius, MaskProfile profile) {
		return builder(FrequencyFilterType.HIGH_PASS).radius(radius).profile(profile).build();
	}
	
	/**
	 * Band pass filter between two radii.
	 * @param innerRadius
	 * @param outerRadius
	 * @param profile
	 * @return
	 */
	public static FrequencyFilterParams bandPass(double innerRadius, double outerRadius, MaskProfile profile) {
		return builder(FrequencyFilterType.BAND_PASS).bandRadii(innerRadius, outerRadius).profile(profile).build();
	}

	/**
	 * The filter type.
	 * @return
	 */
	public FrequencyFilterType getFilterType() {
		return filterType;
	}

	/**
	 * The mask profile.
	 * @return
	 */
	public MaskProfile getProfile() {
		return profile;
	}

	/**
	 * Cutoff radius for low and high pass filters.
	 * @return
	 */
	public double getRadius() {
		return radius;
	}

	/**
	 * Inner radius for band pass filters.
	 * @return
	 */
	public double getInnerRadius() {
		return innerRadius;
	}

	/**
	 * Outer radius for band pass filters.
	 * @return
	 */
	public double getOuterRadius() {
		return outerRadius;
	}

	/**
	 * Whether 128 is added to the filtered output, so that signed results remain visible.
	 * @return
	 */
	public boolean isAddDc() {
		return addDc;
	}
	
	@Override
	public String toString() {
		return "FrequencyFilterParams [" + filterType + ", " + profile + ", radius=" + radius
				+ ", inner=" + innerRadius + ", outer=" + outerRadius + ", addDc=" + addDc + "]";
	}

	
	/**
	 * Builder for {@link FrequencyFilterParams}.
	 */
	public static class Builder {
		
		private final FrequencyFilterType filterType;
		private MaskProfile profile = MaskProfile.IDEAL;
		private double radius = 30;
		private double innerRadius = 10;
		private double outerRadius = 50;
		private boolean addDc = false;
		
		private Builder(FrequencyFilterType filterType) {
			this.filterType = Objects.requireNonNull(filterType, "Filter type must not be null");
		}
		
		/**
		 * Mask profile. Default is {@link MaskProfile#IDEAL}.
		 * @param profile
		 * @return this builder
		 */
		public Builder profile(MaskProfile profile) {
			this.profile = Objects.requireNonNull(profile, "Mask profile must not be null");
			return this;
		}
		
		/**
		 * Use a Gaussian profile if true, or an ideal profile otherwise.
		 * @param gaussian
		 * @return this builder
		 */
		public Builder gaussian(boolean gaussian) {
			return profile(gaussian ? MaskProfile.GAUSSIAN : MaskProfile.IDEAL);
		}
		
		/**
		 * Cutoff radius for low and high pass filters. Default is 30.
		 * @param radius
		 * @return this builder
		 */
		public Builder radius(double radius) {
			this.radius = radius;
			return this;
		}
		
		/**
		 * Inner and outer radii for band pass filters. Defaults are 10 and 50.
		 * @param innerRadius
		 * @param outerRadius
		 * @return this builder
		 */
		public Builder bandRadii(double innerRadius, double outerRadius) {
			this.innerRadius = innerRadius;
			this.outerRadius = outerRadius;
			return this;
		}
		
		/**
		 * Add 128 to the filtered output. Default is false.
		 * @param addDc
		 * @return this builder
		 */
		public Builder addDc(boolean addDc) {
			this.addDc = addDc;
			return this;
		}
		
		/**
		 * Validate and build the parameters.
		 * @return
		 * @throws InvalidParameterException if the radii are invalid for the filter type and profile
		 */
		public FrequencyFilterParams build() throws InvalidParameterException {
			switch (filterType) {
				case LOW_PASS, HIGH_PASS -> {
					checkRadius("Radius", radius);
					if (profile == MaskProfile.GAUSSIAN && radius == 0)
						throw new InvalidParameterException("Gaussian " + filterType + " filter requires a radius > 0");
				}
				case BAND_PASS -> {
					checkRadius("Inner radius", innerRadius);
					checkRadius("Outer radius", outerRadius);
					if (outerRadius < innerRadius)
						throw new InvalidParameterException("Outer radius " + outerRadius + " is smaller than inner radius " + innerRadius);
					if (profile == MaskProfile.GAUSSIAN && outerRadius == innerRadius)
						throw new InvalidParameterException("Gaussian band pass filter requires outer radius > inner radius");
				}
			}
			return new FrequencyFilterParams(this);
		}
		
		private static void checkRadius(String name, double value) {
			if (!Double.isFinite(value) || value < 0)
				throw new InvalidParameterException(name + " must be a finite value >= 0, but was " + value);
		}
		
	}

}
