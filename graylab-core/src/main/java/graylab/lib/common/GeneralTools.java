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

package graylab.lib.common;

import java.util.Locale;

import org.apache.commons.math3.util.Precision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collection of generally useful static methods.
 */
public final class GeneralTools {
	
	private final static Logger logger = LoggerFactory.getLogger(GeneralTools.class);
	
	// Suppressed default constructor for non-instantiability
	private GeneralTools() {
		throw new AssertionError();
	}
	
	/**
	 * Clip a value to be within a specific range.
	 * 
	 * @param value
	 * @param min
	 * @param max
	 * @return
	 */
	public static int clipValue(final int value, final int min, final int max) {
		return value < min ? min : (value > max ? max : value);
	}
	
	/**
	 * Clip a value to be within a specific range.
	 * 
	 * @param value
	 * @param min
	 * @param max
	 * @return
	 */
	public static double clipValue(final double value, final double min, final double max) {
		return value < min ? min : (value > max ? max : value);
	}
	
	/**
	 * Clip a value to the range of an unsigned 8-bit sample, rounding to the nearest integer.
	 * NaN is treated as 0.
	 * @param value
	 * @return a value in the range 0-255
	 */
	public static int clipToUInt8(final double value) {
		if (Double.isNaN(value))
			return 0;
		return (int)Math.round(clipValue(value, 0, 255));
	}

	/**
	 * Test if two doubles are approximately equal, within a specified relative tolerance.
	 * 
	 * @param n1
	 * @param n2
	 * @param tolerance
	 * @return
	 */
	public static boolean almostTheSame(double n1, double n2, double tolerance) {
		return Precision.equalsWithRelativeTolerance(n1, n2, tolerance);
	}
	
	/**
	 * Ensure a kernel size is odd, incrementing even values by one.
	 * 
	 * @param size the requested size; must be at least 1
	 * @return the size, or size + 1 if it was even
	 * @throws InvalidParameterException if the size is less than 1
	 */
	public static int ensureOdd(final int size) {
		if (size < 1)
			throw new InvalidParameterException("Kernel size must be >= 1, but was " + size);
		if (size % 2 == 0) {
			logger.debug("Kernel size {} is even, using {} instead", size, size + 1);
			return size + 1;
		}
		return size;
	}
	
	/**
	 * Parse the name of an enum constant, ignoring case and treating '-' and whitespace as '_'.
	 * 
	 * @param <T>
	 * @param cls the enum class
	 * @param name the name to parse
	 * @return the matching constant
	 * @throws InvalidParameterException if no constant matches
	 */
	public static <T extends Enum<T>> T parseEnum(final Class<T> cls, final String name) {
		if (name == null)
			throw new InvalidParameterException("No " + cls.getSimpleName() + " specified");
		var normalized = name.strip().replaceAll("[\\s-]+", "_").toUpperCase(Locale.ROOT);
		for (var value : cls.getEnumConstants()) {
			if (value.name().equals(normalized))
				return value;
		}
		throw new InvalidParameterException("Unknown " + cls.getSimpleName() + ": '" + name + "'");
	}

}
