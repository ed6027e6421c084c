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

package graylab.lib.analysis.stats;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

import graylab.lib.common.InvalidParameterException;

/**
 * A monotonic lookup from 256 source intensities to target intensities.
 * <p>
 * Entries are either a mapped intensity in the range 0-255 or absent. Absent entries can only 
 * form a trailing tail, so the mapping is fully described by the mapped prefix. 
 * Mapped values are non-decreasing.
 */
public final class IntensityMapping {
	
	private final int[] mapped;
	
	private IntensityMapping(int[] mapped) {
		this.mapped = mapped;
	}
	
	/**
	 * Create a mapping from the values of its mapped prefix.
	 * Intensities from {@code values.length} to 255 are absent.
	 * @param values non-decreasing values in the range 0-255, at most 256 of them
	 * @return
	 * @throws InvalidParameterException if the values are out of range or decreasing
	 */
	public static IntensityMapping of(int... values) throws InvalidParameterException {
		Objects.requireNonNull(values, "Mapping values must not be null");
		if (values.length > IntensityHistogram.N_BINS)
			throw new InvalidParameterException("Mapping can have at most " + IntensityHistogram.N_BINS + " entries, but got " + values.length);
		for (int i = 0; i < values.length; i++) {
			int v = values[i];
			if (v < 0 || v > 255)
				throw new InvalidParameterException("Mapped value " + v + " at intensity " + i + " is outside the range 0-255");
			if (i > 0 && v < values[i-1])
				throw new InvalidParameterException("Mapping is not monotonic at intensity " + i + ": " + values[i-1] + " > " + v);
		}
		return new IntensityMapping(values.clone());
	}
	
	/**
	 * Create a mapping from a list of optional entries, as produced by {@link #toList()}.
	 * @param entries
	 * @return
	 * @throws InvalidParameterException if a mapped entry follows an absent one
	 */
	public static IntensityMapping fromList(List<OptionalInt> entries) throws InvalidParameterException {
		Objects.requireNonNull(entries, "Mapping entries must not be null");
		if (entries.size() != IntensityHistogram.N_BINS)
			throw new InvalidParameterException("Mapping requires " + IntensityHistogram.N_BINS + " entries, but got " + entries.size());
		int n = 0;
		while (n < entries.size() && entries.get(n).isPresent())
			n++;
		for (int i = n; i < entries.size(); i++) {
			if (entries.get(i).isPresent())
				throw new InvalidParameterException("Mapped entry at intensity " + i + " follows an absent entry");
		}
		int[] values = new int[n];
		for (int i = 0; i < n; i++)
			values[i] = entries.get(i).getAsInt();
		return of(values);
	}
	
	/**
	 * Mapping every intensity to itself.
	 * @return
	 */
	public static IntensityMapping identity() {
		int[] values = new int[IntensityHistogram.N_BINS];
		for (int i = 0; i < values.length; i++)
			values[i] = i;
		return new IntensityMapping(values);
	}
	
	/**
	 * Get the entry for an intensity.
	 * @param intensity in the range 0-255
	 * @return the mapped intensity, or empty if none was found
	 */
	public OptionalInt get(int intensity) {
		if (intensity < 0 || intensity >= IntensityHistogram.N_BINS)
			throw new IndexOutOfBoundsException("Intensity " + intensity + " is outside the range 0-255");
		return intensity < mapped.length ? OptionalInt.of(mapped[intensity]) : OptionalInt.empty();
	}
	
	/**
	 * Look up an intensity, treating absent entries as 0.
	 * @param intensity in the range 0-255
	 * @return
	 */
	public int apply(int intensity) {
		return get(intensity).orElse(0);
	}
	
	/**
	 * Number of intensities with a mapping. All intensities at or above this value are absent.
	 * @return
	 */
	public int getMappedCount() {
		return mapped.length;
	}
	
	/**
	 * Returns true if every intensity has a mapping.
	 * @return
	 */
	public boolean isComplete() {
		return mapped.length == IntensityHistogram.N_BINS;
	}
	
	/**
	 * Get the values of the mapped prefix.
	 * @return
	 */
	public int[] getMappedValues() {
		return mapped.clone();
	}
	
	/**
	 * Get all 256 entries.
	 * @return an unmodifiable list
	 */
	public List<OptionalInt> toList() {
		var list = new ArrayList<OptionalInt>(IntensityHistogram.N_BINS);
		for (int i = 0; i < IntensityHistogram.N_BINS; i++)
			list.add(get(i));
		return Collections.unmodifiableList(list);
	}

	@Override
	public int hashCode() {
		return Arrays.hashCode(mapped);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof IntensityMapping other))
			return false;
		return Arrays.equals(mapped, other.mapped);
	}

	@Override
	public String toString() {
		return "IntensityMapping [mapped=" + mapped.length + "]";
	}

}
