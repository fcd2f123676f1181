/*-
 * #%L
 * Fiji distribution of ImageJ for the life sciences.
 * %%
 * Copyright (C) 2010 - 2026 Fiji developers.
 * %%
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/gpl-3.0.html>.
 * #L%
 */

package sc.fiji.pcolor.analysis;

import java.util.Locale;

/**
 * Whether a discrete color scale reserves a color for values below its lowest
 * level, above its highest level, both, or neither.
 */
public enum Extend {

	NONE("neither"), MIN("min"), MAX("max"), BOTH("both");

	private final String label;

	Extend(final String label) {
		this.label = label;
	}

	public boolean includesMin() {
		return this == MIN || this == BOTH;
	}

	public boolean includesMax() {
		return this == MAX || this == BOTH;
	}

	/** @return the number of colors reserved beyond the levels (0, 1 or 2) */
	public int extraColors() {
		return (includesMin() ? 1 : 0) + (includesMax() ? 1 : 0);
	}

	public static Extend of(final boolean min, final boolean max) {
		if (min && max) return BOTH;
		if (min) return MIN;
		if (max) return MAX;
		return NONE;
	}

	/**
	 * Parses an extend keyword.
	 *
	 * @param string one of "none", "neither", "min", "max" or "both" (case
	 *          insensitive)
	 * @return the parsed constant
	 * @throws IllegalArgumentException if string is not recognized
	 */
	public static Extend fromString(final String string) {
		if (string == null)
			throw new IllegalArgumentException("Extend keyword cannot be null");
		switch (string.trim().toLowerCase(Locale.ROOT)) {
			case "none":
			case "neither":
				return NONE;
			case "min":
				return MIN;
			case "max":
				return MAX;
			case "both":
				return BOTH;
			default:
				throw new IllegalArgumentException("Unrecognized extend option: " + string);
		}
	}

	@Override
	public String toString() {
		return label;
	}
}
