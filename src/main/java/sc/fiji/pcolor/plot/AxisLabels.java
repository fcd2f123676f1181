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

package sc.fiji.pcolor.plot;

/**
 * The label and units of a plot axis.
 *
 * @param label the axis label
 * @param units the axis units (empty if dimensionless)
 */
public record AxisLabels(String label, String units) {

	public AxisLabels {
		if (label == null) label = "";
		if (units == null) units = "";
	}

	/**
	 * Resolves the labels of the horizontal axis of a map. Without a coordinate
	 * the axis shows cell indices.
	 */
	public static AxisLabels x(final boolean hasCoordinate, final String label, final String units) {
		return resolve(hasCoordinate, label, units, "i", "Longitude", "°E");
	}

	/**
	 * Resolves the labels of the vertical axis of a map, or of the horizontal
	 * axis of a section.
	 */
	public static AxisLabels y(final boolean hasCoordinate, final String label, final String units) {
		return resolve(hasCoordinate, label, units, "j", "Latitude", "°N");
	}

	/** Resolves the labels of the vertical axis of a section. */
	public static AxisLabels z(final boolean hasCoordinate, final String label, final String units) {
		if (hasCoordinate)
			return new AxisLabels((label == null) ? "Elevation" : label, (units == null) ? "m" : units);
		return new AxisLabels((label == null) ? "k" : label, (units == null) ? "" : units);
	}

	private static AxisLabels resolve(final boolean hasCoordinate, final String label, final String units,
			final String indexLabel, final String coordLabel, final String coordUnits) {
		if (hasCoordinate)
			return new AxisLabels((label == null) ? coordLabel : label, (units == null) ? coordUnits : units);
		return new AxisLabels((label == null) ? indexLabel : label, (units == null) ? "" : units);
	}

	/**
	 * Combines a label and its units in the form "label [units]".
	 *
	 * @param label the label
	 * @param units the units. Omitted if empty.
	 * @return the combined string
	 */
	public static String label(final String label, final String units) {
		final String string = (label == null) ? "" : label;
		if (units == null || units.isEmpty()) return string;
		return string + " [" + units + "]";
	}

	/** @return true if the axis should not be labelled */
	public boolean isEmpty() {
		return label.isEmpty() && units.isEmpty();
	}

	/** @return the axis title, e.g., "Latitude [°N]" */
	public String text() {
		return label(label, units);
	}
}
