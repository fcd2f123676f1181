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

package sc.fiji.pcolor.grid;

/**
 * Axis limits computed from the perimeter of a coordinate array only.
 * <p>
 * Interior values of curvilinear meshes (e.g., singular coordinates near a
 * pole) do not affect the limits.
 * </p>
 */
public class BoundaryExtent {

	private BoundaryExtent() {
	}

	/**
	 * Returns the minimum and maximum of a 2D array restricted to its edges:
	 * the top row, the right column below it, the bottom row left of the right
	 * column and the left column between top and bottom rows. Every perimeter
	 * cell is visited once.
	 *
	 * @param a a rectangular 2D array (typically corner coordinates)
	 * @return the perimeter extent
	 */
	public static Extent minMax(final double[][] a) {
		GridUtils.requireRectangular(a, "Coordinate array");
		final int last = a.length - 1;
		final int lastCol = a[0].length - 1;
		double min = Double.POSITIVE_INFINITY;
		double max = Double.NEGATIVE_INFINITY;
		for (int i = 0; i <= lastCol; i++) { // top row
			min = Math.min(min, a[0][i]);
			max = Math.max(max, a[0][i]);
		}
		for (int j = 1; j <= last; j++) { // right column
			min = Math.min(min, a[j][lastCol]);
			max = Math.max(max, a[j][lastCol]);
		}
		if (last > 0) {
			for (int i = 0; i < lastCol; i++) { // bottom row
				min = Math.min(min, a[last][i]);
				max = Math.max(max, a[last][i]);
			}
		}
		if (lastCol > 0) {
			for (int j = 1; j < last; j++) { // left column
				min = Math.min(min, a[j][0]);
				max = Math.max(max, a[j][0]);
			}
		}
		return new Extent(min, max);
	}

	/**
	 * Returns the minimum and maximum of a coordinate vector.
	 *
	 * @param v the vector
	 * @return the extent of all its values
	 */
	public static Extent minMax(final double[] v) {
		if (v == null || v.length == 0)
			throw new IllegalArgumentException("Coordinate vector cannot be null or empty");
		double min = Double.POSITIVE_INFINITY;
		double max = Double.NEGATIVE_INFINITY;
		for (final double value : v) {
			min = Math.min(min, value);
			max = Math.max(max, value);
		}
		return new Extent(min, max);
	}

	/**
	 * Lower and upper limits of an axis.
	 *
	 * @param min the lower limit
	 * @param max the upper limit
	 */
	public record Extent(double min, double max) {

		/** @return max - min */
		public double span() {
			return max - min;
		}

		public double[] toArray() {
			return new double[] { min, max };
		}
	}
}
