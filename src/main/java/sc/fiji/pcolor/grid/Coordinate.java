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
 * A coordinate axis of a field: either a vector shared by all rows (or
 * columns) of the grid, or a full 2D array, as found on curvilinear meshes.
 * Values may describe cell centers or cell corners; {@link CoordinateExpander}
 * tells them apart from their shape.
 */
public final class Coordinate {

	private final double[] vector;
	private final double[][] array;

	private Coordinate(final double[] vector, final double[][] array) {
		this.vector = vector;
		this.array = array;
	}

	public static Coordinate of(final double[] vector) {
		if (vector == null || vector.length == 0)
			throw new IllegalArgumentException("Coordinate vector cannot be null or empty");
		return new Coordinate(vector.clone(), null);
	}

	public static Coordinate of(final double[][] array) {
		GridUtils.requireRectangular(array, "Coordinate array");
		return new Coordinate(null, GridUtils.copy(array));
	}

	/** @return true if this is a 1D coordinate */
	public boolean isVector() {
		return vector != null;
	}

	/** @return a copy of the 1D values */
	public double[] vector() {
		if (!isVector())
			throw new IllegalStateException("Not a 1D coordinate");
		return vector.clone();
	}

	/** @return a copy of the 2D values */
	public double[][] array() {
		if (isVector())
			throw new IllegalStateException("Not a 2D coordinate");
		return GridUtils.copy(array);
	}

	@Override
	public String toString() {
		return isVector() ? "Coordinate[" + vector.length + "]"
				: "Coordinate[" + array.length + "x" + array[0].length + "]";
	}
}
