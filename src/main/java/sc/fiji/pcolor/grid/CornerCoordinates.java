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
 * Cell-corner coordinates of a quadrilateral mesh: two 2D arrays of identical
 * shape (nj+1, ni+1) surrounding an (nj, ni) field.
 *
 * @param x the x-coordinate of each corner
 * @param y the y-coordinate of each corner
 */
public record CornerCoordinates(double[][] x, double[][] y) {

	public CornerCoordinates {
		if (x == null || y == null)
			throw new IllegalArgumentException("Corner coordinates cannot be null");
		if (!GridUtils.sameShape(x, y))
			throw new ShapeMismatchException("y corners", GridUtils.shape(x), GridUtils.shape(y));
	}

	/** @return the number of corner rows (nj+1) */
	public int rows() {
		return x.length;
	}

	/** @return the number of corner columns (ni+1) */
	public int columns() {
		return x[0].length;
	}

	/** @return the axis limits of x, taken from the mesh perimeter */
	public BoundaryExtent.Extent xExtent() {
		return BoundaryExtent.minMax(x);
	}

	/** @return the axis limits of y, taken from the mesh perimeter */
	public BoundaryExtent.Extent yExtent() {
		return BoundaryExtent.minMax(y);
	}
}
