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
 * Geometry of vertical sections, in which each column j is bounded
 * horizontally by {@code y[j]} and {@code y[j+1]} and each cell (k, j) lies
 * between the interface elevations {@code z[k][j]} and {@code z[k+1][j]}.
 */
public class SectionGeometry {

	private SectionGeometry() {
	}

	/**
	 * Resolves the horizontal corner positions of a section. A vector with one
	 * value per column is taken as cell centers and expanded; a vector one
	 * longer is taken as corners.
	 *
	 * @param y the horizontal coordinate
	 * @param nColumns the number of section columns (nj)
	 * @return the nj+1 corner positions
	 * @throws ShapeMismatchException if y fits neither centers nor corners
	 */
	public static double[] cornerPositions(final double[] y, final int nColumns) {
		if (y == null)
			return GridUtils.indices(nColumns);
		if (y.length == nColumns)
			return CoordinateExpander.expand(y);
		if (y.length == nColumns + 1)
			return y.clone();
		throw new ShapeMismatchException("Length of y coordinate should be equal or 1 longer than horizontal length of z ("
				+ nColumns + ") but is " + y.length);
	}

	/**
	 * Calculates the weights to use for statistics of a section: the area of
	 * each cell in the (y, z) plane. Column widths and layer thicknesses are
	 * absolute, so y may decrease along the section and z may hold either
	 * elevations or depths.
	 *
	 * @param y the nj+1 column edge positions
	 * @param z the (nk+1, nj) interface positions, from top to bottom
	 * @return the (nk, nj) cell weights
	 */
	public static double[][] weights(final double[] y, final double[][] z) {
		GridUtils.requireRectangular(z, "Interface elevations");
		final int nk = z.length - 1;
		final int nj = z[0].length;
		if (nk < 1)
			throw new IllegalArgumentException("At least two interfaces are required");
		if (y == null || y.length != nj + 1)
			throw new ShapeMismatchException("Column edges must have " + (nj + 1) + " values");
		final double[][] w = new double[nk][nj];
		for (int k = 0; k < nk; k++) {
			for (int j = 0; j < nj; j++) {
				w[k][j] = Math.abs(y[j + 1] - y[j]) * Math.abs(z[k][j] - z[k + 1][j]);
			}
		}
		return w;
	}

	/**
	 * Builds the corner coordinates of a section mesh. Column edges are
	 * replicated over all interfaces; interface elevations, given per column,
	 * are expanded to the column edges.
	 *
	 * @param yCorners the nj+1 column edge positions
	 * @param z the (nk+1, nj) interface elevations
	 * @return the (nk+1, nj+1) corners
	 */
	public static CornerCoordinates corners(final double[] yCorners, final double[][] z) {
		GridUtils.requireRectangular(z, "Interface elevations");
		if (yCorners == null || yCorners.length != z[0].length + 1)
			throw new ShapeMismatchException("Column edges must have " + (z[0].length + 1) + " values");
		final double[][] zCorners = (z[0].length == 1) ? widen(z) : CoordinateExpander.expandI(z);
		return new CornerCoordinates(GridUtils.repeatRows(yCorners, z.length), zCorners);
	}

	/* a single column has flat interfaces */
	private static double[][] widen(final double[][] z) {
		final double[][] b = new double[z.length][2];
		for (int k = 0; k < z.length; k++) {
			b[k][0] = z[k][0];
			b[k][1] = z[k][0];
		}
		return b;
	}
}
