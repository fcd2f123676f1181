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

import sc.fiji.pcolor.PColorUtils;

/**
 * Converts cell-center coordinates into the cell-corner coordinates required to
 * render a field as a mesh of quadrilaterals.
 * <p>
 * Interior corners are the average of the two adjacent centers. The first and
 * last corners are extrapolated by reflecting the adjacent interior gap
 * outwards: {@code edge + 0.5 * (edge - next)}. Inputs are never modified.
 * </p>
 */
public class CoordinateExpander {

	private CoordinateExpander() {
	}

	/**
	 * Builds corner coordinates for a field.
	 *
	 * @param field the field
	 * @param x the x coordinate (1D or 2D, centers or corners). Index
	 *          coordinates are used if null.
	 * @param y the y coordinate (1D or 2D, centers or corners). Index
	 *          coordinates are used if null.
	 * @return the (nj+1, ni+1) corner coordinates
	 * @see #toCorners(int, int, Coordinate, Coordinate)
	 */
	public static CornerCoordinates toCorners(final Field field, final Coordinate x, final Coordinate y) {
		return toCorners(field.nj(), field.ni(), x, y);
	}

	/**
	 * Builds corner coordinates for a field of shape (nj, ni).
	 * <p>
	 * A missing coordinate becomes the integer corner positions {@code 0..n}.
	 * A 1D coordinate with one value per cell is expanded on its own, and a 1D
	 * coordinate one longer is taken as corners; x is then replicated over the
	 * rows and y over the columns. A 2D coordinate with the field's shape is
	 * taken as cell centers and expanded by one row and one column; one larger
	 * than the field in each dimension it is taken as corners.
	 * </p>
	 *
	 * @param nj the number of field rows
	 * @param ni the number of field columns
	 * @param x the x coordinate or null
	 * @param y the y coordinate or null
	 * @return the (nj+1, ni+1) corner coordinates
	 * @throws ShapeMismatchException if x and y disagree, or if they match neither
	 *           the centers nor the corners of the field
	 */
	public static CornerCoordinates toCorners(final int nj, final int ni, final Coordinate x, final Coordinate y) {
		if (nj < 1 || ni < 1)
			throw new IllegalArgumentException("Field dimensions must be positive");
		if (x != null && y != null && !x.isVector() && !y.isVector() && !GridUtils.sameShape(x.array(), y.array()))
			throw new ShapeMismatchException("The shape of coordinates are mismatched", GridUtils.shape(x.array()),
					GridUtils.shape(y.array()));

		final double[][] xCorners;
		if (x == null) {
			xCorners = GridUtils.repeatRows(GridUtils.indices(ni), nj + 1);
		} else if (x.isVector()) {
			xCorners = GridUtils.repeatRows(vectorCorners(x.vector(), ni, "x"), nj + 1);
		} else {
			xCorners = arrayCorners(x.array(), nj, ni);
		}
		final double[][] yCorners;
		if (y == null) {
			yCorners = GridUtils.repeatColumns(GridUtils.indices(nj), ni + 1);
		} else if (y.isVector()) {
			yCorners = GridUtils.repeatColumns(vectorCorners(y.vector(), nj, "y"), ni + 1);
		} else {
			yCorners = arrayCorners(y.array(), nj, ni);
		}
		return new CornerCoordinates(xCorners, yCorners);
	}

	/* n centers are expanded, n+1 corners are copied */
	private static double[] vectorCorners(final double[] v, final int n, final String name) {
		if (v.length == n)
			return expand(v);
		if (v.length == n + 1)
			return v.clone();
		throw new ShapeMismatchException("Length of " + name + " coordinate should be " + n + " (centers) or "
				+ (n + 1) + " (corners) but is " + v.length);
	}

	private static double[][] arrayCorners(final double[][] a, final int nj, final int ni) {
		if (GridUtils.hasShape(a, nj, ni)) {
			PColorUtils.log("Expanding " + nj + "x" + ni + " center coordinates to corners");
			return expandJ(expandI(a));
		}
		if (GridUtils.hasShape(a, nj + 1, ni + 1))
			return GridUtils.copy(a);
		throw new ShapeMismatchException("Coordinates fit neither the centers nor the corners of the field",
				new int[] { nj + 1, ni + 1 }, GridUtils.shape(a));
	}

	/**
	 * Expands a vector by one element, averaging the data to the interior
	 * elements and extrapolating the first and last ones.
	 *
	 * @param a the center values (at least 2)
	 * @return the a.length+1 corner values
	 */
	public static double[] expand(final double[] a) {
		if (a == null || a.length < 2)
			throw new IllegalArgumentException("At least two values are required for expansion");
		final int n = a.length;
		final double[] b = new double[n + 1];
		for (int i = 1; i < n; i++)
			b[i] = 0.5 * (a[i - 1] + a[i]);
		b[0] = a[0] + 0.5 * (a[0] - a[1]);
		b[n] = a[n - 1] + 0.5 * (a[n - 1] - a[n - 2]);
		return b;
	}

	/**
	 * Expands a 2D array by one column.
	 *
	 * @param a an (nj, ni) array with ni &gt;= 2
	 * @return an (nj, ni+1) array
	 */
	public static double[][] expandI(final double[][] a) {
		GridUtils.requireRectangular(a, "Array");
		final double[][] b = new double[a.length][];
		for (int j = 0; j < a.length; j++)
			b[j] = expand(a[j]);
		return b;
	}

	/**
	 * Expands a 2D array by one row.
	 *
	 * @param a an (nj, ni) array with nj &gt;= 2
	 * @return an (nj+1, ni) array
	 */
	public static double[][] expandJ(final double[][] a) {
		GridUtils.requireRectangular(a, "Array");
		final int nj = a.length;
		final int ni = a[0].length;
		if (nj < 2)
			throw new IllegalArgumentException("At least two rows are required for expansion");
		final double[][] b = new double[nj + 1][ni];
		for (int i = 0; i < ni; i++) {
			for (int j = 1; j < nj; j++)
				b[j][i] = 0.5 * (a[j - 1][i] + a[j][i]);
			b[0][i] = a[0][i] + 0.5 * (a[0][i] - a[1][i]);
			b[nj][i] = a[nj - 1][i] + 0.5 * (a[nj - 1][i] - a[nj - 2][i]);
		}
		return b;
	}

}
