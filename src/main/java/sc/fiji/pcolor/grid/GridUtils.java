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

import java.util.Arrays;

/**
 * Static utilities for rectangular 2D arrays
 */
public class GridUtils {

	private GridUtils() {
	}

	/**
	 * @param a a rectangular 2D array
	 * @return the {rows, columns} shape of the array
	 */
	public static int[] shape(final double[][] a) {
		return new int[] { a.length, (a.length == 0) ? 0 : a[0].length };
	}

	public static boolean sameShape(final double[][] a, final double[][] b) {
		return a.length == b.length && (a.length == 0 || a[0].length == b[0].length);
	}

	public static boolean hasShape(final double[][] a, final int rows, final int columns) {
		return a.length == rows && (rows == 0 || a[0].length == columns);
	}

	/**
	 * Checks that an array is non-empty and that all its rows have the same
	 * length.
	 *
	 * @param a the array to validate
	 * @param what a description of the array for the error message
	 * @throws IllegalArgumentException if the array is null, empty or ragged
	 */
	public static void requireRectangular(final double[][] a, final String what) {
		if (a == null || a.length == 0 || a[0] == null || a[0].length == 0)
			throw new IllegalArgumentException(what + " cannot be null or empty");
		for (final double[] row : a) {
			if (row == null || row.length != a[0].length)
				throw new IllegalArgumentException(what + " must be rectangular");
		}
	}

	public static double[][] copy(final double[][] a) {
		final double[][] b = new double[a.length][];
		for (int j = 0; j < a.length; j++)
			b[j] = a[j].clone();
		return b;
	}

	/**
	 * Replicates a vector as every row of a new 2D array.
	 *
	 * @param v the row vector
	 * @param rows the number of rows
	 * @return a (rows, v.length) array
	 */
	public static double[][] repeatRows(final double[] v, final int rows) {
		final double[][] b = new double[rows][];
		for (int j = 0; j < rows; j++)
			b[j] = v.clone();
		return b;
	}

	/**
	 * Replicates a vector as every column of a new 2D array.
	 *
	 * @param v the column vector
	 * @param columns the number of columns
	 * @return a (v.length, columns) array
	 */
	public static double[][] repeatColumns(final double[] v, final int columns) {
		final double[][] b = new double[v.length][columns];
		for (int j = 0; j < v.length; j++)
			Arrays.fill(b[j], v[j]);
		return b;
	}

	/**
	 * @param n the number of cells
	 * @return the integer corner positions {0, 1, ..., n}
	 */
	public static double[] indices(final int n) {
		final double[] v = new double[n + 1];
		for (int i = 0; i <= n; i++)
			v[i] = i;
		return v;
	}

}
