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

import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.RealType;
import net.imglib2.view.Views;

/**
 * An immutable 2D scalar field of shape (nj, ni) paired with a validity mask.
 * <p>
 * Missing data ("no data", e.g., land in an ocean field) is recorded once, in
 * the mask, when the field is created. Computations consult only the mask.
 * NaN entries are always considered invalid.
 * </p>
 */
public final class Field {

	private final double[][] values;
	private final boolean[][] valid;
	private final int nj;
	private final int ni;
	private final int validCount;

	private Field(final double[][] values, final boolean[][] valid) {
		this.values = values;
		this.valid = valid;
		this.nj = values.length;
		this.ni = values[0].length;
		int count = 0;
		for (int j = 0; j < nj; j++) {
			for (int i = 0; i < ni; i++) {
				if (Double.isNaN(values[j][i])) valid[j][i] = false;
				if (valid[j][i]) count++;
			}
		}
		this.validCount = count;
	}

	/**
	 * Creates a field in which every non-NaN entry is valid.
	 *
	 * @param values the (nj, ni) data
	 * @return the field
	 */
	public static Field of(final double[][] values) {
		return of(values, null);
	}

	/**
	 * Creates a field, masking entries equal to an ignore value.
	 *
	 * @param values the (nj, ni) data
	 * @param ignoreValue the no-data sentinel. Ignored if null.
	 * @return the field
	 */
	public static Field of(final double[][] values, final Double ignoreValue) {
		GridUtils.requireRectangular(values, "Field values");
		final double[][] copy = GridUtils.copy(values);
		final boolean[][] mask = new boolean[copy.length][copy[0].length];
		for (int j = 0; j < copy.length; j++) {
			for (int i = 0; i < copy[0].length; i++) {
				mask[j][i] = ignoreValue == null || copy[j][i] != ignoreValue;
			}
		}
		return new Field(copy, mask);
	}

	/**
	 * Creates a field from data and an explicit validity mask.
	 *
	 * @param values the (nj, ni) data
	 * @param validMask true where data is present, same shape as values
	 * @return the field
	 * @throws ShapeMismatchException if the mask does not match the data
	 */
	public static Field masked(final double[][] values, final boolean[][] validMask) {
		GridUtils.requireRectangular(values, "Field values");
		if (validMask == null)
			throw new IllegalArgumentException("Mask cannot be null");
		final int[] shape = GridUtils.shape(values);
		if (validMask.length != shape[0])
			throw new ShapeMismatchException("Mask has " + validMask.length + " rows, field has " + shape[0]);
		final boolean[][] mask = new boolean[shape[0]][];
		for (int j = 0; j < shape[0]; j++) {
			if (validMask[j] == null || validMask[j].length != shape[1])
				throw new ShapeMismatchException("Mask row " + j + " has the wrong length");
			mask[j] = validMask[j].clone();
		}
		return new Field(GridUtils.copy(values), mask);
	}

	/**
	 * Reads a 2D image into a field. Dimension 0 of the image is taken as i
	 * (columns) and dimension 1 as j (rows).
	 *
	 * @param img the 2D image
	 * @param ignoreValue the no-data sentinel. Ignored if null.
	 * @param <T> the pixel type
	 * @return the field
	 */
	public static <T extends RealType<T>> Field fromImg(final RandomAccessibleInterval<T> img,
			final Double ignoreValue) {
		if (img == null || img.numDimensions() != 2)
			throw new IllegalArgumentException("A 2D image is required");
		final int ni = (int) img.dimension(0);
		final int nj = (int) img.dimension(1);
		final double[][] values = new double[nj][ni];
		final Cursor<T> cursor = Views.flatIterable(img).cursor();
		for (int j = 0; j < nj; j++) {
			for (int i = 0; i < ni; i++) {
				values[j][i] = cursor.next().getRealDouble();
			}
		}
		return of(values, ignoreValue);
	}

	/** @return the number of rows */
	public int nj() {
		return nj;
	}

	/** @return the number of columns */
	public int ni() {
		return ni;
	}

	/** @return the {nj, ni} shape */
	public int[] shape() {
		return new int[] { nj, ni };
	}

	public double get(final int j, final int i) {
		return values[j][i];
	}

	public boolean isValid(final int j, final int i) {
		return valid[j][i];
	}

	/** @return the number of cells holding data */
	public int validCount() {
		return validCount;
	}

	/** @return true if at least one cell holds no data */
	public boolean hasInvalid() {
		return validCount < nj * ni;
	}

	/** @return a copy of the raw values, invalid cells included */
	public double[][] values() {
		return GridUtils.copy(values);
	}

	/** @return a copy of the validity mask */
	public boolean[][] validityMask() {
		final boolean[][] copy = new boolean[nj][];
		for (int j = 0; j < nj; j++)
			copy[j] = valid[j].clone();
		return copy;
	}

	/** @return the valid values in row-major order */
	public double[] validValues() {
		final double[] v = new double[validCount];
		int idx = 0;
		for (int j = 0; j < nj; j++) {
			for (int i = 0; i < ni; i++) {
				if (valid[j][i]) v[idx++] = values[j][i];
			}
		}
		return v;
	}

	/**
	 * Subtracts another field. The difference is valid where both are valid.
	 *
	 * @param other the field to subtract
	 * @return this - other
	 * @throws ShapeMismatchException if shapes differ
	 */
	public Field minus(final Field other) {
		requireSameShape(other);
		final double[][] diff = new double[nj][ni];
		final boolean[][] mask = new boolean[nj][ni];
		for (int j = 0; j < nj; j++) {
			for (int i = 0; i < ni; i++) {
				diff[j][i] = values[j][i] - other.values[j][i];
				mask[j][i] = valid[j][i] && other.valid[j][i];
			}
		}
		return new Field(diff, mask);
	}

	/**
	 * Subtracts a constant (e.g., the field's mean). The mask is preserved.
	 *
	 * @param value the constant
	 * @return this - value
	 */
	public Field minus(final double value) {
		final double[][] diff = new double[nj][ni];
		for (int j = 0; j < nj; j++) {
			for (int i = 0; i < ni; i++) {
				diff[j][i] = values[j][i] - value;
			}
		}
		return new Field(diff, validityMask());
	}

	/** @return the negated field. The mask is preserved. */
	public Field negate() {
		return scale(-1d);
	}

	private Field scale(final double factor) {
		final double[][] scaled = new double[nj][ni];
		for (int j = 0; j < nj; j++) {
			for (int i = 0; i < ni; i++) {
				scaled[j][i] = values[j][i] * factor;
			}
		}
		return new Field(scaled, validityMask());
	}

	public boolean hasShape(final int rows, final int columns) {
		return nj == rows && ni == columns;
	}

	public void requireSameShape(final Field other) {
		if (other == null)
			throw new IllegalArgumentException("Field cannot be null");
		if (!other.hasShape(nj, ni))
			throw new ShapeMismatchException("Field", shape(), other.shape());
	}

	/**
	 * Checks that an auxiliary array (e.g., cell areas) matches this field.
	 *
	 * @param a the array
	 * @param what a description of the array for the error message
	 * @throws ShapeMismatchException if shapes differ
	 */
	public void requireSameShape(final double[][] a, final String what) {
		GridUtils.requireRectangular(a, what);
		if (!GridUtils.hasShape(a, nj, ni))
			throw new ShapeMismatchException(what, shape(), GridUtils.shape(a));
	}
}
