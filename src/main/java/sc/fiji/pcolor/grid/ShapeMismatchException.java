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
 * Thrown when two arrays that must describe the same grid (coordinates, fields,
 * area weights) have incompatible shapes.
 */
public class ShapeMismatchException extends IllegalArgumentException {

	private static final long serialVersionUID = 1L;

	public ShapeMismatchException(final String message) {
		super(message);
	}

	public ShapeMismatchException(final String what, final int[] expected, final int[] actual) {
		super(what + ": expected shape " + Arrays.toString(expected) + " but got " + Arrays.toString(actual));
	}

}
