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

/**
 * Thrown when the combination of bin count, color limits and level steps is
 * insufficient or ambiguous, e.g., a (min, max) range without a bin count, or
 * explicit levels together with a bin count.
 */
public class InvalidLevelSpecException extends IllegalArgumentException {

	private static final long serialVersionUID = 1L;

	public InvalidLevelSpecException(final String message) {
		super(message);
	}

}
