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

import java.util.Optional;
import java.util.OptionalDouble;

/**
 * The three panels of a comparison of two fields: A and B on a shared color
 * scale, and their difference A - B on its own scale.
 *
 * @param a the first field
 * @param b the second field
 * @param difference the A - B panel
 * @param correlation the area-weighted correlation of A and B. Empty when no
 *          cell areas were given, NaN when undefined.
 */
public record ComparisonSpec(PanelSpec a, PanelSpec b, PanelSpec difference, OptionalDouble correlation) {

	/** @return the " r(A,B)=…\n" text, if a correlation was computed */
	public Optional<String> correlationText() {
		if (correlation.isEmpty()) return Optional.empty();
		return Optional.of(Annotations.correlation(correlation.getAsDouble()));
	}
}
