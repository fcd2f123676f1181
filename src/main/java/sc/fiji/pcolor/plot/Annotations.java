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

import sc.fiji.pcolor.PColorUtils;
import sc.fiji.pcolor.analysis.FieldSummary;

/**
 * The statistics text placed around a panel. Numbers use five significant
 * digits.
 *
 * @param extremes the "max=…\nmin=…" text
 * @param moments the "mean=…\nrms=…" text, if moments were computed
 * @param std the " sd=…\n" text, if moments were computed
 */
public record Annotations(String extremes, Optional<String> moments, Optional<String> std) {

	private static final int DIGITS = 5;

	public static Annotations of(final FieldSummary summary) {
		final String extremes = "max=" + format(summary.max()) + "\nmin=" + format(summary.min());
		if (!summary.hasMoments())
			return new Annotations(extremes, Optional.empty(), Optional.empty());
		final FieldSummary.Moments m = summary.moments().get();
		return new Annotations(extremes, //
				Optional.of("mean=" + format(m.mean()) + "\nrms=" + format(m.rms())), //
				Optional.of(" sd=" + format(m.std()) + "\n"));
	}

	/**
	 * @param r the correlation between the two fields of a comparison
	 * @return the " r(A,B)=…\n" text
	 */
	public static String correlation(final double r) {
		return " r(A,B)=" + format(r) + "\n";
	}

	static String format(final double value) {
		return PColorUtils.formatSignificant(value, DIGITS);
	}
}
