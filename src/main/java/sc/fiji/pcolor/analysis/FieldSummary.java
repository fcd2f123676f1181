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

import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Descriptive statistics of a field.
 * <p>
 * The extremes are always available. Mean, standard deviation and
 * root-mean-square are area-weighted and therefore only computed when cell
 * areas are known: without them {@link #moments()} is empty, which is not to
 * be confused with a zero or NaN result.
 * </p>
 *
 * @param min the smallest valid value (NaN if the field holds no data)
 * @param max the largest valid value (NaN if the field holds no data)
 * @param moments the area-weighted moments, if computed
 */
public record FieldSummary(double min, double max, Optional<Moments> moments) {

	public FieldSummary {
		if (moments == null)
			throw new IllegalArgumentException("moments cannot be null: use Optional.empty()");
	}

	static FieldSummary unweighted(final double min, final double max) {
		return new FieldSummary(min, max, Optional.empty());
	}

	/** @return true if mean, std and rms were computed */
	public boolean hasMoments() {
		return moments.isPresent();
	}

	public OptionalDouble mean() {
		return moments.map(m -> OptionalDouble.of(m.mean())).orElse(OptionalDouble.empty());
	}

	public OptionalDouble std() {
		return moments.map(m -> OptionalDouble.of(m.std())).orElse(OptionalDouble.empty());
	}

	public OptionalDouble rms() {
		return moments.map(m -> OptionalDouble.of(m.rms())).orElse(OptionalDouble.empty());
	}

	/**
	 * Area-weighted moments of a field.
	 *
	 * @param mean the weighted mean
	 * @param std the weighted (population) standard deviation
	 * @param rms the weighted root-mean-square
	 * @param sumArea the total weight of the valid cells
	 */
	public record Moments(double mean, double std, double rms, double sumArea) {
	}
}
