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

import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.Variance;

import sc.fiji.pcolor.PColorUtils;
import sc.fiji.pcolor.grid.Field;

/**
 * Computes masked, area-weighted descriptive statistics of a field.
 * <p>
 * Invalid (no-data) cells never contribute: they are excluded from the
 * extremes and carry no area in the weighted moments. With weights
 * {@code w} (the cell areas of valid cells):
 * </p>
 * <ul>
 * <li>{@code mean = Σ(w·f) / Σw}</li>
 * <li>{@code std = sqrt(Σ(w·(f-mean)²) / Σw)}</li>
 * <li>{@code rms = sqrt(Σ(w·f²) / Σw)}</li>
 * </ul>
 *
 * @see FieldSummary
 */
public class FieldStatistics {

	private FieldStatistics() {
	}

	/**
	 * Computes the extremes of a field. Moments are not computed.
	 *
	 * @param field the field
	 * @return the summary, without moments
	 */
	public static FieldSummary summarize(final Field field) {
		return summarize(field, null);
	}

	/**
	 * Computes the statistics of a field.
	 *
	 * @param field the field
	 * @param area the (nj, ni) cell areas. If null, only min and max are
	 *          computed.
	 * @return the summary
	 * @throws sc.fiji.pcolor.grid.ShapeMismatchException if area does not match
	 *           the field
	 * @throws DegenerateWeightsException if the valid cells have no area
	 * @throws IllegalArgumentException if the area of a valid cell is negative
	 *           or not finite
	 */
	public static FieldSummary summarize(final Field field, final double[][] area) {
		if (field == null)
			throw new IllegalArgumentException("Field cannot be null");
		final double[] values = field.validValues();
		final double min = (values.length == 0) ? Double.NaN : StatUtils.min(values);
		final double max = (values.length == 0) ? Double.NaN : StatUtils.max(values);
		if (area == null)
			return FieldSummary.unweighted(min, max);

		final double[] weights = validWeights(field, area);
		final double sumArea = StatUtils.sum(weights);
		PColorUtils.log("summarize: sum(area) = " + sumArea + " after masking " + (field.nj() * field.ni()
				- field.validCount()) + " cell(s)");
		if (!(sumArea > 0))
			throw new DegenerateWeightsException("Total area of valid cells is zero");

		final double mean = new Mean().evaluate(values, weights);
		final double std = Math.sqrt(new Variance(false).evaluate(values, weights, mean));
		final double[] squares = new double[values.length];
		for (int k = 0; k < values.length; k++)
			squares[k] = values[k] * values[k];
		final double rms = Math.sqrt(new Mean().evaluate(squares, weights));
		PColorUtils.log("summarize: mean = " + mean + ", std = " + std + ", rms = " + rms);
		return new FieldSummary(min, max, Optional.of(new FieldSummary.Moments(mean, std, rms, sumArea)));
	}

	/**
	 * Extracts the areas of valid cells, in the order of
	 * {@link Field#validValues()}.
	 */
	static double[] validWeights(final Field field, final double[][] area) {
		field.requireSameShape(area, "Area");
		final double[] weights = new double[field.validCount()];
		int idx = 0;
		for (int j = 0; j < field.nj(); j++) {
			for (int i = 0; i < field.ni(); i++) {
				if (!field.isValid(j, i)) continue;
				final double w = area[j][i];
				if (!(w >= 0) || Double.isInfinite(w))
					throw new IllegalArgumentException("Invalid area at (" + j + ", " + i + "): " + w);
				weights[idx++] = w;
			}
		}
		return weights;
	}
}
