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

import sc.fiji.pcolor.grid.Field;

/**
 * Area-weighted Pearson correlation between two fields.
 * <p>
 * A field with zero weighted variance has no defined correlation with
 * anything: the coefficient is then {@link #UNDEFINED} ({@code NaN}).
 * </p>
 */
public class FieldCorrelation {

	/** The value returned when either field has zero weighted variance */
	public static final double UNDEFINED = Double.NaN;

	private FieldCorrelation() {
	}

	/**
	 * Checks whether a correlation coefficient is the {@link #UNDEFINED} value.
	 *
	 * @param r the coefficient
	 * @return true if r is undefined
	 */
	public static boolean isUndefined(final double r) {
		return Double.isNaN(r);
	}

	/**
	 * Correlates two fields after removing each field's own area-weighted mean.
	 *
	 * @param field1 the first field
	 * @param field2 the second field
	 * @param area the (nj, ni) cell areas
	 * @return the correlation coefficient, or {@link #UNDEFINED}
	 */
	public static double correlate(final Field field1, final Field field2, final double[][] area) {
		if (area == null)
			throw new IllegalArgumentException("Correlation requires cell areas");
		field1.requireSameShape(field2);
		final double mean1 = FieldStatistics.summarize(field1, area).mean().getAsDouble();
		final double mean2 = FieldStatistics.summarize(field2, area).mean().getAsDouble();
		return correlation(field1.minus(mean1), field2.minus(mean2), area);
	}

	/**
	 * Computes the correlation coefficient of two de-meaned fields.
	 * <p>
	 * Weights are the cell areas, zeroed where {@code s1} holds no data. Terms
	 * involving cells where {@code s2} holds no data are skipped.
	 * </p>
	 *
	 * @param s1 the first field, with its mean already subtracted
	 * @param s2 the second field, with its mean already subtracted
	 * @param area the (nj, ni) cell areas
	 * @return the coefficient, in [-1, 1], or {@link #UNDEFINED} if either
	 *         field has zero weighted variance
	 * @throws sc.fiji.pcolor.grid.ShapeMismatchException if shapes differ
	 * @throws DegenerateWeightsException if the valid cells of s1 have no area
	 */
	public static double correlation(final Field s1, final Field s2, final double[][] area) {
		if (s1 == null || s2 == null)
			throw new IllegalArgumentException("Fields cannot be null");
		s1.requireSameShape(s2);
		s1.requireSameShape(area, "Area");
		double sumArea = 0;
		double sum11 = 0;
		double sum22 = 0;
		double sum12 = 0;
		for (int j = 0; j < s1.nj(); j++) {
			for (int i = 0; i < s1.ni(); i++) {
				if (!s1.isValid(j, i)) continue;
				final double w = area[j][i];
				final double a = s1.get(j, i);
				sumArea += w;
				sum11 += w * a * a;
				if (!s2.isValid(j, i)) continue;
				final double b = s2.get(j, i);
				sum22 += w * b * b;
				sum12 += w * a * b;
			}
		}
		if (!(sumArea > 0))
			throw new DegenerateWeightsException("Total area of valid cells is zero");
		final double v1 = sum11 / sumArea;
		final double v2 = sum22 / sumArea;
		if (v1 == 0 || v2 == 0) return UNDEFINED;
		return (sum12 / sumArea) / Math.sqrt(v1 * v2);
	}
}
