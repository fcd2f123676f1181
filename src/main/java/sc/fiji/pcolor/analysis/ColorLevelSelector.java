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

import java.util.Arrays;

import net.imglib2.display.ColorTable;

import sc.fiji.pcolor.PColorUtils;
import sc.fiji.pcolor.util.ColorMaps;

/**
 * Chooses the discrete color levels of a plot, either from a number of bins
 * (nice levels spanning the data, or a user range) or from an explicit list of
 * levels, and resolves the colors of the bins.
 */
public class ColorLevelSelector {

	/**
	 * The number of bins used when none is given and the levels are not
	 * listed explicitly
	 */
	public static final int DEFAULT_N_BINS = 35;

	private ColorLevelSelector() {
	}

	/**
	 * Chooses color levels.
	 *
	 * @param min the data minimum
	 * @param max the data maximum
	 * @param colormapName the colormap to sample. If null, one is picked with
	 *          {@link ColorMapPicker#pick(double, double)}.
	 * @param nBins the number of bins, or null when limits lists the levels.
	 *          Very few bins may not cover the range (a single bin across
	 *          zero), in which case the uncovered end gets the under or over
	 *          color of the inferred extension.
	 * @param limits null, a {low, high} range (requires nBins), or the explicit
	 *          levels (more than two values, nBins must be null)
	 * @param steps the step multipliers of nice levels, or null for
	 *          {@link NiceLevelLocator#DEFAULT_STEPS}
	 * @param extend the extension of the scale, or null to infer it from how the
	 *          data exceeds the levels
	 * @return the levels and their colors
	 * @throws InvalidLevelSpecException if nBins and limits are inconsistent
	 */
	public static ColorLevels chooseLevels(final double min, final double max, final String colormapName,
			final Integer nBins, final double[] limits, final double[] steps, final Extend extend) {
		final String name = (colormapName == null) ? ColorMapPicker.pick(min, max) : colormapName;
		if (!ColorMaps.isKnown(name))
			throw new IllegalArgumentException("Unknown colormap: " + name);
		final double[] levels = levels(min, max, nBins, limits, steps);
		final Extend resolved = (extend == null) ? resolveExtend(min, max, levels) : extend;
		final int n = levels.length - 1 + resolved.extraColors();
		final DiscreteColorMapper mapper = new DiscreteColorMapper(levels, resolved, ColorMaps.sample(name, n));
		final ColorLevels result = new ColorLevels(levels, resolved, mapper, name);
		PColorUtils.log("chooseLevels: " + result);
		return result;
	}

	/**
	 * Chooses color levels, sampling the bin colors from an arbitrary color
	 * table (e.g., an ImageJ lookup table).
	 *
	 * @see #chooseLevels(double, double, String, Integer, double[], double[],
	 *      Extend)
	 */
	public static ColorLevels chooseLevels(final double min, final double max, final ColorTable colorTable,
			final Integer nBins, final double[] limits, final double[] steps, final Extend extend) {
		if (colorTable == null)
			throw new IllegalArgumentException("colorTable cannot be null");
		final double[] levels = levels(min, max, nBins, limits, steps);
		final Extend resolved = (extend == null) ? resolveExtend(min, max, levels) : extend;
		final int n = levels.length - 1 + resolved.extraColors();
		final DiscreteColorMapper mapper = new DiscreteColorMapper(levels, resolved, ColorMaps.sample(colorTable,
				n));
		return new ColorLevels(levels, resolved, mapper, null);
	}

	/**
	 * Computes the bin edges alone.
	 *
	 * @return the strictly increasing levels
	 * @throws InvalidLevelSpecException if nBins and limits are inconsistent
	 */
	public static double[] levels(final double min, final double max, final Integer nBins, final double[] limits,
			final double[] steps) {
		if (nBins == null && limits == null)
			throw new InvalidLevelSpecException("At least one of nBins or limits must be specified");
		if (limits != null && limits.length < 2)
			throw new InvalidLevelSpecException("limits must have at least two values");
		if (limits != null && limits.length == 2 && nBins == null)
			throw new InvalidLevelSpecException("A range given as limits requires nBins");
		if (limits != null && limits.length > 2 && nBins != null)
			throw new InvalidLevelSpecException(
					"nBins must not be specified when limits lists the levels: " + Arrays.toString(limits));
		if (nBins != null && nBins < 1)
			throw new InvalidLevelSpecException("nBins must be at least 1 but was " + nBins);

		if (limits != null && limits.length > 2) {
			for (int i = 1; i < limits.length; i++) {
				if (!(limits[i] > limits[i - 1]) || !Double.isFinite(limits[i - 1]) || !Double.isFinite(limits[i]))
					throw new InvalidLevelSpecException("Levels must be finite and strictly increasing: "
							+ Arrays.toString(limits));
			}
			return limits.clone();
		}
		final NiceLevelLocator locator = new NiceLevelLocator(nBins, steps);
		if (limits == null)
			return locator.levels(min, max);
		if (!Double.isFinite(limits[0]) || !Double.isFinite(limits[1]) || !(limits[1] > limits[0]))
			throw new InvalidLevelSpecException("Invalid range: " + Arrays.toString(limits));
		return locator.levels(limits[0], limits[1]);
	}

	/**
	 * Infers whether the data exceeds the levels.
	 *
	 * @param min the data minimum
	 * @param max the data maximum
	 * @param levels the levels
	 * @return the extension needed to show out-of-range data
	 */
	public static Extend resolveExtend(final double min, final double max, final double[] levels) {
		return Extend.of(min < levels[0], max > levels[levels.length - 1]);
	}

}
