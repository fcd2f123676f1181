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

import sc.fiji.pcolor.PColorUtils;

/**
 * Finds "nice" bin boundaries for a data range: a fixed number of equal bins
 * whose width is one of a set of steps times a power of ten, and whose edges
 * are multiples of that width.
 * <p>
 * Ranges of zero width are widened before binning. Ranges lying far from zero
 * are binned relative to an offset, a power of ten near their center.
 * </p>
 */
public class NiceLevelLocator {

	/** The default step multipliers */
	public static final double[] DEFAULT_STEPS = { 1, 2, 2.5, 5, 10 };

	private static final double EXPANDER = 1e-13;
	private static final double TINY = 1e-14;
	private static final double OFFSET_THRESHOLD = 100;

	private final int nBins;
	private final double[] steps;

	/**
	 * @param nBins the number of bins (at least 1)
	 * @param steps the step multipliers: strictly increasing, within [1, 10].
	 *          10 is appended when missing. Defaults to {@link #DEFAULT_STEPS}
	 *          when null.
	 * @throws InvalidLevelSpecException if nBins or steps are invalid
	 */
	public NiceLevelLocator(final int nBins, final double[] steps) {
		if (nBins < 1)
			throw new InvalidLevelSpecException("Number of bins must be at least 1 but was " + nBins);
		this.nBins = nBins;
		this.steps = validSteps((steps == null) ? DEFAULT_STEPS : steps);
	}

	public NiceLevelLocator(final int nBins) {
		this(nBins, null);
	}

	private static double[] validSteps(final double[] steps) {
		if (steps.length == 0)
			throw new InvalidLevelSpecException("Steps cannot be empty");
		for (int i = 0; i < steps.length; i++) {
			if (!(steps[i] >= 1 && steps[i] <= 10))
				throw new InvalidLevelSpecException("Steps must lie within [1, 10]: " + Arrays.toString(steps));
			if (i > 0 && steps[i] <= steps[i - 1])
				throw new InvalidLevelSpecException("Steps must be strictly increasing: " + Arrays.toString(steps));
		}
		if (steps[steps.length - 1] == 10) return steps.clone();
		final double[] withTen = Arrays.copyOf(steps, steps.length + 1);
		withTen[steps.length] = 10;
		return withTen;
	}

	public int getNumberOfBins() {
		return nBins;
	}

	public double[] getSteps() {
		return steps.clone();
	}

	/**
	 * Computes the bin boundaries covering [vmin, vmax].
	 *
	 * @param vmin the lower end of the range
	 * @param vmax the upper end of the range
	 * @return nBins + 1 strictly increasing levels, the first not above vmin.
	 *         The last is not below vmax unless no multiple of the steps can
	 *         cover the range (e.g., a single bin across zero), in which case
	 *         the largest step of the first decade is used.
	 */
	public double[] levels(final double vmin, final double vmax) {
		final double[] range = nonSingular(vmin, vmax);
		final double[] scaleOffset = scaleRange(range[0], range[1], nBins);
		final double scale = scaleOffset[0];
		final double offset = scaleOffset[1];
		final double lo = range[0] - offset;
		final double hi = range[1] - offset;
		final double scaledRawStep = (hi - lo) / nBins / scale;

		double step = Double.NaN;
		double bestMin = lo;
		// the steps are tried again one decade up only when rounding of the raw
		// step leaves no candidate within the first decade
		outer: for (final double decade : new double[] { 1, 10 }) {
			for (final double s : steps) {
				if (decade > 1 && s == steps[0]) continue;
				final double candidate = s * decade;
				if (candidate < scaledRawStep) continue;
				step = candidate * scale;
				bestMin = step * Math.floor(lo / step);
				if (bestMin > lo) bestMin -= step; // rounding of lo / step
				if (bestMin + step * nBins >= hi) break outer;
			}
			if (!Double.isNaN(step)) break;
		}
		if (bestMin + step * nBins < hi)
			PColorUtils.warn("No step covers [" + vmin + ", " + vmax + "] with " + nBins + " bin(s): levels end at "
					+ (bestMin + step * nBins + offset));
		final double[] levels = new double[nBins + 1];
		for (int k = 0; k <= nBins; k++)
			levels[k] = k * step + bestMin + offset;
		return levels;
	}

	/**
	 * Widens a range of (near) zero width, and orders its ends.
	 *
	 * @return the {min, max} pair
	 */
	static double[] nonSingular(double vmin, double vmax) {
		if (!Double.isFinite(vmin) || !Double.isFinite(vmax))
			return new double[] { -EXPANDER, EXPANDER };
		if (vmax < vmin) {
			final double tmp = vmin;
			vmin = vmax;
			vmax = tmp;
		}
		final double maxAbs = Math.max(Math.abs(vmin), Math.abs(vmax));
		if (maxAbs < (1e6 / TINY) * Double.MIN_NORMAL) {
			vmin = -EXPANDER;
			vmax = EXPANDER;
		} else if (vmax - vmin <= maxAbs * TINY) {
			vmin -= EXPANDER * Math.abs(vmin);
			vmax += EXPANDER * Math.abs(vmax);
		}
		return new double[] { vmin, vmax };
	}

	/**
	 * Computes the power of ten matching a bin width, and the offset to remove
	 * from ranges far from zero.
	 *
	 * @return the {scale, offset} pair
	 */
	static double[] scaleRange(final double vmin, final double vmax, final int n) {
		final double dv = Math.abs(vmax - vmin);
		if (dv == 0) return new double[] { 1, 0 };
		final double meanv = 0.5 * (vmax + vmin);
		double offset = 0;
		if (Math.abs(meanv) / dv >= OFFSET_THRESHOLD) {
			final double ex = Math.floor(Math.log10(Math.abs(meanv)));
			offset = Math.copySign(Math.pow(10, ex), meanv);
		}
		final double scale = Math.pow(10, Math.floor(Math.log10(dv / n)));
		return new double[] { scale, offset };
	}

}
