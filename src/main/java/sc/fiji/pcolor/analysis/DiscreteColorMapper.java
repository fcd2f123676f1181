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

import java.awt.Color;
import java.util.Arrays;

import net.imglib2.display.ColorTable;
import net.imglib2.display.ColorTable8;

import sc.fiji.pcolor.util.ColorMaps;

/**
 * Maps values onto a discrete set of bins delimited by levels. Bin {@code i}
 * holds values {@code v} with {@code levels[i] <= v < levels[i+1]}. Values
 * outside the levels are painted with the under/over colors when the scale is
 * extended in that direction, and with the nearest bin color otherwise.
 */
public class DiscreteColorMapper extends ColorMapper {

	private final double[] levels;
	private final Extend extend;
	private final Color underColor;
	private final Color overColor;

	/**
	 * Builds a mapper from colors sampled evenly across a colormap. The first
	 * sample becomes the under color when {@code extend} includes the minimum,
	 * the last sample becomes the over color when it includes the maximum, and
	 * the samples in between become the bin colors.
	 *
	 * @param levels the strictly increasing bin edges (at least 2)
	 * @param extend the extension of the scale
	 * @param samples exactly {@code levels.length - 1 + extend.extraColors()}
	 *          colors
	 */
	public DiscreteColorMapper(final double[] levels, final Extend extend, final ColorTable samples) {
		validateLevels(levels);
		if (extend == null)
			throw new IllegalArgumentException("Extend cannot be null");
		final int nColors = levels.length - 1;
		final int expected = nColors + extend.extraColors();
		if (samples == null || samples.getLength() != expected)
			throw new IllegalArgumentException("Expected " + expected + " colors but got " + ((samples == null) ? 0
					: samples.getLength()));
		this.levels = levels.clone();
		this.extend = extend;
		final int first = extend.includesMin() ? 1 : 0;
		underColor = extend.includesMin() ? ColorMaps.toColor(samples, 0) : null;
		overColor = extend.includesMax() ? ColorMaps.toColor(samples, expected - 1) : null;
		final byte[][] bins = new byte[3][nColors];
		for (int i = 0; i < nColors; i++) {
			bins[0][i] = (byte) samples.get(ColorTable.RED, first + i);
			bins[1][i] = (byte) samples.get(ColorTable.GREEN, first + i);
			bins[2][i] = (byte) samples.get(ColorTable.BLUE, first + i);
		}
		colorTable = new ColorTable8(bins);
		min = levels[0];
		max = levels[nColors];
	}

	private static void validateLevels(final double[] levels) {
		if (levels == null || levels.length < 2)
			throw new InvalidLevelSpecException("At least two levels are required");
		for (int i = 0; i < levels.length; i++) {
			if (!Double.isFinite(levels[i]))
				throw new InvalidLevelSpecException("Levels must be finite: " + Arrays.toString(levels));
			if (i > 0 && levels[i] <= levels[i - 1])
				throw new InvalidLevelSpecException("Levels must be strictly increasing: " + Arrays.toString(levels));
		}
	}

	/**
	 * Locates the bin of a value.
	 *
	 * @param value the value
	 * @return -1 below the first level, {@link #getNumberOfBins()} at or above
	 *         the last level, otherwise the bin index
	 * @throws IllegalArgumentException if value is NaN, which falls in no bin
	 */
	public int binIndex(final double value) {
		if (Double.isNaN(value))
			throw new IllegalArgumentException("NaN falls in no bin");
		if (value < levels[0]) return -1;
		if (value >= levels[levels.length - 1]) return getNumberOfBins();
		final int pos = Arrays.binarySearch(levels, value);
		return (pos >= 0) ? pos : -pos - 2;
	}

	@Override
	public Color getColor(final double mappedValue) {
		if (Double.isNaN(mappedValue))
			return getNaNColor();
		final int bin = binIndex(mappedValue);
		if (bin < 0)
			return (underColor != null) ? underColor : ColorMaps.toColor(colorTable, 0);
		if (bin >= getNumberOfBins())
			return (overColor != null) ? overColor : ColorMaps.toColor(colorTable, getNumberOfBins() - 1);
		return ColorMaps.toColor(colorTable, bin);
	}

	/** @return the number of bins, i.e., the number of levels minus one */
	public int getNumberOfBins() {
		return levels.length - 1;
	}

	public double[] getLevels() {
		return levels.clone();
	}

	public Extend getExtend() {
		return extend;
	}

	public boolean hasUnderColor() {
		return underColor != null;
	}

	public boolean hasOverColor() {
		return overColor != null;
	}

	/** @return the color of values below the first level, or null if none */
	public Color getUnderColor() {
		return underColor;
	}

	/** @return the color of values at or above the last level, or null if none */
	public Color getOverColor() {
		return overColor;
	}

	/**
	 * @param bin the bin index
	 * @return the color of the bin
	 */
	public Color getBinColor(final int bin) {
		if (bin < 0 || bin >= getNumberOfBins())
			throw new IllegalArgumentException("Bin index out of range: " + bin);
		return ColorMaps.toColor(colorTable, bin);
	}

}
