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

package sc.fiji.pcolor.util;

import java.awt.Color;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import net.imglib2.display.ColorTable;
import net.imglib2.display.ColorTable8;
import org.scijava.util.ColorRGB;

/**
 * Utilities for named colormaps. Each colormap is defined by piecewise-linear
 * segment data (anchor positions in [0, 1] and the channel value at each
 * anchor) and can be evaluated at any resolution. Appending
 * {@code "_r"} to a name yields the reversed colormap.
 */
public class ColorMaps {

	/** Diverging blue-white-red colormap */
	public static final String SEISMIC = "seismic";
	/** Sequential black-red-yellow-white colormap */
	public static final String HOT = "hot";
	/** Reversed {@link #HOT} */
	public static final String HOT_R = "hot_r";
	/** Multi-hue spectral colormap */
	public static final String SPECTRAL = "spectral";
	/** Rainbow colormap by John Dunne */
	public static final String DUNNE_RAINBOW = "dunneRainbow";
	public static final String GRAY = "gray";

	/** Default number of entries of tables returned by {@link #get(String)} */
	public static final int DEFAULT_LENGTH = 256;

	private static final String REVERSED_SUFFIX = "_r";
	private static final Map<String, double[][][]> SEGMENTS = new LinkedHashMap<>();

	static {
		SEGMENTS.put(SEISMIC, seismic());
		SEGMENTS.put(HOT, hot());
		SEGMENTS.put(SPECTRAL, spectral());
		SEGMENTS.put(DUNNE_RAINBOW, dunneRainbow());
		SEGMENTS.put(GRAY, gray());
	}

	private ColorMaps() {
	}

	/**
	 * Returns the names of all built-in colormaps (reversed variants excluded).
	 *
	 * @return the list of colormap names
	 */
	public static List<String> names() {
		return Collections.unmodifiableList(new ArrayList<>(SEGMENTS.keySet()));
	}

	/**
	 * Checks whether a colormap name (optionally with the "_r" suffix) is known.
	 *
	 * @param name the colormap name
	 * @return true if {@link #get(String)} can resolve the name
	 */
	public static boolean isKnown(final String name) {
		if (name == null || name.isBlank()) return false;
		return SEGMENTS.containsKey(baseName(name));
	}

	/**
	 * Returns a 256-entry color table from its name.
	 *
	 * @param name the colormap name (e.g., "hot", "seismic", "hot_r", etc.)
	 * @return the color table or null if name is null or blank
	 * @throws IllegalArgumentException if name is not a known colormap
	 */
	public static ColorTable get(final String name) {
		if (name == null || name.isBlank())
			return null;
		return sample(name, DEFAULT_LENGTH);
	}

	/**
	 * Samples a named colormap at {@code n} evenly spaced positions, the first
	 * at 0 and the last at 1.
	 *
	 * @param name the colormap name
	 * @param n the number of colors
	 * @return a color table with {@code n} entries
	 * @throws IllegalArgumentException if name is unknown or n is not positive
	 */
	public static ColorTable8 sample(final String name, final int n) {
		if (!isKnown(name))
			throw new IllegalArgumentException("Unknown colormap: " + name);
		if (n < 1)
			throw new IllegalArgumentException("Number of colors must be positive");
		final double[][][] channels = SEGMENTS.get(baseName(name));
		final boolean reversed = name.endsWith(REVERSED_SUFFIX);
		final byte[][] values = new byte[3][n];
		for (int i = 0; i < n; i++) {
			double x = (n == 1) ? 0d : (double) i / (n - 1);
			if (reversed) x = 1d - x;
			for (int c = 0; c < 3; c++) {
				values[c][i] = toByte(evaluate(channels[c], x));
			}
		}
		return new ColorTable8(values);
	}

	/**
	 * Picks {@code n} evenly spaced entries from an arbitrary color table, the
	 * first and last entries included.
	 *
	 * @param colorTable the source table (e.g., an ImageJ lookup table)
	 * @param n the number of colors
	 * @return a color table with {@code n} entries
	 */
	public static ColorTable8 sample(final ColorTable colorTable, final int n) {
		if (n < 1)
			throw new IllegalArgumentException("Number of colors must be positive");
		final int length = colorTable.getLength();
		final byte[][] values = new byte[3][n];
		for (int i = 0; i < n; i++) {
			final int idx = (n == 1) ? 0 : (int) Math.round((double) (length - 1) * i / (n - 1));
			values[0][i] = (byte) colorTable.get(ColorTable.RED, idx);
			values[1][i] = (byte) colorTable.get(ColorTable.GREEN, idx);
			values[2][i] = (byte) colorTable.get(ColorTable.BLUE, idx);
		}
		return new ColorTable8(values);
	}

	public static ColorRGB[] discreteColors(final ColorTable colorTable, final int n) {
		final ColorTable8 sampled = sample(colorTable, n);
		final ColorRGB[] rgb = new ColorRGB[n];
		for (int i = 0; i < n; i++) {
			rgb[i] = new ColorRGB(sampled.get(ColorTable.RED, i), sampled.get(ColorTable.GREEN, i),
					sampled.get(ColorTable.BLUE, i));
		}
		return rgb;
	}

	/**
	 * Retrieves an entry of a color table as an AWT color.
	 *
	 * @param colorTable the color table
	 * @param idx the entry index
	 * @return the color
	 */
	public static Color toColor(final ColorTable colorTable, final int idx) {
		return new Color(colorTable.get(ColorTable.RED, idx), colorTable.get(ColorTable.GREEN, idx),
				colorTable.get(ColorTable.BLUE, idx));
	}

	private static String baseName(final String name) {
		final String trimmed = name.trim();
		if (trimmed.endsWith(REVERSED_SUFFIX))
			return trimmed.substring(0, trimmed.length() - REVERSED_SUFFIX.length());
		return trimmed;
	}

	private static double evaluate(final double[][] anchors, final double x) {
		if (x <= anchors[0][0]) return anchors[0][1];
		for (int k = 1; k < anchors.length; k++) {
			if (x <= anchors[k][0]) {
				final double x0 = anchors[k - 1][0];
				final double x1 = anchors[k][0];
				final double t = (x - x0) / (x1 - x0);
				return anchors[k - 1][1] + t * (anchors[k][1] - anchors[k - 1][1]);
			}
		}
		return anchors[anchors.length - 1][1];
	}

	private static byte toByte(final double v) {
		final double clamped = Math.max(0d, Math.min(1d, v));
		return (byte) Math.round(clamped * 255);
	}

	/** Anchors evenly spaced over [0, 1] */
	private static double[][] even(final double... values) {
		final double[][] anchors = new double[values.length][];
		for (int i = 0; i < values.length; i++) {
			anchors[i] = new double[] { (double) i / (values.length - 1), values[i] };
		}
		return anchors;
	}

	private static double[][][] seismic() {
		// dark blue, blue, white, red, dark red
		return new double[][][] { //
				even(0.0, 0.0, 1.0, 1.0, 0.5), //
				even(0.0, 0.0, 1.0, 0.0, 0.0), //
				even(0.3, 1.0, 1.0, 0.0, 0.0) };
	}

	private static double[][][] hot() {
		return new double[][][] { //
				{ { 0.0, 0.0416 }, { 0.365079, 1.0 }, { 1.0, 1.0 } }, //
				{ { 0.0, 0.0 }, { 0.365079, 0.0 }, { 0.746032, 1.0 }, { 1.0, 1.0 } }, //
				{ { 0.0, 0.0 }, { 0.746032, 0.0 }, { 1.0, 1.0 } } };
	}

	private static double[][][] spectral() {
		final double[] r = { 0.0, 0.4667, 0.5333, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.7333, 0.9333,
				1.0, 1.0, 1.0, 0.8667, 0.80, 0.80 };
		final double[] g = { 0.0, 0.0, 0.0, 0.0, 0.0, 0.4667, 0.6000, 0.6667, 0.6667, 0.6000, 0.7333, 0.8667, 1.0,
				1.0, 0.9333, 0.8000, 0.6000, 0.0, 0.0, 0.0, 0.80 };
		final double[] b = { 0.0, 0.5333, 0.6000, 0.6667, 0.8667, 0.8667, 0.8667, 0.6667, 0.5333, 0.0, 0.0, 0.0,
				0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.80 };
		return new double[][][] { even(r), even(g), even(b) };
	}

	private static double[][][] dunneRainbow() {
		return new double[][][] { //
				{ { 0.00, 0.95 }, { 0.09, 0.85 }, { 0.18, 0.60 }, { 0.32, 0.30 }, { 0.45, 0.00 }, { 0.60, 1.00 },
						{ 0.85, 1.00 }, { 1.00, 0.40 } }, //
				{ { 0.00, 0.75 }, { 0.09, 0.85 }, { 0.18, 0.60 }, { 0.32, 0.20 }, { 0.45, 0.60 }, { 0.60, 1.00 },
						{ 0.73, 0.70 }, { 0.85, 0.00 }, { 1.00, 0.00 } }, //
				{ { 0.00, 1.00 }, { 0.32, 1.00 }, { 0.45, 0.30 }, { 0.60, 0.00 }, { 1.00, 0.00 } } };
	}

	private static double[][][] gray() {
		return new double[][][] { even(0.0, 1.0), even(0.0, 1.0), even(0.0, 1.0) };
	}
}
