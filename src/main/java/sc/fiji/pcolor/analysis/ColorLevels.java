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

/**
 * The outcome of level selection: the bin edges, the resolved extension of
 * the scale, and the mapper assigning colors to values.
 *
 * @param levels the strictly increasing bin edges
 * @param extend the extension of the scale
 * @param colorMapper the color assignment
 * @param colormapName the name of the sampled colormap, or null if the colors
 *          came from an arbitrary color table
 */
public record ColorLevels(double[] levels, Extend extend, DiscreteColorMapper colorMapper, String colormapName) {

	public ColorLevels {
		if (levels == null || colorMapper == null || extend == null)
			throw new IllegalArgumentException("Levels, extend and mapper are required");
		levels = levels.clone();
	}

	@Override
	public double[] levels() {
		return levels.clone();
	}

	/** @return the number of bins */
	public int nColors() {
		return levels.length - 1;
	}

	public double lowest() {
		return levels[0];
	}

	public double highest() {
		return levels[levels.length - 1];
	}

	@Override
	public String toString() {
		return "ColorLevels[colormap=" + colormapName + ", extend=" + extend + ", levels=" + Arrays.toString(levels)
				+ "]";
	}
}
