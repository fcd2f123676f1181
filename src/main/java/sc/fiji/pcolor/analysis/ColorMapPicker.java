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

import sc.fiji.pcolor.util.ColorMaps;

/**
 * Suggests a colormap from the extremes of the data: diverging when the data
 * straddles zero, sequential when it is mostly positive or mostly negative.
 * The thresholds are rules of thumb; callers can always choose a colormap
 * explicitly.
 */
public class ColorMapPicker {

	private ColorMapPicker() {
	}

	/**
	 * Chooses a colormap that fits the data. Branches are evaluated in order.
	 *
	 * @param min the data minimum
	 * @param max the data maximum
	 * @return one of {@link ColorMaps#SEISMIC}, {@link ColorMaps#HOT},
	 *         {@link ColorMaps#HOT_R} or {@link ColorMaps#SPECTRAL}
	 */
	public static String pick(final double min, final double max) {
		if (min < 0 && max > 0) return ColorMaps.SEISMIC;
		else if (max > 0 && min < 0.1 * max) return ColorMaps.HOT;
		else if (min < 0 && max > 0.1 * min) return ColorMaps.HOT_R;
		else return ColorMaps.SPECTRAL;
	}

}
