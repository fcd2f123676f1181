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

import net.imglib2.display.ColorTable;
import org.scijava.util.ColorRGB;

/**
 * Parent class for ColorMappers: a color table, the bounds it spans, and the
 * color of NaN (no-data) values.
 */
public abstract class ColorMapper {

	/** The color assigned to NaN (no-data) values by default */
	public static final Color DEFAULT_NAN_COLOR = new Color(128, 128, 128);

	protected ColorTable colorTable;
	protected double min;
	protected double max;
	private Color nanColor = DEFAULT_NAN_COLOR;

	/**
	 * Gets the color used for NaN (Not a Number) values.
	 *
	 * @return the color for NaN values
	 */
	public Color getNaNColor() {
		return nanColor;
	}

	/**
	 * Sets the color to use for NaN (Not a Number) values, i.e., for cells
	 * holding no data.
	 *
	 * @param nanColor the color to use for NaN values
	 */
	public void setNaNColor(final Color nanColor) {
		this.nanColor = (nanColor == null) ? DEFAULT_NAN_COLOR : nanColor;
	}

	/**
	 * Gets the color corresponding to the specified mapped value. Implementations
	 * return the NaN color if the value is NaN.
	 *
	 * @param mappedValue the value to map to a color
	 * @return the corresponding color
	 */
	public abstract Color getColor(final double mappedValue);

	/**
	 * Gets the color corresponding to the specified mapped value as ColorRGB.
	 *
	 * @param mappedValue the value to map to a color
	 * @return the corresponding ColorRGB
	 * @see #getColor(double)
	 */
	public ColorRGB getColorRGB(final double mappedValue) {
		final Color color = getColor(mappedValue);
		return new ColorRGB(color.getRed(), color.getGreen(), color.getBlue());
	}

	/**
	 * Returns the mapping bounds
	 *
	 * @return a two-element array with current {minimum, maximum} mapping bounds
	 */
	public double[] getMinMax() {
		return new double[] { min, max };
	}

	/**
	 * Gets the current color table used for mapping.
	 *
	 * @return the current color table
	 */
	public ColorTable getColorTable() {
		return colorTable;
	}

}
