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

package sc.fiji.pcolor.plot;

import java.awt.Color;

import sc.fiji.pcolor.analysis.ColorLevels;
import sc.fiji.pcolor.analysis.FieldSummary;
import sc.fiji.pcolor.grid.BoundaryExtent.Extent;
import sc.fiji.pcolor.grid.CornerCoordinates;
import sc.fiji.pcolor.grid.Field;

/**
 * Everything a renderer needs to draw one pseudo-color panel.
 *
 * @param field the masked field
 * @param corners the cell-corner mesh
 * @param summary the field statistics
 * @param xLimits the horizontal axis limits
 * @param yLimits the vertical axis limits
 * @param colorLevels the discrete color scale
 * @param xAxis the horizontal axis labels
 * @param yAxis the vertical axis labels
 * @param annotations the statistics text
 * @param landColor the color of cells without data
 */
public record PanelSpec(Field field, CornerCoordinates corners, FieldSummary summary, Extent xLimits,
		Extent yLimits, ColorLevels colorLevels, AxisLabels xAxis, AxisLabels yAxis, Annotations annotations,
		Color landColor) {

	/**
	 * Resolves the color of a cell.
	 *
	 * @param j the row
	 * @param i the column
	 * @return the land color if the cell holds no data, its mapped color
	 *         otherwise
	 */
	public Color cellColor(final int j, final int i) {
		if (!field.isValid(j, i)) return landColor;
		return colorLevels.colorMapper().getColor(field.get(j, i));
	}
}
