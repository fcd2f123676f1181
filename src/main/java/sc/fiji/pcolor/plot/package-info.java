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

/**
 * Preparation of pseudo-color panels of gridded fields.
 * <p>
 * {@link sc.fiji.pcolor.plot.PlotPreparer} ties the grid and analysis
 * packages together: for a map f(x, y) or a section f(y, z) it resolves the
 * corner mesh, axis limits and labels, statistics and color scale, and
 * returns them as a {@link sc.fiji.pcolor.plot.PanelSpec}. Comparisons of two
 * fields yield a {@link sc.fiji.pcolor.plot.ComparisonSpec} holding the A, B
 * and A - B panels plus their correlation.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * PlotOptions options = new PlotOptions().setIgnoreValue(-1e34).setNBins(20);
 * PanelSpec panel = new PlotPreparer().prepare(sst, Coordinate.of(lon),
 *     Coordinate.of(lat), area, options);
 * Color c = panel.cellColor(j, i);
 * }</pre>
 *
 * @see sc.fiji.pcolor.analysis.ColorLevelSelector
 * @see sc.fiji.pcolor.grid.CoordinateExpander
 */
package sc.fiji.pcolor.plot;
