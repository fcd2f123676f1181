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

import java.util.OptionalDouble;

import org.scijava.Context;

import sc.fiji.pcolor.PColorUtils;
import sc.fiji.pcolor.analysis.ColorLevelSelector;
import sc.fiji.pcolor.analysis.ColorLevels;
import sc.fiji.pcolor.analysis.ColorMapPicker;
import sc.fiji.pcolor.analysis.FieldCorrelation;
import sc.fiji.pcolor.analysis.FieldStatistics;
import sc.fiji.pcolor.analysis.FieldSummary;
import sc.fiji.pcolor.grid.BoundaryExtent;
import sc.fiji.pcolor.grid.BoundaryExtent.Extent;
import sc.fiji.pcolor.grid.Coordinate;
import sc.fiji.pcolor.grid.CoordinateExpander;
import sc.fiji.pcolor.grid.CornerCoordinates;
import sc.fiji.pcolor.grid.Field;
import sc.fiji.pcolor.grid.SectionGeometry;
import sc.fiji.pcolor.util.Logger;

/**
 * Prepares scalar fields for pseudo-color display: resolves the cell-corner
 * mesh, the axis limits and labels, the statistics and the discrete color
 * scale of each panel. Rendering itself is left to the caller.
 * <p>
 * Maps are fields f(x, y) of shape (nj, ni). Sections are fields f(y, z) of
 * shape (nk, nj) whose cells lie between interface elevations; in sections
 * the x label and units of {@link PlotOptions} describe the horizontal (y)
 * axis and the y label and units describe the vertical (z) axis.
 * </p>
 */
public class PlotPreparer {

	private final Logger logger;

	public PlotPreparer() {
		logger = new Logger(PlotPreparer.class);
	}

	/**
	 * @param context the SciJava context providing the LogService
	 */
	public PlotPreparer(final Context context) {
		logger = new Logger(context, PlotPreparer.class.getSimpleName());
	}

	/**
	 * Prepares a single map panel.
	 *
	 * @param values the (nj, ni) field
	 * @param x the x coordinate (1D or 2D, centers or corners), or null
	 * @param y the y coordinate (1D or 2D, centers or corners), or null
	 * @param area the (nj, ni) cell areas, or null to skip mean, std and rms
	 * @param options the options, or null for defaults
	 * @return the panel
	 */
	public PanelSpec prepare(final double[][] values, final Coordinate x, final Coordinate y, final double[][] area,
			final PlotOptions options) {
		final PlotOptions opts = resolve(options);
		return prepare(Field.of(values, opts.getIgnoreValue()), x, y, area, opts);
	}

	/**
	 * Prepares a single map panel from a field that is already masked.
	 *
	 * @see #prepare(double[][], Coordinate, Coordinate, double[][], PlotOptions)
	 */
	public PanelSpec prepare(final Field field, final Coordinate x, final Coordinate y, final double[][] area,
			final PlotOptions options) {
		final PlotOptions opts = resolve(options);
		final AxisLabels xAxis = AxisLabels.x(x != null, opts.getXLabel(), opts.getXUnits());
		final AxisLabels yAxis = AxisLabels.y(y != null, opts.getYLabel(), opts.getYUnits());
		logger.debug("x,y label/units = " + xAxis + ", " + yAxis);
		final CornerCoordinates corners = CoordinateExpander.toCorners(field, x, y);
		final FieldSummary summary = FieldStatistics.summarize(field, area);
		logger.debug("stats: " + summary);
		final ColorLevels levels = chooseLevels(summary.min(), summary.max(), opts.getColormap(), opts.getLimits(),
				opts);
		return new PanelSpec(field, corners, summary, corners.xExtent(), corners.yExtent(), levels, xAxis, yAxis,
				Annotations.of(summary), opts.getLandColor());
	}

	/**
	 * Prepares the comparison of two maps.
	 *
	 * @param values1 the first (nj, ni) field (A)
	 * @param values2 the second (nj, ni) field (B)
	 * @param x the x coordinate, or null
	 * @param y the y coordinate, or null
	 * @param area the cell areas, or null to skip moments and correlation
	 * @param options the options, or null for defaults
	 * @return the A, B and A - B panels
	 * @throws sc.fiji.pcolor.grid.ShapeMismatchException if the fields differ
	 *           in shape
	 */
	public ComparisonSpec compare(final double[][] values1, final double[][] values2, final Coordinate x,
			final Coordinate y, final double[][] area, final PlotOptions options) {
		final PlotOptions opts = resolve(options);
		return compare(Field.of(values1, opts.getIgnoreValue()), Field.of(values2, opts.getIgnoreValue()), x, y, area,
				opts);
	}

	/**
	 * Prepares the comparison of two maps that are already masked.
	 *
	 * @see #compare(double[][], double[][], Coordinate, Coordinate, double[][],
	 *      PlotOptions)
	 */
	public ComparisonSpec compare(final Field field1, final Field field2, final Coordinate x, final Coordinate y,
			final double[][] area, final PlotOptions options) {
		final PlotOptions opts = resolve(options);
		field1.requireSameShape(field2);
		final AxisLabels xAxis = AxisLabels.x(x != null, opts.getXLabel(), opts.getXUnits());
		final AxisLabels yAxis = AxisLabels.y(y != null, opts.getYLabel(), opts.getYUnits());
		final CornerCoordinates corners = CoordinateExpander.toCorners(field1, x, y);
		return compare(field1, field2, corners, corners.xExtent(), corners.yExtent(), xAxis, yAxis, area, opts);
	}

	/**
	 * Prepares a single section panel.
	 *
	 * @param values the (nk, nj) field
	 * @param y the horizontal coordinate: nj centers or nj+1 edges. Column
	 *          indices are used if null.
	 * @param z the (nk+1, nj) interface elevations, from top to bottom
	 * @param options the options, or null for defaults
	 * @return the panel
	 * @throws sc.fiji.pcolor.grid.ShapeMismatchException if y has neither nj
	 *           nor nj+1 values
	 */
	public PanelSpec prepareSection(final double[][] values, final double[] y, final double[][] z,
			final PlotOptions options) {
		final PlotOptions opts = resolve(options);
		final Field field = Field.of(values, opts.getIgnoreValue());
		final Section section = section(field, y, z);
		final AxisLabels yAxis = AxisLabels.y(y != null, opts.getXLabel(), opts.getXUnits());
		final AxisLabels zAxis = AxisLabels.z(true, opts.getYLabel(), opts.getYUnits());
		logger.debug("y,z label/units = " + yAxis + ", " + zAxis);
		final FieldSummary summary = FieldStatistics.summarize(field, section.weights);
		logger.debug("stats: " + summary);
		final ColorLevels levels = chooseLevels(summary.min(), summary.max(), opts.getColormap(), opts.getLimits(),
				opts);
		return new PanelSpec(field, section.corners, summary, section.yLimits, section.zLimits, levels, yAxis, zAxis,
				Annotations.of(summary), opts.getLandColor());
	}

	/**
	 * Prepares the comparison of two sections. Sections always carry weights,
	 * so the correlation is always computed.
	 *
	 * @see #prepareSection(double[][], double[], double[][], PlotOptions)
	 */
	public ComparisonSpec compareSection(final double[][] values1, final double[][] values2, final double[] y,
			final double[][] z, final PlotOptions options) {
		final PlotOptions opts = resolve(options);
		final Field field1 = Field.of(values1, opts.getIgnoreValue());
		final Field field2 = Field.of(values2, opts.getIgnoreValue());
		field1.requireSameShape(field2);
		final Section section = section(field1, y, z);
		final AxisLabels yAxis = AxisLabels.y(y != null, opts.getXLabel(), opts.getXUnits());
		final AxisLabels zAxis = AxisLabels.z(true, opts.getYLabel(), opts.getYUnits());
		return compare(field1, field2, section.corners, section.yLimits, section.zLimits, yAxis, zAxis,
				section.weights, opts);
	}

	private ComparisonSpec compare(final Field field1, final Field field2, final CornerCoordinates corners,
			final Extent hLimits, final Extent vLimits, final AxisLabels hAxis, final AxisLabels vAxis,
			final double[][] weights, final PlotOptions opts) {
		final Field diff = field1.minus(field2);
		final FieldSummary s1 = FieldStatistics.summarize(field1, weights);
		final FieldSummary s2 = FieldStatistics.summarize(field2, weights);
		final FieldSummary sd = FieldStatistics.summarize(diff, weights);
		final OptionalDouble r = (weights == null) ? OptionalDouble.empty()
				: OptionalDouble.of(FieldCorrelation.correlate(field1, field2, weights));
		final double s12Min = nanMin(s1.min(), s2.min());
		final double s12Max = nanMax(s1.max(), s2.max());
		logger.debug("s1: " + s1);
		logger.debug("s2: " + s2);
		logger.debug("s12: min, max = " + s12Min + ", " + s12Max);

		final ColorLevels levels = chooseLevels(s12Min, s12Max, opts.getColormap(), opts.getLimits(), opts);
		final String diffColormap = (opts.getDiffColormap() == null) ? ColorMapPicker.pick(sd.min(), sd.max())
				: opts.getDiffColormap();
		final ColorLevels diffLevels = chooseLevels(sd.min(), sd.max(), diffColormap, opts.getDiffLimits(), opts);

		final PanelSpec a = new PanelSpec(field1, corners, s1, hLimits, vLimits, levels, hAxis, vAxis, Annotations.of(
				s1), opts.getLandColor());
		final PanelSpec b = new PanelSpec(field2, corners, s2, hLimits, vLimits, levels, hAxis, vAxis, Annotations.of(
				s2), opts.getLandColor());
		final PanelSpec d = new PanelSpec(diff, corners, sd, hLimits, vLimits, diffLevels, hAxis, vAxis, Annotations
				.of(sd), opts.getLandColor());
		if (r.isPresent() && FieldCorrelation.isUndefined(r.getAsDouble()))
			logger.warn("Correlation is undefined: one of the fields has no variance");
		return new ComparisonSpec(a, b, d, r);
	}

	private ColorLevels chooseLevels(final double min, final double max, final String colormap,
			final double[] limits, final PlotOptions opts) {
		final String name = (colormap == null) ? ColorMapPicker.pick(min, max) : colormap;
		return ColorLevelSelector.chooseLevels(min, max, name, opts.resolveNBins(limits), limits, opts.getSteps(),
				opts.getExtend());
	}

	private Section section(final Field field, final double[] y, final double[][] z) {
		if (z == null)
			throw new IllegalArgumentException("Interface elevations are required");
		final double[] yCorners = SectionGeometry.cornerPositions(y, field.ni());
		final double[][] weights = SectionGeometry.weights(yCorners, z);
		field.requireSameShape(weights, "Section cells");
		final CornerCoordinates corners = SectionGeometry.corners(yCorners, z);
		return new Section(corners, weights, BoundaryExtent.minMax(yCorners), corners.yExtent());
	}

	private PlotOptions resolve(final PlotOptions options) {
		final PlotOptions opts = (options == null) ? new PlotOptions() : options;
		logger.setDebug(opts.isDebug() || PColorUtils.isDebugMode());
		return opts;
	}

	private static double nanMin(final double a, final double b) {
		if (Double.isNaN(a)) return b;
		if (Double.isNaN(b)) return a;
		return Math.min(a, b);
	}

	private static double nanMax(final double a, final double b) {
		if (Double.isNaN(a)) return b;
		if (Double.isNaN(b)) return a;
		return Math.max(a, b);
	}

	private record Section(CornerCoordinates corners, double[][] weights, Extent yLimits, Extent zLimits) {
	}
}
