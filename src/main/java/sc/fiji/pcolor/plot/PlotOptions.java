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

import sc.fiji.pcolor.analysis.ColorLevelSelector;
import sc.fiji.pcolor.analysis.Extend;
import sc.fiji.pcolor.analysis.NiceLevelLocator;

/**
 * Options controlling how a field is prepared for display. All options are
 * optional: unset options are derived from the data.
 */
public class PlotOptions {

	/** The default color of cells holding no data */
	public static final Color DEFAULT_LAND_COLOR = new Color(128, 128, 128);

	private Integer nBins;
	private double[] limits;
	private double[] diffLimits;
	private double[] steps = NiceLevelLocator.DEFAULT_STEPS.clone();
	private Extend extend;
	private String colormap;
	private String diffColormap;
	private Double ignoreValue;
	private Color landColor = DEFAULT_LAND_COLOR;
	private String xLabel;
	private String xUnits;
	private String yLabel;
	private String yUnits;
	private boolean debug;

	public Integer getNBins() {
		return nBins;
	}

	/**
	 * @param nBins the number of color bins, used when limits are absent or
	 *          give a range. If null, {@link ColorLevelSelector#DEFAULT_N_BINS}
	 *          is used in that case.
	 * @return this
	 */
	public PlotOptions setNBins(final Integer nBins) {
		this.nBins = nBins;
		return this;
	}

	public double[] getLimits() {
		return (limits == null) ? null : limits.clone();
	}

	/**
	 * @param limits a {min, max} color range or an explicit list of levels.
	 *          Derived from the data if null.
	 * @return this
	 */
	public PlotOptions setLimits(final double... limits) {
		this.limits = (limits == null) ? null : limits.clone();
		return this;
	}

	public double[] getDiffLimits() {
		return (diffLimits == null) ? null : diffLimits.clone();
	}

	/**
	 * @param diffLimits the color range or levels of the difference panel of a
	 *          comparison
	 * @return this
	 */
	public PlotOptions setDiffLimits(final double... diffLimits) {
		this.diffLimits = (diffLimits == null) ? null : diffLimits.clone();
		return this;
	}

	public double[] getSteps() {
		return steps.clone();
	}

	public PlotOptions setSteps(final double... steps) {
		this.steps = (steps == null) ? NiceLevelLocator.DEFAULT_STEPS.clone() : steps.clone();
		return this;
	}

	public Extend getExtend() {
		return extend;
	}

	/**
	 * @param extend the extension of the color scale. Inferred from the data if
	 *          null.
	 * @return this
	 */
	public PlotOptions setExtend(final Extend extend) {
		this.extend = extend;
		return this;
	}

	/**
	 * @param extend one of "neither", "min", "max" or "both"
	 * @return this
	 */
	public PlotOptions setExtend(final String extend) {
		this.extend = (extend == null) ? null : Extend.fromString(extend);
		return this;
	}

	public String getColormap() {
		return colormap;
	}

	public PlotOptions setColormap(final String colormap) {
		this.colormap = colormap;
		return this;
	}

	public String getDiffColormap() {
		return diffColormap;
	}

	public PlotOptions setDiffColormap(final String diffColormap) {
		this.diffColormap = diffColormap;
		return this;
	}

	public Double getIgnoreValue() {
		return ignoreValue;
	}

	/**
	 * @param ignoreValue the value flagging cells without data (e.g., land in
	 *          ocean fields)
	 * @return this
	 */
	public PlotOptions setIgnoreValue(final Double ignoreValue) {
		this.ignoreValue = ignoreValue;
		return this;
	}

	public Color getLandColor() {
		return landColor;
	}

	public PlotOptions setLandColor(final Color landColor) {
		this.landColor = (landColor == null) ? DEFAULT_LAND_COLOR : landColor;
		return this;
	}

	public String getXLabel() {
		return xLabel;
	}

	public PlotOptions setXLabel(final String xLabel) {
		this.xLabel = xLabel;
		return this;
	}

	public String getXUnits() {
		return xUnits;
	}

	public PlotOptions setXUnits(final String xUnits) {
		this.xUnits = xUnits;
		return this;
	}

	public String getYLabel() {
		return yLabel;
	}

	public PlotOptions setYLabel(final String yLabel) {
		this.yLabel = yLabel;
		return this;
	}

	public String getYUnits() {
		return yUnits;
	}

	public PlotOptions setYUnits(final String yUnits) {
		this.yUnits = yUnits;
		return this;
	}

	public boolean isDebug() {
		return debug;
	}

	public PlotOptions setDebug(final boolean debug) {
		this.debug = debug;
		return this;
	}

	/**
	 * Resolves the number of bins to use with the given limits.
	 *
	 * @param limits the color range or levels (may be null)
	 * @return {@link ColorLevelSelector#DEFAULT_N_BINS} if no number of bins was
	 *         set and limits are absent or a range, the number of bins
	 *         otherwise
	 */
	public Integer resolveNBins(final double[] limits) {
		if (nBins == null && (limits == null || limits.length == 2))
			return ColorLevelSelector.DEFAULT_N_BINS;
		return nBins;
	}

	public PlotOptions copy() {
		final PlotOptions copy = new PlotOptions();
		copy.nBins = nBins;
		copy.limits = getLimits();
		copy.diffLimits = getDiffLimits();
		copy.steps = getSteps();
		copy.extend = extend;
		copy.colormap = colormap;
		copy.diffColormap = diffColormap;
		copy.ignoreValue = ignoreValue;
		copy.landColor = landColor;
		copy.xLabel = xLabel;
		copy.xUnits = xUnits;
		copy.yLabel = yLabel;
		copy.yUnits = yUnits;
		copy.debug = debug;
		return copy;
	}
}
