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

package sc.fiji.pcolor;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

import org.scijava.Context;
import org.scijava.log.LogService;
import org.scijava.log.StderrLogService;
import org.scijava.util.VersionUtils;

/** Static utilities for PColor **/
public class PColorUtils {

	private static Context context;
	private static LogService logService;
	private static boolean verbose = Boolean.getBoolean("pcolor.debug");

	public static final String VERSION = getVersion();

	private PColorUtils() {}

	/**
	 * Retrieves PColor's version
	 *
	 * @return the version or a non-empty place holder string if version could
	 *         not be retrieved.
	 */
	private static String getVersion() {
		try {
			final String version = VersionUtils.getVersion(PColorUtils.class);
			return (version == null) ? "N/A" : version;
		} catch (final Throwable ignored) {
			return "N/A";
		}
	}

	public static String getReadableVersion() {
		if (VERSION.length() < 21) return "PColor " + VERSION;
		return "PColor " + VERSION.substring(0, 21) + "...";
	}

	/**
	 * Sets the SciJava context whose {@link LogService} should receive PColor's
	 * messages. If never set, messages are printed to the standard error stream.
	 *
	 * @param context the context, or null to revert to the standalone logger
	 */
	public static synchronized void setContext(final Context context) {
		PColorUtils.context = context;
		logService = null;
	}

	public static synchronized Context getContext() {
		return context;
	}

	/**
	 * Returns the log service shared by PColor's components.
	 *
	 * @return the context's LogService, or a {@link StderrLogService} when no
	 *         context has been set
	 */
	public static synchronized LogService getLogService() {
		if (logService == null) {
			logService = (context == null) ? new StderrLogService() : context.getService(LogService.class);
		}
		return logService;
	}

	public static synchronized void log(final String string) {
		if (!isDebugMode()) return;
		getLogService().info("[PColor] " + string);
	}

	public static synchronized void warn(final String string) {
		if (!isDebugMode()) return;
		getLogService().warn("[PColor] " + string);
	}

	/**
	 * Assesses if PColor is running in debug mode
	 *
	 * @return the debug flag
	 */
	public static boolean isDebugMode() {
		return verbose;
	}

	/**
	 * Enables/disables debug mode
	 *
	 * @param b verbose flag
	 */
	public static void setDebugMode(final boolean b) {
		if (isDebugMode() && !b) {
			log("Exiting debug mode...");
		}
		verbose = b;
		if (isDebugMode()) {
			log("Entering debug mode... (" + getReadableVersion() + ")");
		}
	}

	/**
	 * Formats a number the way C's {@code %.Ng} conversion does: N significant
	 * digits, scientific notation only for very small or very large magnitudes,
	 * and no trailing zeros.
	 *
	 * @param value  the value to be formatted
	 * @param digits the number of significant digits (at least 1)
	 * @return the formatted string
	 */
	public static String formatSignificant(final double value, final int digits) {
		if (Double.isNaN(value)) return "nan";
		if (Double.isInfinite(value)) return (value > 0) ? "inf" : "-inf";
		if (value == 0) return (1 / value < 0) ? "-0" : "0";
		final int precision = Math.max(1, digits);
		final BigDecimal rounded = new BigDecimal(value).round(new MathContext(precision, RoundingMode.HALF_EVEN));
		final int exponent = rounded.precision() - rounded.scale() - 1;
		if (exponent < -4 || exponent >= precision) {
			final BigDecimal mantissa = rounded.movePointLeft(exponent).stripTrailingZeros();
			final String sign = (exponent < 0) ? "-" : "+";
			final int absExp = Math.abs(exponent);
			return mantissa.toPlainString() + "e" + sign + ((absExp < 10) ? "0" : "") + absExp;
		}
		return rounded.stripTrailingZeros().toPlainString();
	}

}
