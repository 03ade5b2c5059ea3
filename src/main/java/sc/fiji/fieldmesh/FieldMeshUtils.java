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

package sc.fiji.fieldmesh;

import java.util.Locale;

import org.scijava.Context;
import org.scijava.log.LogService;
import org.scijava.prefs.PrefService;

/** Static utilities for FieldMesh **/
public class FieldMeshUtils {

	/** Placeholder displayed for undefined numeric values */
	public static final String NOT_AVAILABLE = "N/A";

	private static Context context;
	private static LogService logService;
	private static volatile boolean debug;

	private FieldMeshUtils() {}

	private static synchronized LogService logService() {
		if (logService == null) logService = getContext().getService(LogService.class);
		return logService;
	}

	/**
	 * Retrieves the SciJava context used by FieldMesh. If none exists yet, a
	 * minimal one (logging and preferences only) is created.
	 *
	 * @return the context
	 */
	public static synchronized Context getContext() {
		if (context == null) {
			context = new Context(LogService.class, PrefService.class);
		}
		return context;
	}

	public static void log(final String string) {
		if (!isDebugMode()) return;
		logService().info("[FieldMesh] " + string);
	}

	public static void warn(final String string) {
		if (!isDebugMode()) return;
		logService().warn("[FieldMesh] " + string);
	}

	/**
	 * Formats a field value in scientific notation with three decimal digits,
	 * or {@link #NOT_AVAILABLE} if the value is undefined.
	 *
	 * @param value the value to be formatted
	 * @return the formatted string
	 */
	public static String formatScientific(final double value) {
		if (Double.isNaN(value)) return NOT_AVAILABLE;
		return String.format(Locale.US, "%.3e", value);
	}

	/**
	 * Checks if debug mode is enabled
	 *
	 * @return true, if debug mode is enabled
	 */
	public static boolean isDebugMode() {
		return debug;
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
		debug = b;
		if (isDebugMode()) {
			log("Entering debug mode...");
		}
	}

}
