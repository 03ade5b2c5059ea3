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

import java.io.File;

import org.scijava.Context;
import org.scijava.prefs.PrefService;
import org.scijava.util.ColorRGB;

import sc.fiji.fieldmesh.pipeline.RenderSettings;

/**
 * Class handling FieldMesh preferences.
 */
public class FieldMeshPrefs {

	public static final String DEBUG_MODE = "debugMode";
	public static final String LAST_SUBJECT_DIR = "lastSubjectDir";
	public static final String HISTOGRAM_BINS = "histogramBins";
	public static final String SCATTER_SUBSAMPLE = "scatterSubsample";
	public static final String CROSS_SECTION_GRID = "crossSectionGrid";
	public static final String GUARD_STALE_RESULTS = "guardStaleResults";
	public static final String SUPPRESS_RENDERER_WARNINGS = "suppressRendererWarnings";
	public static final String BACKGROUND_COLOR = "backgroundColor";

	public static final boolean DEF_DEBUG_MODE = false;
	public static final int DEF_HISTOGRAM_BINS = 50;
	public static final int DEF_SCATTER_SUBSAMPLE = 5000;
	public static final int DEF_CROSS_SECTION_GRID = 300;
	public static final boolean DEF_GUARD_STALE_RESULTS = true;
	public static final boolean DEF_SUPPRESS_RENDERER_WARNINGS = true;
	/* (0.1, 0.1, 0.2) */
	public static final ColorRGB DEF_BACKGROUND_COLOR = new ColorRGB(26, 26, 51);

	private final PrefService prefService;

	/**
	 * Constructs a new FieldMeshPrefs instance backed by the PrefService of the
	 * specified context.
	 *
	 * @param context the SciJava context
	 */
	public FieldMeshPrefs(final Context context) {
		prefService = context.getService(PrefService.class);
		if (prefService == null)
			throw new IllegalArgumentException("Context does not provide a PrefService");
	}

	public boolean isDebugMode() {
		return prefService.getBoolean(FieldMeshPrefs.class, DEBUG_MODE, DEF_DEBUG_MODE);
	}

	public void setDebugMode(final boolean debug) {
		prefService.put(FieldMeshPrefs.class, DEBUG_MODE, debug);
		FieldMeshUtils.setDebugMode(debug);
	}

	/**
	 * Gets the last subject directory used.
	 *
	 * @return the directory or null if none has been stored or if it no longer
	 *         exists
	 */
	public File getLastSubjectDir() {
		final String path = prefService.get(FieldMeshPrefs.class, LAST_SUBJECT_DIR, null);
		if (path == null) return null;
		final File dir = new File(path);
		return (dir.isDirectory()) ? dir : null;
	}

	public void setLastSubjectDir(final File dir) {
		if (dir == null)
			prefService.remove(FieldMeshPrefs.class, LAST_SUBJECT_DIR);
		else
			prefService.put(FieldMeshPrefs.class, LAST_SUBJECT_DIR, dir.getAbsolutePath());
	}

	public int getHistogramBins() {
		return getPositiveInt(HISTOGRAM_BINS, DEF_HISTOGRAM_BINS);
	}

	public void setHistogramBins(final int bins) {
		putPositiveInt(HISTOGRAM_BINS, bins);
	}

	public int getScatterSubsample() {
		return getPositiveInt(SCATTER_SUBSAMPLE, DEF_SCATTER_SUBSAMPLE);
	}

	public void setScatterSubsample(final int nPoints) {
		putPositiveInt(SCATTER_SUBSAMPLE, nPoints);
	}

	public int getCrossSectionGrid() {
		return getPositiveInt(CROSS_SECTION_GRID, DEF_CROSS_SECTION_GRID);
	}

	public void setCrossSectionGrid(final int gridSize) {
		putPositiveInt(CROSS_SECTION_GRID, gridSize);
	}

	/**
	 * @return whether completions of superseded load requests are discarded
	 *         rather than published
	 */
	public boolean isGuardStaleResults() {
		return prefService.getBoolean(FieldMeshPrefs.class, GUARD_STALE_RESULTS, DEF_GUARD_STALE_RESULTS);
	}

	public void setGuardStaleResults(final boolean guard) {
		prefService.put(FieldMeshPrefs.class, GUARD_STALE_RESULTS, guard);
	}

	/**
	 * Assembles the settings to be handed to a renderer at construction,
	 * including the histogram, scatter and cross-section options.
	 *
	 * @return the current render settings
	 */
	public RenderSettings getRenderSettings() {
		final boolean suppress = prefService.getBoolean(FieldMeshPrefs.class, SUPPRESS_RENDERER_WARNINGS,
				DEF_SUPPRESS_RENDERER_WARNINGS);
		final String color = prefService.get(FieldMeshPrefs.class, BACKGROUND_COLOR, null);
		ColorRGB background = DEF_BACKGROUND_COLOR;
		if (color != null) {
			try {
				background = ColorRGB.fromHTMLColor(color);
			} catch (final IllegalArgumentException | NullPointerException ex) {
				FieldMeshUtils.warn("Ignoring invalid background color preference: " + color);
			}
		}
		return new RenderSettings(suppress, (background == null) ? DEF_BACKGROUND_COLOR : background,
				getHistogramBins(), getScatterSubsample(), getCrossSectionGrid());
	}

	public void setRenderSettings(final RenderSettings settings) {
		prefService.put(FieldMeshPrefs.class, SUPPRESS_RENDERER_WARNINGS, settings.isSuppressWarnings());
		prefService.put(FieldMeshPrefs.class, BACKGROUND_COLOR, settings.getBackground().toHTMLColor());
		setHistogramBins(settings.getHistogramBins());
		setScatterSubsample(settings.getScatterSubsample());
		setCrossSectionGrid(settings.getCrossSectionGrid());
	}

	/**
	 * Restores all options to their defaults.
	 */
	public void reset() {
		prefService.clear(FieldMeshPrefs.class);
	}

	private int getPositiveInt(final String key, final int defaultValue) {
		final int value = prefService.getInt(FieldMeshPrefs.class, key, defaultValue);
		return (value > 0) ? value : defaultValue;
	}

	private void putPositiveInt(final String key, final int value) {
		if (value <= 0) throw new IllegalArgumentException(key + " must be > 0");
		prefService.put(FieldMeshPrefs.class, key, value);
	}

}
