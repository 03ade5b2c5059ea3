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

package sc.fiji.fieldmesh.pipeline;

import java.util.Objects;

import org.scijava.util.ColorRGB;

import sc.fiji.fieldmesh.FieldMeshPrefs;

/**
 * Rendering options handed to a {@link FieldDisplay} when it is constructed.
 * Instances are immutable: displays never consult process-wide state for
 * these options.
 */
public class RenderSettings {

	private final boolean suppressWarnings;
	private final ColorRGB background;
	private final int histogramBins;
	private final int scatterSubsample;
	private final int crossSectionGrid;

	/**
	 * Creates settings using default plot options.
	 *
	 * @param suppressWarnings whether diagnostic warnings emitted by the
	 *          rendering backend should be muted
	 * @param background the viewer background color
	 */
	public RenderSettings(final boolean suppressWarnings, final ColorRGB background) {
		this(suppressWarnings, background, FieldMeshPrefs.DEF_HISTOGRAM_BINS, FieldMeshPrefs.DEF_SCATTER_SUBSAMPLE,
				FieldMeshPrefs.DEF_CROSS_SECTION_GRID);
	}

	/**
	 * @param suppressWarnings whether diagnostic warnings emitted by the
	 *          rendering backend should be muted
	 * @param background the viewer background color
	 * @param histogramBins the number of bins of field histograms
	 * @param scatterSubsample the maximum number of samples in scatter views
	 * @param crossSectionGrid the grid size from which cross-section
	 *          tolerances are derived
	 */
	public RenderSettings(final boolean suppressWarnings, final ColorRGB background, final int histogramBins,
			final int scatterSubsample, final int crossSectionGrid) {
		if (histogramBins <= 0 || scatterSubsample <= 0 || crossSectionGrid <= 0)
			throw new IllegalArgumentException("Plot options must be > 0");
		this.suppressWarnings = suppressWarnings;
		this.background = Objects.requireNonNull(background, "background");
		this.histogramBins = histogramBins;
		this.scatterSubsample = scatterSubsample;
		this.crossSectionGrid = crossSectionGrid;
	}

	public boolean isSuppressWarnings() {
		return suppressWarnings;
	}

	public ColorRGB getBackground() {
		return background;
	}

	public int getHistogramBins() {
		return histogramBins;
	}

	public int getScatterSubsample() {
		return scatterSubsample;
	}

	public int getCrossSectionGrid() {
		return crossSectionGrid;
	}

	@Override
	public boolean equals(final Object o) {
		if (this == o) return true;
		if (!(o instanceof RenderSettings)) return false;
		final RenderSettings other = (RenderSettings) o;
		return suppressWarnings == other.suppressWarnings && background.getARGB() == other.background.getARGB()
				&& histogramBins == other.histogramBins && scatterSubsample == other.scatterSubsample
				&& crossSectionGrid == other.crossSectionGrid;
	}

	@Override
	public int hashCode() {
		return Objects.hash(suppressWarnings, background.getARGB(), histogramBins, scatterSubsample, crossSectionGrid);
	}

	@Override
	public String toString() {
		return "RenderSettings [suppressWarnings=" + suppressWarnings + ", background=" + background.toHTMLColor()
				+ ", histogramBins=" + histogramBins + ", scatterSubsample=" + scatterSubsample + ", crossSectionGrid="
				+ crossSectionGrid + "]";
	}

}
