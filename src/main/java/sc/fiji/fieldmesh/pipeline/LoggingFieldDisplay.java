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

import java.util.Map;
import java.util.Objects;
import java.util.Random;

import sc.fiji.fieldmesh.FieldMeshException;
import sc.fiji.fieldmesh.FieldMeshUtils;
import sc.fiji.fieldmesh.analysis.ColorTransferFunction;
import sc.fiji.fieldmesh.analysis.FieldHistogram;
import sc.fiji.fieldmesh.analysis.FieldOverview;
import sc.fiji.fieldmesh.analysis.FocalView;
import sc.fiji.fieldmesh.annotation.Tissue;
import sc.fiji.fieldmesh.mesh.AugmentedGrid;
import sc.fiji.fieldmesh.util.Logger;

/**
 * Headless {@link FieldDisplay} that reports published outcomes to the log:
 * grid dimensions, color table range, per-tissue statistics and histograms,
 * and an overview of the primary tissue built with the plot options of its
 * {@link RenderSettings}.
 */
public class LoggingFieldDisplay implements FieldDisplay {

	private final RenderSettings settings;
	private final Logger logger;
	private final Random random = new Random();
	private LoadResult lastShown;
	private FieldOverview lastOverview;
	private FieldMeshException lastError;

	public LoggingFieldDisplay(final RenderSettings settings) {
		this(settings, new Logger(LoggingFieldDisplay.class));
	}

	public LoggingFieldDisplay(final RenderSettings settings, final Logger logger) {
		this.settings = Objects.requireNonNull(settings, "settings");
		this.logger = logger;
	}

	@Override
	public void show(final LoadResult result) {
		lastShown = result;
		lastError = null;
		final AugmentedGrid grid = result.getGrid();
		final ColorTransferFunction ctf = result.getTransferFunction();
		final double[] field = grid.getScalarRange();
		final double[] range = ctf.getTableRange();
		logger.info(String.format("#%d: %d mesh nodes + %d field points, %d cells", result.getPipelineId(),
				grid.getBaseCount(), grid.getOverlayCount(), grid.getCells().size()));
		logger.info("Field range: [" + FieldMeshUtils.formatScientific(field[0]) + ", "
				+ FieldMeshUtils.formatScientific(field[1]) + "]. Color table range: ["
				+ FieldMeshUtils.formatScientific(range[0]) + ", "
				+ FieldMeshUtils.formatScientific(range[1]) + "] on background " + settings.getBackground().toHTMLColor());
		logger.info("Tissue statistics:\n" + result.getReport().toTSV());

		final Map<Tissue, FieldHistogram> histograms = FieldHistogram.of(result.getSamples(),
				settings.getHistogramBins());
		histograms.forEach((tissue, h) -> logger.debug(tissue.getLabel() + " histogram: " + h.getTotal()
				+ " values in " + h.getBinCount() + " bins"));

		final Tissue primary = FieldOverview.primaryTissue(result.getSamples());
		if (primary == null) {
			lastOverview = null;
			return;
		}
		lastOverview = new FieldOverview(primary, result.getSamples().get(primary), settings.getHistogramBins(),
				settings.getScatterSubsample(), settings.getCrossSectionGrid(), random);
		final FocalView view = lastOverview.getFocalView();
		logger.info(String.format("%s: max field %s at %s (elevation %.1f, azimuth %.1f)", primary.getLabel(),
				FieldMeshUtils.formatScientific(view.getFocalMagnitude()), view.getFocalPoint(), view.getElevation(),
				view.getAzimuth()));
		logger.debug(String.format("%s: %d of %d points in scatter, %d in cross-section", primary.getLabel(),
				lastOverview.getCloud().size(), result.getSamples().get(primary).size(),
				lastOverview.getCrossSection().getSlice().size()));
	}

	@Override
	public void showError(final long pipelineId, final FieldMeshException failure) {
		lastError = failure;
		logger.warn("#" + pipelineId + ": " + failure.getUserMessage());
	}

	@Override
	public void stateChanged(final long pipelineId, final PipelineState state) {
		logger.debug("#" + pipelineId + ": " + state);
	}

	public RenderSettings getSettings() {
		return settings;
	}

	/** @return the last result shown, or null */
	public LoadResult getLastShown() {
		return lastShown;
	}

	/**
	 * @return the overview of the primary tissue of the last result shown, or
	 *         null
	 */
	public FieldOverview getLastOverview() {
		return lastOverview;
	}

	/** @return the last failure shown, or null */
	public FieldMeshException getLastError() {
		return lastError;
	}

}
