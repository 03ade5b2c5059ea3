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

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import sc.fiji.fieldmesh.analysis.ColorTransferFunction;
import sc.fiji.fieldmesh.analysis.StatisticsReport;
import sc.fiji.fieldmesh.analysis.TissueStatistics;
import sc.fiji.fieldmesh.annotation.Tissue;
import sc.fiji.fieldmesh.io.FieldSample;
import sc.fiji.fieldmesh.mesh.AugmentedGrid;

/**
 * Outcome of a successful {@link LoadPipeline}: the grid to be rendered, its
 * color transfer function, and the samples and statistics of every tissue.
 */
public class LoadResult {

	private final long pipelineId;
	private final LoadRequest request;
	private final AugmentedGrid grid;
	private final ColorTransferFunction transferFunction;
	private final Map<Tissue, TissueStatistics> statistics;
	private final Map<Tissue, FieldSample> samples;

	public LoadResult(final long pipelineId, final LoadRequest request, final AugmentedGrid grid,
			final ColorTransferFunction transferFunction, final Map<Tissue, TissueStatistics> statistics,
			final Map<Tissue, FieldSample> samples) {
		this.pipelineId = pipelineId;
		this.request = request;
		this.grid = grid;
		this.transferFunction = transferFunction;
		final Map<Tissue, TissueStatistics> copy = new EnumMap<>(Tissue.class);
		copy.putAll(statistics);
		this.statistics = Collections.unmodifiableMap(copy);
		final Map<Tissue, FieldSample> sampleCopy = new EnumMap<>(Tissue.class);
		sampleCopy.putAll(samples);
		this.samples = Collections.unmodifiableMap(sampleCopy);
	}

	/** @return the id of the pipeline that produced this result */
	public long getPipelineId() {
		return pipelineId;
	}

	public LoadRequest getRequest() {
		return request;
	}

	public AugmentedGrid getGrid() {
		return grid;
	}

	public ColorTransferFunction getTransferFunction() {
		return transferFunction;
	}

	public Map<Tissue, TissueStatistics> getStatistics() {
		return statistics;
	}

	/** @return the samples of every tissue, empty for tissues without data */
	public Map<Tissue, FieldSample> getSamples() {
		return samples;
	}

	public StatisticsReport getReport() {
		return new StatisticsReport(statistics);
	}

}
