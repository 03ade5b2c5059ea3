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
import java.util.concurrent.Callable;

import sc.fiji.fieldmesh.FieldMeshException;
import sc.fiji.fieldmesh.analysis.ColorTransferFunction;
import sc.fiji.fieldmesh.analysis.ColorTransferFunctionBuilder;
import sc.fiji.fieldmesh.analysis.TissueStatistics;
import sc.fiji.fieldmesh.analysis.TissueStatisticsSummarizer;
import sc.fiji.fieldmesh.annotation.Tissue;
import sc.fiji.fieldmesh.io.FieldSample;
import sc.fiji.fieldmesh.io.MeshFormat;
import sc.fiji.fieldmesh.io.NpyFieldSampleDecoder;
import sc.fiji.fieldmesh.io.TissueSampleLoader;
import sc.fiji.fieldmesh.mesh.AugmentedGrid;
import sc.fiji.fieldmesh.mesh.FieldOverlayMerger;
import sc.fiji.fieldmesh.mesh.IndexedGrid;
import sc.fiji.fieldmesh.mesh.MeshGridBuilder;
import sc.fiji.fieldmesh.mesh.RawMesh;
import sc.fiji.fieldmesh.util.Logger;

/**
 * Loads a mesh, overlays it with field samples and summarizes the field of
 * every tissue. A pipeline runs once, synchronously, on the calling (worker)
 * thread: the mesh stage always completes before the overlay stage starts,
 * and exactly one terminal outcome is produced.
 */
public class LoadPipeline implements Callable<LoadResult> {

	/** Callback notified of every state transition, on the worker thread. */
	public interface StateListener {
		void stateChanged(LoadPipeline pipeline, PipelineState state);
	}

	private final long id;
	private final LoadRequest request;
	private final StateListener listener;
	private final MeshGridBuilder gridBuilder;
	private final FieldOverlayMerger merger;
	private final ColorTransferFunctionBuilder ctfBuilder;
	private final TissueSampleLoader sampleLoader;
	private final TissueStatisticsSummarizer summarizer;
	private final Logger logger;

	private volatile PipelineState state = PipelineState.IDLE;
	private volatile FieldMeshException failure;

	public LoadPipeline(final long id, final LoadRequest request, final StateListener listener) {
		this(id, request, listener, new Logger(LoadPipeline.class));
	}

	public LoadPipeline(final long id, final LoadRequest request, final StateListener listener, final Logger logger) {
		this.id = id;
		this.request = request;
		this.listener = listener;
		this.logger = logger;
		gridBuilder = new MeshGridBuilder();
		merger = new FieldOverlayMerger(new NpyFieldSampleDecoder(), logger);
		ctfBuilder = new ColorTransferFunctionBuilder();
		sampleLoader = new TissueSampleLoader(new NpyFieldSampleDecoder(), logger);
		summarizer = new TissueStatisticsSummarizer();
	}

	/**
	 * Runs the pipeline.
	 *
	 * @return the result
	 * @throws FieldMeshException if the mesh could not be loaded, or if no field
	 *           samples could be overlaid. Unexpected runtime errors are
	 *           reported as {@link PipelineException}s. {@link Error}s are
	 *           rethrown once the pipeline has moved to
	 *           {@link PipelineState#FAILED}, its failure being set to a
	 *           {@link PipelineException}.
	 * @throws IllegalStateException if this pipeline has already been run
	 */
	@Override
	public LoadResult call() throws FieldMeshException {
		synchronized (this) {
			if (state != PipelineState.IDLE) throw new IllegalStateException("Pipeline #" + id + " already ran");
			setState(PipelineState.MESH_LOADING);
		}
		try {
			logger.debug("#" + id + ": decoding " + request.getMeshFile());
			final RawMesh mesh = MeshFormat.decode(request.getMeshFile());
			final IndexedGrid grid = gridBuilder.build(mesh);
			logger.debug("#" + id + ": " + grid.getPointCount() + " nodes, " + grid.getCells().size() + " cells");

			setState(PipelineState.OVERLAY_MERGING);
			final AugmentedGrid augmented = merger.merge(grid, request.getSampleDir());
			final ColorTransferFunction ctf = ctfBuilder.build(augmented);
			final Map<Tissue, FieldSample> samples = sampleLoader.loadAll(request.getSampleDir());
			final Map<Tissue, TissueStatistics> stats = summarizer.summarize(samples);

			final LoadResult result = new LoadResult(id, request, augmented, ctf, stats, samples);
			setState(PipelineState.READY);
			return result;
		} catch (final FieldMeshException ex) {
			fail(ex);
			throw ex;
		} catch (final RuntimeException ex) {
			final PipelineException wrapped = new PipelineException(ex.getMessage(), ex);
			fail(wrapped);
			throw wrapped;
		} catch (final Error err) {
			// recorded as an internal failure, but the error itself is propagated
			fail(new PipelineException(String.valueOf(err), err));
			throw err;
		}
	}

	private void fail(final FieldMeshException ex) {
		failure = ex;
		setState(PipelineState.FAILED);
	}

	private void setState(final PipelineState newState) {
		if (!state.canTransitionTo(newState))
			throw new IllegalStateException("Invalid transition " + state + " -> " + newState);
		state = newState;
		if (listener != null) listener.stateChanged(this, newState);
	}

	public long getId() {
		return id;
	}

	public LoadRequest getRequest() {
		return request;
	}

	public PipelineState getState() {
		return state;
	}

	/** @return the cause of failure, or null if this pipeline has not failed */
	public FieldMeshException getFailure() {
		return failure;
	}

}
