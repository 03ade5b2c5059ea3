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
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import javax.swing.SwingUtilities;

import org.scijava.Context;

import sc.fiji.fieldmesh.FieldMeshException;
import sc.fiji.fieldmesh.FieldMeshPrefs;
import sc.fiji.fieldmesh.util.Logger;

/**
 * Runs {@link LoadPipeline}s off the control thread and publishes their
 * outcomes back onto it. Each submitted request becomes a new pipeline with a
 * monotonically increasing id; in-flight pipelines are never cancelled. When
 * stale results are guarded against (the default), outcomes of pipelines
 * superseded by a later request are discarded, otherwise the last pipeline to
 * finish wins.
 */
public class LoadCoordinator {

	private final FieldDisplay display;
	private final ExecutorService workers;
	private final Executor control;
	private final boolean guardStaleResults;
	private final Logger logger;
	private final AtomicLong latestId = new AtomicLong();

	/* Only accessed on the control thread */
	private LoadResult published;
	private volatile boolean shutdown;

	/**
	 * Creates a coordinator publishing onto the Swing event dispatch thread,
	 * using the preferences of the specified context.
	 *
	 * @param context the SciJava context
	 * @param display the receiver of published outcomes
	 */
	public LoadCoordinator(final Context context, final FieldDisplay display) {
		this(display, Executors.newCachedThreadPool(), SwingUtilities::invokeLater,
				new FieldMeshPrefs(context).isGuardStaleResults(), new Logger(context, "LoadCoordinator"));
	}

	public LoadCoordinator(final FieldDisplay display, final ExecutorService workers, final Executor control,
			final boolean guardStaleResults, final Logger logger) {
		this.display = Objects.requireNonNull(display, "display");
		this.workers = Objects.requireNonNull(workers, "workers");
		this.control = Objects.requireNonNull(control, "control");
		this.guardStaleResults = guardStaleResults;
		this.logger = Objects.requireNonNull(logger, "logger");
	}

	/**
	 * Submits a new load request. Pipelines already running are left to
	 * complete.
	 *
	 * @param request the request
	 * @return the future result of the pipeline created for {@code request}. The
	 *         future completes regardless of whether its result is published.
	 * @throws IllegalStateException if this coordinator has been shut down
	 */
	public Future<LoadResult> submit(final LoadRequest request) {
		if (shutdown) throw new IllegalStateException("Coordinator has been shut down");
		final long id = latestId.incrementAndGet();
		final LoadPipeline pipeline = new LoadPipeline(id, request,
				(p, state) -> control.execute(() -> notifyState(p.getId(), state)), logger);
		logger.debug("Submitting pipeline #" + id + ": " + request);
		return workers.submit(() -> {
			try {
				final LoadResult result = pipeline.call();
				control.execute(() -> publish(result));
				return result;
			} catch (final FieldMeshException ex) {
				control.execute(() -> publishFailure(id, ex));
				throw ex;
			} catch (final Error err) {
				final FieldMeshException failure = (pipeline.getFailure() != null) ? pipeline.getFailure()
						: new PipelineException(String.valueOf(err), err);
				control.execute(() -> publishFailure(id, failure));
				throw err;
			}
		});
	}

	private boolean isStale(final long id) {
		return guardStaleResults && id != latestId.get();
	}

	private void notifyState(final long id, final PipelineState state) {
		if (isStale(id)) return;
		display.stateChanged(id, state);
	}

	private void publish(final LoadResult result) {
		if (isStale(result.getPipelineId())) {
			logger.info("Discarding result of superseded pipeline #" + result.getPipelineId());
			return;
		}
		published = result;
		display.show(result);
	}

	private void publishFailure(final long id, final FieldMeshException failure) {
		if (isStale(id)) {
			logger.info("Discarding failure of superseded pipeline #" + id + ": " + failure.getUserMessage());
			return;
		}
		logger.error("Pipeline #" + id + " failed: " + failure.getUserMessage(), failure);
		display.showError(id, failure);
	}

	/**
	 * @return the last published result, or null if none has been published.
	 *         Should be called from the control thread.
	 */
	public LoadResult getPublished() {
		return published;
	}

	/** @return the id of the most recently submitted pipeline, 0 if none */
	public long getLatestId() {
		return latestId.get();
	}

	public boolean isGuardStaleResults() {
		return guardStaleResults;
	}

	/**
	 * Stops accepting requests and waits briefly for running pipelines before
	 * interrupting them.
	 */
	public void shutdown() {
		shutdown = true;
		workers.shutdown();
		try {
			if (!workers.awaitTermination(1L, TimeUnit.SECONDS)) {
				workers.shutdownNow();
				if (!workers.awaitTermination(1L, TimeUnit.SECONDS))
					logger.warn("Load workers did not terminate");
			}
		} catch (final InterruptedException ie) {
			workers.shutdownNow();
			Thread.currentThread().interrupt();
		}
	}

	public boolean isShutdown() {
		return shutdown;
	}

}
