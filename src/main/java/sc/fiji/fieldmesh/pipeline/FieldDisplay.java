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

import sc.fiji.fieldmesh.FieldMeshException;

/**
 * Receiver of the outcomes of load pipelines, such as a 3D viewer or a
 * statistics table. All methods are invoked on the control thread.
 * Implementations are expected to receive their {@link RenderSettings} at
 * construction.
 */
public interface FieldDisplay {

	/**
	 * Displays a freshly published result.
	 *
	 * @param result the result
	 */
	void show(LoadResult result);

	/**
	 * Reports a fatal failure to the user.
	 *
	 * @param pipelineId the id of the failed pipeline
	 * @param failure the cause of failure
	 */
	void showError(long pipelineId, FieldMeshException failure);

	/**
	 * Notifies progress of a pipeline. Does nothing by default.
	 *
	 * @param pipelineId the id of the pipeline
	 * @param state its new state
	 */
	default void stateChanged(final long pipelineId, final PipelineState state) {
		// no-op
	}

}
