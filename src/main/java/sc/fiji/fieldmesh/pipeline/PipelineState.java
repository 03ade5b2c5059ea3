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

/**
 * States of a {@link LoadPipeline}. {@link #READY} and {@link #FAILED} are
 * terminal.
 */
public enum PipelineState {

	IDLE, MESH_LOADING, OVERLAY_MERGING, READY, FAILED;

	public boolean isTerminal() {
		return this == READY || this == FAILED;
	}

	/**
	 * @param next the candidate state
	 * @return whether a pipeline in this state may move to {@code next}
	 */
	public boolean canTransitionTo(final PipelineState next) {
		switch (this) {
		case IDLE:
			return next == MESH_LOADING;
		case MESH_LOADING:
			return next == OVERLAY_MERGING || next == FAILED;
		case OVERLAY_MERGING:
			return next == READY || next == FAILED;
		default:
			return false;
		}
	}

}
