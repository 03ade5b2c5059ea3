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

/**
 * Asynchronous loading of field-augmented meshes.
 * <p>
 * A {@link sc.fiji.fieldmesh.pipeline.LoadPipeline} decodes a head mesh, builds
 * its grid, overlays the field samples of a directory and summarizes the field
 * of every tissue. Pipelines run on worker threads managed by a
 * {@link sc.fiji.fieldmesh.pipeline.LoadCoordinator}, which hands their
 * outcomes to a {@link sc.fiji.fieldmesh.pipeline.FieldDisplay} on the control
 * thread.
 * </p>
 *
 * <h2>Pipeline states</h2>
 * <pre>
 * IDLE -&gt; MESH_LOADING -&gt; OVERLAY_MERGING -&gt; READY
 *              |                 |
 *              +------&gt; FAILED &lt;-+
 * </pre>
 * A new request never cancels pipelines in flight. Unless disabled in
 * {@link sc.fiji.fieldmesh.FieldMeshPrefs}, outcomes of superseded pipelines
 * are discarded rather than displayed.
 */
package sc.fiji.fieldmesh.pipeline;
