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

package sc.fiji.fieldmesh.mesh;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts a decoded {@link RawMesh} into an {@link IndexedGrid}.
 * <p>
 * Point {@code i} of the grid is node {@code i} of the mesh. Cells are
 * appended in order, all tetrahedra first and then all triangles, referencing
 * the original node ids unchanged. Cell indices are not validated: ids out of
 * range are a decoder error.
 * </p>
 */
public class MeshGridBuilder {

	/**
	 * Builds the grid.
	 *
	 * @param mesh the decoded mesh
	 * @return the indexed grid
	 * @throws EmptyMeshException if the mesh has no nodes
	 */
	public IndexedGrid build(final RawMesh mesh) throws EmptyMeshException {
		if (mesh == null) throw new IllegalArgumentException("mesh cannot be null");
		if (mesh.getNodeCount() == 0) throw new EmptyMeshException("Mesh has no nodes");
		final List<Cell> cells = new ArrayList<>(mesh.getCellCount());
		cells.addAll(mesh.getTetraCells());
		cells.addAll(mesh.getTriangleCells());
		return new IndexedGrid(mesh.nodeCoordinates().clone(), cells);
	}

}
