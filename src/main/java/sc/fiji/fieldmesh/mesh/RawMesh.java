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
import java.util.Collections;
import java.util.List;


/**
 * A decoded head mesh: node coordinates plus tetrahedral and triangular cells.
 * Node ids are 0-based and contiguous (the node id is the node's position in
 * the coordinate sequence). Instances are immutable.
 */
public class RawMesh {

	private final double[] nodes;
	private final List<Cell> tetraCells;
	private final List<Cell> triangleCells;

	/**
	 * @param nodeCoordinates the interleaved node coordinates
	 *          {@code [x0, y0, z0, x1, y1, z1, ...]}. The array is copied.
	 * @param tetraCells the tetrahedral cells, in file order
	 * @param triangleCells the triangular cells, in file order
	 */
	public RawMesh(final double[] nodeCoordinates, final List<Cell> tetraCells, final List<Cell> triangleCells) {
		if (nodeCoordinates == null || nodeCoordinates.length % 3 != 0)
			throw new IllegalArgumentException("Node coordinates must be a multiple of 3");
		this.nodes = nodeCoordinates.clone();
		this.tetraCells = copyOf(tetraCells, CellType.TETRA);
		this.triangleCells = copyOf(triangleCells, CellType.TRIANGLE);
	}

	private static List<Cell> copyOf(final List<Cell> cells, final CellType expected) {
		if (cells == null) return Collections.emptyList();
		for (final Cell c : cells) {
			if (c.getType() != expected)
				throw new IllegalArgumentException("Expected " + expected + " cell but got " + c);
		}
		return Collections.unmodifiableList(new ArrayList<>(cells));
	}

	/** @return the number of nodes */
	public int getNodeCount() {
		return nodes.length / 3;
	}

	public double getX(final int nodeId) {
		return nodes[3 * nodeId];
	}

	public double getY(final int nodeId) {
		return nodes[3 * nodeId + 1];
	}

	public double getZ(final int nodeId) {
		return nodes[3 * nodeId + 2];
	}

	/* no copy: for builders in this package only */
	double[] nodeCoordinates() {
		return nodes;
	}

	public List<Cell> getTetraCells() {
		return tetraCells;
	}

	public List<Cell> getTriangleCells() {
		return triangleCells;
	}

	/** @return the total number of (tetrahedral and triangular) cells */
	public int getCellCount() {
		return tetraCells.size() + triangleCells.size();
	}

	@Override
	public String toString() {
		return "RawMesh[" + getNodeCount() + " nodes, " + tetraCells.size() + " tetra, " + triangleCells.size()
				+ " triangles]";
	}

}
