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

import java.util.Collections;
import java.util.List;

import sc.fiji.fieldmesh.util.FieldPoint;

/**
 * A renderable grid built from a {@link RawMesh}: point {@code i} is node
 * {@code i} of the mesh, and cells reference mesh node ids unchanged.
 *
 * @see MeshGridBuilder
 */
public class IndexedGrid {

	protected final double[] points;
	protected final List<Cell> cells;

	IndexedGrid(final double[] points, final List<Cell> cells) {
		this.points = points;
		this.cells = Collections.unmodifiableList(cells);
	}

	/** @return the number of points */
	public int getPointCount() {
		return points.length / 3;
	}

	public double getX(final int pointId) {
		return points[3 * pointId];
	}

	public double getY(final int pointId) {
		return points[3 * pointId + 1];
	}

	public double getZ(final int pointId) {
		return points[3 * pointId + 2];
	}

	public FieldPoint getPoint(final int pointId) {
		if (pointId < 0 || pointId >= getPointCount())
			throw new IndexOutOfBoundsException("Point " + pointId + " out of range [0, " + getPointCount() + ")");
		return new FieldPoint(getX(pointId), getY(pointId), getZ(pointId));
	}

	/** @return a copy of the interleaved point coordinates */
	public double[] getPoints() {
		return points.clone();
	}

	/* no copy: for the merger in this package only */
	double[] points() {
		return points;
	}

	/** @return the cells: all tetrahedra first, then all triangles */
	public List<Cell> getCells() {
		return cells;
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "[" + getPointCount() + " points, " + cells.size() + " cells]";
	}

}
