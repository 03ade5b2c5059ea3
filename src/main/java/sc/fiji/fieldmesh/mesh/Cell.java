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

import java.util.Arrays;

/**
 * An immutable mesh cell: a typed, ordered list of point indices.
 */
public final class Cell {

	private final CellType type;
	private final int[] pointIds;

	/**
	 * @param type the cell type
	 * @param pointIds the point indices. The array is copied.
	 * @throws IllegalArgumentException if the number of indices does not match
	 *           the cell type
	 */
	public Cell(final CellType type, final int... pointIds) {
		if (type == null) throw new IllegalArgumentException("type cannot be null");
		if (pointIds == null || pointIds.length != type.getVertexCount())
			throw new IllegalArgumentException(type + " cells require " + type.getVertexCount() + " point ids");
		this.type = type;
		this.pointIds = pointIds.clone();
	}

	public CellType getType() {
		return type;
	}

	/** @return the number of point indices */
	public int size() {
		return pointIds.length;
	}

	/**
	 * @param i the vertex position within this cell
	 * @return the point index at position i
	 */
	public int getPointId(final int i) {
		return pointIds[i];
	}

	/** @return a copy of the point indices */
	public int[] getPointIds() {
		return pointIds.clone();
	}

	@Override
	public boolean equals(final Object o) {
		if (this == o) return true;
		if (!(o instanceof Cell)) return false;
		final Cell other = (Cell) o;
		return type == other.type && Arrays.equals(pointIds, other.pointIds);
	}

	@Override
	public int hashCode() {
		return 31 * type.hashCode() + Arrays.hashCode(pointIds);
	}

	@Override
	public String toString() {
		return type + Arrays.toString(pointIds);
	}

}
