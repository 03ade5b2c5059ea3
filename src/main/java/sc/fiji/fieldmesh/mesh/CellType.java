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

/**
 * Cell types retained when decoding a volumetric head mesh. Identifiers of
 * the corresponding element types in the Gmsh and VTK file formats are
 * recorded so that decoders can match them exhaustively.
 */
public enum CellType {

	TETRA(4, 4, 10), //
	TRIANGLE(3, 2, 5);

	private final int nVertices;
	private final int gmshType;
	private final int vtkType;

	CellType(final int nVertices, final int gmshType, final int vtkType) {
		this.nVertices = nVertices;
		this.gmshType = gmshType;
		this.vtkType = vtkType;
	}

	/** @return the number of point indices referenced by a cell of this type */
	public int getVertexCount() {
		return nVertices;
	}

	public int getGmshType() {
		return gmshType;
	}

	public int getVtkType() {
		return vtkType;
	}

	/**
	 * @param gmshType a Gmsh element type
	 * @return the matching cell type, or null if the element type is not
	 *         retained (points, lines, quads, etc.)
	 */
	public static CellType fromGmshType(final int gmshType) {
		for (final CellType t : values()) {
			if (t.gmshType == gmshType) return t;
		}
		return null;
	}

	/**
	 * @param vtkType a VTK cell type
	 * @return the matching cell type, or null if the cell type is not retained
	 */
	public static CellType fromVtkType(final int vtkType) {
		for (final CellType t : values()) {
			if (t.vtkType == vtkType) return t;
		}
		return null;
	}

}
