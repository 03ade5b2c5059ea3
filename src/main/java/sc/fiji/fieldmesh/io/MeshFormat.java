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

package sc.fiji.fieldmesh.io;

import java.io.File;
import java.util.Locale;

import sc.fiji.fieldmesh.mesh.RawMesh;

/**
 * Supported mesh file formats, identified by file extension.
 */
public enum MeshFormat {

	/** Gmsh 2.x (ASCII or binary), as written by SimNIBS */
	GMSH(".msh"),
	/** Legacy VTK ASCII unstructured grid */
	LEGACY_VTK(".vtk");

	private final String extension;

	MeshFormat(final String extension) {
		this.extension = extension;
	}

	public String getExtension() {
		return extension;
	}

	/**
	 * @return a new decoder for this format
	 */
	public MeshDecoder createDecoder() {
		switch (this) {
		case GMSH:
			return new GmshMeshDecoder();
		case LEGACY_VTK:
			return new LegacyVtkMeshDecoder();
		default:
			throw new IllegalStateException("No decoder for " + this);
		}
	}

	/**
	 * Identifies the format of a mesh file from its extension (case insensitive).
	 *
	 * @param file the mesh file
	 * @return the format
	 * @throws MeshDecodeException if the extension is not supported
	 */
	public static MeshFormat fromFile(final File file) throws MeshDecodeException {
		final String name = file.getName().toLowerCase(Locale.ROOT);
		for (final MeshFormat format : values()) {
			if (name.endsWith(format.extension)) return format;
		}
		throw new MeshDecodeException("Unsupported mesh format: " + file.getName());
	}

	/**
	 * Convenience method to decode a mesh file using the decoder associated with
	 * its extension.
	 *
	 * @param file the mesh file
	 * @return the decoded mesh
	 * @throws MeshDecodeException if the format is not supported or the file
	 *           could not be decoded
	 */
	public static RawMesh decode(final File file) throws MeshDecodeException {
		return fromFile(file).createDecoder().decode(file);
	}

}
