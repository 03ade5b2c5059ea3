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

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.StringTokenizer;

import sc.fiji.fieldmesh.FieldMeshUtils;
import sc.fiji.fieldmesh.mesh.Cell;
import sc.fiji.fieldmesh.mesh.CellType;
import sc.fiji.fieldmesh.mesh.RawMesh;

/**
 * Decodes legacy VTK ASCII files holding an {@code UNSTRUCTURED_GRID} dataset,
 * such as the per-tissue surface models exported alongside head meshes. Both
 * the classic {@code CELLS} layout and the 5.1 {@code OFFSETS}/
 * {@code CONNECTIVITY} layout are supported. Only tetrahedra (VTK type 10) and
 * triangles (VTK type 5) are retained; point and cell data are ignored.
 */
public class LegacyVtkMeshDecoder implements MeshDecoder {

	@Override
	public RawMesh decode(final File file) throws MeshDecodeException {
		if (file == null) throw new IllegalArgumentException("file cannot be null");
		if (!file.isFile()) throw new MeshDecodeException("Mesh file not found: " + file);
		try (BufferedReader reader = Files.newBufferedReader(file.toPath(), StandardCharsets.ISO_8859_1)) {
			final RawMesh mesh = parse(reader, file.getName());
			FieldMeshUtils.log("Decoded " + file.getName() + ": " + mesh);
			return mesh;
		} catch (final IOException e) {
			throw new MeshDecodeException("Could not read " + file.getName(), e);
		}
	}

	RawMesh parse(final Reader reader, final String name) throws IOException, MeshDecodeException {
		final BufferedReader br = (reader instanceof BufferedReader) ? (BufferedReader) reader
				: new BufferedReader(reader);
		final String signature = br.readLine();
		if (signature == null || !signature.toLowerCase(Locale.ROOT).startsWith("# vtk datafile"))
			throw new MeshDecodeException(name + ": not a legacy VTK file");
		br.readLine(); // title
		final String encoding = br.readLine();
		if (encoding == null || !"ASCII".equalsIgnoreCase(encoding.trim()))
			throw new MeshDecodeException(name + ": only ASCII legacy VTK files are supported");

		final Tokens tokens = new Tokens(br, name);
		double[] coords = null;
		int[][] cells = null;
		int[] types = null;
		String keyword;
		while ((keyword = tokens.nextOrNull()) != null) {
			switch (keyword.toUpperCase(Locale.ROOT)) {
			case "DATASET":
				final String kind = tokens.next();
				if (!"UNSTRUCTURED_GRID".equalsIgnoreCase(kind))
					throw new MeshDecodeException(name + ": unsupported dataset " + kind);
				break;
			case "POINTS":
				final int nPoints = tokens.nextCount("POINTS");
				if (nPoints > Integer.MAX_VALUE / 3)
					throw new MeshDecodeException(name + ": too many points (" + nPoints + ")");
				tokens.next(); // data type
				coords = new double[3 * nPoints];
				for (int i = 0; i < coords.length; i++)
					coords[i] = tokens.nextDouble();
				break;
			case "CELLS":
				cells = parseCells(tokens, name);
				break;
			case "CELL_TYPES":
				types = new int[tokens.nextCount("CELL_TYPES")];
				for (int i = 0; i < types.length; i++)
					types[i] = tokens.nextInt();
				break;
			case "POINT_DATA":
			case "CELL_DATA":
				keyword = null;
				break;
			default:
				// METADATA, FIELD, etc. are not needed
				break;
			}
			if (keyword == null) break;
		}
		if (coords == null) throw new MeshDecodeException(name + ": no POINTS section");
		if (cells == null) cells = new int[0][];
		if (types == null) types = new int[0];
		if (types.length != cells.length)
			throw new MeshDecodeException(name + ": " + cells.length + " cells but " + types.length + " cell types");

		final int nNodes = coords.length / 3;
		final List<Cell> tetra = new ArrayList<>();
		final List<Cell> triangles = new ArrayList<>();
		for (int i = 0; i < cells.length; i++) {
			final CellType type = CellType.fromVtkType(types[i]);
			if (type == null) continue;
			if (cells[i].length != type.getVertexCount())
				throw new MeshDecodeException(name + ": cell " + i + " has " + cells[i].length + " points");
			for (final int id : cells[i]) {
				if (id < 0 || id >= nNodes)
					throw new MeshDecodeException(name + ": cell " + i + " references undefined point " + id);
			}
			if (type == CellType.TETRA)
				tetra.add(new Cell(type, cells[i]));
			else
				triangles.add(new Cell(type, cells[i]));
		}
		return new RawMesh(coords, tetra, triangles);
	}

	private int[][] parseCells(final Tokens tokens, final String name) throws IOException, MeshDecodeException {
		final int first = tokens.nextCount("CELLS");
		final int second = tokens.nextCount("CELLS");
		final String next = tokens.peek();
		if (next != null && "OFFSETS".equalsIgnoreCase(next)) {
			// VTK 5.1: CELLS <nOffsets> <nConnectivity>
			tokens.next();
			tokens.next(); // data type
			final int[] offsets = new int[first];
			for (int i = 0; i < first; i++)
				offsets[i] = tokens.nextInt();
			if (!"CONNECTIVITY".equalsIgnoreCase(tokens.next()))
				throw new MeshDecodeException(name + ": CONNECTIVITY expected");
			tokens.next(); // data type
			final int[] connectivity = new int[second];
			for (int i = 0; i < second; i++)
				connectivity[i] = tokens.nextInt();
			final int nCells = Math.max(0, first - 1);
			final int[][] cells = new int[nCells][];
			for (int c = 0; c < nCells; c++) {
				final int from = offsets[c];
				final int to = offsets[c + 1];
				if (from < 0 || to < from || to > connectivity.length)
					throw new MeshDecodeException(name + ": invalid offsets for cell " + c);
				cells[c] = new int[to - from];
				System.arraycopy(connectivity, from, cells[c], 0, to - from);
			}
			return cells;
		}
		// classic layout: CELLS <nCells> <size>, each cell being "<n> id1 ... idn"
		final int[][] cells = new int[first][];
		for (int c = 0; c < first; c++) {
			final int n = tokens.nextCount("cell " + c);
			cells[c] = new int[n];
			for (int j = 0; j < n; j++)
				cells[c][j] = tokens.nextInt();
		}
		return cells;
	}

	/** Whitespace tokenizer spanning lines */
	private static class Tokens {

		private final BufferedReader reader;
		private final String name;
		private StringTokenizer current;
		private String peeked;

		Tokens(final BufferedReader reader, final String name) {
			this.reader = reader;
			this.name = name;
		}

		String nextOrNull() throws IOException {
			if (peeked != null) {
				final String p = peeked;
				peeked = null;
				return p;
			}
			while (current == null || !current.hasMoreTokens()) {
				final String line = reader.readLine();
				if (line == null) return null;
				current = new StringTokenizer(line);
			}
			return current.nextToken();
		}

		String peek() throws IOException {
			if (peeked == null) peeked = nextOrNull();
			return peeked;
		}

		String next() throws IOException, MeshDecodeException {
			final String t = nextOrNull();
			if (t == null) throw new MeshDecodeException(name + ": unexpected end of file");
			return t;
		}

		int nextInt() throws IOException, MeshDecodeException {
			final String t = next();
			try {
				return Integer.parseInt(t);
			} catch (final NumberFormatException e) {
				throw new MeshDecodeException(name + ": invalid integer '" + t + "'", e);
			}
		}

		/** Reads a non-negative element count */
		int nextCount(final String section) throws IOException, MeshDecodeException {
			final int n = nextInt();
			if (n < 0) throw new MeshDecodeException(name + ": negative count " + n + " in " + section);
			return n;
		}

		double nextDouble() throws IOException, MeshDecodeException {
			final String t = next();
			try {
				return Double.parseDouble(t);
			} catch (final NumberFormatException e) {
				throw new MeshDecodeException(name + ": invalid number '" + t + "'", e);
			}
		}
	}

}
