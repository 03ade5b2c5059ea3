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

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import sc.fiji.fieldmesh.FieldMeshUtils;
import sc.fiji.fieldmesh.mesh.Cell;
import sc.fiji.fieldmesh.mesh.CellType;
import sc.fiji.fieldmesh.mesh.RawMesh;

/**
 * Decodes Gmsh 2.x mesh files (ASCII and binary). Only tetrahedra (element
 * type 4) and triangles (element type 2) are retained. Gmsh node tags are
 * mapped to contiguous 0-based ids in file order. Post-processing sections
 * ({@code $NodeData}, {@code $ElementData}, {@code $ElementNodeData}) and any
 * other section are skipped.
 */
public class GmshMeshDecoder implements MeshDecoder {

	/* number of nodes of each Gmsh element type (index = type) */
	private static final int[] NODES_PER_TYPE = { -1, 2, 3, 4, 4, 8, 6, 5, 3, 6, 9, 10, 27, 18, 14, 1, 8, 20, 15,
			13 };

	@Override
	public RawMesh decode(final File file) throws MeshDecodeException {
		if (file == null) throw new IllegalArgumentException("file cannot be null");
		if (!file.isFile()) throw new MeshDecodeException("Mesh file not found: " + file);
		try (InputStream is = new BufferedInputStream(new FileInputStream(file), 1 << 16)) {
			final RawMesh mesh = new Parser(is, file.getName()).parse();
			FieldMeshUtils.log("Decoded " + file.getName() + ": " + mesh);
			return mesh;
		} catch (final EOFException e) {
			throw new MeshDecodeException(file.getName() + ": unexpected end of file", e);
		} catch (final IOException e) {
			throw new MeshDecodeException("Could not read " + file.getName(), e);
		}
	}

	private static class Parser {

		private final InputStream in;
		private final String name;
		private boolean formatParsed;
		private boolean binary;
		private ByteOrder order = ByteOrder.LITTLE_ENDIAN;
		private double[] coords;
		private NodeIndex nodeIndex;
		private final List<Cell> tetra = new ArrayList<>();
		private final List<Cell> triangles = new ArrayList<>();
		private final byte[] scratch = new byte[8];

		Parser(final InputStream in, final String name) {
			this.in = in;
			this.name = name;
		}

		RawMesh parse() throws IOException, MeshDecodeException {
			String line;
			while ((line = readLine()) != null) {
				if (line.isEmpty()) continue;
				switch (line) {
				case "$MeshFormat":
					parseFormat();
					break;
				case "$Nodes":
					parseNodes();
					break;
				case "$Elements":
					parseElements();
					break;
				case "$NodeData":
				case "$ElementData":
				case "$ElementNodeData":
					skipDataSection(line);
					break;
				default:
					if (!line.startsWith("$"))
						throw new MeshDecodeException(name + ": unexpected content '" + line + "'");
					skipToEnd(line);
				}
			}
			if (coords == null) throw new MeshDecodeException(name + ": no $Nodes section");
			return new RawMesh(coords, tetra, triangles);
		}

		private void parseFormat() throws IOException, MeshDecodeException {
			final String[] tokens = tokens(requireLine());
			if (tokens.length < 3) throw new MeshDecodeException(name + ": invalid $MeshFormat");
			final double version = parseDouble(tokens[0]);
			if (version < 2 || version >= 3)
				throw new MeshDecodeException(name + ": unsupported Gmsh version " + tokens[0] + " (2.x required)");
			binary = parseInt(tokens[1]) == 1;
			if (parseInt(tokens[2]) != 8)
				throw new MeshDecodeException(name + ": unsupported data size " + tokens[2]);
			if (binary) {
				readBytes(4);
				if (ByteBuffer.wrap(scratch, 0, 4).order(ByteOrder.LITTLE_ENDIAN).getInt() == 1)
					order = ByteOrder.LITTLE_ENDIAN;
				else if (ByteBuffer.wrap(scratch, 0, 4).order(ByteOrder.BIG_ENDIAN).getInt() == 1)
					order = ByteOrder.BIG_ENDIAN;
				else
					throw new MeshDecodeException(name + ": invalid binary endianness marker");
			}
			expectEnd("$EndMeshFormat");
			formatParsed = true;
		}

		private void parseNodes() throws IOException, MeshDecodeException {
			if (!formatParsed) throw new MeshDecodeException(name + ": $Nodes before $MeshFormat");
			final int n = parseInt(requireLine());
			if (n < 0) throw new MeshDecodeException(name + ": invalid node count " + n);
			coords = new double[3 * n];
			final int[] tags = new int[n];
			for (int i = 0; i < n; i++) {
				if (binary) {
					tags[i] = readInt();
					coords[3 * i] = readDouble();
					coords[3 * i + 1] = readDouble();
					coords[3 * i + 2] = readDouble();
				} else {
					final String[] t = tokens(requireLine());
					if (t.length < 4) throw new MeshDecodeException(name + ": invalid node record " + (i + 1));
					tags[i] = parseInt(t[0]);
					coords[3 * i] = parseDouble(t[1]);
					coords[3 * i + 1] = parseDouble(t[2]);
					coords[3 * i + 2] = parseDouble(t[3]);
				}
			}
			nodeIndex = NodeIndex.of(tags);
			expectEnd("$EndNodes");
		}

		private void parseElements() throws IOException, MeshDecodeException {
			if (nodeIndex == null) throw new MeshDecodeException(name + ": $Elements before $Nodes");
			final int n = parseInt(requireLine());
			if (binary) {
				int read = 0;
				while (read < n) {
					final int type = readInt();
					final int follow = readInt();
					final int nTags = readInt();
					final int nNodes = nodesPerType(type);
					final CellType cellType = CellType.fromGmshType(type);
					for (int e = 0; e < follow; e++) {
						readInt(); // element tag
						for (int t = 0; t < nTags; t++)
							readInt();
						final int[] ids = new int[nNodes];
						for (int j = 0; j < nNodes; j++)
							ids[j] = nodeIndex.lookup(readInt(), name);
						addCell(cellType, ids);
					}
					read += follow;
				}
			} else {
				for (int i = 0; i < n; i++) {
					final String[] t = tokens(requireLine());
					if (t.length < 3) throw new MeshDecodeException(name + ": invalid element record " + (i + 1));
					final CellType cellType = CellType.fromGmshType(parseInt(t[1]));
					if (cellType == null) continue;
					final int first = 3 + parseInt(t[2]);
					if (t.length - first != cellType.getVertexCount())
						throw new MeshDecodeException(name + ": element " + t[0] + " has " + (t.length - first)
								+ " nodes, expected " + cellType.getVertexCount());
					final int[] ids = new int[cellType.getVertexCount()];
					for (int j = 0; j < ids.length; j++)
						ids[j] = nodeIndex.lookup(parseInt(t[first + j]), name);
					addCell(cellType, ids);
				}
			}
			expectEnd("$EndElements");
		}

		private void addCell(final CellType type, final int[] ids) {
			if (type == null) return;
			switch (type) {
			case TETRA:
				tetra.add(new Cell(type, ids));
				break;
			case TRIANGLE:
				triangles.add(new Cell(type, ids));
				break;
			default:
				throw new IllegalStateException("Unhandled cell type " + type);
			}
		}

		private int nodesPerType(final int type) throws MeshDecodeException {
			if (type <= 0 || type >= NODES_PER_TYPE.length)
				throw new MeshDecodeException(name + ": unsupported binary element type " + type);
			return NODES_PER_TYPE[type];
		}

		private void skipDataSection(final String section) throws IOException, MeshDecodeException {
			final int nStrings = parseInt(requireLine());
			for (int i = 0; i < nStrings; i++)
				requireLine();
			final int nReals = parseInt(requireLine());
			for (int i = 0; i < nReals; i++)
				requireLine();
			final int nInts = parseInt(requireLine());
			final int[] ints = new int[nInts];
			for (int i = 0; i < nInts; i++)
				ints[i] = parseInt(requireLine());
			if (nInts < 3) throw new MeshDecodeException(name + ": invalid " + section + " header");
			final int nComponents = ints[1];
			final int nEntities = ints[2];
			for (int e = 0; e < nEntities; e++) {
				if (!binary) {
					requireLine();
				} else if ("$ElementNodeData".equals(section)) {
					readInt();
					final int nNodes = readInt();
					skipBytes(8L * nNodes * nComponents);
				} else {
					skipBytes(4L + 8L * nComponents);
				}
			}
			expectEnd("$End" + section.substring(1));
		}

		private void skipToEnd(final String section) throws IOException, MeshDecodeException {
			final String end = "$End" + section.substring(1);
			String line;
			while ((line = readLine()) != null) {
				if (line.equals(end)) return;
			}
			throw new MeshDecodeException(name + ": missing " + end);
		}

		private void expectEnd(final String marker) throws IOException, MeshDecodeException {
			String line;
			while ((line = readLine()) != null) {
				if (line.isEmpty()) continue;
				if (line.equals(marker)) return;
				throw new MeshDecodeException(name + ": expected " + marker + " but found '" + line + "'");
			}
			throw new MeshDecodeException(name + ": missing " + marker);
		}

		private String requireLine() throws IOException, MeshDecodeException {
			String line;
			while ((line = readLine()) != null) {
				if (!line.isEmpty()) return line;
			}
			throw new MeshDecodeException(name + ": unexpected end of file");
		}

		private String readLine() throws IOException {
			final ByteArrayOutputStream buffer = new ByteArrayOutputStream(64);
			int b;
			while ((b = in.read()) != -1) {
				if (b == '\n') break;
				buffer.write(b);
			}
			if (b == -1 && buffer.size() == 0) return null;
			return new String(buffer.toByteArray(), StandardCharsets.ISO_8859_1).trim();
		}

		private void readBytes(final int n) throws IOException {
			int off = 0;
			while (off < n) {
				final int r = in.read(scratch, off, n - off);
				if (r < 0) throw new EOFException();
				off += r;
			}
		}

		private void skipBytes(final long n) throws IOException {
			long remaining = n;
			while (remaining > 0) {
				final long skipped = in.skip(remaining);
				if (skipped <= 0) {
					if (in.read() == -1) throw new EOFException();
					remaining--;
				} else {
					remaining -= skipped;
				}
			}
		}

		private int readInt() throws IOException {
			readBytes(4);
			return ByteBuffer.wrap(scratch, 0, 4).order(order).getInt();
		}

		private double readDouble() throws IOException {
			readBytes(8);
			return ByteBuffer.wrap(scratch, 0, 8).order(order).getDouble();
		}

		private String[] tokens(final String line) {
			return line.trim().split("\\s+");
		}

		private int parseInt(final String s) throws MeshDecodeException {
			try {
				return Integer.parseInt(s.trim());
			} catch (final NumberFormatException e) {
				throw new MeshDecodeException(name + ": invalid integer '" + s + "'", e);
			}
		}

		private double parseDouble(final String s) throws MeshDecodeException {
			try {
				return Double.parseDouble(s.trim());
			} catch (final NumberFormatException e) {
				throw new MeshDecodeException(name + ": invalid number '" + s + "'", e);
			}
		}
	}

	/** Maps Gmsh node tags to 0-based node ids */
	private abstract static class NodeIndex {

		abstract int get(int tag);

		int lookup(final int tag, final String name) throws MeshDecodeException {
			final int id = get(tag);
			if (id < 0) throw new MeshDecodeException(name + ": reference to undefined node " + tag);
			return id;
		}

		static NodeIndex of(final int[] tags) throws MeshDecodeException {
			int max = 0;
			for (final int tag : tags) {
				if (tag < 0) throw new MeshDecodeException("Invalid node tag " + tag);
				max = Math.max(max, tag);
			}
			// dense lookup when tags are (nearly) contiguous
			if ((long) max <= 4L * tags.length + 1024) {
				final int[] lut = new int[max + 1];
				Arrays.fill(lut, -1);
				for (int i = 0; i < tags.length; i++)
					lut[tags[i]] = i;
				return new NodeIndex() {
					@Override
					int get(final int tag) {
						return (tag >= 0 && tag < lut.length) ? lut[tag] : -1;
					}
				};
			}
			final Map<Integer, Integer> map = new HashMap<>(tags.length * 2);
			for (int i = 0; i < tags.length; i++)
				map.put(tags[i], i);
			return new NodeIndex() {
				@Override
				int get(final int tag) {
					final Integer id = map.get(tag);
					return (id == null) ? -1 : id;
				}
			};
		}
	}

}
