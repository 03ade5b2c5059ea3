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

package sc.fiji.fieldmesh;

import java.io.DataOutputStream;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintWriter;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Locale;

/**
 * Writes small mesh and field-sample files for tests.
 */
public class FieldMeshFixtures {

	/** Nodes of the unit tetrahedron */
	public static final double[][] UNIT_TETRA_NODES = { { 0, 0, 0 }, { 1, 0, 0 }, { 0, 1, 0 }, { 0, 0, 1 } };

	private FieldMeshFixtures() {}

	/**
	 * Writes a version 1.0 {@code .npy} file holding a little-endian float64
	 * array in C order.
	 */
	public static File writeNpy(final File file, final double[][] rows) throws IOException {
		return writeNpy(file, rows, "<f8", false);
	}

	/**
	 * Writes a version 1.0 {@code .npy} file of shape {@code (rows.length, 4)}.
	 *
	 * @param descr one of {@code <f8}, {@code >f8}, {@code <f4}, {@code >f4}
	 * @param fortran whether data should be written in column-major order
	 */
	public static File writeNpy(final File file, final double[][] rows, final String descr, final boolean fortran)
			throws IOException {
		final int nCols = (rows.length == 0) ? 4 : rows[0].length;
		return writeNpy(file, rows, descr, fortran, "(" + rows.length + ", " + nCols + ")");
	}

	public static File writeNpy(final File file, final double[][] rows, final String descr, final boolean fortran,
			final String shape) throws IOException {
		final String dict = "{'descr': '" + descr + "', 'fortran_order': " + (fortran ? "True" : "False")
				+ ", 'shape': " + shape + ", }";
		final StringBuilder header = new StringBuilder(dict);
		while ((10 + header.length() + 1) % 64 != 0)
			header.append(' ');
		header.append('\n');

		final boolean doubles = descr.endsWith("8");
		final ByteOrder order = descr.startsWith(">") ? ByteOrder.BIG_ENDIAN : ByteOrder.LITTLE_ENDIAN;
		final int nCols = (rows.length == 0) ? 0 : rows[0].length;
		final ByteBuffer data = ByteBuffer.allocate(rows.length * nCols * (doubles ? 8 : 4)).order(order);
		if (fortran) {
			for (int j = 0; j < nCols; j++)
				for (final double[] row : rows)
					put(data, row[j], doubles);
		} else {
			for (final double[] row : rows)
				for (final double v : row)
					put(data, v, doubles);
		}
		try (OutputStream os = new FileOutputStream(file)) {
			os.write(new byte[] { (byte) 0x93, 'N', 'U', 'M', 'P', 'Y', 1, 0 });
			final byte[] headerBytes = header.toString().getBytes(StandardCharsets.ISO_8859_1);
			os.write(headerBytes.length & 0xff);
			os.write((headerBytes.length >> 8) & 0xff);
			os.write(headerBytes);
			os.write(data.array());
		}
		return file;
	}

	private static void put(final ByteBuffer buffer, final double value, final boolean doubles) {
		if (doubles)
			buffer.putDouble(value);
		else
			buffer.putFloat((float) value);
	}

	/**
	 * Writes an ASCII Gmsh 2.2 mesh. Node tags start at 1; cell ids are 0-based.
	 */
	public static File writeGmshAscii(final File file, final double[][] nodes, final int[][] tetra,
			final int[][] triangles) throws IOException {
		try (PrintWriter pw = new PrintWriter(Files.newBufferedWriter(file.toPath(), StandardCharsets.US_ASCII))) {
			pw.print("$MeshFormat\n2.2 0 8\n$EndMeshFormat\n");
			pw.print("$Nodes\n" + nodes.length + "\n");
			for (int i = 0; i < nodes.length; i++)
				pw.print(String.format(Locale.US, "%d %s %s %s\n", i + 1, nodes[i][0], nodes[i][1], nodes[i][2]));
			pw.print("$EndNodes\n");
			pw.print("$Elements\n" + (tetra.length + triangles.length) + "\n");
			int tag = 1;
			for (final int[] t : triangles)
				pw.print(tag++ + " 2 2 1005 1005 " + oneBased(t) + "\n");
			for (final int[] t : tetra)
				pw.print(tag++ + " 4 2 5 5 " + oneBased(t) + "\n");
			pw.print("$EndElements\n");
		}
		return file;
	}

	/**
	 * Writes a little-endian binary Gmsh 2.2 mesh. Node tags start at 1; cell
	 * ids are 0-based.
	 */
	public static File writeGmshBinary(final File file, final double[][] nodes, final int[][] tetra,
			final int[][] triangles) throws IOException {
		try (DataOutputStream out = new DataOutputStream(new FileOutputStream(file))) {
			out.write("$MeshFormat\n2.2 1 8\n".getBytes(StandardCharsets.US_ASCII));
			out.write(le().putInt(1).array(), 0, 4);
			out.write("\n$EndMeshFormat\n".getBytes(StandardCharsets.US_ASCII));
			out.write(("$Nodes\n" + nodes.length + "\n").getBytes(StandardCharsets.US_ASCII));
			for (int i = 0; i < nodes.length; i++) {
				final ByteBuffer b = ByteBuffer.allocate(28).order(ByteOrder.LITTLE_ENDIAN);
				b.putInt(i + 1).putDouble(nodes[i][0]).putDouble(nodes[i][1]).putDouble(nodes[i][2]);
				out.write(b.array());
			}
			out.write("\n$EndNodes\n".getBytes(StandardCharsets.US_ASCII));
			out.write(("$Elements\n" + (tetra.length + triangles.length) + "\n").getBytes(StandardCharsets.US_ASCII));
			int tag = 1;
			tag = writeBinaryBlock(out, 2, triangles, tag);
			writeBinaryBlock(out, 4, tetra, tag);
			out.write("\n$EndElements\n".getBytes(StandardCharsets.US_ASCII));
		}
		return file;
	}

	private static int writeBinaryBlock(final DataOutputStream out, final int type, final int[][] cells, int tag)
			throws IOException {
		if (cells.length == 0) return tag;
		final int nNodes = cells[0].length;
		final ByteBuffer b = ByteBuffer.allocate(12 + cells.length * 4 * (3 + nNodes)).order(ByteOrder.LITTLE_ENDIAN);
		b.putInt(type).putInt(cells.length).putInt(2);
		for (final int[] cell : cells) {
			b.putInt(tag++).putInt(1).putInt(1);
			for (final int id : cell)
				b.putInt(id + 1);
		}
		out.write(b.array());
		return tag;
	}

	private static ByteBuffer le() {
		return ByteBuffer.allocate(4).order(ByteOrder.LITTLE_ENDIAN);
	}

	/**
	 * Writes a legacy VTK ASCII unstructured grid using the classic CELLS
	 * layout.
	 */
	public static File writeVtk(final File file, final double[][] nodes, final int[][] tetra, final int[][] triangles)
			throws IOException {
		try (PrintWriter pw = new PrintWriter(Files.newBufferedWriter(file.toPath(), StandardCharsets.US_ASCII))) {
			pw.print("# vtk DataFile Version 3.0\ntest grid\nASCII\nDATASET UNSTRUCTURED_GRID\n");
			pw.print("POINTS " + nodes.length + " double\n");
			for (final double[] n : nodes)
				pw.print(String.format(Locale.US, "%s %s %s\n", n[0], n[1], n[2]));
			final int nCells = tetra.length + triangles.length;
			pw.print("CELLS " + nCells + " " + (tetra.length * 5 + triangles.length * 4) + "\n");
			for (final int[] t : triangles)
				pw.print("3 " + join(t) + "\n");
			for (final int[] t : tetra)
				pw.print("4 " + join(t) + "\n");
			pw.print("CELL_TYPES " + nCells + "\n");
			for (int i = 0; i < triangles.length; i++)
				pw.print("5\n");
			for (int i = 0; i < tetra.length; i++)
				pw.print("10\n");
			pw.print("POINT_DATA " + nodes.length + "\nSCALARS e double 1\nLOOKUP_TABLE default\n");
			for (int i = 0; i < nodes.length; i++)
				pw.print("0.0\n");
		}
		return file;
	}

	private static String oneBased(final int[] ids) {
		final StringBuilder sb = new StringBuilder();
		for (final int id : ids) {
			if (sb.length() > 0) sb.append(' ');
			sb.append(id + 1);
		}
		return sb.toString();
	}

	private static String join(final int[] ids) {
		final StringBuilder sb = new StringBuilder();
		for (final int id : ids) {
			if (sb.length() > 0) sb.append(' ');
			sb.append(id);
		}
		return sb.toString();
	}

}
