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
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import sc.fiji.fieldmesh.FieldMeshUtils;

/**
 * Decodes NumPy {@code .npy} arrays of shape {@code (N, 4)} holding
 * {@code (x, y, z, magnitude)} records. Format versions 1.0, 2.0 and 3.0 are
 * supported, with little or big endian {@code float64} or {@code float32}
 * data in C or Fortran order.
 */
public class NpyFieldSampleDecoder implements FieldSampleDecoder {

	private static final byte[] MAGIC = { (byte) 0x93, 'N', 'U', 'M', 'P', 'Y' };
	private static final Pattern DESCR = Pattern.compile("'descr'\\s*:\\s*'([^']*)'");
	private static final Pattern FORTRAN = Pattern.compile("'fortran_order'\\s*:\\s*(True|False)");
	private static final Pattern SHAPE = Pattern.compile("'shape'\\s*:\\s*\\(([^)]*)\\)");

	@Override
	public FieldSample decode(final File file) throws SampleDecodeException {
		if (file == null) throw new IllegalArgumentException("file cannot be null");
		if (!file.exists()) {
			FieldMeshUtils.log("No sample file at " + file);
			return FieldSample.EMPTY;
		}
		try (FileChannel channel = FileChannel.open(file.toPath(), StandardOpenOption.READ)) {
			return decode(channel, file.getName());
		} catch (final IOException e) {
			throw new SampleDecodeException("Could not read " + file.getName(), e);
		}
	}

	private FieldSample decode(final FileChannel channel, final String name)
			throws IOException, SampleDecodeException {
		final ByteBuffer preamble = readFully(channel, 0, MAGIC.length + 2, name);
		for (final byte b : MAGIC) {
			if (preamble.get() != b) throw new SampleDecodeException(name + " is not a .npy file");
		}
		final int major = preamble.get() & 0xff;
		final long headerLength;
		final int lengthBytes;
		switch (major) {
		case 1:
			lengthBytes = 2;
			headerLength = readFully(channel, 8, 2, name).order(ByteOrder.LITTLE_ENDIAN).getShort() & 0xffff;
			break;
		case 2:
		case 3:
			lengthBytes = 4;
			headerLength = readFully(channel, 8, 4, name).order(ByteOrder.LITTLE_ENDIAN).getInt() & 0xffffffffL;
			break;
		default:
			throw new SampleDecodeException(name + ": unsupported .npy version " + major);
		}
		final long dataOffset = 8 + lengthBytes + headerLength;
		final ByteBuffer headerBytes = readFully(channel, 8 + lengthBytes, (int) headerLength, name);
		final String header = (major == 3) ? StandardCharsets.UTF_8.decode(headerBytes).toString()
				: StandardCharsets.ISO_8859_1.decode(headerBytes).toString();
		final Header h = parseHeader(header, name);
		if (h.rows == 0) return FieldSample.EMPTY;

		final long nValues = (long) h.rows * FieldSample.RECORD_LENGTH;
		if (nValues > Integer.MAX_VALUE)
			throw new SampleDecodeException(name + ": too many records (" + h.rows + ")");
		final long nBytes = nValues * h.itemSize;
		if (nBytes > Integer.MAX_VALUE)
			throw new SampleDecodeException(name + ": data too large (" + nBytes + " bytes)");
		if (channel.size() < dataOffset + nBytes)
			throw new SampleDecodeException(name + ": truncated data (expected " + nBytes + " bytes)");
		final ByteBuffer data = channel.map(FileChannel.MapMode.READ_ONLY, dataOffset, nBytes).order(h.order);
		final double[] raw = new double[(int) nValues];
		if (h.itemSize == 8)
			data.asDoubleBuffer().get(raw);
		else
			for (int i = 0; i < raw.length; i++)
				raw[i] = data.getFloat();
		if (!h.fortranOrder) return FieldSample.wrap(raw);

		// column-major: element (i, j) is at j * rows + i
		final double[] records = new double[raw.length];
		for (int i = 0; i < h.rows; i++) {
			for (int j = 0; j < FieldSample.RECORD_LENGTH; j++) {
				records[i * FieldSample.RECORD_LENGTH + j] = raw[j * h.rows + i];
			}
		}
		return FieldSample.wrap(records);
	}

	private static ByteBuffer readFully(final FileChannel channel, final long position, final int length,
			final String name) throws IOException, SampleDecodeException {
		final ByteBuffer buffer = ByteBuffer.allocate(length);
		long pos = position;
		while (buffer.hasRemaining()) {
			final int n = channel.read(buffer, pos);
			if (n < 0) throw new SampleDecodeException(name + ": unexpected end of file");
			pos += n;
		}
		buffer.flip();
		return buffer;
	}

	static Header parseHeader(final String header, final String name) throws SampleDecodeException {
		final Matcher descr = DESCR.matcher(header);
		final Matcher fortran = FORTRAN.matcher(header);
		final Matcher shape = SHAPE.matcher(header);
		if (!descr.find() || !fortran.find() || !shape.find())
			throw new SampleDecodeException(name + ": invalid .npy header " + header.trim());
		final Header h = new Header();
		switch (descr.group(1)) {
		case "<f8":
			h.order = ByteOrder.LITTLE_ENDIAN;
			h.itemSize = 8;
			break;
		case ">f8":
			h.order = ByteOrder.BIG_ENDIAN;
			h.itemSize = 8;
			break;
		case "<f4":
			h.order = ByteOrder.LITTLE_ENDIAN;
			h.itemSize = 4;
			break;
		case ">f4":
			h.order = ByteOrder.BIG_ENDIAN;
			h.itemSize = 4;
			break;
		default:
			throw new SampleDecodeException(name + ": unsupported dtype " + descr.group(1));
		}
		h.fortranOrder = "True".equals(fortran.group(1));
		final List<Long> dims = new ArrayList<>();
		for (final String token : shape.group(1).split(",")) {
			final String t = token.trim();
			if (t.isEmpty()) continue;
			try {
				dims.add(Long.parseLong(t.endsWith("L") ? t.substring(0, t.length() - 1) : t));
			} catch (final NumberFormatException e) {
				throw new SampleDecodeException(name + ": invalid shape (" + shape.group(1) + ")", e);
			}
		}
		for (final long dim : dims) {
			if (dim < 0) throw new SampleDecodeException(name + ": negative dimension in shape " + dims);
		}
		if (dims.contains(0L)) {
			h.rows = 0;
		} else if (dims.size() == 2 && dims.get(1) == FieldSample.RECORD_LENGTH && dims.get(0) <= Integer.MAX_VALUE) {
			h.rows = dims.get(0).intValue();
		} else {
			throw new SampleDecodeException(name + ": unexpected shape " + dims + ", expected (N, 4)");
		}
		return h;
	}

	static class Header {
		ByteOrder order;
		int itemSize;
		boolean fortranOrder;
		int rows;
	}

}
