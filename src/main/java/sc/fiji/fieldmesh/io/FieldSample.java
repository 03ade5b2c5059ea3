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

import java.util.Random;

import sc.fiji.fieldmesh.util.FieldPoint;

/**
 * An ordered, immutable sequence of electric-field samples: records of
 * {@code (x, y, z, magnitude)}. An empty sample denotes an absent tissue.
 */
public final class FieldSample {

	/** Number of values per record */
	public static final int RECORD_LENGTH = 4;

	/** The empty sample */
	public static final FieldSample EMPTY = new FieldSample(new double[0], false);

	private final double[] records;

	/**
	 * @param records the interleaved records {@code [x0, y0, z0, m0, x1, ...]}.
	 *          The array is copied.
	 */
	public FieldSample(final double[] records) {
		this(records, true);
	}

	private FieldSample(final double[] records, final boolean copy) {
		if (records == null || records.length % RECORD_LENGTH != 0)
			throw new IllegalArgumentException("Record data must be a multiple of " + RECORD_LENGTH);
		this.records = (copy) ? records.clone() : records;
	}

	/* takes ownership of the array */
	static FieldSample wrap(final double[] records) {
		return (records.length == 0) ? EMPTY : new FieldSample(records, false);
	}

	/** @return the number of records */
	public int size() {
		return records.length / RECORD_LENGTH;
	}

	public boolean isEmpty() {
		return records.length == 0;
	}

	public double getX(final int i) {
		return records[RECORD_LENGTH * i];
	}

	public double getY(final int i) {
		return records[RECORD_LENGTH * i + 1];
	}

	public double getZ(final int i) {
		return records[RECORD_LENGTH * i + 2];
	}

	public double getMagnitude(final int i) {
		return records[RECORD_LENGTH * i + 3];
	}

	/**
	 * @param i the record index
	 * @param column the column (0: x; 1: y; 2: z; 3: magnitude)
	 * @return the value at the specified record and column
	 */
	public double get(final int i, final int column) {
		if (column < 0 || column >= RECORD_LENGTH)
			throw new IndexOutOfBoundsException("Column " + column);
		return records[RECORD_LENGTH * i + column];
	}

	public FieldPoint getLocation(final int i) {
		return new FieldPoint(getX(i), getY(i), getZ(i));
	}

	/** @return the magnitude column */
	public double[] getMagnitudes() {
		final double[] m = new double[size()];
		for (int i = 0; i < m.length; i++)
			m[i] = getMagnitude(i);
		return m;
	}

	/**
	 * @return the coordinate columns, interleaved as {@code [x0, y0, z0, x1, ...]}
	 */
	public double[] getCoordinates() {
		final int n = size();
		final double[] c = new double[3 * n];
		for (int i = 0; i < n; i++) {
			System.arraycopy(records, RECORD_LENGTH * i, c, 3 * i, 3);
		}
		return c;
	}

	/**
	 * Retrieves up to {@code n} records chosen at random without replacement,
	 * e.g., for previewing large point clouds.
	 *
	 * @param n the maximum number of records
	 * @param random the source of randomness
	 * @return the subsample (this instance if it holds {@code n} records or
	 *         less)
	 */
	public FieldSample subsample(final int n, final Random random) {
		if (n < 0) throw new IllegalArgumentException("n must be >= 0");
		final int size = size();
		if (size <= n) return this;
		// partial Fisher-Yates
		final int[] idx = new int[size];
		for (int i = 0; i < size; i++)
			idx[i] = i;
		final double[] out = new double[RECORD_LENGTH * n];
		for (int i = 0; i < n; i++) {
			final int j = i + random.nextInt(size - i);
			final int tmp = idx[i];
			idx[i] = idx[j];
			idx[j] = tmp;
			System.arraycopy(records, RECORD_LENGTH * idx[i], out, RECORD_LENGTH * i, RECORD_LENGTH);
		}
		return wrap(out);
	}

	@Override
	public String toString() {
		return "FieldSample[" + size() + " records]";
	}

}
