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

package sc.fiji.fieldmesh.analysis;

import net.imglib2.display.ColorTable;
import net.imglib2.display.ColorTable8;

import org.scijava.util.ColorRGBA;

/**
 * An immutable lookup table mapping field magnitudes to color and opacity.
 * Each entry holds red, green, blue and opacity components in the
 * {@code [0, 1]} range. Values at or below the lower table bound map to the
 * first entry; values at or above the upper bound saturate to the last entry.
 *
 * @see ColorTransferFunctionBuilder
 */
public class ColorTransferFunction {

	private static final int RED = 0;
	private static final int GREEN = 1;
	private static final int BLUE = 2;
	private static final int OPACITY = 3;

	private final double[][] table;
	private final double minScalar;
	private final double maxScalar;
	private final double clampMax;

	ColorTransferFunction(final double[][] table, final double minScalar, final double maxScalar,
			final double clampMax) {
		this.table = table;
		this.minScalar = minScalar;
		this.maxScalar = maxScalar;
		this.clampMax = clampMax;
	}

	/** @return the number of table entries */
	public int size() {
		return table.length;
	}

	public double getRed(final int index) {
		return table[index][RED];
	}

	public double getGreen(final int index) {
		return table[index][GREEN];
	}

	public double getBlue(final int index) {
		return table[index][BLUE];
	}

	public double getOpacity(final int index) {
		return table[index][OPACITY];
	}

	/**
	 * @param index the table index
	 * @return the {@code {r, g, b, opacity}} components of the entry
	 */
	public double[] getEntry(final int index) {
		return table[index].clone();
	}

	/** @return the minimum of the scalars the table was built from */
	public double getMinScalar() {
		return minScalar;
	}

	/** @return the maximum of the scalars the table was built from */
	public double getMaxScalar() {
		return maxScalar;
	}

	/** @return the clamped upper bound, a fraction of {@link #getMaxScalar()} */
	public double getClampMax() {
		return clampMax;
	}

	/**
	 * Returns the table domain. The upper bound is {@link #getClampMax()}, unless
	 * it falls below the minimum scalar, in which case the domain collapses to
	 * the minimum.
	 *
	 * @return the {@code {lower, upper}} table bounds
	 */
	public double[] getTableRange() {
		return new double[] { minScalar, Math.max(minScalar, clampMax) };
	}

	/**
	 * Maps a value to a table index.
	 *
	 * @param value the field value
	 * @return the table index, in {@code [0, size() - 1]}
	 */
	public int getIndex(final double value) {
		final double[] range = getTableRange();
		if (Double.isNaN(value) || value <= range[0]) return 0;
		if (value >= range[1]) return table.length - 1;
		final int idx = (int) Math.floor((value - range[0]) / (range[1] - range[0]) * table.length);
		return Math.min(table.length - 1, Math.max(0, idx));
	}

	/**
	 * Gets the color and opacity corresponding to the specified value.
	 *
	 * @param value the field value
	 * @return the corresponding color, with opacity encoded as alpha
	 */
	public ColorRGBA getColor(final double value) {
		final int idx = getIndex(value);
		return new ColorRGBA(to8bit(getRed(idx)), to8bit(getGreen(idx)), to8bit(getBlue(idx)),
				to8bit(getOpacity(idx)));
	}

	/**
	 * Converts this function into an 8-bit ImgLib2 color table, with opacity
	 * stored in the {@link ColorTable#ALPHA} channel.
	 *
	 * @return the color table
	 */
	public ColorTable8 toColorTable() {
		final byte[][] values = new byte[4][table.length];
		for (int i = 0; i < table.length; i++) {
			values[ColorTable.RED][i] = (byte) to8bit(getRed(i));
			values[ColorTable.GREEN][i] = (byte) to8bit(getGreen(i));
			values[ColorTable.BLUE][i] = (byte) to8bit(getBlue(i));
			values[ColorTable.ALPHA][i] = (byte) to8bit(getOpacity(i));
		}
		return new ColorTable8(values);
	}

	private static int to8bit(final double component) {
		return (int) Math.round(255 * Math.max(0, Math.min(1, component)));
	}

	@Override
	public String toString() {
		final double[] range = getTableRange();
		return "ColorTransferFunction[" + table.length + " entries, range " + range[0] + "-" + range[1] + "]";
	}

}
