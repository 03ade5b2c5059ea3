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

import sc.fiji.fieldmesh.mesh.AugmentedGrid;

/**
 * Builds the {@link ColorTransferFunction} used to display field magnitudes.
 * <p>
 * The table has 256 entries over {@code [min, 0.3 * max]} of the scalar range,
 * so that most of the color scale is spent on the low and mid range. With
 * {@code t = i / 255}:
 * </p>
 * <ul>
 * <li>{@code t < 0.05}: white, opacity 0.2</li>
 * <li>{@code 0.05 <= t < 0.5}: gray-to-blue ramp {@code (f, f, 1 - f)} with
 * {@code f = (t - 0.05) / 0.45}, opaque</li>
 * <li>{@code t >= 0.5}: yellow-to-red ramp {@code (1, 1 - f, 0)} with
 * {@code f = (t - 0.5) / 0.5}, opaque</li>
 * </ul>
 */
public class ColorTransferFunctionBuilder {

	/** Number of table entries */
	public static final int TABLE_SIZE = 256;

	/** Fraction of the maximum scalar used as the upper table bound */
	public static final double CLAMP_FRACTION = 0.3;

	/** Upper limit of the faint near-zero band (normalized) */
	public static final double LOW_BAND = 0.05;

	/** Start of the yellow-to-red ramp (normalized) */
	public static final double HIGH_BAND = 0.5;

	/** Opacity of the near-zero band */
	public static final double LOW_BAND_OPACITY = 0.2;

	/**
	 * Builds the transfer function for the scalars of an augmented grid.
	 *
	 * @param grid the augmented grid
	 * @return the transfer function
	 */
	public ColorTransferFunction build(final AugmentedGrid grid) {
		return build(grid.getScalars());
	}

	/**
	 * Builds the transfer function for the specified scalars. NaN values are
	 * ignored when computing the scalar range.
	 *
	 * @param scalars the scalar values
	 * @return the transfer function
	 * @throws IllegalArgumentException if {@code scalars} holds no numeric value
	 */
	public ColorTransferFunction build(final double[] scalars) {
		if (scalars == null) throw new IllegalArgumentException("scalars cannot be null");
		double min = Double.POSITIVE_INFINITY;
		double max = Double.NEGATIVE_INFINITY;
		for (final double v : scalars) {
			if (Double.isNaN(v)) continue;
			if (v < min) min = v;
			if (v > max) max = v;
		}
		if (min > max) throw new IllegalArgumentException("No scalar values to map");
		final double clampMax = max * CLAMP_FRACTION;

		final double[][] table = new double[TABLE_SIZE][];
		for (int i = 0; i < TABLE_SIZE; i++) {
			table[i] = entry(i / (double) (TABLE_SIZE - 1));
		}
		return new ColorTransferFunction(table, min, max, clampMax);
	}

	static double[] entry(final double t) {
		if (t < LOW_BAND) {
			return new double[] { 1, 1, 1, LOW_BAND_OPACITY };
		}
		if (t < HIGH_BAND) {
			final double f = (t - LOW_BAND) / (HIGH_BAND - LOW_BAND);
			return new double[] { f, f, 1 - f, 1 };
		}
		final double f = (t - HIGH_BAND) / (1 - HIGH_BAND);
		return new double[] { 1, 1 - f, 0, 1 };
	}

}
