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

import java.util.Arrays;

import sc.fiji.fieldmesh.io.FieldSample;

/**
 * Extracts the samples lying on (or near) an axis-aligned slicing plane.
 * Samples are retained when their coordinate on the slicing axis lies within
 * {@code (max - min) / gridSize} of the plane.
 */
public class CrossSection {

	public static final int X_AXIS = 0;
	public static final int Y_AXIS = 1;
	public static final int Z_AXIS = 2;

	private final int axis;
	private final double coordinate;
	private final double tolerance;
	private final FieldSample slice;

	/**
	 * @param sample the samples to be sliced
	 * @param axis the slicing axis ({@link #X_AXIS}, {@link #Y_AXIS} or
	 *          {@link #Z_AXIS})
	 * @param coordinate the position of the plane along the axis
	 * @param gridSize the grid size from which the tolerance is derived
	 */
	public CrossSection(final FieldSample sample, final int axis, final double coordinate, final int gridSize) {
		if (axis < X_AXIS || axis > Z_AXIS) throw new IllegalArgumentException("Invalid axis " + axis);
		if (gridSize <= 0) throw new IllegalArgumentException("gridSize must be > 0");
		this.axis = axis;
		this.coordinate = coordinate;
		if (sample == null || sample.isEmpty()) {
			tolerance = 0;
			slice = FieldSample.EMPTY;
			return;
		}
		final double[] range = range(sample, axis);
		tolerance = (range[1] - range[0]) / gridSize;
		final double[] kept = new double[sample.size() * FieldSample.RECORD_LENGTH];
		int n = 0;
		for (int i = 0; i < sample.size(); i++) {
			if (Math.abs(sample.get(i, axis) - coordinate) < tolerance) {
				for (int c = 0; c < FieldSample.RECORD_LENGTH; c++)
					kept[n++] = sample.get(i, c);
			}
		}
		slice = (n == 0) ? FieldSample.EMPTY : new FieldSample(Arrays.copyOf(kept, n));
	}

	/**
	 * Convenience method to slice a sample set half-way through its extent.
	 *
	 * @param sample the samples to be sliced (not empty)
	 * @param axis the slicing axis
	 * @param gridSize the grid size from which the tolerance is derived
	 * @return the cross-section
	 */
	public static CrossSection atMidpoint(final FieldSample sample, final int axis, final int gridSize) {
		if (sample == null || sample.isEmpty()) throw new IllegalArgumentException("No samples to slice");
		final double[] range = range(sample, axis);
		return new CrossSection(sample, axis, 0.5 * (range[0] + range[1]), gridSize);
	}

	private static double[] range(final FieldSample sample, final int axis) {
		double min = Double.POSITIVE_INFINITY;
		double max = Double.NEGATIVE_INFINITY;
		for (int i = 0; i < sample.size(); i++) {
			final double v = sample.get(i, axis);
			min = Math.min(min, v);
			max = Math.max(max, v);
		}
		return new double[] { min, max };
	}

	public int getAxis() {
		return axis;
	}

	public double getCoordinate() {
		return coordinate;
	}

	public double getTolerance() {
		return tolerance;
	}

	/** @return the samples near the slicing plane, in input order */
	public FieldSample getSlice() {
		return slice;
	}

	public boolean isEmpty() {
		return slice.isEmpty();
	}

}
