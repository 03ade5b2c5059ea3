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

import java.util.Collections;
import java.util.List;

/**
 * An {@link IndexedGrid} whose point set has been extended with field-sample
 * locations, and which carries one scalar (the field magnitude) per point.
 * <p>
 * Points {@code [0, baseCount)} are the original mesh nodes and carry a scalar
 * of {@code 0}; points {@code [baseCount, pointCount)} are overlay samples in
 * the order they were appended, each carrying its sample magnitude. The scalar
 * array is always aligned 1:1 with the points.
 * </p>
 *
 * @see FieldOverlayMerger
 */
public class AugmentedGrid extends IndexedGrid {

	private final double[] scalars;
	private final int baseCount;
	private final List<OverlaySource> sources;

	AugmentedGrid(final double[] points, final List<Cell> cells, final double[] scalars, final int baseCount,
			final List<OverlaySource> sources) {
		super(points, cells);
		if (scalars.length != getPointCount())
			throw new IllegalStateException("Scalars (" + scalars.length + ") not aligned with points ("
					+ getPointCount() + ")");
		this.scalars = scalars;
		this.baseCount = baseCount;
		this.sources = Collections.unmodifiableList(sources);
	}

	/** @return the number of points originating from mesh nodes */
	public int getBaseCount() {
		return baseCount;
	}

	/** @return the number of points appended from field samples */
	public int getOverlayCount() {
		return getPointCount() - baseCount;
	}

	/**
	 * @param pointId the point index
	 * @return the scalar associated with the point
	 */
	public double getScalar(final int pointId) {
		return scalars[pointId];
	}

	/** @return a copy of the scalar array */
	public double[] getScalars() {
		return scalars.clone();
	}

	/**
	 * @return the {@code {min, max}} range of the scalar array, NaN values
	 *         excluded. Same range as the one mapped by the color transfer
	 *         function of this grid.
	 */
	public double[] getScalarRange() {
		double min = Double.POSITIVE_INFINITY;
		double max = Double.NEGATIVE_INFINITY;
		for (final double v : scalars) {
			if (Double.isNaN(v)) continue;
			if (v < min) min = v;
			if (v > max) max = v;
		}
		return new double[] { min, max };
	}

	/** @return the sources appended to this grid, in append order */
	public List<OverlaySource> getOverlaySources() {
		return sources;
	}

}
