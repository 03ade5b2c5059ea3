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

package sc.fiji.fieldmesh.util;

import java.util.Objects;

/**
 * An immutable point in 3D space, always using real world coordinates
 * (millimeters for head models).
 */
public final class FieldPoint {

	public final double x;
	public final double y;
	public final double z;

	public FieldPoint(final double x, final double y, final double z) {
		this.x = x;
		this.y = y;
		this.z = z;
	}

	/** @return the X-coordinate of the point */
	public double getX() {
		return x;
	}

	/** @return the Y-coordinate of the point */
	public double getY() {
		return y;
	}

	/** @return the Z-coordinate of the point */
	public double getZ() {
		return z;
	}

	@Override
	public boolean equals(final Object o) {
		if (this == o) return true;
		if (!(o instanceof FieldPoint)) return false;
		final FieldPoint other = (FieldPoint) o;
		return Double.compare(x, other.x) == 0 && Double.compare(y, other.y) == 0
				&& Double.compare(z, other.z) == 0;
	}

	@Override
	public int hashCode() {
		return Objects.hash(x, y, z);
	}

	@Override
	public String toString() {
		return "[" + x + ", " + y + ", " + z + "]";
	}

}
