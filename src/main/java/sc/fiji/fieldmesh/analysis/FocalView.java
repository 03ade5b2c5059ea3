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

import org.apache.commons.math3.util.FastMath;

import sc.fiji.fieldmesh.io.FieldSample;
import sc.fiji.fieldmesh.util.FieldPoint;

/**
 * Viewing direction pointing at the location of maximum field: the camera is
 * oriented from the center of a sample cloud towards the focal point.
 */
public class FocalView {

	/** Elevation used when the focal point coincides with the cloud center */
	public static final double DEFAULT_ELEVATION = 30;

	/** Azimuth used when the focal point coincides with the cloud center */
	public static final double DEFAULT_AZIMUTH = 45;

	private final FieldPoint focalPoint;
	private final double focalMagnitude;
	private final FieldPoint center;
	private final double elevation;
	private final double azimuth;

	/**
	 * @param sample the full set of samples, used to locate the maximum
	 * @param cloud the (possibly subsampled) samples whose center defines the
	 *          viewpoint
	 */
	public FocalView(final FieldSample sample, final FieldSample cloud) {
		if (sample == null || sample.isEmpty() || cloud == null || cloud.isEmpty())
			throw new IllegalArgumentException("Samples cannot be empty");
		int maxIdx = 0;
		for (int i = 1; i < sample.size(); i++) {
			if (sample.getMagnitude(i) > sample.getMagnitude(maxIdx)) maxIdx = i;
		}
		focalPoint = sample.getLocation(maxIdx);
		focalMagnitude = sample.getMagnitude(maxIdx);
		double cx = 0;
		double cy = 0;
		double cz = 0;
		for (int i = 0; i < cloud.size(); i++) {
			cx += cloud.getX(i);
			cy += cloud.getY(i);
			cz += cloud.getZ(i);
		}
		center = new FieldPoint(cx / cloud.size(), cy / cloud.size(), cz / cloud.size());
		final double dx = focalPoint.x - center.x;
		final double dy = focalPoint.y - center.y;
		final double dz = focalPoint.z - center.z;
		final double r = FastMath.sqrt(dx * dx + dy * dy + dz * dz);
		if (r > 0) {
			elevation = FastMath.toDegrees(FastMath.asin(dz / r));
			azimuth = FastMath.toDegrees(FastMath.atan2(dy, dx));
		} else {
			elevation = DEFAULT_ELEVATION;
			azimuth = DEFAULT_AZIMUTH;
		}
	}

	/** @return the location of the maximum field (first one on ties) */
	public FieldPoint getFocalPoint() {
		return focalPoint;
	}

	public double getFocalMagnitude() {
		return focalMagnitude;
	}

	/** @return the center of the sample cloud */
	public FieldPoint getCenter() {
		return center;
	}

	/** @return the elevation angle, in degrees */
	public double getElevation() {
		return elevation;
	}

	/** @return the azimuth angle, in degrees */
	public double getAzimuth() {
		return azimuth;
	}

}
