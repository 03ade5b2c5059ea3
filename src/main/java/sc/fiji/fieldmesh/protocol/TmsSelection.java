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

package sc.fiji.fieldmesh.protocol;

import java.io.File;
import java.util.Objects;

/**
 * TMS parameters. Samples live under
 * {@code <subject>/<coil>/<target>/npy_outputs}.
 */
public class TmsSelection implements StimulationSelection {

	private final TmsCoil coil;
	private final TmsTarget target;
	private final Intensity intensity;

	public TmsSelection(final TmsCoil coil, final TmsTarget target, final Intensity intensity) {
		this.coil = Objects.requireNonNull(coil, "coil");
		this.target = Objects.requireNonNull(target, "target");
		this.intensity = Objects.requireNonNull(intensity, "intensity");
	}

	/**
	 * Assembles a selection from the labels displayed in a parameter prompt.
	 *
	 * @throws IllegalArgumentException if any of the labels is not recognized
	 */
	public static TmsSelection fromLabels(final String coil, final String target, final String intensity) {
		return new TmsSelection(TmsCoil.fromLabel(coil), TmsTarget.fromLabel(target), Intensity.fromLabel(intensity));
	}

	@Override
	public File resolveSampleDir(final File subjectDir) {
		final File coilDir = new File(subjectDir, coil.getDirectoryName());
		return new File(new File(coilDir, target.getDirectoryName()), intensity.getDirectoryName());
	}

	public TmsCoil getCoil() {
		return coil;
	}

	public TmsTarget getTarget() {
		return target;
	}

	@Override
	public Intensity getIntensity() {
		return intensity;
	}

	@Override
	public boolean equals(final Object o) {
		if (this == o) return true;
		if (!(o instanceof TmsSelection)) return false;
		final TmsSelection other = (TmsSelection) o;
		return coil == other.coil && target == other.target && intensity == other.intensity;
	}

	@Override
	public int hashCode() {
		return Objects.hash(coil, target, intensity);
	}

	@Override
	public String toString() {
		return "TMS [" + coil + ", " + target + ", " + intensity + "]";
	}

}
