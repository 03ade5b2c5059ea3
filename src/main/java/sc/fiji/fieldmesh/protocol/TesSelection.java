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
 * tDCS parameters. Samples live under
 * {@code <subject>/tDCS-<montage>/thickness-<mm>/npy_outputs}: unlike
 * {@link TmsSelection}, the placement directory precedes the device one.
 */
public class TesSelection implements StimulationSelection {

	private final TesMontage montage;
	private final TesThickness thickness;
	private final Intensity intensity;

	public TesSelection(final TesMontage montage, final TesThickness thickness, final Intensity intensity) {
		this.montage = Objects.requireNonNull(montage, "montage");
		this.thickness = Objects.requireNonNull(thickness, "thickness");
		this.intensity = Objects.requireNonNull(intensity, "intensity");
	}

	public static TesSelection fromLabels(final String montage, final String thickness, final String intensity) {
		return new TesSelection(TesMontage.fromLabel(montage), TesThickness.fromLabel(thickness),
				Intensity.fromLabel(intensity));
	}

	@Override
	public File resolveSampleDir(final File subjectDir) {
		final File montageDir = new File(subjectDir, montage.getDirectoryName());
		return new File(new File(montageDir, thickness.getDirectoryName()), intensity.getDirectoryName());
	}

	public TesMontage getMontage() {
		return montage;
	}

	public TesThickness getThickness() {
		return thickness;
	}

	@Override
	public Intensity getIntensity() {
		return intensity;
	}

	@Override
	public boolean equals(final Object o) {
		if (this == o) return true;
		if (!(o instanceof TesSelection)) return false;
		final TesSelection other = (TesSelection) o;
		return montage == other.montage && thickness == other.thickness && intensity == other.intensity;
	}

	@Override
	public int hashCode() {
		return Objects.hash(montage, thickness, intensity);
	}

	@Override
	public String toString() {
		return "tDCS [" + montage + ", " + thickness + ", " + intensity + "]";
	}

}
