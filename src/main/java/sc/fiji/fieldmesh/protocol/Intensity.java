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

/**
 * Stimulation intensities (rate of change of coil current, in 1e6 A/s, or
 * injected current for TES). All intensities share a single results
 * directory.
 */
public enum Intensity {

	LOW("1.00x1e6 A/s"), //
	MEDIUM("5.00x1e6 A/s"), //
	HIGH("10.00x1e6 A/s");

	/** Name of the directory holding the exported field samples */
	public static final String SAMPLE_DIR_NAME = "npy_outputs";

	private final String label;

	Intensity(final String label) {
		this.label = label;
	}

	public String getLabel() {
		return label;
	}

	/** @return the name of the directory holding samples at this intensity */
	public String getDirectoryName() {
		return SAMPLE_DIR_NAME;
	}

	public static Intensity fromLabel(final String label) {
		for (final Intensity i : values()) {
			if (i.label.equals(label)) return i;
		}
		throw new IllegalArgumentException("Unrecognized intensity: " + label);
	}

	@Override
	public String toString() {
		return label;
	}

}
