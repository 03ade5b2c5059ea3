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
 * TMS coil models for which simulations are available.
 */
public enum TmsCoil {

	BF70("bf70", "Deymed_70BF"), //
	BF50("bf50", "Deymed_50BF"), //
	CB70("cb70", "MagVenture_C-B70"), //
	CB60("cb60", "MagVenture_C-B60");

	private final String label;
	private final String directoryName;

	TmsCoil(final String label, final String directoryName) {
		this.label = label;
		this.directoryName = directoryName;
	}

	public String getLabel() {
		return label;
	}

	public String getDirectoryName() {
		return directoryName;
	}

	public static TmsCoil fromLabel(final String label) {
		for (final TmsCoil coil : values()) {
			if (coil.label.equals(label)) return coil;
		}
		throw new IllegalArgumentException("Unrecognized coil: " + label);
	}

	@Override
	public String toString() {
		return label;
	}

}
