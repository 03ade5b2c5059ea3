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
 * EEG 10-20 positions over which a TMS coil can be placed.
 */
public enum TmsTarget {

	C3, C4, F3, F4;

	public String getLabel() {
		return name();
	}

	public String getDirectoryName() {
		return name();
	}

	public static TmsTarget fromLabel(final String label) {
		for (final TmsTarget target : values()) {
			if (target.name().equals(label)) return target;
		}
		throw new IllegalArgumentException("Unrecognized target: " + label);
	}

}
