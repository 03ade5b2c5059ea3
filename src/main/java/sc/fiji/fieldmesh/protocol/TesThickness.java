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
 * Electrode (sponge) thicknesses for which tDCS simulations are available.
 */
public enum TesThickness {

	MM4("4.00 mm", 4), //
	MM5("5.00 mm", 5), //
	MM6("6.00 mm", 6);

	private final String label;
	private final int millimeters;

	TesThickness(final String label, final int millimeters) {
		this.label = label;
		this.millimeters = millimeters;
	}

	public String getLabel() {
		return label;
	}

	public int getMillimeters() {
		return millimeters;
	}

	public String getDirectoryName() {
		return "thickness-" + millimeters;
	}

	public static TesThickness fromLabel(final String label) {
		for (final TesThickness t : values()) {
			if (t.label.equals(label)) return t;
		}
		throw new IllegalArgumentException("Unrecognized electrode thickness: " + label);
	}

	@Override
	public String toString() {
		return label;
	}

}
