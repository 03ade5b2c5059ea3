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
 * tDCS electrode montages (anode-cathode pairs).
 */
public enum TesMontage {

	C4_AF3("C4-AF3"), //
	F3_F4("F3-F4"), //
	F3_FP2("F3-Fp2"), //
	F4_FP1("F4-Fp1"), //
	P3_P4("P3-P4");

	private final String label;

	TesMontage(final String label) {
		this.label = label;
	}

	public String getLabel() {
		return label;
	}

	public String getDirectoryName() {
		return "tDCS-" + label;
	}

	public static TesMontage fromLabel(final String label) {
		for (final TesMontage montage : values()) {
			if (montage.label.equals(label)) return montage;
		}
		throw new IllegalArgumentException("Unrecognized montage: " + label);
	}

	@Override
	public String toString() {
		return label;
	}

}
