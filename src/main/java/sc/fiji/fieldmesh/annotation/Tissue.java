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

package sc.fiji.fieldmesh.annotation;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * The anatomical layers of a head model for which electric-field samples may
 * exist. Constants are listed in reporting order.
 */
public enum Tissue {

	SCALP("Scalp", "scalp"), //
	BONE("Bone", "bone"), //
	CSF("CSF", "csf"), //
	GRAY_MATTER("Gray Matter", "gray_matter"), //
	WHITE_MATTER("White Matter", "white_matter");

	/** Prefix shared by all field-sample files */
	public static final String SAMPLE_FILE_PREFIX = "e_";

	/** Extension shared by all field-sample files */
	public static final String SAMPLE_FILE_EXTENSION = ".npy";

	/** Matches any field-sample file name, e.g., {@code e_csf.npy} */
	public static final Pattern SAMPLE_FILE_PATTERN = Pattern.compile("^e_.+\\.npy$");

	private final String label;
	private final String slug;

	Tissue(final String label, final String slug) {
		this.label = label;
		this.slug = slug;
	}

	/** @return the display name, e.g., "Gray Matter" */
	public String getLabel() {
		return label;
	}

	/** @return the file-name token, e.g., "gray_matter" */
	public String getSlug() {
		return slug;
	}

	/** @return the name of the file holding this tissue's samples, e.g., {@code e_gray_matter.npy} */
	public String getSampleFileName() {
		return SAMPLE_FILE_PREFIX + slug + SAMPLE_FILE_EXTENSION;
	}

	/**
	 * Retrieves the tissue associated with a sample file name.
	 *
	 * @param fileName the file name (no parent directories)
	 * @return the matching tissue, or an empty optional if {@code fileName} does
	 *         not name a known tissue
	 */
	public static Optional<Tissue> fromSampleFileName(final String fileName) {
		if (fileName == null) return Optional.empty();
		return Arrays.stream(values()).filter(t -> t.getSampleFileName().equals(fileName)).findFirst();
	}

	/**
	 * Retrieves a tissue from its display name (case insensitive).
	 *
	 * @param label the display name
	 * @return the tissue
	 * @throws IllegalArgumentException if label is not recognized
	 */
	public static Tissue fromLabel(final String label) {
		for (final Tissue t : values()) {
			if (t.label.equalsIgnoreCase(label)) return t;
		}
		throw new IllegalArgumentException("Unrecognized tissue: " + label);
	}

	/**
	 * @param fileName the file name to be checked
	 * @return true if fileName follows the field-sample naming convention
	 */
	public static boolean isSampleFileName(final String fileName) {
		return fileName != null && SAMPLE_FILE_PATTERN.matcher(fileName).matches();
	}

	/** @return all tissues in reporting order */
	public static List<Tissue> list() {
		return Arrays.asList(values());
	}

	@Override
	public String toString() {
		return label;
	}

}
