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

package sc.fiji.fieldmesh;

/**
 * Kinds of failure that can terminate (or, for {@link #SAMPLE_DECODE}, be
 * recovered by) a load pipeline.
 */
public enum FailureKind {

	/** The mesh decoded to zero nodes. */
	EMPTY_MESH("Mesh contains no nodes"),
	/** The mesh file is missing, unreadable or malformed. */
	MESH_DECODE("Mesh could not be read"),
	/** A single field-sample file is malformed. Recoverable. */
	SAMPLE_DECODE("Field samples could not be read"),
	/** No overlay source yielded any field sample. */
	NO_OVERLAY_DATA("No electric field data available"),
	/** Unexpected error raised while loading. */
	INTERNAL("Unexpected error");

	private final String description;

	FailureKind(final String description) {
		this.description = description;
	}

	/**
	 * @return a short, user-readable description of this kind of failure
	 */
	public String getDescription() {
		return description;
	}

}
