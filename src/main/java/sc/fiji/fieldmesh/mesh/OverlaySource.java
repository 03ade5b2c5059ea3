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

package sc.fiji.fieldmesh.mesh;

import java.util.Optional;

import sc.fiji.fieldmesh.annotation.Tissue;

/**
 * Records which contiguous range of an {@link AugmentedGrid}'s points was
 * appended from a given field-sample file.
 */
public final class OverlaySource {

	private final String fileName;
	private final int firstPointId;
	private final int count;

	OverlaySource(final String fileName, final int firstPointId, final int count) {
		this.fileName = fileName;
		this.firstPointId = firstPointId;
		this.count = count;
	}

	/** @return the name of the sample file */
	public String getFileName() {
		return fileName;
	}

	/** @return the tissue named by the sample file, if it is a known one */
	public Optional<Tissue> getTissue() {
		return Tissue.fromSampleFileName(fileName);
	}

	/** @return the index of the first point appended from this source */
	public int getFirstPointId() {
		return firstPointId;
	}

	/** @return the number of points appended from this source */
	public int getCount() {
		return count;
	}

	@Override
	public String toString() {
		return fileName + " [" + firstPointId + ", " + (firstPointId + count) + ")";
	}

}
