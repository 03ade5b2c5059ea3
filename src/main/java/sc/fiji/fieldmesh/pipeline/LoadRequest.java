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

package sc.fiji.fieldmesh.pipeline;

import java.io.File;
import java.util.Objects;
import java.util.Optional;

import sc.fiji.fieldmesh.protocol.StimulationSelection;

/**
 * A request to display a mesh overlaid with the field samples of a directory.
 */
public class LoadRequest {

	private final File meshFile;
	private final File sampleDir;
	private final StimulationSelection selection;

	public LoadRequest(final File meshFile, final File sampleDir) {
		this(meshFile, sampleDir, null);
	}

	/**
	 * @param meshFile the mesh file
	 * @param sampleDir the directory holding {@code e_*.npy} sample files
	 * @param selection the stimulation parameters from which {@code sampleDir}
	 *          was resolved. May be null.
	 */
	public LoadRequest(final File meshFile, final File sampleDir, final StimulationSelection selection) {
		this.meshFile = Objects.requireNonNull(meshFile, "meshFile");
		this.sampleDir = Objects.requireNonNull(sampleDir, "sampleDir");
		this.selection = selection;
	}

	public File getMeshFile() {
		return meshFile;
	}

	public File getSampleDir() {
		return sampleDir;
	}

	public Optional<StimulationSelection> getSelection() {
		return Optional.ofNullable(selection);
	}

	@Override
	public String toString() {
		return "LoadRequest [mesh=" + meshFile + ", samples=" + sampleDir
				+ ((selection == null) ? "" : ", " + selection) + "]";
	}

}
