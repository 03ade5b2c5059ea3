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

import sc.fiji.fieldmesh.pipeline.LoadRequest;

/**
 * Locates the files of a subject directory: the head mesh at its root and the
 * field samples of each simulated protocol in nested directories.
 */
public class SubjectLayout {

	/** Name of the subject's head mesh */
	public static final String MESH_FILE_NAME = "sub-control.msh";

	private final File subjectDir;

	public SubjectLayout(final File subjectDir) {
		this.subjectDir = Objects.requireNonNull(subjectDir, "subjectDir");
	}

	public File getSubjectDir() {
		return subjectDir;
	}

	public File getMeshFile() {
		return new File(subjectDir, MESH_FILE_NAME);
	}

	public File getSampleDir(final StimulationSelection selection) {
		return selection.resolveSampleDir(subjectDir);
	}

	/**
	 * @param selection the stimulation parameters
	 * @return a request to load the subject mesh overlaid with the samples of
	 *         {@code selection}
	 */
	public LoadRequest toRequest(final StimulationSelection selection) {
		return new LoadRequest(getMeshFile(), getSampleDir(selection), selection);
	}

}
