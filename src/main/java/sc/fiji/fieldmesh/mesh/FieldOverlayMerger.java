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

import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import sc.fiji.fieldmesh.annotation.Tissue;
import sc.fiji.fieldmesh.io.FieldSample;
import sc.fiji.fieldmesh.io.FieldSampleDecoder;
import sc.fiji.fieldmesh.io.NpyFieldSampleDecoder;
import sc.fiji.fieldmesh.io.SampleDecodeException;
import sc.fiji.fieldmesh.util.Logger;

/**
 * Appends electric-field samples to an {@link IndexedGrid} as new points, and
 * assembles the scalar array aligned with the extended point set.
 * <p>
 * Sources are selected from the sample directory as follows: if
 * {@code e_gray_matter.npy} exists it is the sole source; otherwise, if
 * {@code e_white_matter.npy} exists it is the sole source; otherwise every
 * {@code e_*.npy} file is used, in lexicographic file-name order. Sources that
 * are empty or malformed are skipped.
 * </p>
 */
public class FieldOverlayMerger {

	private final FieldSampleDecoder decoder;
	private final Logger logger;

	public FieldOverlayMerger() {
		this(new NpyFieldSampleDecoder());
	}

	public FieldOverlayMerger(final FieldSampleDecoder decoder) {
		this(decoder, new Logger(FieldOverlayMerger.class));
	}

	public FieldOverlayMerger(final FieldSampleDecoder decoder, final Logger logger) {
		if (decoder == null) throw new IllegalArgumentException("decoder cannot be null");
		this.decoder = decoder;
		this.logger = logger;
	}

	/**
	 * Selects the sample files to be overlaid.
	 *
	 * @param sampleDir the directory holding the {@code e_<tissue>.npy} files
	 * @return the selected files, in overlay order. Empty if there are none.
	 */
	public List<File> selectSources(final File sampleDir) {
		if (sampleDir == null || !sampleDir.isDirectory()) return Collections.emptyList();
		final File gray = new File(sampleDir, Tissue.GRAY_MATTER.getSampleFileName());
		if (gray.isFile()) return Collections.singletonList(gray);
		final File white = new File(sampleDir, Tissue.WHITE_MATTER.getSampleFileName());
		if (white.isFile()) return Collections.singletonList(white);
		final File[] files = sampleDir.listFiles(f -> f.isFile() && Tissue.isSampleFileName(f.getName()));
		if (files == null) return Collections.emptyList();
		Arrays.sort(files, (f1, f2) -> f1.getName().compareTo(f2.getName()));
		return Arrays.asList(files);
	}

	/**
	 * Merges the field samples of the specified directory onto a grid. The
	 * input grid is not modified.
	 *
	 * @param grid the grid built from the head mesh
	 * @param sampleDir the directory holding the {@code e_<tissue>.npy} files
	 * @return the augmented grid: the points of {@code grid} followed by the
	 *         locations of all selected samples, with scalars set to 0 for mesh
	 *         points and to the sample magnitude for sample points
	 * @throws NoOverlayDataException if no selected source yields any record
	 */
	public AugmentedGrid merge(final IndexedGrid grid, final File sampleDir) throws NoOverlayDataException {
		if (grid == null) throw new IllegalArgumentException("grid cannot be null");
		final List<File> files = selectSources(sampleDir);
		if (files.isEmpty()) throw new NoOverlayDataException("No field-sample files in " + sampleDir);
		logger.debug("Overlay sources: " + files);

		final List<File> accepted = new ArrayList<>(files.size());
		final List<FieldSample> samples = new ArrayList<>(files.size());
		long overlayCount = 0;
		for (final File file : files) {
			final FieldSample sample;
			try {
				sample = decoder.decode(file);
			} catch (final SampleDecodeException e) {
				logger.warn("Skipping " + file.getName() + ": " + e.getMessage());
				continue;
			}
			if (sample.isEmpty()) {
				logger.warn("Skipping " + file.getName() + ": no data");
				continue;
			}
			accepted.add(file);
			samples.add(sample);
			overlayCount += sample.size();
		}
		if (overlayCount == 0)
			throw new NoOverlayDataException("None of " + files.size() + " source(s) in " + sampleDir + " holds data");

		final int baseCount = grid.getPointCount();
		final long total = baseCount + overlayCount;
		if (3 * total > Integer.MAX_VALUE)
			throw new IllegalArgumentException("Too many points to merge: " + total);
		final double[] points = Arrays.copyOf(grid.points(), (int) (3 * total));
		final double[] scalars = new double[(int) total]; // [0, baseCount) stays 0
		final List<OverlaySource> sources = new ArrayList<>(samples.size());
		int offset = baseCount;
		for (int s = 0; s < samples.size(); s++) {
			final FieldSample sample = samples.get(s);
			final double[] coords = sample.getCoordinates();
			System.arraycopy(coords, 0, points, 3 * offset, coords.length);
			for (int i = 0; i < sample.size(); i++) {
				scalars[offset + i] = sample.getMagnitude(i);
			}
			sources.add(new OverlaySource(accepted.get(s).getName(), offset, sample.size()));
			offset += sample.size();
		}
		final AugmentedGrid augmented = new AugmentedGrid(points, new ArrayList<>(grid.getCells()), scalars,
				baseCount, sources);
		logger.debug("Merged " + overlayCount + " samples onto " + baseCount + " mesh points");
		return augmented;
	}

}
