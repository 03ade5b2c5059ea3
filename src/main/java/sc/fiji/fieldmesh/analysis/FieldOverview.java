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

package sc.fiji.fieldmesh.analysis;

import java.util.Map;
import java.util.Random;

import sc.fiji.fieldmesh.annotation.Tissue;
import sc.fiji.fieldmesh.io.FieldSample;

/**
 * Plot-ready summary of the samples of a single tissue: histogram of field
 * magnitudes, subsampled scatter cloud, view towards the maximum field and a
 * cross-section through the middle of the scatter cloud.
 */
public class FieldOverview {

	private final Tissue tissue;
	private final FieldHistogram histogram;
	private final FieldSample cloud;
	private final FocalView focalView;
	private final CrossSection crossSection;

	/**
	 * @param tissue the tissue the samples belong to
	 * @param sample the samples (not empty)
	 * @param bins the number of histogram bins
	 * @param maxCloudSize the maximum number of samples in the scatter cloud
	 * @param gridSize the grid size from which the cross-section tolerance is
	 *          derived
	 * @param random the source of randomness for subsampling
	 */
	public FieldOverview(final Tissue tissue, final FieldSample sample, final int bins, final int maxCloudSize,
			final int gridSize, final Random random) {
		if (sample == null || sample.isEmpty()) throw new IllegalArgumentException("No samples for " + tissue);
		if (maxCloudSize <= 0) throw new IllegalArgumentException("maxCloudSize must be > 0");
		this.tissue = tissue;
		histogram = new FieldHistogram(sample, bins);
		cloud = sample.subsample(maxCloudSize, random);
		focalView = new FocalView(sample, cloud);
		crossSection = CrossSection.atMidpoint(cloud, CrossSection.Z_AXIS, gridSize);
	}

	/**
	 * Picks the tissue to be summarized, following the overlay precedence:
	 * gray matter, then white matter, then the first tissue holding samples.
	 *
	 * @param samples the samples of each tissue
	 * @return the tissue, or null if no tissue holds samples
	 */
	public static Tissue primaryTissue(final Map<Tissue, FieldSample> samples) {
		if (hasData(samples, Tissue.GRAY_MATTER)) return Tissue.GRAY_MATTER;
		if (hasData(samples, Tissue.WHITE_MATTER)) return Tissue.WHITE_MATTER;
		for (final Tissue tissue : Tissue.values()) {
			if (hasData(samples, tissue)) return tissue;
		}
		return null;
	}

	private static boolean hasData(final Map<Tissue, FieldSample> samples, final Tissue tissue) {
		final FieldSample s = samples.get(tissue);
		return s != null && !s.isEmpty();
	}

	public Tissue getTissue() {
		return tissue;
	}

	public FieldHistogram getHistogram() {
		return histogram;
	}

	/** @return the subsampled scatter cloud */
	public FieldSample getCloud() {
		return cloud;
	}

	public FocalView getFocalView() {
		return focalView;
	}

	/** @return the section of the scatter cloud at mid-height (z axis) */
	public CrossSection getCrossSection() {
		return crossSection;
	}

}
