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

import java.util.EnumMap;
import java.util.Map;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import sc.fiji.fieldmesh.annotation.Tissue;
import sc.fiji.fieldmesh.io.FieldSample;

/**
 * Frequency histogram of field magnitudes, using equal-width bins spanning the
 * magnitude range. The last bin is closed, so that the maximum is counted.
 */
public class FieldHistogram {

	private final double[] edges;
	private final long[] counts;

	/**
	 * @param sample the field samples. Must not be empty.
	 * @param bins the number of bins
	 */
	public FieldHistogram(final FieldSample sample, final int bins) {
		if (sample == null || sample.isEmpty()) throw new IllegalArgumentException("No samples to bin");
		if (bins <= 0) throw new IllegalArgumentException("bins must be > 0");
		final DescriptiveStatistics stats = new DescriptiveStatistics(sample.getMagnitudes());
		double lower = stats.getMin();
		double upper = stats.getMax();
		if (lower == upper) {
			lower -= 0.5;
			upper += 0.5;
		}
		edges = new double[bins + 1];
		for (int i = 0; i <= bins; i++)
			edges[i] = lower + (upper - lower) * i / bins;
		counts = new long[bins];
		final double width = (upper - lower) / bins;
		for (final double v : stats.getValues()) {
			int idx = (int) ((v - lower) / width);
			if (idx >= bins) idx = bins - 1;
			if (idx < 0) idx = 0;
			counts[idx]++;
		}
	}

	/**
	 * Bins the samples of each tissue. Tissues without samples are skipped.
	 *
	 * @param samples the samples of each tissue
	 * @param bins the number of bins
	 * @return the histogram of each tissue holding samples
	 */
	public static Map<Tissue, FieldHistogram> of(final Map<Tissue, FieldSample> samples, final int bins) {
		final Map<Tissue, FieldHistogram> map = new EnumMap<>(Tissue.class);
		samples.forEach((tissue, sample) -> {
			if (sample != null && !sample.isEmpty()) map.put(tissue, new FieldHistogram(sample, bins));
		});
		return map;
	}

	public int getBinCount() {
		return counts.length;
	}

	/** @return a copy of the bin counts */
	public long[] getCounts() {
		return counts.clone();
	}

	public long getCount(final int bin) {
		return counts[bin];
	}

	/** @return a copy of the bin edges ({@code getBinCount() + 1} values) */
	public double[] getBinEdges() {
		return edges.clone();
	}

	/** @return the total number of binned values */
	public long getTotal() {
		long total = 0;
		for (final long c : counts)
			total += c;
		return total;
	}

}
