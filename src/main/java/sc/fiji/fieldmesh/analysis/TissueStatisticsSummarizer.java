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
 * Computes summary statistics of field magnitudes for each tissue.
 */
public class TissueStatisticsSummarizer {

	/**
	 * Summarizes the magnitude column of each tissue's samples.
	 *
	 * @param samples the samples of each tissue. Null values are treated as
	 *          empty samples.
	 * @return the statistics of each tissue, iterated in {@link Tissue} order.
	 *         Tissues without samples map to undefined statistics.
	 */
	public Map<Tissue, TissueStatistics> summarize(final Map<Tissue, FieldSample> samples) {
		final Map<Tissue, TissueStatistics> map = new EnumMap<>(Tissue.class);
		for (final Map.Entry<Tissue, FieldSample> entry : samples.entrySet()) {
			map.put(entry.getKey(), summarize(entry.getKey(), entry.getValue()));
		}
		return map;
	}

	/**
	 * Summarizes the magnitude column of a single tissue.
	 *
	 * @param tissue the tissue
	 * @param sample its samples
	 * @return the statistics, undefined if {@code sample} is null or empty
	 */
	public TissueStatistics summarize(final Tissue tissue, final FieldSample sample) {
		if (sample == null || sample.isEmpty()) return TissueStatistics.undefined(tissue);
		final DescriptiveStatistics stats = new DescriptiveStatistics(sample.getMagnitudes());
		return new TissueStatistics(tissue, stats.getN(), stats.getMin(), stats.getMax(), stats.getMean(),
				Math.sqrt(stats.getPopulationVariance()));
	}

}
