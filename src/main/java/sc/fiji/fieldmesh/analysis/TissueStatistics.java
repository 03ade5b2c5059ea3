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

import sc.fiji.fieldmesh.FieldMeshUtils;
import sc.fiji.fieldmesh.annotation.Tissue;

/**
 * Summary statistics of the field magnitudes of a tissue. All values are
 * undefined ({@code NaN}) when the tissue has no samples; use the
 * {@code format*} methods to obtain display strings ("N/A" for undefined
 * values).
 */
public final class TissueStatistics {

	private final Tissue tissue;
	private final long n;
	private final double min;
	private final double max;
	private final double mean;
	private final double std;

	TissueStatistics(final Tissue tissue, final long n, final double min, final double max, final double mean,
			final double std) {
		this.tissue = tissue;
		this.n = n;
		this.min = min;
		this.max = max;
		this.mean = mean;
		this.std = std;
	}

	static TissueStatistics undefined(final Tissue tissue) {
		return new TissueStatistics(tissue, 0, Double.NaN, Double.NaN, Double.NaN, Double.NaN);
	}

	public Tissue getTissue() {
		return tissue;
	}

	/** @return the number of samples */
	public long getN() {
		return n;
	}

	/** @return whether statistics are defined, i.e., the tissue has samples */
	public boolean isDefined() {
		return n > 0;
	}

	public double getMin() {
		return min;
	}

	public double getMax() {
		return max;
	}

	public double getMean() {
		return mean;
	}

	/** @return the population standard deviation */
	public double getStd() {
		return std;
	}

	public String formatMin() {
		return FieldMeshUtils.formatScientific(min);
	}

	public String formatMax() {
		return FieldMeshUtils.formatScientific(max);
	}

	public String formatMean() {
		return FieldMeshUtils.formatScientific(mean);
	}

	public String formatStd() {
		return FieldMeshUtils.formatScientific(std);
	}

	@Override
	public String toString() {
		return String.format("%-12s: min=%s, max=%s, mean=%s, std=%s", tissue.getLabel(), formatMin(), formatMax(),
				formatMean(), formatStd());
	}

}
