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

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import sc.fiji.fieldmesh.annotation.Tissue;

/**
 * Tabular report of per-tissue field statistics, formatted for display:
 * values are shown in scientific notation, undefined values as "N/A".
 */
public class StatisticsReport {

	/** Column headers */
	public static final String[] HEADERS = { "Tissue", "Min", "Max", "Mean", "Std" };

	private final List<String[]> rows;

	/**
	 * @param statistics the statistics of each tissue. Rows are assembled in
	 *          {@link Tissue} order.
	 */
	public StatisticsReport(final Map<Tissue, TissueStatistics> statistics) {
		final List<String[]> list = new ArrayList<>();
		for (final Tissue tissue : Tissue.values()) {
			final TissueStatistics s = statistics.get(tissue);
			if (s == null) continue;
			list.add(new String[] { tissue.getLabel(), s.formatMin(), s.formatMax(), s.formatMean(), s.formatStd() });
		}
		rows = Collections.unmodifiableList(list);
	}

	/** @return the number of rows (header excluded) */
	public int getRowCount() {
		return rows.size();
	}

	/**
	 * @param row the row index
	 * @return a copy of the cells of the row
	 */
	public String[] getRow(final int row) {
		return rows.get(row).clone();
	}

	/**
	 * @param row the row index
	 * @param column the column index (see {@link #HEADERS})
	 * @return the cell contents
	 */
	public String get(final int row, final int column) {
		return rows.get(row)[column];
	}

	/**
	 * @return the report as tab-separated values, header included
	 */
	public String toTSV() {
		final StringBuilder sb = new StringBuilder(String.join("\t", HEADERS)).append('\n');
		for (final String[] row : rows) {
			sb.append(String.join("\t", row)).append('\n');
		}
		return sb.toString();
	}

	/**
	 * Saves the report as tab-separated values.
	 *
	 * @param file the output file
	 * @throws IOException if the file could not be written
	 */
	public void save(final File file) throws IOException {
		try (PrintWriter pw = new PrintWriter(Files.newBufferedWriter(file.toPath(), StandardCharsets.UTF_8))) {
			pw.print(toTSV());
		}
	}

	@Override
	public String toString() {
		return toTSV();
	}

}
