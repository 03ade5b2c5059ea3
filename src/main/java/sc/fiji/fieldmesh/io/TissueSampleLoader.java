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

package sc.fiji.fieldmesh.io;

import java.io.File;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import sc.fiji.fieldmesh.annotation.Tissue;
import sc.fiji.fieldmesh.util.Logger;

/**
 * Loads the field samples of every {@link Tissue} from a sample directory,
 * e.g., for statistical reports. Unlike overlay merging, all tissues are
 * always loaded: absent tissues and malformed files map to
 * {@link FieldSample#EMPTY}.
 */
public class TissueSampleLoader {

	private final FieldSampleDecoder decoder;
	private final Logger logger;

	public TissueSampleLoader() {
		this(new NpyFieldSampleDecoder());
	}

	public TissueSampleLoader(final FieldSampleDecoder decoder) {
		this(decoder, new Logger(TissueSampleLoader.class));
	}

	public TissueSampleLoader(final FieldSampleDecoder decoder, final Logger logger) {
		if (decoder == null) throw new IllegalArgumentException("decoder cannot be null");
		this.decoder = decoder;
		this.logger = logger;
	}

	/**
	 * Loads the samples of all tissues.
	 *
	 * @param sampleDir the directory holding the {@code e_<tissue>.npy} files
	 * @return the samples of each tissue, iterated in {@link Tissue} order
	 */
	public Map<Tissue, FieldSample> loadAll(final File sampleDir) {
		final Map<Tissue, FieldSample> map = new EnumMap<>(Tissue.class);
		final List<Tissue> missing = new ArrayList<>();
		for (final Tissue tissue : Tissue.values()) {
			final FieldSample sample = load(sampleDir, tissue);
			if (sample.isEmpty()) missing.add(tissue);
			map.put(tissue, sample);
		}
		if (!missing.isEmpty()) {
			logger.warn("Missing data for: " + missing.stream().map(Tissue::getLabel).collect(Collectors.joining(", ")));
		}
		return map;
	}

	/**
	 * Loads the samples of a single tissue.
	 *
	 * @param sampleDir the directory holding the {@code e_<tissue>.npy} files
	 * @param tissue the tissue to be loaded
	 * @return the samples, or {@link FieldSample#EMPTY} if the file is absent or
	 *         malformed
	 */
	public FieldSample load(final File sampleDir, final Tissue tissue) {
		final File file = new File(sampleDir, tissue.getSampleFileName());
		try {
			return decoder.decode(file);
		} catch (final SampleDecodeException e) {
			logger.warn("Ignoring " + tissue.getLabel() + " samples: " + e.getMessage());
			return FieldSample.EMPTY;
		}
	}

}
