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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Map;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import sc.fiji.fieldmesh.FieldMeshFixtures;
import sc.fiji.fieldmesh.annotation.Tissue;

/**
 * Tests for {@link TissueSampleLoader}
 */
public class TissueSampleLoaderTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	@Test
	public void testLoadAll() throws Exception {
		final File dir = folder.getRoot();
		FieldMeshFixtures.writeNpy(new File(dir, "e_gray_matter.npy"), new double[][] { { 0, 0, 0, 1 } });
		FieldMeshFixtures.writeNpy(new File(dir, "e_scalp.npy"), new double[][] { { 0, 0, 0, 2 }, { 1, 1, 1, 3 } });
		Files.write(new File(dir, "e_bone.npy").toPath(), new byte[] { 0 });

		final Map<Tissue, FieldSample> map = new TissueSampleLoader().loadAll(dir);
		assertEquals("All tissues reported", Arrays.asList(Tissue.values()), new ArrayList<>(map.keySet()));
		assertEquals(2, map.get(Tissue.SCALP).size());
		assertEquals(1, map.get(Tissue.GRAY_MATTER).size());
		assertTrue("Malformed file reported as empty", map.get(Tissue.BONE).isEmpty());
		assertTrue(map.get(Tissue.CSF).isEmpty());
		assertTrue(map.get(Tissue.WHITE_MATTER).isEmpty());
		assertArrayEquals(new double[] { 2, 3 }, map.get(Tissue.SCALP).getMagnitudes(), 0d);
	}

}
