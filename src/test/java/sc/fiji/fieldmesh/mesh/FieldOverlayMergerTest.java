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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Collections;
import java.util.List;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import sc.fiji.fieldmesh.FailureKind;
import sc.fiji.fieldmesh.FieldMeshFixtures;
import sc.fiji.fieldmesh.analysis.ColorTransferFunction;
import sc.fiji.fieldmesh.analysis.ColorTransferFunctionBuilder;
import sc.fiji.fieldmesh.annotation.Tissue;

/**
 * Tests for {@link FieldOverlayMerger}
 */
public class FieldOverlayMergerTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private final FieldOverlayMerger merger = new FieldOverlayMerger();
	private IndexedGrid grid;
	private File dir;

	@Before
	public void setUp() throws Exception {
		final RawMesh mesh = new RawMesh(new double[] { 0, 0, 0, 1, 0, 0, 0, 1, 0, 0, 0, 1 },
				Collections.singletonList(new Cell(CellType.TETRA, 0, 1, 2, 3)), Collections.emptyList());
		grid = new MeshGridBuilder().build(mesh);
		dir = folder.newFolder("npy_outputs");
	}

	private void write(final String name, final double... magnitudes) throws IOException {
		final double[][] rows = new double[magnitudes.length][];
		for (int i = 0; i < rows.length; i++)
			rows[i] = new double[] { 10 + i, 20 + i, 30 + i, magnitudes[i] };
		FieldMeshFixtures.writeNpy(new File(dir, name), rows);
	}

	@Test
	public void testGrayMatterTakesPrecedence() throws Exception {
		write("e_gray_matter.npy", 0.5, 0.7);
		write("e_white_matter.npy", 9, 9, 9);
		write("e_scalp.npy", 8);
		final AugmentedGrid aug = merger.merge(grid, dir);
		assertEquals(6, aug.getPointCount());
		assertArrayEquals(new double[] { 0, 0, 0, 0, 0.5, 0.7 }, aug.getScalars(), 0d);
		assertEquals(1, aug.getOverlaySources().size());
		assertEquals(Tissue.GRAY_MATTER, aug.getOverlaySources().get(0).getTissue().get());
	}

	@Test
	public void testWhiteMatterFallback() throws Exception {
		write("e_white_matter.npy", 2, 3, 4);
		write("e_csf.npy", 8);
		final AugmentedGrid aug = merger.merge(grid, dir);
		assertEquals(7, aug.getPointCount());
		assertArrayEquals(new double[] { 0, 0, 0, 0, 2, 3, 4 }, aug.getScalars(), 0d);
	}

	@Test
	public void testAllSourcesInFileNameOrder() throws Exception {
		write("e_csf.npy", 1, 2);
		write("e_bone.npy", 3);
		final List<File> sources = merger.selectSources(dir);
		assertEquals(2, sources.size());
		assertEquals("e_bone.npy", sources.get(0).getName());
		assertEquals("e_csf.npy", sources.get(1).getName());

		final AugmentedGrid aug = merger.merge(grid, dir);
		assertArrayEquals(new double[] { 0, 0, 0, 0, 3, 1, 2 }, aug.getScalars(), 0d);
		assertEquals(4, aug.getOverlaySources().get(0).getFirstPointId());
		assertEquals(5, aug.getOverlaySources().get(1).getFirstPointId());
		assertEquals(2, aug.getOverlaySources().get(1).getCount());
	}

	@Test
	public void testNonSampleFilesIgnored() throws Exception {
		write("e_csf.npy", 1);
		write("field.npy", 5);
		Files.write(new File(dir, "e_notes.txt").toPath(), "x".getBytes(StandardCharsets.UTF_8));
		assertEquals(1, merger.selectSources(dir).size());
	}

	@Test
	public void testPointsAppendedAfterMeshNodes() throws Exception {
		write("e_gray_matter.npy", 0.5, 0.7);
		final AugmentedGrid aug = merger.merge(grid, dir);
		assertEquals(4, aug.getBaseCount());
		assertEquals(2, aug.getOverlayCount());
		for (int i = 0; i < grid.getPointCount(); i++)
			assertEquals(grid.getPoint(i), aug.getPoint(i));
		assertEquals(10d, aug.getX(4), 0d);
		assertEquals(21d, aug.getY(5), 0d);
		assertEquals(31d, aug.getZ(5), 0d);
		assertEquals("Cells unchanged", grid.getCells(), aug.getCells());
		assertEquals("Input grid unchanged", 4, grid.getPointCount());
	}

	@Test
	public void testScalarsAlignedWithPoints() throws Exception {
		write("e_bone.npy", 1, 2, 3);
		write("e_scalp.npy", 4);
		final AugmentedGrid aug = merger.merge(grid, dir);
		assertEquals(aug.getPointCount(), aug.getScalars().length);
		for (int i = 0; i < aug.getBaseCount(); i++)
			assertEquals(0d, aug.getScalar(i), 0d);
	}

	@Test
	public void testMalformedSourceSkipped() throws Exception {
		Files.write(new File(dir, "e_bone.npy").toPath(), "not an array".getBytes(StandardCharsets.UTF_8));
		write("e_csf.npy", 6);
		final AugmentedGrid aug = merger.merge(grid, dir);
		assertArrayEquals(new double[] { 0, 0, 0, 0, 6 }, aug.getScalars(), 0d);
		assertEquals("e_csf.npy", aug.getOverlaySources().get(0).getFileName());
	}

	@Test
	public void testNegativeShapeSkipped() throws Exception {
		FieldMeshFixtures.writeNpy(new File(dir, "e_bone.npy"), new double[][] { { 1, 2, 3, 4 } }, "<f8", false,
				"(-1, 4)");
		write("e_csf.npy", 6, 7);
		final AugmentedGrid aug = merger.merge(grid, dir);
		assertEquals(6, aug.getPointCount());
		assertArrayEquals(new double[] { 0, 0, 0, 0, 6, 7 }, aug.getScalars(), 0d);
		assertEquals(1, aug.getOverlaySources().size());
		assertEquals("e_csf.npy", aug.getOverlaySources().get(0).getFileName());
	}

	@Test
	public void testEmptyGrayMatterDoesNotFallBack() throws Exception {
		write("e_gray_matter.npy");
		write("e_white_matter.npy", 2, 3);
		write("e_csf.npy", 4);
		assertEquals(Collections.singletonList(new File(dir, "e_gray_matter.npy")), merger.selectSources(dir));
		assertNoOverlayData();
	}

	@Test
	public void testScalarRangeIgnoresNaN() throws Exception {
		write("e_gray_matter.npy", 0.5, Double.NaN, 0.7);
		final AugmentedGrid aug = merger.merge(grid, dir);
		assertTrue(Double.isNaN(aug.getScalar(5)));
		assertArrayEquals(new double[] { 0, 0.7 }, aug.getScalarRange(), 0d);
		final ColorTransferFunction ctf = new ColorTransferFunctionBuilder().build(aug);
		assertEquals(aug.getScalarRange()[0], ctf.getMinScalar(), 0d);
		assertEquals(aug.getScalarRange()[1], ctf.getMaxScalar(), 0d);

		final AugmentedGrid nanFirst = new AugmentedGrid(new double[6], Collections.emptyList(),
				new double[] { Double.NaN, 2 }, 1, Collections.emptyList());
		assertArrayEquals(new double[] { 2, 2 }, nanFirst.getScalarRange(), 0d);
	}

	@Test
	public void testNoOverlayData() throws Exception {
		assertNoOverlayData();
		write("e_csf.npy");
		assertNoOverlayData();
		Files.write(new File(dir, "e_bone.npy").toPath(), new byte[] { 1, 2, 3 });
		assertNoOverlayData();
	}

	@Test
	public void testMissingDirectory() {
		assertTrue(merger.selectSources(new File(dir, "missing")).isEmpty());
	}

	private void assertNoOverlayData() {
		try {
			merger.merge(grid, dir);
			fail("NoOverlayDataException expected");
		} catch (final NoOverlayDataException e) {
			assertSame(FailureKind.NO_OVERLAY_DATA, e.getKind());
		}
	}

}
