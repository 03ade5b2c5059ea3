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
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertSame;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import sc.fiji.fieldmesh.FailureKind;

/**
 * Tests for {@link MeshGridBuilder}
 */
public class MeshGridBuilderTest {

	private final MeshGridBuilder builder = new MeshGridBuilder();

	@Test
	public void testPointsAndCellsPreserved() throws EmptyMeshException {
		final double[] nodes = { 0, 0, 0, 1, 0, 0, 0, 1, 0, 0, 0, 1, 1, 1, 1 };
		final List<Cell> tetra = Arrays.asList(new Cell(CellType.TETRA, 0, 1, 2, 3),
				new Cell(CellType.TETRA, 1, 2, 3, 4));
		final List<Cell> triangles = Collections.singletonList(new Cell(CellType.TRIANGLE, 4, 2, 1));
		final RawMesh mesh = new RawMesh(nodes, tetra, triangles);
		final IndexedGrid grid = builder.build(mesh);

		assertEquals("Point count", mesh.getNodeCount(), grid.getPointCount());
		assertArrayEquals("Coordinates", nodes, grid.getPoints(), 0d);
		assertEquals("Cell count", 3, grid.getCells().size());
		// tetrahedra first, then triangles, indices untouched
		assertEquals(tetra.get(0), grid.getCells().get(0));
		assertEquals(tetra.get(1), grid.getCells().get(1));
		assertEquals(triangles.get(0), grid.getCells().get(2));
		assertArrayEquals(new int[] { 4, 2, 1 }, grid.getCells().get(2).getPointIds());
	}

	@Test
	public void testNodesWithoutCells() throws EmptyMeshException {
		final RawMesh mesh = new RawMesh(new double[] { 1, 2, 3 }, Collections.emptyList(), Collections.emptyList());
		final IndexedGrid grid = builder.build(mesh);
		assertEquals(1, grid.getPointCount());
		assertEquals(0, grid.getCells().size());
		assertEquals(2d, grid.getY(0), 0d);
	}

	@Test
	public void testGridIsIndependentOfMesh() throws EmptyMeshException {
		final double[] nodes = { 0, 0, 0 };
		final RawMesh mesh = new RawMesh(nodes, Collections.emptyList(), Collections.emptyList());
		final IndexedGrid grid = builder.build(mesh);
		nodes[0] = 42;
		final double[] points = grid.getPoints();
		points[1] = 42;
		assertEquals("Grid unaffected by caller arrays", 0d, grid.getX(0), 0d);
		assertEquals("Grid unaffected by returned copies", 0d, grid.getY(0), 0d);
		assertNotSame(grid.getPoints(), grid.getPoints());
	}

	@Test
	public void testEmptyMesh() {
		final RawMesh mesh = new RawMesh(new double[0], Collections.emptyList(), Collections.emptyList());
		try {
			builder.build(mesh);
		} catch (final EmptyMeshException e) {
			assertSame(FailureKind.EMPTY_MESH, e.getKind());
			return;
		}
		throw new AssertionError("EmptyMeshException expected");
	}

	@Test(expected = IllegalArgumentException.class)
	public void testNullMesh() throws EmptyMeshException {
		builder.build(null);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testCellArityValidated() {
		new Cell(CellType.TETRA, 0, 1, 2);
	}

}
