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

package sc.fiji.fieldmesh.pipeline;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.util.ArrayList;
import java.util.List;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.scijava.util.ColorRGB;

import sc.fiji.fieldmesh.FieldMeshException;
import sc.fiji.fieldmesh.FieldMeshFixtures;
import sc.fiji.fieldmesh.FieldMeshUtils;
import sc.fiji.fieldmesh.analysis.FieldOverview;
import sc.fiji.fieldmesh.annotation.Tissue;
import sc.fiji.fieldmesh.util.Logger;

/**
 * Tests for {@link LoggingFieldDisplay}
 */
public class LoggingFieldDisplayTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	@Test
	public void testShowAndError() throws Exception {
		final File mesh = FieldMeshFixtures.writeGmshAscii(folder.newFile("sub-control.msh"),
				FieldMeshFixtures.UNIT_TETRA_NODES, new int[][] { { 0, 1, 2, 3 } }, new int[0][]);
		final File samples = folder.newFolder("npy_outputs");
		FieldMeshFixtures.writeNpy(new File(samples, Tissue.CSF.getSampleFileName()),
				new double[][] { { 0, 0, 2, 0.1 } });

		final LoggingFieldDisplay display = new LoggingFieldDisplay(new RenderSettings(false, new ColorRGB(0, 0, 0)));
		final LoadResult result = new LoadPipeline(7, new LoadRequest(mesh, samples), null).call();
		display.stateChanged(7, PipelineState.READY);
		display.show(result);
		assertSame(result, display.getLastShown());
		assertNull(display.getLastError());

		try {
			new LoadPipeline(8, new LoadRequest(mesh, folder.newFolder("empty")), null).call();
		} catch (final FieldMeshException e) {
			display.showError(8, e);
			assertSame(e, display.getLastError());
			return;
		}
		throw new AssertionError("Pipeline should have failed");
	}

	@Test
	public void testOverviewUsesPlotOptions() throws Exception {
		final File mesh = FieldMeshFixtures.writeGmshAscii(folder.newFile("sub-control.msh"),
				FieldMeshFixtures.UNIT_TETRA_NODES, new int[][] { { 0, 1, 2, 3 } }, new int[0][]);
		final File samples = folder.newFolder("npy_outputs");
		FieldMeshFixtures.writeNpy(new File(samples, Tissue.GRAY_MATTER.getSampleFileName()), new double[][] {
				{ 0, 0, 0, 0.2 }, { 1, 0, 1, 0.4 }, { 2, 0, 2, 0.8 }, { 3, 0, 3, 0.6 } });
		FieldMeshFixtures.writeNpy(new File(samples, Tissue.CSF.getSampleFileName()),
				new double[][] { { 0, 0, 2, 0.1 } });

		final LoggingFieldDisplay display = new LoggingFieldDisplay(
				new RenderSettings(true, new ColorRGB(0, 0, 0), 8, 2, 10));
		final LoadResult result = new LoadPipeline(3, new LoadRequest(mesh, samples), null).call();
		display.show(result);
		final FieldOverview overview = display.getLastOverview();
		assertEquals(Tissue.GRAY_MATTER, overview.getTissue());
		assertEquals(8, overview.getHistogram().getBinCount());
		assertEquals(4, overview.getHistogram().getTotal());
		assertEquals(2, overview.getCloud().size());
		assertEquals(0.8, overview.getFocalView().getFocalMagnitude(), 0d);
	}

	@Test
	public void testStatesLoggedWhenWarningsSuppressed() {
		final List<String> messages = new ArrayList<>();
		final Logger logger = new Logger(FieldMeshUtils.getContext(), "LoggingFieldDisplayTest") {

			@Override
			public void debug(final Object msg) {
				messages.add(String.valueOf(msg));
			}
		};
		final LoggingFieldDisplay display = new LoggingFieldDisplay(
				new RenderSettings(true, new ColorRGB(0, 0, 0)), logger);
		display.stateChanged(5, PipelineState.MESH_LOADING);
		display.stateChanged(5, PipelineState.OVERLAY_MERGING);
		assertEquals(2, messages.size());
		assertTrue(messages.get(0).contains("MESH_LOADING"));
		assertTrue(messages.get(1).contains("OVERLAY_MERGING"));
	}

}
