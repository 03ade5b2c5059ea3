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

package sc.fiji.fieldmesh.protocol;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;

import java.io.File;

import org.junit.Test;

import sc.fiji.fieldmesh.pipeline.LoadRequest;

/**
 * Tests for {@link TmsSelection}, {@link TesSelection} and
 * {@link SubjectLayout}
 */
public class StimulationSelectionTest {

	private final File subject = new File("subjects", "ernie");

	@Test
	public void testTmsDirectory() {
		final TmsSelection s = TmsSelection.fromLabels("cb70", "F4", "5.00x1e6 A/s");
		assertSame(TmsCoil.CB70, s.getCoil());
		final File expected = new File(new File(new File(subject, "MagVenture_C-B70"), "F4"), "npy_outputs");
		assertEquals(expected, s.resolveSampleDir(subject));
		assertEquals(new File(new File(new File(subject, "Deymed_50BF"), "C3"), "npy_outputs"),
				new TmsSelection(TmsCoil.BF50, TmsTarget.C3, Intensity.HIGH).resolveSampleDir(subject));
	}

	@Test
	public void testTesDirectory() {
		final TesSelection s = TesSelection.fromLabels("F3-Fp2", "6.00 mm", "1.00x1e6 A/s");
		final File expected = new File(new File(new File(subject, "tDCS-F3-Fp2"), "thickness-6"), "npy_outputs");
		assertEquals("Montage precedes thickness", expected, s.resolveSampleDir(subject));
		assertEquals(6, s.getThickness().getMillimeters());
	}

	@Test
	public void testIntensitiesShareDirectory() {
		for (final Intensity i : Intensity.values())
			assertEquals(Intensity.SAMPLE_DIR_NAME, i.getDirectoryName());
		assertEquals(new TmsSelection(TmsCoil.BF70, TmsTarget.C4, Intensity.LOW).resolveSampleDir(subject),
				new TmsSelection(TmsCoil.BF70, TmsTarget.C4, Intensity.HIGH).resolveSampleDir(subject));
	}

	@Test
	public void testSubjectLayout() {
		final SubjectLayout layout = new SubjectLayout(subject);
		final TesSelection selection = new TesSelection(TesMontage.P3_P4, TesThickness.MM4, Intensity.MEDIUM);
		final LoadRequest request = layout.toRequest(selection);
		assertEquals(new File(subject, "sub-control.msh"), request.getMeshFile());
		assertEquals(selection.resolveSampleDir(subject), request.getSampleDir());
		assertSame(selection, request.getSelection().get());
	}

	@Test
	public void testLabels() {
		for (final TmsCoil c : TmsCoil.values())
			assertSame(c, TmsCoil.fromLabel(c.getLabel()));
		for (final TesMontage m : TesMontage.values())
			assertSame(m, TesMontage.fromLabel(m.getLabel()));
		for (final TesThickness t : TesThickness.values())
			assertSame(t, TesThickness.fromLabel(t.getLabel()));
		assertSame(TmsTarget.C3, TmsTarget.fromLabel("C3"));
		assertEquals("tDCS-C4-AF3", TesMontage.C4_AF3.getDirectoryName());
		assertEquals("Deymed_70BF", TmsCoil.BF70.getDirectoryName());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testUnknownCoil() {
		TmsCoil.fromLabel("fig8");
	}

	@Test(expected = IllegalArgumentException.class)
	public void testUnknownIntensity() {
		Intensity.fromLabel("2.00x1e6 A/s");
	}

}
