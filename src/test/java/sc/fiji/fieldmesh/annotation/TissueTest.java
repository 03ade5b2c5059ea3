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

package sc.fiji.fieldmesh.annotation;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

/**
 * Tests for {@link Tissue}
 */
public class TissueTest {

	@Test
	public void testSampleFileNames() {
		assertEquals("e_gray_matter.npy", Tissue.GRAY_MATTER.getSampleFileName());
		assertEquals("e_csf.npy", Tissue.CSF.getSampleFileName());
		for (final Tissue t : Tissue.values()) {
			assertSame(t, Tissue.fromSampleFileName(t.getSampleFileName()).get());
			assertTrue(Tissue.isSampleFileName(t.getSampleFileName()));
		}
		assertFalse(Tissue.fromSampleFileName("e_skin.npy").isPresent());
		assertTrue("Unknown tissues are still sample files", Tissue.isSampleFileName("e_skin.npy"));
		assertFalse(Tissue.isSampleFileName("e_csf.npz"));
		assertFalse(Tissue.isSampleFileName("csf.npy"));
	}

	@Test
	public void testLabels() {
		assertSame(Tissue.WHITE_MATTER, Tissue.fromLabel("White Matter"));
		assertEquals("Gray Matter", Tissue.GRAY_MATTER.toString());
		assertEquals(5, Tissue.list().size());
		assertSame(Tissue.SCALP, Tissue.list().get(0));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testUnknownLabel() {
		Tissue.fromLabel("Skin");
	}

}
