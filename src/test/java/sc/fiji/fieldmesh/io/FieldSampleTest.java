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
import static org.junit.Assert.assertSame;

import java.util.HashSet;
import java.util.Random;
import java.util.Set;

import org.junit.Test;

/**
 * Tests for {@link FieldSample}
 */
public class FieldSampleTest {

	private static FieldSample sequence(final int n) {
		final double[] records = new double[n * FieldSample.RECORD_LENGTH];
		for (int i = 0; i < n; i++) {
			records[4 * i] = i;
			records[4 * i + 1] = -i;
			records[4 * i + 2] = 2 * i;
			records[4 * i + 3] = i / 10d;
		}
		return new FieldSample(records);
	}

	@Test
	public void testColumns() {
		final FieldSample s = sequence(3);
		assertEquals(3, s.size());
		assertArrayEquals(new double[] { 0, 0.1, 0.2 }, s.getMagnitudes(), 1e-12);
		assertArrayEquals(new double[] { 0, 0, 0, 1, -1, 2, 2, -2, 4 }, s.getCoordinates(), 0d);
		assertEquals(-2d, s.getLocation(2).y, 0d);
	}

	@Test
	public void testSubsampleWithoutReplacement() {
		final FieldSample s = sequence(100);
		final FieldSample sub = s.subsample(30, new Random(42));
		assertEquals(30, sub.size());
		final Set<Double> xs = new HashSet<>();
		for (int i = 0; i < sub.size(); i++) {
			xs.add(sub.getX(i));
			// records are kept whole
			assertEquals(sub.getX(i) / 10d, sub.getMagnitude(i), 1e-12);
		}
		assertEquals("No duplicates", 30, xs.size());
	}

	@Test
	public void testSubsampleOfSmallSample() {
		final FieldSample s = sequence(5);
		assertSame(s, s.subsample(5, new Random()));
		assertSame(s, s.subsample(5000, new Random()));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testIncompleteRecord() {
		new FieldSample(new double[] { 1, 2, 3 });
	}

}
