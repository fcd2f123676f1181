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

package sc.fiji.pcolor.grid;

import static org.junit.Assert.*;

import org.junit.Test;

import sc.fiji.pcolor.grid.BoundaryExtent.Extent;

/**
 * Tests for {@link BoundaryExtent}
 */
public class BoundaryExtentTest {

	@Test
	public void testInteriorIsIgnored() {
		final double[][] a = { { 1, 2, 3 }, { 4, 1000, 6 }, { 7, 8, 9 } };
		final Extent e = BoundaryExtent.minMax(a);
		assertEquals("Min", 1, e.min(), 0);
		assertEquals("Max should ignore the interior outlier", 9, e.max(), 0);

		a[1][1] = -1000;
		assertEquals("Min should ignore the interior outlier", 1, BoundaryExtent.minMax(a).min(), 0);
	}

	@Test
	public void testEveryEdgeIsVisited() {
		final double[][] a = new double[4][5];
		a[2][0] = -3; // left column
		a[3][2] = 7; // bottom row
		final Extent e = BoundaryExtent.minMax(a);
		assertEquals(-3, e.min(), 0);
		assertEquals(7, e.max(), 0);
		a[1][4] = 11; // right column
		assertEquals(11, BoundaryExtent.minMax(a).max(), 0);
	}

	@Test
	public void testSingleRowAndColumn() {
		final Extent row = BoundaryExtent.minMax(new double[][] { { 3, 1, 2 } });
		assertEquals(1, row.min(), 0);
		assertEquals(3, row.max(), 0);
		final Extent col = BoundaryExtent.minMax(new double[][] { { 3 }, { 1 }, { 2 } });
		assertEquals(1, col.min(), 0);
		assertEquals(3, col.max(), 0);
	}

	@Test
	public void testVector() {
		final Extent e = BoundaryExtent.minMax(new double[] { 2, -1, 5, 0 });
		assertArrayEquals(new double[] { -1, 5 }, e.toArray(), 0);
		assertEquals(6, e.span(), 0);
	}
}
