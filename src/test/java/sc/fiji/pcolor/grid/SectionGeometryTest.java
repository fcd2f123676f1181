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

/**
 * Tests for {@link SectionGeometry}
 */
public class SectionGeometryTest {

	private static final double[][] Z = { { 0, 0, 0 }, { -10, -10, -20 }, { -30, -30, -30 } };

	@Test
	public void testCornerPositions() {
		assertArrayEquals("Centers are expanded", new double[] { -0.5, 0.5, 1.5, 2.5 }, SectionGeometry
				.cornerPositions(new double[] { 0, 1, 2 }, 3), 1e-12);
		assertArrayEquals("Edges are kept", new double[] { 0, 1, 2, 4 }, SectionGeometry.cornerPositions(
				new double[] { 0, 1, 2, 4 }, 3), 0);
		assertArrayEquals("Indices when absent", new double[] { 0, 1, 2, 3 }, SectionGeometry.cornerPositions(null,
				3), 0);
	}

	@Test(expected = ShapeMismatchException.class)
	public void testCornerPositionsMismatch() {
		SectionGeometry.cornerPositions(new double[] { 0, 1, 2, 3, 4 }, 3);
	}

	@Test
	public void testWeights() {
		final double[][] w = SectionGeometry.weights(new double[] { 0, 1, 2, 4 }, Z);
		assertEquals("Layers", 2, w.length);
		assertEquals("Columns", 3, w[0].length);
		assertEquals(10, w[0][0], 0);
		assertEquals(40, w[0][2], 0);
		assertEquals(20, w[1][1], 0);
		assertEquals("Wider column", 20, w[1][2], 0);
	}

	@Test
	public void testWeightsOfDecreasingY() {
		final double[][] w = SectionGeometry.weights(new double[] { 4, 2, 1, 0 }, Z);
		assertEquals(20, w[0][0], 0);
	}

	@Test
	public void testWeightsOfDepths() {
		final double[][] depths = { { 0, 0, 0 }, { 10, 10, 20 }, { 30, 30, 30 } };
		final double[] y = { 0, 1, 2, 4 };
		final double[][] fromDepths = SectionGeometry.weights(y, depths);
		final double[][] fromElevations = SectionGeometry.weights(y, Z);
		for (int k = 0; k < fromDepths.length; k++)
			assertArrayEquals("Layer " + k, fromElevations[k], fromDepths[k], 0);
	}

	@Test
	public void testCorners() {
		final CornerCoordinates c = SectionGeometry.corners(new double[] { 0, 1, 2, 3 }, Z);
		assertEquals("Interfaces", 3, c.rows());
		assertEquals("Column edges", 4, c.columns());
		assertArrayEquals(new double[] { 0, 1, 2, 3 }, c.x()[2], 0);
		assertEquals(-15, c.y()[1][2], 1e-12);
		assertEquals(-30, c.yExtent().min(), 0);
		assertEquals(0, c.yExtent().max(), 0);
	}

	@Test
	public void testSingleColumnCorners() {
		final CornerCoordinates c = SectionGeometry.corners(new double[] { 0, 1 }, new double[][] { { 0 }, { -5 } });
		assertArrayEquals(new double[] { -5, -5 }, c.y()[1], 0);
	}
}
