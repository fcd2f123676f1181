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
 * Tests for {@link CoordinateExpander}
 */
public class CoordinateExpanderTest {

	private static final double DELTA = 1e-12;

	@Test
	public void testExpandVector() {
		final double[] corners = CoordinateExpander.expand(new double[] { 1, 2, 4 });
		assertArrayEquals("Corners of [1, 2, 4]", new double[] { 0.5, 1.5, 3, 5 }, corners, DELTA);
	}

	@Test
	public void testExpandDoesNotModifyInput() {
		final double[] centers = { 1, 2, 4 };
		CoordinateExpander.expand(centers);
		assertArrayEquals("Input should be unchanged", new double[] { 1, 2, 4 }, centers, 0);
	}

	@Test
	public void testAdjacentCornersAverageToInteriorCenters() {
		final double[] centers = { 1, 3, 5, 7, 9 };
		final double[] corners = CoordinateExpander.expand(centers);
		for (int i = 0; i < centers.length; i++) {
			assertEquals("Center " + i, centers[i], 0.5 * (corners[i] + corners[i + 1]), DELTA);
		}
	}

	@Test(expected = IllegalArgumentException.class)
	public void testExpandRequiresTwoValues() {
		CoordinateExpander.expand(new double[] { 1 });
	}

	@Test
	public void testExpandIJ() {
		final double[][] a = { { 0, 1, 2 }, { 10, 11, 12 } };
		final double[][] i = CoordinateExpander.expandI(a);
		assertEquals("Rows after expandI", 2, i.length);
		assertEquals("Columns after expandI", 4, i[0].length);
		assertArrayEquals(new double[] { 9.5, 10.5, 11.5, 12.5 }, i[1], DELTA);

		final double[][] j = CoordinateExpander.expandJ(a);
		assertEquals("Rows after expandJ", 3, j.length);
		assertEquals("Columns after expandJ", 3, j[0].length);
		assertArrayEquals(new double[] { -5, 5, 15 }, new double[] { j[0][0], j[1][0], j[2][0] }, DELTA);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testExpandJRequiresTwoRows() {
		CoordinateExpander.expandJ(new double[][] { { 1, 2, 3 } });
	}

	@Test
	public void testIndexCoordinates() {
		final CornerCoordinates c = CoordinateExpander.toCorners(2, 3, null, null);
		assertEquals("Corner rows", 3, c.rows());
		assertEquals("Corner columns", 4, c.columns());
		assertArrayEquals(new double[] { 0, 1, 2, 3 }, c.x()[0], 0);
		assertArrayEquals(new double[] { 0, 1, 2 }, new double[] { c.y()[0][2], c.y()[1][2], c.y()[2][2] }, 0);
	}

	@Test
	public void testCenterVectors() {
		final Field field = Field.of(new double[2][3]);
		final CornerCoordinates c = CoordinateExpander.toCorners(field, Coordinate.of(new double[] { 10, 20, 30 }),
				Coordinate.of(new double[] { 0, 5 }));
		assertEquals(3, c.rows());
		assertEquals(4, c.columns());
		for (int j = 0; j < c.rows(); j++)
			assertArrayEquals("x corners of row " + j, new double[] { 5, 15, 25, 35 }, c.x()[j], DELTA);
		assertEquals(-2.5, c.y()[0][1], DELTA);
		assertEquals(2.5, c.y()[1][1], DELTA);
		assertEquals(7.5, c.y()[2][3], DELTA);
	}

	@Test
	public void testCornerVectorsArePassedThrough() {
		final double[] x = { 0, 1, 3, 6 };
		final double[] y = { -1, 0, 1 };
		final CornerCoordinates c = CoordinateExpander.toCorners(2, 3, Coordinate.of(x), Coordinate.of(y));
		assertArrayEquals(x, c.x()[1], 0);
		assertEquals(-1, c.y()[0][3], 0);
		assertEquals(1, c.y()[2][0], 0);
	}

	@Test
	public void testMissingCoordinateUsesIndexCorners() {
		final CornerCoordinates c = CoordinateExpander.toCorners(2, 3, null, Coordinate.of(new double[] { 0, 5 }));
		assertArrayEquals("Index corners", new double[] { 0, 1, 2, 3 }, c.x()[0], DELTA);
		assertEquals(-2.5, c.y()[0][0], DELTA);
	}

	@Test
	public void testSingleRowWithCenterVector() {
		final CornerCoordinates c = CoordinateExpander.toCorners(1, 3, Coordinate.of(new double[] { 10, 20, 30 }), null);
		assertEquals("Corner rows", 2, c.rows());
		assertEquals("Corner columns", 4, c.columns());
		assertArrayEquals(new double[] { 5, 15, 25, 35 }, c.x()[1], DELTA);
		assertArrayEquals(new double[] { 0, 0, 0, 0 }, c.y()[0], 0);
		assertArrayEquals(new double[] { 1, 1, 1, 1 }, c.y()[1], 0);
	}

	@Test
	public void testSingleColumnWithCenterVector() {
		final CornerCoordinates c = CoordinateExpander.toCorners(3, 1, null, Coordinate.of(new double[] { -1, 0, 1 }));
		assertEquals(4, c.rows());
		assertEquals(2, c.columns());
		assertEquals(-1.5, c.y()[0][1], DELTA);
		assertEquals(1.5, c.y()[3][0], DELTA);
		assertArrayEquals(new double[] { 0, 1 }, c.x()[2], 0);
	}

	@Test
	public void test2DCentersWithMissingY() {
		final double[][] x = { { 0, 1 }, { 0.5, 1.5 } };
		final CornerCoordinates c = CoordinateExpander.toCorners(2, 2, Coordinate.of(x), null);
		assertEquals(0.75, c.x()[1][1], DELTA);
		assertArrayEquals(new double[] { 2, 2, 2 }, c.y()[2], 0);
	}

	@Test
	public void test2DCenters() {
		final double[][] x = { { 0, 1 }, { 0.5, 1.5 } };
		final double[][] y = { { 0, 0 }, { 1, 1 } };
		final CornerCoordinates c = CoordinateExpander.toCorners(2, 2, Coordinate.of(x), Coordinate.of(y));
		assertEquals(3, c.rows());
		assertEquals(3, c.columns());
		assertEquals("Interior corner is the mean of four centers", 0.75, c.x()[1][1], DELTA);
		assertEquals(0.5, c.y()[1][1], DELTA);
	}

	@Test(expected = ShapeMismatchException.class)
	public void testMismatched2DCoordinates() {
		CoordinateExpander.toCorners(2, 3, Coordinate.of(new double[2][3]), Coordinate.of(new double[3][3]));
	}

	@Test(expected = ShapeMismatchException.class)
	public void testCoordinatesFittingNeitherCentersNorCorners() {
		CoordinateExpander.toCorners(2, 3, Coordinate.of(new double[] { 0, 1, 2, 3, 4 }), Coordinate.of(
				new double[] { 0, 1 }));
	}
}
