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

package sc.fiji.pcolor.analysis;

import static org.junit.Assert.*;

import org.junit.Test;

import sc.fiji.pcolor.PColorUtils;

/**
 * Tests for {@link NiceLevelLocator}
 */
public class NiceLevelLocatorTest {

	private static void assertNice(final double[] levels, final int nBins, final double vmin, final double vmax) {
		assertEquals("Number of levels", nBins + 1, levels.length);
		for (int i = 1; i < levels.length; i++)
			assertTrue("Levels should be strictly increasing", levels[i] > levels[i - 1]);
		assertTrue("First level should not exceed " + vmin, levels[0] <= vmin);
		assertTrue("Last level should not fall below " + vmax, levels[nBins] >= vmax);
	}

	@Test
	public void testExactRange() {
		assertArrayEquals(new double[] { -5, 0, 5, 10 }, new NiceLevelLocator(3).levels(-5, 10), 1e-12);
		assertArrayEquals(new double[] { 0, 25, 50, 75, 100 }, new NiceLevelLocator(4).levels(0, 100), 1e-12);
	}

	@Test
	public void testRangesAreCovered() {
		final double[][] ranges = { { -1.3, 7.9 }, { 0.001, 0.0173 }, { -273.15, 42 }, { 3, 3.2 }, { -1e6, -2 } };
		for (final int nBins : new int[] { 2, 3, 10, 35 }) {
			final NiceLevelLocator locator = new NiceLevelLocator(nBins);
			for (final double[] range : ranges) {
				assertNice(locator.levels(range[0], range[1]), nBins, range[0], range[1]);
			}
		}
	}

	@Test
	public void testSingularRangeIsWidened() {
		assertNice(new NiceLevelLocator(4).levels(5, 5), 4, 5, 5);
		assertNice(new NiceLevelLocator(4).levels(0, 0), 4, 0, 0);
	}

	@Test
	public void testOffsetRange() {
		final double[] levels = new NiceLevelLocator(5).levels(1000, 1001);
		assertArrayEquals(new double[] { 1000, 1000.2, 1000.4, 1000.6, 1000.8, 1001 }, levels, 1e-9);
	}

	@Test
	public void testSingleBinAcrossZero() {
		final boolean debug = PColorUtils.isDebugMode();
		try {
			PColorUtils.setDebugMode(true);
			final double[] levels = new NiceLevelLocator(1).levels(-1, 1);
			assertArrayEquals("Largest step of the first decade", new double[] { -10, 0 }, levels, 1e-12);
		} finally {
			PColorUtils.setDebugMode(debug);
		}
	}

	@Test
	public void testTenIsAppended() {
		assertArrayEquals(new double[] { 1, 5, 10 }, new NiceLevelLocator(3, new double[] { 1, 5 }).getSteps(), 0);
		assertArrayEquals(NiceLevelLocator.DEFAULT_STEPS, new NiceLevelLocator(3).getSteps(), 0);
	}

	@Test
	public void testNonSingular() {
		assertArrayEquals(new double[] { -1e-13, 1e-13 }, NiceLevelLocator.nonSingular(Double.NaN, 1), 0);
		assertArrayEquals("Ends are ordered", new double[] { 1, 2 }, NiceLevelLocator.nonSingular(2, 1), 0);
	}

	@Test(expected = InvalidLevelSpecException.class)
	public void testStepsOutOfRange() {
		new NiceLevelLocator(3, new double[] { 0.5, 1 });
	}

	@Test(expected = InvalidLevelSpecException.class)
	public void testStepsNotIncreasing() {
		new NiceLevelLocator(3, new double[] { 2, 1 });
	}

	@Test(expected = InvalidLevelSpecException.class)
	public void testEmptySteps() {
		new NiceLevelLocator(3, new double[0]);
	}

	@Test(expected = InvalidLevelSpecException.class)
	public void testZeroBins() {
		new NiceLevelLocator(0);
	}
}
