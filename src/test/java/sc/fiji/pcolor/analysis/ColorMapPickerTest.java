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

import sc.fiji.pcolor.util.ColorMaps;

/**
 * Tests for {@link ColorMapPicker}
 */
public class ColorMapPickerTest {

	@Test
	public void testStraddlingZeroIsDiverging() {
		assertEquals(ColorMaps.SEISMIC, ColorMapPicker.pick(-1, 1));
		assertEquals(ColorMaps.SEISMIC, ColorMapPicker.pick(-0.01, 100));
	}

	@Test
	public void testMostlyPositive() {
		assertEquals(ColorMaps.HOT, ColorMapPicker.pick(0, 10));
		assertEquals(ColorMaps.HOT, ColorMapPicker.pick(0.5, 10));
	}

	@Test
	public void testMostlyNegative() {
		assertEquals(ColorMaps.HOT_R, ColorMapPicker.pick(-10, 0));
		assertEquals(ColorMaps.HOT_R, ColorMapPicker.pick(-10, -0.5));
	}

	@Test
	public void testFarFromZero() {
		assertEquals(ColorMaps.SPECTRAL, ColorMapPicker.pick(5, 10));
		assertEquals(ColorMaps.SPECTRAL, ColorMapPicker.pick(-10, -5));
		assertEquals(ColorMaps.SPECTRAL, ColorMapPicker.pick(0, 0));
	}
}
