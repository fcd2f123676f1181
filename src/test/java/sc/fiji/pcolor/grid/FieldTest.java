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

import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.real.DoubleType;

/**
 * Tests for {@link Field}
 */
public class FieldTest {

	@Test
	public void testIgnoreValueIsMasked() {
		final Field field = Field.of(new double[][] { { 1, -999 }, { 3, 4 } }, -999d);
		assertFalse("Sentinel cell should be invalid", field.isValid(0, 1));
		assertTrue(field.isValid(0, 0));
		assertEquals(3, field.validCount());
		assertTrue(field.hasInvalid());
		assertArrayEquals("Valid values in row-major order", new double[] { 1, 3, 4 }, field.validValues(), 0);
	}

	@Test
	public void testNaNIsAlwaysInvalid() {
		final Field field = Field.of(new double[][] { { Double.NaN, 2 } });
		assertFalse(field.isValid(0, 0));
		assertEquals(1, field.validCount());
	}

	@Test
	public void testInputIsCopied() {
		final double[][] values = { { 1, 2 } };
		final Field field = Field.of(values);
		values[0][0] = 42;
		assertEquals("Field should not see later changes", 1, field.get(0, 0), 0);
	}

	@Test
	public void testExplicitMask() {
		final Field field = Field.masked(new double[][] { { 1, 2 }, { 3, 4 } }, new boolean[][] { { true, false }, {
				true, true } });
		assertFalse(field.isValid(0, 1));
		assertEquals(3, field.validCount());
	}

	@Test(expected = ShapeMismatchException.class)
	public void testMaskShapeMismatch() {
		Field.masked(new double[][] { { 1, 2 } }, new boolean[][] { { true } });
	}

	@Test
	public void testDifferenceIsValidWhereBothAre() {
		final Field a = Field.of(new double[][] { { 5, 6, 7 } }, 7d);
		final Field b = Field.of(new double[][] { { 1, 0, 2 } }, 0d);
		final Field diff = a.minus(b);
		assertEquals(4, diff.get(0, 0), 0);
		assertFalse("Invalid in b", diff.isValid(0, 1));
		assertFalse("Invalid in a", diff.isValid(0, 2));
		assertEquals(1, diff.validCount());
	}

	@Test
	public void testSubtractConstantKeepsMask() {
		final Field a = Field.of(new double[][] { { 5, -1 } }, -1d);
		final Field shifted = a.minus(2);
		assertEquals(3, shifted.get(0, 0), 0);
		assertFalse(shifted.isValid(0, 1));
		assertEquals(-5, a.negate().get(0, 0), 0);
	}

	@Test(expected = ShapeMismatchException.class)
	public void testDifferenceShapeMismatch() {
		Field.of(new double[2][2]).minus(Field.of(new double[2][3]));
	}

	@Test
	public void testFromImg() {
		// dimension 0 is i, dimension 1 is j
		final Img<DoubleType> img = ArrayImgs.doubles(new double[] { 1, 2, 3, 4, 5, 6 }, 3, 2);
		final Field field = Field.fromImg(img, 5d);
		assertArrayEquals(new int[] { 2, 3 }, field.shape());
		assertEquals(3, field.get(0, 2), 0);
		assertEquals(4, field.get(1, 0), 0);
		assertFalse(field.isValid(1, 1));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testRaggedValues() {
		Field.of(new double[][] { { 1, 2 }, { 3 } });
	}
}
