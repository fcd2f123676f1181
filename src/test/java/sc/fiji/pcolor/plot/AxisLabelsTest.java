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

package sc.fiji.pcolor.plot;

import static org.junit.Assert.*;

import java.util.Optional;

import org.junit.Test;

import sc.fiji.pcolor.analysis.FieldStatistics;
import sc.fiji.pcolor.analysis.FieldSummary;
import sc.fiji.pcolor.grid.Field;

/**
 * Tests for {@link AxisLabels} and {@link Annotations}
 */
public class AxisLabelsTest {

	@Test
	public void testDefaults() {
		assertEquals(new AxisLabels("i", ""), AxisLabels.x(false, null, null));
		assertEquals(new AxisLabels("Longitude", "°E"), AxisLabels.x(true, null, null));
		assertEquals(new AxisLabels("j", ""), AxisLabels.y(false, null, null));
		assertEquals(new AxisLabels("Latitude", "°N"), AxisLabels.y(true, null, null));
		assertEquals(new AxisLabels("k", ""), AxisLabels.z(false, null, null));
		assertEquals(new AxisLabels("Elevation", "m"), AxisLabels.z(true, null, null));
	}

	@Test
	public void testGivenLabelsAreKept() {
		final AxisLabels labels = AxisLabels.y(true, "Lat", null);
		assertEquals("Lat", labels.label());
		assertEquals("Units still default", "°N", labels.units());
		assertEquals("", AxisLabels.x(true, "", "").text());
		assertTrue(AxisLabels.x(true, "", "").isEmpty());
	}

	@Test
	public void testLabel() {
		assertEquals("Depth [m]", AxisLabels.label("Depth", "m"));
		assertEquals("Depth", AxisLabels.label("Depth", ""));
	}

	@Test
	public void testAnnotations() {
		final FieldSummary summary = FieldStatistics.summarize(Field.of(new double[][] { { 1, 2 }, { 3, 4 } }),
				new double[][] { { 1, 1 }, { 1, 1 } });
		final Annotations annotations = Annotations.of(summary);
		assertEquals("max=4\nmin=1", annotations.extremes());
		assertEquals(Optional.of("mean=2.5\nrms=2.7386"), annotations.moments());
		assertEquals(Optional.of(" sd=1.118\n"), annotations.std());
		assertEquals(" r(A,B)=0.12346\n", Annotations.correlation(0.123456789));
	}

	@Test
	public void testAnnotationsWithoutMoments() {
		final Annotations annotations = Annotations.of(FieldStatistics.summarize(Field.of(new double[][] { { -1.5,
				1e6 } })));
		assertEquals("max=1e+06\nmin=-1.5", annotations.extremes());
		assertFalse(annotations.moments().isPresent());
		assertFalse(annotations.std().isPresent());
	}
}
