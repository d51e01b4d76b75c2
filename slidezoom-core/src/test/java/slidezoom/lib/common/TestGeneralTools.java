/*-
 * #%L
 * This file is part of SlideZoom.
 * %%
 * Copyright (C) 2026 SlideZoom developers
 * %%
 * SlideZoom is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * SlideZoom is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with SlideZoom.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package slidezoom.lib.common;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Locale;

import org.junit.jupiter.api.Test;

@SuppressWarnings("javadoc")
public class TestGeneralTools {

	@Test
	public void testCeilDiv() {
		assertEquals(0, GeneralTools.ceilDiv(0, 256));
		assertEquals(1, GeneralTools.ceilDiv(1, 256));
		assertEquals(1, GeneralTools.ceilDiv(256, 256));
		assertEquals(2, GeneralTools.ceilDiv(257, 256));
		assertEquals(38, GeneralTools.ceilDiv(75, 2));
		assertEquals(1073741824, GeneralTools.ceilDiv(Integer.MAX_VALUE, 2));
		for (int n = 0; n < 1000; n++) {
			for (int d = 1; d < 20; d++)
				assertEquals((int)Math.ceil(n / (double)d), GeneralTools.ceilDiv(n, d));
		}
		assertThrows(IllegalArgumentException.class, () -> GeneralTools.ceilDiv(1, 0));
		assertThrows(IllegalArgumentException.class, () -> GeneralTools.ceilDiv(-1, 2));
	}

	@Test
	public void testAlmostTheSame() {
		assertTrue(GeneralTools.almostTheSame(4.0, 4.0001, 0.001));
		assertFalse(GeneralTools.almostTheSame(4.0, 4.1, 0.001));
		assertTrue(GeneralTools.almostTheSame(-1.0, -1.0, 0.0));
	}

	@Test
	public void testBlankString() {
		assertTrue(GeneralTools.blankString(null, false));
		assertTrue(GeneralTools.blankString("", false));
		assertFalse(GeneralTools.blankString("  ", false));
		assertTrue(GeneralTools.blankString("  ", true));
		assertFalse(GeneralTools.blankString(" a ", true));
	}

	@Test
	public void testFormatNumber() {
		assertEquals("1.333", GeneralTools.formatNumber(Locale.US, 4.0/3.0, 3));
		assertEquals("2", GeneralTools.formatNumber(Locale.US, 2.0, 5));
		assertEquals("12345.5", GeneralTools.formatNumber(Locale.US, 12345.5, 2));
	}

}
