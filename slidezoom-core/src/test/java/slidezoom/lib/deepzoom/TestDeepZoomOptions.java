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

package slidezoom.lib.deepzoom;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

@SuppressWarnings("javadoc")
public class TestDeepZoomOptions {

	@AfterEach
	public void reset() {
		DeepZoomOptions.getInstance().reset();
	}

	@Test
	public void testDefaults() {
		var options = DeepZoomOptions.getInstance();
		assertEquals(256, options.getTileSize());
		assertEquals(1, options.getOverlap());
		assertEquals("ffffff", options.getBackgroundColor());
	}

	@Test
	public void testSetters() {
		var options = DeepZoomOptions.getInstance();
		options.setTileSize(510);
		options.setOverlap(0);
		options.setBackgroundColor("#F0E0D0");
		assertEquals(510, options.getTileSize());
		assertEquals(0, options.getOverlap());
		assertEquals("f0e0d0", options.getBackgroundColor());

		options.reset();
		assertEquals(256, options.getTileSize());
	}

	@Test
	public void testInvalidValues() {
		var options = DeepZoomOptions.getInstance();
		assertThrows(IllegalArgumentException.class, () -> options.setTileSize(0));
		assertThrows(IllegalArgumentException.class, () -> options.setOverlap(-1));
		assertThrows(IllegalArgumentException.class, () -> options.setBackgroundColor("not a color"));
		assertThrows(IllegalArgumentException.class, () -> options.setBackgroundColor(null));
		assertEquals(256, options.getTileSize());
		assertEquals(1, options.getOverlap());
	}

}
