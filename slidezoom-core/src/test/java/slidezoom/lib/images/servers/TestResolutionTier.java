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

package slidezoom.lib.images.servers;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

@SuppressWarnings("javadoc")
public class TestResolutionTier {

	@Test
	public void testExplicitTiersKeepDimensions() {
		var tiers = new ResolutionTier.Builder(1001, 503)
				.addFullResolutionTier()
				.addTier(4.0, 251, 126)
				.addTier(4.0, 251, 126)
				.build();
		assertEquals(3, tiers.size());
		assertEquals(251, tiers.get(1).getWidth());
		assertEquals(126, tiers.get(1).getHeight());
		assertEquals(4.0, tiers.get(2).getDownsample());
	}

	@Test
	public void testTiersByDownsample() {
		var tiers = new ResolutionTier.Builder(1001, 503)
				.addFullResolutionTier()
				.addTierByDownsample(4)
				.build();
		assertEquals(1001, tiers.get(0).getWidth());
		assertEquals(503, tiers.get(0).getHeight());
		assertEquals(250, tiers.get(1).getWidth());
		assertEquals(125, tiers.get(1).getHeight());
		assertEquals(4.0, tiers.get(1).getDownsample());
	}

	@Test
	public void testInvalidTiers() {
		assertThrows(IllegalArgumentException.class, () -> new ResolutionTier.Builder(0, 100));
		assertThrows(IllegalStateException.class, () -> new ResolutionTier.Builder(100, 100).build());
		assertThrows(IllegalStateException.class, () -> new ResolutionTier.Builder(100, 100).addTier(2, 50, 50).build());
		assertThrows(IllegalArgumentException.class, () -> new ResolutionTier.Builder(100, 100)
				.addFullResolutionTier()
				.addTierByDownsample(4)
				.addTierByDownsample(2));
		assertThrows(IllegalArgumentException.class, () -> new ResolutionTier.Builder(100, 100).addTier(Double.NaN, 50, 50));
		assertThrows(IllegalArgumentException.class, () -> new ResolutionTier.Builder(100, 100).addTier(2, 0, 50));
	}

	@Test
	public void testEquality() {
		var tiers1 = new ResolutionTier.Builder(100, 100).addFullResolutionTier().addTierByDownsample(2).build();
		var tiers2 = new ResolutionTier.Builder(100, 100).addTier(1, 100, 100).addTier(2, 50, 50).build();
		assertEquals(tiers1, tiers2);
		assertThrows(UnsupportedOperationException.class, () -> tiers1.add(tiers2.get(0)));
	}

}
