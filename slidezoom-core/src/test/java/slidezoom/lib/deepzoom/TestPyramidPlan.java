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

import java.util.HashSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import slidezoom.lib.regions.TileAddress;
import slidezoom.lib.regions.TileRegion;

@SuppressWarnings("javadoc")
public class TestPyramidPlan {

	@Test
	public void testAllTileAddresses() {
		var plan = PyramidPlanner.build(1000, 600, 256, 1);
		var addresses = plan.getAllTileAddresses();
		assertEquals(plan.getTotalTileCount(), addresses.size());
		assertEquals(addresses.size(), new HashSet<>(addresses).size());

		assertEquals(TileAddress.createInstance(0, 0, 0), addresses.get(0));
		int last = plan.nLevels() - 1;
		assertEquals(TileAddress.createInstance(last, plan.getTilesX(last)-1, plan.getTilesY(last)-1),
				addresses.get(addresses.size()-1));

		// Row-major within the finest level
		int firstFinest = addresses.indexOf(TileAddress.createInstance(last, 0, 0));
		assertEquals(TileAddress.createInstance(last, 1, 0), addresses.get(firstFinest + 1));

		for (var address : addresses)
			assertTrue(plan.contains(address));
	}

	@Test
	public void testContains() {
		var plan = PyramidPlanner.build(300, 300, 256, 1);
		assertTrue(plan.contains(TileAddress.createInstance(9, 1, 1)));
		assertFalse(plan.contains(TileAddress.createInstance(9, 2, 1)));
		assertFalse(plan.contains(TileAddress.createInstance(10, 0, 0)));
		assertFalse(plan.contains(TileAddress.createInstance(-1, 0, 0)));
		assertFalse(plan.contains(TileAddress.createInstance(0, 0, -1)));
	}

	@Test
	public void testLevelsAreUnmodifiable() {
		var plan = PyramidPlanner.build(300, 300, 256, 1);
		assertThrows(UnsupportedOperationException.class, () -> plan.getLevels().clear());
		assertThrows(UnsupportedOperationException.class, () -> plan.getTiers().clear());
	}

	@Test
	public void testConcurrentMapping() {
		var plan = PyramidPlanner.build(5000, 3000, 254, 1);
		var addresses = plan.getAllTileAddresses();
		var sequential = addresses.stream()
				.collect(Collectors.toMap(a -> a, a -> TileCoordinateMapper.mapTile(plan, a)));
		var parallel = new ConcurrentHashMap<TileAddress, TileRegion>();
		addresses.parallelStream().forEach(a -> parallel.put(a, TileCoordinateMapper.mapTile(plan, a)));
		assertEquals(sequential, parallel);
	}

}
