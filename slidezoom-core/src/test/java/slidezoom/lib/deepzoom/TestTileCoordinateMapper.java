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

import org.junit.jupiter.api.Test;

import slidezoom.lib.images.servers.ResolutionTier;
import slidezoom.lib.regions.TileAddress;
import slidezoom.lib.regions.TileRegion;

@SuppressWarnings("javadoc")
public class TestTileCoordinateMapper {

	@Test
	public void testFirstTileHasOverlapOnlyAfter() {
		var plan = PyramidPlanner.build(300, 300, 256, 1);
		var region = TileCoordinateMapper.mapTile(plan, 9, 0, 0);
		assertRegion(region, 0, 0, 0, 257, 257, 257, 257);
		assertFalse(region.needsResize());
	}

	@Test
	public void testLastTileIsClippedWithOverlapOnlyBefore() {
		var plan = PyramidPlanner.build(300, 300, 256, 1);
		var region = TileCoordinateMapper.mapTile(plan, 9, 1, 1);
		assertRegion(region, 255, 255, 0, 45, 45, 45, 45);
		assertEquals(TileAddress.createInstance(9, 1, 1), region.getAddress());
	}

	@Test
	public void testMixedEdges() {
		var plan = PyramidPlanner.build(300, 300, 256, 1);
		var region = TileCoordinateMapper.mapTile(plan, TileAddress.createInstance(9, 1, 0));
		assertRegion(region, 255, 0, 0, 45, 257, 45, 257);
		region = TileCoordinateMapper.mapTile(plan, TileAddress.createInstance(9, 0, 1));
		assertRegion(region, 0, 255, 0, 257, 45, 257, 45);
	}

	@Test
	public void testInteriorTileHasOverlapOnAllSides() {
		var plan = PyramidPlanner.build(1000, 1000, 256, 1);
		int level = plan.nLevels() - 1;
		assertEquals(4, plan.getTilesX(level));

		var region = TileCoordinateMapper.mapTile(plan, level, 1, 2);
		assertRegion(region, 255, 511, 0, 258, 258, 258, 258);

		// 1000 - 3*256 = 232 remaining pixels, plus overlap on top/left
		region = TileCoordinateMapper.mapTile(plan, level, 3, 3);
		assertRegion(region, 767, 767, 0, 233, 233, 233, 233);
		assertTrue(region.getFinalWidth() < plan.getTileSize() + 2 * plan.getOverlap());
	}

	@Test
	public void testSingleTileLevelIsReadFromFullResolution() {
		var plan = PyramidPlanner.build(300, 300, 256, 1);
		// 150 x 150 level, but only tier 0 is available
		var region = TileCoordinateMapper.mapTile(plan, 8, 0, 0);
		assertRegion(region, 0, 0, 0, 300, 300, 150, 150);
		assertTrue(region.needsResize());

		region = TileCoordinateMapper.mapTile(plan, 0, 0, 0);
		assertRegion(region, 0, 0, 0, 300, 300, 1, 1);
	}

	@Test
	public void testZeroOverlap() {
		var plan = PyramidPlanner.build(600, 300, 256, 0);
		int level = plan.nLevels() - 1;
		var region = TileCoordinateMapper.mapTile(plan, level, 1, 0);
		assertRegion(region, 256, 0, 0, 256, 256, 256, 256);
		region = TileCoordinateMapper.mapTile(plan, level, 2, 1);
		assertRegion(region, 512, 256, 0, 88, 44, 88, 44);
	}

	@Test
	public void testNonIntegralTierDownsample() {
		var tiers = new ResolutionTier.Builder(1000, 1000)
				.addFullResolutionTier()
				.addTierByDownsample(3)
				.build();
		assertEquals(333, tiers.get(1).getWidth());
		var plan = PyramidPlanner.build(tiers, 100, 1);

		// Level 8 is 250 x 250, read from the 3x tier with a level-to-tier downsample of 4/3
		var region = TileCoordinateMapper.mapTile(plan, 8, 0, 0);
		assertRegion(region, 0, 0, 1, 135, 135, 101, 101);

		// Location is truncated in tier 0 pixels
		region = TileCoordinateMapper.mapTile(plan, 8, 1, 1);
		assertRegion(region, 396, 396, 1, 136, 136, 102, 102);

		// The read is clipped at the edge of the tier, one pixel short of ceil(51 * 4/3)
		region = TileCoordinateMapper.mapTile(plan, 8, 2, 2);
		assertRegion(region, 796, 796, 1, 67, 67, 51, 51);
	}

	@Test
	public void testReadClippedAtTierEdge() {
		var tiers = new ResolutionTier.Builder(1000, 1000)
				.addFullResolutionTier()
				.addTierByDownsample(3)
				.build();
		var plan = PyramidPlanner.build(tiers, 100, 1);

		// Level 9 is 500 x 500, read from tier 0 at 2x
		var region = TileCoordinateMapper.mapTile(plan, 9, 1, 0);
		assertRegion(region, 199, 0, 0, 204, 202, 102, 101);
		region = TileCoordinateMapper.mapTile(plan, 9, 4, 4);
		assertRegion(region, 799, 799, 0, 201, 201, 101, 101);
	}

	@Test
	public void testAdjacentTilesShareOverlap() {
		int overlap = 2;
		var plan = PyramidPlanner.build(1000, 700, 254, overlap);
		int level = plan.nLevels() - 1;
		int tilesX = plan.getTilesX(level);
		int tilesY = plan.getTilesY(level);
		int sumCoreWidth = 0;
		for (int x = 0; x < tilesX; x++) {
			var region = TileCoordinateMapper.mapTile(plan, level, x, 0);
			int core = region.getFinalWidth() - (x == 0 ? 0 : overlap) - (x == tilesX-1 ? 0 : overlap);
			sumCoreWidth += core;
			if (x < tilesX - 1) {
				var next = TileCoordinateMapper.mapTile(plan, level, x+1, 0);
				assertEquals(next.getReadX() + 2 * overlap, region.getReadX() + region.getReadWidth());
			} else {
				assertEquals(plan.getFullWidth(), region.getReadX() + region.getReadWidth());
			}
		}
		assertEquals(plan.getFullWidth(), sumCoreWidth);

		for (int y = 0; y < tilesY; y++) {
			var region = TileCoordinateMapper.mapTile(plan, level, 0, y);
			assertTrue(region.getReadY() >= 0);
			assertTrue(region.getReadY() + region.getReadHeight() <= plan.getFullHeight());
		}
	}

	@Test
	public void testAllRegionsWithinTiers() {
		var tiers = new ResolutionTier.Builder(3001, 1999)
				.addFullResolutionTier()
				.addTierByDownsample(4)
				.addTierByDownsample(16)
				.build();
		var plan = PyramidPlanner.build(tiers, 254, 1);
		for (var address : plan.getAllTileAddresses()) {
			var region = TileCoordinateMapper.mapTile(plan, address);
			var tier = tiers.get(region.getTier());
			double tierX = region.getReadX() / tier.getDownsample();
			double tierY = region.getReadY() / tier.getDownsample();
			assertTrue(region.getReadWidth() > 0, () -> "Empty read for " + region);
			assertTrue(region.getReadHeight() > 0, () -> "Empty read for " + region);
			assertTrue(Math.floor(tierX) + region.getReadWidth() <= tier.getWidth(), () -> "Read beyond tier for " + region);
			assertTrue(Math.floor(tierY) + region.getReadHeight() <= tier.getHeight(), () -> "Read beyond tier for " + region);
		}
	}

	@Test
	public void testReadSizeClampedToZeroAtTierEdge() {
		// Level 8 is 251 px wide but is served from a 333 px tier with downsample 3,
		// so the last column starts beyond the tier edge after rounding
		var tiers = new ResolutionTier.Builder(1001, 10)
				.addFullResolutionTier()
				.addTierByDownsample(3)
				.build();
		var plan = PyramidPlanner.build(tiers, 2, 0);
		assertEquals(251, plan.getLevelWidth(8));
		assertEquals(126, plan.getTilesX(8));

		var region = TileCoordinateMapper.mapTile(plan, 8, 125, 0);
		assertRegion(region, 1000, 0, 1, 0, 3, 1, 2);

		// The column before still has pixels to read
		region = TileCoordinateMapper.mapTile(plan, 8, 124, 0);
		assertTrue(region.getReadWidth() > 0);
	}

	@Test
	public void testOverlapLargerThanTile() {
		var plan = PyramidPlanner.build(4, 4, 1, 2);
		assertEquals(3, plan.nLevels());
		// Overlap before exceeds the tile origin, so the region starts left of the image
		var region = TileCoordinateMapper.mapTile(plan, 2, 1, 0);
		assertRegion(region, -1, 0, 0, 5, 3, 5, 3);
		region = TileCoordinateMapper.mapTile(plan, 2, 3, 3);
		assertRegion(region, 1, 1, 0, 3, 3, 3, 3);
	}

	@Test
	public void testInvalidLevel() {
		var plan = PyramidPlanner.build(300, 300, 256, 1);
		var e = assertThrows(InvalidTileException.class, () -> TileCoordinateMapper.mapTile(plan, -1, 0, 0));
		assertEquals(InvalidTileException.Reason.INVALID_LEVEL, e.getReason());
		e = assertThrows(InvalidTileException.class, () -> TileCoordinateMapper.mapTile(plan, plan.nLevels(), 0, 0));
		assertEquals(InvalidTileException.Reason.INVALID_LEVEL, e.getReason());
	}

	@Test
	public void testInvalidAddress() {
		var plan = PyramidPlanner.build(300, 300, 256, 1);
		var e = assertThrows(InvalidTileException.class, () -> TileCoordinateMapper.mapTile(plan, 9, 2, 0));
		assertEquals(InvalidTileException.Reason.INVALID_ADDRESS, e.getReason());
		assertEquals(2, e.getColumn());
		assertEquals(0, e.getRow());

		e = assertThrows(InvalidTileException.class, () -> TileCoordinateMapper.mapTile(plan, 9, 0, 2));
		assertEquals(InvalidTileException.Reason.INVALID_ADDRESS, e.getReason());
		e = assertThrows(InvalidTileException.class, () -> TileCoordinateMapper.mapTile(plan, 9, -1, 0));
		assertEquals(InvalidTileException.Reason.INVALID_ADDRESS, e.getReason());
		e = assertThrows(InvalidTileException.class, () -> TileCoordinateMapper.mapTile(plan, 0, 1, 0));
		assertEquals(InvalidTileException.Reason.INVALID_ADDRESS, e.getReason());

		// Still an IllegalArgumentException for callers that don't care about the reason
		assertThrows(IllegalArgumentException.class, () -> TileCoordinateMapper.mapTile(plan, 0, 0, 1));
	}

	private static void assertRegion(TileRegion region, int readX, int readY, int tier, int readWidth, int readHeight, int finalWidth, int finalHeight) {
		assertEquals(readX, region.getReadX(), "readX");
		assertEquals(readY, region.getReadY(), "readY");
		assertEquals(tier, region.getTier(), "tier");
		assertEquals(readWidth, region.getReadWidth(), "readWidth");
		assertEquals(readHeight, region.getReadHeight(), "readHeight");
		assertEquals(finalWidth, region.getFinalWidth(), "finalWidth");
		assertEquals(finalHeight, region.getFinalHeight(), "finalHeight");
	}

}
