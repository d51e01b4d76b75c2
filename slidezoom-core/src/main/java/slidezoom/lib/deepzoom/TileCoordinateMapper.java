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

import java.util.Objects;

import slidezoom.lib.regions.TileAddress;
import slidezoom.lib.regions.TileRegion;

/**
 * Maps Deep Zoom tile addresses onto the source pixels needed to produce them.
 * <p>
 * Four coordinate spaces are involved:
 * <ul>
 *   <li>tile: column and row within a level's tile grid</li>
 *   <li>level: pixels within a Deep Zoom level</li>
 *   <li>tier: pixels within the source tier chosen for the level</li>
 *   <li>tier 0: pixels within the full-resolution source tier</li>
 * </ul>
 * The read location is rounded down and the read size rounded up, then clipped to the tier bounds.
 * The order of operations determines the rounding, and must not be changed: tiles are
 * expected to match those of other Deep Zoom generators pixel for pixel.
 */
public class TileCoordinateMapper {

	// Suppressed default constructor for non-instantiability
	private TileCoordinateMapper() {
		throw new AssertionError();
	}

	/**
	 * Compute the region that must be read to generate a tile.
	 *
	 * @param plan the pyramid
	 * @param address the tile
	 * @return
	 * @throws InvalidTileException if the tile is not part of the pyramid
	 */
	public static TileRegion mapTile(PyramidPlan plan, TileAddress address) {
		Objects.requireNonNull(address, "Tile address must not be null");
		return mapTile(plan, address.getLevel(), address.getColumn(), address.getRow());
	}

	/**
	 * Compute the region that must be read to generate a tile.
	 *
	 * @param plan the pyramid
	 * @param level the Deep Zoom level
	 * @param column the tile column
	 * @param row the tile row
	 * @return
	 * @throws InvalidTileException if the tile is not part of the pyramid
	 */
	public static TileRegion mapTile(PyramidPlan plan, int level, int column, int row) {
		Objects.requireNonNull(plan, "Pyramid plan must not be null");
		var pyramidLevel = plan.getLevel(level);
		int tilesX = pyramidLevel.getTilesX();
		int tilesY = pyramidLevel.getTilesY();
		if (column < 0 || column >= tilesX || row < 0 || row >= tilesY)
			throw InvalidTileException.invalidAddress(level, column, row, tilesX, tilesY);

		int tier = pyramidLevel.getPreferredTier();
		var resolutionTier = plan.getTiers().get(tier);
		double levelToTier = pyramidLevel.getLevelToTierDownsample();
		double tierDownsample = resolutionTier.getDownsample();

		var x = mapAxis(column, tilesX, pyramidLevel.getWidth(), resolutionTier.getWidth(),
				plan.getTileSize(), plan.getOverlap(), levelToTier, tierDownsample);
		var y = mapAxis(row, tilesY, pyramidLevel.getHeight(), resolutionTier.getHeight(),
				plan.getTileSize(), plan.getOverlap(), levelToTier, tierDownsample);

		return TileRegion.createInstance(
				TileAddress.createInstance(level, column, row),
				x.tier0Location, y.tier0Location,
				tier,
				x.readSize, y.readSize,
				x.finalSize, y.finalSize);
	}

	/**
	 * Map a single axis; x and y are handled identically.
	 */
	static AxisMapping mapAxis(int t, int nTiles, int levelDimension, int tierDimension,
			int tileSize, int overlap, double levelToTier, double tierDownsample) {
		// Overlap only on interior edges
		int overlapBefore = t != 0 ? overlap : 0;
		int overlapAfter = t != nTiles - 1 ? overlap : 0;

		// Final tile size in level pixels, with the core clipped at the level edge
		int finalSize = Math.min(tileSize, levelDimension - tileSize * t) + overlapBefore + overlapAfter;

		// Tile origin in level pixels, converted to tier pixels then shifted to include the overlap
		int levelLocation = tileSize * t;
		double tierLocation = levelToTier * levelLocation - overlapBefore;

		// Round location down (in tier 0 pixels) and size up (in tier pixels), then clip
		int tier0Location = (int)(tierDownsample * tierLocation);
		int readSize = (int)Math.min(Math.ceil(levelToTier * finalSize), tierDimension - Math.ceil(tierLocation));

		return new AxisMapping(tier0Location, Math.max(0, readSize), finalSize);
	}

	static class AxisMapping {

		final int tier0Location;
		final int readSize;
		final int finalSize;

		AxisMapping(int tier0Location, int readSize, int finalSize) {
			this.tier0Location = tier0Location;
			this.readSize = readSize;
			this.finalSize = finalSize;
		}

	}

}
