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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import slidezoom.lib.common.GeneralTools;
import slidezoom.lib.geom.ImmutableDimension;
import slidezoom.lib.images.servers.ResolutionTier;
import slidezoom.lib.regions.TileAddress;

/**
 * The complete level hierarchy of a Deep Zoom pyramid.
 * <p>
 * Level 0 is the coarsest (1x1 pixels) and level {@code nLevels()-1} is the full-resolution image.
 * Each level records its dimensions, its tile grid, and which source tier should be used to render it.
 * <p>
 * A plan is immutable, and may be shared freely between threads.
 *
 * @see PyramidPlanner
 */
public class PyramidPlan {

	private final int tileSize;
	private final int overlap;
	private final List<ResolutionTier> tiers;
	private final List<PyramidLevel> levels;
	private final long totalTileCount;

	PyramidPlan(final int tileSize, final int overlap, final List<ResolutionTier> tiers, final List<PyramidLevel> levels) {
		this.tileSize = tileSize;
		this.overlap = overlap;
		this.tiers = Collections.unmodifiableList(new ArrayList<>(tiers));
		this.levels = Collections.unmodifiableList(new ArrayList<>(levels));
		long count = 0;
		for (var level : levels)
			count += level.getTileGrid().getArea();
		this.totalTileCount = count;
	}

	/**
	 * Get the width and height of each tile, excluding any overlap.
	 * @return
	 */
	public int getTileSize() {
		return tileSize;
	}

	/**
	 * Get the number of extra pixels added to each interior edge of a tile.
	 * @return
	 */
	public int getOverlap() {
		return overlap;
	}

	/**
	 * Get the width of the full-resolution image (the finest level).
	 * @return
	 */
	public int getFullWidth() {
		return levels.get(levels.size()-1).getWidth();
	}

	/**
	 * Get the height of the full-resolution image (the finest level).
	 * @return
	 */
	public int getFullHeight() {
		return levels.get(levels.size()-1).getHeight();
	}

	/**
	 * Get the source tiers used when planning the pyramid.
	 * @return
	 */
	public List<ResolutionTier> getTiers() {
		return tiers;
	}

	/**
	 * Get the number of Deep Zoom levels.
	 * @return
	 */
	public int nLevels() {
		return levels.size();
	}

	/**
	 * Get all levels, coarsest first.
	 * @return
	 */
	public List<PyramidLevel> getLevels() {
		return levels;
	}

	/**
	 * Get a single level.
	 * @param level
	 * @return
	 * @throws InvalidTileException if the level is outside the pyramid
	 */
	public PyramidLevel getLevel(int level) {
		checkLevel(level);
		return levels.get(level);
	}

	/**
	 * Get the width of a level, in pixels.
	 * @param level
	 * @return
	 */
	public int getLevelWidth(int level) {
		return getLevel(level).getWidth();
	}

	/**
	 * Get the height of a level, in pixels.
	 * @param level
	 * @return
	 */
	public int getLevelHeight(int level) {
		return getLevel(level).getHeight();
	}

	/**
	 * Get the number of tile columns in a level.
	 * @param level
	 * @return
	 */
	public int getTilesX(int level) {
		return getLevel(level).getTilesX();
	}

	/**
	 * Get the number of tile rows in a level.
	 * @param level
	 * @return
	 */
	public int getTilesY(int level) {
		return getLevel(level).getTilesY();
	}

	/**
	 * Get the total number of tiles across all levels.
	 * @return
	 */
	public long getTotalTileCount() {
		return totalTileCount;
	}

	/**
	 * Query whether a tile address exists in this pyramid.
	 * @param address
	 * @return
	 */
	public boolean contains(TileAddress address) {
		int level = address.getLevel();
		if (level < 0 || level >= levels.size())
			return false;
		var pyramidLevel = levels.get(level);
		return address.getColumn() >= 0 && address.getColumn() < pyramidLevel.getTilesX() &&
				address.getRow() >= 0 && address.getRow() < pyramidLevel.getTilesY();
	}

	/**
	 * Get the addresses of all tiles in the pyramid, coarsest level first and in row-major order within a level.
	 * @return
	 */
	public List<TileAddress> getAllTileAddresses() {
		if (totalTileCount > Integer.MAX_VALUE)
			throw new UnsupportedOperationException("Too many tiles to list: " + totalTileCount);
		var list = new ArrayList<TileAddress>((int)totalTileCount);
		for (int level = 0; level < levels.size(); level++) {
			var pyramidLevel = levels.get(level);
			for (int row = 0; row < pyramidLevel.getTilesY(); row++) {
				for (int col = 0; col < pyramidLevel.getTilesX(); col++) {
					list.add(TileAddress.createInstance(level, col, row));
				}
			}
		}
		return list;
	}

	void checkLevel(int level) {
		if (level < 0 || level >= levels.size())
			throw InvalidTileException.invalidLevel(level, levels.size());
	}

	@Override
	public String toString() {
		return String.format("PyramidPlan: %d x %d, tileSize=%d, overlap=%d, levels=%d, tiles=%d",
				getFullWidth(), getFullHeight(), tileSize, overlap, levels.size(), totalTileCount);
	}


	/**
	 * A single level of a Deep Zoom pyramid.
	 */
	public static class PyramidLevel {

		private final ImmutableDimension dimensions;
		private final ImmutableDimension tileGrid;
		private final double downsample;
		private final int preferredTier;
		private final double levelToTierDownsample;

		PyramidLevel(final ImmutableDimension dimensions, final ImmutableDimension tileGrid,
				final double downsample, final int preferredTier, final double levelToTierDownsample) {
			this.dimensions = dimensions;
			this.tileGrid = tileGrid;
			this.downsample = downsample;
			this.preferredTier = preferredTier;
			this.levelToTierDownsample = levelToTierDownsample;
		}

		/**
		 * Get the level width, in pixels.
		 * @return
		 */
		public int getWidth() {
			return dimensions.getWidth();
		}

		/**
		 * Get the level height, in pixels.
		 * @return
		 */
		public int getHeight() {
			return dimensions.getHeight();
		}

		/**
		 * Get the level dimensions, in pixels.
		 * @return
		 */
		public ImmutableDimension getDimensions() {
			return dimensions;
		}

		/**
		 * Get the number of tile columns.
		 * @return
		 */
		public int getTilesX() {
			return tileGrid.getWidth();
		}

		/**
		 * Get the number of tile rows.
		 * @return
		 */
		public int getTilesY() {
			return tileGrid.getHeight();
		}

		/**
		 * Get the tile grid dimensions, as columns x rows.
		 * @return
		 */
		public ImmutableDimension getTileGrid() {
			return tileGrid;
		}

		/**
		 * Get the downsample of this level relative to the full-resolution image.
		 * This is always a power of 2.
		 * @return
		 */
		public double getDownsample() {
			return downsample;
		}

		/**
		 * Get the index of the source tier used to render this level.
		 * @return
		 */
		public int getPreferredTier() {
			return preferredTier;
		}

		/**
		 * Get the factor converting distances in level pixels into distances in pixels of the preferred tier.
		 * This is not necessarily an integer.
		 * @return
		 */
		public double getLevelToTierDownsample() {
			return levelToTierDownsample;
		}

		@Override
		public String toString() {
			return "Level: " + dimensions + ", tiles=" + tileGrid + ", tier=" + preferredTier +
					" (" + GeneralTools.formatNumber(levelToTierDownsample, 5) + ")";
		}

	}

}
