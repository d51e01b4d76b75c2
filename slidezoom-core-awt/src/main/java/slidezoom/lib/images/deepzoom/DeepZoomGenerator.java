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

package slidezoom.lib.images.deepzoom;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import slidezoom.lib.deepzoom.DeepZoomOptions;
import slidezoom.lib.deepzoom.DescriptorEmitter;
import slidezoom.lib.deepzoom.PyramidPlan;
import slidezoom.lib.deepzoom.PyramidPlanner;
import slidezoom.lib.deepzoom.TileCoordinateMapper;
import slidezoom.lib.geom.ImmutableDimension;
import slidezoom.lib.images.servers.SourceReader;
import slidezoom.lib.regions.TileAddress;
import slidezoom.lib.regions.TileRegion;

/**
 * Generates Deep Zoom tiles and descriptors from a multi-resolution source.
 * <p>
 * The pyramid is planned once on construction. Tile requests are independent of one another,
 * and may be made from multiple threads if the underlying reader supports concurrent reads.
 * Nothing is cached.
 */
public class DeepZoomGenerator {

	private static final Logger logger = LoggerFactory.getLogger(DeepZoomGenerator.class);

	private final SourceReader<BufferedImage> reader;
	private final PyramidPlan plan;
	private final Color backgroundColor;

	private DeepZoomGenerator(final SourceReader<BufferedImage> reader, final int tileSize, final int overlap, final Color backgroundColor) {
		this.reader = reader;
		this.plan = PyramidPlanner.build(reader, tileSize, overlap);
		this.backgroundColor = backgroundColor;
	}

	/**
	 * Create a generator with default options.
	 * @param reader the source of pixels
	 * @return
	 */
	public static DeepZoomGenerator create(SourceReader<BufferedImage> reader) {
		return builder(reader).build();
	}

	/**
	 * Create a builder to customize a generator.
	 * @param reader the source of pixels
	 * @return
	 */
	public static Builder builder(SourceReader<BufferedImage> reader) {
		return new Builder(reader);
	}

	/**
	 * Get the pyramid plan.
	 * @return
	 */
	public PyramidPlan getPlan() {
		return plan;
	}

	/**
	 * Get the source reader.
	 * @return
	 */
	public SourceReader<BufferedImage> getReader() {
		return reader;
	}

	/**
	 * Get the color used wherever the source has no pixels.
	 * @return
	 */
	public Color getBackgroundColor() {
		return backgroundColor;
	}

	/**
	 * Get the number of Deep Zoom levels.
	 * @return
	 */
	public int nLevels() {
		return plan.nLevels();
	}

	/**
	 * Get the dimensions of a level, in pixels.
	 * @param level
	 * @return
	 */
	public ImmutableDimension getLevelDimensions(int level) {
		return plan.getLevel(level).getDimensions();
	}

	/**
	 * Get the tile grid of a level, as columns x rows.
	 * @param level
	 * @return
	 */
	public ImmutableDimension getLevelTiles(int level) {
		return plan.getLevel(level).getTileGrid();
	}

	/**
	 * Get the total number of tiles across all levels.
	 * @return
	 */
	public long getTileCount() {
		return plan.getTotalTileCount();
	}

	/**
	 * Get the addresses of every tile in the pyramid.
	 * @return
	 */
	public List<TileAddress> getTileAddresses() {
		return plan.getAllTileAddresses();
	}

	/**
	 * Get the source region that would be read for a tile, without reading it.
	 * @param level
	 * @param column
	 * @param row
	 * @return
	 */
	public TileRegion getTileInfo(int level, int column, int row) {
		return TileCoordinateMapper.mapTile(plan, level, column, row);
	}

	/**
	 * Get a tile.
	 * @param address
	 * @return
	 * @throws IOException if the reader fails
	 * @see #getTile(int, int, int)
	 */
	public BufferedImage getTile(TileAddress address) throws IOException {
		Objects.requireNonNull(address, "Tile address must not be null");
		return getTile(address.getLevel(), address.getColumn(), address.getRow());
	}

	/**
	 * Get an opaque RGB image for a tile.
	 *
	 * @param level the Deep Zoom level
	 * @param column the tile column
	 * @param row the tile row
	 * @return the tile, including overlap on its interior edges
	 * @throws IOException if the reader fails; this is passed on unchanged
	 * @throws slidezoom.lib.deepzoom.InvalidTileException if the tile is not part of the pyramid
	 */
	public BufferedImage getTile(int level, int column, int row) throws IOException {
		var region = getTileInfo(level, column, row);
		if (region.getReadWidth() == 0 || region.getReadHeight() == 0) {
			logger.debug("No pixels to read for {}, returning background", region);
			return TileCompositor.createBackgroundTile(region.getFinalWidth(), region.getFinalHeight(), backgroundColor);
		}
		logger.trace("Reading {}", region);
		var raw = reader.readRegion(
				region.getReadX(), region.getReadY(),
				region.getTier(),
				region.getReadWidth(), region.getReadHeight());
		return TileCompositor.composite(raw, region.getFinalWidth(), region.getFinalHeight(), backgroundColor);
	}

	/**
	 * Get the XML descriptor (.dzi) for the pyramid.
	 * @param format the tile format, e.g. "jpeg" or "png"
	 * @return
	 */
	public String getDzi(String format) {
		return DescriptorEmitter.toXml(plan, format);
	}

	/**
	 * Get the JSON form of the descriptor for the pyramid.
	 * @param format the tile format, e.g. "jpeg" or "png"
	 * @return
	 */
	public String getDziJson(String format) {
		return DescriptorEmitter.toJson(plan, format);
	}

	@Override
	public String toString() {
		return "DeepZoomGenerator: " + reader.getPath() + ", " + plan;
	}


	/**
	 * Builder for a {@link DeepZoomGenerator}.
	 * Anything not set explicitly is taken from {@link DeepZoomOptions}, or from the reader for the background color.
	 */
	public static class Builder {

		private final SourceReader<BufferedImage> reader;
		private int tileSize;
		private int overlap;
		private Color backgroundColor;

		private Builder(SourceReader<BufferedImage> reader) {
			this.reader = Objects.requireNonNull(reader, "Source reader must not be null");
			var options = DeepZoomOptions.getInstance();
			this.tileSize = options.getTileSize();
			this.overlap = options.getOverlap();
		}

		/**
		 * Set the tile size, excluding overlap.
		 * @param tileSize
		 * @return
		 */
		public Builder tileSize(int tileSize) {
			this.tileSize = tileSize;
			return this;
		}

		/**
		 * Set the number of extra pixels added to each interior edge of a tile.
		 * @param overlap
		 * @return
		 */
		public Builder overlap(int overlap) {
			this.overlap = overlap;
			return this;
		}

		/**
		 * Set the background color, overriding any color suggested by the reader.
		 * @param color
		 * @return
		 */
		public Builder backgroundColor(Color color) {
			this.backgroundColor = color;
			return this;
		}

		/**
		 * Set the background color as a hexadecimal RGB string, overriding any color suggested by the reader.
		 * @param color
		 * @return
		 */
		public Builder backgroundColor(String color) {
			this.backgroundColor = TileCompositor.parseBackgroundColor(color);
			return this;
		}

		/**
		 * Build the generator, planning its pyramid.
		 * @return
		 */
		public DeepZoomGenerator build() {
			Color color = backgroundColor;
			if (color == null) {
				String hint = reader.getBackgroundColorHint()
						.orElse(DeepZoomOptions.getInstance().getBackgroundColor());
				color = TileCompositor.parseBackgroundColor(hint);
			}
			var generator = new DeepZoomGenerator(reader, tileSize, overlap, color);
			logger.debug("Created {}", generator);
			return generator;
		}

	}

}
