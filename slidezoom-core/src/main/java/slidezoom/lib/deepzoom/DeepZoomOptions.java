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

import slidezoom.lib.images.servers.SourceTools;

/**
 * Helper class to store the default options used when creating Deep Zoom pyramids.
 * <p>
 * Changing these options affects only pyramids created afterwards; existing pyramids
 * never change their tile size or overlap.
 */
public class DeepZoomOptions {

	/**
	 * Tile size used unless another is requested.
	 */
	public static final int DEFAULT_TILE_SIZE = 256;

	/**
	 * Overlap used unless another is requested.
	 */
	public static final int DEFAULT_OVERLAP = 1;

	/**
	 * Background color used when neither the caller nor the source specifies one.
	 */
	public static final String DEFAULT_BACKGROUND_COLOR = "ffffff";

	private static final DeepZoomOptions instance = new DeepZoomOptions();

	private int tileSize = DEFAULT_TILE_SIZE;
	private int overlap = DEFAULT_OVERLAP;
	private String backgroundColor = DEFAULT_BACKGROUND_COLOR;

	private DeepZoomOptions() {}

	/**
	 * Get the main (singleton) instance of the options.
	 * @return
	 */
	public static DeepZoomOptions getInstance() {
		return instance;
	}

	/**
	 * Get the default tile size, excluding overlap.
	 * @return
	 */
	public synchronized int getTileSize() {
		return tileSize;
	}

	/**
	 * Set the default tile size, excluding overlap.
	 * @param tileSize the tile size, must be &gt; 0
	 */
	public synchronized void setTileSize(int tileSize) {
		if (tileSize <= 0)
			throw new IllegalArgumentException("Tile size must be > 0! Requested " + tileSize);
		this.tileSize = tileSize;
	}

	/**
	 * Get the default overlap.
	 * @return
	 */
	public synchronized int getOverlap() {
		return overlap;
	}

	/**
	 * Set the default overlap.
	 * @param overlap the overlap, must be &geq; 0
	 */
	public synchronized void setOverlap(int overlap) {
		if (overlap < 0)
			throw new IllegalArgumentException("Overlap must be >= 0! Requested " + overlap);
		this.overlap = overlap;
	}

	/**
	 * Get the default background color, as a hexadecimal RGB string without a leading '#'.
	 * @return
	 */
	public synchronized String getBackgroundColor() {
		return backgroundColor;
	}

	/**
	 * Set the default background color.
	 * @param backgroundColor hexadecimal RGB string, with or without a leading '#'
	 */
	public synchronized void setBackgroundColor(String backgroundColor) {
		Integer rgb = SourceTools.parseHexRGB(backgroundColor);
		if (rgb == null)
			throw new IllegalArgumentException("Invalid background color: " + backgroundColor);
		this.backgroundColor = String.format("%06x", rgb);
	}

	/**
	 * Restore all options to their default values.
	 */
	public synchronized void reset() {
		tileSize = DEFAULT_TILE_SIZE;
		overlap = DEFAULT_OVERLAP;
		backgroundColor = DEFAULT_BACKGROUND_COLOR;
	}

}
