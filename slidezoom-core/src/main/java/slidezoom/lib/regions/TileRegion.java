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

package slidezoom.lib.regions;

/**
 * The pixels that must be read from a source to produce one Deep Zoom tile,
 * together with the size the finished tile must have.
 * <p>
 * Three coordinate spaces meet here:
 * <ul>
 *   <li>the read location is in tier 0 (full resolution) pixels</li>
 *   <li>the read size is in pixels of the tier being read</li>
 *   <li>the final size is in pixels of the Deep Zoom level, including any overlap</li>
 * </ul>
 * The read region covers the tile area (location rounded down, size rounded up),
 * clipped so that it never extends beyond the tier.
 */
public class TileRegion {

	private final TileAddress address;

	private final int readX;
	private final int readY;
	private final int tier;
	private final int readWidth;
	private final int readHeight;

	private final int finalWidth;
	private final int finalHeight;

	TileRegion(final TileAddress address, final int readX, final int readY, final int tier,
			final int readWidth, final int readHeight, final int finalWidth, final int finalHeight) {
		this.address = address;
		this.readX = readX;
		this.readY = readY;
		this.tier = tier;
		this.readWidth = readWidth;
		this.readHeight = readHeight;
		this.finalWidth = finalWidth;
		this.finalHeight = finalHeight;
	}

	/**
	 * Create a tile region.
	 *
	 * @param address the tile this region belongs to
	 * @param readX x-coordinate of the read origin, in tier 0 pixels
	 * @param readY y-coordinate of the read origin, in tier 0 pixels
	 * @param tier the source tier to read from
	 * @param readWidth width to read, in tier pixels
	 * @param readHeight height to read, in tier pixels
	 * @param finalWidth width of the finished tile, in level pixels
	 * @param finalHeight height of the finished tile, in level pixels
	 * @return
	 */
	public static TileRegion createInstance(final TileAddress address, final int readX, final int readY, final int tier,
			final int readWidth, final int readHeight, final int finalWidth, final int finalHeight) {
		if (readWidth < 0 || readHeight < 0)
			throw new IllegalArgumentException("Read size must be >= 0! Requested " + readWidth + "x" + readHeight);
		if (finalWidth <= 0 || finalHeight <= 0)
			throw new IllegalArgumentException("Final size must be > 0! Requested " + finalWidth + "x" + finalHeight);
		return new TileRegion(address, readX, readY, tier, readWidth, readHeight, finalWidth, finalHeight);
	}

	/**
	 * Get the address of the tile this region belongs to.
	 * @return
	 */
	public TileAddress getAddress() {
		return address;
	}

	/**
	 * Get the x-coordinate of the read origin, in tier 0 pixels.
	 * @return
	 */
	public int getReadX() {
		return readX;
	}

	/**
	 * Get the y-coordinate of the read origin, in tier 0 pixels.
	 * @return
	 */
	public int getReadY() {
		return readY;
	}

	/**
	 * Get the index of the source tier to read from.
	 * @return
	 */
	public int getTier() {
		return tier;
	}

	/**
	 * Get the width to read, in pixels of the source tier.
	 * @return
	 */
	public int getReadWidth() {
		return readWidth;
	}

	/**
	 * Get the height to read, in pixels of the source tier.
	 * @return
	 */
	public int getReadHeight() {
		return readHeight;
	}

	/**
	 * Get the width of the finished tile, in pixels of the Deep Zoom level.
	 * @return
	 */
	public int getFinalWidth() {
		return finalWidth;
	}

	/**
	 * Get the height of the finished tile, in pixels of the Deep Zoom level.
	 * @return
	 */
	public int getFinalHeight() {
		return finalHeight;
	}

	/**
	 * Query whether the pixels read need to be resized to give the final tile.
	 * @return
	 */
	public boolean needsResize() {
		return readWidth != finalWidth || readHeight != finalHeight;
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + ((address == null) ? 0 : address.hashCode());
		result = prime * result + finalHeight;
		result = prime * result + finalWidth;
		result = prime * result + readHeight;
		result = prime * result + readWidth;
		result = prime * result + readX;
		result = prime * result + readY;
		result = prime * result + tier;
		return result;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		TileRegion other = (TileRegion) obj;
		if (address == null) {
			if (other.address != null)
				return false;
		} else if (!address.equals(other.address))
			return false;
		return readX == other.readX && readY == other.readY && tier == other.tier &&
				readWidth == other.readWidth && readHeight == other.readHeight &&
				finalWidth == other.finalWidth && finalHeight == other.finalHeight;
	}

	@Override
	public String toString() {
		return String.format("TileRegion: %s, read=(%d, %d, %d, %d), tier=%d, final=(%d, %d)",
				address, readX, readY, readWidth, readHeight, tier, finalWidth, finalHeight);
	}

}
