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

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Generic interface for a multi-resolution image source, providing pixels from
 * pre-computed resolution tiers.
 * <p>
 * Implementations wrap a particular slide or image library; decoding is entirely their concern.
 *
 * @param <T> the type of pixel buffer returned when reading regions
 */
public interface SourceReader<T> extends AutoCloseable {

	/**
	 * Get a String identifying the source, for use in log and error messages.
	 * @return
	 */
	String getPath();

	/**
	 * Get the resolution tiers of the source, finest (tier 0, full resolution) first.
	 * Downsamples are non-decreasing, and tier 0 always has a downsample of 1.
	 * @return an unmodifiable list of tiers
	 */
	List<ResolutionTier> getTiers();

	/**
	 * Read a region of the source.
	 * <p>
	 * The location is given in tier 0 pixel coordinates, while the size is given in the
	 * pixel coordinates of the requested tier. The returned image has an alpha channel; any pixels
	 * outside the valid area of the source are transparent.
	 *
	 * @param x x-coordinate of the top left of the region, in tier 0 pixels
	 * @param y y-coordinate of the top left of the region, in tier 0 pixels
	 * @param tier the tier to read from
	 * @param width width of the region, in pixels of the requested tier
	 * @param height height of the region, in pixels of the requested tier
	 * @return pixels for the region
	 * @throws IOException if the pixels could not be read
	 */
	T readRegion(int x, int y, int tier, int width, int height) throws IOException;

	/**
	 * Get the background color suggested by the source, as a hexadecimal RGB string.
	 * The leading '#' is optional.
	 * @return the background color, or an empty optional if the source does not specify one
	 */
	default Optional<String> getBackgroundColorHint() {
		return Optional.empty();
	}

	/**
	 * Number of resolution tiers.
	 * @return
	 */
	default int nTiers() {
		return getTiers().size();
	}

	/**
	 * Get a resolution tier by index.
	 * @param tier
	 * @return
	 */
	default ResolutionTier getTier(int tier) {
		return getTiers().get(tier);
	}

	/**
	 * Get the downsample of a tier, relative to tier 0.
	 * @param tier
	 * @return
	 */
	default double getTierDownsample(int tier) {
		return getTier(tier).getDownsample();
	}

	/**
	 * Get the index of the tier best suited for reading pixels at the requested downsample.
	 * @param downsample the downsample relative to tier 0
	 * @return
	 * @see SourceTools#getBestTierForDownsample(List, double)
	 */
	default int getBestTierForDownsample(double downsample) {
		return SourceTools.getBestTierForDownsample(getTiers(), downsample);
	}

	/**
	 * Release any resources held by the reader.
	 * The default implementation does nothing.
	 */
	@Override
	default void close() throws Exception {}

}
