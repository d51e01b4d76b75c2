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

import java.util.List;

import slidezoom.lib.common.GeneralTools;

/**
 * Static methods helpful when working with a {@link SourceReader}.
 */
public class SourceTools {

	// Suppressed default constructor for non-instantiability
	private SourceTools() {
		throw new AssertionError();
	}

	/**
	 * Get the index of the tier that is best suited to provide pixels at the requested downsample.
	 * <p>
	 * This is the tier with the largest downsample that does not exceed the requested downsample,
	 * so that pixels never need to be upsampled. If every tier is coarser than the request, tier 0 is returned.
	 *
	 * @param tiers resolution tiers, finest first
	 * @param requestedDownsample the downsample relative to tier 0, must be &gt; 0
	 * @return the tier index
	 * @throws IllegalArgumentException if the downsample is NaN or &leq; 0, or there are no tiers
	 */
	public static int getBestTierForDownsample(List<ResolutionTier> tiers, double requestedDownsample) {
		if (Double.isNaN(requestedDownsample) || requestedDownsample <= 0)
			throw new IllegalArgumentException("Downsample must be > 0! Requested " + requestedDownsample);
		if (tiers.isEmpty())
			throw new IllegalArgumentException("No resolution tiers available");
		int bestTier = 0;
		double bestDownsampleDiff = Double.POSITIVE_INFINITY;
		for (int i = 0; i < tiers.size(); i++) {
			double downsampleDiff = requestedDownsample - tiers.get(i).getDownsample();
			if (downsampleDiff >= 0 && downsampleDiff < bestDownsampleDiff) {
				bestTier = i;
				bestDownsampleDiff = downsampleDiff;
			}
		}
		return bestTier;
	}

	/**
	 * Parse a hexadecimal color string, with or without a leading '#', into a packed RGB value.
	 * <p>
	 * This accepts the same 6-digit values as {@code java.awt.Color.decode("#" + hex)}, but returns null
	 * rather than throwing, and avoids a dependency on AWT in the core module.
	 *
	 * @param hex the color, e.g. "ffffff" or "#F0E0D0"
	 * @return the packed RGB value, or null if the input is blank or cannot be parsed
	 */
	public static Integer parseHexRGB(String hex) {
		if (GeneralTools.blankString(hex, true))
			return null;
		String value = hex.trim();
		if (value.startsWith("#"))
			value = value.substring(1);
		if (value.length() != 6)
			return null;
		try {
			return Integer.parseInt(value, 16);
		} catch (NumberFormatException e) {
			return null;
		}
	}

}
