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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import slidezoom.lib.common.GeneralTools;

/**
 * A resolution tier natively stored by a multi-resolution source.
 * <p>
 * Tier 0 is the full-resolution image; coarser tiers have been downsampled in advance
 * by the source and report their own dimensions and downsample relative to tier 0.
 */
public class ResolutionTier {

	private final double downsample;
	private final int width, height;

	private ResolutionTier(final double downsample, final int width, final int height) {
		this.downsample = downsample;
		this.width = width;
		this.height = height;
	}

	/**
	 * Get the downsample factor for this tier, relative to tier 0.
	 * @return
	 */
	public double getDownsample() {
		return downsample;
	}

	/**
	 * Get the image width at this tier.
	 * @return
	 */
	public int getWidth() {
		return width;
	}

	/**
	 * Get the image height at this tier.
	 * @return
	 */
	public int getHeight() {
		return height;
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		long temp;
		temp = Double.doubleToLongBits(downsample);
		result = prime * result + (int) (temp ^ (temp >>> 32));
		result = prime * result + height;
		result = prime * result + width;
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
		ResolutionTier other = (ResolutionTier) obj;
		if (Double.doubleToLongBits(downsample) != Double.doubleToLongBits(other.downsample))
			return false;
		if (height != other.height)
			return false;
		if (width != other.width)
			return false;
		return true;
	}

	@Override
	public String toString() {
		return "Tier: " + width + "x" + height + " (" + GeneralTools.formatNumber(downsample, 5) + ")";
	}

	/**
	 * Builder to create a list of {@link ResolutionTier} to represent the tiers of a source.
	 * <p>
	 * Tiers should be added from finest to coarsest; the first tier added is expected to be
	 * the full-resolution image.
	 */
	public static class Builder {

		private final int fullWidth, fullHeight;
		private final List<ResolutionTier> tiers = new ArrayList<>();

		/**
		 * Constructor to help build a list of {@link ResolutionTier} objects.
		 *
		 * @param fullWidth full-resolution image width
		 * @param fullHeight full-resolution image height
		 */
		public Builder(int fullWidth, int fullHeight) {
			if (fullWidth < 1 || fullHeight < 1)
				throw new IllegalArgumentException("Full resolution dimensions must be >= 1! Requested " + fullWidth + "x" + fullHeight);
			this.fullWidth = fullWidth;
			this.fullHeight = fullHeight;
		}

		/**
		 * Add the full-resolution image as a tier.
		 * @return
		 */
		public Builder addFullResolutionTier() {
			return addTier(1, fullWidth, fullHeight);
		}

		/**
		 * Add a new tier, calculating dimensions using a downsample factor applied to the full-resolution image.
		 * @param downsample
		 * @return
		 */
		public Builder addTierByDownsample(double downsample) {
			int tierWidth = Math.max(1, (int)(fullWidth / downsample));
			int tierHeight = Math.max(1, (int)(fullHeight / downsample));
			return addTier(downsample, tierWidth, tierHeight);
		}

		/**
		 * Add a new tier by providing a downsample value, width and height.
		 * The dimensions are used as given, since sources may round them differently from the downsample.
		 * @param downsample
		 * @param tierWidth
		 * @param tierHeight
		 * @return
		 */
		public Builder addTier(double downsample, int tierWidth, int tierHeight) {
			if (!(downsample > 0) || Double.isInfinite(downsample))
				throw new IllegalArgumentException("Tier downsample must be a finite value > 0! Requested " + downsample);
			if (tierWidth < 1 || tierHeight < 1)
				throw new IllegalArgumentException("Tier dimensions must be >= 1! Requested " + tierWidth + "x" + tierHeight);
			if (!tiers.isEmpty()) {
				double previous = tiers.get(tiers.size()-1).downsample;
				if (downsample < previous)
					throw new IllegalArgumentException("Tier downsamples must be non-decreasing! Requested " + downsample + " after " + previous);
			}
			tiers.add(new ResolutionTier(downsample, tierWidth, tierHeight));
			return this;
		}

		/**
		 * Build an unmodifiable list of tiers.
		 * @return
		 * @throws IllegalStateException if no tiers have been added, or the first tier does not have a downsample of 1
		 */
		public List<ResolutionTier> build() {
			if (tiers.isEmpty())
				throw new IllegalStateException("At least one resolution tier is required");
			if (tiers.get(0).downsample != 1.0)
				throw new IllegalStateException("The first resolution tier must have a downsample of 1, but was " + tiers.get(0).downsample);
			return Collections.unmodifiableList(new ArrayList<>(tiers));
		}

	}

}
