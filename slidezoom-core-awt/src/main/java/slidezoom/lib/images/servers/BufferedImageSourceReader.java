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

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import slidezoom.lib.awt.common.BufferedImageTools;

/**
 * Implementation of a {@link SourceReader} that wraps an existing {@link BufferedImage}.
 * <p>
 * Coarser tiers are generated up front by downsampling the image, so that the reader behaves
 * like a pyramidal slide. Pixels requested outside the image are transparent.
 */
public class BufferedImageSourceReader implements SourceReader<BufferedImage> {

	private static final Logger logger = LoggerFactory.getLogger(BufferedImageSourceReader.class);

	private final String name;
	private final List<ResolutionTier> tiers;
	private final List<BufferedImage> tierImages;
	private final String backgroundColor;

	/**
	 * Create a reader for an image, with optional additional tiers.
	 *
	 * @param name a name used to identify the image (may be null)
	 * @param img the image to wrap; this is copied, so later changes are not seen by the reader
	 * @param downsamples downsamples of additional tiers to generate, in increasing order and each &gt; 1
	 */
	public BufferedImageSourceReader(final String name, final BufferedImage img, final double... downsamples) {
		this(name, img, null, downsamples);
	}

	/**
	 * Create a reader for an image, with a background color hint and optional additional tiers.
	 *
	 * @param name a name used to identify the image (may be null)
	 * @param img the image to wrap; this is copied, so later changes are not seen by the reader
	 * @param backgroundColor hexadecimal RGB background color hint (may be null)
	 * @param downsamples downsamples of additional tiers to generate, in increasing order and each &gt; 1
	 */
	public BufferedImageSourceReader(final String name, final BufferedImage img, final String backgroundColor, final double... downsamples) {
		Objects.requireNonNull(img, "Image must not be null");
		this.name = name == null ? "BufferedImage" : name;
		this.backgroundColor = backgroundColor;

		var tier0 = BufferedImageTools.copyAsType(img, BufferedImage.TYPE_INT_ARGB);

		var builder = new ResolutionTier.Builder(tier0.getWidth(), tier0.getHeight())
				.addFullResolutionTier();
		var images = new ArrayList<BufferedImage>();
		images.add(tier0);
		for (double downsample : downsamples) {
			if (!(downsample > 1))
				throw new IllegalArgumentException("Additional tiers need downsamples > 1! Requested " + downsample);
			builder.addTierByDownsample(downsample);
		}
		this.tiers = builder.build();
		for (int i = 1; i < tiers.size(); i++) {
			var tier = tiers.get(i);
			logger.debug("Generating {} for {}", tier, this.name);
			images.add(BufferedImageTools.resize(tier0, tier.getWidth(), tier.getHeight()));
		}
		this.tierImages = Collections.unmodifiableList(images);
	}

	@Override
	public String getPath() {
		return name;
	}

	@Override
	public List<ResolutionTier> getTiers() {
		return tiers;
	}

	@Override
	public Optional<String> getBackgroundColorHint() {
		return Optional.ofNullable(backgroundColor);
	}

	@Override
	public BufferedImage readRegion(int x, int y, int tier, int width, int height) throws IOException {
		if (tier < 0 || tier >= tiers.size())
			throw new IOException("Tier " + tier + " requested from " + name + ", but only " + tiers.size() + " tiers available");
		if (width <= 0 || height <= 0)
			throw new IOException("Region size must be > 0! Requested " + width + "x" + height);

		var tierImage = tierImages.get(tier);
		double downsample = tiers.get(tier).getDownsample();
		int tx = (int)Math.floor(x / downsample);
		int ty = (int)Math.floor(y / downsample);

		var img = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
		int x0 = Math.max(0, tx);
		int y0 = Math.max(0, ty);
		int x1 = Math.min(tierImage.getWidth(), tx + width);
		int y1 = Math.min(tierImage.getHeight(), ty + height);
		if (x1 > x0 && y1 > y0) {
			int w = x1 - x0;
			int h = y1 - y0;
			int[] rgb = tierImage.getRGB(x0, y0, w, h, null, 0, w);
			img.setRGB(x0 - tx, y0 - ty, w, h, rgb, 0, w);
		}
		return img;
	}

	@Override
	public String toString() {
		return "BufferedImageSourceReader: " + name + " " + tiers;
	}

}
