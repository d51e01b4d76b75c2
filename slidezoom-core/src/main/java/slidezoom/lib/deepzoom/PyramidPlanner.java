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
import java.util.Objects;
import java.util.function.DoubleToIntFunction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import slidezoom.lib.common.GeneralTools;
import slidezoom.lib.geom.ImmutableDimension;
import slidezoom.lib.images.servers.ResolutionTier;
import slidezoom.lib.images.servers.SourceReader;
import slidezoom.lib.images.servers.SourceTools;

/**
 * Derives the level hierarchy of a Deep Zoom pyramid from the full-resolution size of a source.
 * <p>
 * Level dimensions come from repeatedly halving the full-resolution dimensions (rounding up)
 * until a single pixel remains. This matches the rule viewers use to reconstruct the pyramid
 * from the descriptor alone, so it is computed by the recurrence rather than from a logarithm.
 */
public class PyramidPlanner {

	private static final Logger logger = LoggerFactory.getLogger(PyramidPlanner.class);

	// Suppressed default constructor for non-instantiability
	private PyramidPlanner() {
		throw new AssertionError();
	}

	/**
	 * Plan a pyramid for a source with a single (full-resolution) tier.
	 *
	 * @param fullWidth full-resolution width, &geq; 1
	 * @param fullHeight full-resolution height, &geq; 1
	 * @param tileSize tile width and height, excluding overlap, &gt; 0
	 * @param overlap pixels added to interior tile edges, &geq; 0
	 * @return
	 */
	public static PyramidPlan build(int fullWidth, int fullHeight, int tileSize, int overlap) {
		if (fullWidth < 1 || fullHeight < 1)
			throw new IllegalArgumentException("Image dimensions must be >= 1! Requested " + fullWidth + "x" + fullHeight);
		var tiers = new ResolutionTier.Builder(fullWidth, fullHeight)
				.addFullResolutionTier()
				.build();
		return build(tiers, tileSize, overlap);
	}

	/**
	 * Plan a pyramid using the tiers of a source, choosing tiers with the source's own selection logic.
	 *
	 * @param reader the source
	 * @param tileSize tile width and height, excluding overlap, &gt; 0
	 * @param overlap pixels added to interior tile edges, &geq; 0
	 * @return
	 */
	public static PyramidPlan build(SourceReader<?> reader, int tileSize, int overlap) {
		Objects.requireNonNull(reader, "Source reader must not be null");
		logger.debug("Planning pyramid for {}", reader.getPath());
		return build(reader.getTiers(), reader::getBestTierForDownsample, tileSize, overlap);
	}

	/**
	 * Plan a pyramid using a list of resolution tiers.
	 *
	 * @param tiers resolution tiers, finest first
	 * @param tileSize tile width and height, excluding overlap, &gt; 0
	 * @param overlap pixels added to interior tile edges, &geq; 0
	 * @return
	 */
	public static PyramidPlan build(List<ResolutionTier> tiers, int tileSize, int overlap) {
		Objects.requireNonNull(tiers, "Tiers must not be null");
		return build(tiers, d -> SourceTools.getBestTierForDownsample(tiers, d), tileSize, overlap);
	}

	private static PyramidPlan build(List<ResolutionTier> tiers, DoubleToIntFunction tierSelector, int tileSize, int overlap) {
		if (tileSize <= 0)
			throw new IllegalArgumentException("Tile size must be > 0! Requested " + tileSize);
		if (overlap < 0)
			throw new IllegalArgumentException("Overlap must be >= 0! Requested " + overlap);
		if (tiers.isEmpty())
			throw new IllegalArgumentException("At least one resolution tier is required");

		var fullTier = tiers.get(0);
		var dimensions = computeLevelDimensions(fullTier.getWidth(), fullTier.getHeight());
		int nLevels = dimensions.size();

		var levels = new ArrayList<PyramidPlan.PyramidLevel>(nLevels);
		double[] downsamples = computeLevelDownsamples(nLevels);
		for (int level = 0; level < nLevels; level++) {
			var dim = dimensions.get(level);
			var tileGrid = ImmutableDimension.getInstance(
					GeneralTools.ceilDiv(dim.getWidth(), tileSize),
					GeneralTools.ceilDiv(dim.getHeight(), tileSize));
			double downsample = downsamples[level];
			int tier = tierSelector.applyAsInt(downsample);
			if (tier < 0 || tier >= tiers.size())
				throw new IllegalStateException("Tier " + tier + " selected for downsample " + downsample + ", but only " + tiers.size() + " tiers available");
			double levelToTierDownsample = downsample / tiers.get(tier).getDownsample();
			if (!GeneralTools.almostTheSame(levelToTierDownsample, Math.rint(levelToTierDownsample), 1e-6))
				logger.debug("Level {} will be resampled from tier {} by a non-integer factor {}", level, tier, levelToTierDownsample);
			levels.add(new PyramidPlan.PyramidLevel(dim, tileGrid, downsample, tier, levelToTierDownsample));
		}

		var plan = new PyramidPlan(tileSize, overlap, tiers, levels);
		logger.debug("Created {}", plan);
		if (logger.isTraceEnabled()) {
			for (var level : levels)
				logger.trace("  {}", level);
		}
		return plan;
	}

	/**
	 * Compute the dimensions of every level, coarsest first.
	 * Each dimension is halved (rounding up) until both dimensions are 1.
	 *
	 * @param fullWidth
	 * @param fullHeight
	 * @return
	 */
	static List<ImmutableDimension> computeLevelDimensions(int fullWidth, int fullHeight) {
		var dimensions = new ArrayList<ImmutableDimension>();
		int w = fullWidth;
		int h = fullHeight;
		dimensions.add(ImmutableDimension.getInstance(w, h));
		while (w > 1 || h > 1) {
			w = Math.max(1, GeneralTools.ceilDiv(w, 2));
			h = Math.max(1, GeneralTools.ceilDiv(h, 2));
			dimensions.add(ImmutableDimension.getInstance(w, h));
		}
		Collections.reverse(dimensions);
		return dimensions;
	}

	/**
	 * Compute the downsample of every level relative to the full-resolution image, coarsest first.
	 * The finest level has a downsample of 1, and each coarser level doubles it.
	 *
	 * @param nLevels
	 * @return
	 */
	static double[] computeLevelDownsamples(int nLevels) {
		double[] downsamples = new double[nLevels];
		double downsample = 1.0;
		for (int level = nLevels - 1; level >= 0; level--) {
			downsamples[level] = downsample;
			downsample *= 2;
		}
		return downsamples;
	}

}
