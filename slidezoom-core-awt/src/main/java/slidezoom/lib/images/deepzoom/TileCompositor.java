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

import java.awt.AlphaComposite;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import slidezoom.lib.awt.common.BufferedImageTools;
import slidezoom.lib.common.GeneralTools;
import slidezoom.lib.images.servers.SourceTools;

/**
 * Turns the raw pixels read from a source into a finished Deep Zoom tile.
 * <p>
 * Sources use transparency to mark pixels outside their valid area; these are replaced by a
 * solid background color, and the result is resized to the exact size the tile must have.
 */
public class TileCompositor {

	private static final Logger logger = LoggerFactory.getLogger(TileCompositor.class);

	// Suppressed default constructor for non-instantiability
	private TileCompositor() {
		throw new AssertionError();
	}

	/**
	 * Flatten a region onto a background color, and resize it if needed.
	 *
	 * @param raw the pixels read from the source, which may contain transparency
	 * @param finalWidth the width of the tile to return
	 * @param finalHeight the height of the tile to return
	 * @param background the color to show wherever the raw region is transparent
	 * @return an opaque RGB image with the requested size
	 */
	public static BufferedImage composite(BufferedImage raw, int finalWidth, int finalHeight, Color background) {
		Objects.requireNonNull(raw, "Raw region must not be null");
		Objects.requireNonNull(background, "Background color must not be null");
		if (finalWidth <= 0 || finalHeight <= 0)
			throw new IllegalArgumentException("Tile size must be > 0! Requested " + finalWidth + "x" + finalHeight);

		int width = raw.getWidth();
		int height = raw.getHeight();
		BufferedImage img = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
		Graphics2D g2d = img.createGraphics();
		g2d.setColor(background);
		g2d.fillRect(0, 0, width, height);
		g2d.setComposite(AlphaComposite.SrcOver);
		g2d.drawImage(raw, 0, 0, null);
		g2d.dispose();

		return BufferedImageTools.resize(img, finalWidth, finalHeight);
	}

	/**
	 * Create a tile containing only the background color.
	 * This is used whenever there are no source pixels to read.
	 *
	 * @param finalWidth
	 * @param finalHeight
	 * @param background
	 * @return
	 */
	public static BufferedImage createBackgroundTile(int finalWidth, int finalHeight, Color background) {
		BufferedImage img = new BufferedImage(finalWidth, finalHeight, BufferedImage.TYPE_INT_RGB);
		Graphics2D g2d = img.createGraphics();
		g2d.setColor(background);
		g2d.fillRect(0, 0, finalWidth, finalHeight);
		g2d.dispose();
		return img;
	}

	/**
	 * Parse a background color suggested by a source.
	 * <p>
	 * The leading '#' is optional. Blank or unparseable values result in white.
	 *
	 * @param hint the hexadecimal RGB color, may be null
	 * @return
	 */
	public static Color parseBackgroundColor(String hint) {
		if (GeneralTools.blankString(hint, true))
			return Color.WHITE;
		Integer rgb = SourceTools.parseHexRGB(hint);
		if (rgb == null) {
			logger.warn("Unable to parse background color '{}', will use white", hint);
			return Color.WHITE;
		}
		return new Color(rgb);
	}

}
