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


package slidezoom.lib.awt.common;

import java.awt.AlphaComposite;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.awt.image.WritableRaster;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ij.process.FloatProcessor;
import ij.process.ImageProcessor;

/**
 * Static methods for working with BufferedImages.
 */
public final class BufferedImageTools {

	private static final Logger logger = LoggerFactory.getLogger(BufferedImageTools.class);

	// Suppress default constructor for non-instantiability
	private BufferedImageTools() {
		throw new AssertionError();
	}

	/**
	 * Draw an image into a new BufferedImage of the requested type.
	 * <p>
	 * The result never shares pixels with the input, even if the types already match.
	 *
	 * @param img the input image
	 * @param type the BufferedImage type of the copy, e.g. {@link BufferedImage#TYPE_INT_ARGB}
	 * @return a new image with the same size and content
	 */
	public static BufferedImage copyAsType(final BufferedImage img, final int type) {
		BufferedImage copy = new BufferedImage(img.getWidth(), img.getHeight(), type);
		Graphics2D g2d = copy.createGraphics();
		g2d.setComposite(AlphaComposite.Src);
		g2d.drawImage(img, 0, 0, null);
		g2d.dispose();
		return copy;
	}

	/**
	 * Resize an 8-bit packed RGB or ARGB image to exactly the requested size.
	 * <p>
	 * Each band is resized separately with ImageJ, averaging areas when shrinking and
	 * interpolating bilinearly otherwise. The aspect ratio is not preserved.
	 * The input image is returned unchanged if it already has the requested size.
	 *
	 * @param img input image
	 * @param finalWidth target width, &gt; 0
	 * @param finalHeight target height, &gt; 0
	 * @return resized image, with the same color model as the input
	 */
	public static BufferedImage resize(final BufferedImage img, final int finalWidth, final int finalHeight) {
		int w = img.getWidth();
		int h = img.getHeight();
		if (w == finalWidth && h == finalHeight)
			return img;

		logger.trace("Resizing {}x{} -> {}x{}", w, h, finalWidth, finalHeight);

		WritableRaster raster = img.getRaster();
		WritableRaster resized = raster.createCompatibleWritableRaster(finalWidth, finalHeight);
		float[] samples = new float[w * h];
		for (int b = 0; b < raster.getNumBands(); b++) {
			raster.getSamples(0, 0, w, h, b, samples);
			var fp = new FloatProcessor(w, h, samples);
			fp.setInterpolationMethod(ImageProcessor.BILINEAR);
			float[] output = (float[])fp.resize(finalWidth, finalHeight, true).getPixels();
			// Samples are integer, and must stay within 0-255
			for (int i = 0; i < output.length; i++)
				output[i] = Math.min(255, Math.max(0, Math.round(output[i])));
			resized.setSamples(0, 0, finalWidth, finalHeight, b, output);
		}
		return new BufferedImage(img.getColorModel(), resized, img.isAlphaPremultiplied(), null);
	}

}
