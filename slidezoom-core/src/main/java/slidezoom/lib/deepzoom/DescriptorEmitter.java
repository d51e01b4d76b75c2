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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;

import slidezoom.lib.common.GeneralTools;

/**
 * Create the Deep Zoom descriptor (.dzi) for a pyramid.
 * <p>
 * The descriptor depends only upon the tile size, overlap, tile format and full-resolution size,
 * which is all a viewer needs to reconstruct the rest of the pyramid.
 */
public class DescriptorEmitter {

	private static final Logger logger = LoggerFactory.getLogger(DescriptorEmitter.class);

	/**
	 * Namespace identifying a Deep Zoom image descriptor.
	 */
	public static final String NAMESPACE = "http://schemas.microsoft.com/deepzoom/2008";

	private static final String NAMESPACE_ATTRIBUTE = "xmlns";

	// Suppressed default constructor for non-instantiability
	private DescriptorEmitter() {
		throw new AssertionError();
	}

	/**
	 * Create the XML descriptor for a pyramid.
	 *
	 * @param plan the pyramid
	 * @param format the format of the tile images, e.g. "jpeg" or "png"
	 * @return UTF-8 XML text
	 * @throws IllegalArgumentException if the format is blank
	 */
	public static String toXml(PyramidPlan plan, String format) {
		checkArgs(plan, format);
		try {
			Document document = DocumentBuilderFactory.newInstance().newDocumentBuilder().newDocument();
			document.setXmlStandalone(true);

			Element image = document.createElement("Image");
			image.setAttribute(NAMESPACE_ATTRIBUTE, NAMESPACE);
			image.setAttribute("TileSize", Integer.toString(plan.getTileSize()));
			image.setAttribute("Overlap", Integer.toString(plan.getOverlap()));
			image.setAttribute("Format", format);

			Element size = document.createElement("Size");
			size.setAttribute("Width", Integer.toString(plan.getFullWidth()));
			size.setAttribute("Height", Integer.toString(plan.getFullHeight()));
			image.appendChild(size);
			document.appendChild(image);

			var transformer = TransformerFactory.newInstance().newTransformer();
			transformer.setOutputProperty(OutputKeys.ENCODING, StandardCharsets.UTF_8.name());
			try (ByteArrayOutputStream os = new ByteArrayOutputStream()) {
				transformer.transform(
						new DOMSource(document),
						new StreamResult(new OutputStreamWriter(os, StandardCharsets.UTF_8))
						);
				return os.toString(StandardCharsets.UTF_8);
			}
		} catch (ParserConfigurationException | TransformerException | IOException e) {
			logger.error("Unable to create Deep Zoom descriptor: {}", e.getLocalizedMessage());
			throw new IllegalStateException("Unable to create Deep Zoom descriptor", e);
		}
	}

	/**
	 * Create the JSON form of the descriptor for a pyramid, as accepted by OpenSeadragon.
	 * <p>
	 * Values are written as strings, as they are in the XML attributes.
	 *
	 * @param plan the pyramid
	 * @param format the format of the tile images, e.g. "jpeg" or "png"
	 * @return JSON text
	 * @throws IllegalArgumentException if the format is blank
	 */
	public static String toJson(PyramidPlan plan, String format) {
		checkArgs(plan, format);
		var size = new JsonObject();
		size.addProperty("Width", Integer.toString(plan.getFullWidth()));
		size.addProperty("Height", Integer.toString(plan.getFullHeight()));

		var image = new JsonObject();
		image.addProperty(NAMESPACE_ATTRIBUTE, NAMESPACE);
		image.addProperty("Format", format);
		image.addProperty("Overlap", Integer.toString(plan.getOverlap()));
		image.addProperty("TileSize", Integer.toString(plan.getTileSize()));
		image.add("Size", size);

		var root = new JsonObject();
		root.add("Image", image);
		return new GsonBuilder().setPrettyPrinting().create().toJson(root);
	}

	private static void checkArgs(PyramidPlan plan, String format) {
		Objects.requireNonNull(plan, "Pyramid plan must not be null");
		if (GeneralTools.blankString(format, true))
			throw new IllegalArgumentException("Tile format must not be blank");
	}

}
