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

package slidezoom.lib.geom;

/**
 * An immutable alternative to Java's AWT Dimension.
 * <p>
 * Used for both pixel dimensions and tile grid dimensions, so values may be
 * counts of pixels or counts of tiles depending upon where it was obtained.
 */
public class ImmutableDimension {

	/**
	 * Width of the ImmutableDimension.
	 */
	final public int width;

	/**
	 * Height of the ImmutableDimension.
	 */
	final public int height;

	private ImmutableDimension(final int width, final int height) {
		this.width = width;
		this.height = height;
	}

	/**
	 * Get an ImmutableDimension representing the specified width and height.
	 * @param width
	 * @param height
	 * @return
	 */
	public static ImmutableDimension getInstance(final int width, final int height) {
		return new ImmutableDimension(width, height);
	}

	/**
	 * Get the ImmutableDimension width.
	 * @return
	 */
	public int getWidth() {
		return width;
	}

	/**
	 * Get the ImmutableDimension height.
	 * @return
	 */
	public int getHeight() {
		return height;
	}

	/**
	 * Get the product of the width and height.
	 * @return
	 */
	public long getArea() {
		return (long)width * height;
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
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
		ImmutableDimension other = (ImmutableDimension) obj;
		return width == other.width && height == other.height;
	}

	@Override
	public String toString() {
		return width + "x" + height;
	}

}
