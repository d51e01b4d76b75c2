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
 * The address of a single Deep Zoom tile: a level, and a column and row within that level's tile grid.
 * <p>
 * All values are 0-based. An address is only meaningful relative to a particular pyramid, which
 * is responsible for checking that it is valid.
 */
public class TileAddress {

	private final int level;
	private final int column;
	private final int row;

	private TileAddress(final int level, final int column, final int row) {
		this.level = level;
		this.column = column;
		this.row = row;
	}

	/**
	 * Create a tile address.
	 * @param level the Deep Zoom level, where 0 is the coarsest
	 * @param column the tile column within the level
	 * @param row the tile row within the level
	 * @return
	 */
	public static TileAddress createInstance(final int level, final int column, final int row) {
		return new TileAddress(level, column, row);
	}

	/**
	 * Get the Deep Zoom level.
	 * @return
	 */
	public int getLevel() {
		return level;
	}

	/**
	 * Get the tile column.
	 * @return
	 */
	public int getColumn() {
		return column;
	}

	/**
	 * Get the tile row.
	 * @return
	 */
	public int getRow() {
		return row;
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + column;
		result = prime * result + level;
		result = prime * result + row;
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
		TileAddress other = (TileAddress) obj;
		return level == other.level && column == other.column && row == other.row;
	}

	@Override
	public String toString() {
		return "Tile: level=" + level + ", column=" + column + ", row=" + row;
	}

}
