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

/**
 * Exception thrown when a tile is requested that does not exist in a pyramid.
 * <p>
 * This is always raised before any pixels are read.
 */
public class InvalidTileException extends IllegalArgumentException {

	private static final long serialVersionUID = 1L;

	/**
	 * The reason a tile request was rejected.
	 */
	public enum Reason {
		/**
		 * The level is outside the range of levels in the pyramid.
		 */
		INVALID_LEVEL("Invalid level"),
		/**
		 * The column or row is outside the tile grid of the requested level.
		 */
		INVALID_ADDRESS("Invalid address");

		private final String description;

		Reason(String description) {
			this.description = description;
		}

		@Override
		public String toString() {
			return description;
		}
	}

	private final Reason reason;
	private final int level;
	private final int column;
	private final int row;

	InvalidTileException(Reason reason, int level, int column, int row, String message) {
		super(reason + ": " + message);
		this.reason = reason;
		this.level = level;
		this.column = column;
		this.row = row;
	}

	static InvalidTileException invalidLevel(int level, int nLevels) {
		return new InvalidTileException(Reason.INVALID_LEVEL, level, -1, -1,
				String.format("level %d requested, but the pyramid has %d levels", level, nLevels));
	}

	static InvalidTileException invalidAddress(int level, int column, int row, int tilesX, int tilesY) {
		return new InvalidTileException(Reason.INVALID_ADDRESS, level, column, row,
				String.format("tile (%d, %d) requested, but level %d has %d x %d tiles", column, row, level, tilesX, tilesY));
	}

	/**
	 * Get the reason the request was rejected.
	 * @return
	 */
	public Reason getReason() {
		return reason;
	}

	/**
	 * Get the requested level.
	 * @return
	 */
	public int getLevel() {
		return level;
	}

	/**
	 * Get the requested column, or -1 if the level itself was invalid.
	 * @return
	 */
	public int getColumn() {
		return column;
	}

	/**
	 * Get the requested row, or -1 if the level itself was invalid.
	 * @return
	 */
	public int getRow() {
		return row;
	}

}
