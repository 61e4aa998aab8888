/*-
 * #%L
 * This file is part of Diffrax.
 * %%
 * Copyright (C) 2023 Diffrax developers
 * %%
 * Diffrax is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * Diffrax is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with Diffrax.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package diffrax.lib.images;

/**
 * A minimal interface for a single 2D array of pixel values, stored in row-major order.
 * <p>
 * A tile normally holds the pixels of one detector panel: x runs along the fast axis and y along the slow axis.
 */
public interface ImageTile {
	
	/**
	 * Width of the tile, i.e. the number of pixels along the fast axis.
	 * @return
	 */
	public int getWidth();
	
	/**
	 * Height of the tile, i.e. the number of pixels along the slow axis.
	 * @return
	 */
	public int getHeight();
	
	/**
	 * Total number of pixels in the tile.
	 * @return
	 */
	public default int size() {
		return getWidth() * getHeight();
	}
	
	/**
	 * Returns true if the other tile has the same width and height, regardless of its pixel type.
	 * @param other
	 * @return
	 */
	public default boolean hasSameShape(ImageTile other) {
		return other != null && getWidth() == other.getWidth() && getHeight() == other.getHeight();
	}

}
