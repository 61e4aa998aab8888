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

import java.util.Objects;

import diffrax.lib.common.ModelContracts;

/**
 * Abstract {@link ImageTile} that stores the tile shape and checks pixel coordinates.
 */
abstract class AbstractImageTile implements ImageTile {
	
	private final int width;
	private final int height;
	
	AbstractImageTile(int width, int height, int arrayLength) {
		ModelContracts.check(width >= 0 && height >= 0, "Tile size must not be negative (requested %d x %d)", width, height);
		ModelContracts.check(arrayLength == width * height, 
				"Pixel array length %d does not match tile size %d x %d", arrayLength, width, height);
		this.width = width;
		this.height = height;
	}

	@Override
	public int getWidth() {
		return width;
	}

	@Override
	public int getHeight() {
		return height;
	}
	
	/**
	 * Get the index into the row-major pixel array for a pixel coordinate.
	 * @param x
	 * @param y
	 * @return
	 * @throws IndexOutOfBoundsException if the coordinate lies outside the tile
	 */
	protected int index(int x, int y) {
		Objects.checkIndex(x, width);
		Objects.checkIndex(y, height);
		return y * width + x;
	}
	
	@Override
	public String toString() {
		return getClass().getSimpleName() + " (" + width + " x " + height + ")";
	}

}
