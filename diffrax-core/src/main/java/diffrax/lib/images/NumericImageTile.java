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
 * An {@link ImageTile} containing numeric pixel values, which can be promoted to double precision.
 */
public interface NumericImageTile extends ImageTile {
	
	/**
	 * Get a pixel value as a double.
	 * @param x
	 * @param y
	 * @return
	 */
	public double getDouble(int x, int y);
	
	/**
	 * Create a new double-precision tile with the same shape and values.
	 * The returned tile does not share its pixel array with this one.
	 * @return
	 */
	public DoubleImageTile toDoubleTile();

}
