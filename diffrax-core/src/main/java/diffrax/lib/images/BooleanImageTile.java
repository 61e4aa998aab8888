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

import java.util.Arrays;

import diffrax.lib.common.ModelContracts;

/**
 * An {@link ImageTile} of boolean values, used for masks where {@code true} indicates a valid pixel.
 */
public class BooleanImageTile extends AbstractImageTile {

	private final boolean[] data;
	
	/**
	 * Create a tile backed by an existing array, stored in row-major order.
	 * The array is used directly, not copied.
	 * @param data
	 * @param width
	 * @param height
	 */
	public BooleanImageTile(boolean[] data, int width, int height) {
		super(width, height, data.length);
		this.data = data;
	}
	
	/**
	 * Create a tile with every pixel set to the same value.
	 * @param width
	 * @param height
	 * @param value
	 */
	public BooleanImageTile(int width, int height, boolean value) {
		this(new boolean[width * height], width, height);
		if (value)
			Arrays.fill(data, true);
	}
	
	/**
	 * Get the value of a single pixel.
	 * @param x
	 * @param y
	 * @return
	 */
	public boolean getValue(int x, int y) {
		return data[index(x, y)];
	}
	
	/**
	 * Set the value of a single pixel.
	 * @param x
	 * @param y
	 * @param val
	 */
	public void setValue(int x, int y, boolean val) {
		data[index(x, y)] = val;
	}
	
	/**
	 * Request the mask array, returned row-wise.
	 * @param direct if true, the internal array will be returned and the caller should take care if modifying it
	 * @return
	 */
	public boolean[] getArray(boolean direct) {
		return direct ? data : data.clone();
	}
	
	/**
	 * Create a new tile that is the elementwise logical AND of this tile and another.
	 * @param other
	 * @return
	 * @throws diffrax.lib.common.ModelContractException if the tiles differ in shape
	 */
	public BooleanImageTile and(BooleanImageTile other) {
		ModelContracts.check(hasSameShape(other), "Cannot combine mask tiles of different shapes (%s and %s)", this, other);
		boolean[] result = new boolean[data.length];
		for (int i = 0; i < data.length; i++)
			result[i] = data[i] && other.data[i];
		return new BooleanImageTile(result, getWidth(), getHeight());
	}
	
	/**
	 * Count the number of pixels that are true.
	 * @return
	 */
	public int countTrue() {
		int n = 0;
		for (boolean b : data) {
			if (b)
				n++;
		}
		return n;
	}

	@Override
	public int hashCode() {
		return 31 * (31 * getWidth() + getHeight()) + Arrays.hashCode(data);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		BooleanImageTile other = (BooleanImageTile) obj;
		return hasSameShape(other) && Arrays.equals(data, other.data);
	}

}
