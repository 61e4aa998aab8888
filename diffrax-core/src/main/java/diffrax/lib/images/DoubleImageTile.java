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

/**
 * An {@link ImageTile} backed by an array of doubles.
 */
public class DoubleImageTile extends AbstractImageTile implements NumericImageTile {

	private final double[] data;
	
	/**
	 * Create a tile backed by an existing pixel array, stored in row-major order.
	 * The array is used directly, not copied.
	 * @param data
	 * @param width
	 * @param height
	 */
	public DoubleImageTile(double[] data, int width, int height) {
		super(width, height, data.length);
		this.data = data;
	}
	
	/**
	 * Create a tile with all pixels set to zero.
	 * @param width
	 * @param height
	 */
	public DoubleImageTile(int width, int height) {
		this(new double[width * height], width, height);
	}
	
	/**
	 * Get the value of a single pixel.
	 * @param x
	 * @param y
	 * @return
	 */
	public double getValue(int x, int y) {
		return data[index(x, y)];
	}
	
	/**
	 * Set the value of a single pixel.
	 * @param x
	 * @param y
	 * @param val
	 */
	public void setValue(int x, int y, double val) {
		data[index(x, y)] = val;
	}
	
	/**
	 * Request the pixel array, returned row-wise.
	 * @param direct if true, the internal array will be returned and the caller should take care if modifying it
	 * @return
	 */
	public double[] getArray(boolean direct) {
		return direct ? data : data.clone();
	}

	@Override
	public double getDouble(int x, int y) {
		return getValue(x, y);
	}

	@Override
	public DoubleImageTile toDoubleTile() {
		return new DoubleImageTile(data.clone(), getWidth(), getHeight());
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
		DoubleImageTile other = (DoubleImageTile) obj;
		return hasSameShape(other) && Arrays.equals(data, other.data);
	}

}
