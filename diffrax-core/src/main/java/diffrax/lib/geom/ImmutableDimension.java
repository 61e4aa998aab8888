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

package diffrax.lib.geom;

/**
 * An immutable integer width and height, used for example to store the shape of an image grid.
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
	 * Get the number of elements covered, i.e. {@code width * height}.
	 * @return
	 */
	public long getArea() {
		return (long)width * height;
	}
	
	@Override
	public String toString() {
		return "ImmutableDimension (" + width + " x " + height + ")";
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
		if (height != other.height)
			return false;
		if (width != other.width)
			return false;
		return true;
	}
	
}
