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

package diffrax.lib.model;

/**
 * A rectangular region of a panel, in pixel coordinates, that should be excluded from analysis.
 * <p>
 * The region covers fast-axis pixels {@code f0 <= x < f1} and slow-axis pixels {@code s0 <= y < s1}.
 */
public class MaskRegion {
	
	private final int f0, s0, f1, s1;
	
	/**
	 * Constructor.
	 * @param f0 first fast-axis pixel (inclusive)
	 * @param s0 first slow-axis pixel (inclusive)
	 * @param f1 last fast-axis pixel (exclusive)
	 * @param s1 last slow-axis pixel (exclusive)
	 */
	public MaskRegion(int f0, int s0, int f1, int s1) {
		this.f0 = f0;
		this.s0 = s0;
		this.f1 = f1;
		this.s1 = s1;
	}

	/**
	 * First fast-axis pixel (inclusive).
	 * @return
	 */
	public int getF0() {
		return f0;
	}

	/**
	 * First slow-axis pixel (inclusive).
	 * @return
	 */
	public int getS0() {
		return s0;
	}

	/**
	 * Last fast-axis pixel (exclusive).
	 * @return
	 */
	public int getF1() {
		return f1;
	}

	/**
	 * Last slow-axis pixel (exclusive).
	 * @return
	 */
	public int getS1() {
		return s1;
	}
	
	/**
	 * Returns true if the pixel coordinate falls inside this region.
	 * @param x
	 * @param y
	 * @return
	 */
	public boolean contains(int x, int y) {
		return f0 <= x && x < f1 && s0 <= y && y < s1;
	}

	@Override
	public String toString() {
		return "MaskRegion (f0=" + f0 + ", s0=" + s0 + ", f1=" + f1 + ", s1=" + s1 + ")";
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + f0;
		result = prime * result + f1;
		result = prime * result + s0;
		result = prime * result + s1;
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
		MaskRegion other = (MaskRegion) obj;
		return f0 == other.f0 && f1 == other.f1 && s0 == other.s0 && s1 == other.s1;
	}

}
