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

package diffrax.lib.imageset;

/**
 * The kinds of {@link ImageSet}.
 */
public enum ImageSetType {
	
	/**
	 * A plain, unstructured set of images.
	 */
	PLAIN,
	
	/**
	 * A set of images arranged as a rectangular grid.
	 * @see ImageGrid
	 */
	GRID,
	
	/**
	 * A contiguous rotation series sharing one beam, detector, goniometer and scan.
	 * @see ImageSweep
	 */
	SWEEP;
	
	@Override
	public String toString() {
		switch (this) {
		case PLAIN:
			return "Image set";
		case GRID:
			return "Image grid";
		case SWEEP:
			return "Image sweep";
		default:
			return super.toString();
		}
	}

}
