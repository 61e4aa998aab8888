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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import diffrax.lib.common.ModelContracts;

/**
 * Static methods for creating and combining {@link TiledImage TiledImages}.
 */
public class TiledImages {
	
	// Suppress default constructor for non-instantiability
	private TiledImages() {
		throw new AssertionError();
	}
	
	/**
	 * Create a tile where every pixel has the same value.
	 * @param width
	 * @param height
	 * @param value
	 * @return
	 */
	public static DoubleImageTile createFilledTile(int width, int height, double value) {
		var tile = new DoubleImageTile(width, height);
		Arrays.fill(tile.getArray(true), value);
		return tile;
	}
	
	/**
	 * Convert every tile of a numeric image to double precision.
	 * The result does not share pixel arrays with the input.
	 * @param image
	 * @return
	 */
	public static TiledImage<DoubleImageTile> toDouble(TiledImage<? extends NumericImageTile> image) {
		List<DoubleImageTile> tiles = new ArrayList<>(image.nTiles());
		for (var tile : image)
			tiles.add(tile.toDoubleTile());
		return TiledImage.of(tiles);
	}
	
	/**
	 * Combine two masks with an elementwise logical AND.
	 * @param mask1
	 * @param mask2
	 * @return
	 * @throws diffrax.lib.common.ModelContractException if the masks do not have the same tile count and tile shapes
	 */
	public static TiledImage<BooleanImageTile> and(TiledImage<BooleanImageTile> mask1, TiledImage<BooleanImageTile> mask2) {
		checkSameShape(mask1, mask2, "mask");
		List<BooleanImageTile> tiles = new ArrayList<>(mask1.nTiles());
		for (int i = 0; i < mask1.nTiles(); i++)
			tiles.add(mask1.getTile(i).and(mask2.getTile(i)));
		return TiledImage.of(tiles);
	}
	
	/**
	 * Check that two images have the same tile count and tile shapes.
	 * @param image
	 * @param other
	 * @param name name of the other image, used in the error message
	 * @throws diffrax.lib.common.ModelContractException if the shapes differ
	 */
	public static void checkSameShape(TiledImage<?> image, TiledImage<?> other, String name) {
		ModelContracts.check(image.nTiles() == other.nTiles(), 
				"Expected %d tiles for %s, but found %d", image.nTiles(), name, other.nTiles());
		for (int i = 0; i < image.nTiles(); i++) {
			ModelContracts.check(image.getTile(i).hasSameShape(other.getTile(i)), 
					"Tile %d of %s has shape %d x %d, expected %d x %d", i, name,
					other.getTile(i).getWidth(), other.getTile(i).getHeight(),
					image.getTile(i).getWidth(), image.getTile(i).getHeight());
		}
	}

}
