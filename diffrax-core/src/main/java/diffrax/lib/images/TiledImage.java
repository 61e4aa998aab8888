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

import java.util.Collection;
import java.util.Iterator;
import java.util.List;

import com.google.common.collect.ImmutableList;

import diffrax.lib.common.ModelContracts;

/**
 * An image made up of an ordered list of tiles, conventionally one tile per detector panel.
 * <p>
 * Each tile may have its own shape. An image with no tiles is 'empty'; this is used to represent 
 * data that is absent (e.g. no gain map or no dynamic mask), rather than {@code null}.
 * <p>
 * The list of tiles is immutable, although the pixel values within a tile may be modifiable.
 *
 * @param <T> the tile type
 */
public final class TiledImage<T extends ImageTile> implements Iterable<T> {
	
	private static final TiledImage<?> EMPTY = new TiledImage<>(ImmutableList.of());
	
	private final ImmutableList<T> tiles;
	
	private TiledImage(ImmutableList<T> tiles) {
		this.tiles = tiles;
	}
	
	/**
	 * Get an image with no tiles.
	 * @param <T>
	 * @return
	 */
	@SuppressWarnings("unchecked")
	public static <T extends ImageTile> TiledImage<T> empty() {
		return (TiledImage<T>)EMPTY;
	}
	
	/**
	 * Create an image from the specified tiles.
	 * @param <T>
	 * @param tiles
	 * @return
	 */
	@SafeVarargs
	public static <T extends ImageTile> TiledImage<T> of(T... tiles) {
		return of(List.of(tiles));
	}
	
	/**
	 * Create an image from a collection of tiles, in iteration order.
	 * @param <T>
	 * @param tiles
	 * @return
	 */
	public static <T extends ImageTile> TiledImage<T> of(Collection<? extends T> tiles) {
		if (tiles.isEmpty())
			return empty();
		return new TiledImage<>(ImmutableList.copyOf(tiles));
	}
	
	/**
	 * Get the number of tiles.
	 * @return
	 */
	public int nTiles() {
		return tiles.size();
	}
	
	/**
	 * Returns true if the image contains no tiles.
	 * @return
	 */
	public boolean isEmpty() {
		return tiles.isEmpty();
	}
	
	/**
	 * Get a single tile.
	 * @param index
	 * @return
	 * @throws diffrax.lib.common.ModelContractException if the index is out of range
	 */
	public T getTile(int index) {
		return tiles.get(ModelContracts.checkIndex(index, tiles.size(), "Tile"));
	}
	
	/**
	 * Get an unmodifiable list of all tiles.
	 * @return
	 */
	public List<T> getTiles() {
		return tiles;
	}
	
	/**
	 * Check whether another image has the same number of tiles, and each tile has the same shape.
	 * The tile types do not need to match.
	 * @param other
	 * @return
	 */
	public boolean hasSameShape(TiledImage<?> other) {
		if (other == null || nTiles() != other.nTiles())
			return false;
		for (int i = 0; i < nTiles(); i++) {
			if (!tiles.get(i).hasSameShape(other.tiles.get(i)))
				return false;
		}
		return true;
	}

	@Override
	public Iterator<T> iterator() {
		return tiles.iterator();
	}

	@Override
	public String toString() {
		return "TiledImage (" + nTiles() + " tiles)";
	}

	@Override
	public int hashCode() {
		return tiles.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		return tiles.equals(((TiledImage<?>)obj).tiles);
	}

}
