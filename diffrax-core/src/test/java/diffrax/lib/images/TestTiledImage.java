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

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import diffrax.lib.common.ModelContractException;

@SuppressWarnings("javadoc")
public class TestTiledImage {
	
	@Test
	public void test_empty() {
		TiledImage<DoubleImageTile> empty = TiledImage.empty();
		assertTrue(empty.isEmpty());
		assertEquals(0, empty.nTiles());
		assertEquals(empty, TiledImage.of(List.<DoubleImageTile>of()));
		assertTrue(empty.hasSameShape(TiledImage.<BooleanImageTile>empty()));
		assertThrows(ModelContractException.class, () -> empty.getTile(0));
		assertFalse(empty.iterator().hasNext());
	}
	
	@Test
	public void test_tiles() {
		var t1 = new IntImageTile(2, 3);
		var t2 = new IntImageTile(4, 5);
		var image = TiledImage.of(t1, t2);
		assertFalse(image.isEmpty());
		assertEquals(2, image.nTiles());
		assertSame(t1, image.getTile(0));
		assertSame(t2, image.getTile(1));
		assertThrows(ModelContractException.class, () -> image.getTile(2));
		assertThrows(UnsupportedOperationException.class, () -> image.getTiles().clear());
		
		var mask = TiledImage.of(new BooleanImageTile(2, 3, true), new BooleanImageTile(4, 5, false));
		assertTrue(image.hasSameShape(mask));
		assertFalse(image.hasSameShape(TiledImage.of(new BooleanImageTile(3, 2, true), new BooleanImageTile(4, 5, false))));
		assertFalse(image.hasSameShape(TiledImage.of(new BooleanImageTile(2, 3, true))));
		assertFalse(image.hasSameShape(null));
	}
	
	@Test
	public void test_toDouble() {
		var image = TiledImage.of(new IntImageTile(new int[] {1, 2, 3, 4}, 2, 2), new IntImageTile(new int[] {5}, 1, 1));
		var converted = TiledImages.toDouble(image);
		assertEquals(2, converted.nTiles());
		assertArrayEquals(new double[] {1, 2, 3, 4}, converted.getTile(0).getArray(false));
		assertEquals(5.0, converted.getTile(1).getValue(0, 0));
		
		// Double images are copied
		var again = TiledImages.toDouble(converted);
		assertEquals(converted, again);
		again.getTile(0).setValue(0, 0, 10);
		assertEquals(1.0, converted.getTile(0).getValue(0, 0));
		
		assertTrue(TiledImages.toDouble(TiledImage.empty()).isEmpty());
	}
	
	@Test
	public void test_filledTile() {
		var tile = TiledImages.createFilledTile(3, 2, 2.5);
		assertEquals(3, tile.getWidth());
		assertEquals(2, tile.getHeight());
		for (double v : tile.getArray(false))
			assertEquals(2.5, v);
	}
	
	@Test
	public void test_and() {
		var m1 = TiledImage.of(new BooleanImageTile(new boolean[] {true, true, false}, 3, 1));
		var m2 = TiledImage.of(new BooleanImageTile(new boolean[] {false, true, true}, 3, 1));
		var combined = TiledImages.and(m1, m2);
		assertArrayEquals(new boolean[] {false, true, false}, combined.getTile(0).getArray(false));
		assertEquals(combined, TiledImages.and(m2, m1));
		
		var wrongShape = TiledImage.of(new BooleanImageTile(1, 3, true));
		assertThrows(ModelContractException.class, () -> TiledImages.and(m1, wrongShape));
		var wrongCount = TiledImage.of(new BooleanImageTile(3, 1, true), new BooleanImageTile(3, 1, true));
		assertThrows(ModelContractException.class, () -> TiledImages.and(m1, wrongCount));
		assertThrows(ModelContractException.class, () -> TiledImages.checkSameShape(m1, TiledImage.empty(), "gain"));
	}

}
