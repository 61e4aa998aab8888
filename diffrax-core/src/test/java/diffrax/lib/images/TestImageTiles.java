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

import org.junit.jupiter.api.Test;

import diffrax.lib.common.ModelContractException;

@SuppressWarnings("javadoc")
public class TestImageTiles {
	
	@Test
	public void test_doubleTile() {
		int width = 4, height = 3;
		double[] data = new double[width * height];
		for (int i = 0; i < data.length; i++)
			data[i] = i * 0.5;
		var tile = new DoubleImageTile(data, width, height);
		assertEquals(width, tile.getWidth());
		assertEquals(height, tile.getHeight());
		assertEquals(12, tile.size());
		
		// Row-major order
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++) {
				assertEquals((y * width + x) * 0.5, tile.getValue(x, y));
				assertEquals(tile.getValue(x, y), tile.getDouble(x, y));
			}
		}
		
		tile.setValue(1, 2, -1);
		assertEquals(-1, data[2 * width + 1]);
		assertSame(data, tile.getArray(true));
		assertNotSame(data, tile.getArray(false));
		
		var converted = tile.toDoubleTile();
		assertEquals(tile, converted);
		converted.setValue(0, 0, 100);
		assertNotEquals(tile, converted);
		
		assertThrows(IndexOutOfBoundsException.class, () -> tile.getValue(4, 0));
		assertThrows(IndexOutOfBoundsException.class, () -> tile.getValue(0, 3));
		assertThrows(IndexOutOfBoundsException.class, () -> tile.getValue(-1, 0));
	}
	
	@Test
	public void test_intTile() {
		var tile = new IntImageTile(new int[] {1, 2, 3, 4, 5, 6}, 3, 2);
		assertEquals(6, tile.getValue(2, 1));
		assertEquals(4.0, tile.getDouble(0, 1));
		
		var doubleTile = tile.toDoubleTile();
		assertArrayEquals(new double[] {1, 2, 3, 4, 5, 6}, doubleTile.getArray(false));
		assertTrue(tile.hasSameShape(doubleTile));
		assertFalse(tile.hasSameShape(new IntImageTile(2, 3)));
		assertNotEquals(tile, doubleTile);
	}
	
	@Test
	public void test_booleanTile() {
		var tile = new BooleanImageTile(3, 2, true);
		assertEquals(6, tile.countTrue());
		tile.setValue(0, 1, false);
		assertFalse(tile.getValue(0, 1));
		
		var other = new BooleanImageTile(new boolean[] {true, false, true, true, true, false}, 3, 2);
		var combined = tile.and(other);
		assertArrayEquals(new boolean[] {true, false, true, false, true, false}, combined.getArray(false));
		assertEquals(combined, other.and(tile));
		// Inputs are unchanged
		assertEquals(5, tile.countTrue());
		assertEquals(4, other.countTrue());
		
		assertThrows(ModelContractException.class, () -> tile.and(new BooleanImageTile(2, 3, true)));
		assertEquals(0, new BooleanImageTile(2, 2, false).countTrue());
	}
	
	@Test
	public void test_invalidSize() {
		assertThrows(ModelContractException.class, () -> new DoubleImageTile(new double[5], 2, 3));
		assertThrows(ModelContractException.class, () -> new IntImageTile(new int[6], -2, -3));
		assertThrows(ModelContractException.class, () -> new BooleanImageTile(new boolean[1], 1, 2));
		
		var empty = new DoubleImageTile(0, 0);
		assertEquals(0, empty.size());
	}

}
