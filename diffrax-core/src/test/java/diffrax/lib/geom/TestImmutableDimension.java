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

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

@SuppressWarnings("javadoc")
public class TestImmutableDimension {
	
	@Test
	public void test() {
		var dim = ImmutableDimension.getInstance(3, 4);
		assertEquals(3, dim.getWidth());
		assertEquals(4, dim.getHeight());
		assertEquals(12L, dim.getArea());
		assertEquals(ImmutableDimension.getInstance(3, 4), dim);
		assertEquals(ImmutableDimension.getInstance(3, 4).hashCode(), dim.hashCode());
		assertNotEquals(ImmutableDimension.getInstance(4, 3), dim);
		
		// Area does not overflow
		var large = ImmutableDimension.getInstance(100_000, 100_000);
		assertEquals(10_000_000_000L, large.getArea());
	}

}
