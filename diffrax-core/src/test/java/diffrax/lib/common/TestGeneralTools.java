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

package diffrax.lib.common;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

@SuppressWarnings("javadoc")
public class TestGeneralTools {
	
	@Test
	public void test_almostTheSame() {
		assertTrue(GeneralTools.almostTheSame(1.0, 1.0 + 1e-8, 1e-6));
		assertTrue(GeneralTools.almostTheSame(1e6, 1e6 + 0.1, 1e-6));
		assertFalse(GeneralTools.almostTheSame(1.0, 1.1, 1e-6));
	}
	
	@Test
	public void test_almostEqual() {
		assertTrue(GeneralTools.almostEqual(new double[] {1, 2}, new double[] {1 + 1e-9, 2}, 1e-7));
		assertFalse(GeneralTools.almostEqual(new double[] {1, 2}, new double[] {1, 2.1}, 1e-7));
		assertFalse(GeneralTools.almostEqual(new double[] {1, 2}, new double[] {1}, 1e-7));
		assertTrue(GeneralTools.almostEqual(new double[0], new double[0], 1e-7));
	}
	
	@Test
	public void test_arrayToString() {
		assertEquals("(1.0, 2.5)", GeneralTools.arrayToString(1.0, 2.5));
		assertEquals("()", GeneralTools.arrayToString());
	}

}
