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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

@SuppressWarnings("javadoc")
public class TestPrefs {
	
	@AfterEach
	public void reset() {
		Prefs.resetToDefaults();
	}
	
	@Test
	public void test_defaults() {
		Prefs.resetToDefaults();
		assertEquals(1e-6, Prefs.getAngleTolerance());
		assertEquals(0.01, Prefs.getOscillationTolerance());
	}
	
	@Test
	public void test_setters() {
		Prefs.setAngleTolerance(1e-3);
		assertEquals(1e-3, Prefs.getAngleTolerance());
		Prefs.setAngleTolerance(-1);
		assertEquals(0.0, Prefs.getAngleTolerance());
		
		Prefs.setOscillationTolerance(0.5);
		assertEquals(0.5, Prefs.getOscillationTolerance());
		assertThrows(IllegalArgumentException.class, () -> Prefs.setOscillationTolerance(0));
		assertThrows(IllegalArgumentException.class, () -> Prefs.setOscillationTolerance(Double.NaN));
		assertEquals(0.5, Prefs.getOscillationTolerance());
	}

}
