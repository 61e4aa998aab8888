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

import static org.junit.jupiter.api.Assertions.*;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.junit.jupiter.api.Test;

import diffrax.lib.common.ModelContractException;

@SuppressWarnings("javadoc")
public class TestBeam {
	
	@Test
	public void test_s0() {
		var beam = new Beam(new Vector3D(0, 0, 2), 0.5);
		assertEquals(1.0, beam.getDirection().getNorm(), 1e-12);
		assertEquals(0.0, beam.getS0().distance(new Vector3D(0, 0, -2)), 1e-12);
		
		var fromS0 = new Beam(new Vector3D(0, 0, -2));
		assertEquals(0.5, fromS0.getWavelength(), 1e-12);
		assertEquals(beam, fromS0);
		assertEquals(beam, new Beam(beam));
		
		assertNotEquals(beam, new Beam(new Vector3D(0, 0.01, 1), 0.5));
		assertNotEquals(beam, new Beam(new Vector3D(0, 0, 1), 0.6));
	}
	
	@Test
	public void test_invalid() {
		assertThrows(ModelContractException.class, () -> new Beam(Vector3D.ZERO, 1.0));
		assertThrows(ModelContractException.class, () -> new Beam(Vector3D.PLUS_K, 0.0));
		assertThrows(ModelContractException.class, () -> new Beam(Vector3D.ZERO));
	}

}
