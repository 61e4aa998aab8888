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
import org.apache.commons.math3.linear.MatrixUtils;
import org.junit.jupiter.api.Test;

import diffrax.lib.common.ModelContractException;

@SuppressWarnings("javadoc")
public class TestGoniometer {
	
	@Test
	public void test_goniometer() {
		var gonio = new Goniometer();
		assertEquals(Vector3D.PLUS_I, gonio.getRotationAxis());
		assertEquals(MatrixUtils.createRealIdentityMatrix(3), gonio.getFixedRotation());
		
		var scaled = new Goniometer(new Vector3D(3, 0, 0));
		assertEquals(gonio, scaled);
		
		var copy = new Goniometer(gonio);
		copy.setFixedRotation(MatrixUtils.createRealDiagonalMatrix(new double[] {1, -1, -1}));
		assertNotEquals(gonio, copy);
		assertEquals(1.0, gonio.getFixedRotation().getEntry(1, 1));
		
		assertNotEquals(gonio, new Goniometer(Vector3D.PLUS_J));
	}
	
	@Test
	public void test_invalid() {
		assertThrows(ModelContractException.class, () -> new Goniometer(Vector3D.ZERO));
		assertThrows(ModelContractException.class, 
				() -> new Goniometer(Vector3D.PLUS_I, MatrixUtils.createRealIdentityMatrix(2)));
	}

}
