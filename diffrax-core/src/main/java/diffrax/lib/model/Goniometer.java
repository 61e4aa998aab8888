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

import org.apache.commons.math3.exception.MathArithmeticException;
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;

import diffrax.lib.common.GeneralTools;
import diffrax.lib.common.ModelContracts;
import diffrax.lib.common.Prefs;

/**
 * A single-axis goniometer: a rotation axis, plus a fixed rotation applied to the crystal before rotation about the axis.
 */
public class Goniometer {
	
	private static final double MATRIX_TOLERANCE = 1e-6;
	
	private Vector3D rotationAxis;
	private RealMatrix fixedRotation;
	
	/**
	 * Create a goniometer rotating about the x axis, with no fixed rotation.
	 */
	public Goniometer() {
		this(Vector3D.PLUS_I);
	}
	
	/**
	 * Create a goniometer with the specified rotation axis and no fixed rotation.
	 * @param rotationAxis this will be normalized
	 */
	public Goniometer(Vector3D rotationAxis) {
		this(rotationAxis, MatrixUtils.createRealIdentityMatrix(3));
	}
	
	/**
	 * Create a goniometer with the specified rotation axis and fixed rotation.
	 * @param rotationAxis this will be normalized
	 * @param fixedRotation 3x3 rotation matrix
	 */
	public Goniometer(Vector3D rotationAxis, RealMatrix fixedRotation) {
		setRotationAxis(rotationAxis);
		setFixedRotation(fixedRotation);
	}
	
	/**
	 * Copy constructor.
	 * @param goniometer
	 */
	public Goniometer(Goniometer goniometer) {
		this.rotationAxis = goniometer.rotationAxis;
		this.fixedRotation = goniometer.fixedRotation.copy();
	}
	
	/**
	 * Get the unit rotation axis.
	 * @return
	 */
	public Vector3D getRotationAxis() {
		return rotationAxis;
	}
	
	/**
	 * Set the rotation axis.
	 * @param rotationAxis this will be normalized
	 */
	public void setRotationAxis(Vector3D rotationAxis) {
		try {
			this.rotationAxis = rotationAxis.normalize();
		} catch (MathArithmeticException e) {
			throw ModelContracts.fail("Rotation axis must not have zero length");
		}
	}
	
	/**
	 * Get the fixed rotation matrix.
	 * @return a copy of the matrix
	 */
	public RealMatrix getFixedRotation() {
		return fixedRotation.copy();
	}
	
	/**
	 * Set the fixed rotation matrix.
	 * @param fixedRotation 3x3 matrix
	 */
	public void setFixedRotation(RealMatrix fixedRotation) {
		ModelContracts.check(fixedRotation.getRowDimension() == 3 && fixedRotation.getColumnDimension() == 3, 
				"Fixed rotation must be a 3x3 matrix");
		this.fixedRotation = fixedRotation.copy();
	}

	/**
	 * Goniometers are equal if their rotation axes differ by no more than {@link Prefs#getAngleTolerance()} 
	 * and their fixed rotations match elementwise to within 1e-6.
	 */
	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		Goniometer other = (Goniometer) obj;
		if (Vector3D.angle(rotationAxis, other.rotationAxis) > Prefs.getAngleTolerance())
			return false;
		for (int r = 0; r < 3; r++) {
			if (!GeneralTools.almostEqual(fixedRotation.getRow(r), other.fixedRotation.getRow(r), MATRIX_TOLERANCE))
				return false;
		}
		return true;
	}

	// Equality is tolerant, so there are no exact fields to hash
	@Override
	public int hashCode() {
		return Goniometer.class.hashCode();
	}

	@Override
	public String toString() {
		return "Goniometer:\n" +
				"    Rotation axis:  " + GeneralTools.arrayToString(rotationAxis.toArray()) + "\n" +
				"    Fixed rotation: " + GeneralTools.arrayToString(fixedRotation.getRow(0)) 
					+ GeneralTools.arrayToString(fixedRotation.getRow(1)) 
					+ GeneralTools.arrayToString(fixedRotation.getRow(2)) + "\n";
	}

}
