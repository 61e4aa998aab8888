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

import diffrax.lib.common.GeneralTools;
import diffrax.lib.common.ModelContracts;
import diffrax.lib.common.Prefs;

/**
 * The incident X-ray beam.
 * <p>
 * The beam direction is stored as a unit vector pointing from the sample towards the source, 
 * so that the incident beam vector is {@code s0 = -direction / wavelength}.
 */
public class Beam {
	
	private Vector3D direction;
	private double wavelength;
	
	/**
	 * Create a beam from its direction and wavelength.
	 * @param direction direction from the sample towards the source; this will be normalized
	 * @param wavelength wavelength in Angstroms
	 */
	public Beam(Vector3D direction, double wavelength) {
		setDirection(direction);
		setWavelength(wavelength);
	}
	
	/**
	 * Create a beam from the incident beam vector, whose length is the reciprocal of the wavelength.
	 * @param s0
	 */
	public Beam(Vector3D s0) {
		ModelContracts.check(s0.getNorm() > 0, "Beam vector must not have zero length");
		this.wavelength = 1.0 / s0.getNorm();
		this.direction = s0.negate().normalize();
	}
	
	/**
	 * Copy constructor.
	 * @param beam
	 */
	public Beam(Beam beam) {
		this.direction = beam.direction;
		this.wavelength = beam.wavelength;
	}
	
	/**
	 * Get the unit vector pointing from the sample towards the source.
	 * @return
	 */
	public Vector3D getDirection() {
		return direction;
	}
	
	/**
	 * Set the beam direction.
	 * @param direction direction from the sample towards the source; this will be normalized
	 */
	public void setDirection(Vector3D direction) {
		try {
			this.direction = direction.normalize();
		} catch (MathArithmeticException e) {
			throw ModelContracts.fail("Beam direction must not have zero length");
		}
	}
	
	/**
	 * Get the wavelength, in Angstroms.
	 * @return
	 */
	public double getWavelength() {
		return wavelength;
	}
	
	/**
	 * Set the wavelength, in Angstroms.
	 * @param wavelength
	 */
	public void setWavelength(double wavelength) {
		ModelContracts.check(wavelength > 0, "Wavelength must be > 0, but was %s", wavelength);
		this.wavelength = wavelength;
	}
	
	/**
	 * Get the incident beam vector, with length equal to the reciprocal of the wavelength.
	 * @return
	 */
	public Vector3D getS0() {
		return direction.scalarMultiply(-1.0 / wavelength);
	}

	/**
	 * Beams are equal if their directions differ by no more than {@link Prefs#getAngleTolerance()} 
	 * and their wavelengths are the same to within a relative tolerance of 1e-6.
	 */
	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		Beam other = (Beam) obj;
		return Vector3D.angle(direction, other.direction) <= Prefs.getAngleTolerance()
				&& GeneralTools.almostTheSame(wavelength, other.wavelength, 1e-6);
	}

	// Equality is tolerant, so there are no exact fields to hash
	@Override
	public int hashCode() {
		return Beam.class.hashCode();
	}

	@Override
	public String toString() {
		return "Beam:\n" +
				"    wavelength: " + wavelength + "\n" +
				"    sample to source direction: " + GeneralTools.arrayToString(direction.toArray()) + "\n";
	}

}
