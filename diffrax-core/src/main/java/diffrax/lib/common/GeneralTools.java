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

import org.apache.commons.math3.util.Precision;

/**
 * A collection of generally-useful static methods.
 */
public class GeneralTools {
	
	// Suppress default constructor for non-instantiability
	private GeneralTools() {
		throw new AssertionError();
	}
	
	/**
	 * Test if two doubles are approximately equal, relative to their magnitudes.
	 * @param n1
	 * @param n2
	 * @param tolerance
	 * @return
	 */
	public static boolean almostTheSame(double n1, double n2, double tolerance) {
		return Precision.equalsWithRelativeTolerance(n1, n2, tolerance);
	}
	
	/**
	 * Test if two arrays have the same length, and each pair of elements differs by at most the absolute tolerance.
	 * @param a1
	 * @param a2
	 * @param tolerance
	 * @return
	 */
	public static boolean almostEqual(double[] a1, double[] a2, double tolerance) {
		if (a1.length != a2.length)
			return false;
		for (int i = 0; i < a1.length; i++) {
			if (!Precision.equals(a1[i], a2[i], tolerance))
				return false;
		}
		return true;
	}
	
	/**
	 * Format a double array as a comma-separated list within brackets, e.g. {@code (1.0, 2.0, 3.0)}.
	 * @param values
	 * @return
	 */
	public static String arrayToString(double... values) {
		StringBuilder sb = new StringBuilder("(");
		for (int i = 0; i < values.length; i++) {
			if (i > 0)
				sb.append(", ");
			sb.append(values[i]);
		}
		sb.append(")");
		return sb.toString();
	}

}
