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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Core Diffrax preferences. These are not persistent, but initial values can be given as system properties.
 * <ul>
 *   <li>{@value #PROP_ANGLE_TOLERANCE}: maximum angle (radians) between vectors considered the same when comparing models</li>
 *   <li>{@value #PROP_OSCILLATION_TOLERANCE}: fraction of the oscillation width allowed as mismatch when joining scans</li>
 * </ul>
 */
public class Prefs {
	
	private static final Logger logger = LoggerFactory.getLogger(Prefs.class);
	
	/**
	 * System property used to initialize {@link #getAngleTolerance()}.
	 */
	public static final String PROP_ANGLE_TOLERANCE = "diffrax.panel.angleTolerance";

	/**
	 * System property used to initialize {@link #getOscillationTolerance()}.
	 */
	public static final String PROP_OSCILLATION_TOLERANCE = "diffrax.scan.oscillationTolerance";
	
	private static final double DEFAULT_ANGLE_TOLERANCE = 1e-6;
	private static final double DEFAULT_OSCILLATION_TOLERANCE = 0.01;
	
	private static double angleTolerance = readDouble(PROP_ANGLE_TOLERANCE, DEFAULT_ANGLE_TOLERANCE);
	private static double oscillationTolerance = readDouble(PROP_OSCILLATION_TOLERANCE, DEFAULT_OSCILLATION_TOLERANCE);
	
	/**
	 * Get the maximum angle, in radians, between two axes for them to be considered equal.
	 * @return
	 */
	public static double getAngleTolerance() {
		return angleTolerance;
	}

	/**
	 * Set the maximum angle, in radians, between two axes for them to be considered equal.
	 * Negative values are clipped to 0.
	 * @param tolerance
	 */
	public static void setAngleTolerance(double tolerance) {
		angleTolerance = Math.max(0, tolerance);
	}
	
	/**
	 * Get the tolerance used when checking that two scans can be joined, as a fraction of the oscillation width.
	 * @return
	 */
	public static double getOscillationTolerance() {
		return oscillationTolerance;
	}

	/**
	 * Set the tolerance used when checking that two scans can be joined, as a fraction of the oscillation width.
	 * This must be &gt; 0.
	 * @param tolerance
	 * @throws IllegalArgumentException if the tolerance is not positive
	 */
	public static void setOscillationTolerance(double tolerance) {
		if (!(tolerance > 0))
			throw new IllegalArgumentException("Oscillation tolerance must be > 0, but was " + tolerance);
		oscillationTolerance = tolerance;
	}
	
	/**
	 * Reset all preferences to their defaults, ignoring system properties.
	 */
	public static void resetToDefaults() {
		angleTolerance = DEFAULT_ANGLE_TOLERANCE;
		oscillationTolerance = DEFAULT_OSCILLATION_TOLERANCE;
	}
	
	private static double readDouble(String key, double defaultValue) {
		String value = System.getProperty(key);
		if (value == null || value.isBlank())
			return defaultValue;
		try {
			return Double.parseDouble(value.trim());
		} catch (NumberFormatException e) {
			logger.warn("Unable to parse {}={}, will use default {}", key, value, defaultValue);
			return defaultValue;
		}
	}

}
