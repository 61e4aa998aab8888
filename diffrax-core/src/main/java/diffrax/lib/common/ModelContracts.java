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

/**
 * Static checks that throw a {@link ModelContractException} when a condition does not hold.
 */
public final class ModelContracts {
	
	// Suppress default constructor for non-instantiability
	private ModelContracts() {
		throw new AssertionError();
	}
	
	/**
	 * Check that a condition is true.
	 * @param condition the condition to test
	 * @param message message (a {@link String#format(String, Object...)} pattern) used if the condition is false
	 * @param args arguments for the message
	 * @throws ModelContractException if the condition is false
	 */
	public static void check(boolean condition, String message, Object... args) throws ModelContractException {
		if (!condition)
			throw new ModelContractException(args.length == 0 ? message : String.format(message, args));
	}
	
	/**
	 * Check that an index is within the range {@code 0 <= index < size}.
	 * @param index
	 * @param size
	 * @param name name of the indexed quantity, used in the error message
	 * @return the index
	 * @throws ModelContractException if the index is out of range
	 */
	public static int checkIndex(int index, int size, String name) throws ModelContractException {
		if (index < 0 || index >= size)
			throw new ModelContractException(String.format("%s index %d out of range (size %d)", name, index, size));
		return index;
	}
	
	/**
	 * Dereference a value that must be present.
	 * @param <T>
	 * @param value
	 * @param name name of the value, used in the error message
	 * @return the value, if it is not null
	 * @throws ModelContractException if the value is null
	 */
	public static <T> T checkPresent(T value, String name) throws ModelContractException {
		if (value == null)
			throw new ModelContractException(name + " is not set");
		return value;
	}
	
	/**
	 * Create a {@link ModelContractException} for an operation that is never permitted.
	 * Callers should throw the result, i.e. {@code throw ModelContracts.fail(...)}.
	 * @param message
	 * @return the exception
	 */
	public static ModelContractException fail(String message) {
		return new ModelContractException(message);
	}

}
