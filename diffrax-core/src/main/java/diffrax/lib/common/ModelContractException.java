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
 * Unchecked exception thrown when a precondition of the instrument or image set models is violated.
 * <p>
 * Examples include out-of-range image indices, tiles with mismatched shapes, non-positive gains, 
 * singular panel frames and operations that a specialized image set does not support.
 * These represent programming errors: callers are expected to validate their input rather than 
 * catch this exception. Data that is simply absent (e.g. an empty mask) is never reported this way.
 */
public class ModelContractException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	/**
	 * Constructor with a message.
	 * @param message
	 */
	public ModelContractException(String message) {
		super(message);
	}

	/**
	 * Constructor with a message and cause.
	 * @param message
	 * @param cause
	 */
	public ModelContractException(String message, Throwable cause) {
		super(message, cause);
	}

}
