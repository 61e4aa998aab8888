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

package diffrax.lib.imageset;

import diffrax.lib.images.BooleanImageTile;
import diffrax.lib.images.DoubleImageTile;

/**
 * The static mask, gain map and pedestal shared by all images in a collection.
 * <p>
 * Each item is returned by reference, so that it can be updated in place.
 */
public class ExternalLookup {
	
	private final ExternalLookupItem<BooleanImageTile> mask = new ExternalLookupItem<>();
	private final ExternalLookupItem<DoubleImageTile> gain = new ExternalLookupItem<>();
	private final ExternalLookupItem<DoubleImageTile> pedestal = new ExternalLookupItem<>();
	
	/**
	 * Get the static mask, where true indicates a valid pixel.
	 * @return
	 */
	public ExternalLookupItem<BooleanImageTile> getMask() {
		return mask;
	}
	
	/**
	 * Get the gain map.
	 * @return
	 */
	public ExternalLookupItem<DoubleImageTile> getGain() {
		return gain;
	}
	
	/**
	 * Get the pedestal, which is subtracted from raw pixel values.
	 * @return
	 */
	public ExternalLookupItem<DoubleImageTile> getPedestal() {
		return pedestal;
	}

}
