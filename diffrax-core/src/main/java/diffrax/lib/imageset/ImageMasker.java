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

import java.io.IOException;

import diffrax.lib.images.BooleanImageTile;
import diffrax.lib.images.TiledImage;

/**
 * Provides dynamic masks that may change from image to image (e.g. shadows cast by moving hardware).
 */
public interface ImageMasker {
	
	/**
	 * Get the number of images for which masks can be requested.
	 * @return
	 */
	public int size();
	
	/**
	 * Get the dynamic mask for an image, where true indicates a valid pixel.
	 * @param index physical image index
	 * @return the mask with one tile per detector panel, or {@link TiledImage#empty()} if there is no dynamic mask
	 * @throws IOException if the mask could not be read
	 */
	public TiledImage<BooleanImageTile> getMask(int index) throws IOException;

}
