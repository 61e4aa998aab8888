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

import diffrax.lib.images.NumericImageTile;
import diffrax.lib.images.TiledImage;

/**
 * Provides raw images for an {@link ImageSetData}.
 * <p>
 * Implementations handle file decoding and format detection. Images are addressed by their physical 
 * index within the full collection, from 0 to {@code size() - 1}.
 */
public interface ImageReader {
	
	/**
	 * Get the number of images available.
	 * @return
	 */
	public int size();
	
	/**
	 * Read the raw pixels for an image, with one tile per detector panel.
	 * @param index physical image index
	 * @return
	 * @throws IOException if the image could not be read
	 */
	public TiledImage<? extends NumericImageTile> read(int index) throws IOException;
	
	/**
	 * Returns true if all images are stored within a single file (e.g. an HDF5 container), 
	 * false if each image has its own file.
	 * @return
	 */
	public boolean isSingleFileReader();
	
	/**
	 * Get the path to the file containing an image.
	 * @param index physical image index
	 * @return
	 */
	public String getPath(int index);
	
	/**
	 * Get a string that identifies an image, which may include more than the path 
	 * (e.g. the path plus an index within a container).
	 * @param index physical image index
	 * @return
	 */
	public String getImageIdentifier(int index);

}
