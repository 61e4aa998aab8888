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

import java.util.Objects;

import diffrax.lib.images.ImageTile;
import diffrax.lib.images.TiledImage;

/**
 * An image supplied from outside the image collection (e.g. a mask or gain map), 
 * along with the name of the file it came from.
 * <p>
 * An item that has not been set contains an empty filename and {@link TiledImage#empty()}.
 *
 * @param <T> the tile type
 */
public class ExternalLookupItem<T extends ImageTile> {
	
	private String filename = "";
	private TiledImage<T> data = TiledImage.empty();
	
	/**
	 * Get the filename.
	 * @return the filename, or an empty string if no file is associated with the data
	 */
	public String getFilename() {
		return filename;
	}
	
	/**
	 * Set the filename.
	 * @param filename
	 */
	public void setFilename(String filename) {
		this.filename = filename == null ? "" : filename;
	}
	
	/**
	 * Get the data.
	 * @return the data, or an empty image if none is available
	 */
	public TiledImage<T> getData() {
		return data;
	}
	
	/**
	 * Set the data.
	 * @param data the data, or null to clear it
	 */
	public void setData(TiledImage<T> data) {
		this.data = data == null ? TiledImage.empty() : data;
	}
	
	/**
	 * Returns true if no data is available.
	 * @return
	 */
	public boolean isEmpty() {
		return data.isEmpty();
	}

	@Override
	public String toString() {
		return "ExternalLookupItem [filename=" + filename + ", " + data + "]";
	}

	@Override
	public int hashCode() {
		return Objects.hash(filename, data);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		ExternalLookupItem<?> other = (ExternalLookupItem<?>) obj;
		return filename.equals(other.filename) && data.equals(other.data);
	}

}
