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
import java.util.ArrayList;
import java.util.List;

import diffrax.lib.images.IntImageTile;
import diffrax.lib.images.NumericImageTile;
import diffrax.lib.images.TiledImage;

/**
 * Reader for images held in memory, which keeps count of the number of reads.
 */
class InMemoryImageReader implements ImageReader {
	
	private final List<TiledImage<? extends NumericImageTile>> images;
	private final boolean singleFile;
	private int readCount = 0;
	
	InMemoryImageReader(List<TiledImage<? extends NumericImageTile>> images, boolean singleFile) {
		this.images = new ArrayList<>(images);
		this.singleFile = singleFile;
	}
	
	/**
	 * Create a reader for images containing a single tile.
	 * Pixel {@code j} of image {@code i} has the value {@code i * 100 + j}.
	 */
	static InMemoryImageReader create(int nImages, int width, int height, boolean singleFile) {
		List<TiledImage<? extends NumericImageTile>> images = new ArrayList<>();
		for (int i = 0; i < nImages; i++) {
			int[] values = new int[width * height];
			for (int j = 0; j < values.length; j++)
				values[j] = i * 100 + j;
			images.add(TiledImage.of(new IntImageTile(values, width, height)));
		}
		return new InMemoryImageReader(images, singleFile);
	}
	
	int getReadCount() {
		return readCount;
	}

	@Override
	public int size() {
		return images.size();
	}

	@Override
	public TiledImage<? extends NumericImageTile> read(int index) throws IOException {
		if (index < 0 || index >= images.size())
			throw new IOException("No image at index " + index);
		readCount++;
		return images.get(index);
	}

	@Override
	public boolean isSingleFileReader() {
		return singleFile;
	}

	@Override
	public String getPath(int index) {
		if (singleFile)
			return "/data/master.h5";
		return String.format("/data/image_%05d.cbf", index + 1);
	}

	@Override
	public String getImageIdentifier(int index) {
		if (singleFile)
			return getPath(index) + "#" + index;
		return getPath(index);
	}

}
