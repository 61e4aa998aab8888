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

import diffrax.lib.common.ModelContracts;
import diffrax.lib.geom.ImmutableDimension;

/**
 * An image set where the images are arranged on a regular 2D grid, for example from a grid scan
 * across a sample.
 * <p>
 * The grid shape is fixed at construction, and must contain exactly one cell per image.
 */
public class ImageGrid extends ImageSet {

	private final ImmutableDimension gridSize;

	/**
	 * Create a grid containing every image in the data.
	 * @param data
	 * @param gridSize
	 * @throws diffrax.lib.common.ModelContractException if the grid does not have one cell per image
	 */
	public ImageGrid(ImageSetData data, ImmutableDimension gridSize) {
		super(data);
		this.gridSize = checkGridSize(gridSize);
	}

	/**
	 * Create a grid containing the specified images.
	 * @param data
	 * @param indices physical image indices, in grid order
	 * @param gridSize
	 * @throws diffrax.lib.common.ModelContractException if the grid does not have one cell per image
	 */
	public ImageGrid(ImageSetData data, int[] indices, ImmutableDimension gridSize) {
		super(data, indices);
		this.gridSize = checkGridSize(gridSize);
	}

	/**
	 * Create a grid containing the same images as an existing image set.
	 * @param imageSet
	 * @param gridSize
	 * @return
	 */
	public static ImageGrid fromImageSet(ImageSet imageSet, ImmutableDimension gridSize) {
		return new ImageGrid(imageSet.getData(), imageSet.getIndices(), gridSize);
	}

	private ImmutableDimension checkGridSize(ImmutableDimension gridSize) {
		Objects.requireNonNull(gridSize, "Grid size must not be null");
		ModelContracts.check(gridSize.getWidth() > 0 && gridSize.getHeight() > 0,
				"Grid size must be > 0, but was %d x %d", gridSize.getWidth(), gridSize.getHeight());
		ModelContracts.check(gridSize.getArea() == size(),
				"Grid size %d x %d does not match the number of images (%d)",
				gridSize.getWidth(), gridSize.getHeight(), size());
		return gridSize;
	}

	/**
	 * Get the grid shape.
	 * @return
	 */
	public ImmutableDimension getGridSize() {
		return gridSize;
	}

	@Override
	public ImageSetType getImageSetType() {
		return ImageSetType.GRID;
	}

	/**
	 * Get a plain image set with the same images, but without the grid shape.
	 */
	@Override
	public ImageSet asImageSet() {
		return new ImageSet(data, indices);
	}

	/**
	 * Not supported for grids.
	 * @throws diffrax.lib.common.ModelContractException always
	 */
	@Override
	public ImageSet completeSet() {
		throw ModelContracts.fail("Cannot get complete set from image grid");
	}

	/**
	 * Not supported for grids.
	 * @throws diffrax.lib.common.ModelContractException always
	 */
	@Override
	public ImageSet partialSet(int first, int last) {
		throw ModelContracts.fail("Cannot get partial set from image grid");
	}

	@Override
	public String toString() {
		return getImageSetType() + " (" + gridSize.getWidth() + " x " + gridSize.getHeight() + " images)";
	}

}
