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
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.primitives.Ints;

import diffrax.lib.common.ModelContracts;
import diffrax.lib.images.BooleanImageTile;
import diffrax.lib.images.DoubleImageTile;
import diffrax.lib.images.NumericImageTile;
import diffrax.lib.images.TiledImage;
import diffrax.lib.images.TiledImages;
import diffrax.lib.model.Beam;
import diffrax.lib.model.Detector;
import diffrax.lib.model.Goniometer;
import diffrax.lib.model.Panel;
import diffrax.lib.model.Scan;

/**
 * An ordered view of images from an {@link ImageSetData}.
 * <p>
 * Images are requested by their <i>logical</i> index within this set, which is mapped to a <i>physical</i> index
 * within the underlying data. Several image sets may share the same data, and each may use a different subset
 * or ordering of the physical images.
 * <p>
 * Besides access to the instrument models for each image, an image set provides the corrected pixel values
 * (raw values with the pedestal subtracted and divided by the gain) and a mask combining the trusted range
 * of each panel with the dynamic and static masks.
 * <p>
 * The most recently read raw image is cached. Image sets are not thread-safe.
 */
public class ImageSet {

	private static final Logger logger = LoggerFactory.getLogger(ImageSet.class);

	/**
	 * The shared image data.
	 */
	protected final ImageSetData data;

	/**
	 * The physical index of each image in this set.
	 */
	protected final int[] indices;

	private int cacheIndex = -1;
	private TiledImage<? extends NumericImageTile> cacheImage;

	/**
	 * Create an image set containing every image in the data, in order.
	 * @param data
	 */
	public ImageSet(ImageSetData data) {
		this.data = Objects.requireNonNull(data, "ImageSet needs image set data");
		this.indices = new int[data.size()];
		for (int i = 0; i < indices.length; i++)
			indices[i] = i;
	}

	/**
	 * Create an image set containing the specified images.
	 * @param data
	 * @param indices physical indices of the images to include; each must be less than {@code data.size()}
	 * @throws diffrax.lib.common.ModelContractException if any index is out of range
	 */
	public ImageSet(ImageSetData data, int[] indices) {
		this.data = Objects.requireNonNull(data, "ImageSet needs image set data");
		this.indices = indices.clone();
		if (indices.length > 0) {
			ModelContracts.check(Ints.min(indices) >= 0, "Image indices must not be negative");
			ModelContracts.check(Ints.max(indices) < data.size(),
					"Image index %d out of range (data size %d)", Ints.max(indices), data.size());
		}
	}

	/**
	 * Get the kind of image set.
	 * @return
	 */
	public ImageSetType getImageSetType() {
		return ImageSetType.PLAIN;
	}

	/**
	 * Get the shared image data.
	 * @return
	 */
	public ImageSetData getData() {
		return data;
	}

	/**
	 * Get the physical index of each image in this set.
	 * @return a copy of the indices
	 */
	public int[] getIndices() {
		return indices.clone();
	}

	/**
	 * Get the number of images in this set.
	 * @return
	 */
	public int size() {
		return indices.length;
	}

	/**
	 * Get the external lookup. This is shared by all image sets with the same data.
	 * @return
	 */
	public ExternalLookup getExternalLookup() {
		return data.getExternalLookup();
	}

	/**
	 * Get the raw pixels for an image.
	 * <p>
	 * The last image read is cached, so that requesting the same index repeatedly does not require it to be read again.
	 *
	 * @param index logical image index
	 * @return
	 * @throws IOException if the image could not be read
	 */
	public TiledImage<? extends NumericImageTile> getRawData(int index) throws IOException {
		checkIndex(index);
		if (cacheIndex == index) {
			logger.trace("Returning cached image {}", index);
			return cacheImage;
		}
		var image = data.getData(indices[index]);
		cacheIndex = index;
		cacheImage = image;
		return image;
	}

	/**
	 * Get the corrected pixels for an image, computed as {@code (raw - pedestal) / gain}.
	 * <p>
	 * The pedestal and gain are only applied if they are available; otherwise the raw values are returned
	 * as doubles. When they are available, they must have the same tile count and tile shapes as the raw image.
	 *
	 * @param index logical image index
	 * @return
	 * @throws IOException if the image could not be read
	 * @throws diffrax.lib.common.ModelContractException if the gain or pedestal do not match the image, or a gain value is not positive
	 */
	public TiledImage<DoubleImageTile> getCorrectedData(int index) throws IOException {
		var result = TiledImages.toDouble(getRawData(index));
		var gain = getGain(index);
		var pedestal = getPedestal(index);
		if (!gain.isEmpty())
			TiledImages.checkSameShape(result, gain, "gain");
		if (!pedestal.isEmpty())
			TiledImages.checkSameShape(result, pedestal, "pedestal");

		for (int i = 0; i < result.nTiles(); i++) {
			// Arrays of the converted image are copies, so can be updated in place
			double[] c = result.getTile(i).getArray(true);
			if (!pedestal.isEmpty()) {
				double[] p = pedestal.getTile(i).getArray(true);
				for (int j = 0; j < c.length; j++)
					c[j] -= p[j];
			}
			if (!gain.isEmpty()) {
				double[] g = gain.getTile(i).getArray(true);
				for (int j = 0; j < c.length; j++) {
					ModelContracts.check(g[j] > 0, "Gain must be > 0, but found %s in tile %d", g[j], i);
					c[j] /= g[j];
				}
			}
		}
		return result;
	}

	/**
	 * Get the gain map.
	 * <p>
	 * If the external lookup has no gain map, an attempt is made to create one from the gain of each panel
	 * of the image's detector. This is only possible if every panel has a gain &gt; 0. If successful, the
	 * gain map is stored in the external lookup, and therefore used for every image with the same data.
	 * Otherwise, the gain map remains empty and no gain correction is applied.
	 *
	 * @param index logical image index
	 * @return the gain map, or an empty image if none is available
	 * @throws diffrax.lib.common.ModelContractException if a gain map is needed but the image has no detector
	 */
	public TiledImage<DoubleImageTile> getGain(int index) {
		var gainItem = getExternalLookup().getGain();
		if (gainItem.isEmpty()) {
			Detector detector = ModelContracts.checkPresent(getDetectorForImage(index), "Detector for image " + index);
			boolean useDetectorGain = true;
			for (Panel panel : detector) {
				if (panel.getGain() <= 0) {
					useDetectorGain = false;
					break;
				}
			}
			if (useDetectorGain) {
				List<DoubleImageTile> tiles = new ArrayList<>(detector.size());
				for (Panel panel : detector) {
					int[] size = panel.getImageSize();
					tiles.add(TiledImages.createFilledTile(size[0], size[1], panel.getGain()));
				}
				logger.debug("Creating gain map from the gains of {} panel(s)", tiles.size());
				gainItem.setFilename("");
				gainItem.setData(TiledImage.of(tiles));
			} else if (data.markGainWarningLogged()) {
				logger.warn("Detector panel gains are not all > 0, gain correction will not be applied");
			}
		}
		return gainItem.getData();
	}

	/**
	 * Get the pedestal.
	 * @param index logical image index
	 * @return the pedestal from the external lookup, or an empty image if none is available
	 */
	public TiledImage<DoubleImageTile> getPedestal(int index) {
		return getExternalLookup().getPedestal().getData();
	}

	/**
	 * Compute the mask for an image, where true indicates a valid pixel.
	 * <p>
	 * This starts from the trusted range of each panel, applied to the raw pixel values.
	 * It is then combined with the dynamic mask for the image and the static mask from the external lookup,
	 * if these are available.
	 *
	 * @param index logical image index
	 * @return
	 * @throws IOException if the image or dynamic mask could not be read
	 * @throws diffrax.lib.common.ModelContractException if the image has no detector, or the image and masks do not match the detector panels
	 */
	public TiledImage<BooleanImageTile> getMask(int index) throws IOException {
		var raw = getRawData(index);
		Detector detector = ModelContracts.checkPresent(getDetectorForImage(index), "Detector for image " + index);
		ModelContracts.check(raw.nTiles() == detector.size(),
				"Image has %d tiles, but detector has %d panels", raw.nTiles(), detector.size());
		List<BooleanImageTile> tiles = new ArrayList<>(detector.size());
		for (int i = 0; i < detector.size(); i++)
			tiles.add(detector.getPanel(i).getTrustedRangeMask(raw.getTile(i)));
		TiledImage<BooleanImageTile> mask = TiledImage.of(tiles);

		var dynamicMask = data.getMask(indices[index]);
		if (!dynamicMask.isEmpty()) {
			TiledImages.checkSameShape(mask, dynamicMask, "dynamic mask");
			mask = TiledImages.and(mask, dynamicMask);
		}

		var externalMask = getExternalLookup().getMask().getData();
		if (!externalMask.isEmpty()) {
			TiledImages.checkSameShape(mask, externalMask, "external mask");
			mask = TiledImages.and(mask, externalMask);
		}
		return mask;
	}

	/**
	 * Get a property of the image data.
	 * @param name
	 * @return
	 * @see ImageSetData#getProperty(String)
	 */
	public String getProperty(String name) {
		return data.getProperty(name);
	}

	/**
	 * Set a property of the image data.
	 * @param name
	 * @param value
	 */
	public void setProperty(String name, String value) {
		data.setProperty(name, value);
	}

	/**
	 * Get the beam for an image.
	 * @param index logical image index
	 * @return the beam, or null if none is set
	 */
	public Beam getBeamForImage(int index) {
		return data.getBeam(indices[checkIndex(index)]);
	}

	/**
	 * Get the detector for an image.
	 * @param index logical image index
	 * @return the detector, or null if none is set
	 */
	public Detector getDetectorForImage(int index) {
		return data.getDetector(indices[checkIndex(index)]);
	}

	/**
	 * Get the goniometer for an image.
	 * @param index logical image index
	 * @return the goniometer, or null if none is set
	 */
	public Goniometer getGoniometerForImage(int index) {
		return data.getGoniometer(indices[checkIndex(index)]);
	}

	/**
	 * Get the scan for an image.
	 * @param index logical image index
	 * @return the scan, or null if none is set
	 */
	public Scan getScanForImage(int index) {
		return data.getScan(indices[checkIndex(index)]);
	}

	/**
	 * Set the beam for an image.
	 * @param index logical image index
	 * @param beam
	 */
	public void setBeamForImage(int index, Beam beam) {
		data.setBeam(indices[checkIndex(index)], beam);
	}

	/**
	 * Set the detector for an image.
	 * @param index logical image index
	 * @param detector
	 */
	public void setDetectorForImage(int index, Detector detector) {
		data.setDetector(indices[checkIndex(index)], detector);
	}

	/**
	 * Set the goniometer for an image.
	 * @param index logical image index
	 * @param goniometer
	 */
	public void setGoniometerForImage(int index, Goniometer goniometer) {
		data.setGoniometer(indices[checkIndex(index)], goniometer);
	}

	/**
	 * Set the scan for an image.
	 * @param index logical image index
	 * @param scan a scan containing exactly one image, or null
	 */
	public void setScanForImage(int index, Scan scan) {
		ModelContracts.check(scan == null || scan.getNumImages() == 1,
				"Scan for a single image must contain 1 image, but has %d", scan == null ? 0 : scan.getNumImages());
		data.setScan(indices[checkIndex(index)], scan);
	}

	/**
	 * Get the path for an image.
	 * If all images are stored in a single file, the path of that file is returned for every image.
	 * @param index logical image index
	 * @return
	 */
	public String getPath(int index) {
		checkIndex(index);
		if (data.hasSingleFileReader())
			return data.getMasterPath();
		return data.getPath(indices[index]);
	}

	/**
	 * Get the path of the first image in the underlying data.
	 * @return
	 */
	public String getMasterPath() {
		return data.getMasterPath();
	}

	/**
	 * Get the identifier for an image.
	 * @param index logical image index
	 * @return
	 */
	public String getImageIdentifier(int index) {
		return data.getImageIdentifier(indices[checkIndex(index)]);
	}

	/**
	 * Get this set as a plain {@link ImageSet}.
	 * @return this image set
	 */
	public ImageSet asImageSet() {
		return this;
	}

	/**
	 * Get an image set containing every image of the underlying data, not only those in this set.
	 * @return
	 */
	public ImageSet completeSet() {
		return new ImageSet(data);
	}

	/**
	 * Get an image set containing a contiguous range of the images in this set.
	 * The new set shares the same data.
	 *
	 * @param first first logical index (inclusive)
	 * @param last last logical index (exclusive)
	 * @return
	 */
	public ImageSet partialSet(int first, int last) {
		checkRange(first, last);
		return new ImageSet(data, Arrays.copyOfRange(indices, first, last));
	}

	/**
	 * Check that a logical index is valid.
	 * @param index
	 * @return the index
	 */
	protected int checkIndex(int index) {
		return ModelContracts.checkIndex(index, indices.length, "Image");
	}

	/**
	 * Check that {@code [first, last)} is a non-empty range of logical indices.
	 * @param first
	 * @param last
	 */
	protected void checkRange(int first, int last) {
		ModelContracts.check(last > first, "Invalid range [%d, %d): last must be greater than first", first, last);
		ModelContracts.check(first >= 0 && last <= indices.length,
				"Range [%d, %d) out of bounds for %d images", first, last, indices.length);
	}

	/**
	 * Image sets are equal if they contain the same number of images, and each image has the same path.
	 */
	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof ImageSet))
			return false;
		ImageSet other = (ImageSet)obj;
		if (size() != other.size())
			return false;
		for (int i = 0; i < size(); i++) {
			if (!Objects.equals(getPath(i), other.getPath(i)))
				return false;
		}
		return true;
	}

	@Override
	public int hashCode() {
		int result = size();
		for (int i = 0; i < size(); i++)
			result = 31 * result + Objects.hashCode(getPath(i));
		return result;
	}

	@Override
	public String toString() {
		return getImageSetType() + " (" + size() + " images)";
	}

}
