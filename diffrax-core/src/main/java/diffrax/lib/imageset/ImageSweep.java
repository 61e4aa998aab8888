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

import java.util.Arrays;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import diffrax.lib.common.ModelContracts;
import diffrax.lib.model.Beam;
import diffrax.lib.model.Detector;
import diffrax.lib.model.Goniometer;
import diffrax.lib.model.Scan;

/**
 * An image set representing a rotation sweep: a contiguous series of images recorded with the same
 * beam, detector and goniometer, described by a single scan.
 * <p>
 * The models are copied on construction, and the copies are shared by every image in the sweep.
 * Each image is given its own single-image scan taken from the sweep scan.
 * Models can only be changed for the whole sweep at once, using {@link #setBeam(Beam)} and related methods;
 * setting a model for an individual image is not permitted.
 */
public class ImageSweep extends ImageSet {

	private static final Logger logger = LoggerFactory.getLogger(ImageSweep.class);

	private Beam beam;
	private Detector detector;
	private Goniometer goniometer;
	private Scan scan;

	/**
	 * Create a sweep containing every image in the data.
	 * @param data
	 * @param beam
	 * @param detector
	 * @param goniometer
	 * @param scan the scan, which must contain one image for each image in the data
	 * @throws diffrax.lib.common.ModelContractException if the scan does not match the number of images
	 */
	public ImageSweep(ImageSetData data, Beam beam, Detector detector, Goniometer goniometer, Scan scan) {
		super(data);
		Objects.requireNonNull(scan, "Scan must not be null");
		ModelContracts.check(data.size() == scan.getNumImages(),
				"Scan has %d images, but data has %d", scan.getNumImages(), data.size());
		initialize(beam, detector, goniometer, scan);
	}

	/**
	 * Create a sweep containing the specified images.
	 * @param data
	 * @param indices physical image indices; these must be consecutive and increasing
	 * @param beam
	 * @param detector
	 * @param goniometer
	 * @param scan the scan, which must contain one image for each index
	 * @throws diffrax.lib.common.ModelContractException if the scan does not match the number of images, or the indices are not consecutive
	 */
	public ImageSweep(ImageSetData data, int[] indices, Beam beam, Detector detector, Goniometer goniometer, Scan scan) {
		super(data, indices);
		Objects.requireNonNull(scan, "Scan must not be null");
		ModelContracts.check(indices.length == scan.getNumImages(),
				"Scan has %d images, but %d indices were provided", scan.getNumImages(), indices.length);
		for (int i = 1; i < indices.length; i++) {
			ModelContracts.check(indices[i] == indices[i-1] + 1,
					"Sweep indices must be consecutive, but found %d after %d", indices[i], indices[i-1]);
		}
		initialize(beam, detector, goniometer, scan);
	}

	private void initialize(Beam beam, Detector detector, Goniometer goniometer, Scan scan) {
		this.beam = new Beam(Objects.requireNonNull(beam, "Beam must not be null"));
		this.detector = new Detector(Objects.requireNonNull(detector, "Detector must not be null"));
		this.goniometer = new Goniometer(Objects.requireNonNull(goniometer, "Goniometer must not be null"));
		this.scan = new Scan(scan);
		for (int i = 0; i < size(); i++) {
			super.setBeamForImage(i, this.beam);
			super.setDetectorForImage(i, this.detector);
			super.setGoniometerForImage(i, this.goniometer);
			super.setScanForImage(i, scan.getImage(i));
		}
		logger.debug("Set models for {} images in sweep", size());
	}

	@Override
	public ImageSetType getImageSetType() {
		return ImageSetType.SWEEP;
	}

	/**
	 * Get the range of the sweep scan as 0-based array indices.
	 * @return
	 * @see Scan#getArrayRange()
	 */
	public int[] getArrayRange() {
		return ModelContracts.checkPresent(scan, "Scan").getArrayRange();
	}

	/**
	 * Get the beam shared by all images.
	 * @return
	 */
	public Beam getBeam() {
		return beam;
	}

	/**
	 * Get the detector shared by all images.
	 * @return
	 */
	public Detector getDetector() {
		return detector;
	}

	/**
	 * Get the goniometer shared by all images.
	 * @return
	 */
	public Goniometer getGoniometer() {
		return goniometer;
	}

	/**
	 * Get the scan for the whole sweep.
	 * @return
	 */
	public Scan getScan() {
		return scan;
	}

	/**
	 * Set the beam for every image in the sweep. The beam is copied.
	 * @param beam
	 */
	public void setBeam(Beam beam) {
		this.beam = new Beam(beam);
		for (int i = 0; i < size(); i++)
			super.setBeamForImage(i, this.beam);
	}

	/**
	 * Set the detector for every image in the sweep. The detector is copied.
	 * @param detector
	 */
	public void setDetector(Detector detector) {
		this.detector = new Detector(detector);
		for (int i = 0; i < size(); i++)
			super.setDetectorForImage(i, this.detector);
	}

	/**
	 * Set the goniometer for every image in the sweep. The goniometer is copied.
	 * @param goniometer
	 */
	public void setGoniometer(Goniometer goniometer) {
		this.goniometer = new Goniometer(goniometer);
		for (int i = 0; i < size(); i++)
			super.setGoniometerForImage(i, this.goniometer);
	}

	/**
	 * Set the scan for the sweep, and a single-image scan for each image.
	 * @param scan a scan with one image for each image in the sweep
	 */
	public void setScan(Scan scan) {
		ModelContracts.check(scan.getNumImages() == size(),
				"Scan has %d images, but sweep has %d", scan.getNumImages(), size());
		this.scan = new Scan(scan);
		for (int i = 0; i < size(); i++)
			super.setScanForImage(i, scan.getImage(i));
	}

	/**
	 * Not supported for sweeps.
	 * @throws diffrax.lib.common.ModelContractException always
	 */
	@Override
	public void setBeamForImage(int index, Beam beam) {
		throw ModelContracts.fail("Cannot set per-image model in sweep");
	}

	/**
	 * Not supported for sweeps.
	 * @throws diffrax.lib.common.ModelContractException always
	 */
	@Override
	public void setDetectorForImage(int index, Detector detector) {
		throw ModelContracts.fail("Cannot set per-image model in sweep");
	}

	/**
	 * Not supported for sweeps.
	 * @throws diffrax.lib.common.ModelContractException always
	 */
	@Override
	public void setGoniometerForImage(int index, Goniometer goniometer) {
		throw ModelContracts.fail("Cannot set per-image model in sweep");
	}

	/**
	 * Not supported for sweeps.
	 * @throws diffrax.lib.common.ModelContractException always
	 */
	@Override
	public void setScanForImage(int index, Scan scan) {
		throw ModelContracts.fail("Cannot set per-image model in sweep");
	}

	/**
	 * Get a plain image set with the same images, without the shared models.
	 */
	@Override
	public ImageSet asImageSet() {
		return new ImageSet(data, indices);
	}

	/**
	 * Not supported for sweeps, see {@link #completeSweep()}.
	 * @throws diffrax.lib.common.ModelContractException always
	 */
	@Override
	public ImageSet completeSet() {
		throw ModelContracts.fail("Cannot get complete set from image sweep");
	}

	/**
	 * Not supported for sweeps, see {@link #partialSweep(int, int)}.
	 * @throws diffrax.lib.common.ModelContractException always
	 */
	@Override
	public ImageSet partialSet(int first, int last) {
		throw ModelContracts.fail("Cannot get partial set from image sweep");
	}

	/**
	 * Get a sweep containing every image of the underlying data.
	 * The scan is created by joining the scans for each image, in order.
	 * @return
	 * @throws diffrax.lib.common.ModelContractException if any image has no scan, or the scans cannot be joined
	 */
	public ImageSweep completeSweep() {
		Scan merged = new Scan(ModelContracts.checkPresent(data.getScan(0), "Scan for image 0"));
		for (int i = 1; i < data.size(); i++)
			merged.append(ModelContracts.checkPresent(data.getScan(i), "Scan for image " + i));
		return new ImageSweep(data, beam, detector, goniometer, merged);
	}

	/**
	 * Get a sweep containing a contiguous range of the images in this sweep.
	 * The scan is created by joining the scans for each image in the range.
	 * @param first first logical index (inclusive)
	 * @param last last logical index (exclusive)
	 * @return
	 */
	public ImageSweep partialSweep(int first, int last) {
		checkRange(first, last);
		Scan merged = new Scan(ModelContracts.checkPresent(getScanForImage(first), "Scan for image " + first));
		for (int i = first + 1; i < last; i++)
			merged.append(ModelContracts.checkPresent(getScanForImage(i), "Scan for image " + i));
		return new ImageSweep(data, Arrays.copyOfRange(indices, first, last), beam, detector, goniometer, merged);
	}

}
