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

package diffrax.lib.model;

import java.util.Arrays;

import diffrax.lib.common.GeneralTools;
import diffrax.lib.common.ModelContracts;
import diffrax.lib.common.Prefs;

/**
 * A rotation scan, covering a contiguous range of images.
 * <p>
 * Image numbers are 1-based and the image range is inclusive, so a scan of images {@code [1, 10]}
 * contains 10 images. The oscillation is stored as a starting angle and a width per image, both in degrees.
 * Each image also has an exposure time and an epoch (the time at which it was recorded).
 * <p>
 * A scan with multiple images can be split into single-image scans with {@link #getImage(int)},
 * and consecutive scans can be joined with {@link #append(Scan)}.
 */
public class Scan {

	private static final double EPS = 1e-7;

	private int[] imageRange;
	private double[] oscillation;
	private double[] exposureTimes;
	private double[] epochs;
	private int batchOffset;

	/**
	 * Create a scan with all exposure times and epochs set to zero.
	 * @param firstImage first image number (inclusive)
	 * @param lastImage last image number (inclusive)
	 * @param oscillationStart starting angle, in degrees
	 * @param oscillationWidth angular width of each image, in degrees
	 */
	public Scan(int firstImage, int lastImage, double oscillationStart, double oscillationWidth) {
		this(firstImage, lastImage, oscillationStart, oscillationWidth,
				new double[Math.max(0, lastImage - firstImage + 1)],
				new double[Math.max(0, lastImage - firstImage + 1)]);
	}

	/**
	 * Create a scan.
	 * @param firstImage first image number (inclusive)
	 * @param lastImage last image number (inclusive)
	 * @param oscillationStart starting angle, in degrees
	 * @param oscillationWidth angular width of each image, in degrees
	 * @param exposureTimes exposure time for each image
	 * @param epochs epoch for each image
	 */
	public Scan(int firstImage, int lastImage, double oscillationStart, double oscillationWidth,
			double[] exposureTimes, double[] epochs) {
		this(firstImage, lastImage, oscillationStart, oscillationWidth, exposureTimes, epochs, 0);
	}

	/**
	 * Create a scan with a batch offset.
	 * @param firstImage first image number (inclusive)
	 * @param lastImage last image number (inclusive)
	 * @param oscillationStart starting angle, in degrees
	 * @param oscillationWidth angular width of each image, in degrees
	 * @param exposureTimes exposure time for each image
	 * @param epochs epoch for each image
	 * @param batchOffset
	 */
	public Scan(int firstImage, int lastImage, double oscillationStart, double oscillationWidth,
			double[] exposureTimes, double[] epochs, int batchOffset) {
		ModelContracts.check(firstImage <= lastImage, "Invalid image range [%d, %d]", firstImage, lastImage);
		int n = lastImage - firstImage + 1;
		ModelContracts.check(exposureTimes.length == n, "Expected %d exposure times, but found %d", n, exposureTimes.length);
		ModelContracts.check(epochs.length == n, "Expected %d epochs, but found %d", n, epochs.length);
		this.imageRange = new int[] {firstImage, lastImage};
		this.oscillation = new double[] {oscillationStart, oscillationWidth};
		this.exposureTimes = exposureTimes.clone();
		this.epochs = epochs.clone();
		this.batchOffset = batchOffset;
	}

	/**
	 * Copy constructor.
	 * @param scan
	 */
	public Scan(Scan scan) {
		this.imageRange = scan.imageRange.clone();
		this.oscillation = scan.oscillation.clone();
		this.exposureTimes = scan.exposureTimes.clone();
		this.epochs = scan.epochs.clone();
		this.batchOffset = scan.batchOffset;
	}

	/**
	 * Get the first and last image numbers (both inclusive).
	 * @return
	 */
	public int[] getImageRange() {
		return imageRange.clone();
	}

	/**
	 * Get the image range as 0-based array indices, where the first is inclusive and the last exclusive.
	 * @return
	 */
	public int[] getArrayRange() {
		return new int[] {imageRange[0] - 1, imageRange[1]};
	}

	/**
	 * Get the number of images in the scan.
	 * @return
	 */
	public int getNumImages() {
		return imageRange[1] - imageRange[0] + 1;
	}

	/**
	 * Get the batch offset.
	 * @return
	 */
	public int getBatchOffset() {
		return batchOffset;
	}

	/**
	 * Set the batch offset.
	 * @param batchOffset
	 */
	public void setBatchOffset(int batchOffset) {
		this.batchOffset = batchOffset;
	}

	/**
	 * Get the starting angle and the width of each image, in degrees.
	 * @return
	 */
	public double[] getOscillation() {
		return oscillation.clone();
	}

	/**
	 * Get the angles at the start and end of the scan, in degrees.
	 * @return
	 */
	public double[] getOscillationRange() {
		return new double[] {
				oscillation[0],
				oscillation[0] + oscillation[1] * getNumImages()
		};
	}

	/**
	 * Get the starting angle and width for a single image.
	 * @param imageNumber the image number, within the image range
	 * @return
	 */
	public double[] getImageOscillation(int imageNumber) {
		return new double[] {
				oscillation[0] + (imageNumber - imageRange[0]) * oscillation[1],
				oscillation[1]
		};
	}

	/**
	 * Get the exposure time for a single image.
	 * @param imageNumber the image number, within the image range
	 * @return
	 */
	public double getImageExposureTime(int imageNumber) {
		return exposureTimes[checkImageNumber(imageNumber) - imageRange[0]];
	}

	/**
	 * Get the epoch for a single image.
	 * @param imageNumber the image number, within the image range
	 * @return
	 */
	public double getImageEpoch(int imageNumber) {
		return epochs[checkImageNumber(imageNumber) - imageRange[0]];
	}

	/**
	 * Get the exposure times for all images.
	 * @return
	 */
	public double[] getExposureTimes() {
		return exposureTimes.clone();
	}

	/**
	 * Get the epochs for all images.
	 * @return
	 */
	public double[] getEpochs() {
		return epochs.clone();
	}

	/**
	 * Returns true if the image number falls within the image range.
	 * @param imageNumber
	 * @return
	 */
	public boolean isImageNumberValid(int imageNumber) {
		return imageRange[0] <= imageNumber && imageNumber <= imageRange[1];
	}

	/**
	 * Get a scan containing only a single image.
	 * @param index 0-based offset of the image within this scan
	 * @return a new single-image scan
	 * @throws diffrax.lib.common.ModelContractException if the index is out of range
	 */
	public Scan getImage(int index) {
		ModelContracts.checkIndex(index, getNumImages(), "Scan image");
		int imageNumber = imageRange[0] + index;
		double[] osc = getImageOscillation(imageNumber);
		return new Scan(imageNumber, imageNumber, osc[0], osc[1],
				new double[] {getImageExposureTime(imageNumber)},
				new double[] {getImageEpoch(imageNumber)},
				batchOffset);
	}

	/**
	 * Extend this scan with the images of another scan, which must immediately follow it.
	 * <p>
	 * The scans must have the same (non-zero) oscillation width and batch offset, the first image of
	 * {@code other} must follow the last image of this scan, and the oscillation ranges must be contiguous.
	 * Widths and angles are compared using a tolerance of {@link Prefs#getOscillationTolerance()} times the width.
	 *
	 * @param other
	 * @return this scan
	 * @throws diffrax.lib.common.ModelContractException if the scans cannot be joined
	 */
	public Scan append(Scan other) {
		double eps = Prefs.getOscillationTolerance() * Math.abs(oscillation[1]);
		ModelContracts.check(eps > 0, "Cannot join scans with zero oscillation width");
		ModelContracts.check(imageRange[1] + 1 == other.imageRange[0],
				"Cannot join scans: image %d does not follow image %d", other.imageRange[0], imageRange[1]);
		ModelContracts.check(Math.abs(oscillation[1] - other.oscillation[1]) < eps,
				"Cannot join scans with oscillation widths %s and %s", oscillation[1], other.oscillation[1]);
		ModelContracts.check(batchOffset == other.batchOffset,
				"Cannot join scans with batch offsets %d and %d", batchOffset, other.batchOffset);
		ModelContracts.check(Math.abs(getOscillationRange()[1] - other.getOscillationRange()[0]) < eps,
				"Cannot join scans: oscillation ranges are not contiguous (%s and %s)",
				getOscillationRange()[1], other.getOscillationRange()[0]);
		imageRange[1] = other.imageRange[1];
		exposureTimes = concat(exposureTimes, other.exposureTimes);
		epochs = concat(epochs, other.epochs);
		return this;
	}

	private int checkImageNumber(int imageNumber) {
		ModelContracts.check(isImageNumberValid(imageNumber),
				"Image number %d outside scan range [%d, %d]", imageNumber, imageRange[0], imageRange[1]);
		return imageNumber;
	}

	private static double[] concat(double[] a, double[] b) {
		double[] result = Arrays.copyOf(a, a.length + b.length);
		System.arraycopy(b, 0, result, a.length, b.length);
		return result;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		Scan other = (Scan) obj;
		return Arrays.equals(imageRange, other.imageRange)
				&& batchOffset == other.batchOffset
				&& GeneralTools.almostEqual(oscillation, other.oscillation, EPS)
				&& GeneralTools.almostEqual(exposureTimes, other.exposureTimes, EPS)
				&& GeneralTools.almostEqual(epochs, other.epochs, EPS);
	}

	@Override
	public int hashCode() {
		return 31 * (31 * imageRange[0] + imageRange[1]) + batchOffset;
	}

	@Override
	public String toString() {
		return "Scan:\n" +
				"    image range:   (" + imageRange[0] + ", " + imageRange[1] + ")\n" +
				"    oscillation:   " + GeneralTools.arrayToString(oscillation) + "\n" +
				"    batch offset:  " + batchOffset + "\n";
	}

}
