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
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import diffrax.lib.common.ModelContracts;
import diffrax.lib.images.BooleanImageTile;
import diffrax.lib.images.NumericImageTile;
import diffrax.lib.images.TiledImage;
import diffrax.lib.model.Beam;
import diffrax.lib.model.Detector;
import diffrax.lib.model.Goniometer;
import diffrax.lib.model.Scan;

/**
 * The data shared by every {@link ImageSet} created for one collection of images.
 * <p>
 * This holds the {@link ImageReader} and {@link ImageMasker} that provide pixels, one slot per physical image
 * for each of the beam, detector, goniometer and scan models, free-form string properties and the
 * {@link ExternalLookup}. Slots may be empty (null), and several slots may refer to the same model instance.
 * <p>
 * Instances are shared rather than copied: changes made through one image set are visible to all others
 * that use the same data. No synchronization is performed.
 */
public class ImageSetData {

	private static final Logger logger = LoggerFactory.getLogger(ImageSetData.class);

	private final ImageReader reader;
	private final ImageMasker masker;

	private final Beam[] beams;
	private final Detector[] detectors;
	private final Goniometer[] goniometers;
	private final Scan[] scans;

	private final Map<String, String> properties = new LinkedHashMap<>();
	private final ExternalLookup externalLookup = new ExternalLookup();

	private boolean gainWarningLogged = false;

	/**
	 * Create the data for a collection of images.
	 * @param reader provides the raw images
	 * @param masker provides the dynamic masks; this must have the same size as the reader
	 * @throws diffrax.lib.common.ModelContractException if the reader and masker sizes differ
	 */
	public ImageSetData(ImageReader reader, ImageMasker masker) {
		this.reader = Objects.requireNonNull(reader, "Reader must not be null");
		this.masker = Objects.requireNonNull(masker, "Masker must not be null");
		int n = reader.size();
		ModelContracts.check(n == masker.size(), "Reader size %d does not match masker size %d", n, masker.size());
		this.beams = new Beam[n];
		this.detectors = new Detector[n];
		this.goniometers = new Goniometer[n];
		this.scans = new Scan[n];
		logger.debug("Created image set data for {} images", n);
	}

	/**
	 * Get the number of physical images.
	 * @return
	 */
	public int size() {
		return reader.size();
	}

	/**
	 * Get the reader.
	 * @return
	 */
	public ImageReader getReader() {
		return reader;
	}

	/**
	 * Get the masker.
	 * @return
	 */
	public ImageMasker getMasker() {
		return masker;
	}

	/**
	 * Read the raw pixels for an image.
	 * @param index physical image index
	 * @return
	 * @throws IOException
	 */
	public TiledImage<? extends NumericImageTile> getData(int index) throws IOException {
		logger.trace("Reading image {}", index);
		return reader.read(index);
	}

	/**
	 * Get the dynamic mask for an image.
	 * @param index physical image index
	 * @return the mask, or an empty image if there is no dynamic mask
	 * @throws IOException
	 */
	public TiledImage<BooleanImageTile> getMask(int index) throws IOException {
		var mask = masker.getMask(index);
		return mask == null ? TiledImage.empty() : mask;
	}

	/**
	 * Returns true if all images are read from a single file.
	 * @return
	 */
	public boolean hasSingleFileReader() {
		return reader.isSingleFileReader();
	}

	/**
	 * Get the path for an image.
	 * @param index physical image index
	 * @return
	 */
	public String getPath(int index) {
		return reader.getPath(index);
	}

	/**
	 * Get the path of the first image, which for a single file reader is the path of the file containing all images.
	 * @return
	 */
	public String getMasterPath() {
		return reader.getPath(0);
	}

	/**
	 * Get the identifier for an image.
	 * @param index physical image index
	 * @return
	 */
	public String getImageIdentifier(int index) {
		return reader.getImageIdentifier(index);
	}

	/**
	 * Returns true if a property has been set.
	 * @param name
	 * @return
	 */
	public boolean hasProperty(String name) {
		return properties.containsKey(name);
	}

	/**
	 * Get a property.
	 * @param name
	 * @return
	 * @throws diffrax.lib.common.ModelContractException if the property has not been set
	 */
	public String getProperty(String name) {
		ModelContracts.check(properties.containsKey(name), "No property found with name '%s'", name);
		return properties.get(name);
	}

	/**
	 * Set a property, replacing any existing value.
	 * @param name
	 * @param value
	 */
	public void setProperty(String name, String value) {
		logger.trace("Setting property: {}: {}", name, value);
		properties.put(name, value);
	}

	/**
	 * Get the beam for an image.
	 * @param index physical image index
	 * @return the beam, or null if not set
	 */
	public Beam getBeam(int index) {
		return beams[ModelContracts.checkIndex(index, beams.length, "Beam")];
	}

	/**
	 * Set the beam for an image.
	 * @param index physical image index
	 * @param beam the beam; may be null
	 */
	public void setBeam(int index, Beam beam) {
		beams[ModelContracts.checkIndex(index, beams.length, "Beam")] = beam;
	}

	/**
	 * Get the detector for an image.
	 * @param index physical image index
	 * @return the detector, or null if not set
	 */
	public Detector getDetector(int index) {
		return detectors[ModelContracts.checkIndex(index, detectors.length, "Detector")];
	}

	/**
	 * Set the detector for an image.
	 * @param index physical image index
	 * @param detector the detector; may be null
	 */
	public void setDetector(int index, Detector detector) {
		detectors[ModelContracts.checkIndex(index, detectors.length, "Detector")] = detector;
	}

	/**
	 * Get the goniometer for an image.
	 * @param index physical image index
	 * @return the goniometer, or null if not set
	 */
	public Goniometer getGoniometer(int index) {
		return goniometers[ModelContracts.checkIndex(index, goniometers.length, "Goniometer")];
	}

	/**
	 * Set the goniometer for an image.
	 * @param index physical image index
	 * @param goniometer the goniometer; may be null
	 */
	public void setGoniometer(int index, Goniometer goniometer) {
		goniometers[ModelContracts.checkIndex(index, goniometers.length, "Goniometer")] = goniometer;
	}

	/**
	 * Get the scan for an image.
	 * @param index physical image index
	 * @return the scan, or null if not set
	 */
	public Scan getScan(int index) {
		return scans[ModelContracts.checkIndex(index, scans.length, "Scan")];
	}

	/**
	 * Set the scan for an image.
	 * @param index physical image index
	 * @param scan the scan; may be null
	 */
	public void setScan(int index, Scan scan) {
		scans[ModelContracts.checkIndex(index, scans.length, "Scan")] = scan;
	}

	/**
	 * Get the external lookup, shared by all images.
	 * @return
	 */
	public ExternalLookup getExternalLookup() {
		return externalLookup;
	}

	@Override
	public String toString() {
		return "ImageSetData (" + size() + " images)";
	}

	/**
	 * Record that the warning about unusable panel gains has been logged for this collection.
	 * @return true the first time this is called, false afterwards
	 */
	boolean markGainWarningLogged() {
		if (gainWarningLogged)
			return false;
		gainWarningLogged = true;
		return true;
	}

}
