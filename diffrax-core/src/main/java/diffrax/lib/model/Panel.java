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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.math3.exception.MathArithmeticException;
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.apache.commons.math3.geometry.euclidean.twod.Vector2D;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;

import diffrax.lib.common.GeneralTools;
import diffrax.lib.common.ModelContractException;
import diffrax.lib.common.ModelContracts;
import diffrax.lib.common.Prefs;
import diffrax.lib.images.BooleanImageTile;
import diffrax.lib.images.NumericImageTile;

/**
 * A single flat detector panel. A detector can have multiple panels, which are each represented by this class.
 * <p>
 * The geometry of the panel is defined by the matrix <i>d</i>, whose columns are the (normalized) fast axis,
 * the (normalized) slow axis and the origin of the panel in the laboratory frame. This maps a coordinate
 * in millimeters on the panel {@code (x, y, 1)} to a laboratory coordinate.
 * The inverse matrix <i>D</i> is recomputed whenever the frame is set.
 * <p>
 * Note that {@link #equals(Object)} only compares the panel axes, origin and image size: two panels with
 * different pixel sizes, trusted ranges, gains or masks may be considered equal.
 */
public class Panel {

	private static final RealMatrix ZERO_MATRIX = MatrixUtils.createRealMatrix(3, 3);

	private String type = "Unknown";
	private RealMatrix d = ZERO_MATRIX;
	private RealMatrix D = ZERO_MATRIX;
	private double[] pixelSize = new double[2];
	private int[] imageSize = new int[2];
	private double[] trustedRange = new double[2];
	private double gain = 1.0;
	private List<MaskRegion> mask = new ArrayList<>();

	/**
	 * Default constructor.
	 * <p>
	 * The frame matrix is all zeros, so {@link #setFrame(Vector3D, Vector3D, Vector3D)} must be called
	 * before any geometric calculations are possible.
	 */
	public Panel() {}

	/**
	 * Initialize a detector panel.
	 * @param type the type of the detector panel
	 * @param fastAxis the fast axis of the panel; this will be normalized
	 * @param slowAxis the slow axis of the panel; this will be normalized
	 * @param origin the panel origin
	 * @param pixelSize the size of the pixels along the fast and slow axes, in mm
	 * @param imageSize the number of pixels along the fast and slow axes
	 * @param trustedRange the trusted range of pixel values, where the first value is inclusive and the second exclusive
	 */
	public Panel(String type, Vector3D fastAxis, Vector3D slowAxis, Vector3D origin,
			double[] pixelSize, int[] imageSize, double[] trustedRange) {
		setType(type);
		setFrame(fastAxis, slowAxis, origin);
		setPixelSize(pixelSize);
		setImageSize(imageSize);
		setTrustedRange(trustedRange);
	}

	/**
	 * Copy constructor. The new panel shares no mutable state with the original.
	 * @param panel
	 */
	public Panel(Panel panel) {
		this.type = panel.type;
		this.d = panel.d.copy();
		this.D = panel.D.copy();
		this.pixelSize = panel.pixelSize.clone();
		this.imageSize = panel.imageSize.clone();
		this.trustedRange = panel.trustedRange.clone();
		this.gain = panel.gain;
		this.mask = new ArrayList<>(panel.mask);
	}

	/**
	 * Get the sensor type.
	 * @return
	 */
	public String getType() {
		return type;
	}

	/**
	 * Set the sensor type.
	 * @param type
	 */
	public void setType(String type) {
		this.type = type;
	}

	/**
	 * Get the (normalized) fast axis.
	 * @return
	 */
	public Vector3D getFastAxis() {
		return column(d, 0);
	}

	/**
	 * Get the (normalized) slow axis.
	 * @return
	 */
	public Vector3D getSlowAxis() {
		return column(d, 1);
	}

	/**
	 * Get the panel origin, i.e. the laboratory coordinate of the corner of the first pixel.
	 * @return
	 */
	public Vector3D getOrigin() {
		return column(d, 2);
	}

	/**
	 * Get the panel normal, defined as the cross product of the fast and slow axes.
	 * @return
	 */
	public Vector3D getNormal() {
		return getFastAxis().crossProduct(getSlowAxis());
	}

	/**
	 * Get the size of a pixel along the fast and slow axes, in mm.
	 * @return a new two-element array
	 */
	public double[] getPixelSize() {
		return pixelSize.clone();
	}

	/**
	 * Set the size of a pixel along the fast and slow axes, in mm.
	 * @param pixelSize two-element array
	 */
	public void setPixelSize(double[] pixelSize) {
		ModelContracts.check(pixelSize.length == 2, "Pixel size must have 2 values, but found %d", pixelSize.length);
		this.pixelSize = pixelSize.clone();
	}

	/**
	 * Get the number of pixels along the fast and slow axes.
	 * @return a new two-element array
	 */
	public int[] getImageSize() {
		return imageSize.clone();
	}

	/**
	 * Set the number of pixels along the fast and slow axes.
	 * @param imageSize two-element array
	 */
	public void setImageSize(int[] imageSize) {
		ModelContracts.check(imageSize.length == 2, "Image size must have 2 values, but found %d", imageSize.length);
		this.imageSize = imageSize.clone();
	}

	/**
	 * Get the trusted range of pixel values.
	 * @return a new two-element array containing the inclusive lower bound and the exclusive upper bound
	 */
	public double[] getTrustedRange() {
		return trustedRange.clone();
	}

	/**
	 * Set the trusted range of pixel values.
	 * @param trustedRange two-element array containing the inclusive lower bound and the exclusive upper bound
	 */
	public void setTrustedRange(double[] trustedRange) {
		ModelContracts.check(trustedRange.length == 2, "Trusted range must have 2 values, but found %d", trustedRange.length);
		this.trustedRange = trustedRange.clone();
	}

	/**
	 * Get the gain of the panel, used to convert pixel values into photon counts.
	 * @return
	 */
	public double getGain() {
		return gain;
	}

	/**
	 * Set the gain of the panel.
	 * @param gain
	 */
	public void setGain(double gain) {
		this.gain = gain;
	}

	/**
	 * Get the masked regions of the panel.
	 * @return an unmodifiable list
	 */
	public List<MaskRegion> getMask() {
		return Collections.unmodifiableList(mask);
	}

	/**
	 * Set the masked regions of the panel, replacing any existing regions.
	 * @param mask
	 */
	public void setMask(List<MaskRegion> mask) {
		this.mask = new ArrayList<>(mask);
	}

	/**
	 * Add a masked region.
	 * @param f0 first fast-axis pixel (inclusive)
	 * @param s0 first slow-axis pixel (inclusive)
	 * @param f1 last fast-axis pixel (exclusive)
	 * @param s1 last slow-axis pixel (exclusive)
	 */
	public void addMask(int f0, int s0, int f1, int s1) {
		mask.add(new MaskRegion(f0, s0, f1, s1));
	}

	/**
	 * Get the matrix of the panel coordinate system.
	 * @return a copy of the matrix
	 */
	public RealMatrix getDMatrix() {
		return d.copy();
	}

	/**
	 * Get the inverse of the matrix of the panel coordinate system.
	 * @return a copy of the matrix
	 */
	public RealMatrix getInverseDMatrix() {
		return D.copy();
	}

	/**
	 * Set the fast axis, slow axis and origin of the panel.
	 * Both axes are normalized, and the inverse frame matrix is recomputed.
	 *
	 * @param fastAxis
	 * @param slowAxis
	 * @param origin
	 * @throws diffrax.lib.common.ModelContractException if either axis has zero length or the frame is singular
	 */
	public void setFrame(Vector3D fastAxis, Vector3D slowAxis, Vector3D origin) {
		RealMatrix dNew = createDMatrix(normalize(fastAxis, "fast"), normalize(slowAxis, "slow"), origin);
		DecompositionSolver solver = new LUDecomposition(dNew).getSolver();
		ModelContracts.check(solver.isNonSingular(),
				"Panel frame is singular (fast=%s, slow=%s, origin=%s)", fastAxis, slowAxis, origin);
		d = dNew;
		D = solver.getInverse();
	}

	/**
	 * Get the distance from the sample to the panel plane, along the panel normal.
	 * @return
	 */
	public double getDistance() {
		return getOrigin().dotProduct(getNormal());
	}

	/**
	 * Get the size of the panel in mm.
	 * @return
	 */
	public Vector2D getImageSizeMm() {
		return pixelToMillimeter(new Vector2D(imageSize[0], imageSize[1]));
	}

	/**
	 * Check whether a pixel value falls within the trusted range.
	 * The lower bound is inclusive, and the upper bound exclusive.
	 * @param value
	 * @return
	 */
	public boolean isValueInTrustedRange(double value) {
		return trustedRange[0] <= value && value < trustedRange[1];
	}

	/**
	 * Check whether a pixel coordinate falls within the panel.
	 * @param xy
	 * @return
	 */
	public boolean isCoordValid(Vector2D xy) {
		return (0 <= xy.getX() && xy.getX() < imageSize[0])
				&& (0 <= xy.getY() && xy.getY() < imageSize[1]);
	}

	/**
	 * Check whether a coordinate in mm falls within the panel.
	 * @param xy
	 * @return
	 */
	public boolean isCoordValidMm(Vector2D xy) {
		Vector2D size = getImageSizeMm();
		return (0 <= xy.getX() && xy.getX() < size.getX())
				&& (0 <= xy.getY() && xy.getY() < size.getY());
	}

	/**
	 * Create a mask for a tile of pixel values, where each pixel is true if its value is within the trusted range.
	 * @param tile
	 * @return
	 * @see #isValueInTrustedRange(double)
	 */
	public BooleanImageTile getTrustedRangeMask(NumericImageTile tile) {
		int w = tile.getWidth();
		int h = tile.getHeight();
		boolean[] mask = new boolean[w * h];
		for (int y = 0; y < h; y++) {
			for (int x = 0; x < w; x++) {
				mask[y * w + x] = isValueInTrustedRange(tile.getDouble(x, y));
			}
		}
		return new BooleanImageTile(mask, w, h);
	}

	/**
	 * Get the beam centre on the panel, in mm.
	 * @param s0 the incident beam vector
	 * @return
	 */
	public Vector2D getBeamCentre(Vector3D s0) {
		return getRayIntersection(s0);
	}

	/**
	 * Get the beam centre on the panel, in mm.
	 * @param beam
	 * @return
	 */
	public Vector2D getBeamCentre(Beam beam) {
		return getBeamCentre(beam.getS0());
	}

	/**
	 * Get the point where the beam intersects the panel plane, in laboratory coordinates.
	 * @param s0 the incident beam vector
	 * @return
	 * @throws diffrax.lib.common.ModelContractException if the beam does not point towards the panel plane
	 */
	public Vector3D getBeamCentreLab(Vector3D s0) {
		double s0DotNormal = s0.dotProduct(getNormal());
		ModelContracts.check(s0DotNormal > 0, "Beam %s does not intersect the panel plane", s0);
		return s0.scalarMultiply(getDistance() / s0DotNormal);
	}

	/**
	 * Get the resolution (d-spacing) at a given pixel.
	 * @param s0 the incident beam vector
	 * @param wavelength the beam wavelength
	 * @param xy the pixel coordinate
	 * @return the resolution, {@code wavelength / (2 sin(theta))}
	 * @throws diffrax.lib.common.ModelContractException if the pixel coincides with the beam centre
	 */
	public double getResolutionAtPixel(Vector3D s0, double wavelength, Vector2D xy) {
		Vector3D xyz = getPixelLabCoord(xy);
		Vector3D beamCentre = getBeamCentreLab(s0);
		double sinTheta = Math.sin(0.5 * angle(beamCentre, xyz));
		ModelContracts.check(sinTheta != 0, "Cannot compute resolution at the beam centre %s", xy);
		return wavelength / (2.0 * sinTheta);
	}

	/**
	 * Get the resolution (d-spacing) at a given pixel.
	 * @param beam
	 * @param xy the pixel coordinate
	 * @return
	 */
	public double getResolutionAtPixel(Beam beam, Vector2D xy) {
		return getResolutionAtPixel(beam.getS0(), beam.getWavelength(), xy);
	}

	/**
	 * Get the maximum resolution of the panel, by finding the largest scattering angle to any of its four corners.
	 * @param s0 the incident beam vector
	 * @param wavelength the beam wavelength
	 * @return
	 * @throws diffrax.lib.common.ModelContractException if all corners coincide with the beam centre
	 */
	public double getMaxResolutionAtCorners(Vector3D s0, double wavelength) {
		int fast = imageSize[0], slow = imageSize[1];
		Vector3D xyz00 = getOrigin();
		Vector3D xyz01 = getPixelLabCoord(new Vector2D(0, slow));
		Vector3D xyz10 = getPixelLabCoord(new Vector2D(fast, 0));
		Vector3D xyz11 = getPixelLabCoord(new Vector2D(fast, slow));

		Vector3D beamCentre = getBeamCentreLab(s0);

		double maxAngle = Math.max(
				Math.max(angle(beamCentre, xyz00), angle(beamCentre, xyz01)),
				Math.max(angle(beamCentre, xyz10), angle(beamCentre, xyz11)));
		double sinTheta = Math.sin(0.5 * maxAngle);
		ModelContracts.check(sinTheta != 0, "Cannot compute resolution: all panel corners lie at the beam centre");
		return wavelength / (2.0 * sinTheta);
	}

	/**
	 * Get the maximum resolution of the panel, by finding the largest scattering angle to any of its four corners.
	 * @param beam
	 * @return
	 */
	public double getMaxResolutionAtCorners(Beam beam) {
		return getMaxResolutionAtCorners(beam.getS0(), beam.getWavelength());
	}

	/**
	 * Get the maximum resolution of a full circle on the panel.
	 * <p>
	 * The beam centre is used to define a cross-hair, and the resolution is evaluated where the cross-hair
	 * meets each of the four edges of the panel. The smallest of these scattering angles defines the result.
	 *
	 * @param s0 the incident beam vector
	 * @param wavelength the beam wavelength
	 * @return
	 */
	public double getMaxResolutionElipse(Vector3D s0, double wavelength) {
		int fast = imageSize[0], slow = imageSize[1];
		Vector2D c = millimeterToPixel(getBeamCentre(s0));
		Vector3D xyz0c = getPixelLabCoord(new Vector2D(0.0, c.getY()));
		Vector3D xyz1c = getPixelLabCoord(new Vector2D(fast, c.getY()));
		Vector3D xyzc0 = getPixelLabCoord(new Vector2D(c.getX(), 0.0));
		Vector3D xyzc1 = getPixelLabCoord(new Vector2D(c.getX(), slow));

		Vector3D beamCentre = getBeamCentreLab(s0);

		double minAngle = Math.min(
				Math.min(angle(beamCentre, xyz0c), angle(beamCentre, xyzc0)),
				Math.min(angle(beamCentre, xyz1c), angle(beamCentre, xyzc1)));
		double sinTheta = Math.sin(0.5 * minAngle);
		return wavelength / (2.0 * sinTheta);
	}

	/**
	 * Get the maximum resolution of a full circle on the panel.
	 * @param beam
	 * @return
	 * @see #getMaxResolutionElipse(Vector3D, double)
	 */
	public double getMaxResolutionElipse(Beam beam) {
		return getMaxResolutionElipse(beam.getS0(), beam.getWavelength());
	}

	/**
	 * Get the laboratory coordinate of a point on the panel given in mm.
	 * @param xy
	 * @return
	 */
	public Vector3D getLabCoord(Vector2D xy) {
		double[] v = d.operate(new double[] {xy.getX(), xy.getY(), 1.0});
		return new Vector3D(v[0], v[1], v[2]);
	}

	/**
	 * Get the laboratory coordinate of a point on the panel given in pixels.
	 * @param xy
	 * @return
	 */
	public Vector3D getPixelLabCoord(Vector2D xy) {
		return getLabCoord(pixelToMillimeter(xy));
	}

	/**
	 * Get the point, in mm, where a ray intersects the panel plane.
	 * @param s1 the ray direction
	 * @return
	 * @throws diffrax.lib.common.ModelContractException if the ray does not point towards the panel plane
	 */
	public Vector2D getRayIntersection(Vector3D s1) {
		double[] v = D.operate(s1.toArray());
		ModelContracts.check(v[2] > 0, "Ray %s does not intersect the panel plane", s1);
		return new Vector2D(v[0] / v[2], v[1] / v[2]);
	}

	/**
	 * Convert a coordinate in mm to pixels.
	 * @param xy
	 * @return
	 */
	public Vector2D millimeterToPixel(Vector2D xy) {
		return new Vector2D(xy.getX() / pixelSize[0], xy.getY() / pixelSize[1]);
	}

	/**
	 * Convert a coordinate in pixels to mm.
	 * @param xy
	 * @return
	 */
	public Vector2D pixelToMillimeter(Vector2D xy) {
		return new Vector2D(xy.getX() * pixelSize[0], xy.getY() * pixelSize[1]);
	}

	/**
	 * Panels are equal if their fast axes, slow axes and origins point in (almost) the same directions,
	 * and they have the same image size.
	 * The angular tolerance is given by {@link Prefs#getAngleTolerance()}.
	 */
	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		Panel other = (Panel) obj;
		double eps = Prefs.getAngleTolerance();
		return sameDirection(getFastAxis(), other.getFastAxis(), eps)
				&& sameDirection(getSlowAxis(), other.getSlowAxis(), eps)
				&& sameDirection(getOrigin(), other.getOrigin(), eps)
				&& imageSize[0] == other.imageSize[0]
				&& imageSize[1] == other.imageSize[1];
	}

	/**
	 * The hash code depends upon the image size, which is mutable.
	 * Panels (and detectors containing them) should therefore not be modified while they are used as keys
	 * in a map or set.
	 */
	@Override
	public int hashCode() {
		return 31 * imageSize[0] + imageSize[1];
	}

	@Override
	public String toString() {
		return "Panel:\n" +
				"    type:          " + type + "\n" +
				"    fast axis:     " + format(getFastAxis()) + "\n" +
				"    slow axis:     " + format(getSlowAxis()) + "\n" +
				"    origin:        " + format(getOrigin()) + "\n" +
				"    normal:        " + format(getNormal()) + "\n" +
				"    pixel size:    " + GeneralTools.arrayToString(pixelSize) + "\n" +
				"    image size:    (" + imageSize[0] + ", " + imageSize[1] + ")\n" +
				"    trusted range: " + GeneralTools.arrayToString(trustedRange) + "\n";
	}

	private static String format(Vector3D v) {
		return GeneralTools.arrayToString(v.toArray());
	}

	private static RealMatrix createDMatrix(Vector3D fastAxis, Vector3D slowAxis, Vector3D origin) {
		return MatrixUtils.createRealMatrix(new double[][] {
			{fastAxis.getX(), slowAxis.getX(), origin.getX()},
			{fastAxis.getY(), slowAxis.getY(), origin.getY()},
			{fastAxis.getZ(), slowAxis.getZ(), origin.getZ()}
		});
	}

	private static Vector3D column(RealMatrix m, int col) {
		return new Vector3D(m.getColumn(col));
	}

	private static Vector3D normalize(Vector3D axis, String name) {
		try {
			return axis.normalize();
		} catch (MathArithmeticException e) {
			throw ModelContracts.fail("Panel " + name + " axis must not have zero length");
		}
	}

	// Zero-length vectors (e.g. an unset frame) only match one another
	private static boolean sameDirection(Vector3D v1, Vector3D v2, double eps) {
		if (v1.getNorm() == 0 || v2.getNorm() == 0)
			return v1.getNorm() == v2.getNorm();
		return Math.abs(Vector3D.angle(v1, v2)) <= eps;
	}

	private static double angle(Vector3D v1, Vector3D v2) {
		try {
			return Vector3D.angle(v1, v2);
		} catch (MathArithmeticException e) {
			throw new ModelContractException("Cannot compute the angle to a zero-length vector", e);
		}
	}

}
