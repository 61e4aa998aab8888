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

import static org.junit.jupiter.api.Assertions.*;

import java.util.HashSet;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.apache.commons.math3.geometry.euclidean.twod.Vector2D;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.junit.jupiter.api.Test;

import diffrax.lib.common.ModelContractException;
import diffrax.lib.images.BooleanImageTile;
import diffrax.lib.images.IntImageTile;

@SuppressWarnings("javadoc")
public class TestPanel {
	
	private static final double EPS = 1e-9;
	
	static Panel createSimplePanel() {
		return new Panel("SENSOR_PAD",
				new Vector3D(1, 0, 0), new Vector3D(0, 1, 0), new Vector3D(0, 0, 100),
				new double[] {0.1, 0.1}, new int[] {100, 100}, new double[] {0, 1000});
	}
	
	/**
	 * Panel facing the beam, with the beam centre at pixel (100, 100).
	 */
	static Panel createFacingPanel() {
		return new Panel("SENSOR_PAD",
				new Vector3D(1, 0, 0), new Vector3D(0, -1, 0), new Vector3D(-10, 10, -100),
				new double[] {0.1, 0.1}, new int[] {200, 200}, new double[] {-1, 65535});
	}
	
	@Test
	public void test_geometry() {
		var panel = createSimplePanel();
		assertEquals(100.0, panel.getDistance(), EPS);
		assertEquals(0.0, panel.getNormal().distance(new Vector3D(0, 0, 1)), EPS);
		
		Vector2D mm = panel.pixelToMillimeter(new Vector2D(10, 10));
		assertEquals(1.0, mm.getX(), EPS);
		assertEquals(1.0, mm.getY(), EPS);
		
		Vector3D lab = panel.getLabCoord(new Vector2D(1.0, 1.0));
		assertEquals(0.0, lab.distance(new Vector3D(1.0, 1.0, 100.0)), EPS);
		
		Vector3D labPixel = panel.getPixelLabCoord(new Vector2D(10, 10));
		assertEquals(0.0, labPixel.distance(lab), EPS);
		
		Vector2D size = panel.getImageSizeMm();
		assertEquals(10.0, size.getX(), EPS);
		assertEquals(10.0, size.getY(), EPS);
	}
	
	@Test
	public void test_inverseMatrix() {
		var panel = createSimplePanel();
		assertIdentity(panel.getDMatrix().multiply(panel.getInverseDMatrix()));
		
		panel.setFrame(new Vector3D(0, 2, 0), new Vector3D(3, 0, 0), new Vector3D(-5, 7, 150));
		assertIdentity(panel.getDMatrix().multiply(panel.getInverseDMatrix()));
		
		// Axes are normalized
		assertEquals(1.0, panel.getFastAxis().getNorm(), EPS);
		assertEquals(1.0, panel.getSlowAxis().getNorm(), EPS);
		assertEquals(0.0, panel.getOrigin().distance(new Vector3D(-5, 7, 150)), EPS);
		
		// Copies are returned
		panel.getDMatrix().setEntry(0, 0, 100);
		assertEquals(0.0, panel.getDMatrix().getEntry(0, 0), EPS);
	}
	
	private static void assertIdentity(RealMatrix matrix) {
		var identity = MatrixUtils.createRealIdentityMatrix(3);
		for (int r = 0; r < 3; r++) {
			for (int c = 0; c < 3; c++)
				assertEquals(identity.getEntry(r, c), matrix.getEntry(r, c), 1e-12);
		}
	}
	
	@Test
	public void test_coordinateRoundTrip() {
		var panel = createFacingPanel();
		var xy = new Vector2D(37.5, 12.25);
		var back = panel.millimeterToPixel(panel.pixelToMillimeter(xy));
		assertEquals(xy.getX(), back.getX(), EPS);
		assertEquals(xy.getY(), back.getY(), EPS);
		
		// A ray through a point on the panel intersects at the same point
		var mm = new Vector2D(3.0, 17.0);
		var intersection = panel.getRayIntersection(panel.getLabCoord(mm));
		assertEquals(mm.getX(), intersection.getX(), EPS);
		assertEquals(mm.getY(), intersection.getY(), EPS);
		
		// Rays pointing away from the panel never hit it
		assertThrows(ModelContractException.class, () -> panel.getRayIntersection(new Vector3D(0, 0, 1)));
	}
	
	@Test
	public void test_beamCentreAndResolution() {
		var panel = createFacingPanel();
		var beam = new Beam(new Vector3D(0, 0, 1), 1.0);
		
		var centre = panel.getBeamCentre(beam);
		assertEquals(10.0, centre.getX(), EPS);
		assertEquals(10.0, centre.getY(), EPS);
		assertEquals(0.0, panel.getBeamCentreLab(beam.getS0()).distance(new Vector3D(0, 0, -100)), EPS);
		
		double expected = 1.0 / (2.0 * Math.sin(0.5 * Math.atan(0.1)));
		assertEquals(expected, panel.getResolutionAtPixel(beam, new Vector2D(200, 100)), 1e-6);
		assertEquals(expected * 2, panel.getResolutionAtPixel(beam.getS0(), 2.0, new Vector2D(0, 100)), 1e-6);
		
		// Resolution is undefined at the beam centre
		assertThrows(ModelContractException.class, () -> panel.getResolutionAtPixel(beam, new Vector2D(100, 100)));
		
		// The corners are further from the beam centre than the edges, so have higher resolution (smaller d)
		double corners = panel.getMaxResolutionAtCorners(beam);
		double elipse = panel.getMaxResolutionElipse(beam);
		assertEquals(1.0 / (2.0 * Math.sin(0.5 * Math.atan(Math.sqrt(2) * 0.1))), corners, 1e-6);
		assertEquals(expected, elipse, 1e-6);
		assertTrue(corners < elipse);
	}
	
	@Test
	public void test_beamBehindPanel() {
		var panel = createSimplePanel();
		var s0 = new Vector3D(0, 0, -1);
		assertThrows(ModelContractException.class, () -> panel.getBeamCentreLab(s0));
	}
	
	@Test
	public void test_singularFrame() {
		var panel = createSimplePanel();
		var before = panel.getDMatrix();
		assertThrows(ModelContractException.class,
				() -> panel.setFrame(new Vector3D(1, 0, 0), new Vector3D(2, 0, 0), new Vector3D(0, 0, 100)));
		assertThrows(ModelContractException.class,
				() -> panel.setFrame(new Vector3D(1, 0, 0), new Vector3D(0, 1, 0), Vector3D.ZERO));
		assertThrows(ModelContractException.class,
				() -> panel.setFrame(Vector3D.ZERO, new Vector3D(0, 1, 0), new Vector3D(0, 0, 100)));
		// Failed calls leave the frame unchanged
		assertEquals(before, panel.getDMatrix());
	}
	
	@Test
	public void test_trustedRange() {
		var panel = createSimplePanel();
		assertTrue(panel.isValueInTrustedRange(0));
		assertTrue(panel.isValueInTrustedRange(999.5));
		assertFalse(panel.isValueInTrustedRange(1000));
		assertFalse(panel.isValueInTrustedRange(-1));
		
		var tile = new IntImageTile(new int[] {-5, 0, 10, 1000, 999, 2000}, 3, 2);
		BooleanImageTile mask = panel.getTrustedRangeMask(tile);
		assertEquals(3, mask.getWidth());
		assertEquals(2, mask.getHeight());
		assertArrayEquals(new boolean[] {false, true, true, false, true, false}, mask.getArray(false));
		assertEquals(3, mask.countTrue());
		
		assertThrows(ModelContractException.class, () -> panel.setTrustedRange(new double[] {1, 2, 3}));
	}
	
	@Test
	public void test_coordValid() {
		var panel = createSimplePanel();
		assertTrue(panel.isCoordValid(new Vector2D(0, 0)));
		assertTrue(panel.isCoordValid(new Vector2D(99.9, 50)));
		assertFalse(panel.isCoordValid(new Vector2D(100, 50)));
		assertFalse(panel.isCoordValid(new Vector2D(-0.1, 50)));
		assertTrue(panel.isCoordValidMm(new Vector2D(9.99, 0)));
		assertFalse(panel.isCoordValidMm(new Vector2D(10.0, 0)));
	}
	
	@Test
	public void test_hashCodeFollowsImageSize() {
		var panel = createSimplePanel();
		var copy = new Panel(panel);
		var set = new HashSet<Panel>();
		set.add(panel);
		assertTrue(set.contains(copy));
		
		copy.setImageSize(new int[] {100, 200});
		assertNotEquals(panel, copy);
		assertNotEquals(panel.hashCode(), copy.hashCode());
		assertFalse(set.contains(copy));
	}
	
	@Test
	public void test_equality() {
		var panel = createSimplePanel();
		var copy = new Panel(panel);
		assertEquals(panel, copy);
		assertEquals(panel.hashCode(), copy.hashCode());
		
		// Pixel size, trusted range, gain and mask are not compared
		copy.setPixelSize(new double[] {0.2, 0.2});
		copy.setTrustedRange(new double[] {-1, 10});
		copy.setGain(5.0);
		copy.addMask(0, 0, 10, 10);
		assertEquals(panel, copy);
		
		copy.setImageSize(new int[] {100, 101});
		assertNotEquals(panel, copy);
		
		var rotated = createSimplePanel();
		rotated.setFrame(new Vector3D(0, 1, 0), new Vector3D(-1, 0, 0), new Vector3D(0, 0, 100));
		assertNotEquals(panel, rotated);
	}
	
	@Test
	public void test_copyIsIndependent() {
		var panel = createSimplePanel();
		panel.addMask(1, 2, 3, 4);
		var copy = new Panel(panel);
		copy.addMask(5, 6, 7, 8);
		copy.setFrame(new Vector3D(0, 1, 0), new Vector3D(1, 0, 0), new Vector3D(0, 0, 50));
		assertEquals(1, panel.getMask().size());
		assertEquals(2, copy.getMask().size());
		assertEquals(100.0, panel.getDistance(), EPS);
		assertEquals(new MaskRegion(1, 2, 3, 4), panel.getMask().get(0));
		assertThrows(UnsupportedOperationException.class, () -> panel.getMask().clear());
	}
	
	@Test
	public void test_defaultPanel() {
		var panel = new Panel();
		assertEquals("Unknown", panel.getType());
		assertEquals(1.0, panel.getGain());
		assertEquals(Vector3D.ZERO, panel.getOrigin());
		assertEquals(new Panel(), panel);
		assertTrue(panel.toString().startsWith("Panel:"));
	}

}
