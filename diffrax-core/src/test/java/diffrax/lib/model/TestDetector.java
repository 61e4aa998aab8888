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

import java.util.List;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.apache.commons.math3.geometry.euclidean.twod.Vector2D;
import org.junit.jupiter.api.Test;

import diffrax.lib.common.ModelContractException;

@SuppressWarnings("javadoc")
public class TestDetector {
	
	static Detector createTwoPanelDetector() {
		var p1 = TestPanel.createSimplePanel();
		var p2 = new Panel("SENSOR_PAD",
				new Vector3D(1, 0, 0), new Vector3D(0, 1, 0), new Vector3D(20, 0, 100),
				new double[] {0.2, 0.2}, new int[] {50, 50}, new double[] {0, 10});
		return new Detector(p1, p2);
	}
	
	@Test
	public void test_panels() {
		var detector = createTwoPanelDetector();
		assertEquals(2, detector.size());
		assertEquals(50, detector.getPanel(1).getImageSize()[0]);
		assertThrows(ModelContractException.class, () -> detector.getPanel(2));
		assertThrows(ModelContractException.class, () -> detector.getPanel(-1));
		
		int n = 0;
		for (Panel panel : detector) {
			assertSame(detector.getPanel(n), panel);
			n++;
		}
		assertEquals(2, n);
		
		List<Panel> snapshot = detector.getPanels();
		detector.addPanel(new Panel());
		assertEquals(2, snapshot.size());
		assertEquals(3, detector.size());
		assertThrows(UnsupportedOperationException.class, () -> snapshot.add(new Panel()));
		
		detector.removePanel(2);
		assertEquals(2, detector.size());
		detector.removePanels();
		assertEquals(0, detector.size());
	}
	
	@Test
	public void test_multiPanelHelpers() {
		var detector = createTwoPanelDetector();
		assertTrue(detector.isValueInTrustedRange(0, 500));
		assertFalse(detector.isValueInTrustedRange(1, 500));
		assertFalse(detector.isValueInTrustedRange(2, 5));
		assertFalse(detector.isValueInTrustedRange(-1, 5));
		
		assertTrue(detector.isCoordValid(1, new Vector2D(49, 49)));
		assertFalse(detector.isCoordValid(1, new Vector2D(50, 49)));
		assertFalse(detector.isCoordValid(5, new Vector2D(0, 0)));
		
		var mm = detector.pixelToMillimeter(1, new Vector2D(10, 5));
		assertEquals(2.0, mm.getX(), 1e-12);
		assertEquals(1.0, mm.getY(), 1e-12);
		var px = detector.millimeterToPixel(0, new Vector2D(1, 2));
		assertEquals(10.0, px.getX(), 1e-9);
		assertEquals(20.0, px.getY(), 1e-9);
		assertThrows(ModelContractException.class, () -> detector.millimeterToPixel(3, new Vector2D(1, 2)));
	}
	
	@Test
	public void test_equalityAndCopy() {
		var detector = createTwoPanelDetector();
		var copy = new Detector(detector);
		assertEquals(detector, copy);
		assertNotSame(detector.getPanel(0), copy.getPanel(0));
		
		copy.getPanel(0).setImageSize(new int[] {10, 10});
		assertNotEquals(detector, copy);
		assertEquals(100, detector.getPanel(0).getImageSize()[0]);
		
		assertNotEquals(detector, new Detector(detector.getPanel(0)));
		assertEquals(new Detector(), new Detector(List.of()));
	}

}
