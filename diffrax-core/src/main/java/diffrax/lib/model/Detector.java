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
import java.util.Collection;
import java.util.Iterator;
import java.util.List;

import org.apache.commons.math3.geometry.euclidean.twod.Vector2D;

import com.google.common.collect.ImmutableList;

import diffrax.lib.common.ModelContracts;

/**
 * A detector made up of one or more flat panels.
 * <p>
 * Panels are accessed by index, in the same order as the tiles of the images recorded by the detector.
 * Two detectors are equal if they have the same number of panels, and each pair of panels is equal.
 */
public class Detector implements Iterable<Panel> {

	private List<Panel> panels = new ArrayList<>();

	/**
	 * Create a detector with no panels.
	 */
	public Detector() {}

	/**
	 * Create a detector with the specified panels.
	 * @param panels
	 */
	public Detector(Panel... panels) {
		this(List.of(panels));
	}

	/**
	 * Create a detector with the specified panels.
	 * @param panels
	 */
	public Detector(Collection<Panel> panels) {
		this.panels.addAll(panels);
	}

	/**
	 * Copy constructor. The panels are copied, so that changes to the new detector are not reflected in the original.
	 * @param detector
	 */
	public Detector(Detector detector) {
		for (Panel panel : detector.panels)
			panels.add(new Panel(panel));
	}

	/**
	 * Add a panel to the end of the list of panels.
	 * @param panel
	 */
	public void addPanel(Panel panel) {
		panels.add(panel);
	}

	/**
	 * Remove a single panel.
	 * @param index
	 */
	public void removePanel(int index) {
		panels.remove(ModelContracts.checkIndex(index, panels.size(), "Panel"));
	}

	/**
	 * Remove all the panels.
	 */
	public void removePanels() {
		panels.clear();
	}

	/**
	 * Get the number of panels.
	 * @return
	 */
	public int size() {
		return panels.size();
	}

	/**
	 * Get a panel. This is the panel stored by the detector, so changes to it are reflected in the detector.
	 * @param index
	 * @return
	 */
	public Panel getPanel(int index) {
		return panels.get(ModelContracts.checkIndex(index, panels.size(), "Panel"));
	}

	/**
	 * Get an immutable snapshot of the list of panels.
	 * @return
	 */
	public List<Panel> getPanels() {
		return ImmutableList.copyOf(panels);
	}

	/**
	 * Check whether a value is within the trusted range of a panel.
	 * @param panel the panel index
	 * @param value
	 * @return false if the panel index is invalid or the value is outside the trusted range
	 */
	public boolean isValueInTrustedRange(int panel, double value) {
		return 0 <= panel && panel < panels.size()
				&& panels.get(panel).isValueInTrustedRange(value);
	}

	/**
	 * Check whether a pixel coordinate is valid for a panel.
	 * @param panel the panel index
	 * @param xy
	 * @return false if the panel index is invalid or the coordinate falls outside the panel
	 */
	public boolean isCoordValid(int panel, Vector2D xy) {
		return 0 <= panel && panel < panels.size()
				&& panels.get(panel).isCoordValid(xy);
	}

	/**
	 * Convert a coordinate in mm on a panel to pixels.
	 * @param panel
	 * @param xy
	 * @return
	 */
	public Vector2D millimeterToPixel(int panel, Vector2D xy) {
		return getPanel(panel).millimeterToPixel(xy);
	}

	/**
	 * Convert a pixel coordinate on a panel to mm.
	 * @param panel
	 * @param xy
	 * @return
	 */
	public Vector2D pixelToMillimeter(int panel, Vector2D xy) {
		return getPanel(panel).pixelToMillimeter(xy);
	}

	@Override
	public Iterator<Panel> iterator() {
		return panels.iterator();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		return panels.equals(((Detector)obj).panels);
	}

	@Override
	public int hashCode() {
		return panels.hashCode();
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder("Detector:\n");
		for (Panel panel : panels)
			sb.append(panel);
		return sb.toString();
	}

}
