/*-
 * #%L
 * This file is part of DbView.
 * %%
 * Copyright (C) 2026 DbView developers
 * %%
 * DbView is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * DbView is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with DbView.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package dbview.lib.display;

/**
 * Metadata of the image shown at one (z, t) frame of a 4D series.
 * 
 * @author DbView developers
 */
public final class FrameEntry {
	
	private final double zCoordinate;
	private final double tCoordinate;
	private final String uid;
	private final double windowCenter;
	private final double windowWidth;
	private final String colormap;
	
	FrameEntry(double zCoordinate, double tCoordinate, String uid, double windowCenter, double windowWidth, String colormap) {
		this.zCoordinate = zCoordinate;
		this.tCoordinate = tCoordinate;
		this.uid = uid;
		this.windowCenter = windowCenter;
		this.windowWidth = windowWidth;
		this.colormap = colormap;
	}
	
	/**
	 * Value of the view-axis attribute (e.g. SliceLocation).
	 * @return
	 */
	public double getZCoordinate() {
		return zCoordinate;
	}
	
	/**
	 * Value of the plot-axis attribute (e.g. AcquisitionTime).
	 * @return
	 */
	public double getTCoordinate() {
		return tCoordinate;
	}
	
	/**
	 * SOPInstanceUID of the image.
	 * @return
	 */
	public String getUID() {
		return uid;
	}
	
	public double getWindowCenter() {
		return windowCenter;
	}
	
	public double getWindowWidth() {
		return windowWidth;
	}
	
	/**
	 * Name of the colormap, or null.
	 * @return
	 */
	public String getColormap() {
		return colormap;
	}
	
	/**
	 * Get the range of values covered by the display window.
	 * @return
	 */
	public ValueRange getWindowRange() {
		return ValueRange.ofWindow(windowCenter, windowWidth);
	}

	@Override
	public String toString() {
		return "FrameEntry [z=" + zCoordinate + ", t=" + tCoordinate + ", uid=" + uid 
				+ ", center=" + windowCenter + ", width=" + windowWidth + ", colormap=" + colormap + "]";
	}

}
