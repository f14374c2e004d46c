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

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dbview.lib.common.GeneralTools;
import dbview.lib.dicom.SeriesArray;
import dbview.lib.interfaces.StatusMonitor;

/**
 * Lookup table giving, for every (z, t) frame of a {@link SeriesArray}, the coordinates along 
 * both sort axes together with the identifier, display window and colormap of its image.
 * <p>
 * The index is built once when a series is loaded, reading the header of each frame exactly once. 
 * Pixel data is never touched.
 * 
 * @author DbView developers
 */
public class FrameIndex {
	
	private static final Logger logger = LoggerFactory.getLogger(FrameIndex.class);
	
	/**
	 * Progress message reported while the index is built.
	 */
	public static final String PROGRESS_MESSAGE = "Reading coordinates..";
	
	private final String zLabel;
	private final String tLabel;
	private final int nZ;
	private final int nT;
	private final FrameEntry[] entries;
	
	private final ValueRange tRange;
	private final ValueRange windowRange;
	
	private FrameIndex(String zLabel, String tLabel, int nZ, int nT, FrameEntry[] entries) {
		this.zLabel = zLabel;
		this.tLabel = tLabel;
		this.nZ = nZ;
		this.nT = nT;
		this.entries = entries;
		
		double[] tCoords = new double[entries.length];
		double[] windowLow = new double[entries.length];
		double[] windowHigh = new double[entries.length];
		for (int i = 0; i < entries.length; i++) {
			var entry = entries[i];
			tCoords[i] = entry.getTCoordinate();
			windowLow[i] = entry.getWindowCenter() - entry.getWindowWidth() / 2.0;
			windowHigh[i] = entry.getWindowCenter() + entry.getWindowWidth() / 2.0;
		}
		this.tRange = createRange(tCoords, tCoords);
		this.windowRange = createRange(windowLow, windowHigh);
	}
	
	private static ValueRange createRange(double[] low, double[] high) {
		double min = GeneralTools.min(low);
		double max = GeneralTools.max(high);
		if (Double.isNaN(min) || Double.isNaN(max))
			return null;
		return ValueRange.of(min, max);
	}
	
	/**
	 * Build the index for an array.
	 * 
	 * @param array the sorted series array
	 * @param zLabel name of the attribute the view axis was sorted by
	 * @param tLabel name of the attribute the plot axis was sorted by
	 * @param status receiver for progress, reported once per frame as {@code (count, total, "Reading coordinates..")}
	 * @return the index
	 * @throws IllegalArgumentException if any frame of the array has no image
	 */
	public static FrameIndex build(SeriesArray array, String zLabel, String tLabel, StatusMonitor status) {
		Objects.requireNonNull(array);
		Objects.requireNonNull(zLabel);
		Objects.requireNonNull(tLabel);
		if (status == null)
			status = StatusMonitor.silent();
		
		int nZ = array.getSizeZ();
		int nT = array.getSizeT();
		int total = nZ * nT;
		var entries = new FrameEntry[total];
		int count = 0;
		for (int z = 0; z < nZ; z++) {
			for (int t = 0; t < nT; t++) {
				count++;
				status.progress(count, total, PROGRESS_MESSAGE);
				var header = array.getHeader(z, t);
				if (header == null)
					throw new IllegalArgumentException("No image found for frame (z=" + z + ", t=" + t + "); the series cannot be sorted by " + zLabel + " and " + tLabel);
				entries[z * nT + t] = new FrameEntry(
						GeneralTools.toDouble(header.getValue(zLabel)),
						GeneralTools.toDouble(header.getValue(tLabel)),
						header.getSopInstanceUID(),
						header.getWindowCenter(),
						header.getWindowWidth(),
						header.getColormap());
			}
		}
		logger.debug("Built frame index for {} x {} frames sorted by {} and {}", nZ, nT, zLabel, tLabel);
		return new FrameIndex(zLabel, tLabel, nZ, nT, entries);
	}
	
	/**
	 * Get the entry for a frame.
	 * @param z
	 * @param t
	 * @return
	 * @throws IndexOutOfBoundsException if (z, t) is outside the index
	 */
	public FrameEntry getEntry(int z, int t) {
		if (z < 0 || z >= nZ || t < 0 || t >= nT)
			throw new IndexOutOfBoundsException("Frame (z=" + z + ", t=" + t + ") is outside a " + nZ + "x" + nT + " index");
		return entries[z * nT + t];
	}
	
	/**
	 * Get the plot-axis coordinates of all frames at one view position, i.e. {@code tcoords[z, :]}.
	 * @param z
	 * @return an array of length {@link #getSizeT()}
	 */
	public double[] getTCoordinates(int z) {
		double[] coords = new double[nT];
		for (int t = 0; t < nT; t++)
			coords[t] = getEntry(z, t).getTCoordinate();
		return coords;
	}
	
	/**
	 * Name of the attribute along the view axis.
	 * @return
	 */
	public String getZLabel() {
		return zLabel;
	}

	/**
	 * Name of the attribute along the plot axis.
	 * @return
	 */
	public String getTLabel() {
		return tLabel;
	}
	
	public int getSizeZ() {
		return nZ;
	}
	
	public int getSizeT() {
		return nT;
	}
	
	/**
	 * Get the range of plot-axis coordinates over all frames.
	 * @return the range, or null if no frame has a numeric coordinate
	 */
	public ValueRange getTRange() {
		return tRange;
	}
	
	/**
	 * Get the union of the display windows of all frames, 
	 * i.e. {@code [min(center - width/2), max(center + width/2)]}.
	 * @return the range, or null if no frame has a numeric window
	 */
	public ValueRange getWindowRange() {
		return windowRange;
	}

}
