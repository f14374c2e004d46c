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

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dbview.lib.common.GeneralTools;
import dbview.lib.dicom.ImageSeries;
import dbview.lib.dicom.SeriesArray;
import dbview.lib.interfaces.StatusMonitor;

/**
 * State and behavior of a 4D series display, independent of any user interface toolkit.
 * <p>
 * The model owns a {@link SeriesCursor} selecting the (z, t) frame and a {@link PixelProbe} 
 * tracking the pointer. Whenever either changes, the frame is sent to a {@link FrameRenderer}, 
 * the status text is recomputed and the signal curve {@code array[x, y, z, :]} is sent to a {@link CurvePlot}.
 * <p>
 * Plot limits are fixed when a series is loaded: the x-axis spans all plot-axis coordinates, 
 * the y-axis spans the union of all display windows. Cursor and pointer movement never change them; 
 * only {@link #setWindow(double, double)} and {@link #resetWindow()} do.
 * 
 * @author DbView developers
 */
public class SeriesDisplay4DModel implements SeriesCursorListener {
	
	private static final Logger logger = LoggerFactory.getLogger(SeriesDisplay4DModel.class);
	
	private static final int STATUS_DECIMAL_PLACES = 4;
	
	private final FrameRenderer renderer;
	private final CurvePlot plot;
	private final StatusMonitor status;
	
	private final SeriesCursor cursor = new SeriesCursor();
	private final PixelProbe probe = new PixelProbe();
	
	private SeriesArray array;
	private FrameIndex index;
	private String description;
	
	private ValueRange plotXRange;
	private ValueRange plotYRange;
	
	private boolean windowOverride = false;
	private double overrideCenter;
	private double overrideWidth;
	
	private String statusText = "";
	
	private boolean loading = false;
	
	/**
	 * Constructor.
	 * @param renderer surface showing the current frame
	 * @param plot plot showing the signal curve
	 * @param status receiver for status text and progress
	 */
	public SeriesDisplay4DModel(FrameRenderer renderer, CurvePlot plot, StatusMonitor status) {
		this.renderer = Objects.requireNonNull(renderer);
		this.plot = Objects.requireNonNull(plot);
		this.status = status == null ? StatusMonitor.silent() : status;
		cursor.addListener(this);
	}
	
	/**
	 * Load a series, sorting its images into a 4D array.
	 * 
	 * @param series the series
	 * @param sortBy exactly two attribute names; the first defines the view axis, the second the plot axis
	 * @throws IOException if the pixel data cannot be read
	 * @throws IllegalArgumentException if sortBy does not contain two names, or the sorted series has 
	 *                                  frames without an image
	 */
	public void setSeries(ImageSeries series, List<String> sortBy) throws IOException {
		Objects.requireNonNull(series);
		if (sortBy == null || sortBy.size() != 2)
			throw new IllegalArgumentException("Two sort keys are needed for a 4D display, but got " + sortBy);
		var newArray = series.array(sortBy, status);
		status.hide();
		setArray(newArray, sortBy.get(0), sortBy.get(1), series.getSeriesDescription());
	}
	
	/**
	 * Load an array that has already been sorted.
	 * 
	 * @param array the array
	 * @param zLabel attribute defining the view axis
	 * @param tLabel attribute defining the plot axis
	 * @param description label for the plot y-axis
	 */
	public void setArray(SeriesArray array, String zLabel, String tLabel, String description) {
		var newIndex = FrameIndex.build(array, zLabel, tLabel, status);
		status.hide();
		
		loading = true;
		try {
			this.array = array;
			this.index = newIndex;
			this.description = description;
			this.windowOverride = false;
			cursor.setBounds(array.getSizeZ(), array.getSizeT());
		} finally {
			loading = false;
		}
		
		plotXRange = newIndex.getTRange();
		plotYRange = newIndex.getWindowRange();
		plot.setXLabel(tLabel);
		plot.setYLabel(description);
		plot.setXLimits(plotXRange);
		plot.setYLimits(plotYRange);
		
		logger.debug("Showing {} as {} frames, plot range x={}, y={}", description, array, plotXRange, plotYRange);
		refresh();
	}
	
	/**
	 * Query whether a series has been loaded.
	 * @return
	 */
	public boolean hasSeries() {
		return array != null;
	}
	
	/**
	 * Redraw the frame, status text and curve.
	 */
	public void refresh() {
		if (array == null)
			return;
		updateStatus();
		updateFrame();
		updatePlot();
	}

	@Override
	public void cursorChanged(SeriesCursor cursor, int zOld, int tOld) {
		if (loading || array == null)
			return;
		updateFrame();
		updateStatus();
		updatePlot();
	}
	
	/**
	 * Record a new pointer position in image pixel coordinates, updating the status text and curve.
	 * @param x
	 * @param y
	 */
	public void pointerMoved(int x, int y) {
		probe.setCoordinate(x, y);
		if (array == null)
			return;
		updateStatus();
		updatePlot();
	}
	
	/**
	 * Apply the same display window to every frame, and fix the plot y-axis to the window.
	 * @param center
	 * @param width
	 * @throws IllegalArgumentException if width is not &gt; 0
	 */
	public void setWindow(double center, double width) {
		if (!(width > 0))
			throw new IllegalArgumentException("Window width must be > 0, but was " + width);
		windowOverride = true;
		overrideCenter = center;
		overrideWidth = width;
		plotYRange = ValueRange.ofWindow(center, width);
		plot.setYLimits(plotYRange);
		if (array == null)
			return;
		updateFrame();
		updatePlot();
	}
	
	/**
	 * Restore the display window of each frame and the plot y-axis computed when the series was loaded.
	 */
	public void resetWindow() {
		windowOverride = false;
		if (index == null)
			return;
		plotYRange = index.getWindowRange();
		plot.setYLimits(plotYRange);
		updateFrame();
		updatePlot();
	}
	
	/**
	 * Query whether a window set with {@link #setWindow(double, double)} is in use.
	 * @return
	 */
	public boolean isWindowOverridden() {
		return windowOverride;
	}
	
	/**
	 * Get the window center used to show the current frame.
	 * @return the center, or NaN if no series is loaded
	 */
	public double getWindowCenter() {
		if (windowOverride)
			return overrideCenter;
		return index == null ? Double.NaN : currentEntry().getWindowCenter();
	}
	
	/**
	 * Get the window width used to show the current frame.
	 * @return the width, or NaN if no series is loaded
	 */
	public double getWindowWidth() {
		if (windowOverride)
			return overrideWidth;
		return index == null ? Double.NaN : currentEntry().getWindowWidth();
	}
	
	private FrameEntry currentEntry() {
		return index.getEntry(cursor.getZ(), cursor.getT());
	}
	
	private void updateFrame() {
		var entry = currentEntry();
		renderer.showFrame(
				array.getFrame(cursor.getZ(), cursor.getT()),
				entry.getUID(),
				getWindowCenter(),
				getWindowWidth(),
				entry.getColormap());
	}
	
	private void updateStatus() {
		if (!probe.hasCoordinate())
			return;
		if (!isProbeInside()) {
			setStatusText("");
			return;
		}
		int x = probe.getX();
		int y = probe.getY();
		int z = cursor.getZ();
		int t = cursor.getT();
		var entry = currentEntry();
		String msg = index.getZLabel() + " = " + format(entry.getZCoordinate())
				+ ", " + index.getTLabel() + " = " + format(entry.getTCoordinate())
				+ ", x = " + x
				+ ", y = " + y
				+ ", signal = " + format(array.getValue(x, y, z, t));
		setStatusText(msg);
	}
	
	private void setStatusText(String text) {
		statusText = text;
		status.message(text);
	}
	
	private void updatePlot() {
		if (!probe.hasCoordinate())
			return;
		if (!isProbeInside()) {
			plot.clear();
			return;
		}
		int z = cursor.getZ();
		plot.setData(
				index.getTCoordinates(z),
				array.getCurve(probe.getX(), probe.getY(), z),
				cursor.getT());
	}
	
	private boolean isProbeInside() {
		return probe.isInside(array.getWidth(), array.getHeight());
	}
	
	private static String format(double value) {
		return GeneralTools.formatNumber(Locale.US, value, STATUS_DECIMAL_PLACES);
	}
	
	/**
	 * Get the last status text produced by the pointer probe.
	 * @return the text, empty if the pointer is outside the image or has not moved over it yet
	 */
	public String getStatusText() {
		return statusText;
	}
	
	public SeriesCursor getCursor() {
		return cursor;
	}
	
	public PixelProbe getProbe() {
		return probe;
	}
	
	/**
	 * Get the index of the loaded series.
	 * @return the index, or null if no series is loaded
	 */
	public FrameIndex getFrameIndex() {
		return index;
	}
	
	/**
	 * Get the loaded array.
	 * @return the array, or null if no series is loaded
	 */
	public SeriesArray getArray() {
		return array;
	}
	
	/**
	 * Get the description of the loaded series.
	 * @return
	 */
	public String getDescription() {
		return description;
	}
	
	/**
	 * Current x-axis limits of the plot.
	 * @return
	 */
	public ValueRange getPlotXRange() {
		return plotXRange;
	}
	
	/**
	 * Current y-axis limits of the plot.
	 * @return
	 */
	public ValueRange getPlotYRange() {
		return plotYRange;
	}

}
