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


package dbview.lib.gui.display;

import java.io.IOException;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dbview.lib.dicom.ImageSeries;
import dbview.lib.display.SeriesCursor;
import dbview.lib.display.SeriesCursorListener;
import dbview.lib.display.SeriesDisplay4DModel;
import dbview.lib.interfaces.StatusMonitor;
import javafx.geometry.Orientation;
import javafx.scene.control.SplitPane;
import javafx.scene.layout.BorderPane;
import javafx.scene.layout.Pane;

/**
 * Display of a series sorted along a view axis (z) and a plot axis (t).
 * <p>
 * The left side shows the frame at (z, t) with a slider for z; the right side plots the signal 
 * over t at the pixel under the pointer, with a slider for t. 
 * Left/right arrow keys step through t, up/down through z.
 * 
 * @author DbView developers
 */
public class SeriesDisplay4D implements SeriesCursorListener {
	
	private static final Logger logger = LoggerFactory.getLogger(SeriesDisplay4D.class);
	
	private final SeriesCanvas canvas = new SeriesCanvas();
	private final PlotCurve plot = new PlotCurve();
	private final IndexSlider viewSlider = new IndexSlider(Orientation.HORIZONTAL);
	private final IndexSlider plotSlider = new IndexSlider(Orientation.HORIZONTAL);
	private final SeriesDisplay4DModel model;
	private final WindowToolBar toolBar;
	
	private final BorderPane pane = new BorderPane();
	
	private ImageSeries series;
	
	private boolean loading = false;
	
	/**
	 * Constructor.
	 * @param status receiver for progress while the series is sorted, and for the pixel value under the pointer
	 */
	public SeriesDisplay4D(StatusMonitor status) {
		model = new SeriesDisplay4DModel(canvas, plot, status);
		toolBar = new WindowToolBar(model);
		// Registered after the model, so sliders follow the cursor once the frame is shown
		model.getCursor().addListener(this);
		
		viewSlider.indexProperty().addListener((v, o, n) -> model.getCursor().setZ(n.intValue()));
		plotSlider.indexProperty().addListener((v, o, n) -> model.getCursor().setT(n.intValue()));
		canvas.setArrowKeyListener(model.getCursor()::handleArrowKey);
		canvas.setPointerListener(model::pointerMoved);
		
		var left = new BorderPane(canvas.getPane());
		left.setBottom(viewSlider.getSlider());
		var right = new BorderPane(plot.getPane());
		right.setBottom(plotSlider.getSlider());
		var split = new SplitPane(left, right);
		split.setDividerPositions(0.5);
		
		pane.setTop(toolBar.getToolBar());
		pane.setCenter(split);
	}
	
	/**
	 * Sort a series and show its first frame.
	 * @param series
	 * @param sortBy view axis attribute, followed by the plot axis attribute
	 * @throws IOException if the pixel data cannot be read
	 * @throws IllegalArgumentException if the series cannot be sorted into a complete 4D array
	 */
	public void setSeries(ImageSeries series, List<String> sortBy) throws IOException {
		loading = true;
		try {
			model.setSeries(series, sortBy);
		} finally {
			loading = false;
		}
		this.series = series;
		var cursor = model.getCursor();
		viewSlider.setMaximum(cursor.getSizeZ() - 1);
		plotSlider.setMaximum(cursor.getSizeT() - 1);
		viewSlider.setIndex(cursor.getZ());
		plotSlider.setIndex(cursor.getT());
		toolBar.updateSpinners();
		logger.debug("Showing series {} sorted by {}", series.getSeriesDescription(), sortBy);
	}
	
	/**
	 * Get the series being shown.
	 * @return
	 */
	public ImageSeries getSeries() {
		return series;
	}
	
	/**
	 * Get the model coordinating frame, status and plot.
	 * @return
	 */
	public SeriesDisplay4DModel getModel() {
		return model;
	}
	
	/**
	 * Get the pane containing the display.
	 * @return
	 */
	public Pane getPane() {
		return pane;
	}

	@Override
	public void cursorChanged(SeriesCursor cursor, int zOld, int tOld) {
		// Slider ranges are updated once the new series is loaded
		if (loading)
			return;
		viewSlider.setIndex(cursor.getZ());
		plotSlider.setIndex(cursor.getT());
	}

}
