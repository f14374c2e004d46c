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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dbview.fx.dialogs.Dialogs;
import dbview.lib.dicom.ImageSeries;
import dbview.lib.display.SeriesBrowser;
import dbview.lib.display.SeriesCursor.ArrowKey;
import dbview.lib.interfaces.StatusMonitor;
import javafx.geometry.Orientation;
import javafx.scene.layout.BorderPane;
import javafx.scene.layout.Pane;

/**
 * Display of a series one image at a time, in stored order, with a slider to select the image.
 * 
 * @author DbView developers
 */
public class SeriesDisplay {
	
	private static final Logger logger = LoggerFactory.getLogger(SeriesDisplay.class);
	
	private final SeriesCanvas canvas = new SeriesCanvas();
	private final IndexSlider slider = new IndexSlider(Orientation.HORIZONTAL);
	private final SeriesBrowser browser;
	private final BorderPane pane = new BorderPane();
	
	private ImageSeries series;
	
	/**
	 * Constructor.
	 * @param status receiver for the pixel value under the pointer
	 */
	public SeriesDisplay(StatusMonitor status) {
		browser = new SeriesBrowser(canvas, status);
		pane.setCenter(canvas.getPane());
		pane.setBottom(slider.getSlider());
		slider.indexProperty().addListener((v, o, n) -> select(n.intValue()));
		canvas.setArrowKeyListener(this::handleArrowKey);
		canvas.setPointerListener(browser::pointerMoved);
	}
	
	/**
	 * Show a series, starting at its first image.
	 * @param series
	 * @throws IOException if the first image cannot be read
	 */
	public void setSeries(ImageSeries series) throws IOException {
		this.series = series;
		browser.setSeries(series);
		slider.setIndex(0);
		slider.setMaximum(browser.size() - 1);
		logger.debug("Showing series {} ({} images)", series.getSeriesDescription(), browser.size());
	}
	
	/**
	 * Get the series being shown.
	 * @return
	 */
	public ImageSeries getSeries() {
		return series;
	}
	
	/**
	 * Get the pane containing the display.
	 * @return
	 */
	public Pane getPane() {
		return pane;
	}
	
	private void select(int index) {
		try {
			browser.setIndex(index);
		} catch (IOException e) {
			Dialogs.showErrorNotification("Display series", e);
		}
	}
	
	private void handleArrowKey(ArrowKey key) {
		try {
			if (browser.handleArrowKey(key))
				slider.setIndex(browser.getIndex());
		} catch (IOException e) {
			Dialogs.showErrorNotification("Display series", e);
		}
	}

}
