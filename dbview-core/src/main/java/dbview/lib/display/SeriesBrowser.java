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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dbview.lib.common.GeneralTools;
import dbview.lib.dicom.DicomImage;
import dbview.lib.dicom.ImageSeries;
import dbview.lib.dicom.PixelData;
import dbview.lib.display.SeriesCursor.ArrowKey;
import dbview.lib.display.SeriesCursor.Direction;
import dbview.lib.interfaces.StatusMonitor;

/**
 * State and behavior of a 2D series display, stepping through the images of a series in their stored order.
 * <p>
 * Each time the selected image changes its pixel data is read, shown and released again; 
 * only the plane most recently shown is kept for the pixel probe.
 * 
 * @author DbView developers
 */
public class SeriesBrowser {
	
	private static final Logger logger = LoggerFactory.getLogger(SeriesBrowser.class);
	
	private final FrameRenderer renderer;
	private final StatusMonitor status;
	private final PixelProbe probe = new PixelProbe();
	
	private List<DicomImage> images = Collections.emptyList();
	private int index = 0;
	private PixelData displayed;
	
	/**
	 * Constructor.
	 * @param renderer surface showing the current image
	 * @param status receiver for the pixel probe text
	 */
	public SeriesBrowser(FrameRenderer renderer, StatusMonitor status) {
		this.renderer = Objects.requireNonNull(renderer);
		this.status = status == null ? StatusMonitor.silent() : status;
	}
	
	/**
	 * Show the first image of a series.
	 * @param series
	 * @throws IOException if the pixel data cannot be read
	 */
	public void setSeries(ImageSeries series) throws IOException {
		setImages(series.getImages());
	}
	
	/**
	 * Show the first image of a list.
	 * @param images
	 * @throws IOException if the pixel data cannot be read
	 */
	public void setImages(List<? extends DicomImage> images) throws IOException {
		this.images = images == null ? Collections.emptyList() : new ArrayList<>(images);
		this.index = 0;
		this.displayed = null;
		show(0);
	}
	
	/**
	 * Number of images.
	 * @return
	 */
	public int size() {
		return images.size();
	}
	
	/**
	 * Index of the image being shown.
	 * @return
	 */
	public int getIndex() {
		return index;
	}
	
	/**
	 * Get the image being shown.
	 * @return the image, or null if there are no images
	 */
	public DicomImage getImage() {
		return images.isEmpty() ? null : images.get(index);
	}
	
	/**
	 * Select an image, clamping the index to the available range.
	 * @param index
	 * @return true if the selected image changed
	 * @throws IOException if the pixel data cannot be read
	 */
	public boolean setIndex(int index) throws IOException {
		if (images.isEmpty())
			return false;
		int newIndex = GeneralTools.clipValue(index, 0, images.size() - 1);
		if (newIndex == this.index)
			return false;
		show(newIndex);
		return true;
	}
	
	/**
	 * Step to the next or previous image.
	 * @param direction
	 * @return true if the selected image changed
	 * @throws IOException if the pixel data cannot be read
	 */
	public boolean move(Direction direction) throws IOException {
		return setIndex(index + (direction == Direction.UP ? 1 : -1));
	}
	
	/**
	 * Left and down select the previous image, right and up the next.
	 * @param key
	 * @return true if the selected image changed
	 * @throws IOException if the pixel data cannot be read
	 */
	public boolean handleArrowKey(ArrowKey key) throws IOException {
		switch (key) {
		case LEFT:
		case DOWN:
			return move(Direction.DOWN);
		case RIGHT:
		case UP:
			return move(Direction.UP);
		default:
			throw new IllegalArgumentException("Unknown key " + key);
		}
	}
	
	/**
	 * Read and show the current image again.
	 * @throws IOException if the pixel data cannot be read
	 */
	public void refresh() throws IOException {
		show(index);
	}
	
	/**
	 * Read and show an image. The index and the pixels read under the pointer change only once the read succeeded.
	 */
	private void show(int newIndex) throws IOException {
		if (images.isEmpty()) {
			displayed = null;
			renderer.clearFrame();
			return;
		}
		var image = images.get(newIndex);
		try (var loaded = image.load()) {
			var pixels = loaded.getPixels();
			renderer.showFrame(pixels,
					image.getSopInstanceUID(),
					image.getWindowCenter(),
					image.getWindowWidth(),
					image.getColormap());
			index = newIndex;
			displayed = pixels;
		}
		logger.trace("Showing image {} of {}", index + 1, images.size());
		updateStatus();
	}
	
	/**
	 * Record a new pointer position in image pixel coordinates, updating the status text.
	 * @param x
	 * @param y
	 */
	public void pointerMoved(int x, int y) {
		probe.setCoordinate(x, y);
		updateStatus();
	}
	
	private void updateStatus() {
		if (!probe.hasCoordinate())
			return;
		if (displayed == null || !probe.isInside(displayed.getWidth(), displayed.getHeight())) {
			status.message("");
			return;
		}
		int x = probe.getX();
		int y = probe.getY();
		status.message("x = " + x + ", y = " + y + ", signal = " 
				+ GeneralTools.formatNumber(Locale.US, displayed.getValue(x, y), 4));
	}
	
	public PixelProbe getProbe() {
		return probe;
	}

}
