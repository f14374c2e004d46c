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

import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dbview.lib.color.ColorMaps;
import dbview.lib.dicom.PixelData;
import dbview.lib.display.FrameRenderer;
import dbview.lib.display.SeriesCursor.ArrowKey;
import javafx.scene.image.ImageView;
import javafx.scene.image.PixelFormat;
import javafx.scene.image.WritableImage;
import javafx.scene.input.KeyEvent;
import javafx.scene.input.MouseEvent;
import javafx.scene.layout.Pane;
import javafx.scene.layout.StackPane;

/**
 * Canvas showing one frame of a series, scaled to fit while preserving its aspect ratio.
 * <p>
 * Pointer positions are reported in image pixel coordinates, and arrow keys are reported while the 
 * canvas has the focus.
 * 
 * @author DbView developers
 */
public class SeriesCanvas implements FrameRenderer {
	
	private static final Logger logger = LoggerFactory.getLogger(SeriesCanvas.class);
	
	/**
	 * Listener for pointer movements over the image.
	 */
	@FunctionalInterface
	public static interface PointerListener {
		
		/**
		 * Called when the pointer moves over the canvas.
		 * @param x pixel column; may be outside the image
		 * @param y pixel row; may be outside the image
		 */
		void pointerMoved(int x, int y);
		
	}
	
	private final ImageView imageView = new ImageView();
	private final StackPane pane = new StackPane(imageView);
	
	private WritableImage image;
	private String uid;
	private double center = Double.NaN;
	private double width = Double.NaN;
	private String colormap;
	
	private PointerListener pointerListener;
	private Consumer<ArrowKey> arrowKeyListener;
	
	/**
	 * Constructor.
	 */
	public SeriesCanvas() {
		pane.setStyle("-fx-background-color: black;");
		pane.setMinSize(100, 100);
		pane.setFocusTraversable(true);
		imageView.setPreserveRatio(true);
		imageView.setSmooth(false);
		imageView.fitWidthProperty().bind(pane.widthProperty());
		imageView.fitHeightProperty().bind(pane.heightProperty());
		imageView.setOnMouseMoved(this::handleMouseMoved);
		imageView.setOnMouseDragged(this::handleMouseMoved);
		pane.setOnMouseClicked(e -> pane.requestFocus());
		pane.addEventFilter(KeyEvent.KEY_PRESSED, this::handleKeyPressed);
	}
	
	/**
	 * Get the pane containing the image.
	 * @return
	 */
	public Pane getPane() {
		return pane;
	}
	
	/**
	 * Set the listener notified when the pointer moves over the image.
	 * @param listener
	 */
	public void setPointerListener(PointerListener listener) {
		this.pointerListener = listener;
	}
	
	/**
	 * Set the listener notified when an arrow key is pressed.
	 * @param listener
	 */
	public void setArrowKeyListener(Consumer<ArrowKey> listener) {
		this.arrowKeyListener = listener;
	}

	@Override
	public void showFrame(PixelData pixels, String uid, double center, double width, String colormap) {
		int w = pixels.getWidth();
		int h = pixels.getHeight();
		if (image == null || (int)image.getWidth() != w || (int)image.getHeight() != h) {
			image = new WritableImage(w, h);
			imageView.setImage(image);
		}
		if (!(width > 0)) {
			logger.debug("Invalid window width {} for {}, using the full range of values", width, uid);
			double min = Double.POSITIVE_INFINITY;
			double max = Double.NEGATIVE_INFINITY;
			for (double v : pixels.getValues()) {
				if (v < min)
					min = v;
				if (v > max)
					max = v;
			}
			center = (min + max) / 2.0;
			width = max > min ? max - min : 1.0;
		}
		int[] rgb = ColorMaps.applyWindow(pixels.getValues(), center, width, ColorMaps.getColorMap(colormap));
		image.getPixelWriter().setPixels(0, 0, w, h, PixelFormat.getIntArgbInstance(), rgb, 0, w);
		this.uid = uid;
		this.center = center;
		this.width = width;
		this.colormap = colormap;
	}
	
	@Override
	public void clearFrame() {
		image = null;
		uid = null;
		imageView.setImage(null);
	}
	
	/**
	 * Get the identifier of the image currently shown.
	 * @return
	 */
	public String getUID() {
		return uid;
	}
	
	/**
	 * Get the window center used for the current frame.
	 * @return
	 */
	public double getCenter() {
		return center;
	}
	
	/**
	 * Get the window width used for the current frame.
	 * @return
	 */
	public double getWidth() {
		return width;
	}
	
	/**
	 * Get the name of the colormap requested for the current frame.
	 * @return
	 */
	public String getColormap() {
		return colormap;
	}
	
	private void handleMouseMoved(MouseEvent event) {
		if (image == null || pointerListener == null)
			return;
		var bounds = imageView.getLayoutBounds();
		if (bounds.getWidth() <= 0 || bounds.getHeight() <= 0)
			return;
		int x = (int)Math.floor(event.getX() / bounds.getWidth() * image.getWidth());
		int y = (int)Math.floor(event.getY() / bounds.getHeight() * image.getHeight());
		pointerListener.pointerMoved(x, y);
	}
	
	private void handleKeyPressed(KeyEvent event) {
		if (arrowKeyListener == null)
			return;
		ArrowKey key;
		switch (event.getCode()) {
		case LEFT:
			key = ArrowKey.LEFT;
			break;
		case RIGHT:
			key = ArrowKey.RIGHT;
			break;
		case UP:
			key = ArrowKey.UP;
			break;
		case DOWN:
			key = ArrowKey.DOWN;
			break;
		default:
			return;
		}
		arrowKeyListener.accept(key);
		event.consume();
	}

}
