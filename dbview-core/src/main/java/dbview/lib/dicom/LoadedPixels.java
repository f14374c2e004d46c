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

package dbview.lib.dicom;

import java.io.IOException;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scoped access to the pixel data of a {@link DicomImage}.
 * The data is read on creation and released when the handle is closed, so it should be 
 * used in a try-with-resources block:
 * <pre>
 * try (var loaded = image.load()) {
 *     render(loaded.getPixels());
 * }
 * </pre>
 * 
 * @author DbView developers
 */
public final class LoadedPixels implements AutoCloseable {
	
	private static final Logger logger = LoggerFactory.getLogger(LoadedPixels.class);
	
	private final DicomImage image;
	private final PixelData pixels;
	private boolean closed = false;
	
	private LoadedPixels(DicomImage image, PixelData pixels) {
		this.image = image;
		this.pixels = pixels;
	}
	
	/**
	 * Read the pixel data of an image.
	 * @param image
	 * @return a handle that must be closed to release the data
	 * @throws IOException if the data cannot be read; in this case the image is cleared before returning
	 */
	public static LoadedPixels acquire(DicomImage image) throws IOException {
		Objects.requireNonNull(image);
		try {
			image.read();
			return new LoadedPixels(image, image.getPixels());
		} catch (IOException | RuntimeException e) {
			image.clear();
			throw e;
		}
	}
	
	/**
	 * Get the image whose pixels are loaded.
	 * @return
	 */
	public DicomImage getImage() {
		return image;
	}
	
	/**
	 * Get the pixel data. The returned object remains usable after this handle is closed.
	 * @return
	 */
	public PixelData getPixels() {
		return pixels;
	}

	@Override
	public void close() {
		if (closed)
			return;
		closed = true;
		image.clear();
		logger.trace("Released pixels for {}", image.getSopInstanceUID());
	}

}
