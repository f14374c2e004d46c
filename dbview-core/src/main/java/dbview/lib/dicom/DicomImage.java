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
import java.util.Collections;
import java.util.List;

/**
 * A single DICOM image (instance).
 * <p>
 * Pixel data is loaded lazily with {@link #read()} and released with {@link #clear()}. 
 * Callers should prefer {@link #load()}, which pairs the two in a try-with-resources block.
 * 
 * @author DbView developers
 */
public interface DicomImage extends DicomRecord {
	
	/**
	 * Get the unique instance identifier.
	 * @return
	 */
	String getSopInstanceUID();
	
	/**
	 * Get the center of the display window.
	 * @return
	 */
	double getWindowCenter();
	
	/**
	 * Get the width of the display window; this should be &gt; 0 for a valid display.
	 * @return
	 */
	double getWindowWidth();
	
	/**
	 * Get the name of the colormap used to display the image.
	 * @return the colormap name, or null if none is set
	 */
	String getColormap();
	
	/**
	 * Get the value of a header attribute.
	 * @param attribute the attribute keyword, e.g. {@code "SliceLocation"}
	 * @return the value, or null if the attribute is not present
	 */
	Object getValue(String attribute);
	
	/**
	 * Read the pixel data into memory.
	 * @throws IOException
	 */
	void read() throws IOException;
	
	/**
	 * Get the pixel data. {@link #read()} must have been called first.
	 * @return
	 * @throws IllegalStateException if the pixel data has not been read
	 */
	PixelData getPixels();
	
	/**
	 * Release the pixel data held in memory.
	 */
	void clear();
	
	/**
	 * Read the pixel data, returning a handle that releases it when closed.
	 * @return
	 * @throws IOException
	 */
	default LoadedPixels load() throws IOException {
		return LoadedPixels.acquire(this);
	}
	
	@Override
	default DicomLevel getLevel() {
		return DicomLevel.INSTANCE;
	}
	
	@Override
	default String getLabel() {
		return getSopInstanceUID();
	}
	
	@Override
	default List<? extends DicomRecord> getChildren() {
		return Collections.emptyList();
	}

}
