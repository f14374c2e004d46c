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

import dbview.lib.dicom.PixelData;

/**
 * A surface that can show a single image plane.
 * 
 * @author DbView developers
 */
public interface FrameRenderer {
	
	/**
	 * Show a plane, mapped to display intensities through a window and colormap.
	 * 
	 * @param pixels the pixel values
	 * @param uid identifier of the image the plane belongs to
	 * @param center window center
	 * @param width window width
	 * @param colormap colormap name, or null for the default
	 */
	void showFrame(PixelData pixels, String uid, double center, double width, String colormap);
	
	/**
	 * Remove any displayed plane.
	 */
	default void clearFrame() {}

}
