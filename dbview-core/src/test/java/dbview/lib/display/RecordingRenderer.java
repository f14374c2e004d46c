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

import java.util.ArrayList;
import java.util.List;

import dbview.lib.dicom.PixelData;

/**
 * Renderer that records the frames it is asked to show.
 */
@SuppressWarnings("javadoc")
public class RecordingRenderer implements FrameRenderer {
	
	final List<String> uids = new ArrayList<>();
	PixelData pixels;
	double center = Double.NaN;
	double width = Double.NaN;
	String colormap;
	int clearCount = 0;

	@Override
	public void showFrame(PixelData pixels, String uid, double center, double width, String colormap) {
		this.uids.add(uid);
		this.pixels = pixels;
		this.center = center;
		this.width = width;
		this.colormap = colormap;
	}
	
	@Override
	public void clearFrame() {
		pixels = null;
		clearCount++;
	}
	
	String lastUID() {
		return uids.isEmpty() ? null : uids.get(uids.size() - 1);
	}

}
