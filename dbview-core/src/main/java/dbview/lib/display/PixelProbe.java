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

/**
 * The last pointer position over a displayed image, in image pixel coordinates.
 * <p>
 * The probe is undefined until the pointer first moves over the display.
 * 
 * @author DbView developers
 */
public class PixelProbe {
	
	private boolean hasCoordinate = false;
	private int x;
	private int y;
	
	/**
	 * Record a pointer position. The position may lie outside the image.
	 * @param x
	 * @param y
	 */
	public void setCoordinate(int x, int y) {
		this.x = x;
		this.y = y;
		this.hasCoordinate = true;
	}
	
	/**
	 * Forget the pointer position.
	 */
	public void clear() {
		hasCoordinate = false;
	}
	
	/**
	 * Query whether the pointer has moved over the display since creation or the last {@link #clear()}.
	 * @return
	 */
	public boolean hasCoordinate() {
		return hasCoordinate;
	}
	
	/**
	 * Query whether the probe lies inside an image of the given size.
	 * @param width
	 * @param height
	 * @return false if there is no coordinate
	 */
	public boolean isInside(int width, int height) {
		return hasCoordinate && x >= 0 && x < width && y >= 0 && y < height;
	}
	
	public int getX() {
		return x;
	}
	
	public int getY() {
		return y;
	}

	@Override
	public String toString() {
		return hasCoordinate ? "PixelProbe [" + x + ", " + y + "]" : "PixelProbe [undefined]";
	}

}
