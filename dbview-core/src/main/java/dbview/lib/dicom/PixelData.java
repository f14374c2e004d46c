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

import java.util.Objects;

/**
 * A 2D plane of pixel values, stored in row-major order.
 * 
 * @author DbView developers
 */
public class PixelData {
	
	private final int width;
	private final int height;
	private final double[] values;
	
	/**
	 * Constructor.
	 * @param width number of columns
	 * @param height number of rows
	 * @param values pixel values in row-major order; the array is used directly, not copied
	 * @throws IllegalArgumentException if the length of the array does not match the dimensions
	 */
	public PixelData(int width, int height, double[] values) {
		Objects.requireNonNull(values);
		if (width <= 0 || height <= 0)
			throw new IllegalArgumentException("Width and height must be > 0, but were " + width + " and " + height);
		if (values.length != width * height)
			throw new IllegalArgumentException("Expected " + (width * height) + " values, but found " + values.length);
		this.width = width;
		this.height = height;
		this.values = values;
	}
	
	/**
	 * Number of columns.
	 * @return
	 */
	public int getWidth() {
		return width;
	}
	
	/**
	 * Number of rows.
	 * @return
	 */
	public int getHeight() {
		return height;
	}
	
	/**
	 * Query whether a pixel coordinate lies inside the plane.
	 * @param x
	 * @param y
	 * @return
	 */
	public boolean contains(int x, int y) {
		return x >= 0 && x < width && y >= 0 && y < height;
	}
	
	/**
	 * Get a single pixel value.
	 * @param x
	 * @param y
	 * @return
	 * @throws IndexOutOfBoundsException if the coordinate is outside the plane
	 */
	public double getValue(int x, int y) {
		if (!contains(x, y))
			throw new IndexOutOfBoundsException("Pixel (" + x + ", " + y + ") is outside a " + width + "x" + height + " image");
		return values[y * width + x];
	}
	
	/**
	 * Get direct access to the values, in row-major order.
	 * @return
	 */
	public double[] getValues() {
		return values;
	}

	@Override
	public String toString() {
		return "PixelData [" + width + "x" + height + "]";
	}
	
}
