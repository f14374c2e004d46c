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
 * Pixel values of a series arranged as a 4D array (x, y, z, t), together with the header 
 * of the image providing each (z, t) frame.
 * <p>
 * Frames are stored contiguously, so extracting a single plane is a copy of one block of memory.
 * 
 * @author DbView developers
 */
public class SeriesArray {
	
	private final int width;
	private final int height;
	private final int nZ;
	private final int nT;
	private final double[] values;
	private final DicomImage[][] headers;
	
	/**
	 * Constructor.
	 * @param width number of columns in each frame
	 * @param height number of rows in each frame
	 * @param values all pixel values; frame (z, t) starts at {@code (t * nZ + z) * width * height}
	 *               and is stored in row-major order
	 * @param headers image headers indexed as {@code [z][t]}; these define nZ and nT
	 * @throws IllegalArgumentException if the dimensions are inconsistent
	 */
	public SeriesArray(int width, int height, double[] values, DicomImage[][] headers) {
		Objects.requireNonNull(values);
		Objects.requireNonNull(headers);
		if (width <= 0 || height <= 0)
			throw new IllegalArgumentException("Width and height must be > 0, but were " + width + " and " + height);
		if (headers.length == 0 || headers[0].length == 0)
			throw new IllegalArgumentException("A series array needs at least one frame");
		int nT = headers[0].length;
		for (var row : headers) {
			if (row.length != nT)
				throw new IllegalArgumentException("Header rows must all have the same length");
		}
		this.width = width;
		this.height = height;
		this.nZ = headers.length;
		this.nT = nT;
		long expected = (long)width * height * nZ * nT;
		if (values.length != expected)
			throw new IllegalArgumentException("Expected " + expected + " values, but found " + values.length);
		this.values = values;
		this.headers = headers;
	}
	
	/**
	 * Get the shape of the array as {@code [width, height, nZ, nT]}.
	 * @return
	 */
	public int[] getShape() {
		return new int[] {width, height, nZ, nT};
	}
	
	public int getWidth() {
		return width;
	}
	
	public int getHeight() {
		return height;
	}
	
	/**
	 * Number of positions along the view axis.
	 * @return
	 */
	public int getSizeZ() {
		return nZ;
	}

	/**
	 * Number of positions along the plot axis.
	 * @return
	 */
	public int getSizeT() {
		return nT;
	}
	
	/**
	 * Get the header of the image at a specific frame.
	 * @param z
	 * @param t
	 * @return the image header, or null if the frame has no image
	 */
	public DicomImage getHeader(int z, int t) {
		checkFrame(z, t);
		return headers[z][t];
	}
	
	/**
	 * Get a single value.
	 * @param x
	 * @param y
	 * @param z
	 * @param t
	 * @return
	 */
	public double getValue(int x, int y, int z, int t) {
		checkFrame(z, t);
		if (x < 0 || x >= width || y < 0 || y >= height)
			throw new IndexOutOfBoundsException("Pixel (" + x + ", " + y + ") is outside a " + width + "x" + height + " frame");
		return values[frameOffset(z, t) + y * width + x];
	}
	
	/**
	 * Get a copy of a single frame.
	 * @param z
	 * @param t
	 * @return
	 */
	public PixelData getFrame(int z, int t) {
		checkFrame(z, t);
		int n = width * height;
		double[] frame = new double[n];
		System.arraycopy(values, frameOffset(z, t), frame, 0, n);
		return new PixelData(width, height, frame);
	}
	
	/**
	 * Get the values at one pixel along the plot axis, i.e. {@code array[x, y, z, :]}.
	 * @param x
	 * @param y
	 * @param z
	 * @return an array of length nT
	 */
	public double[] getCurve(int x, int y, int z) {
		double[] curve = new double[nT];
		for (int t = 0; t < nT; t++)
			curve[t] = getValue(x, y, z, t);
		return curve;
	}
	
	private int frameOffset(int z, int t) {
		return (t * nZ + z) * width * height;
	}
	
	private void checkFrame(int z, int t) {
		if (z < 0 || z >= nZ || t < 0 || t >= nT)
			throw new IndexOutOfBoundsException("Frame (z=" + z + ", t=" + t + ") is outside a " + nZ + "x" + nT + " array");
	}

	@Override
	public String toString() {
		return "SeriesArray [" + width + "x" + height + "x" + nZ + "x" + nT + "]";
	}

}
