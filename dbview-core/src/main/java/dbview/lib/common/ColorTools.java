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

package dbview.lib.common;

/**
 * Static functions to help work with RGB(A) colors using packed ints.
 * 
 * @author DbView developers
 *
 */
public final class ColorTools {

	// Suppressed default constructor for non-instantiability
	private ColorTools() {
		throw new AssertionError();
	}
	
	/**
	 * Packed int representing black.
	 */
	public static final int BLACK = packRGB(0, 0, 0);
	
	/**
	 * Packed int representing white.
	 */
	public static final int WHITE = packRGB(255, 255, 255);

	/**
	 * Make a packed RGB value from specified input values, with an alpha value of 255.
	 * Inputs are clipped to the range 0-255.
	 * 
	 * @param r
	 * @param g
	 * @param b
	 * @return
	 */
	public static int packRGB(int r, int g, int b) {
		return (255 << 24) | (do8BitRangeCheck(r) << 16) | (do8BitRangeCheck(g) << 8) | do8BitRangeCheck(b);
	}
	
	/**
	 * Extract the red component of a packed (A)RGB value.
	 * @param rgb
	 * @return
	 */
	public static int red(int rgb) {
		return (rgb >> 16) & 0xff;
	}

	/**
	 * Extract the green component of a packed (A)RGB value.
	 * @param rgb
	 * @return
	 */
	public static int green(int rgb) {
		return (rgb >> 8) & 0xff;
	}

	/**
	 * Extract the blue component of a packed (A)RGB value.
	 * @param rgb
	 * @return
	 */
	public static int blue(int rgb) {
		return rgb & 0xff;
	}
	
	/**
	 * Clip an input value to be an integer in the range 0-255.
	 * @param v
	 * @return
	 */
	public static int do8BitRangeCheck(int v) {
		return v < 0 ? 0 : (v > 255 ? 255 : v);
	}

}
