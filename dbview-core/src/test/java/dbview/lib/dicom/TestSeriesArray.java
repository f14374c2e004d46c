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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

@SuppressWarnings("javadoc")
public class TestSeriesArray {
	
	/**
	 * Array of 2x2 frames where each value encodes its position as 1000*t + 100*z + 10*y + x.
	 */
	static SeriesArray createArray(int nZ, int nT) {
		int w = 2, h = 2;
		double[] values = new double[w * h * nZ * nT];
		var headers = new DicomImage[nZ][nT];
		for (int t = 0; t < nT; t++) {
			for (int z = 0; z < nZ; z++) {
				headers[z][t] = new MockImage("uid-" + z + "-" + t, 0, 1);
				for (int y = 0; y < h; y++) {
					for (int x = 0; x < w; x++)
						values[((t * nZ + z) * h + y) * w + x] = 1000 * t + 100 * z + 10 * y + x;
				}
			}
		}
		return new SeriesArray(w, h, values, headers);
	}
	
	@Test
	public void test_layout() {
		var array = createArray(3, 4);
		assertArrayEquals(new int[] {2, 2, 3, 4}, array.getShape());
		assertEquals(2211, array.getValue(1, 1, 2, 2));
		assertEquals(3100, array.getValue(0, 0, 1, 3));
		assertEquals(1201, array.getValue(1, 0, 2, 1));
		assertEquals("uid-2-3", array.getHeader(2, 3).getSopInstanceUID());
	}
	
	@Test
	public void test_frameAndCurve() {
		var array = createArray(2, 3);
		var frame = array.getFrame(1, 2);
		assertEquals(2, frame.getWidth());
		assertArrayEquals(new double[] {2100, 2101, 2110, 2111}, frame.getValues());
		assertArrayEquals(new double[] {111, 1111, 2111}, array.getCurve(1, 1, 1));
	}
	
	@Test
	public void test_bounds() {
		var array = createArray(2, 3);
		assertThrows(IndexOutOfBoundsException.class, () -> array.getValue(2, 0, 0, 0));
		assertThrows(IndexOutOfBoundsException.class, () -> array.getFrame(2, 0));
		assertThrows(IndexOutOfBoundsException.class, () -> array.getHeader(0, 3));
	}
	
	@Test
	public void test_missingHeaderAllowed() {
		var headers = new DicomImage[][] {{new MockImage("a", 0, 1), null}};
		var array = new SeriesArray(1, 1, new double[2], headers);
		assertNull(array.getHeader(0, 1));
	}
	
	@Test
	public void test_inconsistentSizes() {
		var headers = new DicomImage[1][2];
		assertThrows(IllegalArgumentException.class, () -> new SeriesArray(1, 1, new double[3], headers));
		assertThrows(IllegalArgumentException.class, () -> new SeriesArray(0, 1, new double[0], headers));
		assertThrows(IllegalArgumentException.class, () -> new SeriesArray(1, 1, new double[2], new DicomImage[][] {{null, null}, {null}}));
	}

}
