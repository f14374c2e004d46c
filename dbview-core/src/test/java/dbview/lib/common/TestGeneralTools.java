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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Locale;

import org.junit.jupiter.api.Test;

@SuppressWarnings("javadoc")
public class TestGeneralTools {
	
	@Test
	public void test_toDouble() {
		assertEquals(2.5, GeneralTools.toDouble(2.5));
		assertEquals(3.0, GeneralTools.toDouble(3));
		assertEquals(-12.25, GeneralTools.toDouble(" -12.25 "));
		assertTrue(Double.isNaN(GeneralTools.toDouble("abc")));
		assertTrue(Double.isNaN(GeneralTools.toDouble(null)));
		assertTrue(Double.isNaN(GeneralTools.toDouble(new Object())));
	}
	
	@Test
	public void test_minMax() {
		assertEquals(-1.0, GeneralTools.min(3, Double.NaN, -1, 2));
		assertEquals(3.0, GeneralTools.max(3, Double.NaN, -1, 2));
		assertTrue(Double.isNaN(GeneralTools.min()));
		assertTrue(Double.isNaN(GeneralTools.max(Double.NaN)));
	}
	
	@Test
	public void test_clipValue() {
		assertEquals(0, GeneralTools.clipValue(-3, 0, 5));
		assertEquals(5, GeneralTools.clipValue(8, 0, 5));
		assertEquals(2, GeneralTools.clipValue(2, 0, 5));
		assertEquals(0.5, GeneralTools.clipValue(0.5, 0.0, 1.0));
	}
	
	@Test
	public void test_formatNumber() {
		assertEquals("10", GeneralTools.formatNumber(Locale.US, 10.0, 4));
		assertEquals("1.5", GeneralTools.formatNumber(Locale.US, 1.5, 4));
		assertEquals("0.3333", GeneralTools.formatNumber(Locale.US, 1.0/3.0, 4));
		assertEquals("12345", GeneralTools.formatNumber(Locale.US, 12345, 2));
		assertEquals("NaN", GeneralTools.formatNumber(Locale.US, Double.NaN, 2));
	}
	
	@Test
	public void test_blankString() {
		assertTrue(GeneralTools.blankString(null, false));
		assertTrue(GeneralTools.blankString("  ", true));
		assertEquals(false, GeneralTools.blankString("  ", false));
	}

}
