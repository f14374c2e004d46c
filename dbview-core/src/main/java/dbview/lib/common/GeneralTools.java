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

import java.text.NumberFormat;
import java.util.HashMap;
import java.util.Locale;
import java.util.Locale.Category;
import java.util.Map;

/**
 * A collection of generally-useful static methods.
 * 
 * @author DbView developers
 */
public final class GeneralTools {
	
	// Suppressed default constructor for non-instantiability
	private GeneralTools() {
		throw new AssertionError();
	}
	
	private static final Map<Locale, NumberFormat> formatters = new HashMap<>();
	
	/**
	 * Check if a string is null or empty, optionally trimming it first.
	 * 
	 * @param s
	 * @param trim
	 * @return
	 */
	public static boolean blankString(final String s, final boolean trim) {
		if (s == null)
			return true;
		return trim ? s.trim().isEmpty() : s.isEmpty();
	}
	
	/**
	 * Clip a value to be within a specific range.
	 * 
	 * @param value
	 * @param min
	 * @param max
	 * @return
	 */
	public static int clipValue(final int value, final int min, final int max) {
		return value < min ? min : (value > max ? max : value);
	}
	
	/**
	 * Clip a value to be within a specific range.
	 * 
	 * @param value
	 * @param min
	 * @param max
	 * @return
	 */
	public static double clipValue(final double value, final double min, final double max) {
		return value < min ? min : (value > max ? max : value);
	}
	
	/**
	 * Format a value with a maximum number of decimal places, using the default format locale.
	 * 
	 * @param value
	 * @param maxDecimalPlaces
	 * @return
	 */
	public synchronized static String formatNumber(final double value, final int maxDecimalPlaces) {
		return formatNumber(Locale.getDefault(Category.FORMAT), value, maxDecimalPlaces);
	}
	
	/**
	 * Format a value with a maximum number of decimal places, using a specified Locale.
	 * 
	 * @param locale
	 * @param value
	 * @param maxDecimalPlaces
	 * @return
	 */
	public synchronized static String formatNumber(final Locale locale, final double value, final int maxDecimalPlaces) {
		if (Double.isNaN(value))
			return "NaN";
		NumberFormat nf = formatters.get(locale);
		if (nf == null) {
			nf = NumberFormat.getInstance(locale);
			nf.setGroupingUsed(false);
			formatters.put(locale, nf);
		}
		nf.setMaximumFractionDigits(maxDecimalPlaces);
		return nf.format(value);
	}
	
	/**
	 * Convert a DICOM attribute value to a double, if possible.
	 * Numbers are converted directly, strings are parsed; anything else gives NaN.
	 * 
	 * @param value
	 * @return the numeric value, or NaN if the value is missing or not numeric
	 */
	public static double toDouble(final Object value) {
		if (value instanceof Number)
			return ((Number)value).doubleValue();
		if (value instanceof String) {
			try {
				return Double.parseDouble(((String)value).trim());
			} catch (NumberFormatException e) {
				return Double.NaN;
			}
		}
		return Double.NaN;
	}
	
	/**
	 * Get the minimum of an array, ignoring NaNs.
	 * @param values
	 * @return the minimum, or NaN if the array contains no finite values
	 */
	public static double min(final double... values) {
		double min = Double.POSITIVE_INFINITY;
		for (double v : values) {
			if (v < min)
				min = v;
		}
		return Double.isInfinite(min) ? Double.NaN : min;
	}
	
	/**
	 * Get the maximum of an array, ignoring NaNs.
	 * @param values
	 * @return the maximum, or NaN if the array contains no finite values
	 */
	public static double max(final double... values) {
		double max = Double.NEGATIVE_INFINITY;
		for (double v : values) {
			if (v > max)
				max = v;
		}
		return Double.isInfinite(max) ? Double.NaN : max;
	}

}
