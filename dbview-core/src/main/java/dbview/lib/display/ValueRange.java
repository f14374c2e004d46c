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
 * An immutable closed interval of values, such as the limits of a plot axis.
 */
public final class ValueRange {
	
	private final double min;
	private final double max;
	
	private ValueRange(double min, double max) {
		this.min = min;
		this.max = max;
	}
	
	/**
	 * Create a range.
	 * @param min
	 * @param max
	 * @return
	 * @throws IllegalArgumentException if min &gt; max
	 */
	public static ValueRange of(double min, double max) {
		if (min > max)
			throw new IllegalArgumentException("Range minimum " + min + " is greater than maximum " + max);
		return new ValueRange(min, max);
	}
	
	/**
	 * Create the range covered by a display window.
	 * @param center window center
	 * @param width window width
	 * @return {@code [center - width/2, center + width/2]}
	 */
	public static ValueRange ofWindow(double center, double width) {
		double half = Math.abs(width) / 2.0;
		return new ValueRange(center - half, center + half);
	}
	
	public double getMin() {
		return min;
	}
	
	public double getMax() {
		return max;
	}
	
	/**
	 * Get the difference between maximum and minimum.
	 * @return
	 */
	public double getLength() {
		return max - min;
	}

	@Override
	public int hashCode() {
		return Double.hashCode(min) * 31 + Double.hashCode(max);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof ValueRange))
			return false;
		ValueRange other = (ValueRange)obj;
		return Double.compare(min, other.min) == 0 && Double.compare(max, other.max) == 0;
	}

	@Override
	public String toString() {
		return "[" + min + ", " + max + "]";
	}

}
