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
 * A plot showing a single curve with one highlighted point.
 * 
 * @author DbView developers
 */
public interface CurvePlot {
	
	void setXLabel(String label);
	
	void setYLabel(String label);
	
	/**
	 * Fix the range of the x-axis.
	 * @param range the range, or null to scale automatically
	 */
	void setXLimits(ValueRange range);
	
	/**
	 * Fix the range of the y-axis.
	 * @param range the range, or null to scale automatically
	 */
	void setYLimits(ValueRange range);
	
	/**
	 * Replace the curve.
	 * @param x x-coordinates
	 * @param y y-coordinates, same length as x
	 * @param highlightIndex index of the point to highlight, or -1 for none
	 */
	void setData(double[] x, double[] y, int highlightIndex);
	
	/**
	 * Remove the curve. Labels and limits are kept.
	 */
	void clear();

}
