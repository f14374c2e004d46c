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

package dbview.lib.color;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dbview.lib.common.ColorTools;

/**
 * Helper class to manage colormaps, which are rather like lookup tables but easily support interpolation.
 * <p>
 * Images in a DICOM database name their colormap with a string (e.g. {@code "gray"} or {@code "jet"}); 
 * names are matched here without regard to case.
 * 
 * @author DbView developers
 */
public class ColorMaps {
	
	private static final Logger logger = LoggerFactory.getLogger(ColorMaps.class);
	
	private static final ColorMap GRAY = createColorMap("Gray", 255, 255, 255);
	
	private static final List<ColorMap> SINGLE_COLOR_MAPS = Arrays.asList(
			GRAY,
			createColorMap("Red", 255, 0, 0),
			createColorMap("Green", 0, 255, 0),
			createColorMap("Blue", 0, 0, 255),
			createColorMap("Magenta", 255, 0, 255),
			createColorMap("Yellow", 255, 255, 0),
			createColorMap("Cyan", 0, 255, 255)
			);
	
	private static final List<ColorMap> INTERPOLATED_COLOR_MAPS = Arrays.asList(
			createColorMap("Jet",
					new int[] {0, 0,   0,   0,   255, 255},
					new int[] {0, 0,   255, 255, 255, 0},
					new int[] {0, 255, 255, 0,   0,   0}),
			createColorMap("Hot",
					new int[] {0, 255, 255, 255},
					new int[] {0, 0,   255, 255},
					new int[] {0, 0,   0,   255}),
			createColorMap("Viridis",
					new int[] {68, 59,  33,  94,  253},
					new int[] {1,  82,  145, 201, 231},
					new int[] {84, 139, 140, 98,  37})
			);
	
	private static ColorMap defaultColorMap = GRAY;

	private static final Map<String, ColorMap> maps = new LinkedHashMap<>();
	private static final Map<String, ColorMap> mapsUnmodifiable = Collections.unmodifiableMap(maps);
	
	static {
		for (var cm : SINGLE_COLOR_MAPS)
			maps.put(cm.getName(), cm);
		for (var cm : INTERPOLATED_COLOR_MAPS)
			maps.put(cm.getName(), cm);
	}
		
	/**
	 * colormap, which acts as an interpolating lookup table with an arbitrary range.
	 */
	public interface ColorMap {
		
		/**
		 * Get the name of the colormap.
		 * @return
		 */
		public String getName();

		/**
		 * Get a packed ARGB representation of the (interpolated) color at the specified value.
		 * @param value value that should be colorized
		 * @param minValue minimum display value, corresponding to the first color in the lookup table of this map
		 * @param maxValue maximum display value, corresponding to the last color in the lookup table of this map
		 * @return
		 */
		public int getColor(double value, double minValue, double maxValue);

	}
	
	/**
	 * Get the colormap with the specified name, ignoring case.
	 * If the name is null, blank or unknown, the default colormap is returned.
	 * 
	 * @param name the colormap name, as stored with an image
	 * @return a colormap (never null)
	 * @see #getDefaultColorMap()
	 */
	public static ColorMap getColorMap(String name) {
		if (name == null || name.isBlank())
			return defaultColorMap;
		String key = name.trim().toLowerCase(Locale.ROOT);
		if ("grey".equals(key) || "greys".equals(key) || "grayscale".equals(key))
			key = "gray";
		for (var entry : maps.entrySet()) {
			if (entry.getKey().toLowerCase(Locale.ROOT).equals(key))
				return entry.getValue();
		}
		logger.debug("Unknown colormap '{}', using {}", name, defaultColorMap.getName());
		return defaultColorMap;
	}
	
	/**
	 * Get a default, general-purpose {@link ColorMap}.
	 * @return
	 * @see #setDefaultColorMap(ColorMap)
	 */
	public static ColorMap getDefaultColorMap() {
		return defaultColorMap;
	}
	
	/**
	 * Set the default {@link ColorMap}, used whenever an image does not name a known colormap.
	 * @param colorMap
	 * @see #getDefaultColorMap()
	 */
	public static void setDefaultColorMap(ColorMap colorMap) {
		Objects.requireNonNull(colorMap);
		defaultColorMap = colorMap;
	}
	
	/**
	 * Get an unmodifiable map representing all the currently-available colormaps.
	 * 
	 * @return the available colormaps
	 */
	public static Map<String, ColorMap> getColorMaps() {
		return mapsUnmodifiable;
	}
	
	/**
	 * Create a colormap using integer values for red, green and blue.
	 * These should be in the range 0-255, and the arrays should have the same length (at least 2).
	 * @param name
	 * @param r
	 * @param g
	 * @param b
	 * @return
	 */
	public static ColorMap createColorMap(String name, int[] r, int[] g, int[] b) {
		if (r.length < 2 || r.length != g.length || r.length != b.length)
			throw new IllegalArgumentException("Colormap arrays must have the same length, and at least 2 values");
		return new DefaultColorMap(name, r, g, b);
	}
	
	/**
	 * Create a colormap using int values for red, green and blue corresponding to the maximum value; 
	 * the minimum color will be black.
	 * These should be in the range 0-255.
	 * @param name
	 * @param r
	 * @param g
	 * @param b
	 * @return
	 */
	public static ColorMap createColorMap(String name, int r, int g, int b) {
		return new SingleColorMap(name, r, g, b);
	}
	

	/**
	 * Map pixel values to packed ARGB colors through a display window.
	 * Values at or below {@code center - width/2} get the lowest color of the map, 
	 * values at or above {@code center + width/2} the highest.
	 * 
	 * @param values the pixel values
	 * @param center window center
	 * @param width window width; must be &gt; 0
	 * @param colorMap the colormap to apply
	 * @return a new array of packed ARGB values, one per input value
	 */
	public static int[] applyWindow(double[] values, double center, double width, ColorMap colorMap) {
		Objects.requireNonNull(colorMap);
		if (!(width > 0))
			throw new IllegalArgumentException("Window width must be > 0, but was " + width);
		double min = center - width / 2.0;
		double max = center + width / 2.0;
		int[] rgb = new int[values.length];
		for (int i = 0; i < values.length; i++)
			rgb[i] = colorMap.getColor(values[i], min, max);
		return rgb;
	}
	

	private static class DefaultColorMap implements ColorMap {
		
		private final String name;
		
		private static final int nColors = 256;
		private final int[] colors = new int[nColors];
		
		DefaultColorMap(String name, int[] r, int[] g, int[] b) {
			this.name = name;
			double scale = (double)(r.length - 1) / nColors;
			for (int i = 0; i < nColors; i++) {
				int ind = (int)(i * scale);
				double residual = (i * scale) - ind;
				colors[i] = ColorTools.packRGB(
						r[ind] + (int)((r[ind+1] - r[ind]) * residual),
						g[ind] + (int)((g[ind+1] - g[ind]) * residual),
						b[ind] + (int)((b[ind+1] - b[ind]) * residual));
			}
			colors[nColors-1] = ColorTools.packRGB(r[r.length-1], g[g.length-1], b[b.length-1]);
		}
		
		@Override
		public String getName() {
			return name;
		}
		
		@Override
		public String toString() {
			return getName();
		}

		@Override
		public int getColor(double value, double minValue, double maxValue) {
			int ind = 0;
			if (maxValue > minValue) {
				ind = (int)Math.round((value - minValue) / (maxValue - minValue) * nColors);
				ind = ind >= nColors ? nColors - 1 : ind;
				ind = ind < 0 ? 0 : ind;
			} else if (minValue > maxValue) {
				ind = (int)Math.round((value - maxValue) / (minValue - maxValue) * nColors);
				ind = ind >= nColors ? nColors - 1 : ind;
				ind = ind < 0 ? 0 : ind;
				ind = nColors - 1 - ind;
			}
			return colors[ind];
		}

	}
	
	
	private static class SingleColorMap implements ColorMap {
		
		private final String name;
		
		private final int maxRed, maxGreen, maxBlue;
		
		SingleColorMap(String name, int maxRed, int maxGreen, int maxBlue) {
			this.name = name;
			this.maxRed = maxRed;
			this.maxGreen = maxGreen;
			this.maxBlue = maxBlue;
		}
		
		@Override
		public String getName() {
			return name;
		}
		
		@Override
		public String toString() {
			return getName();
		}

		@Override
		public int getColor(double value, double minValue, double maxValue) {
			if (minValue == maxValue)
				return value < minValue ? ColorTools.BLACK : ColorTools.packRGB(maxRed, maxGreen, maxBlue);
			
			double val = (value - minValue) / (maxValue - minValue);
			if (val >= 1)
				return ColorTools.packRGB(maxRed, maxGreen, maxBlue);
			if (val <= 0 || Double.isNaN(val))
				return ColorTools.BLACK;
			
			int r = (int)Math.round(maxRed * val);
			int g = (int)Math.round(maxGreen * val);
			int b = (int)Math.round(maxBlue * val);
			
			return ColorTools.packRGB(r, g, b);
		}

	}

}
