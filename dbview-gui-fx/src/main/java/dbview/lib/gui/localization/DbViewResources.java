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


package dbview.lib.gui.localization;

import java.util.Locale;
import java.util.Locale.Category;
import java.util.MissingResourceException;
import java.util.ResourceBundle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Load strings from the default resource bundle.
 * 
 * @author DbView developers
 */
public class DbViewResources {
	
	private static final Logger logger = LoggerFactory.getLogger(DbViewResources.class);
	
	private static final String DEFAULT_BUNDLE = "dbview/lib/gui/localization/dbview-gui-strings";
	
	/**
	 * Get a string from the main {@link ResourceBundle} used for the user interface.
	 * @param key
	 * @return
	 * @throws MissingResourceException if the key is not found
	 */
	public static String getString(String key) {
		var bundle = getBundleOrNull();
		if (bundle == null)
			throw new MissingResourceException("No resource bundle available", DEFAULT_BUNDLE, key);
		return bundle.getString(key);
	}
	
	/**
	 * Get a string from the main resource bundle, or the key itself if it is not found.
	 * @param key
	 * @return
	 */
	public static String getStringOrKey(String key) {
		return hasString(key) ? getString(key) : key;
	}
	
	/**
	 * Query whether the main resource bundle contains a key.
	 * @param key
	 * @return
	 */
	public static boolean hasString(String key) {
		var bundle = getBundleOrNull();
		if (bundle != null)
			return bundle.containsKey(key);
		return false;
	}
	
	private static ResourceBundle getBundleOrNull() {
		try {
			return ResourceBundle.getBundle(DEFAULT_BUNDLE, Locale.getDefault(Category.DISPLAY), DbViewResources.class.getClassLoader());
		} catch (MissingResourceException e) {
			logger.error("Missing resource bundle {}", DEFAULT_BUNDLE);
			return null;
		}
	}

}
