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


package dbview.lib.gui.prefs;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.prefs.BackingStoreException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dbview.fx.prefs.PreferenceManager;
import dbview.lib.dicom.DicomAttributes;
import dbview.lib.gui.logging.LogManager.LogLevel;
import javafx.beans.property.ObjectProperty;
import javafx.beans.property.StringProperty;

/**
 * Central storage of DbView preferences.
 * <p>
 * All of these are 'persistent', and stored in a platform-dependent way using 
 * Java's Preferences API.
 * 
 * @author DbView developers
 *
 */
public class DbViewPrefs {
	
	private static final Logger logger = LoggerFactory.getLogger(DbViewPrefs.class);
	
	/**
	 * Allow preference node name to be specified in system property.
	 * This is especially useful for testing without touching the real preferences.
	 */
	private static final String PROP_PREFS = "dbview.prefs.name";
	
	private static final String DEFAULT_NODE_NAME = "io.github.dbview/0.1";
	
	private static final PreferenceManager MANAGER = createPreferenceManager();
	
	private static PreferenceManager createPreferenceManager() {
		var name = System.getProperty(PROP_PREFS);
		String nodeName = DEFAULT_NODE_NAME;
		if (name != null && !name.isBlank()) {
			logger.info("Setting preference node to {}", name);
			nodeName = name;
		}
		return PreferenceManager.createForUserPreferences(nodeName);
	}
	
	private static final StringProperty viewSortKey = MANAGER.createPersistentStringProperty("viewSortKey", DicomAttributes.SLICE_LOCATION);
	
	/**
	 * Attribute used to sort images along the view (z) axis of 4D displays.
	 * @return
	 */
	public static StringProperty viewSortKeyProperty() {
		return viewSortKey;
	}
	
	private static final StringProperty plotSortKey = MANAGER.createPersistentStringProperty("plotSortKey", DicomAttributes.ACQUISITION_TIME);

	/**
	 * Attribute used to sort images along the plot (t) axis of 4D displays.
	 * @return
	 */
	public static StringProperty plotSortKeyProperty() {
		return plotSortKey;
	}
	
	/**
	 * Get the attributes used to sort images for 4D displays, view axis first.
	 * @return
	 */
	public static List<String> getSortKeys() {
		return Arrays.asList(viewSortKey.get(), plotSortKey.get());
	}
	
	private static final ObjectProperty<Path> lastDirectory = MANAGER.createPersistentPathProperty("lastDirectory", null);

	/**
	 * The last directory chosen in a directory prompt; used as the starting point for the next prompt.
	 * @return
	 */
	public static ObjectProperty<Path> lastDirectoryProperty() {
		return lastDirectory;
	}
	
	private static final ObjectProperty<LogLevel> logLevel = MANAGER.createPersistentEnumProperty("logLevel", LogLevel.INFO, LogLevel.class);
	
	/**
	 * Requested root log level.
	 * @return
	 */
	public static ObjectProperty<LogLevel> logLevelProperty() {
		return logLevel;
	}
	
	private static final StringProperty defaultColorMap = MANAGER.createPersistentStringProperty("defaultColorMap", "Gray");

	/**
	 * Name of the colormap used for images that do not specify one.
	 * @return
	 */
	public static StringProperty defaultColorMapProperty() {
		return defaultColorMap;
	}
	
	/**
	 * Save the preferences.
	 * @return true if the preferences were saved
	 */
	public static synchronized boolean savePreferences() {
		try {
			MANAGER.save();
			return true;
		} catch (BackingStoreException e) {
			logger.error("Failed to save preferences: {}", e.getLocalizedMessage(), e);
			return false;
		}
	}
	
	/**
	 * Reset all preferences to their defaults.
	 * @return true if the preferences were reset
	 */
	public static synchronized boolean resetPreferences() {
		try {
			MANAGER.reset();
			logger.info("Preferences have been reset");
			return true;
		} catch (BackingStoreException e) {
			logger.error("Failed to reset preferences: {}", e.getLocalizedMessage(), e);
			return false;
		}
	}

}
