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


package dbview.lib.gui;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import dbview.lib.dicom.DicomDatabase;
import dbview.lib.dicom.DicomLevel;
import dbview.lib.dicom.DicomRecord;
import dbview.lib.dicom.ImageSeries;
import dbview.lib.interfaces.DialogPrompt;
import dbview.lib.interfaces.StatusMonitor;

/**
 * The application as seen by menu commands.
 * <p>
 * Commands receive the context explicitly, rather than looking up a shared instance, 
 * so that they can be run against any implementation (including a test double).
 * 
 * @author DbView developers
 */
public interface ApplicationContext {
	
	/**
	 * Get the database currently shown by the application.
	 * @return the database, or null if none is open
	 */
	DicomDatabase database();
	
	/**
	 * Close the current database, along with all displays showing its series.
	 * <p>
	 * If the database is still open, it is asked to close itself first; 
	 * if it refuses (e.g. because the user cancelled a prompt about unsaved changes) the application 
	 * keeps showing it.
	 * 
	 * @return true if no database is shown after the call
	 * @throws IOException if the database could not be closed
	 */
	boolean close() throws IOException;
	
	/**
	 * Open a database folder and show it.
	 * @param path
	 * @throws IOException if the folder could not be opened as a database
	 */
	void open(Path path) throws IOException;
	
	/**
	 * Update the application to reflect changes to the current database.
	 */
	void refresh();
	
	/**
	 * Show a database that has been opened elsewhere, replacing the current one.
	 * @param database
	 */
	void display(DicomDatabase database);
	
	/**
	 * Close all series displays, without closing the database.
	 */
	void closeAllDisplays();
	
	/**
	 * Get the records currently selected by the user at a specific level of the hierarchy.
	 * @param level
	 * @return the selected records, in display order; empty if nothing is selected
	 */
	List<? extends DicomRecord> selected(DicomLevel level);
	
	/**
	 * Get the number of records currently selected at a specific level of the hierarchy.
	 * @param level
	 * @return
	 */
	default int nrSelected(DicomLevel level) {
		return selected(level).size();
	}
	
	/**
	 * Get the selected series.
	 * @return
	 */
	default List<ImageSeries> selectedSeries() {
		return selected(DicomLevel.SERIES).stream()
				.filter(ImageSeries.class::isInstance)
				.map(ImageSeries.class::cast)
				.collect(Collectors.toList());
	}
	
	/**
	 * Query whether a database is currently open.
	 * @return
	 */
	default boolean isDatabaseOpen() {
		var database = database();
		return database != null && database.isOpen();
	}
	
	/**
	 * Get the status bar, used to report progress.
	 * @return
	 */
	StatusMonitor status();
	
	/**
	 * Get the prompts used to ask the user for input.
	 * @return
	 */
	DialogPrompt dialog();

}
