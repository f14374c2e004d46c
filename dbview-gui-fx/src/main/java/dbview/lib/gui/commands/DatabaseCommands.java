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


package dbview.lib.gui.commands;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dbview.lib.dicom.DatabaseProviders;
import dbview.lib.dicom.DicomDatabase;
import dbview.lib.dicom.ImageSeries;
import dbview.lib.gui.ApplicationContext;

/**
 * Commands of the File menu, acting on the database of an {@link ApplicationContext}.
 * <p>
 * Commands do not return anything: their outcome is reported through the status bar and dialogs 
 * of the context. Failures are thrown to the caller.
 * 
 * @author DbView developers
 */
public class DatabaseCommands {
	
	private static final Logger logger = LoggerFactory.getLogger(DatabaseCommands.class);
	
	static final String MSG_OPENING = "Opening DICOM folder..";
	static final String PROMPT_OPEN = "Select a DICOM folder";
	static final String PROMPT_TOP_FOLDER = "Select the top folder..";
	static final String PROMPT_EXPORT = "Where do you want to export the data?";
	static final String MSG_SELECT_SERIES = "Please select at least one series";
	static final String MSG_EXPORTING_DATA = "Exporting data..";
	
	/**
	 * Formats in which selected series can be exported.
	 */
	public enum ExportFormat {
		
		/**
		 * DICOM files
		 */
		DICOM(".dcm"),
		/**
		 * Comma-separated pixel values
		 */
		CSV(".csv"),
		/**
		 * PNG images
		 */
		PNG(".png"),
		/**
		 * NIfTI volume
		 */
		NIFTI(".nii");
		
		private final String extension;
		
		private ExportFormat(String extension) {
			this.extension = extension;
		}
		
		/**
		 * Get the file extension written for this format, including the dot.
		 * @return
		 */
		public String getExtension() {
			return extension;
		}
		
		void export(ImageSeries series, Path directory) throws IOException {
			switch (this) {
			case DICOM:
				series.exportAsDicom(directory);
				break;
			case CSV:
				series.exportAsCsv(directory);
				break;
			case PNG:
				series.exportAsPng(directory);
				break;
			case NIFTI:
				series.exportAsNifti(directory);
				break;
			default:
				throw new IllegalArgumentException("Unsupported export format " + this);
			}
		}
		
	}
	
	// Suppressed default constructor for non-instantiability
	private DatabaseCommands() {
		throw new AssertionError();
	}
	
	/**
	 * Prompt for a DICOM folder, close the current database and open the folder instead.
	 * @param context
	 * @throws IOException
	 */
	public static void openDatabase(ApplicationContext context) throws IOException {
		var status = context.status();
		status.message(MSG_OPENING);
		String path = context.dialog().directory(PROMPT_OPEN);
		if (path == null || path.isEmpty()) {
			status.message("");
			return;
		}
		status.cursorToHourglass();
		try {
			if (!context.close()) {
				logger.info("Current database was not closed, {} will not be opened", path);
				return;
			}
			context.open(Paths.get(path));
		} finally {
			status.hide();
			status.cursorToNormal();
		}
	}
	
	/**
	 * Rescan the folder of the open database.
	 * All series displays are closed, since the series they show may no longer exist.
	 * @param context
	 * @throws IOException
	 */
	public static void readDatabase(ApplicationContext context) throws IOException {
		var status = context.status();
		status.cursorToHourglass();
		try {
			context.closeAllDisplays();
			requireDatabase(context).scan();
		} finally {
			status.cursorToNormal();
		}
		context.refresh();
	}
	
	/**
	 * Save all pending changes of the open database.
	 * @param context
	 * @throws IOException
	 */
	public static void saveDatabase(ApplicationContext context) throws IOException {
		requireDatabase(context).save();
	}
	
	/**
	 * Discard all pending changes of the open database.
	 * @param context
	 * @throws IOException
	 */
	public static void restoreDatabase(ApplicationContext context) throws IOException {
		requireDatabase(context).restore();
		context.refresh();
	}
	
	/**
	 * Close the open database; the application stops showing it only if the database agreed to close.
	 * @param context
	 * @throws IOException
	 */
	public static void closeDatabase(ApplicationContext context) throws IOException {
		boolean closed = requireDatabase(context).close();
		if (closed)
			context.close();
		else
			logger.debug("Database remains open");
	}
	
	/**
	 * Prompt for a folder, then open and save each of its immediate subfolders as an independent database.
	 * <p>
	 * Only the database opened last is shown afterwards.
	 * 
	 * @param context
	 * @throws IOException
	 */
	public static void openSubfolders(ApplicationContext context) throws IOException {
		var status = context.status();
		status.message(MSG_OPENING);
		String path = context.dialog().directory(PROMPT_TOP_FOLDER);
		if (path == null || path.isEmpty()) {
			status.message("");
			return;
		}
		List<Path> subfolders = listSubfolders(Paths.get(path));
		if (subfolders.isEmpty()) {
			logger.info("No subfolders found in {}", path);
			status.hide();
			return;
		}
		if (!context.close()) {
			status.hide();
			return;
		}
		status.cursorToHourglass();
		DicomDatabase folder = null;
		try {
			int n = subfolders.size();
			// Earlier folders are saved but not closed; only the last one is displayed
			for (int i = 0; i < n; i++) {
				status.message("Reading folder " + (i+1) + " of " + n);
				folder = DatabaseProviders.open(subfolders.get(i), status, context.dialog());
				folder.save();
			}
		} finally {
			status.cursorToNormal();
			status.hide();
		}
		context.display(folder);
	}
	
	/**
	 * Get the immediate subdirectories of a directory, sorted by name.
	 * @param path
	 * @return
	 * @throws IOException
	 */
	static List<Path> listSubfolders(Path path) throws IOException {
		try (var stream = Files.list(path)) {
			return stream.filter(Files::isDirectory)
					.sorted()
					.collect(Collectors.toList());
		}
	}
	
	/**
	 * Export the selected series to a directory chosen by the user.
	 * <p>
	 * If no series is selected, the user is told so and nothing is written.
	 * 
	 * @param context
	 * @param format
	 * @throws IOException
	 */
	public static void exportSelected(ApplicationContext context, ExportFormat format) throws IOException {
		List<ImageSeries> series = context.selectedSeries();
		if (series.isEmpty()) {
			context.dialog().information(MSG_SELECT_SERIES);
			return;
		}
		var status = context.status();
		String path = context.dialog().directory(PROMPT_EXPORT);
		if (path == null || path.isEmpty()) {
			status.message("");
			return;
		}
		Path directory = Paths.get(path);
		int n = series.size();
		try {
			for (int i = 0; i < n; i++) {
				if (format == ExportFormat.DICOM)
					status.progress(i, n, MSG_EXPORTING_DATA);
				else
					status.message("Exporting series " + i);
				format.export(series.get(i), directory);
			}
			logger.info("Exported {} series as {} to {}", n, format.getExtension(), directory);
		} finally {
			status.hide();
		}
	}
	
	private static DicomDatabase requireDatabase(ApplicationContext context) {
		var database = context.database();
		if (database == null)
			throw new IllegalStateException("No database is open");
		return database;
	}

}
