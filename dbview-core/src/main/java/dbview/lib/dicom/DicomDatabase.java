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

import java.io.IOException;
import java.nio.file.Path;

/**
 * A DICOM database backed by a folder on disk.
 * <p>
 * Changes made through the database are held until {@link #save()} writes them to disk, 
 * or {@link #restore()} discards them.
 * 
 * @author DbView developers
 */
public interface DicomDatabase extends DicomRecord {
	
	/**
	 * Get the folder containing the database.
	 * @return
	 */
	Path getPath();
	
	/**
	 * Rescan the folder, rebuilding the index of patients, studies, series and images.
	 * @throws IOException
	 */
	void scan() throws IOException;
	
	/**
	 * Write all pending changes to disk.
	 * @throws IOException
	 */
	void save() throws IOException;
	
	/**
	 * Discard all pending changes, restoring the last saved state.
	 * @throws IOException
	 */
	void restore() throws IOException;
	
	/**
	 * Close the database. Implementations may ask the user what to do with unsaved changes, 
	 * and the user may decide to keep the database open.
	 * @return true if the database was closed, false if it remains open
	 * @throws IOException
	 */
	boolean close() throws IOException;
	
	/**
	 * Query whether the database is currently open.
	 * @return
	 */
	boolean isOpen();
	
	@Override
	default DicomLevel getLevel() {
		return DicomLevel.DATABASE;
	}

}
