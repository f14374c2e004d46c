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

import dbview.lib.interfaces.DialogPrompt;
import dbview.lib.interfaces.StatusMonitor;

/**
 * Service interface for libraries able to open a folder as a {@link DicomDatabase}.
 * <p>
 * Implementations are discovered with {@link java.util.ServiceLoader}, and should be registered under 
 * {@code META-INF/services/dbview.lib.dicom.DatabaseProvider}.
 * 
 * @author DbView developers
 * @see DatabaseProviders
 */
public interface DatabaseProvider {
	
	/**
	 * Get a human-readable name for the provider.
	 * @return
	 */
	String getName();
	
	/**
	 * Query whether this provider can open the specified path.
	 * @param path
	 * @return
	 */
	boolean supports(Path path);
	
	/**
	 * Open a database.
	 * @param path the database folder
	 * @param status receiver for progress while the folder is read
	 * @param dialog prompts that the database may use, e.g. to ask about unsaved changes
	 * @return the open database
	 * @throws IOException if the folder cannot be read
	 */
	DicomDatabase open(Path path, StatusMonitor status, DialogPrompt dialog) throws IOException;

}
