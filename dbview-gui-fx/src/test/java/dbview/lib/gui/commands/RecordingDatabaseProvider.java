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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import dbview.lib.dicom.DatabaseProvider;
import dbview.lib.dicom.DicomDatabase;
import dbview.lib.interfaces.DialogPrompt;
import dbview.lib.interfaces.StatusMonitor;

/**
 * Provider opening any directory as a {@link FakeDatabase}, remembering every database it opened.
 */
@SuppressWarnings("javadoc")
public class RecordingDatabaseProvider implements DatabaseProvider {
	
	static final List<FakeDatabase> OPENED = Collections.synchronizedList(new ArrayList<>());

	@Override
	public String getName() {
		return "Recording provider";
	}

	@Override
	public boolean supports(Path path) {
		return Files.isDirectory(path);
	}

	@Override
	public DicomDatabase open(Path path, StatusMonitor status, DialogPrompt dialog) throws IOException {
		var db = new FakeDatabase(path);
		OPENED.add(db);
		return db;
	}

}
