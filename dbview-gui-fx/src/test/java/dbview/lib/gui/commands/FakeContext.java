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
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import dbview.lib.dicom.DicomDatabase;
import dbview.lib.dicom.DicomLevel;
import dbview.lib.dicom.DicomRecord;
import dbview.lib.gui.ApplicationContext;
import dbview.lib.interfaces.DialogPrompt;
import dbview.lib.interfaces.StatusMonitor;

/**
 * Application context without a user interface, recording what commands ask of it.
 */
@SuppressWarnings("javadoc")
public class FakeContext implements ApplicationContext {
	
	public final RecordingStatus status = new RecordingStatus();
	public final ScriptedDialog dialog = new ScriptedDialog();
	public final List<String> calls = new ArrayList<>();
	public final List<DicomRecord> selection = new ArrayList<>();
	
	public DicomDatabase database;

	@Override
	public DicomDatabase database() {
		return database;
	}

	@Override
	public boolean close() throws IOException {
		calls.add("close");
		if (database != null && database.isOpen() && !database.close())
			return false;
		database = null;
		return true;
	}

	@Override
	public void open(Path path) throws IOException {
		calls.add("open " + path.getFileName());
		database = new FakeDatabase(path);
	}

	@Override
	public void refresh() {
		calls.add("refresh");
	}

	@Override
	public void display(DicomDatabase database) {
		calls.add("display " + database.getLabel());
		this.database = database;
	}

	@Override
	public void closeAllDisplays() {
		calls.add("closeAllDisplays");
	}

	@Override
	public List<? extends DicomRecord> selected(DicomLevel level) {
		List<DicomRecord> list = new ArrayList<>();
		for (var record : selection) {
			if (record.getLevel() == level)
				list.add(record);
		}
		return list;
	}

	@Override
	public StatusMonitor status() {
		return status;
	}

	@Override
	public DialogPrompt dialog() {
		return dialog;
	}

}
