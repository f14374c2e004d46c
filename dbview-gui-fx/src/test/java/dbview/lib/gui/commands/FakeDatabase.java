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
import java.util.Collections;
import java.util.List;

import dbview.lib.dicom.DicomDatabase;
import dbview.lib.dicom.DicomRecord;

/**
 * Database that counts the operations called on it.
 */
@SuppressWarnings("javadoc")
public class FakeDatabase implements DicomDatabase {
	
	private final Path path;
	
	public boolean open = true;
	public boolean closeResult = true;
	public IOException failure;
	
	public int scanCount = 0;
	public int saveCount = 0;
	public int restoreCount = 0;
	public int closeCount = 0;
	
	public final List<String> events;
	
	public FakeDatabase(Path path) {
		this(path, new ArrayList<>());
	}
	
	public FakeDatabase(Path path, List<String> events) {
		this.path = path;
		this.events = events;
	}

	@Override
	public String getLabel() {
		return path.getFileName().toString();
	}

	@Override
	public List<? extends DicomRecord> getChildren() {
		return Collections.emptyList();
	}

	@Override
	public Path getPath() {
		return path;
	}

	@Override
	public void scan() throws IOException {
		checkFailure();
		scanCount++;
		events.add("scan");
	}

	@Override
	public void save() throws IOException {
		checkFailure();
		saveCount++;
		events.add("save " + getLabel());
	}

	@Override
	public void restore() throws IOException {
		checkFailure();
		restoreCount++;
		events.add("restore");
	}

	@Override
	public boolean close() throws IOException {
		checkFailure();
		closeCount++;
		events.add("db.close");
		if (closeResult)
			open = false;
		return closeResult;
	}

	@Override
	public boolean isOpen() {
		return open;
	}
	
	private void checkFailure() throws IOException {
		if (failure != null)
			throw failure;
	}

}
