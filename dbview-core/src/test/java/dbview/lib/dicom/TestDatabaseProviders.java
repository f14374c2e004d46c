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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Paths;

import org.junit.jupiter.api.Test;

import dbview.lib.interfaces.DialogPrompt;
import dbview.lib.interfaces.StatusMonitor;

@SuppressWarnings("javadoc")
public class TestDatabaseProviders {
	
	private static final DialogPrompt NO_DIALOG = new DialogPrompt() {

		@Override
		public String directory(String prompt) {
			return "";
		}

		@Override
		public void information(String message) {}

		@Override
		public boolean question(String title, String message) {
			return false;
		}
		
	};
	
	@Test
	public void test_installedProviders() {
		var providers = DatabaseProviders.getInstalledProviders();
		assertTrue(providers.stream().anyMatch(p -> p instanceof MockDatabaseProvider));
	}
	
	@Test
	public void test_openSupported() throws IOException {
		var path = Paths.get("studies", "patient.mockdb");
		var db = DatabaseProviders.open(path, StatusMonitor.silent(), NO_DIALOG);
		assertEquals(path, db.getPath());
		assertEquals(DicomLevel.DATABASE, db.getLevel());
		assertTrue(db.isOpen());
	}
	
	@Test
	public void test_openUnsupported() {
		var path = Paths.get("studies", "patient");
		assertThrows(IOException.class, () -> DatabaseProviders.open(path, StatusMonitor.silent(), NO_DIALOG));
	}

}
