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


package dbview;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import dbview.lib.gui.logging.LogManager.LogLevel;
import picocli.CommandLine;

@SuppressWarnings("javadoc")
public class TestDbView {
	
	private static CommandLine createCommandLine(DbView dbview) {
		var cmd = new CommandLine(dbview);
		cmd.setCaseInsensitiveEnumValuesAllowed(true);
		return cmd;
	}
	
	@Test
	public void test_pathAndOptions() {
		var dbview = new DbView();
		createCommandLine(dbview).parseArgs("--log", "debug", "-r", "/data/dicom");
		assertArrayEquals(new String[] {"/data/dicom"}, dbview.getApplicationArgs());
	}
	
	@Test
	public void test_noPath() {
		var dbview = new DbView();
		createCommandLine(dbview).parseArgs();
		assertEquals(0, dbview.getApplicationArgs().length);
	}
	
	@Test
	public void test_help() {
		var cmd = createCommandLine(new DbView());
		cmd.parseArgs("-h");
		assertTrue(cmd.isUsageHelpRequested());
		var usage = cmd.getUsageMessage();
		assertTrue(usage.contains("--log"));
		assertTrue(usage.contains(LogLevel.DEBUG.name()));
	}
	
	@Test
	public void test_version() throws Exception {
		var version = new DbView.VersionProvider().getVersion();
		assertEquals(1, version.length);
		assertTrue(version[0].contains("DbView"));
	}

}
