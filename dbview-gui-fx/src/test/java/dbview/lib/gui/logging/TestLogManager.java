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


package dbview.lib.gui.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import dbview.lib.gui.logging.LogManager.LogLevel;

@SuppressWarnings("javadoc")
public class TestLogManager {
	
	@AfterEach
	public void restoreLevel() {
		LogManager.setRootLogLevel(LogLevel.INFO);
	}
	
	@Test
	public void test_rootLevel() {
		LogManager.setRootLogLevel(LogLevel.DEBUG);
		assertEquals(LogLevel.DEBUG, LogManager.getRootLogLevel());
		assertEquals(Level.DEBUG, LogManager.getEffectiveRootLevel());
		
		LogManager.rootLogLevelProperty().set(LogLevel.WARN);
		assertEquals(Level.WARN, LogManager.getEffectiveRootLevel());
		
		LogManager.setRootLogLevel(LogLevel.INFO);
		assertEquals(Level.INFO, LogManager.getEffectiveRootLevel());
	}
	
	@Test
	public void test_levelMapping() {
		for (var level : LogLevel.values())
			assertEquals(level.name(), LogManager.getLevel(level).toString());
	}
	
	@Test
	public void test_logToFile(@TempDir Path dir) throws IOException {
		var file = dir.resolve("dbview.log");
		assertTrue(LogManager.logToFile(file.toFile()));
		LoggerFactory.getLogger(TestLogManager.class).info("Written to file");
		assertTrue(Files.readString(file).contains("Written to file"));
		
		// Detach so the temp directory can be removed
		var root = (ch.qos.logback.classic.Logger)LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
		var appender = root.getAppender("dbview.log");
		root.detachAppender(appender);
		appender.stop();
	}

}
