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

import java.nio.file.Paths;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dbview.fx.dialogs.Dialogs;
import javafx.application.Application;
import javafx.stage.Stage;

/**
 * Launcher application to start DbView.
 * <p>
 * The first unnamed parameter, if any, is the path of a database to open at startup.
 * 
 * @author DbView developers
 *
 */
public class DbViewApp extends Application {
	
	private static final Logger logger = LoggerFactory.getLogger(DbViewApp.class);

	@Override
	public void start(Stage stage) throws Exception {
		
		var gui = DbViewGUI.createInstance(stage);
		Thread.currentThread().setUncaughtExceptionHandler(new DbViewUncaughtExceptionHandler(gui));
		
		logger.info("Starting DbView with parameters: {}", getParameters().getRaw());
		stage.show();
		
		getDatabaseParameter().ifPresent(path -> openDatabaseOrLogException(gui, path));
	}
	
	private Optional<String> getDatabaseParameter() {
		var unnamed = getParameters().getUnnamed();
		if (unnamed.isEmpty())
			return Optional.empty();
		return Optional.ofNullable(unnamed.get(0));
	}
	
	private static void openDatabaseOrLogException(DbViewGUI gui, String path) {
		try {
			gui.open(Paths.get(path));
		} catch (Exception e) {
			Dialogs.showErrorMessage("Open database", e);
		}
	}

}
