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

import java.io.File;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dbview.lib.gui.DbViewApp;
import dbview.lib.gui.logging.LogManager;
import dbview.lib.gui.logging.LogManager.LogLevel;
import dbview.lib.gui.prefs.DbViewPrefs;
import javafx.application.Application;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.IVersionProvider;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Main DbView launcher.
 * 
 * @author DbView developers
 *
 */
@Command(name = "DbView", 
	footer = {"", "Copyright(c) DbView developers (2026)"}, 
	mixinStandardHelpOptions = true, versionProvider = DbView.VersionProvider.class)
public class DbView {
	
	private static final Logger logger = LoggerFactory.getLogger(DbView.class);
	
	@Parameters(arity = "0..1", description = {"Path to a DICOM folder to open"})
	private String path;

	@Option(names = {"-r", "--reset"}, description = "Reset all DbView preferences.")
	private boolean reset;

	@Option(names = {"-l", "--log"}, description = {"Log level (default = the level stored in the preferences).", "Options: ${COMPLETION-CANDIDATES}"})
	private LogLevel logLevel;
	
	@Option(names = {"--log-file"}, description = "Also write the log to the specified file.", paramLabel = "file")
	private File logFile;
	
	/**
	 * Main method to launch DbView.
	 * 
	 * @param args
	 */
	public static void main(String[] args) {
		
		DbView dbview = new DbView();
		CommandLine cmd = new CommandLine(dbview);
		cmd.setCaseInsensitiveEnumValuesAllowed(true);
		cmd.setExpandAtFiles(false);
		try {
			cmd.parseArgs(args);
		} catch (Exception e) {
			logger.error("An error has occurred, please type -h to display help message.\n" + e.getLocalizedMessage());
			return;
		}
		
		// Catch -h/--help and -V/--version
		if (cmd.isUsageHelpRequested()) {
			cmd.usage(System.out);
			return;
		} else if (cmd.isVersionHelpRequested()) {
			cmd.printVersionHelp(System.out);
			return;
		}
		
		if (dbview.reset) {
			if (!DbViewPrefs.resetPreferences())
				logger.warn("Preferences could not be reset");
		}
		
		var level = dbview.logLevel == null ? DbViewPrefs.logLevelProperty().get() : dbview.logLevel;
		if (level != null)
			LogManager.setRootLogLevel(level);
		if (dbview.logFile != null)
			LogManager.logToFile(dbview.logFile);
		
		Application.launch(DbViewApp.class, dbview.getApplicationArgs());
	}
	
	/**
	 * Get the arguments passed on to the JavaFX application.
	 * @return
	 */
	String[] getApplicationArgs() {
		List<String> args = new ArrayList<>();
		if (path != null && !path.isBlank())
			args.add(path);
		return args.toArray(String[]::new);
	}
	
	
	static class VersionProvider implements IVersionProvider {

		@Override
		public String[] getVersion() throws Exception {
			var version = DbView.class.getPackage().getImplementationVersion();
			if (version == null)
				return new String[] {"Unknown DbView version!"};
			if (!version.startsWith("v"))
				version = "v" + version;
			return new String[] {"DbView " + version};
		}
		
	}
	
}
