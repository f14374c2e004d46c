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


package dbview.lib.gui.dialogs;

import java.io.File;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dbview.fx.dialogs.Dialogs;
import dbview.fx.dialogs.FileChoosers;
import dbview.fx.utils.FXUtils;
import dbview.lib.gui.prefs.DbViewPrefs;
import dbview.lib.interfaces.DialogPrompt;

/**
 * {@link DialogPrompt} showing JavaFX dialogs owned by the main window.
 * <p>
 * Directory prompts start in the directory chosen last, which is remembered in the preferences.
 * 
 * @author DbView developers
 */
public class FxDialogPrompt implements DialogPrompt {
	
	private static final Logger logger = LoggerFactory.getLogger(FxDialogPrompt.class);
	
	private final String title;
	
	/**
	 * Constructor.
	 * @param title title used for information and question dialogs
	 */
	public FxDialogPrompt(String title) {
		this.title = title;
	}

	@Override
	public String directory(String prompt) {
		return FXUtils.callOnApplicationThread(() -> {
			var last = DbViewPrefs.lastDirectoryProperty().get();
			File initial = last == null ? null : last.toFile();
			var dir = FileChoosers.promptForDirectory(Dialogs.getPrimaryWindow(), prompt, initial);
			if (dir == null) {
				logger.debug("Directory prompt cancelled: {}", prompt);
				return "";
			}
			DbViewPrefs.lastDirectoryProperty().set(dir.toPath());
			return dir.getAbsolutePath();
		});
	}

	@Override
	public void information(String message) {
		FXUtils.runOnApplicationThread(() -> Dialogs.showMessageDialog(title, message));
	}

	@Override
	public boolean question(String title, String message) {
		return FXUtils.callOnApplicationThread(() -> Dialogs.showYesNoDialog(title, message));
	}

}
