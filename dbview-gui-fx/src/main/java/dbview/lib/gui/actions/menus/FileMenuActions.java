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


package dbview.lib.gui.actions.menus;

import java.util.List;
import java.util.Objects;

import org.controlsfx.control.action.Action;

import dbview.lib.gui.ApplicationContext;
import dbview.lib.gui.actions.ActionTools;
import dbview.lib.gui.actions.ActionTools.CheckedCommand;
import dbview.lib.gui.actions.annotations.ActionAccelerator;
import dbview.lib.gui.actions.annotations.ActionConfig;
import dbview.lib.gui.actions.annotations.ActionMenu;
import dbview.lib.gui.commands.DatabaseCommands;
import dbview.lib.gui.commands.DatabaseCommands.ExportFormat;
import dbview.lib.gui.localization.DbViewResources;
import javafx.beans.binding.BooleanExpression;
import javafx.beans.value.ObservableValue;

/**
 * Actions of the File menu.
 * <p>
 * Commands that need an open database are disabled while none is open, 
 * and export commands are disabled while no series is selected.
 * 
 * @author DbView developers
 */
public class FileMenuActions implements MenuActions {
	
	private final ApplicationContext context;
	private final BooleanExpression databaseOpen;
	private final BooleanExpression seriesSelected;
	
	private Actions actions;
	
	/**
	 * Constructor.
	 * @param context the application on which commands act
	 * @param databaseOpen true while a database is open
	 * @param seriesSelected true while at least one series is selected
	 */
	public FileMenuActions(ApplicationContext context, ObservableValue<Boolean> databaseOpen, ObservableValue<Boolean> seriesSelected) {
		this.context = Objects.requireNonNull(context);
		this.databaseOpen = BooleanExpression.booleanExpression(databaseOpen);
		this.seriesSelected = BooleanExpression.booleanExpression(seriesSelected);
	}
	
	@Override
	public List<Action> getActions() {
		if (actions == null) {
			actions = new Actions();
		}
		return ActionTools.getAnnotatedActions(actions);
	}

	@Override
	public String getMenuKey() {
		return "Menu.File";
	}
	
	private Action createAction(String key, CheckedCommand command) {
		return ActionTools.createCheckedAction(DbViewResources.getStringOrKey(key), command);
	}
	
	private Action createDatabaseAction(String key, CheckedCommand command) {
		var action = createAction(key, command);
		action.disabledProperty().bind(databaseOpen.not());
		return action;
	}
	
	private Action createExportAction(String key, ExportFormat format) {
		var action = createAction(key, () -> DatabaseCommands.exportSelected(context, format));
		action.disabledProperty().bind(seriesSelected.not());
		return action;
	}
	
	
	@ActionMenu("Menu.File")
	public class Actions {
		
		@ActionConfig("Action.File.open")
		@ActionAccelerator("shortcut+o")
		public final Action OPEN = createAction("Action.File.open", () -> DatabaseCommands.openDatabase(context));
		
		@ActionConfig("Action.File.read")
		public final Action READ = createDatabaseAction("Action.File.read", () -> DatabaseCommands.readDatabase(context));
		
		@ActionConfig("Action.File.save")
		@ActionAccelerator("shortcut+s")
		public final Action SAVE = createDatabaseAction("Action.File.save", () -> DatabaseCommands.saveDatabase(context));

		@ActionConfig("Action.File.restore")
		@ActionAccelerator("shortcut+r")
		public final Action RESTORE = createDatabaseAction("Action.File.restore", () -> DatabaseCommands.restoreDatabase(context));

		@ActionConfig("Action.File.close")
		@ActionAccelerator("shortcut+c")
		public final Action CLOSE = createDatabaseAction("Action.File.close", () -> DatabaseCommands.closeDatabase(context));
		
		public final Action SEP_1 = ActionTools.createSeparator();
		
		@ActionConfig("Action.File.openSubfolders")
		public final Action OPEN_SUBFOLDERS = createAction("Action.File.openSubfolders", () -> DatabaseCommands.openSubfolders(context));
		
		public final Action SEP_2 = ActionTools.createSeparator();

		@ActionConfig("Action.File.exportDicom")
		public final Action EXPORT_DICOM = createExportAction("Action.File.exportDicom", ExportFormat.DICOM);

		@ActionConfig("Action.File.exportCsv")
		public final Action EXPORT_CSV = createExportAction("Action.File.exportCsv", ExportFormat.CSV);

		@ActionConfig("Action.File.exportPng")
		public final Action EXPORT_PNG = createExportAction("Action.File.exportPng", ExportFormat.PNG);

		@ActionConfig("Action.File.exportNifti")
		public final Action EXPORT_NIFTI = createExportAction("Action.File.exportNifti", ExportFormat.NIFTI);

	}

}
