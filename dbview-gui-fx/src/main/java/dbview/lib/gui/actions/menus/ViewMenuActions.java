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

import org.controlsfx.control.action.Action;

import dbview.lib.dicom.ImageSeries;
import dbview.lib.gui.DbViewGUI;
import dbview.lib.gui.actions.ActionTools;
import dbview.lib.gui.actions.annotations.ActionConfig;
import dbview.lib.gui.actions.annotations.ActionMenu;
import dbview.lib.gui.localization.DbViewResources;

/**
 * Actions of the View menu, opening displays for the selected series.
 * 
 * @author DbView developers
 */
public class ViewMenuActions implements MenuActions {
	
	private final DbViewGUI gui;
	
	private Actions actions;
	
	/**
	 * Constructor.
	 * @param gui
	 */
	public ViewMenuActions(DbViewGUI gui) {
		this.gui = gui;
	}

	@Override
	public List<Action> getActions() {
		if (actions == null)
			actions = new Actions();
		return ActionTools.getAnnotatedActions(actions);
	}

	@Override
	public String getMenuKey() {
		return "Menu.View";
	}
	
	private Action createSeriesAction(String key, SeriesCommand command) {
		var action = ActionTools.createCheckedAction(DbViewResources.getStringOrKey(key), () -> {
			for (var series : gui.selectedSeries())
				command.show(series);
		});
		action.disabledProperty().bind(gui.seriesSelectedProperty().not());
		return action;
	}
	
	@FunctionalInterface
	private static interface SeriesCommand {
		void show(ImageSeries series) throws Exception;
	}
	
	@ActionMenu("Menu.View")
	public class Actions {
		
		@ActionConfig("Action.View.displaySeries")
		public final Action DISPLAY_SERIES = createSeriesAction("Action.View.displaySeries", gui::showSeriesDisplay);
		
		@ActionConfig("Action.View.displaySeries4D")
		public final Action DISPLAY_SERIES_4D = createSeriesAction("Action.View.displaySeries4D", gui::showSeriesDisplay4D);
		
		public final Action SEP_1 = ActionTools.createSeparator();
		
		@ActionConfig("Action.View.closeAllDisplays")
		public final Action CLOSE_ALL = ActionTools.createAction(gui::closeAllDisplays);
		
	}

}
