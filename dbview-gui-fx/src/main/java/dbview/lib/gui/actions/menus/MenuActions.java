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

import dbview.lib.gui.localization.DbViewResources;

/**
 * The actions of one top-level menu of the main window.
 * Menus are identified by a resource key, so that the same key can be used in {@link dbview.lib.gui.actions.annotations.ActionMenu} paths.
 */
public interface MenuActions {

	/**
	 * Get the resource key of the top-level menu, e.g. {@code "Menu.File"}.
	 * @return
	 */
	String getMenuKey();

	/**
	 * Get all the actions to include in the menu, in order.
	 * Actions without their own menu path belong to the menu given by {@link #getMenuKey()}.
	 * @return
	 */
	List<Action> getActions();

	/**
	 * Get the localized name of the menu.
	 * @return the menu text, or the menu key if it has no localized string
	 */
	default String getName() {
		return DbViewResources.getStringOrKey(getMenuKey());
	}
	
}
