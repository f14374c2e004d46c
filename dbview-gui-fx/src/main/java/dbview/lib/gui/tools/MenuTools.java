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


package dbview.lib.gui.tools;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.controlsfx.control.action.Action;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dbview.lib.gui.actions.ActionTools;
import dbview.lib.gui.actions.menus.MenuActions;
import dbview.lib.gui.localization.DbViewResources;
import javafx.scene.control.Menu;
import javafx.scene.control.MenuItem;
import javafx.scene.control.SeparatorMenuItem;

/**
 * Static methods to help with creating and populating JavaFX menus.
 * 
 * @author DbView developers
 *
 */
public class MenuTools {
	
	private static final Logger logger = LoggerFactory.getLogger(MenuTools.class);
	
	/**
	 * Add menu items to the specified list.
	 * Items may be
	 * <ul>
	 * <li>a {@link MenuItem}</li>
	 * <li>an {@link Action}</li>
	 * <li>{@code null} (indicating that a separator should be added)</li>
	 * </ul>
	 * 
	 * @param menuItems existing list to which items should be added, or null if a new list should be created
	 * @param items the items that should be provided (MenuItems or Actions, or null to insert a separator)
	 * @return the list containing the adding items (same as the original if provided)
	 */
	public static List<MenuItem> addMenuItems(List<MenuItem> menuItems, final Object... items) {
		if (menuItems == null)
			menuItems = new ArrayList<>();

		// Avoid two adjacent separators
		boolean lastIsSeparator = !menuItems.isEmpty() && menuItems.get(menuItems.size()-1) instanceof SeparatorMenuItem;
		
		List<MenuItem> newItems = new ArrayList<>();
		for (Object item : items) {
			if (item == null || (item instanceof Action && ActionTools.isSeparator((Action)item))) {
				if (!lastIsSeparator)
					newItems.add(new SeparatorMenuItem());
				lastIsSeparator = true;
			}
			else if (item instanceof MenuItem) {
				newItems.add((MenuItem)item);
				lastIsSeparator = false;
			}
			else if (item instanceof Action) {
				newItems.add(ActionTools.createMenuItem((Action)item));
				lastIsSeparator = false;
			} else
				logger.warn("Could not add menu item {}", item);
		}
		if (!newItems.isEmpty()) {
			menuItems.addAll(newItems);
		}
		return menuItems;
	}
	
	/**
	 * Create menus for the actions of a {@link MenuActions}, adding them to an existing list of menus.
	 * Each action is placed in the menu named by its menu path, creating menus and submenus as needed; 
	 * actions without a menu path go into the menu given by {@link MenuActions#getMenuKey()}.
	 * 
	 * @param menus
	 * @param menuActions
	 */
	public static void installActions(final List<Menu> menus, final MenuActions menuActions) {
		for (var action : menuActions.getActions()) {
			var path = ActionTools.getMenuPath(action);
			Menu menu;
			if (path == null)
				menu = getMenu(menus, menuActions.getMenuKey(), true);
			else
				menu = getMenu(menus, path, true);
			addMenuItems(menu.getItems(), action);
		}
	}
	
	/**
	 * Get a reference to an existing menu, optionally creating a new menu if it is not present.
	 * 
	 * @param menus 
	 * @param name menu path, in the form {@code "Menu>Submenu"}; each part may be a key for a localized string
	 * @param createMenu
	 * @return the menu, or null if it does not exist and createMenu is false
	 */
	public static Menu getMenu(final List<Menu> menus, final String name, final boolean createMenu) {
		Menu menuCurrent = null;
		for (String namePart : name.split(">")) {
			namePart = namePart.trim();
			String text = DbViewResources.getStringOrKey(namePart);
			if (menuCurrent == null) {
				menuCurrent = findMenuByNameNonRecursive(menus, text);
				if (menuCurrent == null) {
					if (createMenu) {
						menuCurrent = new Menu(text);
						menus.add(menuCurrent);
					} else
						return null;
				}
			} else {
				List<MenuItem> menuItems = menuCurrent.getItems();
				menuCurrent = findMenuByNameNonRecursive(menuItems, text);
				if (menuCurrent == null) {
					if (createMenu) {
						menuCurrent = new Menu(text);
						menuItems.add(menuCurrent);
					} else
						return null;
				}				
			}
		}
		return menuCurrent;
	}
	
	private static Menu findMenuByNameNonRecursive(List<? extends MenuItem> menuItems, String name) {
		for (var item : menuItems) {
			if (item instanceof Menu) {
				if (Objects.equals(name, item.getText()))
					return (Menu)item;
			}
		}
		return null;
	}

}
