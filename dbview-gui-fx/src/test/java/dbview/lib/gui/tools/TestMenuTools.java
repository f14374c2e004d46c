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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.controlsfx.control.action.Action;
import org.junit.jupiter.api.Test;

import dbview.lib.gui.actions.ActionTools;
import dbview.lib.gui.actions.menus.MenuActions;
import javafx.scene.control.Menu;

@SuppressWarnings("javadoc")
public class TestMenuTools {
	
	private static MenuActions createMenuActions(String key, Action... actions) {
		return new MenuActions() {
			@Override
			public String getMenuKey() {
				return key;
			}
			@Override
			public List<Action> getActions() {
				return Arrays.asList(actions);
			}
		};
	}
	
	private static Action createAction(String text, String menuPath) {
		var action = ActionTools.actionBuilder(e -> {}).text(text).build();
		if (menuPath != null)
			action.getProperties().put(ActionTools.MENU_KEY, menuPath);
		return action;
	}
	
	@Test
	public void test_localizedMenuName() {
		assertEquals("File", createMenuActions("Menu.File").getName());
		assertEquals("Menu.Unknown", createMenuActions("Menu.Unknown").getName());
	}
	
	@Test
	public void test_installActions() {
		List<Menu> menus = new ArrayList<>();
		MenuTools.installActions(menus, createMenuActions("Menu.View",
				createAction("2D", null),
				createAction("4D", "Menu.View"),
				createAction("Axial", "Menu.View>Planes")));
		MenuTools.installActions(menus, createMenuActions("Menu.File",
				createAction("Open", "Menu.File")));
		
		assertEquals(2, menus.size());
		var view = menus.get(0);
		assertEquals("View", view.getText());
		assertEquals(3, view.getItems().size());
		assertEquals("2D", view.getItems().get(0).getText());
		assertEquals("4D", view.getItems().get(1).getText());
		
		var planes = MenuTools.getMenu(menus, "Menu.View>Planes", false);
		assertSame(view.getItems().get(2), planes);
		assertEquals("Planes", planes.getText());
		assertEquals("Axial", planes.getItems().get(0).getText());
		
		assertEquals("File", menus.get(1).getText());
		assertEquals("Open", menus.get(1).getItems().get(0).getText());
	}
	
	@Test
	public void test_getMenuWithoutCreating() {
		List<Menu> menus = new ArrayList<>();
		assertNull(MenuTools.getMenu(menus, "Menu.File", false));
		var file = MenuTools.getMenu(menus, "Menu.File", true);
		assertSame(file, MenuTools.getMenu(menus, "Menu.File", false));
		assertNull(MenuTools.getMenu(menus, "Menu.File>Recent", false));
	}

}
