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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import org.controlsfx.control.action.Action;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import dbview.lib.gui.actions.ActionTools;
import dbview.lib.gui.commands.FakeContext;
import dbview.lib.gui.commands.FakeDatabase;
import dbview.lib.gui.commands.FakeSeries;
import javafx.beans.property.SimpleBooleanProperty;
import javafx.event.ActionEvent;
import javafx.scene.input.KeyCombination;

@SuppressWarnings("javadoc")
public class TestFileMenuActions {
	
	private FakeContext context;
	private SimpleBooleanProperty databaseOpen;
	private SimpleBooleanProperty seriesSelected;
	private FileMenuActions menuActions;
	
	@BeforeEach
	public void init() {
		context = new FakeContext();
		databaseOpen = new SimpleBooleanProperty(false);
		seriesSelected = new SimpleBooleanProperty(false);
		menuActions = new FileMenuActions(context, databaseOpen, seriesSelected);
	}
	
	@Test
	public void test_menuLayout() {
		List<Action> actions = menuActions.getActions();
		assertEquals(12, actions.size());
		
		List<String> texts = actions.stream()
				.map(a -> ActionTools.isSeparator(a) ? "-" : a.getText())
				.collect(Collectors.toList());
		assertEquals(Arrays.asList(
				"Open", "Read", "Save", "Restore", "Close", 
				"-", 
				"Open subfolders", 
				"-", 
				"Export as .dcm", "Export as .csv", "Export as .png", "Export as .nii"), texts);
		
		for (var action : actions)
			assertEquals("Menu.File", ActionTools.getMenuPath(action));
		assertEquals("Menu.File", menuActions.getMenuKey());
		assertEquals("File", menuActions.getName());
	}
	
	@Test
	public void test_descriptions() {
		var actions = menuActions.getActions();
		assertEquals("Close the open database", actions.get(4).getLongText());
		assertNull(actions.get(8).getLongText());
	}
	
	@Test
	public void test_accelerators() {
		var actions = menuActions.getActions();
		assertEquals(KeyCombination.keyCombination("shortcut+o"), actions.get(0).getAccelerator());
		assertNull(actions.get(1).getAccelerator());
		assertEquals(KeyCombination.keyCombination("shortcut+s"), actions.get(2).getAccelerator());
		assertEquals(KeyCombination.keyCombination("shortcut+r"), actions.get(3).getAccelerator());
		assertEquals(KeyCombination.keyCombination("shortcut+c"), actions.get(4).getAccelerator());
	}
	
	@Test
	public void test_enabledState() {
		var actions = menuActions.getActions();
		var open = actions.get(0);
		var save = actions.get(2);
		var openSubfolders = actions.get(6);
		var exportCsv = actions.get(9);
		
		assertFalse(open.isDisabled());
		assertFalse(openSubfolders.isDisabled());
		assertTrue(save.isDisabled());
		assertTrue(exportCsv.isDisabled());
		
		databaseOpen.set(true);
		assertFalse(save.isDisabled());
		assertTrue(exportCsv.isDisabled());
		
		seriesSelected.set(true);
		assertFalse(exportCsv.isDisabled());
		
		databaseOpen.set(false);
		assertTrue(save.isDisabled());
		assertFalse(open.isDisabled());
	}
	
	@Test
	public void test_openPromptsForFolder() {
		var open = menuActions.getActions().get(0);
		open.handle(new ActionEvent());
		assertEquals(1, context.dialog.prompts.size());
		assertTrue(context.calls.isEmpty());
	}
	
	@Test
	public void test_saveRunsOnDatabase() {
		var db = new FakeDatabase(Paths.get("db"));
		context.database = db;
		databaseOpen.set(true);
		menuActions.getActions().get(2).handle(new ActionEvent());
		assertEquals(1, db.saveCount);
	}
	
	@Test
	public void test_exportWithSelection() {
		var series = new FakeSeries("T1");
		context.selection.add(series);
		context.dialog.answerDirectory("exported");
		seriesSelected.set(true);
		menuActions.getActions().get(10).handle(new ActionEvent());
		assertEquals(1, series.exports.size());
		assertTrue(series.exports.get(0).startsWith("png "));
	}
	
	@Test
	public void test_failingCommandIsReported() {
		// Read without a database fails; the error is reported rather than thrown
		databaseOpen.set(true);
		menuActions.getActions().get(1).handle(new ActionEvent());
		assertEquals(Arrays.asList("closeAllDisplays"), context.calls);
		assertEquals("normal", context.status.last());
	}

}
