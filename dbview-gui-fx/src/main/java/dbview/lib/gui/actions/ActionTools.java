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


package dbview.lib.gui.actions;

import java.lang.reflect.AnnotatedElement;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.stream.Collectors;

import org.controlsfx.control.action.Action;
import org.controlsfx.control.action.ActionUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dbview.fx.dialogs.Dialogs;
import dbview.lib.gui.actions.annotations.ActionAccelerator;
import dbview.lib.gui.actions.annotations.ActionConfig;
import dbview.lib.gui.actions.annotations.ActionMenu;
import dbview.lib.gui.localization.DbViewResources;
import javafx.beans.property.Property;
import javafx.beans.value.ObservableValue;
import javafx.event.ActionEvent;
import javafx.scene.control.Button;
import javafx.scene.control.MenuItem;
import javafx.scene.control.SeparatorMenuItem;
import javafx.scene.input.KeyCombination;

/**
 * Helper methods for generating and configuring {@linkplain Action Actions} and UI elements.
 * 
 * @author DbView developers
 */
public class ActionTools {
	
	private static final Logger logger = LoggerFactory.getLogger(ActionTools.class);
	
	/**
	 * Key of the action property holding the menu path, as parsed from {@link ActionMenu}.
	 */
	public static final String MENU_KEY = "MENU";
	
	/**
	 * A command that may fail with an exception, for use with {@link #createCheckedAction(String, CheckedCommand)}.
	 */
	@FunctionalInterface
	public static interface CheckedCommand {
		
		/**
		 * Run the command.
		 * @throws Exception
		 */
		void run() throws Exception;
		
	}
	
	/**
	 * Builder class for custom {@link Action} objects.
	 * These can be used to create GUI components (e.g. buttons, menu items).
	 */
	public static class ActionBuilder {

		private Consumer<ActionEvent> handler;
		
		private enum Keys {TEXT, LONG_TEXT, DISABLED};
		private Map<Keys, Object> properties = new HashMap<>();

		ActionBuilder(Consumer<ActionEvent> handler) {
			this.handler = handler;
		}
		
		private ActionBuilder property(Keys key, Object value) {
			properties.put(key, value);
			return this;
		}
		
		/**
		 * Set the text property of the action.
		 * @param value
		 * @return this builder
		 */
		public ActionBuilder text(String value) {
			return property(Keys.TEXT, value);
		}
		
		/**
		 * Set the long text property of the action.
		 * @param value
		 * @return this builder
		 */
		public ActionBuilder longText(String value) {
			return property(Keys.LONG_TEXT, value);
		}
		
		/**
		 * Bind the disabled property of the action to an {@link ObservableValue}.
		 * @param value
		 * @return this builder
		 */
		public ActionBuilder disabled(ObservableValue<Boolean> value) {
			return property(Keys.DISABLED, value);
		}
		
		@SuppressWarnings("unchecked")
		private static <T> void updateProperty(Property<T> property, Object value) {
			if (value instanceof ObservableValue)
				property.bind((ObservableValue<? extends T>)value);
			else
				property.setValue((T)value);
		}
		
		/**
		 * Create an {@link Action} with this builder.
		 * @return
		 */
		public Action build() {
			var action = new Action(handler);
			for (var entry : properties.entrySet()) {
				var value = entry.getValue();
				switch (entry.getKey()) {
				case DISABLED:
					updateProperty(action.disabledProperty(), value);
					break;
				case LONG_TEXT:
					updateProperty(action.longTextProperty(), value);
					break;
				case TEXT:
					updateProperty(action.textProperty(), value);
					break;
				default:
					break;
				}
			}
			return action;
		}
		
	}
	
	
	private static String getMenuString(String[] text) {
		return Arrays.stream(text)
			.collect(Collectors.joining(">")) + ">";
	}
	
	private static String joinMenuPaths(String baseMenu, String submenu) {
		if (baseMenu.isEmpty())
			return submenu;
		else if (baseMenu.endsWith(">"))
			return baseMenu + submenu;
		else
			return baseMenu + ">" + submenu;
	}
	
	/**
	 * Actions are parsed from the non-static fields of any object, in declaration order.
	 * Fields may hold an {@link Action}, an array of actions, or another object annotated with {@link ActionMenu} 
	 * whose actions then belong to a submenu.
	 * Any annotations associated with the actions will be parsed.
	 * 
	 * @param obj the object containing the action fields
	 * @return a list of parsed and configured actions
	 */
	public static List<Action> getAnnotatedActions(Object obj) {
		return getAnnotatedActions(obj, "");
	}
	
	private static List<Action> getAnnotatedActions(Object obj, String baseMenu) {
		List<Action> actions = new ArrayList<>();
		
		Class<?> cls = obj.getClass();
		
		// If the class is annotated with a menu, use that as a base; all other menus will be nested within this
		var menuAnnotation = cls.getAnnotation(ActionMenu.class);
		if (menuAnnotation != null)
			baseMenu = joinMenuPaths(baseMenu, getMenuString(menuAnnotation.value()));
		
		for (var f : cls.getDeclaredFields()) {
			if (Modifier.isStatic(f.getModifiers()) || f.isSynthetic())
				continue;
			try {
				if (!f.canAccess(obj))
					f.setAccessible(true);
				var value = f.get(obj);
				if (value instanceof Action) {
					var action = (Action)value;
					parseAnnotations(action, f, baseMenu);
					actions.add(action);
				} else if (value instanceof Action[]) {
					for (var temp : (Action[])value) {
						parseAnnotations(temp, f, baseMenu);
						actions.add(temp);		
					}
				} else if (value != null && f.isAnnotationPresent(ActionMenu.class)) {
					String baseSubMenu = joinMenuPaths(baseMenu, getMenuString(f.getAnnotation(ActionMenu.class).value()));
					actions.addAll(getAnnotatedActions(value, baseSubMenu));
				}
			} catch (Exception e) {
				logger.error("Error setting up action: {}", e.getLocalizedMessage(), e);
			}
		}
		return actions;
	}
	
	/**
	 * Parse annotations relating to an action, updating the properties of the action with an optional base menu.
	 * @param action the action to update
	 * @param element the annotated element (usually a field)
	 * @param baseMenu prepended to any {@link ActionMenu} path
	 */
	private static void parseAnnotations(Action action, AnnotatedElement element, String baseMenu) {
		parseMenu(action, element.getAnnotation(ActionMenu.class), baseMenu);
		parseAccelerator(action, element.getAnnotation(ActionAccelerator.class));
		parseConfig(action, element.getAnnotation(ActionConfig.class));
	}
	
	private static void parseConfig(Action action, ActionConfig annotation) {
		if (annotation == null)
			return;
		String key = annotation.value();
		action.setText(DbViewResources.getStringOrKey(key));
		String descriptionKey = key + ".description";
		if (DbViewResources.hasString(descriptionKey))
			action.setLongText(DbViewResources.getString(descriptionKey));
	}
	
	private static void parseMenu(Action action, ActionMenu annotation, String baseMenu) {
		String menuString = baseMenu == null || baseMenu.isBlank() ? "" : baseMenu;
		if (!menuString.isEmpty() && !menuString.endsWith(">"))
			menuString += ">";
		if (annotation != null)
			menuString += getMenuString(annotation.value());
		if (menuString.isEmpty())
			return;
		// Strip the trailing separator so that the last element is the menu holding the action
		var menu = menuString.substring(0, menuString.length()-1);
		action.getProperties().put(MENU_KEY, menu);
	}
	
	private static void parseAccelerator(Action action, ActionAccelerator annotation) {
		if (annotation == null)
			return;
		var accelerator = annotation.value();
		if (!accelerator.isBlank()) {
			try {
				action.setAccelerator(KeyCombination.keyCombination(accelerator));
			} catch (Exception e) {
				logger.warn("Unable to parse key combination '{}', cannot create accelerator for {}", accelerator, action);					
			}
		}
	}
	
	/**
	 * Get the menu path of an action, as set by {@link ActionMenu} annotations.
	 * @param action
	 * @return the menu path, or null if none is set
	 */
	public static String getMenuPath(Action action) {
		var menu = action.getProperties().get(MENU_KEY);
		return menu instanceof String ? (String)menu : null;
	}
	
	/**
	 * Create an action indicating that a separator should be added (e.g. to a menu or toolbar).
	 * @return
	 */
	public static Action createSeparator() {
		return new Action(null, null);
	}
	
	/**
	 * Query whether an action represents a separator.
	 * @param action
	 * @return
	 * @see #createSeparator()
	 */
	public static boolean isSeparator(Action action) {
		return action == ActionUtils.ACTION_SEPARATOR || action.getText() == null;
	}
	
	/**
	 * Create an {@link ActionBuilder} with the specified event handler.
	 * @param handler
	 * @return a new {@link ActionBuilder}
	 */
	public static ActionBuilder actionBuilder(Consumer<ActionEvent> handler) {
		return new ActionBuilder(handler);
	}
	
	/**
	 * Create an action whose event handler calls a runnable.
	 * @param command the runnable to call
	 * @return a new {@link Action}
	 */
	public static Action createAction(final Runnable command) {
		return actionBuilder(e -> command.run()).build();
	}
	
	/**
	 * Create an action that runs a command that may fail.
	 * Any exception is logged and shown to the user as an error.
	 * @param title title for the error message
	 * @param command the command to run
	 * @return a new {@link Action}
	 */
	public static Action createCheckedAction(final String title, final CheckedCommand command) {
		return actionBuilder(e -> {
			try {
				command.run();
			} catch (Exception ex) {
				Dialogs.showErrorMessage(title, ex);
			}
		}).build();
	}
	
	/**
	 * Create a menu item from an action.
	 * @param action the action from which to construct the menu item
	 * @return a new {@link MenuItem} configured according to the action.
	 */
	public static MenuItem createMenuItem(Action action) {
		if (isSeparator(action))
			return new SeparatorMenuItem();
		return ActionUtils.createMenuItem(action);
	}
	
	/**
	 * Create a button from an action, showing its text.
	 * @param action the action from which to construct the button
	 * @return a new {@link Button} configured according to the action.
	 */
	public static Button createButton(Action action) {
		return ActionUtils.createButton(action);
	}

}
