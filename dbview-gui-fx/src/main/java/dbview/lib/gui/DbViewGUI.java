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

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dbview.fx.dialogs.Dialogs;
import dbview.lib.color.ColorMaps;
import dbview.lib.dicom.DatabaseProviders;
import dbview.lib.dicom.DicomDatabase;
import dbview.lib.dicom.DicomLevel;
import dbview.lib.dicom.DicomRecord;
import dbview.lib.dicom.ImageSeries;
import dbview.lib.gui.actions.menus.FileMenuActions;
import dbview.lib.gui.actions.menus.ViewMenuActions;
import dbview.lib.gui.dialogs.FxDialogPrompt;
import dbview.lib.gui.display.SeriesDisplay;
import dbview.lib.gui.display.SeriesDisplay4D;
import dbview.lib.gui.localization.DbViewResources;
import dbview.lib.gui.panes.DatabaseTreePane;
import dbview.lib.gui.panes.StatusBarPane;
import dbview.lib.gui.prefs.DbViewPrefs;
import dbview.lib.gui.tools.MenuTools;
import dbview.lib.interfaces.DialogPrompt;
import dbview.lib.interfaces.StatusMonitor;
import javafx.beans.binding.Bindings;
import javafx.beans.binding.BooleanBinding;
import javafx.beans.property.ReadOnlyBooleanProperty;
import javafx.scene.Node;
import javafx.scene.Scene;
import javafx.scene.control.MenuBar;
import javafx.scene.control.SplitPane;
import javafx.scene.control.Tab;
import javafx.scene.control.TabPane;
import javafx.scene.layout.BorderPane;
import javafx.stage.Stage;
import javafx.stage.WindowEvent;

/**
 * Main window of DbView: menus, the database tree, a tab for each series display and a status bar.
 * <p>
 * This is the {@link ApplicationContext} passed to all menu commands.
 * 
 * @author DbView developers
 */
public class DbViewGUI implements ApplicationContext {
	
	private static final Logger logger = LoggerFactory.getLogger(DbViewGUI.class);
	
	private final Stage stage;
	
	private final MenuBar menuBar = new MenuBar();
	private final DatabaseTreePane treePane = new DatabaseTreePane();
	private final TabPane tabPane = new TabPane();
	private final StatusBarPane statusBar = new StatusBarPane();
	private final DialogPrompt dialog;
	
	private final BooleanBinding databaseOpen;
	
	private DbViewGUI(Stage stage) {
		this.stage = Objects.requireNonNull(stage);
		this.dialog = new FxDialogPrompt(DbViewResources.getString("Window.title"));
		
		var database = treePane.databaseProperty();
		databaseOpen = Bindings.createBooleanBinding(() -> {
			var db = database.get();
			return db != null && db.isOpen();
		}, database);
		
		MenuTools.installActions(menuBar.getMenus(), new FileMenuActions(this, databaseOpen, treePane.seriesSelectedProperty()));
		MenuTools.installActions(menuBar.getMenus(), new ViewMenuActions(this));
		
		treePane.setOnSeriesOpened(series -> {
			try {
				showSeriesDisplay(series);
			} catch (IOException e) {
				Dialogs.showErrorMessage(DbViewResources.getString("Display.open"), e);
			}
		});
		database.addListener((v, o, n) -> updateTitle());
		
		tabPane.setTabClosingPolicy(TabPane.TabClosingPolicy.ALL_TABS);
		var split = new SplitPane(treePane.getPane(), tabPane);
		split.setDividerPositions(0.25);
		SplitPane.setResizableWithParent(treePane.getPane(), Boolean.FALSE);
		
		var root = new BorderPane(split);
		root.setTop(menuBar);
		root.setBottom(statusBar.getPane());
		
		stage.setScene(new Scene(root, 1200, 800));
		stage.setOnCloseRequest(this::handleCloseRequest);
		updateTitle();
		
		Dialogs.setPrimaryWindow(stage);
		applyDefaultColorMap(DbViewPrefs.defaultColorMapProperty().get());
		DbViewPrefs.defaultColorMapProperty().addListener((v, o, n) -> applyDefaultColorMap(n));
	}
	
	/**
	 * Create the main window on a stage.
	 * This must be called on the JavaFX Application Thread.
	 * @param stage
	 * @return
	 */
	public static DbViewGUI createInstance(Stage stage) {
		var gui = new DbViewGUI(stage);
		logger.debug("Main window created");
		return gui;
	}
	
	private static void applyDefaultColorMap(String name) {
		var map = ColorMaps.getColorMaps().get(name);
		if (map == null) {
			logger.warn("Unknown default colormap '{}'", name);
			return;
		}
		ColorMaps.setDefaultColorMap(map);
	}
	
	private void handleCloseRequest(WindowEvent event) {
		try {
			if (!close()) {
				event.consume();
				return;
			}
		} catch (IOException e) {
			Dialogs.showErrorMessage(DbViewResources.getString("Window.quitTitle"), e);
			event.consume();
			return;
		}
		DbViewPrefs.savePreferences();
		logger.info("DbView closed");
	}
	
	private void updateTitle() {
		var db = database();
		String title = DbViewResources.getString("Window.title");
		if (db != null && db.getPath() != null)
			title += " - " + db.getPath().toString();
		stage.setTitle(title);
	}
	
	/**
	 * Get the main stage.
	 * @return
	 */
	public Stage getStage() {
		return stage;
	}
	
	/**
	 * True whenever at least one series is selected in the database tree.
	 * @return
	 */
	public ReadOnlyBooleanProperty seriesSelectedProperty() {
		return treePane.seriesSelectedProperty();
	}

	@Override
	public DicomDatabase database() {
		return treePane.databaseProperty().get();
	}

	@Override
	public boolean close() throws IOException {
		var db = database();
		if (db != null && db.isOpen() && !db.close()) {
			logger.debug("Database {} was not closed", db.getPath());
			return false;
		}
		closeAllDisplays();
		treePane.databaseProperty().set(null);
		return true;
	}

	@Override
	public void open(Path path) throws IOException {
		var db = DatabaseProviders.open(path, status(), dialog());
		logger.info("Opened database {}", path);
		display(db);
	}

	@Override
	public void refresh() {
		treePane.refresh();
		databaseOpen.invalidate();
	}

	@Override
	public void display(DicomDatabase database) {
		closeAllDisplays();
		treePane.databaseProperty().set(database);
		databaseOpen.invalidate();
	}

	@Override
	public void closeAllDisplays() {
		tabPane.getTabs().clear();
	}

	@Override
	public List<? extends DicomRecord> selected(DicomLevel level) {
		return treePane.getSelected(level);
	}

	@Override
	public StatusMonitor status() {
		return statusBar;
	}

	@Override
	public DialogPrompt dialog() {
		return dialog;
	}
	
	/**
	 * Open a tab showing a series one image at a time.
	 * @param series
	 * @throws IOException if the first image cannot be read
	 */
	public void showSeriesDisplay(ImageSeries series) throws IOException {
		var display = new SeriesDisplay(status());
		display.setSeries(series);
		addTab(series.getSeriesDescription(), display.getPane());
	}
	
	/**
	 * Open a tab showing a series sorted by the view and plot sort keys of the preferences.
	 * If the series cannot be sorted along both keys, the user is told so and no tab is opened.
	 * @param series
	 * @throws IOException if the pixel data cannot be read
	 */
	public void showSeriesDisplay4D(ImageSeries series) throws IOException {
		var sortBy = DbViewPrefs.getSortKeys();
		var display = new SeriesDisplay4D(status());
		status().cursorToHourglass();
		try {
			display.setSeries(series, sortBy);
		} catch (IllegalArgumentException e) {
			logger.debug(e.getLocalizedMessage(), e);
			dialog().information(String.format(DbViewResources.getString("Display4D.invalidAxes"), sortBy.get(0), sortBy.get(1)));
			return;
		} finally {
			status().hide();
			status().cursorToNormal();
		}
		addTab(series.getSeriesDescription(), display.getPane());
	}
	
	private void addTab(String title, Node content) {
		var tab = new Tab(title, content);
		tabPane.getTabs().add(tab);
		tabPane.getSelectionModel().select(tab);
	}

}
