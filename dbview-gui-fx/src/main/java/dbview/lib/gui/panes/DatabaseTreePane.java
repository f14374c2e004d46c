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


package dbview.lib.gui.panes;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dbview.lib.dicom.DicomDatabase;
import dbview.lib.dicom.DicomLevel;
import dbview.lib.dicom.DicomRecord;
import dbview.lib.dicom.ImageSeries;
import dbview.lib.gui.localization.DbViewResources;
import javafx.beans.binding.Bindings;
import javafx.beans.property.ObjectProperty;
import javafx.beans.property.ReadOnlyBooleanProperty;
import javafx.beans.property.ReadOnlyBooleanWrapper;
import javafx.beans.property.SimpleObjectProperty;
import javafx.collections.ObservableList;
import javafx.scene.control.Label;
import javafx.scene.control.SelectionMode;
import javafx.scene.control.TreeCell;
import javafx.scene.control.TreeItem;
import javafx.scene.control.TreeView;
import javafx.scene.input.MouseButton;
import javafx.scene.layout.BorderPane;
import javafx.scene.layout.Pane;

/**
 * Tree showing the patients, studies and series of a database, with multiple selection.
 * Images are not shown.
 * 
 * @author DbView developers
 */
public class DatabaseTreePane {
	
	private static final Logger logger = LoggerFactory.getLogger(DatabaseTreePane.class);
	
	private final ObjectProperty<DicomDatabase> database = new SimpleObjectProperty<>();
	
	private final ReadOnlyBooleanWrapper seriesSelected = new ReadOnlyBooleanWrapper(false);
	
	private final TreeView<DicomRecord> tree = new TreeView<>();
	private final BorderPane pane = new BorderPane(tree);
	
	private Consumer<ImageSeries> onSeriesOpened;
	
	/**
	 * Constructor.
	 */
	public DatabaseTreePane() {
		tree.getSelectionModel().setSelectionMode(SelectionMode.MULTIPLE);
		tree.setShowRoot(false);
		tree.setCellFactory(t -> new DicomRecordCell());
		tree.setPlaceholder(new Label(DbViewResources.getString("Tree.empty")));
		database.addListener((v, o, n) -> refresh());
		seriesSelected.bind(Bindings.createBooleanBinding(
				() -> getSelected(DicomLevel.SERIES).size() > 0,
				tree.getSelectionModel().getSelectedItems()));
		tree.setOnMouseClicked(e -> {
			if (e.getButton() == MouseButton.PRIMARY && e.getClickCount() == 2) {
				var item = tree.getSelectionModel().getSelectedItem();
				if (item != null && item.getValue() instanceof ImageSeries && onSeriesOpened != null)
					onSeriesOpened.accept((ImageSeries)item.getValue());
			}
		});
	}
	
	/**
	 * Get the pane containing the tree.
	 * @return
	 */
	public Pane getPane() {
		return pane;
	}
	
	/**
	 * The database shown in the tree.
	 * @return
	 */
	public ObjectProperty<DicomDatabase> databaseProperty() {
		return database;
	}
	
	/**
	 * True whenever at least one series is selected.
	 * @return
	 */
	public ReadOnlyBooleanProperty seriesSelectedProperty() {
		return seriesSelected.getReadOnlyProperty();
	}
	
	/**
	 * Set the consumer called when a series is double-clicked.
	 * @param onSeriesOpened
	 */
	public void setOnSeriesOpened(Consumer<ImageSeries> onSeriesOpened) {
		this.onSeriesOpened = onSeriesOpened;
	}
	
	/**
	 * Rebuild the tree from the current database, e.g. after the database has been rescanned.
	 * The selection is cleared.
	 */
	public void refresh() {
		tree.getSelectionModel().clearSelection();
		var db = database.get();
		if (db == null) {
			tree.setRoot(null);
			return;
		}
		var root = new DicomRecordTreeItem(db);
		root.setExpanded(true);
		tree.setRoot(root);
		logger.debug("Database tree refreshed for {}", db.getPath());
	}
	
	/**
	 * Get the selected records at a specific level, in display order.
	 * @param level
	 * @return
	 */
	public List<DicomRecord> getSelected(DicomLevel level) {
		List<DicomRecord> selected = new ArrayList<>();
		for (var item : tree.getSelectionModel().getSelectedItems()) {
			if (item != null && item.getValue() != null && item.getValue().getLevel() == level)
				selected.add(item.getValue());
		}
		return selected;
	}
	
	
	static class DicomRecordTreeItem extends TreeItem<DicomRecord> {
		
		private boolean childrenComputed = false;
		
		DicomRecordTreeItem(DicomRecord record) {
			super(record);
		}
		
		@Override
		public ObservableList<TreeItem<DicomRecord>> getChildren() {
			if (!isLeaf() && !childrenComputed) {
				childrenComputed = true;
				var children = getValue().getChildren().stream()
						.map(DicomRecordTreeItem::new)
						.collect(Collectors.toList());
				super.getChildren().setAll(children);
			}
			return super.getChildren();
		}

		@Override
		public boolean isLeaf() {
			return getValue().getLevel() == DicomLevel.SERIES;
		}
		
	}
	
	
	static class DicomRecordCell extends TreeCell<DicomRecord> {
		
		@Override
		protected void updateItem(DicomRecord item, boolean empty) {
			super.updateItem(item, empty);
			if (item == null || empty) {
				setText(null);
				setGraphic(null);
				return;
			}
			String label = item.getLabel();
			if (label == null || label.isBlank())
				label = item.getLevel().toString();
			setText(label);
		}
		
	}

}
