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

import dbview.lib.interfaces.StatusMonitor;
import javafx.geometry.Insets;
import javafx.geometry.Pos;
import javafx.scene.Cursor;
import javafx.scene.Node;
import javafx.scene.control.Label;
import javafx.scene.control.ProgressBar;
import javafx.scene.layout.HBox;
import javafx.scene.layout.Priority;

/**
 * Status bar at the bottom of the main window, with a message and a progress bar.
 * 
 * @author DbView developers
 */
public class StatusBarPane implements StatusMonitor {
	
	private final Label label = new Label();
	private final ProgressBar progressBar = new ProgressBar();
	private final HBox pane = new HBox(8, label, progressBar);
	
	/**
	 * Constructor.
	 */
	public StatusBarPane() {
		label.setMaxWidth(Double.MAX_VALUE);
		HBox.setHgrow(label, Priority.ALWAYS);
		progressBar.setPrefWidth(160);
		progressBar.setVisible(false);
		pane.setAlignment(Pos.CENTER_LEFT);
		pane.setPadding(new Insets(2, 8, 2, 8));
		pane.setMinHeight(24);
	}
	
	/**
	 * Get the node to add to the scene.
	 * @return
	 */
	public Node getPane() {
		return pane;
	}
	
	/**
	 * Get the message currently shown.
	 * @return
	 */
	public String getMessage() {
		return label.getText();
	}

	@Override
	public void message(String message) {
		label.setText(message == null ? "" : message);
	}

	@Override
	public void progress(int value, int total, String message) {
		message(message);
		progressBar.setVisible(true);
		progressBar.setProgress(total <= 0 ? ProgressBar.INDETERMINATE_PROGRESS : (double)value / total);
	}

	@Override
	public void hide() {
		label.setText("");
		progressBar.setVisible(false);
		progressBar.setProgress(0);
	}

	@Override
	public void cursorToHourglass() {
		setCursor(Cursor.WAIT);
	}

	@Override
	public void cursorToNormal() {
		setCursor(Cursor.DEFAULT);
	}
	
	private void setCursor(Cursor cursor) {
		var scene = pane.getScene();
		if (scene != null)
			scene.setCursor(cursor);
	}

}
