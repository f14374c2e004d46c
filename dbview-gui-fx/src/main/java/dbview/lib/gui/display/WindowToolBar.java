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


package dbview.lib.gui.display;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dbview.fx.utils.FXUtils;
import dbview.lib.display.SeriesCursor;
import dbview.lib.display.SeriesCursorListener;
import dbview.lib.display.SeriesDisplay4DModel;
import dbview.lib.gui.actions.ActionTools;
import dbview.lib.gui.localization.DbViewResources;
import javafx.scene.control.Label;
import javafx.scene.control.Spinner;
import javafx.scene.control.ToolBar;

/**
 * Toolbar of a 4D display, to set a display window shared by all frames.
 * <p>
 * While no shared window is set, the spinners follow the window of the current frame.
 * 
 * @author DbView developers
 */
class WindowToolBar implements SeriesCursorListener {
	
	private static final Logger logger = LoggerFactory.getLogger(WindowToolBar.class);
	
	private final SeriesDisplay4DModel model;
	
	private final Spinner<Double> spinnerCenter = FXUtils.createDynamicStepSpinner(-Double.MAX_VALUE, Double.MAX_VALUE, 0, 0.1, 1);
	private final Spinner<Double> spinnerWidth = FXUtils.createDynamicStepSpinner(Double.MIN_VALUE, Double.MAX_VALUE, 1, 0.1, 1);
	private final ToolBar toolBar = new ToolBar();
	
	private boolean updating = false;
	
	WindowToolBar(SeriesDisplay4DModel model) {
		this.model = model;
		spinnerCenter.setPrefWidth(110);
		spinnerWidth.setPrefWidth(110);
		spinnerCenter.valueProperty().addListener((v, o, n) -> handleWindowChange());
		spinnerWidth.valueProperty().addListener((v, o, n) -> handleWindowChange());
		
		var actionDefault = ActionTools.actionBuilder(e -> {
				model.resetWindow();
				updateSpinners();
			})
			.text(DbViewResources.getString("Display4D.default"))
			.longText(DbViewResources.getString("Display4D.default.description"))
			.disabled(spinnerCenter.disableProperty())
			.build();
		var btnDefault = ActionTools.createButton(actionDefault);
		
		toolBar.getItems().addAll(
				new Label(DbViewResources.getString("Display4D.center")), spinnerCenter,
				new Label(DbViewResources.getString("Display4D.width")), spinnerWidth,
				btnDefault);
		model.getCursor().addListener(this);
		updateSpinners();
	}
	
	ToolBar getToolBar() {
		return toolBar;
	}
	
	private void handleWindowChange() {
		if (updating || !model.hasSeries())
			return;
		Double center = spinnerCenter.getValue();
		Double width = spinnerWidth.getValue();
		if (center == null || width == null || !(width > 0))
			return;
		logger.trace("Setting window center={}, width={}", center, width);
		model.setWindow(center, width);
	}
	
	/**
	 * Show the window of the current frame, without changing the display.
	 */
	void updateSpinners() {
		boolean hasSeries = model.hasSeries();
		spinnerCenter.setDisable(!hasSeries);
		spinnerWidth.setDisable(!hasSeries);
		if (!hasSeries)
			return;
		double center = model.getWindowCenter();
		double width = model.getWindowWidth();
		updating = true;
		try {
			if (Double.isFinite(center))
				spinnerCenter.getValueFactory().setValue(center);
			if (width > 0)
				spinnerWidth.getValueFactory().setValue(width);
		} finally {
			updating = false;
		}
	}

	@Override
	public void cursorChanged(SeriesCursor cursor, int zOld, int tOld) {
		if (!model.isWindowOverridden())
			updateSpinners();
	}

}
