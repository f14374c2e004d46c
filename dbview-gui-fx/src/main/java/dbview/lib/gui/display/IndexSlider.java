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

import javafx.beans.property.IntegerProperty;
import javafx.beans.property.SimpleIntegerProperty;
import javafx.geometry.Orientation;
import javafx.scene.control.Slider;

/**
 * Slider selecting an integer index in {@code [0, maximum]}.
 * 
 * @author DbView developers
 */
public class IndexSlider {
	
	private final Slider slider = new Slider(0, 0, 0);
	private final IntegerProperty index = new SimpleIntegerProperty(0);
	
	/**
	 * Constructor.
	 * @param orientation
	 */
	public IndexSlider(Orientation orientation) {
		slider.setOrientation(orientation);
		slider.setBlockIncrement(1);
		slider.setMajorTickUnit(1);
		slider.setMinorTickCount(0);
		slider.setSnapToTicks(true);
		slider.setFocusTraversable(false);
		slider.valueProperty().addListener((v, o, n) -> index.set((int)Math.round(n.doubleValue())));
		index.addListener((v, o, n) -> {
			if ((int)Math.round(slider.getValue()) != n.intValue())
				slider.setValue(n.intValue());
		});
	}
	
	/**
	 * Get the slider control.
	 * @return
	 */
	public Slider getSlider() {
		return slider;
	}
	
	/**
	 * Set the maximum index, clamping the current index if needed.
	 * The slider is disabled when the maximum is 0.
	 * @param maximum
	 */
	public void setMaximum(int maximum) {
		maximum = Math.max(0, maximum);
		slider.setMax(maximum);
		slider.setDisable(maximum == 0);
		if (index.get() > maximum)
			index.set(maximum);
	}
	
	/**
	 * The current index.
	 * @return
	 */
	public IntegerProperty indexProperty() {
		return index;
	}
	
	/**
	 * Get the current index.
	 * @return
	 */
	public int getIndex() {
		return index.get();
	}
	
	/**
	 * Set the current index.
	 * @param value
	 */
	public void setIndex(int value) {
		index.set(value);
	}

}
