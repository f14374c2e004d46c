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

import dbview.lib.display.CurvePlot;
import dbview.lib.display.ValueRange;
import javafx.scene.chart.LineChart;
import javafx.scene.chart.NumberAxis;
import javafx.scene.chart.XYChart;
import javafx.scene.chart.XYChart.Data;
import javafx.scene.layout.BorderPane;
import javafx.scene.layout.Pane;

/**
 * Line chart showing one signal curve, with the current point highlighted.
 */
public class PlotCurve implements CurvePlot {

    private final NumberAxis xAxis = new NumberAxis();
    private final NumberAxis yAxis = new NumberAxis();
    private final LineChart<Number, Number> chart = new LineChart<>(xAxis, yAxis);

    private final XYChart.Series<Number, Number> curve = new XYChart.Series<>();
    private final XYChart.Series<Number, Number> highlight = new XYChart.Series<>();

    private final BorderPane pane = new BorderPane(chart);

    /**
     * Constructor.
     */
    public PlotCurve() {
        chart.setAnimated(false);
        chart.setLegendVisible(false);
        chart.setCreateSymbols(true);
        chart.getData().add(curve);
        chart.getData().add(highlight);
        setXLimits(null);
        setYLimits(null);
    }

    /**
     * Get the pane containing the chart.
     * @return
     */
    public Pane getPane() {
        return pane;
    }

    /**
     * Get the chart.
     * @return
     */
    public LineChart<Number, Number> getChart() {
        return chart;
    }

    @Override
    public void setXLabel(String label) {
        xAxis.setLabel(label);
    }

    @Override
    public void setYLabel(String label) {
        yAxis.setLabel(label);
    }

    @Override
    public void setXLimits(ValueRange range) {
        setLimits(xAxis, range);
    }

    @Override
    public void setYLimits(ValueRange range) {
        setLimits(yAxis, range);
    }

    private static void setLimits(NumberAxis axis, ValueRange range) {
        if (range == null || !(range.getLength() > 0)) {
            axis.setAutoRanging(true);
            return;
        }
        axis.setAutoRanging(false);
        axis.setLowerBound(range.getMin());
        axis.setUpperBound(range.getMax());
        axis.setTickUnit(range.getLength() / 5.0);
    }

    @Override
    public void setData(double[] x, double[] y, int highlightIndex) {
        int n = Math.min(x.length, y.length);
        var data = curve.getData();
        data.clear();
        for (int i = 0; i < n; i++)
            data.add(new Data<>(x[i], y[i]));
        highlight.getData().clear();
        if (highlightIndex >= 0 && highlightIndex < n)
            highlight.getData().add(new Data<>(x[highlightIndex], y[highlightIndex]));
    }

    @Override
    public void clear() {
        curve.getData().clear();
        highlight.getData().clear();
    }

}
