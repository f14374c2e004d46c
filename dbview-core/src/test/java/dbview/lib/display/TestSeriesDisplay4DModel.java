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

package dbview.lib.display;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import dbview.lib.dicom.DicomAttributes;
import dbview.lib.display.SeriesCursor.ArrowKey;
import dbview.lib.display.SeriesCursor.Axis;
import dbview.lib.display.SeriesCursor.Direction;

@SuppressWarnings("javadoc")
public class TestSeriesDisplay4DModel {
	
	private RecordingRenderer renderer;
	private RecordingPlot plot;
	private RecordingStatus status;
	private SeriesDisplay4DModel model;
	
	@BeforeEach
	public void init() {
		renderer = new RecordingRenderer();
		plot = new RecordingPlot();
		status = new RecordingStatus();
		model = new SeriesDisplay4DModel(renderer, plot, status);
	}
	
	@Test
	public void test_load() throws IOException {
		var series = new MockSeries("Series", 2, 2, 3, 2, new double[] {100, 110}, new double[] {20, 10});
		model.setSeries(series, DicomAttributes.DEFAULT_4D_SORT_KEYS);
		
		assertEquals(DicomAttributes.DEFAULT_4D_SORT_KEYS, series.lastSortBy);
		assertEquals(DicomAttributes.ACQUISITION_TIME, plot.xLabel);
		assertEquals("Series", plot.yLabel);
		assertEquals(ValueRange.of(0, 10), plot.xLimits);
		assertEquals(ValueRange.of(90, 115), plot.yLimits);
		
		// First frame shown, but no probe yet
		assertEquals("uid-0-0", renderer.lastUID());
		assertEquals(100, renderer.center);
		assertEquals(20, renderer.width);
		assertEquals("Gray", renderer.colormap);
		assertFalse(plot.hasData());
		assertTrue(status.messages.isEmpty());
		assertEquals("", model.getStatusText());
	}
	
	@Test
	public void test_plotRangeFixedOnCursorMove() throws IOException {
		var series = new MockSeries("Series", 3, 2, 3, 2, new double[] {100, 110}, new double[] {20, 10});
		model.setSeries(series, DicomAttributes.DEFAULT_4D_SORT_KEYS);
		model.pointerMoved(1, 1);
		var cursor = model.getCursor();
		for (var key : ArrowKey.values()) {
			cursor.handleArrowKey(key);
			cursor.handleArrowKey(key);
			assertEquals(ValueRange.of(90, 115), plot.yLimits);
			assertEquals(ValueRange.of(90, 115), model.getPlotYRange());
			assertEquals(ValueRange.of(0, 10), plot.xLimits);
		}
	}
	
	@Test
	public void test_cursorMoveRendersFrame() throws IOException {
		model.setSeries(new MockSeries(3, 4), DicomAttributes.DEFAULT_4D_SORT_KEYS);
		var cursor = model.getCursor();
		cursor.move(Axis.Z, Direction.UP);
		assertEquals("uid-1-0", renderer.lastUID());
		cursor.handleArrowKey(ArrowKey.RIGHT);
		assertEquals("uid-1-1", renderer.lastUID());
		assertEquals(110, renderer.center);
		assertEquals("Jet", renderer.colormap);
		assertEquals(MockSeries.value(2, 1, 1, 1), renderer.pixels.getValue(2, 1));
		
		// Clamped moves do not redraw
		int nShown = renderer.uids.size();
		cursor.setPosition(2, 3);
		cursor.move(Axis.Z, Direction.UP);
		cursor.handleArrowKey(ArrowKey.RIGHT);
		assertEquals(nShown + 1, renderer.uids.size());
	}
	
	@Test
	public void test_probeInside() throws IOException {
		model.setSeries(new MockSeries(2, 3), DicomAttributes.DEFAULT_4D_SORT_KEYS);
		model.getCursor().setPosition(1, 2);
		model.pointerMoved(2, 1);
		
		String expected = "SliceLocation = 5, AcquisitionTime = 20, x = 2, y = 1, signal = " + (int)MockSeries.value(2, 1, 1, 2);
		assertEquals(expected, model.getStatusText());
		assertEquals(expected, status.lastMessage());
		
		assertArrayEquals(new double[] {0, 10, 20}, plot.x);
		assertArrayEquals(new double[] {
				MockSeries.value(2, 1, 1, 0),
				MockSeries.value(2, 1, 1, 1),
				MockSeries.value(2, 1, 1, 2)}, plot.y);
		assertEquals(2, plot.highlightIndex);
		
		model.getCursor().handleArrowKey(ArrowKey.LEFT);
		assertEquals(1, plot.highlightIndex);
		assertEquals("SliceLocation = 5, AcquisitionTime = 10, x = 2, y = 1, signal = " + (int)MockSeries.value(2, 1, 1, 1),
				status.lastMessage());
	}
	
	@Test
	public void test_probeOutsideClearsEverywhere() throws IOException {
		model.setSeries(new MockSeries(3, 3), DicomAttributes.DEFAULT_4D_SORT_KEYS);
		model.pointerMoved(1, 1);
		assertTrue(plot.hasData());
		
		for (int[] p : new int[][] {{-1, 0}, {0, -1}, {3, 0}, {0, 2}, {100, 100}}) {
			model.pointerMoved(p[0], p[1]);
			for (int z = 0; z < 3; z++) {
				for (int t = 0; t < 3; t++) {
					model.getCursor().setPosition(z, t);
					model.refresh();
					assertEquals("", model.getStatusText());
					assertEquals("", status.lastMessage());
					assertFalse(plot.hasData());
				}
			}
		}
	}
	
	@Test
	public void test_windowOverride() throws IOException {
		model.setSeries(new MockSeries(2, 2), DicomAttributes.DEFAULT_4D_SORT_KEYS);
		var loadRange = plot.yLimits;
		
		model.setWindow(50, 40);
		assertTrue(model.isWindowOverridden());
		assertEquals(ValueRange.of(30, 70), plot.yLimits);
		assertEquals(50, renderer.center);
		assertEquals(40, renderer.width);
		
		model.getCursor().handleArrowKey(ArrowKey.RIGHT);
		assertEquals(50, renderer.center);
		assertEquals(ValueRange.of(30, 70), plot.yLimits);
		
		model.resetWindow();
		assertFalse(model.isWindowOverridden());
		assertEquals(loadRange, plot.yLimits);
		assertEquals(110, renderer.center);
		
		assertThrows(IllegalArgumentException.class, () -> model.setWindow(50, 0));
	}
	
	@Test
	public void test_progressAndHide() throws IOException {
		model.setSeries(new MockSeries(2, 2), DicomAttributes.DEFAULT_4D_SORT_KEYS);
		assertTrue(status.progress.contains("4/4 Reading coordinates.."));
		assertTrue(status.hideCount >= 2);
	}
	
	@Test
	public void test_invalidSortKeys() {
		var series = new MockSeries(2, 2);
		assertThrows(IllegalArgumentException.class, () -> model.setSeries(series, List.of(DicomAttributes.SLICE_LOCATION)));
		assertFalse(model.hasSeries());
	}
	
	@Test
	public void test_pointerBeforeLoad() {
		model.pointerMoved(0, 0);
		assertNull(renderer.lastUID());
		assertTrue(status.messages.isEmpty());
		assertNull(model.getFrameIndex());
	}

}
