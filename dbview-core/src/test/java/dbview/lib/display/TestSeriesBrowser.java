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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import dbview.lib.dicom.MockImage;
import dbview.lib.dicom.PixelData;
import dbview.lib.display.SeriesCursor.ArrowKey;

@SuppressWarnings("javadoc")
public class TestSeriesBrowser {
	
	private RecordingRenderer renderer;
	private RecordingStatus status;
	private SeriesBrowser browser;
	private List<MockImage> images;
	
	@BeforeEach
	public void init() {
		renderer = new RecordingRenderer();
		status = new RecordingStatus();
		browser = new SeriesBrowser(renderer, status);
		images = List.of(
				new MockImage("a", 10, 2, "Red", new PixelData(2, 2, new double[] {1, 2, 3, 4})),
				new MockImage("b", 20, 4, null, new PixelData(2, 2, new double[] {5, 6, 7, 8})),
				new MockImage("c", 30, 6, "Jet", new PixelData(2, 2, new double[] {9, 10, 11, 12.5})));
	}
	
	@Test
	public void test_eachDisplayReadsAndReleases() throws IOException {
		browser.setImages(images);
		assertEquals("a", renderer.lastUID());
		assertEquals(10, renderer.center);
		assertEquals("Red", renderer.colormap);
		
		browser.setIndex(2);
		browser.setIndex(1);
		assertEquals(List.of("a", "c", "b"), renderer.uids);
		for (var image : images) {
			assertFalse(image.isLoaded());
			assertEquals(image.getReadCount(), image.getClearCount());
		}
		assertEquals(1, images.get(0).getReadCount());
		assertEquals(1, images.get(1).getReadCount());
	}
	
	@Test
	public void test_failedReadIsReleased() throws IOException {
		browser.setImages(images);
		images.get(1).setFailOnRead(true);
		assertThrows(IOException.class, () -> browser.setIndex(1));
		assertFalse(images.get(1).isLoaded());
		assertEquals(1, images.get(1).getClearCount());
	}
	
	@Test
	public void test_failedReadKeepsCurrentImage() throws IOException {
		browser.setImages(images);
		images.get(1).setFailOnRead(true);
		assertThrows(IOException.class, () -> browser.setIndex(1));
		assertEquals(0, browser.getIndex());
		assertEquals("a", browser.getImage().getSopInstanceUID());
		
		browser.pointerMoved(0, 0);
		assertEquals("x = 0, y = 0, signal = 1", status.lastMessage());
		
		images.get(1).setFailOnRead(false);
		assertTrue(browser.setIndex(1));
		assertEquals(1, browser.getIndex());
		assertEquals("b", renderer.lastUID());
		assertEquals("x = 0, y = 0, signal = 5", status.lastMessage());
	}
	
	@Test
	public void test_arrowKeys() throws IOException {
		browser.setImages(images);
		assertFalse(browser.handleArrowKey(ArrowKey.LEFT));
		assertFalse(browser.handleArrowKey(ArrowKey.DOWN));
		assertTrue(browser.handleArrowKey(ArrowKey.RIGHT));
		assertTrue(browser.handleArrowKey(ArrowKey.UP));
		assertFalse(browser.handleArrowKey(ArrowKey.UP));
		assertEquals(2, browser.getIndex());
		assertEquals("c", browser.getImage().getSopInstanceUID());
		assertTrue(browser.handleArrowKey(ArrowKey.DOWN));
		assertEquals(1, browser.getIndex());
	}
	
	@Test
	public void test_indexClamped() throws IOException {
		browser.setImages(images);
		browser.setIndex(10);
		assertEquals(2, browser.getIndex());
		browser.setIndex(-4);
		assertEquals(0, browser.getIndex());
	}
	
	@Test
	public void test_probe() throws IOException {
		browser.setImages(images);
		browser.pointerMoved(1, 0);
		assertEquals("x = 1, y = 0, signal = 2", status.lastMessage());
		browser.setIndex(2);
		assertEquals("x = 1, y = 0, signal = 10", status.lastMessage());
		browser.pointerMoved(1, 1);
		assertEquals("x = 1, y = 1, signal = 12.5", status.lastMessage());
		browser.pointerMoved(2, 1);
		assertEquals("", status.lastMessage());
	}
	
	@Test
	public void test_empty() throws IOException {
		browser.setImages(Collections.emptyList());
		assertNull(browser.getImage());
		assertEquals(1, renderer.clearCount);
		assertFalse(browser.setIndex(1));
		browser.pointerMoved(0, 0);
		assertEquals("", status.lastMessage());
	}

}
