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

package dbview.lib.dicom;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;

import org.junit.jupiter.api.Test;

@SuppressWarnings("javadoc")
public class TestLoadedPixels {
	
	@Test
	public void test_closeReleasesPixels() throws IOException {
		var pixels = new PixelData(2, 1, new double[] {1, 2});
		var image = new MockImage("1.2.3", 0, 1, null, pixels);
		try (var loaded = image.load()) {
			assertTrue(image.isLoaded());
			assertSame(pixels, loaded.getPixels());
			assertSame(image, loaded.getImage());
		}
		assertFalse(image.isLoaded());
		assertEquals(1, image.getReadCount());
		assertEquals(1, image.getClearCount());
	}
	
	@Test
	public void test_closeIsIdempotent() throws IOException {
		var image = new MockImage("1.2.3", 0, 1);
		var loaded = LoadedPixels.acquire(image);
		loaded.close();
		loaded.close();
		assertEquals(1, image.getClearCount());
	}
	
	@Test
	public void test_releasedOnEarlyExit() throws IOException {
		var image = new MockImage("1.2.3", 0, 1);
		assertThrows(IllegalStateException.class, () -> {
			try (var loaded = image.load()) {
				throw new IllegalStateException("Failure while using " + loaded.getPixels());
			}
		});
		assertFalse(image.isLoaded());
		assertEquals(1, image.getClearCount());
	}
	
	@Test
	public void test_failedReadIsCleared() {
		var image = new MockImage("1.2.3", 0, 1);
		image.setFailOnRead(true);
		assertThrows(IOException.class, () -> image.load());
		assertEquals(1, image.getReadCount());
		assertEquals(1, image.getClearCount());
	}

}
