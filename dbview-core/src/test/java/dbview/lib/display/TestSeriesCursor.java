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
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import dbview.lib.display.SeriesCursor.ArrowKey;
import dbview.lib.display.SeriesCursor.Axis;
import dbview.lib.display.SeriesCursor.Direction;

@SuppressWarnings("javadoc")
public class TestSeriesCursor {
	
	@Test
	public void test_clampAtBounds() {
		var cursor = new SeriesCursor(3, 2);
		assertFalse(cursor.move(Axis.Z, Direction.DOWN));
		assertEquals(0, cursor.getZ());
		
		assertTrue(cursor.move(Axis.Z, Direction.UP));
		assertTrue(cursor.move(Axis.Z, Direction.UP));
		assertEquals(2, cursor.getZ());
		assertFalse(cursor.move(Axis.Z, Direction.UP));
		assertEquals(2, cursor.getZ());
		
		assertTrue(cursor.move(Axis.T, Direction.UP));
		assertFalse(cursor.move(Axis.T, Direction.UP));
		assertEquals(1, cursor.getT());
	}
	
	@Test
	public void test_setClamps() {
		var cursor = new SeriesCursor(4, 5);
		cursor.setZ(10);
		cursor.setT(-3);
		assertEquals(3, cursor.getZ());
		assertEquals(0, cursor.getT());
		cursor.setPosition(-1, 99);
		assertEquals(0, cursor.getZ());
		assertEquals(4, cursor.getT());
	}
	
	@Test
	public void test_arrowKeys() {
		var cursor = new SeriesCursor(3, 3);
		cursor.setPosition(1, 1);
		cursor.handleArrowKey(ArrowKey.LEFT);
		assertEquals(0, cursor.getT());
		assertEquals(1, cursor.getZ());
		cursor.handleArrowKey(ArrowKey.RIGHT);
		cursor.handleArrowKey(ArrowKey.RIGHT);
		assertEquals(2, cursor.getT());
		cursor.handleArrowKey(ArrowKey.UP);
		assertEquals(2, cursor.getZ());
		cursor.handleArrowKey(ArrowKey.DOWN);
		cursor.handleArrowKey(ArrowKey.DOWN);
		assertEquals(0, cursor.getZ());
		assertEquals(2, cursor.getT());
	}
	
	@Test
	public void test_listenersInOrder() {
		var cursor = new SeriesCursor(3, 3);
		List<String> calls = new ArrayList<>();
		cursor.addListener((c, z, t) -> calls.add("first " + z + "," + t + "->" + c.getZ() + "," + c.getT()));
		cursor.addListener((c, z, t) -> calls.add("second"));
		cursor.addListener((c, z, t) -> calls.add("third"));
		
		cursor.move(Axis.Z, Direction.UP);
		assertEquals(List.of("first 0,0->1,0", "second", "third"), calls);
	}
	
	@Test
	public void test_noNotificationWithoutChange() {
		var cursor = new SeriesCursor(2, 2);
		List<String> calls = new ArrayList<>();
		cursor.addListener((c, z, t) -> calls.add(z + "," + t));
		cursor.move(Axis.Z, Direction.DOWN);
		cursor.setT(0);
		cursor.setPosition(0, 0);
		assertTrue(calls.isEmpty());
		cursor.setPosition(1, 1);
		assertEquals(1, calls.size());
	}
	
	@Test
	public void test_removeListener() {
		var cursor = new SeriesCursor(2, 2);
		List<String> calls = new ArrayList<>();
		SeriesCursorListener listener = (c, z, t) -> calls.add("called");
		cursor.addListener(listener);
		cursor.setZ(1);
		cursor.removeListener(listener);
		cursor.setZ(0);
		assertEquals(1, calls.size());
	}
	
	@Test
	public void test_setBoundsClampsPosition() {
		var cursor = new SeriesCursor(5, 5);
		cursor.setPosition(4, 3);
		List<String> calls = new ArrayList<>();
		cursor.addListener((c, z, t) -> calls.add(z + "," + t));
		cursor.setBounds(2, 10);
		assertEquals(1, cursor.getZ());
		assertEquals(3, cursor.getT());
		assertEquals(List.of("4,3"), calls);
	}
	
	@Test
	public void test_invalidBounds() {
		assertThrows(IllegalArgumentException.class, () -> new SeriesCursor(0, 1));
		assertThrows(IllegalArgumentException.class, () -> new SeriesCursor(2, 2).setBounds(2, 0));
	}

}
