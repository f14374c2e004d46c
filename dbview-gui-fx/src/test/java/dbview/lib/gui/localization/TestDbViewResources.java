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


package dbview.lib.gui.localization;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.MissingResourceException;

import org.junit.jupiter.api.Test;

@SuppressWarnings("javadoc")
public class TestDbViewResources {
	
	@Test
	public void test_strings() {
		assertTrue(DbViewResources.hasString("Menu.File"));
		assertEquals("File", DbViewResources.getString("Menu.File"));
		assertEquals("Open subfolders", DbViewResources.getStringOrKey("Action.File.openSubfolders"));
	}
	
	@Test
	public void test_missingKey() {
		assertFalse(DbViewResources.hasString("Menu.Help"));
		assertEquals("Menu.Help", DbViewResources.getStringOrKey("Menu.Help"));
		assertThrows(MissingResourceException.class, () -> DbViewResources.getString("Menu.Help"));
	}
	
	@Test
	public void test_formattedMessage() {
		var message = String.format(DbViewResources.getString("Display4D.invalidAxes"), "SliceLocation", "AcquisitionTime");
		assertTrue(message.endsWith("both SliceLocation and AcquisitionTime"));
	}

}
