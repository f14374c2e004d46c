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

package dbview.lib.interfaces;

/**
 * Receiver for status and progress feedback while the application works.
 * <p>
 * All methods are expected to be called from the thread that owns the user interface, 
 * after each unit of work; implementations should update their display immediately.
 * 
 * @author DbView developers
 */
public interface StatusMonitor {
	
	/**
	 * Show a status message, replacing any previous message.
	 * An empty string clears the message.
	 * @param message
	 */
	void message(String message);
	
	/**
	 * Report progress through a task.
	 * @param value number of units completed
	 * @param total total number of units
	 * @param message message describing the task
	 */
	void progress(int value, int total, String message);
	
	/**
	 * Hide any progress indicator and clear the status message.
	 */
	void hide();
	
	/**
	 * Indicate that a long-running operation is in progress, typically by showing a wait cursor.
	 */
	void cursorToHourglass();
	
	/**
	 * Restore the normal cursor after {@link #cursorToHourglass()}.
	 */
	void cursorToNormal();
	
	/**
	 * Get a monitor that ignores all feedback.
	 * @return
	 */
	static StatusMonitor silent() {
		return SilentStatusMonitor.INSTANCE;
	}
	
}
