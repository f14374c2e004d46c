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
 * Modal prompts that commands and database providers may use to ask the user something.
 * 
 * @author DbView developers
 */
public interface DialogPrompt {
	
	/**
	 * Prompt the user to choose a directory.
	 * @param prompt the text to show with the chooser
	 * @return the absolute path of the chosen directory, or an empty string if the user cancelled
	 */
	String directory(String prompt);
	
	/**
	 * Show an information message, blocking until the user dismisses it.
	 * @param message
	 */
	void information(String message);
	
	/**
	 * Ask a yes/no question.
	 * @param title
	 * @param message
	 * @return true if the user answered yes
	 */
	boolean question(String title, String message);

}
