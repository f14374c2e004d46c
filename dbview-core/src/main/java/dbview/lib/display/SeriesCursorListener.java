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

import java.util.EventListener;

/**
 * Interface for objects that need to know when the frame selected by a {@link SeriesCursor} changes.
 * 
 * @author DbView developers
 */
public interface SeriesCursorListener extends EventListener {
	
	/**
	 * Called after the selected frame has changed.
	 * At least one of the coordinates differs from its previous value.
	 * 
	 * @param cursor the cursor that changed
	 * @param zOld previous position along the view axis
	 * @param tOld previous position along the plot axis
	 */
	void cursorChanged(SeriesCursor cursor, int zOld, int tOld);

}
