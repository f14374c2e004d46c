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

enum SilentStatusMonitor implements StatusMonitor {
	
	INSTANCE;

	@Override
	public void message(String message) {}

	@Override
	public void progress(int value, int total, String message) {}

	@Override
	public void hide() {}

	@Override
	public void cursorToHourglass() {}

	@Override
	public void cursorToNormal() {}

}
