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



package dbview.lib.gui;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dbview.fx.dialogs.Dialogs;

class DbViewUncaughtExceptionHandler implements UncaughtExceptionHandler {
	
	private static final Logger logger = LoggerFactory.getLogger(DbViewUncaughtExceptionHandler.class);
	
	private final DbViewGUI gui;
	
	private long lastExceptionTimestamp = 0L;
	private String lastExceptionMessage = null;
	
	private long sameExceptionCount = 0;
	private long minDelay = 1000;
	
	DbViewUncaughtExceptionHandler(DbViewGUI gui) {
		this.gui = gui;
	}
	
	@Override
	public void uncaughtException(Thread t, Throwable e) {
		// Avoid showing the same message repeatedly
		String msg = e.getLocalizedMessage();
		long timestamp = System.currentTimeMillis();
		try {
			if (timestamp - lastExceptionTimestamp < minDelay && 
					Objects.equals(msg, lastExceptionMessage)) {
				sameExceptionCount++;
				if (sameExceptionCount > 3)
					logger.error("{} (see full stack trace above, or use 'debug' log level)", e.getLocalizedMessage());
				else
					logger.debug(e.getLocalizedMessage(), e);
				return;
			} else
				sameExceptionCount = 0;

			// A failed command may leave the wait cursor or a stale progress bar behind
			var status = gui.status();
			status.cursorToNormal();
			status.hide();
			if (e instanceof OutOfMemoryError) {
				gui.closeAllDisplays();
				Dialogs.showErrorNotification("Out of memory error",
						"Out of memory! All displays have been closed; you may need to restart DbView with more memory.");
				logger.error(e.getMessage(), e);
			} else {
				Dialogs.showErrorNotification("DbView exception", e);
			}
		} finally {
			lastExceptionMessage = msg;
			lastExceptionTimestamp = timestamp;				
		}
	}
	
}
