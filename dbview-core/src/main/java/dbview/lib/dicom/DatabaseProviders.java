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

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.ServiceLoader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dbview.lib.interfaces.DialogPrompt;
import dbview.lib.interfaces.StatusMonitor;

/**
 * Entry point for opening databases through the installed {@link DatabaseProvider DatabaseProviders}.
 * 
 * @author DbView developers
 */
public class DatabaseProviders {
	
	private static final Logger logger = LoggerFactory.getLogger(DatabaseProviders.class);
	
	private static ServiceLoader<DatabaseProvider> serviceLoader = ServiceLoader.load(DatabaseProvider.class);
	
	/**
	 * Replace the default service loader with another.
	 * <p>
	 * This can be handy if the ServiceLoader should be using an alternative ClassLoader,
	 * e.g. to discover providers in plugin directories.
	 * 
	 * @param newLoader
	 */
	public static void setServiceLoader(final ServiceLoader<DatabaseProvider> newLoader) {
		Objects.requireNonNull(newLoader);
		serviceLoader = newLoader;
	}
	
	/**
	 * Request all available {@link DatabaseProvider DatabaseProviders}.
	 * @return
	 */
	public static List<DatabaseProvider> getInstalledProviders() {
		List<DatabaseProvider> providers = new ArrayList<>();
		synchronized (serviceLoader) {
			serviceLoader.reload();
			for (DatabaseProvider p : serviceLoader) {
				providers.add(p);
			}
		}
		return providers;
	}
	
	/**
	 * Open a database with the first installed provider that supports the path.
	 * 
	 * @param path the database folder
	 * @param status receiver for progress feedback
	 * @param dialog prompts the database may use
	 * @return the open database
	 * @throws IOException if no provider supports the path, or the provider fails to open it
	 */
	public static DicomDatabase open(Path path, StatusMonitor status, DialogPrompt dialog) throws IOException {
		Objects.requireNonNull(path);
		for (var provider : getInstalledProviders()) {
			if (provider.supports(path)) {
				logger.debug("Opening {} with {}", path, provider.getName());
				return provider.open(path, status, dialog);
			}
			logger.trace("{} does not support {}", provider.getName(), path);
		}
		throw new IOException("No database provider is installed that can open " + path);
	}

}
