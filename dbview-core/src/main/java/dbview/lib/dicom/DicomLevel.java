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

/**
 * Levels of the DICOM information hierarchy, from the database itself down to single images.
 */
public enum DicomLevel {
	
	/**
	 * The database (root folder).
	 */
	DATABASE,
	/**
	 * A patient.
	 */
	PATIENT,
	/**
	 * A study of a patient.
	 */
	STUDY,
	/**
	 * A series within a study.
	 */
	SERIES,
	/**
	 * A single image (instance) within a series.
	 */
	INSTANCE;

	@Override
	public String toString() {
		String name = name();
		return name.charAt(0) + name.substring(1).toLowerCase();
	}
	
}
