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

import java.util.List;

/**
 * A node in the hierarchy of a DICOM database.
 * 
 * @author DbView developers
 */
public interface DicomRecord {
	
	/**
	 * Get the level of this record in the hierarchy.
	 * @return
	 */
	DicomLevel getLevel();
	
	/**
	 * Get a short label to display for this record, such as a patient name or series description.
	 * @return
	 */
	String getLabel();
	
	/**
	 * Get the records one level below this one, in their stored order.
	 * @return an unmodifiable list; empty for images
	 */
	List<? extends DicomRecord> getChildren();

}
