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
 * Names of the DICOM attributes DbView reads from image headers.
 */
public final class DicomAttributes {
	
	private DicomAttributes() {
		throw new AssertionError();
	}
	
	public static final String SLICE_LOCATION = "SliceLocation";
	
	public static final String ACQUISITION_TIME = "AcquisitionTime";
	
	public static final String SOP_INSTANCE_UID = "SOPInstanceUID";
	
	public static final String WINDOW_CENTER = "WindowCenter";
	
	public static final String WINDOW_WIDTH = "WindowWidth";
	
	public static final String SERIES_DESCRIPTION = "SeriesDescription";
	
	/**
	 * Default sort keys for a 4D display: the view axis, then the plot axis.
	 */
	public static final List<String> DEFAULT_4D_SORT_KEYS = List.of(SLICE_LOCATION, ACQUISITION_TIME);

}
