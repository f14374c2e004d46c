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
import java.util.List;

import dbview.lib.interfaces.StatusMonitor;

/**
 * An ordered collection of images sharing a modality and acquisition context.
 * 
 * @author DbView developers
 */
public interface ImageSeries extends DicomRecord {
	
	/**
	 * Get the SeriesDescription attribute.
	 * @return
	 */
	String getSeriesDescription();
	
	/**
	 * Get the images of the series, in their stored order.
	 * @return
	 */
	List<DicomImage> getImages();
	
	/**
	 * Materialize the series as a 4D array, sorting the images by two attributes.
	 * The first sort key defines the z (view) axis, the second the t (plot) axis.
	 * 
	 * @param sortBy exactly two attribute names, e.g. {@code [SliceLocation, AcquisitionTime]}
	 * @param status receiver for progress while images are read
	 * @return the array, with one header per (z, t) frame
	 * @throws IOException if the pixel data cannot be read
	 */
	SeriesArray array(List<String> sortBy, StatusMonitor status) throws IOException;
	
	/**
	 * Export the series as DICOM files to a directory.
	 * @param directory
	 * @throws IOException
	 */
	void exportAsDicom(Path directory) throws IOException;
	
	/**
	 * Export the pixel values of the series as CSV files to a directory.
	 * @param directory
	 * @throws IOException
	 */
	void exportAsCsv(Path directory) throws IOException;
	
	/**
	 * Export the series as PNG images to a directory.
	 * @param directory
	 * @throws IOException
	 */
	void exportAsPng(Path directory) throws IOException;
	
	/**
	 * Export the series as a NIfTI volume to a directory.
	 * @param directory
	 * @throws IOException
	 */
	void exportAsNifti(Path directory) throws IOException;
	
	@Override
	default DicomLevel getLevel() {
		return DicomLevel.SERIES;
	}
	
	@Override
	default String getLabel() {
		return getSeriesDescription();
	}
	
	@Override
	default List<? extends DicomRecord> getChildren() {
		return getImages();
	}

}
