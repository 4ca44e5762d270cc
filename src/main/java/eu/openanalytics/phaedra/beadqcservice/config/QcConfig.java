/**
 * Phaedra II
 *
 * Copyright (C) 2016-2025 Open Analytics
 *
 * ===========================================================================
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the Apache License as published by
 * The Apache Software Foundation, either version 2 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * Apache License for more details.
 *
 * You should have received a copy of the Apache License
 * along with this program.  If not, see <http://www.apache.org/licenses/>
 */
package eu.openanalytics.phaedra.beadqcservice.config;

import java.nio.file.Path;
import java.util.List;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Run parameters of a QC run. Loaded once by {@link QcConfigLoader} and passed down the pipeline.
 */
@Value
@With
@Builder(toBuilder = true)
public class QcConfig {

	Path inputPath;
	Path outputDir;

	int beadCountThreshold;
	double rSquaredThreshold;
	String backgroundAnalyte;
	List<String> standardAnalytes;

	/** Null means: strict for a single file, lenient for a folder. */
	Boolean strict;

	String fileExtension;
	int parallelism;
	String projectNameDelimiter;

	ExportFormat exportFormat;

	public boolean isStrict(boolean folderMode) {
		return strict != null ? strict : !folderMode;
	}
}
