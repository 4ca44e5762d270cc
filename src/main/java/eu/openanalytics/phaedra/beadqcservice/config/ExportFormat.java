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

import java.nio.charset.Charset;
import java.util.List;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;

import eu.openanalytics.phaedra.beadqcservice.enumeration.TerminationMode;
import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Describes the layout of an instrument export: the section markers to look for, and how a
 * data block ends.
 */
@Value
@With
@Builder(toBuilder = true)
public class ExportFormat {

	char delimiter;
	Charset charset;

	String mfiMarker;
	Pattern countMarker;
	String countMarkerExclusion;
	List<String> terminators;

	TerminationMode termination;
	Integer wellCount;

	public boolean isCountMarker(String line) {
		return countMarker.matcher(line).find()
				&& !(StringUtils.isNotEmpty(countMarkerExclusion) && line.contains(countMarkerExclusion));
	}

	public boolean isTerminator(String line) {
		return terminators.stream().anyMatch(line::contains);
	}

	public boolean hasWellCount() {
		return wellCount != null && wellCount > 0;
	}
}
