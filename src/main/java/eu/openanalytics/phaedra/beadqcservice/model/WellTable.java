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
package eu.openanalytics.phaedra.beadqcservice.model;

import java.util.List;

import lombok.Getter;

/**
 * A well-indexed table carved out of an export file, e.g. the bead counts or the median MFI.
 * Rows are mutated in place as the table moves through the pipeline.
 */
@Getter
public class WellTable {

	public static final String LOCATION = "Location";
	public static final String SAMPLE = "Sample";
	public static final String TOTAL_EVENTS = "Total Events";

	private final String name;
	private final List<String> columnNames;
	private final List<String> analytes;
	private final List<WellRow> rows;

	public WellTable(String name, List<String> columnNames, List<String> analytes, List<WellRow> rows) {
		this.name = name;
		this.columnNames = List.copyOf(columnNames);
		this.analytes = List.copyOf(analytes);
		this.rows = List.copyOf(rows);
	}

	public boolean hasAnalyte(String analyte) {
		return analytes.contains(analyte);
	}

	public List<String> getLocations() {
		return rows.stream().map(WellRow::getLocation).toList();
	}

	public int size() {
		return rows.size();
	}
}
