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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import lombok.Getter;

/**
 * One well of a plate table: identity columns plus one cell per analyte, in column order.
 */
@Getter
public class WellRow {

	private final String location;
	private final String sample;
	private final Map<String, CellValue> values;

	public WellRow(String location, String sample, Map<String, CellValue> values) {
		this.location = location;
		this.sample = sample;
		this.values = new LinkedHashMap<>(values);
	}

	public Map<String, CellValue> getValues() {
		return Collections.unmodifiableMap(values);
	}

	public CellValue getValue(String analyte) {
		CellValue value = values.get(analyte);
		if (value == null) throw new IllegalArgumentException("No such analyte column: " + analyte);
		return value;
	}

	public void setValue(String analyte, CellValue value) {
		if (!values.containsKey(analyte)) throw new IllegalArgumentException("No such analyte column: " + analyte);
		values.put(analyte, value);
	}

	public void setAll(CellValue value) {
		values.replaceAll((analyte, old) -> value);
	}
}
