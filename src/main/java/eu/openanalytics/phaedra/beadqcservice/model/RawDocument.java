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

import lombok.Value;

/**
 * The text lines of one exported file, in file order.
 */
@Value
public class RawDocument {

	String name;
	List<String> lines;

	public static RawDocument of(String name, List<String> lines) {
		return new RawDocument(name, List.copyOf(lines));
	}

	public int size() {
		return lines.size();
	}

	public String getLine(int index) {
		return lines.get(index);
	}

	public List<String> getLines(LineRange range) {
		return lines.subList(range.getStart(), range.getEnd());
	}
}
