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

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Result of one file in a folder run: either a plate outcome or the reason the file was skipped.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PlateRunResult {

	String fileName;
	PlateOutcome outcome;
	PlateError error;

	public static PlateRunResult completed(String fileName, PlateOutcome outcome) {
		return new PlateRunResult(fileName, outcome, null);
	}

	public static PlateRunResult skipped(String fileName, PlateError error) {
		return new PlateRunResult(fileName, null, error);
	}

	public boolean isSkipped() {
		return error != null;
	}
}
