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
package eu.openanalytics.phaedra.beadqcservice.service.extraction;

import static eu.openanalytics.phaedra.beadqcservice.service.PlateLogger.log;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import eu.openanalytics.phaedra.beadqcservice.exception.AlignmentException;
import eu.openanalytics.phaedra.beadqcservice.model.WellRow;
import eu.openanalytics.phaedra.beadqcservice.model.WellTable;

/**
 * Checks that the bead count table and the median MFI table describe the same wells, in the same
 * order, with the same analyte columns.
 */
@Service
public class AlignmentValidator {

	public static final String CHECK_LOCATIONS_PRESENT = "locations present";
	public static final String CHECK_SAMPLES_PRESENT = "samples present";
	public static final String CHECK_COLUMNS_IDENTICAL = "identical columns";
	public static final String CHECK_LOCATION_ORDER = "identical location order";
	public static final String CHECK_LOCATIONS_UNIQUE = "unique locations";

	private final Logger logger = LoggerFactory.getLogger(getClass());

	public void validate(WellTable beadCounts, WellTable medianMfi, String plateId) {
		for (WellTable table : new WellTable[] { beadCounts, medianMfi }) {
			long missing = table.getRows().stream().map(WellRow::getLocation).filter(Objects::isNull).count();
			if (missing > 0) {
				throw new AlignmentException(CHECK_LOCATIONS_PRESENT, "%s table has %d rows without a Location", table.getName(), missing);
			}
		}

		for (WellTable table : new WellTable[] { beadCounts, medianMfi }) {
			for (WellRow row : table.getRows()) {
				if (row.getSample() == null) {
					throw new AlignmentException(CHECK_SAMPLES_PRESENT, "%s table has no Sample for well %s", table.getName(), row.getLocation());
				}
			}
		}

		if (!beadCounts.getColumnNames().equals(medianMfi.getColumnNames())) {
			throw new AlignmentException(CHECK_COLUMNS_IDENTICAL, "%s columns %s differ from %s columns %s",
					beadCounts.getName(), beadCounts.getColumnNames(), medianMfi.getName(), medianMfi.getColumnNames());
		}

		if (!beadCounts.getLocations().equals(medianMfi.getLocations())) {
			throw new AlignmentException(CHECK_LOCATION_ORDER, "%s wells %s differ from %s wells %s",
					beadCounts.getName(), beadCounts.getLocations(), medianMfi.getName(), medianMfi.getLocations());
		}

		Set<String> seen = new HashSet<>();
		for (String location : medianMfi.getLocations()) {
			if (!seen.add(location)) {
				throw new AlignmentException(CHECK_LOCATIONS_UNIQUE, "well %s occurs more than once", location);
			}
		}

		log(logger, plateId, "Bead count and median MFI tables are aligned: %d wells, %d analytes",
				medianMfi.size(), medianMfi.getAnalytes().size());
	}
}
