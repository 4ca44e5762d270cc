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
package eu.openanalytics.phaedra.beadqcservice.service.qc;

import static eu.openanalytics.phaedra.beadqcservice.service.PlateLogger.log;
import static eu.openanalytics.phaedra.beadqcservice.service.PlateLogger.warn;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import eu.openanalytics.phaedra.beadqcservice.model.CellValue;
import eu.openanalytics.phaedra.beadqcservice.model.LowBeadRecord;
import eu.openanalytics.phaedra.beadqcservice.model.WellRow;
import eu.openanalytics.phaedra.beadqcservice.model.WellTable;

/**
 * Flags (well, analyte) cells whose bead count is too low for the MFI to be trusted, and masks
 * the affected wells in the MFI table.
 */
@Service
public class BeadCountQcService {

	private final Logger logger = LoggerFactory.getLogger(getClass());

	/**
	 * Replace every bead count strictly below the threshold with the failed-bead sentinel.
	 *
	 * @return one record per failing (well, analyte) pair, in table order
	 */
	public List<LowBeadRecord> flagLowBeadCounts(WellTable beadCounts, int threshold, String plateId) {
		List<LowBeadRecord> records = new ArrayList<>();
		for (WellRow row : beadCounts.getRows()) {
			for (String analyte : beadCounts.getAnalytes()) {
				CellValue count = row.getValue(analyte);
				if (count.isNumeric() && count.getNumericValue() < threshold) {
					row.setValue(analyte, CellValue.FAILED_BEAD);
					records.add(new LowBeadRecord(row.getLocation(), row.getSample(), analyte, plateId));
				}
			}
		}
		log(logger, plateId, "Bead count QC (threshold %d): %d failing well/analyte pairs", threshold, records.size());
		return records;
	}

	/**
	 * Mark every analyte of each well that has at least one low bead count as bead-masked.
	 * Masking is per well, not per analyte.
	 */
	public void maskMedianMfi(WellTable medianMfi, List<LowBeadRecord> lowBeadRecords, String plateId) {
		Map<String, List<String>> failingAnalytes = lowBeadRecords.stream()
				.collect(Collectors.groupingBy(LowBeadRecord::getLocation, LinkedHashMap::new,
						Collectors.mapping(LowBeadRecord::getAntigen, Collectors.toList())));

		for (WellRow row : medianMfi.getRows()) {
			List<String> analytes = failingAnalytes.get(row.getLocation());
			if (analytes == null) continue;
			row.setAll(CellValue.BEAD_MASKED);
			warn(logger, plateId, "Masked all %d analytes of well %s (%s): low bead count for %s",
					medianMfi.getAnalytes().size(), row.getLocation(), row.getSample(), analytes);
		}
	}
}
