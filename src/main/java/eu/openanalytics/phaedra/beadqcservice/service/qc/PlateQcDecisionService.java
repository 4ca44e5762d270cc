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

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import eu.openanalytics.phaedra.beadqcservice.model.AnalyteFit;
import eu.openanalytics.phaedra.beadqcservice.model.CellValue;
import eu.openanalytics.phaedra.beadqcservice.model.CleanedTable;
import eu.openanalytics.phaedra.beadqcservice.model.PlateQcResult;
import eu.openanalytics.phaedra.beadqcservice.model.WellRow;
import eu.openanalytics.phaedra.beadqcservice.model.WellTable;
import lombok.Value;

/**
 * Decides plate pass/fail from the standard curve fits and writes the QC sentinels into the MFI table.
 *
 * A plate passes when at least one analyte's curve has R2 strictly above the threshold. On a
 * passing plate the bead-masked cells become "Failed QC (bead)" and other missing cells stay empty. On a failing plate every cell becomes
 * "Failed QC (standards)", regardless of bead QC.
 */
@Service
public class PlateQcDecisionService {

	private final Logger logger = LoggerFactory.getLogger(getClass());

	public PlateDecision decide(List<AnalyteFit> fits, double rSquaredThreshold, WellTable medianMfi, String plateId) {
		List<AnalyteFit> markedFits = fits.stream()
				.map(fit -> fit.withPassed(fit.getRSquared() > rSquaredThreshold))
				.toList();
		List<String> passingAnalytes = markedFits.stream()
				.filter(AnalyteFit::isPassed)
				.map(AnalyteFit::getAnalyte)
				.toList();
		boolean platePassed = !passingAnalytes.isEmpty();

		if (platePassed) {
			int failedBead = 0;
			for (WellRow row : medianMfi.getRows()) {
				for (String analyte : medianMfi.getAnalytes()) {
					CellValue value = row.getValue(analyte);
					if (value.isBeadMasked()) {
						row.setValue(analyte, CellValue.FAILED_BEAD);
						failedBead++;
					} else if (value.isMissing()) {
						warn(logger, plateId, "Well %s (%s), analyte %s has no value and passed bead QC; written empty",
								row.getLocation(), row.getSample(), analyte);
					}
				}
			}
			log(logger, plateId, "Plate passed standards QC (R2 > %s) for %s; %d cells marked as failed bead QC",
					rSquaredThreshold, passingAnalytes, failedBead);
		} else {
			for (WellRow row : medianMfi.getRows()) {
				row.setAll(CellValue.FAILED_STANDARDS);
			}
			warn(logger, plateId, "Plate failed standards QC: no analyte curve has R2 > %s; all %d wells marked as failed standards QC",
					rSquaredThreshold, medianMfi.size());
		}

		PlateQcResult result = new PlateQcResult(plateId, platePassed, passingAnalytes);
		return new PlateDecision(result, markedFits, new CleanedTable(plateId, medianMfi, passingAnalytes));
	}

	@Value
	public static class PlateDecision {
		PlateQcResult result;
		List<AnalyteFit> fits;
		CleanedTable cleanedTable;
	}
}
