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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import eu.openanalytics.phaedra.beadqcservice.exception.ConfigException;
import eu.openanalytics.phaedra.beadqcservice.execution.progress.QcStage;
import eu.openanalytics.phaedra.beadqcservice.model.CellValue;
import eu.openanalytics.phaedra.beadqcservice.model.WellRow;
import eu.openanalytics.phaedra.beadqcservice.model.WellTable;

@Service
public class BackgroundSubtractor {

	private final Logger logger = LoggerFactory.getLogger(getClass());

	/**
	 * Subtract the background analyte of each well from every other analyte of that well.
	 * The background column is left as is; missing and bead-masked cells keep their state.
	 */
	public void subtract(WellTable medianMfi, String backgroundAnalyte, String plateId) {
		if (!medianMfi.hasAnalyte(backgroundAnalyte)) {
			throw new ConfigException(QcStage.BackgroundSubtraction, "Background analyte '%s' is not a column of %s (analytes: %s)",
					backgroundAnalyte, plateId, medianMfi.getAnalytes());
		}

		for (WellRow row : medianMfi.getRows()) {
			CellValue background = row.getValue(backgroundAnalyte);
			if (background.isMissing()) {
				warn(logger, plateId, "Well %s (%s) has no background value for %s; its other analytes become missing",
						row.getLocation(), row.getSample(), backgroundAnalyte);
			}
			for (String analyte : medianMfi.getAnalytes()) {
				if (analyte.equals(backgroundAnalyte)) continue;
				row.setValue(analyte, row.getValue(analyte).minus(background));
			}
		}
		log(logger, plateId, "Subtracted background analyte %s from %d analytes", backgroundAnalyte, medianMfi.getAnalytes().size() - 1);
	}
}
