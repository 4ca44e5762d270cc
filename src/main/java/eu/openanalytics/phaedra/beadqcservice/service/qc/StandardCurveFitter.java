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
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import eu.openanalytics.phaedra.beadqcservice.model.AnalyteFit;
import eu.openanalytics.phaedra.beadqcservice.model.CellValue;
import eu.openanalytics.phaedra.beadqcservice.model.StandardCurvePoint;
import eu.openanalytics.phaedra.beadqcservice.model.WellRow;
import eu.openanalytics.phaedra.beadqcservice.model.WellTable;

/**
 * Fits a log-linear standard curve per analyte over the serially diluted "Standard" wells.
 *
 * The dilution factor of a standard well is minus the first integer in its sample label, so
 * "Standard3" is more dilute than "Standard1". The response is log10(MFI + 1).
 */
@Service
public class StandardCurveFitter {

	public static final String STANDARD_LABEL = "Standard";

	private static final Pattern DILUTION_INDEX_PATTERN = Pattern.compile("\\d+");

	private final Logger logger = LoggerFactory.getLogger(getClass());

	public CurveFitResult fit(WellTable medianMfi, List<String> analytes, String plateId) {
		Map<WellRow, Integer> standards = new LinkedHashMap<>();
		for (WellRow row : medianMfi.getRows()) {
			if (row.getSample() == null || !row.getSample().contains(STANDARD_LABEL)) continue;
			OptionalInt dilutionFactor = parseDilutionFactor(row.getSample());
			if (dilutionFactor.isEmpty()) {
				warn(logger, plateId, "Standard well %s (%s) has no dilution index and is left out of the standard curves",
						row.getLocation(), row.getSample());
				continue;
			}
			standards.put(row, dilutionFactor.getAsInt());
		}
		log(logger, plateId, "Found %d standard wells", standards.size());

		Map<String, AnalyteFit> fits = new LinkedHashMap<>();
		List<StandardCurvePoint> allPoints = new ArrayList<>();
		for (String analyte : analytes) {
			if (!medianMfi.hasAnalyte(analyte)) {
				warn(logger, plateId, "Standard analyte %s is not measured on this plate, skipping it", analyte);
				continue;
			}

			List<StandardCurvePoint> points = collectPoints(standards, analyte);
			if (points.isEmpty()) {
				warn(logger, plateId, "No valid standard points for analyte %s, no curve fitted", analyte);
				continue;
			}

			AnalyteFit fit = fitCurve(analyte, points);
			AnalyteFit replaced = fits.remove(analyte);
			if (replaced != null) {
				warn(logger, plateId, "Analyte %s was fitted more than once, keeping the last fit (R2 %s, was %s)",
						analyte, fit.getRSquared(), replaced.getRSquared());
				allPoints.removeIf(p -> p.getAnalyte().equals(analyte));
			}
			fits.put(analyte, fit);
			allPoints.addAll(points);
			log(logger, plateId, "Standard curve %s: slope %s, intercept %s, R2 %s over %d points",
					analyte, fit.getSlope(), fit.getIntercept(), fit.getRSquared(), fit.getPointCount());
		}

		return new CurveFitResult(new ArrayList<>(fits.values()), allPoints);
	}

	/**
	 * @return minus the first run of digits in the label, or empty if the label has no digits
	 */
	public static OptionalInt parseDilutionFactor(String sampleLabel) {
		Matcher matcher = DILUTION_INDEX_PATTERN.matcher(sampleLabel);
		if (!matcher.find()) return OptionalInt.empty();
		try {
			return OptionalInt.of(-Integer.parseInt(matcher.group()));
		} catch (NumberFormatException e) {
			return OptionalInt.empty();
		}
	}

	private List<StandardCurvePoint> collectPoints(Map<WellRow, Integer> standards, String analyte) {
		List<StandardCurvePoint> points = new ArrayList<>();
		standards.forEach((row, dilutionFactor) -> {
			CellValue mfi = row.getValue(analyte);
			if (!mfi.isNumeric()) return;
			double log10Mfi = Math.log10(mfi.getNumericValue() + 1);
			if (!Double.isFinite(log10Mfi)) return;
			points.add(new StandardCurvePoint(analyte, row.getSample(), dilutionFactor, log10Mfi));
		});
		return points;
	}

	private AnalyteFit fitCurve(String analyte, List<StandardCurvePoint> points) {
		SimpleRegression regression = new SimpleRegression(true);
		for (StandardCurvePoint point : points) {
			regression.addData(point.getDilutionFactor(), point.getLog10Mfi());
		}
		return AnalyteFit.builder()
				.analyte(analyte)
				.slope(regression.getSlope())
				.intercept(regression.getIntercept())
				.rSquared(regression.getRSquare())
				.pointCount(points.size())
				.passed(false)
				.build();
	}
}
