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
package eu.openanalytics.phaedra.beadqcservice.service.output;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;

import eu.openanalytics.phaedra.beadqcservice.model.AnalyteFit;
import eu.openanalytics.phaedra.beadqcservice.model.CellValue;
import eu.openanalytics.phaedra.beadqcservice.model.CleanedTable;
import eu.openanalytics.phaedra.beadqcservice.model.LowBeadRecord;
import eu.openanalytics.phaedra.beadqcservice.model.PlateError;
import eu.openanalytics.phaedra.beadqcservice.model.PlateOutcome;
import eu.openanalytics.phaedra.beadqcservice.model.PlateQcResult;
import eu.openanalytics.phaedra.beadqcservice.model.ProjectSummary;
import eu.openanalytics.phaedra.beadqcservice.model.StandardCurvePoint;
import eu.openanalytics.phaedra.beadqcservice.model.WellTable;

/**
 * Writes the per-plate and per-project QC tables as comma separated files.
 *
 * Every file starts with a header row, also when it has no data rows.
 */
@Service
public class QcArtifactWriter {

	public static final String LOW_BEAD_SUFFIX = "_beadqc_low_df.csv";
	public static final String CLEAN_SUFFIX = "_clean.csv";
	public static final String FITS_SUFFIX = "_standards_fits.csv";
	public static final String CURVE_SUFFIX = "_standards_curve.csv";
	public static final String PROJECT_STANDARDS_QC_SUFFIX = "_all_plates_standardsqc.csv";
	public static final String PROJECT_BEAD_QC_SUFFIX = "_all_plates_beadqc.csv";
	public static final String PROJECT_SKIPPED_SUFFIX = "_skipped_plates.csv";

	public static final String PLATE = "Plate";
	public static final String STANDARD = "Standard";
	public static final String ANTIGEN = "Antigen";
	public static final String PASSED_QC = "Passed_QC";

	private static final List<String> LOW_BEAD_COLUMNS = List.of(WellTable.LOCATION, WellTable.SAMPLE, ANTIGEN, PLATE);
	private static final List<String> FIT_COLUMNS = List.of("Analyte", "Slope", "Intercept", "R_squared", "Passed");
	private static final List<String> CURVE_COLUMNS = List.of("Analyte", WellTable.SAMPLE, "DilutionFactor", "Log10MFI");
	private static final List<String> STANDARDS_QC_COLUMNS = List.of(PLATE, PASSED_QC);
	private static final List<String> SKIPPED_COLUMNS = List.of(PLATE, "Stage", "Error");

	private final CsvMapper csvMapper;
	private final Logger logger = LoggerFactory.getLogger(getClass());

	public QcArtifactWriter(CsvMapper csvMapper) {
		this.csvMapper = csvMapper;
	}

	public List<Path> writePlateArtifacts(PlateOutcome outcome, Path outputDir) {
		String plateId = outcome.getPlateId();
		List<Path> written = new ArrayList<>();
		written.add(write(outputDir.resolve(plateId + LOW_BEAD_SUFFIX), LOW_BEAD_COLUMNS, outcome.getLowBeadRecords(), this::lowBeadRow));
		written.add(writeCleanedTable(outcome.getCleanedTable(), outputDir.resolve(plateId + CLEAN_SUFFIX)));
		written.add(write(outputDir.resolve(plateId + FITS_SUFFIX), FIT_COLUMNS, outcome.getFits(), this::fitRow));
		written.add(write(outputDir.resolve(plateId + CURVE_SUFFIX), CURVE_COLUMNS, outcome.getCurvePoints(), this::curveRow));
		logger.info("Plate [P={}] Wrote {} QC artifacts to {}", plateId, written.size(), outputDir);
		return written;
	}

	public List<Path> writeProjectArtifacts(ProjectSummary summary, Path outputDir) {
		String project = summary.getProjectName();
		List<Path> written = new ArrayList<>();
		written.add(write(outputDir.resolve(project + PROJECT_STANDARDS_QC_SUFFIX), STANDARDS_QC_COLUMNS, summary.getPlateResults(), this::resultRow));
		written.add(write(outputDir.resolve(project + PROJECT_BEAD_QC_SUFFIX), LOW_BEAD_COLUMNS, summary.getLowBeadRecords(), this::lowBeadRow));
		written.add(write(outputDir.resolve(project + PROJECT_SKIPPED_SUFFIX), SKIPPED_COLUMNS, summary.getSkippedPlates(), this::skippedRow));
		logger.info("Project [{}] Wrote {} summary tables to {}", project, written.size(), outputDir);
		return written;
	}

	private Path writeCleanedTable(CleanedTable cleanedTable, Path file) {
		WellTable table = cleanedTable.getTable();
		List<String> columns = new ArrayList<>(table.getColumnNames());
		columns.add(PLATE);
		columns.add(STANDARD);

		return write(file, columns, table.getRows(), row -> {
			Map<String, String> values = new LinkedHashMap<>();
			for (String column : table.getColumnNames()) {
				if (column.equals(WellTable.LOCATION)) values.put(column, row.getLocation());
				else if (column.equals(WellTable.SAMPLE)) values.put(column, row.getSample());
				else values.put(column, row.getValue(column).format());
			}
			values.put(PLATE, cleanedTable.getPlateId());
			values.put(STANDARD, cleanedTable.getStandardLabel());
			return values;
		});
	}

	private <T> Path write(Path file, List<String> columns, List<T> items, Function<T, Map<String, String>> toRow) {
		CsvSchema.Builder schema = CsvSchema.builder().setLineSeparator("\n");
		columns.forEach(schema::addColumn);

		try {
			Files.createDirectories(file.getParent());
			try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
					SequenceWriter rows = csvMapper.writer(schema.build()).writeValues(out)) {
				Map<String, String> header = new LinkedHashMap<>();
				columns.forEach(c -> header.put(c, c));
				rows.write(header);
				for (T item : items) {
					rows.write(toRow.apply(item));
				}
			}
		} catch (IOException e) {
			throw new UncheckedIOException("Failed to write " + file, e);
		}
		logger.debug("Wrote {} rows to {}", items.size(), file);
		return file;
	}

	private Map<String, String> lowBeadRow(LowBeadRecord record) {
		return row(LOW_BEAD_COLUMNS, record.getLocation(), record.getSample(), record.getAntigen(), record.getPlate());
	}

	private Map<String, String> fitRow(AnalyteFit fit) {
		return row(FIT_COLUMNS, fit.getAnalyte(), formatNumber(fit.getSlope()), formatNumber(fit.getIntercept()),
				formatNumber(fit.getRSquared()), formatBoolean(fit.isPassed()));
	}

	private Map<String, String> curveRow(StandardCurvePoint point) {
		return row(CURVE_COLUMNS, point.getAnalyte(), point.getSample(), String.valueOf(point.getDilutionFactor()),
				formatNumber(point.getLog10Mfi()));
	}

	private Map<String, String> resultRow(PlateQcResult result) {
		return row(STANDARDS_QC_COLUMNS, result.getPlateId(), formatBoolean(result.isPassed()));
	}

	private Map<String, String> skippedRow(PlateError error) {
		return row(SKIPPED_COLUMNS, error.getPlateId(), String.valueOf(error.getStage()), error.getDescription());
	}

	private static Map<String, String> row(List<String> columns, String... values) {
		Map<String, String> row = new LinkedHashMap<>();
		for (int i = 0; i < columns.size(); i++) {
			row.put(columns.get(i), values[i]);
		}
		return row;
	}

	/**
	 * Plain notation without trailing zeros; NaN and infinities are written as empty cells.
	 */
	public static String formatNumber(double value) {
		return CellValue.numeric(value).format();
	}

	public static String formatBoolean(boolean value) {
		return value ? "TRUE" : "FALSE";
	}
}
