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
package eu.openanalytics.phaedra.beadqcservice.service;

import static eu.openanalytics.phaedra.beadqcservice.service.PlateLogger.log;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import eu.openanalytics.phaedra.beadqcservice.config.ExportFormat;
import eu.openanalytics.phaedra.beadqcservice.config.QcConfig;
import eu.openanalytics.phaedra.beadqcservice.exception.BeadQcException;
import eu.openanalytics.phaedra.beadqcservice.execution.block.BlockLocator;
import eu.openanalytics.phaedra.beadqcservice.execution.block.BlockRanges;
import eu.openanalytics.phaedra.beadqcservice.model.LowBeadRecord;
import eu.openanalytics.phaedra.beadqcservice.model.PlateOutcome;
import eu.openanalytics.phaedra.beadqcservice.model.RawDocument;
import eu.openanalytics.phaedra.beadqcservice.model.WellTable;
import eu.openanalytics.phaedra.beadqcservice.service.extraction.AlignmentValidator;
import eu.openanalytics.phaedra.beadqcservice.service.extraction.TableExtractor;
import eu.openanalytics.phaedra.beadqcservice.service.output.QcArtifactWriter;
import eu.openanalytics.phaedra.beadqcservice.service.qc.BackgroundSubtractor;
import eu.openanalytics.phaedra.beadqcservice.service.qc.BeadCountQcService;
import eu.openanalytics.phaedra.beadqcservice.service.qc.CurveFitResult;
import eu.openanalytics.phaedra.beadqcservice.service.qc.PlateQcDecisionService;
import eu.openanalytics.phaedra.beadqcservice.service.qc.PlateQcDecisionService.PlateDecision;
import eu.openanalytics.phaedra.beadqcservice.service.qc.StandardCurveFitter;

/**
 * Runs the complete QC pipeline on a single export file.
 *
 * The steps are executed in a fixed order, each one mutating the tables of the previous one:
 * <ol>
 * <li>locate the median MFI and bead count blocks</li>
 * <li>extract both tables and validate that they line up</li>
 * <li>flag low bead counts and mask the affected wells in the MFI table</li>
 * <li>subtract the background analyte</li>
 * <li>fit the standard curves</li>
 * <li>decide plate pass/fail and substitute the QC sentinels</li>
 * </ol>
 * Any exception is tagged with the plate id and propagated; whether it is fatal is up to the caller.
 */
@Service
public class PlateProcessor {

	public static final String BEAD_COUNT_TABLE = "Bead count";
	public static final String MEDIAN_MFI_TABLE = "Median MFI";

	private final BlockLocator blockLocator;
	private final TableExtractor tableExtractor;
	private final AlignmentValidator alignmentValidator;
	private final BeadCountQcService beadCountQcService;
	private final BackgroundSubtractor backgroundSubtractor;
	private final StandardCurveFitter standardCurveFitter;
	private final PlateQcDecisionService plateQcDecisionService;
	private final QcArtifactWriter artifactWriter;

	private final Logger logger = LoggerFactory.getLogger(getClass());

	public PlateProcessor(
			BlockLocator blockLocator,
			TableExtractor tableExtractor,
			AlignmentValidator alignmentValidator,
			BeadCountQcService beadCountQcService,
			BackgroundSubtractor backgroundSubtractor,
			StandardCurveFitter standardCurveFitter,
			PlateQcDecisionService plateQcDecisionService,
			QcArtifactWriter artifactWriter) {

		this.blockLocator = blockLocator;
		this.tableExtractor = tableExtractor;
		this.alignmentValidator = alignmentValidator;
		this.beadCountQcService = beadCountQcService;
		this.backgroundSubtractor = backgroundSubtractor;
		this.standardCurveFitter = standardCurveFitter;
		this.plateQcDecisionService = plateQcDecisionService;
		this.artifactWriter = artifactWriter;
	}

	/**
	 * Process one export file and write its plate artifacts to the configured output directory.
	 */
	public PlateOutcome processAndWrite(Path file, QcConfig config) {
		PlateOutcome outcome = process(file, config);
		artifactWriter.writePlateArtifacts(outcome, config.getOutputDir());
		return outcome;
	}

	public PlateOutcome process(Path file, QcConfig config) {
		RawDocument document = readDocument(file, config.getExportFormat().getCharset());
		return process(document, config);
	}

	public PlateOutcome process(RawDocument document, QcConfig config) {
		String plateId = document.getName();
		try {
			return doProcess(document, plateId, config);
		} catch (BeadQcException e) {
			throw e.forPlate(plateId);
		}
	}

	private PlateOutcome doProcess(RawDocument document, String plateId, QcConfig config) {
		ExportFormat format = config.getExportFormat();
		log(logger, plateId, "Processing %d lines", document.size());

		BlockRanges ranges = blockLocator.locate(document, format);
		WellTable beadCounts = tableExtractor.extract(document, ranges.getCountRange(), BEAD_COUNT_TABLE, format.getDelimiter());
		WellTable medianMfi = tableExtractor.extract(document, ranges.getMfiRange(), MEDIAN_MFI_TABLE, format.getDelimiter());
		alignmentValidator.validate(beadCounts, medianMfi, plateId);

		List<LowBeadRecord> lowBeadRecords = beadCountQcService.flagLowBeadCounts(beadCounts, config.getBeadCountThreshold(), plateId);
		beadCountQcService.maskMedianMfi(medianMfi, lowBeadRecords, plateId);

		backgroundSubtractor.subtract(medianMfi, config.getBackgroundAnalyte(), plateId);

		CurveFitResult curves = standardCurveFitter.fit(medianMfi, config.getStandardAnalytes(), plateId);
		PlateDecision decision = plateQcDecisionService.decide(curves.getFits(), config.getRSquaredThreshold(), medianMfi, plateId);

		log(logger, plateId, "Processing finished: %s", decision.getResult().isPassed() ? "PASSED" : "FAILED");
		return PlateOutcome.builder()
				.plateId(plateId)
				.cleanedTable(decision.getCleanedTable())
				.lowBeadRecords(lowBeadRecords)
				.qcResult(decision.getResult())
				.fits(decision.getFits())
				.curvePoints(curves.getPoints())
				.build();
	}

	/**
	 * Read an export file. Bytes that are not valid in the charset are replaced, never rejected.
	 */
	public static RawDocument readDocument(Path file, Charset charset) {
		try {
			String content = new String(Files.readAllBytes(file), charset);
			return RawDocument.of(plateId(file), Arrays.asList(content.split("\\R")));
		} catch (IOException e) {
			throw new UncheckedIOException("Failed to read export file " + file, e);
		}
	}

	/**
	 * The plate id is the file name without its extension.
	 */
	public static String plateId(Path file) {
		String fileName = file.getFileName().toString();
		return fileName.contains(".") ? StringUtils.substringBeforeLast(fileName, ".") : fileName;
	}
}
