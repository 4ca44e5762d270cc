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

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import eu.openanalytics.phaedra.beadqcservice.config.QcConfig;
import eu.openanalytics.phaedra.beadqcservice.exception.BeadQcException;
import eu.openanalytics.phaedra.beadqcservice.exception.BlockNotFoundException;
import eu.openanalytics.phaedra.beadqcservice.exception.SchemaException;
import eu.openanalytics.phaedra.beadqcservice.model.LowBeadRecord;
import eu.openanalytics.phaedra.beadqcservice.model.PlateError;
import eu.openanalytics.phaedra.beadqcservice.model.PlateQcResult;
import eu.openanalytics.phaedra.beadqcservice.model.PlateRunResult;
import eu.openanalytics.phaedra.beadqcservice.model.ProjectSummary;
import eu.openanalytics.phaedra.beadqcservice.service.output.QcArtifactWriter;

/**
 * Runs the plate pipeline over every export file of a folder and folds the per-plate results
 * into project-level summary tables.
 *
 * Plates are independent, so they may be processed concurrently. The fold only starts after
 * every plate has finished, and runs on the calling thread in file name order.
 */
@Service
public class ProjectAggregator {

	private final PlateProcessor plateProcessor;
	private final QcArtifactWriter artifactWriter;

	private final Logger logger = LoggerFactory.getLogger(getClass());

	public ProjectAggregator(PlateProcessor plateProcessor, QcArtifactWriter artifactWriter) {
		this.plateProcessor = plateProcessor;
		this.artifactWriter = artifactWriter;
	}

	public ProjectSummary aggregate(Path folder, QcConfig config) {
		List<Path> files = listExportFiles(folder, config.getFileExtension());
		String projectName = files.isEmpty() ? folder.getFileName().toString()
				: projectName(files.get(0), config.getProjectNameDelimiter());
		boolean strict = config.isStrict(true);

		if (files.isEmpty()) {
			logger.warn("Project [{}] No '{}' files found in {}", projectName, config.getFileExtension(), folder);
		} else {
			logger.info("Project [{}] Processing {} plates from {} ({} threads, strict: {})",
					projectName, files.size(), folder, config.getParallelism(), strict);
		}

		List<PlateRunResult> runResults = runAll(files, config, strict);

		ErrorCollector errorCollector = new ErrorCollector(projectName);
		List<PlateQcResult> plateResults = new ArrayList<>();
		List<LowBeadRecord> lowBeadRecords = new ArrayList<>();
		for (PlateRunResult runResult : runResults) {
			if (runResult.isSkipped()) {
				errorCollector.handleError(runResult.getError());
			} else {
				plateResults.add(runResult.getOutcome().getQcResult());
				lowBeadRecords.addAll(runResult.getOutcome().getLowBeadRecords());
			}
		}

		ProjectSummary summary = new ProjectSummary(projectName, plateResults, lowBeadRecords, errorCollector.getErrors());
		artifactWriter.writeProjectArtifacts(summary, config.getOutputDir());

		if (errorCollector.hasError()) {
			logger.warn("Project [{}] {} of {} plates were skipped:\n{}", projectName,
					errorCollector.getErrors().size(), files.size(), errorCollector.getErrorDescription());
		}
		logger.info("Project [{}] Finished: {} plates processed, {} passed standards QC, {} low bead count records",
				projectName, plateResults.size(), plateResults.stream().filter(PlateQcResult::isPassed).count(), lowBeadRecords.size());
		return summary;
	}

	private List<PlateRunResult> runAll(List<Path> files, QcConfig config, boolean strict) {
		ExecutorService pool = Executors.newFixedThreadPool(config.getParallelism());
		try {
			List<CompletableFuture<PlateRunResult>> futures = files.stream()
					.map(file -> CompletableFuture.supplyAsync(() -> runPlate(file, config, strict), pool))
					.toList();
			CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
			return futures.stream().map(CompletableFuture::join).toList();
		} catch (CompletionException e) {
			if (e.getCause() instanceof RuntimeException cause) throw cause;
			throw e;
		} finally {
			pool.shutdown();
		}
	}

	private PlateRunResult runPlate(Path file, QcConfig config, boolean strict) {
		String fileName = file.getFileName().toString();
		try {
			return PlateRunResult.completed(fileName, plateProcessor.processAndWrite(file, config));
		} catch (BlockNotFoundException | SchemaException e) {
			if (strict) throw e;
			return PlateRunResult.skipped(fileName, toPlateError(fileName, file, e));
		}
	}

	private static PlateError toPlateError(String fileName, Path file, BeadQcException e) {
		return PlateError.builder()
				.plateId(e.getPlateId() != null ? e.getPlateId() : PlateProcessor.plateId(file))
				.fileName(fileName)
				.stage(e.getStage())
				.exceptionClassName(e.getClass().getSimpleName())
				.description(e.getMessage())
				.build();
	}

	/**
	 * Regular files directly inside the folder whose name ends with the extension (case-insensitive),
	 * sorted by file name.
	 */
	public static List<Path> listExportFiles(Path folder, String extension) {
		try (Stream<Path> entries = Files.list(folder)) {
			return entries
					.filter(Files::isRegularFile)
					.filter(p -> StringUtils.endsWithIgnoreCase(p.getFileName().toString(), extension))
					.sorted(Comparator.comparing(p -> p.getFileName().toString()))
					.collect(Collectors.toList());
		} catch (IOException e) {
			throw new UncheckedIOException("Failed to list export files in " + folder, e);
		}
	}

	/**
	 * The project name is the part of the file name before the first delimiter, e.g. "ProjA" for
	 * "ProjA_plate01.csv". Without delimiter it is the plate id.
	 */
	public static String projectName(Path file, String delimiter) {
		String plateId = PlateProcessor.plateId(file);
		if (StringUtils.isEmpty(delimiter) || !plateId.contains(delimiter)) return plateId;
		return StringUtils.substringBefore(plateId, delimiter);
	}
}
