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
package eu.openanalytics.phaedra.beadqcservice.runner;

import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import eu.openanalytics.phaedra.beadqcservice.config.QcConfig;
import eu.openanalytics.phaedra.beadqcservice.config.QcConfigLoader;
import eu.openanalytics.phaedra.beadqcservice.exception.BlockNotFoundException;
import eu.openanalytics.phaedra.beadqcservice.exception.ConfigException;
import eu.openanalytics.phaedra.beadqcservice.exception.SchemaException;
import eu.openanalytics.phaedra.beadqcservice.model.PlateOutcome;
import eu.openanalytics.phaedra.beadqcservice.service.PlateProcessor;
import eu.openanalytics.phaedra.beadqcservice.service.ProjectAggregator;

/**
 * Entry point of a QC run: a single export file is processed on its own, a folder is processed as a project.
 */
@Component
public class BeadQcRunner implements ApplicationRunner {

	private final QcConfigLoader configLoader;
	private final PlateProcessor plateProcessor;
	private final ProjectAggregator projectAggregator;

	private final Logger logger = LoggerFactory.getLogger(getClass());

	public BeadQcRunner(QcConfigLoader configLoader, PlateProcessor plateProcessor, ProjectAggregator projectAggregator) {
		this.configLoader = configLoader;
		this.plateProcessor = plateProcessor;
		this.projectAggregator = projectAggregator;
	}

	@Override
	public void run(ApplicationArguments args) {
		QcConfig config = configLoader.load();
		Path input = config.getInputPath();
		if (input == null) {
			logger.info("No input path configured ({}input-path), nothing to do", QcConfigLoader.PREFIX);
			return;
		}

		if (Files.isDirectory(input)) {
			projectAggregator.aggregate(input, config);
		} else if (Files.isRegularFile(input)) {
			runSingleFile(input, config);
		} else {
			throw new ConfigException("Input path %s does not exist", input);
		}
	}

	private void runSingleFile(Path file, QcConfig config) {
		try {
			PlateOutcome outcome = plateProcessor.processAndWrite(file, config);
			logger.info("Plate {} {} standards QC, {} low bead count records",
					outcome.getPlateId(), outcome.getQcResult().isPassed() ? "passed" : "failed", outcome.getLowBeadRecords().size());
		} catch (BlockNotFoundException | SchemaException e) {
			if (config.isStrict(false)) throw e;
			logger.warn("Skipped {}: {}", file, e.getMessage());
		}
	}
}
