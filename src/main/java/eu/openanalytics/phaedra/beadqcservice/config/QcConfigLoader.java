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
package eu.openanalytics.phaedra.beadqcservice.config;

import java.nio.charset.Charset;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import org.apache.commons.lang3.EnumUtils;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;

import eu.openanalytics.phaedra.beadqcservice.enumeration.TerminationMode;
import eu.openanalytics.phaedra.beadqcservice.exception.ConfigException;

/**
 * Reads the {@code phaedra.beadqc.*} properties from the Spring environment into a {@link QcConfig}.
 */
@Service
public class QcConfigLoader {

	public static final String PREFIX = "phaedra.beadqc.";

	private final Environment environment;
	private final Logger logger = LoggerFactory.getLogger(getClass());

	public QcConfigLoader(Environment environment) {
		this.environment = environment;
	}

	public QcConfig load() {
		String inputPath = environment.getProperty(PREFIX + "input-path");

		int beadCountThreshold = getInt("bead-count-threshold", "50");
		if (beadCountThreshold < 0) {
			throw new ConfigException("Bead count threshold must be >= 0, got %d", beadCountThreshold);
		}

		double rSquaredThreshold = getDouble("r-squared-threshold", "0.9");
		if (!(rSquaredThreshold > 0.0 && rSquaredThreshold < 1.0)) {
			throw new ConfigException("R-squared threshold must lie in (0,1), got %s", rSquaredThreshold);
		}

		String backgroundAnalyte = environment.getProperty(PREFIX + "background-analyte");
		if (StringUtils.isBlank(backgroundAnalyte)) {
			throw new ConfigException("No background analyte configured (%sbackground-analyte)", PREFIX);
		}

		List<String> standardAnalytes = getList("standard-analytes", "");
		if (standardAnalytes.isEmpty()) {
			logger.warn("No standard analytes configured: no standard curve can pass and every plate will fail standards QC");
		}

		int parallelism = getInt("parallelism", "1");
		if (parallelism < 1) {
			throw new ConfigException("Parallelism must be >= 1, got %d", parallelism);
		}

		String strict = environment.getProperty(PREFIX + "strict");

		QcConfig config = QcConfig.builder()
				.inputPath(StringUtils.isBlank(inputPath) ? null : Path.of(inputPath.trim()))
				.outputDir(Path.of(environment.getProperty(PREFIX + "output-dir", "qc-output").trim()))
				.beadCountThreshold(beadCountThreshold)
				.rSquaredThreshold(rSquaredThreshold)
				.backgroundAnalyte(backgroundAnalyte.trim())
				.standardAnalytes(standardAnalytes)
				.strict(StringUtils.isBlank(strict) ? null : Boolean.valueOf(strict.trim()))
				.fileExtension(environment.getProperty(PREFIX + "file-extension", ".csv").trim())
				.parallelism(parallelism)
				.projectNameDelimiter(environment.getProperty(PREFIX + "project-name-delimiter", "_"))
				.exportFormat(loadExportFormat())
				.build();

		logger.info("Loaded QC configuration: {}", config);
		return config;
	}

	private ExportFormat loadExportFormat() {
		String delimiter = environment.getProperty(PREFIX + "export.delimiter", ",");
		if (delimiter.length() != 1) {
			throw new ConfigException("Export delimiter must be a single character, got '%s'", delimiter);
		}

		String charsetName = environment.getProperty(PREFIX + "export.charset", "UTF-8").trim();
		Charset charset;
		try {
			charset = Charset.forName(charsetName);
		} catch (IllegalArgumentException e) {
			throw new ConfigException("Unsupported export charset '%s'", charsetName);
		}

		String countMarker = environment.getProperty(PREFIX + "export.count-marker", "DataType.*Count");
		Pattern countPattern;
		try {
			countPattern = Pattern.compile(countMarker);
		} catch (PatternSyntaxException e) {
			throw new ConfigException("Invalid count marker pattern '%s': %s", countMarker, e.getDescription());
		}

		String termination = environment.getProperty(PREFIX + "export.termination", TerminationMode.AUTO.name()).trim();
		TerminationMode terminationMode = EnumUtils.getEnumIgnoreCase(TerminationMode.class, termination);
		if (terminationMode == null) {
			throw new ConfigException("Unknown block termination '%s', expected one of %s", termination,
					Arrays.toString(TerminationMode.values()));
		}

		String wellCountProperty = environment.getProperty(PREFIX + "export.well-count");
		Integer wellCount = StringUtils.isBlank(wellCountProperty) ? null : parseInt("export.well-count", wellCountProperty);
		if (wellCount != null && wellCount <= 0) {
			throw new ConfigException("Well count must be positive, got %d", wellCount);
		}
		if (terminationMode == TerminationMode.FIXED_WELL_COUNT && wellCount == null) {
			throw new ConfigException("Block termination %s requires %sexport.well-count", terminationMode, PREFIX);
		}

		return ExportFormat.builder()
				.delimiter(delimiter.charAt(0))
				.charset(charset)
				.mfiMarker(environment.getProperty(PREFIX + "export.mfi-marker", "Median"))
				.countMarker(countPattern)
				.countMarkerExclusion(environment.getProperty(PREFIX + "export.count-marker-exclusion", "Per Bead"))
				.terminators(getList("export.terminators", "Net MFI,Avg Net MFI,Total Events,DataType:"))
				.termination(terminationMode)
				.wellCount(wellCount)
				.build();
	}

	private List<String> getList(String key, String defaultValue) {
		String value = environment.getProperty(PREFIX + key, defaultValue);
		return Arrays.stream(StringUtils.split(value, ','))
				.map(String::trim)
				.filter(StringUtils::isNotEmpty)
				.toList();
	}

	private int getInt(String key, String defaultValue) {
		return parseInt(key, environment.getProperty(PREFIX + key, defaultValue));
	}

	private int parseInt(String key, String value) {
		try {
			return Integer.parseInt(value.trim());
		} catch (NumberFormatException e) {
			throw new ConfigException("Property %s%s is not an integer: '%s'", PREFIX, key, value);
		}
	}

	private double getDouble(String key, String defaultValue) {
		String value = environment.getProperty(PREFIX + key, defaultValue);
		try {
			return Double.parseDouble(value.trim());
		} catch (NumberFormatException e) {
			throw new ConfigException("Property %s%s is not a number: '%s'", PREFIX, key, value);
		}
	}
}
