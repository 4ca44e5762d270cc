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
package eu.openanalytics.phaedra.beadqcservice.execution.block;

import static eu.openanalytics.phaedra.beadqcservice.service.PlateLogger.log;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import eu.openanalytics.phaedra.beadqcservice.config.ExportFormat;
import eu.openanalytics.phaedra.beadqcservice.exception.BlockNotFoundException;
import eu.openanalytics.phaedra.beadqcservice.execution.block.strategy.BlockTerminationStrategy;
import eu.openanalytics.phaedra.beadqcservice.execution.block.strategy.TerminationStrategyProvider;
import eu.openanalytics.phaedra.beadqcservice.model.LineRange;
import eu.openanalytics.phaedra.beadqcservice.model.RawDocument;

/**
 * Scans the free-form text of an export for the section markers that precede the median MFI
 * and the bead count tables.
 *
 * The MFI block follows the first line containing the MFI marker. The bead count block follows
 * the last line matching the count marker that is not a per-bead variant.
 */
@Service
public class BlockLocator {

	private final TerminationStrategyProvider strategyProvider;
	private final Logger logger = LoggerFactory.getLogger(getClass());

	public BlockLocator(TerminationStrategyProvider strategyProvider) {
		this.strategyProvider = strategyProvider;
	}

	public BlockRanges locate(RawDocument document, ExportFormat format) {
		int mfiMarker = -1;
		int countMarker = -1;
		for (int i = 0; i < document.size(); i++) {
			String line = document.getLine(i);
			if (mfiMarker < 0 && line.contains(format.getMfiMarker())) mfiMarker = i;
			if (format.isCountMarker(line)) countMarker = i;
		}

		if (mfiMarker < 0) {
			throw new BlockNotFoundException("No '%s' marker found in %s", format.getMfiMarker(), document.getName());
		}
		if (countMarker < 0) {
			throw new BlockNotFoundException("No bead count marker (%s, excluding '%s') found in %s",
					format.getCountMarker().pattern(), format.getCountMarkerExclusion(), document.getName());
		}
		if (mfiMarker == countMarker) {
			throw new BlockNotFoundException("Line %d of %s is both the MFI and the bead count marker", mfiMarker + 1, document.getName());
		}

		int mfiStart = mfiMarker + 1;
		int countStart = countMarker + 1;
		if (mfiStart >= document.size() || countStart >= document.size()) {
			throw new BlockNotFoundException("Section marker on the last line of %s, block is empty", document.getName());
		}

		BlockTerminationStrategy strategy = strategyProvider.getStrategy(document, format, mfiStart, countStart)
				.orElseThrow(() -> new BlockNotFoundException("No block termination (%s) applies to %s",
						format.getTermination(), document.getName()));

		LineRange mfiRange = new LineRange(mfiStart, strategy.findBlockEnd(document, mfiStart, format));
		LineRange countRange = new LineRange(countStart, strategy.findBlockEnd(document, countStart, format));
		if (mfiRange.overlaps(countRange)) {
			throw new BlockNotFoundException("Median MFI block %s and bead count block %s overlap in %s",
					mfiRange, countRange, document.getName());
		}

		log(logger, document.getName(), "Located median MFI block at lines %s and bead count block at lines %s using %s termination",
				mfiRange, countRange, strategy.getMode());
		return new BlockRanges(mfiRange, countRange, strategy.getMode());
	}
}
