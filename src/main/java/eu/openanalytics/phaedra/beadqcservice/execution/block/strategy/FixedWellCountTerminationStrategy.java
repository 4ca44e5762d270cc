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
package eu.openanalytics.phaedra.beadqcservice.execution.block.strategy;

import org.springframework.stereotype.Component;

import eu.openanalytics.phaedra.beadqcservice.config.ExportFormat;
import eu.openanalytics.phaedra.beadqcservice.enumeration.TerminationMode;
import eu.openanalytics.phaedra.beadqcservice.exception.BlockNotFoundException;
import eu.openanalytics.phaedra.beadqcservice.model.RawDocument;
import jakarta.annotation.Priority;

/**
 * A block is its header line followed by exactly the configured number of well lines.
 */
@Component
@Priority(2)
public class FixedWellCountTerminationStrategy implements BlockTerminationStrategy {

	@Override
	public TerminationMode getMode() {
		return TerminationMode.FIXED_WELL_COUNT;
	}

	@Override
	public boolean isSuited(RawDocument document, int blockStart, ExportFormat format) {
		return format.hasWellCount() && blockStart + 1 + format.getWellCount() <= document.size();
	}

	@Override
	public int findBlockEnd(RawDocument document, int blockStart, ExportFormat format) {
		if (!format.hasWellCount()) {
			throw new BlockNotFoundException("No well count configured for fixed-size blocks");
		}
		int end = blockStart + 1 + format.getWellCount();
		if (end > document.size()) {
			throw new BlockNotFoundException("Block starting at line %d needs %d well lines but the document ends at line %d",
					blockStart + 1, format.getWellCount(), document.size());
		}
		return end;
	}
}
