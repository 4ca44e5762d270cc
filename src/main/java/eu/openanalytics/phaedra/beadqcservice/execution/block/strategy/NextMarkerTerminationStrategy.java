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
 * Ends a block on the line before the next section marker (e.g. "Net MFI"). The header line of
 * the block itself is never considered.
 */
@Component
@Priority(1)
public class NextMarkerTerminationStrategy implements BlockTerminationStrategy {

	@Override
	public TerminationMode getMode() {
		return TerminationMode.NEXT_MARKER;
	}

	@Override
	public boolean isSuited(RawDocument document, int blockStart, ExportFormat format) {
		return findTerminator(document, blockStart, format) >= 0;
	}

	@Override
	public int findBlockEnd(RawDocument document, int blockStart, ExportFormat format) {
		int end = findTerminator(document, blockStart, format);
		if (end < 0) {
			throw new BlockNotFoundException("No terminating marker %s after the block starting at line %d",
					format.getTerminators(), blockStart + 1);
		}
		return end;
	}

	private int findTerminator(RawDocument document, int blockStart, ExportFormat format) {
		for (int i = blockStart + 1; i < document.size(); i++) {
			if (format.isTerminator(document.getLine(i))) return i;
		}
		return -1;
	}
}
