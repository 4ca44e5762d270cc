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

import eu.openanalytics.phaedra.beadqcservice.config.ExportFormat;
import eu.openanalytics.phaedra.beadqcservice.enumeration.TerminationMode;
import eu.openanalytics.phaedra.beadqcservice.model.RawDocument;

/**
 * A strategy for finding where a data block of an instrument export ends.
 *
 * Different export variants of the same reader terminate their blocks differently, so the
 * {@link TerminationStrategyProvider} picks a strategy per document.
 */
public interface BlockTerminationStrategy {

	TerminationMode getMode();

	/**
	 * @param blockStart index of the block's header line
	 */
	boolean isSuited(RawDocument document, int blockStart, ExportFormat format);

	/**
	 * @param blockStart index of the block's header line
	 * @return index of the first line after the block
	 */
	int findBlockEnd(RawDocument document, int blockStart, ExportFormat format);

}
