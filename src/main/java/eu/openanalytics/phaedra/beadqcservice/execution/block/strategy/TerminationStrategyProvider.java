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

import java.util.List;
import java.util.Optional;

import org.springframework.stereotype.Service;

import eu.openanalytics.phaedra.beadqcservice.config.ExportFormat;
import eu.openanalytics.phaedra.beadqcservice.enumeration.TerminationMode;
import eu.openanalytics.phaedra.beadqcservice.model.RawDocument;

@Service
public class TerminationStrategyProvider {

	private final List<BlockTerminationStrategy> strategies;

	/**
	 * @param strategies all known strategies, in priority order
	 */
	public TerminationStrategyProvider(List<BlockTerminationStrategy> strategies) {
		this.strategies = strategies;
	}

	/**
	 * Select the strategy that delimits every given block of the document.
	 * In {@link TerminationMode#AUTO} the first suited strategy wins, otherwise the configured one is
	 * returned if it is suited.
	 */
	public Optional<BlockTerminationStrategy> getStrategy(RawDocument document, ExportFormat format, int... blockStarts) {
		for (BlockTerminationStrategy strat : strategies) {
			if (format.getTermination() != TerminationMode.AUTO && strat.getMode() != format.getTermination()) continue;
			if (isSuited(strat, document, format, blockStarts)) {
				return Optional.of(strat);
			}
		}
		return Optional.empty();
	}

	private boolean isSuited(BlockTerminationStrategy strat, RawDocument document, ExportFormat format, int[] blockStarts) {
		for (int start : blockStarts) {
			if (!strat.isSuited(document, start, format)) return false;
		}
		return true;
	}
}
