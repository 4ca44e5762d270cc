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
package eu.openanalytics.phaedra.beadqcservice.service.extraction;

import static eu.openanalytics.phaedra.beadqcservice.service.PlateLogger.log;
import static eu.openanalytics.phaedra.beadqcservice.service.PlateLogger.warn;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;

import eu.openanalytics.phaedra.beadqcservice.exception.SchemaException;
import eu.openanalytics.phaedra.beadqcservice.model.CellValue;
import eu.openanalytics.phaedra.beadqcservice.model.LineRange;
import eu.openanalytics.phaedra.beadqcservice.model.RawDocument;
import eu.openanalytics.phaedra.beadqcservice.model.WellRow;
import eu.openanalytics.phaedra.beadqcservice.model.WellTable;

/**
 * Parses a block of delimited lines into a {@link WellTable}, keeping only the columns from
 * "Location" up to (not including) "Total Events".
 */
@Service
public class TableExtractor {

	private final CsvMapper csvMapper;
	private final Logger logger = LoggerFactory.getLogger(getClass());

	public TableExtractor(CsvMapper csvMapper) {
		this.csvMapper = csvMapper;
	}

	public WellTable extract(RawDocument document, LineRange range, String tableName, char delimiter) {
		List<String[]> records = parse(document, range, delimiter);
		if (records.isEmpty()) {
			throw new SchemaException("%s block %s of %s has no header line", tableName, range, document.getName());
		}

		List<String> header = Arrays.stream(records.get(0)).map(StringUtils::trim).toList();
		int first = header.indexOf(WellTable.LOCATION);
		int last = header.indexOf(WellTable.TOTAL_EVENTS);
		if (first < 0) {
			throw new SchemaException("%s block of %s has no '%s' column", tableName, document.getName(), WellTable.LOCATION);
		}
		if (last < 0) {
			throw new SchemaException("%s block of %s has no '%s' column", tableName, document.getName(), WellTable.TOTAL_EVENTS);
		}
		if (last <= first) {
			throw new SchemaException("%s block of %s has '%s' before '%s'", tableName, document.getName(),
					WellTable.TOTAL_EVENTS, WellTable.LOCATION);
		}

		List<String> columnNames = header.subList(first, last);
		Set<String> seen = new HashSet<>();
		for (String column : columnNames) {
			if (!seen.add(column)) {
				throw new SchemaException("%s block of %s has duplicate column '%s'", tableName, document.getName(), column);
			}
		}
		int sampleIndex = header.indexOf(WellTable.SAMPLE);
		if (sampleIndex < first || sampleIndex >= last) {
			throw new SchemaException("%s block of %s has no '%s' column", tableName, document.getName(), WellTable.SAMPLE);
		}

		List<String> analytes = columnNames.stream()
				.filter(c -> !c.equals(WellTable.LOCATION) && !c.equals(WellTable.SAMPLE))
				.toList();

		List<WellRow> rows = new ArrayList<>();
		int missingCells = 0;
		for (String[] record : records.subList(1, records.size())) {
			if (Arrays.stream(record).allMatch(StringUtils::isBlank)) continue;

			String location = StringUtils.trimToNull(cell(record, first));
			Map<String, CellValue> values = new LinkedHashMap<>();
			for (String analyte : analytes) {
				String raw = cell(record, header.indexOf(analyte));
				CellValue value = CellValue.parse(raw);
				if (value.isMissing()) {
					missingCells++;
					warn(logger, document.getName(), "%s table: well %s, analyte %s has non-numeric value '%s', read as missing",
							tableName, location, analyte, StringUtils.defaultString(raw));
				}
				values.put(analyte, value);
			}
			rows.add(new WellRow(location, StringUtils.trimToNull(cell(record, sampleIndex)), values));
		}

		if (missingCells > 0) {
			warn(logger, document.getName(), "%s table has %d non-numeric or empty analyte cells, read as missing", tableName, missingCells);
		}
		log(logger, document.getName(), "Extracted %s table: %d wells, %d analytes %s", tableName, rows.size(), analytes.size(), analytes);
		return new WellTable(tableName, columnNames, analytes, rows);
	}

	private List<String[]> parse(RawDocument document, LineRange range, char delimiter) {
		CsvSchema schema = CsvSchema.emptySchema().withColumnSeparator(delimiter);
		String text = String.join("\n", document.getLines(range));
		try (MappingIterator<String[]> it = csvMapper.readerFor(String[].class)
				.with(schema)
				.with(CsvParser.Feature.WRAP_AS_ARRAY)
				.readValues(text)) {
			return it.readAll();
		} catch (IOException e) {
			throw new SchemaException("Block %s of %s is not valid delimited text: %s", range, document.getName(), e.getMessage());
		}
	}

	private static String cell(String[] record, int index) {
		return index < record.length ? record[index] : null;
	}
}
