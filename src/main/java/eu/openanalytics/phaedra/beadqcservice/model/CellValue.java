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
package eu.openanalytics.phaedra.beadqcservice.model;

import java.math.BigDecimal;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;

import eu.openanalytics.phaedra.beadqcservice.enumeration.CellState;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * A single analyte cell: either a number, a missing value, or a sentinel recording why the
 * number was discarded.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CellValue {

	public static final String FAILED_BEAD_LABEL = "Failed QC (bead)";
	public static final String FAILED_STANDARDS_LABEL = "Failed QC (standards)";

	public static final CellValue MISSING = new CellValue(CellState.MISSING, null);
	public static final CellValue BEAD_MASKED = new CellValue(CellState.BEAD_MASKED, null);
	public static final CellValue FAILED_BEAD = new CellValue(CellState.FAILED_BEAD, null);
	public static final CellValue FAILED_STANDARDS = new CellValue(CellState.FAILED_STANDARDS, null);

	CellState state;
	Double value;

	public static CellValue numeric(double value) {
		if (!Double.isFinite(value)) return MISSING;
		return new CellValue(CellState.NUMERIC, value);
	}

	/**
	 * Parse a raw export cell. Blank, NaN, infinite or non-numeric text is missing.
	 */
	public static CellValue parse(String raw) {
		if (StringUtils.isBlank(raw)) return MISSING;
		return numeric(NumberUtils.toDouble(raw.trim(), Double.NaN));
	}

	public boolean isNumeric() {
		return state == CellState.NUMERIC;
	}

	public boolean isMissing() {
		return state == CellState.MISSING;
	}

	public boolean isBeadMasked() {
		return state == CellState.BEAD_MASKED;
	}

	public double getNumericValue() {
		if (!isNumeric()) throw new IllegalStateException("Cell is not numeric: " + state);
		return value;
	}

	/**
	 * Subtract another cell. A bead-masked cell stays masked; otherwise anything but two numbers
	 * gives a missing cell.
	 */
	public CellValue minus(CellValue other) {
		if (isBeadMasked()) return this;
		if (!isNumeric() || !other.isNumeric()) return MISSING;
		return numeric(value - other.value);
	}

	public String format() {
		switch (state) {
		case NUMERIC:
			return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
		case FAILED_BEAD:
			return FAILED_BEAD_LABEL;
		case FAILED_STANDARDS:
			return FAILED_STANDARDS_LABEL;
		default:
			return "";
		}
	}

	@Override
	public String toString() {
		if (isMissing()) return "<missing>";
		if (isBeadMasked()) return "<bead masked>";
		return format();
	}
}
