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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import eu.openanalytics.phaedra.beadqcservice.enumeration.CellState;

public class CellValueTest {

    @Test
    public void parseExportCells() {
        Assertions.assertEquals(1500.0, CellValue.parse(" 1500 ").getNumericValue());
        Assertions.assertEquals(-3.25, CellValue.parse("-3.25").getNumericValue());
        Assertions.assertTrue(CellValue.parse("").isMissing());
        Assertions.assertTrue(CellValue.parse(null).isMissing());
        Assertions.assertTrue(CellValue.parse("NaN").isMissing());
        Assertions.assertTrue(CellValue.parse("Infinity").isMissing());
        Assertions.assertTrue(CellValue.parse("n/a").isMissing());
    }

    @Test
    public void subtractionPropagatesMissing() {
        Assertions.assertEquals(CellValue.numeric(1480), CellValue.numeric(1500).minus(CellValue.numeric(20)));
        Assertions.assertTrue(CellValue.MISSING.minus(CellValue.numeric(20)).isMissing());
        Assertions.assertTrue(CellValue.numeric(1500).minus(CellValue.MISSING).isMissing());
        Assertions.assertTrue(CellValue.FAILED_BEAD.minus(CellValue.numeric(20)).isMissing());
        Assertions.assertEquals(CellValue.BEAD_MASKED, CellValue.BEAD_MASKED.minus(CellValue.numeric(20)));
        Assertions.assertEquals(CellValue.BEAD_MASKED, CellValue.BEAD_MASKED.minus(CellValue.MISSING));
    }

    @Test
    public void formatting() {
        Assertions.assertEquals("1500", CellValue.numeric(1500.0).format());
        Assertions.assertEquals("103.5", CellValue.numeric(103.5).format());
        Assertions.assertEquals("0.001", CellValue.numeric(0.001).format());
        Assertions.assertEquals("", CellValue.MISSING.format());
        Assertions.assertEquals("Failed QC (bead)", CellValue.FAILED_BEAD.format());
        Assertions.assertEquals("Failed QC (standards)", CellValue.FAILED_STANDARDS.format());
    }

    @Test
    public void cellStates() {
        Assertions.assertTrue(CellValue.BEAD_MASKED.isBeadMasked());
        Assertions.assertFalse(CellValue.BEAD_MASKED.isMissing());
        Assertions.assertFalse(CellValue.MISSING.isBeadMasked());
        Assertions.assertEquals(CellState.NUMERIC, CellValue.numeric(1).getState());
        Assertions.assertThrows(IllegalStateException.class, () -> CellValue.FAILED_BEAD.getNumericValue());
    }
}
