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
package eu.openanalytics.phaedra.beadqcservice.service;

import static eu.openanalytics.phaedra.beadqcservice.support.CsvTestReader.readRow;
import static eu.openanalytics.phaedra.beadqcservice.support.CsvTestReader.readRows;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import eu.openanalytics.phaedra.beadqcservice.config.QcConfig;
import eu.openanalytics.phaedra.beadqcservice.enumeration.TerminationMode;
import eu.openanalytics.phaedra.beadqcservice.exception.AlignmentException;
import eu.openanalytics.phaedra.beadqcservice.exception.BeadQcException;
import eu.openanalytics.phaedra.beadqcservice.exception.BlockNotFoundException;
import eu.openanalytics.phaedra.beadqcservice.exception.ConfigException;
import eu.openanalytics.phaedra.beadqcservice.execution.progress.QcStage;
import eu.openanalytics.phaedra.beadqcservice.model.AnalyteFit;
import eu.openanalytics.phaedra.beadqcservice.model.CellValue;
import eu.openanalytics.phaedra.beadqcservice.model.LowBeadRecord;
import eu.openanalytics.phaedra.beadqcservice.model.PlateOutcome;
import eu.openanalytics.phaedra.beadqcservice.model.RawDocument;
import eu.openanalytics.phaedra.beadqcservice.model.WellRow;
import eu.openanalytics.phaedra.beadqcservice.model.WellTable;
import eu.openanalytics.phaedra.beadqcservice.support.QcTestSupport;

public class PlateProcessorTest {

    private final PlateProcessor plateProcessor = QcTestSupport.plateProcessor();

    @TempDir
    Path outputDir;

    private QcConfig config() {
        return QcTestSupport.defaultConfig(null, outputDir);
    }

    @Test
    public void passingPlate() {
        PlateOutcome outcome = plateProcessor.process(QcTestSupport.exportFile("ProjA_plate01.csv"), config());

        Assertions.assertEquals("ProjA_plate01", outcome.getPlateId());
        Assertions.assertTrue(outcome.getQcResult().isPassed());
        Assertions.assertEquals(List.of("Spike"), outcome.getQcResult().getPassingAnalytes());

        // Spike count 49 in F1 is below the threshold, IgG count 50 in H1 is not
        Assertions.assertEquals(List.of(new LowBeadRecord("6(1,F1)", "Sample02", "Spike", "ProjA_plate01")), outcome.getLowBeadRecords());

        List<AnalyteFit> fits = outcome.getFits();
        Assertions.assertEquals("IgG", fits.get(0).getAnalyte());
        Assertions.assertFalse(fits.get(0).isPassed());
        Assertions.assertEquals("Spike", fits.get(1).getAnalyte());
        Assertions.assertTrue(fits.get(1).isPassed());
        Assertions.assertEquals(1.0, fits.get(1).getRSquared(), 1e-9);

        WellTable cleaned = outcome.getCleanedTable().getTable();
        WellRow e1 = cleaned.getRows().get(4);
        Assertions.assertEquals("5(1,E1)", e1.getLocation());
        Assertions.assertEquals(1500.0, e1.getValue("IgG").getNumericValue(), 1e-9);
        Assertions.assertEquals(800.0, e1.getValue("Spike").getNumericValue(), 1e-9);
        Assertions.assertEquals(20.0, e1.getValue("BSA").getNumericValue());

        // Only Spike failed in F1, but the whole well is flagged
        WellRow f1 = cleaned.getRows().get(5);
        for (String analyte : cleaned.getAnalytes()) {
            Assertions.assertEquals(CellValue.FAILED_BEAD, f1.getValue(analyte), analyte);
        }

        WellRow h1 = cleaned.getRows().get(7);
        Assertions.assertEquals(3000.0, h1.getValue("IgG").getNumericValue(), 1e-9);
    }

    @Test
    public void failingPlateHasOnlyStandardsSentinels() {
        PlateOutcome outcome = plateProcessor.process(QcTestSupport.exportFile("project/ProjA_plate02.csv"), config());

        Assertions.assertFalse(outcome.getQcResult().isPassed());
        Assertions.assertTrue(outcome.getLowBeadRecords().isEmpty());
        Assertions.assertEquals("", outcome.getCleanedTable().getStandardLabel());
        for (WellRow row : outcome.getCleanedTable().getTable().getRows()) {
            for (CellValue value : row.getValues().values()) {
                Assertions.assertEquals(CellValue.FAILED_STANDARDS, value);
            }
        }
    }

    @Test
    public void blankMfiCellsWithGoodBeadCountsStayEmpty() {
        RawDocument document = RawDocument.of("gaps", List.of(
                "DataType:,Median",
                "Location,Sample,IgG,Spike,BSA,Total Events",
                "A1,Standard1,1020,10019,20,1200",
                "B1,Standard2,120,1019,20,1200",
                "C1,Standard3,30,119,20,1200",
                "D1,Sample01,1520,,20,1200",
                "E1,Sample02,1520,820,,1200",
                "DataType:,Count",
                "Location,Sample,IgG,Spike,BSA,Total Events",
                "A1,Standard1,80,80,80,1200",
                "B1,Standard2,80,80,80,1200",
                "C1,Standard3,80,80,80,1200",
                "D1,Sample01,80,80,80,1200",
                "E1,Sample02,80,80,80,1200",
                "DataType:,Net MFI"));

        PlateOutcome outcome = plateProcessor.process(document, config());

        Assertions.assertTrue(outcome.getQcResult().isPassed());
        Assertions.assertTrue(outcome.getLowBeadRecords().isEmpty());

        WellTable cleaned = outcome.getCleanedTable().getTable();
        WellRow d1 = cleaned.getRows().get(3);
        Assertions.assertEquals(1500.0, d1.getValue("IgG").getNumericValue(), 1e-9);
        Assertions.assertEquals(CellValue.MISSING, d1.getValue("Spike"));
        Assertions.assertEquals(20.0, d1.getValue("BSA").getNumericValue());

        // No background value: the analytes cannot be corrected, but bead QC did not fail
        WellRow e1 = cleaned.getRows().get(4);
        for (String analyte : cleaned.getAnalytes()) {
            Assertions.assertEquals(CellValue.MISSING, e1.getValue(analyte), analyte);
        }
        for (WellRow row : cleaned.getRows()) {
            Assertions.assertFalse(row.getValues().containsValue(CellValue.FAILED_BEAD), row.getLocation());
        }
    }

    @Test
    public void fixedWellCountGivesSameResult() {
        QcConfig fixed = config().withExportFormat(QcTestSupport.defaultFormat()
                .withTermination(TerminationMode.FIXED_WELL_COUNT)
                .withWellCount(8));

        PlateOutcome outcome = plateProcessor.process(QcTestSupport.exportFile("ProjA_plate01.csv"), fixed);

        Assertions.assertTrue(outcome.getQcResult().isPassed());
        Assertions.assertEquals(8, outcome.getCleanedTable().getTable().size());
        Assertions.assertEquals(1, outcome.getLowBeadRecords().size());
    }

    @Test
    public void writesPlateArtifacts() throws Exception {
        plateProcessor.processAndWrite(QcTestSupport.exportFile("ProjA_plate01.csv"), config());

        Path clean = outputDir.resolve("ProjA_plate01_clean.csv");
        Assertions.assertEquals(List.of("Location", "Sample", "IgG", "Spike", "BSA", "Plate", "Standard"), readRow(clean, 0));
        Assertions.assertEquals(List.of("1(1,A1)", "Standard1", "500", "9999", "20", "ProjA_plate01", "Spike"), readRow(clean, 1));
        Assertions.assertEquals(List.of("6(1,F1)", "Sample02", "Failed QC (bead)", "Failed QC (bead)", "Failed QC (bead)", "ProjA_plate01", "Spike"), readRow(clean, 6));
        Assertions.assertEquals(9, readRows(clean).size());

        Path lowBead = outputDir.resolve("ProjA_plate01_beadqc_low_df.csv");
        Assertions.assertEquals(List.of("Location", "Sample", "Antigen", "Plate"), readRow(lowBead, 0));
        Assertions.assertEquals(List.of("6(1,F1)", "Sample02", "Spike", "ProjA_plate01"), readRow(lowBead, 1));

        Path fits = outputDir.resolve("ProjA_plate01_standards_fits.csv");
        Assertions.assertEquals(List.of("Analyte", "Slope", "Intercept", "R_squared", "Passed"), readRow(fits, 0));
        Assertions.assertEquals("FALSE", readRow(fits, 1).get(4));
        Assertions.assertEquals("TRUE", readRow(fits, 2).get(4));

        Path curve = outputDir.resolve("ProjA_plate01_standards_curve.csv");
        Assertions.assertEquals(List.of("Analyte", "Sample", "DilutionFactor", "Log10MFI"), readRow(curve, 0));
        Assertions.assertEquals(9, readRows(curve).size());
    }

    @Test
    public void rerunIsByteIdentical(@TempDir Path secondOutputDir) throws Exception {
        plateProcessor.processAndWrite(QcTestSupport.exportFile("ProjA_plate01.csv"), config());
        plateProcessor.processAndWrite(QcTestSupport.exportFile("ProjA_plate01.csv"), config().withOutputDir(secondOutputDir));

        for (String suffix : List.of("_clean.csv", "_beadqc_low_df.csv", "_standards_fits.csv", "_standards_curve.csv")) {
            Assertions.assertArrayEquals(
                    Files.readAllBytes(outputDir.resolve("ProjA_plate01" + suffix)),
                    Files.readAllBytes(secondOutputDir.resolve("ProjA_plate01" + suffix)), suffix);
        }
    }

    @Test
    public void malformedExportIsBlockNotFoundForPlate() {
        BlockNotFoundException e = Assertions.assertThrows(BlockNotFoundException.class,
                () -> plateProcessor.process(QcTestSupport.exportFile("project/ProjA_plate03.csv"), config()));
        Assertions.assertEquals("ProjA_plate03", e.getPlateId());
        Assertions.assertEquals(QcStage.Extraction, e.getStage());
    }

    @Test
    public void misalignedTablesAreFatal() {
        RawDocument document = RawDocument.of("misaligned", List.of(
                "DataType:,Median",
                "Location,Sample,IgG,BSA,Total Events",
                "A1,Standard1,100,20,1200",
                "A2,Standard2,10,20,1200",
                "DataType:,Count",
                "Location,Sample,IgG,BSA,Total Events",
                "A2,Standard2,80,80,1200",
                "A1,Standard1,80,80,1200",
                "DataType:,Net MFI"));

        BeadQcException e = Assertions.assertThrows(AlignmentException.class, () -> plateProcessor.process(document, config()));
        Assertions.assertEquals("misaligned", e.getPlateId());
    }

    @Test
    public void absentBackgroundAnalyteIsFatal() {
        QcConfig config = config().withBackgroundAnalyte("GST");
        Assertions.assertThrows(ConfigException.class, () -> plateProcessor.process(QcTestSupport.exportFile("ProjA_plate01.csv"), config));
    }

    @Test
    public void plateIdStripsExtension() {
        Assertions.assertEquals("ProjA_plate01", PlateProcessor.plateId(Path.of("/data/ProjA_plate01.csv")));
        Assertions.assertEquals("run.2023", PlateProcessor.plateId(Path.of("run.2023.txt")));
        Assertions.assertEquals("plate", PlateProcessor.plateId(Path.of("plate")));
    }
}
