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

import com.fasterxml.jackson.dataformat.csv.CsvMapper;

import eu.openanalytics.phaedra.beadqcservice.config.QcConfig;
import eu.openanalytics.phaedra.beadqcservice.exception.BlockNotFoundException;
import eu.openanalytics.phaedra.beadqcservice.exception.ConfigException;
import eu.openanalytics.phaedra.beadqcservice.execution.progress.QcStage;
import eu.openanalytics.phaedra.beadqcservice.model.PlateError;
import eu.openanalytics.phaedra.beadqcservice.model.PlateQcResult;
import eu.openanalytics.phaedra.beadqcservice.model.ProjectSummary;
import eu.openanalytics.phaedra.beadqcservice.service.output.QcArtifactWriter;
import eu.openanalytics.phaedra.beadqcservice.support.QcTestSupport;

public class ProjectAggregatorTest {

    private final PlateProcessor plateProcessor = QcTestSupport.plateProcessor();
    private final ProjectAggregator projectAggregator = new ProjectAggregator(plateProcessor,
            new QcArtifactWriter(new CsvMapper()));

    private final Path projectFolder = QcTestSupport.exportFile("project");

    @TempDir
    Path outputDir;

    private QcConfig config() {
        return QcTestSupport.defaultConfig(projectFolder, outputDir);
    }

    @Test
    public void malformedPlateIsSkippedInFolderMode() throws Exception {
        ProjectSummary summary = projectAggregator.aggregate(projectFolder, config());

        Assertions.assertEquals("ProjA", summary.getProjectName());
        Assertions.assertEquals(List.of(
                new PlateQcResult("ProjA_plate01", true, List.of("Spike")),
                new PlateQcResult("ProjA_plate02", false, List.of())), summary.getPlateResults());
        Assertions.assertEquals(1, summary.getLowBeadRecords().size());

        Assertions.assertEquals(1, summary.getSkippedPlates().size());
        PlateError skipped = summary.getSkippedPlates().get(0);
        Assertions.assertEquals("ProjA_plate03", skipped.getPlateId());
        Assertions.assertEquals("ProjA_plate03.csv", skipped.getFileName());
        Assertions.assertEquals(QcStage.Extraction, skipped.getStage());
        Assertions.assertEquals("BlockNotFoundException", skipped.getExceptionClassName());

        Path standardsQc = outputDir.resolve("ProjA_all_plates_standardsqc.csv");
        Assertions.assertEquals(List.of("Plate", "Passed_QC"), readRow(standardsQc, 0));
        Assertions.assertEquals(List.of("ProjA_plate01", "TRUE"), readRow(standardsQc, 1));
        Assertions.assertEquals(List.of("ProjA_plate02", "FALSE"), readRow(standardsQc, 2));

        Path beadQc = outputDir.resolve("ProjA_all_plates_beadqc.csv");
        Assertions.assertEquals(List.of("6(1,F1)", "Sample02", "Spike", "ProjA_plate01"), readRow(beadQc, 1));
        Assertions.assertEquals(2, readRows(beadQc).size());

        Path skippedFile = outputDir.resolve("ProjA_skipped_plates.csv");
        Assertions.assertEquals(List.of("Plate", "Stage", "Error"), readRow(skippedFile, 0));
        Assertions.assertEquals("ProjA_plate03", readRow(skippedFile, 1).get(0));

        // Per-plate artifacts of the processed plates
        Assertions.assertTrue(Files.exists(outputDir.resolve("ProjA_plate01_clean.csv")));
        Assertions.assertTrue(Files.exists(outputDir.resolve("ProjA_plate02_clean.csv")));
        Assertions.assertFalse(Files.exists(outputDir.resolve("ProjA_plate03_clean.csv")));
    }

    @Test
    public void strictFolderRunAborts() {
        QcConfig strict = config().withStrict(true);
        Assertions.assertThrows(BlockNotFoundException.class, () -> projectAggregator.aggregate(projectFolder, strict));
    }

    @Test
    public void configErrorIsFatalInFolderMode() {
        QcConfig config = config().withBackgroundAnalyte("GST");
        Assertions.assertThrows(ConfigException.class, () -> projectAggregator.aggregate(projectFolder, config));
    }

    @Test
    public void parallelRunGivesSameSummary(@TempDir Path parallelOutputDir) throws Exception {
        projectAggregator.aggregate(projectFolder, config());
        projectAggregator.aggregate(projectFolder, config().withParallelism(4).withOutputDir(parallelOutputDir));

        for (String file : List.of("ProjA_all_plates_standardsqc.csv", "ProjA_all_plates_beadqc.csv", "ProjA_skipped_plates.csv",
                "ProjA_plate01_clean.csv", "ProjA_plate02_clean.csv")) {
            Assertions.assertArrayEquals(Files.readAllBytes(outputDir.resolve(file)), Files.readAllBytes(parallelOutputDir.resolve(file)), file);
        }
    }

    @Test
    public void emptyFolderWritesHeaderOnlySummaries(@TempDir Path emptyFolder) throws Exception {
        ProjectSummary summary = projectAggregator.aggregate(emptyFolder, QcTestSupport.defaultConfig(emptyFolder, outputDir));

        Assertions.assertTrue(summary.getPlateResults().isEmpty());
        Path standardsQc = outputDir.resolve(summary.getProjectName() + "_all_plates_standardsqc.csv");
        Assertions.assertEquals(1, readRows(standardsQc).size());
    }

    @Test
    public void onlyMatchingFilesAreListed() {
        List<Path> files = ProjectAggregator.listExportFiles(projectFolder, ".CSV");
        Assertions.assertEquals(List.of("ProjA_plate01.csv", "ProjA_plate02.csv", "ProjA_plate03.csv"),
                files.stream().map(p -> p.getFileName().toString()).toList());
    }

    @Test
    public void projectNameIsFirstToken() {
        Assertions.assertEquals("ProjA", ProjectAggregator.projectName(Path.of("ProjA_plate01.csv"), "_"));
        Assertions.assertEquals("ProjA", ProjectAggregator.projectName(Path.of("ProjA-plate01-rerun.csv"), "-"));
        Assertions.assertEquals("plate01", ProjectAggregator.projectName(Path.of("plate01.csv"), "_"));
    }
}
