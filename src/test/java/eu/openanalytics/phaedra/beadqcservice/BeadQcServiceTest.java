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
package eu.openanalytics.phaedra.beadqcservice;

import static eu.openanalytics.phaedra.beadqcservice.support.CsvTestReader.readRows;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import eu.openanalytics.phaedra.beadqcservice.enumeration.TerminationMode;
import eu.openanalytics.phaedra.beadqcservice.execution.block.strategy.BlockTerminationStrategy;
import eu.openanalytics.phaedra.beadqcservice.support.QcTestSupport;

@SpringBootTest(properties = {
        "phaedra.beadqc.background-analyte=BSA",
        "phaedra.beadqc.standard-analytes=IgG,Spike",
        "phaedra.beadqc.parallelism=2"
})
public class BeadQcServiceTest {

    @TempDir
    static Path outputDir;

    @DynamicPropertySource
    static void qcProperties(DynamicPropertyRegistry registry) {
        registry.add("phaedra.beadqc.input-path", () -> QcTestSupport.exportFile("project").toString());
        registry.add("phaedra.beadqc.output-dir", () -> outputDir.toString());
    }

    @Autowired
    private List<BlockTerminationStrategy> strategies;

    @Test
    public void strategiesAreOrderedByPriority() {
        Assertions.assertEquals(List.of(TerminationMode.NEXT_MARKER, TerminationMode.FIXED_WELL_COUNT),
                strategies.stream().map(BlockTerminationStrategy::getMode).toList());
    }

    @Test
    public void startupRunsConfiguredFolder() throws Exception {
        Assertions.assertEquals(3, readRows(outputDir.resolve("ProjA_all_plates_standardsqc.csv")).size());
        Assertions.assertEquals(2, readRows(outputDir.resolve("ProjA_skipped_plates.csv")).size());
        Assertions.assertTrue(Files.exists(outputDir.resolve("ProjA_plate01_clean.csv")));
    }
}
