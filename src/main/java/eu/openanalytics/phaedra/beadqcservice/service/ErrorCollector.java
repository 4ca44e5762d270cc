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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.openanalytics.phaedra.beadqcservice.model.PlateError;

/**
 * Collects the plates that were skipped during a folder run, so they can be reported together at the end.
 */
public class ErrorCollector {

    private final List<PlateError> errors = Collections.synchronizedList(new ArrayList<>());
    private final Logger logger = LoggerFactory.getLogger(getClass());
    private final String projectName;

    public ErrorCollector(String projectName) {
        this.projectName = projectName;
    }

    public List<PlateError> getErrors() {
        return errors;
    }

    public String getErrorDescription() {
        StringBuilder description = new StringBuilder();
        for (var error : errors) {
            description.append(String.format("%s (%s) skipped at stage %s: %s: %s",
                    error.getPlateId(), error.getFileName(), error.getStage(), error.getExceptionClassName(), error.getDescription()));
            description.append("\n");
        }
        return description.toString();
    }

    public boolean hasError() {
        return errors.size() > 0;
    }

    public void handleError(PlateError error) {
        errors.add(error);
        logger.warn("Project [{}] Plate {} skipped: {}", projectName, error.getPlateId(), error.getDescription());
    }

}
