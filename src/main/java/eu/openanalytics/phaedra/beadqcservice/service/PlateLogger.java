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

import org.slf4j.Logger;

public class PlateLogger {

    private PlateLogger() {
    }

    /**
     * Logs a message related to a plate in a consistent format.
     *
     * Important: never pass file content to the formatString. If you need to log an external string,
     * pass "%s" as formatString and the string as a formatArg.
     *
     * @param logger logger to use log the message to
     * @param plateId the plate, used to generate a consistent prefix for the log messages
     * @param formatString a formatString for the log message
     * @param formatArgs arguments for the formatString
     */
    public static void log(Logger logger, String plateId, String formatString, Object... formatArgs) {
        if (logger.isInfoEnabled()) {
            logger.info(prefix(plateId) + String.format(formatString, formatArgs));
        }
    }

    /**
     * Logs a warning related to a plate in a consistent format. Used for every decision that discards data.
     *
     * @see #log(Logger, String, String, Object...)
     */
    public static void warn(Logger logger, String plateId, String formatString, Object... formatArgs) {
        logger.warn(prefix(plateId) + String.format(formatString, formatArgs));
    }

    public static void debug(Logger logger, String plateId, String formatString, Object... formatArgs) {
        if (logger.isDebugEnabled()) {
            logger.debug(prefix(plateId) + String.format(formatString, formatArgs));
        }
    }

    private static String prefix(String plateId) {
        return String.format("Plate [P=%s] ", plateId);
    }

}
