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
package eu.openanalytics.phaedra.beadqcservice.exception;

import eu.openanalytics.phaedra.beadqcservice.execution.progress.QcStage;

/**
 * The bead count table and the median MFI table do not describe the same wells and analytes.
 */
public class AlignmentException extends BeadQcException {

	private static final long serialVersionUID = -1928004637207714536L;

	private final String check;

	public AlignmentException(String check, String msg, Object... args) {
		super(QcStage.Alignment, "Alignment check '" + check + "' failed: " + msg, args);
		this.check = check;
	}

	public String getCheck() {
		return check;
	}
}
