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

public class BeadQcException extends RuntimeException {

	private static final long serialVersionUID = 4861023915530297718L;

	private final QcStage stage;
	private String plateId;

	public BeadQcException(QcStage stage, String msg) {
		super(msg);
		this.stage = stage;
	}

	public BeadQcException(QcStage stage, String msg, Object... args) {
		super(String.format(msg, args));
		this.stage = stage;
	}

	public QcStage getStage() {
		return stage;
	}

	public String getPlateId() {
		return plateId;
	}

	/**
	 * Attach the plate on which the error occurred, if it is not known yet.
	 */
	public BeadQcException forPlate(String plateId) {
		if (this.plateId == null) this.plateId = plateId;
		return this;
	}

	@Override
	public String getMessage() {
		if (plateId == null) return super.getMessage();
		return String.format("%s [plate %s]", super.getMessage(), plateId);
	}
}
