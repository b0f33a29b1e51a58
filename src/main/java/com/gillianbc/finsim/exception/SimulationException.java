package com.gillianbc.finsim.exception;

import lombok.Getter;

import java.util.Map;

/**
 * Raised while a trial is running. Fatal to that trial only; the orchestrator records it
 * against the trial index and keeps going with the other trials.
 */
@Getter
public class SimulationException extends BaseException {

    /** Simulation year in which the failure happened, or null when not yet known. */
    private final Integer year;

    public SimulationException(ErrorCode errorCode, String message) {
        super(errorCode, message, null, null);
        this.year = null;
    }

    public SimulationException(ErrorCode errorCode, String message, int year) {
        super(errorCode, message, Map.of("year", year), null);
        this.year = year;
    }

    public SimulationException(ErrorCode errorCode, String message, int year, Throwable cause) {
        super(errorCode, message, Map.of("year", year), cause);
        this.year = year;
    }

    public SimulationException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, null, cause);
        this.year = null;
    }
}
