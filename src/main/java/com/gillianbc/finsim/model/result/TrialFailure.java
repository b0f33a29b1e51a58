package com.gillianbc.finsim.model.result;

import com.gillianbc.finsim.exception.ErrorCode;
import com.gillianbc.finsim.exception.SimulationException;
import lombok.Getter;

@Getter
public class TrialFailure {

    private final int trialIndex;
    /** Year the trial failed in; null if it failed before the first year. */
    private final Integer year;
    private final ErrorCode errorCode;
    private final String message;

    public TrialFailure(int trialIndex, Integer year, ErrorCode errorCode, String message) {
        this.trialIndex = trialIndex;
        this.year = year;
        this.errorCode = errorCode;
        this.message = message;
    }

    public static TrialFailure of(int trialIndex, SimulationException cause) {
        return new TrialFailure(trialIndex, cause.getYear(), cause.getErrorCode(), cause.getMessage());
    }

    @Override
    public String toString() {
        return "trial " + trialIndex + (year == null ? "" : " in " + year) + ": " + errorCode.getCode() + " " + message;
    }
}
