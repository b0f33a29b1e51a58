package com.gillianbc.finsim.exception;

import lombok.Getter;

import java.util.Map;
import java.util.Objects;

/**
 * Root of the simulator's failures. {@code details} holds structured context for callers,
 * such as the offending jurisdiction or the simulation year.
 */
@Getter
public abstract class BaseException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode must not be null");
        this.details = details == null ? Map.of() : Map.copyOf(details);
    }

    @Override
    public String toString() {
        return "[" + errorCode.getCode() + "] " + getMessage();
    }
}
