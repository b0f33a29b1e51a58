package com.gillianbc.finsim.exception;

import java.util.Map;

/**
 * Invalid model or reference data. Always raised while building or validating,
 * never once a trial has started.
 */
public class ConfigurationException extends BaseException {

    public ConfigurationException(ErrorCode errorCode, String message) {
        super(errorCode, message, null, null);
    }

    public ConfigurationException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(errorCode, message, details, null);
    }
}
