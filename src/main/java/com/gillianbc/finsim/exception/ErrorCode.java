package com.gillianbc.finsim.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    INVALID_ALLOCATION("INVALID_ALLOCATION", true),
    UNKNOWN_JURISDICTION("UNKNOWN_JURISDICTION", true),
    UNKNOWN_GROWTH_CATEGORY("UNKNOWN_GROWTH_CATEGORY", true),
    EVENT_OUT_OF_RANGE("EVENT_OUT_OF_RANGE", true),
    MALFORMED_ACTION("MALFORMED_ACTION", true),
    INVALID_MODEL("INVALID_MODEL", true),
    INVALID_REFERENCE_DATA("INVALID_REFERENCE_DATA", true),
    NEGATIVE_ASSET_VALUE("NEGATIVE_ASSET_VALUE", false),
    UNKNOWN_TARGET("UNKNOWN_TARGET", false),
    TRIAL_ABORTED("TRIAL_ABORTED", false),
    INTERNAL_ERROR("INTERNAL_ERROR", false);

    private final String code;
    /** Configuration errors are raised before any trial runs. */
    private final boolean configuration;
}
