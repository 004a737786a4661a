package com.brewuv.core.diagnostics;

/**
 * Why a data source or remote provider could not deliver a value.
 */
public enum CauseCode {
    NONE,
    NOT_CONFIGURED,
    FILE_MISSING,
    NO_DATA,
    HTTP_ERROR,
    RATE_LIMITED,
    TIMEOUT,
    PARSE_ERROR,
    INTERRUPTED,
    RUNTIME_ERROR
}
