package com.brewuv.model;

/**
 * Where the cloud cover used for a result came from.
 */
public enum CloudSource {
    PARAMETER_FILE,
    CLOUD_SERVICE,
    DEFAULT,
    NONE
}
