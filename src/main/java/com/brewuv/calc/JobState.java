package com.brewuv.calc;

/**
 * Progress of one section calculation.
 */
public enum JobState {
    PENDING,
    RESOLVING_INPUTS,
    CALIBRATING,
    SOLVING,
    CORRECTING,
    DONE,
    FAILED
}
