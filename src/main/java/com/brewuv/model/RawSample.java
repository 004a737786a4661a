package com.brewuv.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * One measured point of a scan: time in minutes since midnight, wavelength in nm.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
public final class RawSample {
    public final double time;
    public final double wavelength;
    public final int step;
    public final double events;

    public double std() {
        return events > 0 ? 1.0 / Math.sqrt(events) : 0.0;
    }
}
