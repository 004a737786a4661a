package com.brewuv.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Calibrated and cosine corrected spectrum of one section.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class Result {
    public final int sectionIndex;
    public final String brewerId;
    public final LocalDate date;
    public final SectionHeader header;
    /** Solar zenith angle in degrees at the first sample. */
    public final double solarZenithAngle;
    public final double airMass;
    public final double temperatureCorrection;
    public final Spectrum spectrum;
    public final ResolvedParameters parameters;
    public final CosCorrection cosCorrection;
}
