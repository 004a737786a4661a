package com.brewuv.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * Inputs actually used for one result, with the source each one came from.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class ResolvedParameters {
    public final double ozone;
    public final String ozoneSource;
    public final double albedo;
    public final double alpha;
    public final double beta;
    public final String parameterSource;
    public final Double cloudCover;
    public final CloudSource cloudSource;
    public final StraylightCorrection straylightCorrection;
    /** Ozone source whose brewer model decided the straylight setting, or {@code straylight.default}. */
    public final String straylightSource;
}
