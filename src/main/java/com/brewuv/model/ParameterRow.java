package com.brewuv.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * Site parameters for one day of year. {@code cloudCover} is null when the row has none.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class ParameterRow {
    public final int day;
    public final double albedo;
    public final double alpha;
    public final double beta;
    public final Double cloudCover;
}
