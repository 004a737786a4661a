package com.brewuv.solver;

import com.brewuv.model.Position;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * Geometry and atmosphere of one solver run. The output grid runs from {@code firstWavelength}
 * to {@code lastWavelength} in steps of {@code wavelengthStep}, {@code wavelengthCount} points.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class SolverRequest {
    public final double firstWavelength;
    public final double lastWavelength;
    public final double wavelengthStep;
    public final int wavelengthCount;
    public final Position position;
    /** UTC time of the first sample. */
    public final LocalDateTime time;
    public final double pressure;
    public final double ozone;
    public final double albedo;
    public final double alpha;
    public final double beta;
}
