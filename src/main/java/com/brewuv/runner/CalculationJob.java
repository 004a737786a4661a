package com.brewuv.runner;

import com.brewuv.input.MeasurementInput;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * One section of one day. Jobs of the same day share the day's input.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
public final class CalculationJob {
    public final MeasurementInput input;
    public final int sectionIndex;

    public String id() {
        return input.brewerId() + "/" + input.date() + "#" + sectionIndex;
    }
}
