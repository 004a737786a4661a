package com.brewuv.runner;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.LocalDate;

/**
 * A day that produced no jobs, with the reason.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
public final class DayOutcome {
    public final String brewerId;
    public final LocalDate date;
    public final String reason;
    public final Throwable cause;
}
