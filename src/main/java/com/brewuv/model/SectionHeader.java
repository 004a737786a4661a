package com.brewuv.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class SectionHeader {
    public final String scanType;
    public final double integrationTime;
    public final double deadTime;
    public final int cycles;
    public final LocalDate date;
    public final String place;
    public final Position position;
    /** Instrument temperature in degrees Celsius. */
    public final double temperature;
    public final double pressure;
    public final double darkCount;
}
