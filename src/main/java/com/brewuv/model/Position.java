package com.brewuv.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Instrument position. Longitude follows the Brewer convention: positive west of Greenwich.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
public final class Position {
    public final double latitude;
    public final double longitude;
}
