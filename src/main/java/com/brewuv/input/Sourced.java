package com.brewuv.input;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * A resolved value and the name of the source that produced it.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
public final class Sourced<T> {
    public final T value;
    public final String source;
}
