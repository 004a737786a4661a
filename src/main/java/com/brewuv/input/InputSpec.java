package com.brewuv.input;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.time.LocalDate;

/**
 * Identifies the inputs of one (day, instrument) pair. File paths may be null when no local file exists.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class InputSpec {
    public final String brewerId;
    public final LocalDate date;
    public final Path uvFile;
    public final Path bFile;
    public final Path uvrFile;
    public final Path arfFile;
    public final Path parameterFile;

    public String label() {
        return date + "/" + brewerId;
    }
}
