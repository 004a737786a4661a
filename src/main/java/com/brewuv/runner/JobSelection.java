package com.brewuv.runner;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.time.LocalDate;

/**
 * What to calculate. Directory watching is done outside this package by calling {@link #files} per new UV file.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class JobSelection {

    public enum Mode {
        /** One day from explicitly given files. */
        FILES,
        /** All days between two dates for one instrument. */
        DATE_RANGE,
        /** Every UV file found under the input directory. */
        DIRECTORY
    }

    public final Mode mode;
    public final Path uvFile;
    public final Path bFile;
    public final Path uvrFile;
    public final Path arfFile;
    public final Path parameterFile;
    public final String brewerId;
    public final LocalDate from;
    public final LocalDate to;
    /** Input directory for DATE_RANGE and DIRECTORY; null means the configured one. */
    public final Path inputDir;

    public static JobSelection files(Path uvFile, Path bFile, Path uvrFile, Path arfFile, Path parameterFile) {
        return JobSelection.builder()
                .mode(Mode.FILES)
                .uvFile(uvFile)
                .bFile(bFile)
                .uvrFile(uvrFile)
                .arfFile(arfFile)
                .parameterFile(parameterFile)
                .build();
    }

    public static JobSelection dateRange(String brewerId, LocalDate from, LocalDate to) {
        return JobSelection.builder().mode(Mode.DATE_RANGE).brewerId(brewerId).from(from).to(to).build();
    }

    public static JobSelection directory(Path inputDir) {
        return JobSelection.builder().mode(Mode.DIRECTORY).inputDir(inputDir).build();
    }
}
