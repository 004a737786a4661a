package com.brewuv.output;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.nio.file.Path;
import java.util.List;

/**
 * Files written for one result.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
public final class OutputArtifacts {
    public final String resultId;
    public final List<Path> files;

    public static OutputArtifacts none(String resultId) {
        return new OutputArtifacts(resultId, List.of());
    }
}
