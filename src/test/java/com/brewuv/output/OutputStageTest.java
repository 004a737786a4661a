package com.brewuv.output;

import com.brewuv.model.Result;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

class OutputStageTest {

    @Test
    void writesResultsOnItsOwnPool() throws Exception {
        OutputSink sink = result -> new OutputArtifacts(OutputStage.resultId(result), List.of(Path.of("out", "a.csv")));

        try (OutputStage stage = new OutputStage(sink, 2)) {
            OutputArtifacts artifacts = stage.submit(result(4)).get(5, TimeUnit.SECONDS);

            assertEquals("033/2019-06-22/4", artifacts.resultId);
            assertEquals(1, artifacts.files.size());
            assertEquals(2, stage.threads());
        }
    }

    @Test
    void writerFailureCompletesFutureExceptionally() {
        OutputSink failing = result -> {
            throw new IOException("disk full");
        };

        try (OutputStage stage = new OutputStage(failing, 1)) {
            CompletableFuture<OutputArtifacts> future = stage.submit(result(0));

            ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
            assertInstanceOf(UncheckedIOException.class, e.getCause());
        }
    }

    private static Result result(int sectionIndex) {
        return Result.builder().brewerId("033").date(LocalDate.of(2019, 6, 22)).sectionIndex(sectionIndex).build();
    }
}
