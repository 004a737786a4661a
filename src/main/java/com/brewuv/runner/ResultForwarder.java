package com.brewuv.runner;

import com.brewuv.output.OutputArtifacts;
import com.brewuv.output.OutputStage;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Hands successful results to the output stage as they complete.
 */
public final class ResultForwarder implements JobListener {
    private final OutputStage outputStage;
    private final List<CompletableFuture<OutputArtifacts>> pending = new CopyOnWriteArrayList<>();

    public ResultForwarder(OutputStage outputStage) {
        this.outputStage = outputStage;
    }

    @Override
    public void onOutcome(JobOutcome outcome) {
        if (outcome.isSuccess()) {
            pending.add(outputStage.submit(outcome.result));
        }
    }

    public List<CompletableFuture<OutputArtifacts>> pending() {
        return List.copyOf(pending);
    }
}
