package com.brewuv.runner;

import java.util.List;

/**
 * Per-section and per-day outcome list of a batch, sections in completion order.
 */
public final class BatchReport {
    public final List<JobOutcome> outcomes;
    public final List<DayOutcome> skippedDays;

    public BatchReport(List<JobOutcome> outcomes, List<DayOutcome> skippedDays) {
        this.outcomes = List.copyOf(outcomes);
        this.skippedDays = List.copyOf(skippedDays);
    }

    public long succeeded() {
        return outcomes.stream().filter(JobOutcome::isSuccess).count();
    }

    public long failed() {
        return outcomes.size() - succeeded();
    }
}
