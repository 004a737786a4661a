package com.brewuv.runner;

import java.util.List;

/**
 * Jobs ready to run plus the days skipped while building them.
 */
public final class JobBatch {
    public final List<CalculationJob> jobs;
    public final List<DayOutcome> skippedDays;

    public JobBatch(List<CalculationJob> jobs, List<DayOutcome> skippedDays) {
        this.jobs = jobs == null ? List.of() : List.copyOf(jobs);
        this.skippedDays = skippedDays == null ? List.of() : List.copyOf(skippedDays);
    }

    public int size() {
        return jobs.size();
    }
}
