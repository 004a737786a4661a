package com.brewuv.runner;

import com.brewuv.model.Result;

/**
 * Either the result of a job or its failure.
 */
public final class JobOutcome {
    public final CalculationJob job;
    public final Result result;
    public final JobFailure failure;

    private JobOutcome(CalculationJob job, Result result, JobFailure failure) {
        this.job = job;
        this.result = result;
        this.failure = failure;
    }

    public static JobOutcome success(CalculationJob job, Result result) {
        return new JobOutcome(job, result, null);
    }

    public static JobOutcome failed(CalculationJob job, JobFailure failure) {
        return new JobOutcome(job, null, failure);
    }

    public boolean isSuccess() {
        return failure == null;
    }
}
