package com.brewuv.runner;

import com.brewuv.calc.IrradianceCalculation;
import com.brewuv.calc.JobState;
import com.brewuv.calc.StateTracker;
import com.brewuv.config.Config;
import com.brewuv.model.Result;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs calculation jobs on a fixed worker pool and collects one outcome per job.
 * <p>
 * A failing job is recorded with the stage it failed in; the remaining jobs keep running.
 */
public final class JobScheduler {
    private static final Logger log = LogManager.getLogger(JobScheduler.class);

    private final IrradianceCalculation calculation;
    private final int poolSize;

    public JobScheduler(IrradianceCalculation calculation, int poolSize) {
        this.calculation = calculation;
        this.poolSize = Math.max(1, poolSize);
    }

    public static JobScheduler fromConfig(Config config, IrradianceCalculation calculation) {
        int configured = config.getInt("scan.threads", 0);
        return new JobScheduler(calculation, configured > 0 ? configured : defaultPoolSize(config));
    }

    /**
     * Cores plus a few extra threads for the solver processes, capped.
     */
    public static int defaultPoolSize(Config config) {
        int cores = Runtime.getRuntime().availableProcessors();
        int extra = Math.max(0, config.getInt("scan.threads.extra", 4));
        int max = Math.max(1, config.getInt("scan.threads.max", 20));
        return Math.max(1, Math.min(cores + extra, max));
    }

    public int poolSize() {
        return poolSize;
    }

    public BatchReport run(JobBatch batch, JobListener listener) {
        JobListener sink = listener == null ? JobListener.NONE : listener;
        List<JobOutcome> outcomes = new ArrayList<>(batch.size());
        if (batch.jobs.isEmpty()) {
            return new BatchReport(outcomes, batch.skippedDays);
        }

        int threads = Math.min(poolSize, batch.size());
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CompletionService<JobOutcome> completion = new ExecutorCompletionService<>(pool);
        log.info("running {} jobs on {} threads", batch.size(), threads);
        Map<Future<JobOutcome>, CalculationJob> submitted = new IdentityHashMap<>();
        try {
            for (CalculationJob job : batch.jobs) {
                submitted.put(completion.submit(() -> execute(job)), job);
            }
            for (int i = 0; i < batch.size(); i++) {
                Future<JobOutcome> future = completion.take();
                JobOutcome outcome;
                try {
                    outcome = future.get();
                } catch (ExecutionException e) {
                    // execute() catches everything but Errors
                    CalculationJob job = submitted.get(future);
                    Throwable cause = e.getCause() == null ? e : e.getCause();
                    log.error("job {} crashed", job.id(), cause);
                    outcome = JobOutcome.failed(job, new JobFailure(job.id(), JobState.FAILED, cause));
                }
                outcomes.add(outcome);
                if (!outcome.isSuccess()) {
                    log.warn("job {} failed while {}: {}", outcome.failure.jobId, outcome.failure.state, outcome.failure.message());
                }
                try {
                    sink.onOutcome(outcome);
                } catch (RuntimeException e) {
                    log.error("listener failed for job {}: {}", outcome.job.id(), e.getMessage());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("interrupted, {} of {} jobs collected", outcomes.size(), batch.size());
            pool.shutdownNow();
        } finally {
            pool.shutdown();
        }
        return new BatchReport(outcomes, batch.skippedDays);
    }

    JobOutcome execute(CalculationJob job) {
        StateTracker tracker = new StateTracker();
        try {
            Result result = calculation.calculate(job.input, job.sectionIndex, tracker);
            return JobOutcome.success(job, result);
        } catch (Exception e) {
            return JobOutcome.failed(job, new JobFailure(job.id(), tracker.current(), e));
        }
    }
}
