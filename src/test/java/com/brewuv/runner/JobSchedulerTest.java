package com.brewuv.runner;

import com.brewuv.Fixtures;
import com.brewuv.calc.CloudCoverResolver;
import com.brewuv.calc.CosineCorrection;
import com.brewuv.calc.IrradianceCalculation;
import com.brewuv.calc.JobState;
import com.brewuv.calc.SpectrumCalibrator;
import com.brewuv.calc.ThresholdCorrectionPolicy;
import com.brewuv.config.Config;
import com.brewuv.input.MeasurementInput;
import com.brewuv.model.StraylightCorrection;
import com.brewuv.solver.IrradianceSolver;
import com.brewuv.solver.SolverException;
import com.brewuv.solver.SolverRequest;
import com.brewuv.solver.SolverResult;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobSchedulerTest {

    @Test
    void defaultPoolIsCoresPlusFourCappedAtTwenty() {
        int cores = Runtime.getRuntime().availableProcessors();

        assertEquals(Math.min(cores + 4, 20), JobScheduler.defaultPoolSize(Config.defaults()));
        assertEquals(Math.min(cores + 4, 20), JobScheduler.fromConfig(Config.defaults(), null).poolSize());
    }

    @Test
    void configuredThreadCountWins() {
        Config config = Config.fromConfigurationProperties(Path.of("."), Map.of("scan.threads", "3"));

        assertEquals(3, JobScheduler.fromConfig(config, null).poolSize());
    }

    @Test
    void concurrencyNeverExceedsPoolSize() {
        int poolSize = JobScheduler.defaultPoolSize(Config.defaults());
        ConcurrencyProbe solver = new ConcurrencyProbe();
        JobBatch batch = batch(Fixtures.input(Fixtures.sections(poolSize * 3)));

        BatchReport report = new JobScheduler(calculation(solver), poolSize).run(batch, JobListener.NONE);

        assertEquals(batch.size(), report.outcomes.size());
        assertEquals(batch.size(), report.succeeded());
        assertTrue(solver.maxActive.get() <= poolSize, "max active " + solver.maxActive.get());
        assertTrue(solver.maxActive.get() >= 1);
    }

    @Test
    void failingSectionDoesNotAffectOthers() {
        IrradianceSolver solver = request -> {
            if (request.time.getMinute() == 10) {
                throw new SolverException("uvspec exited with code 1");
            }
            return Fixtures.solved(request, 40.0);
        };
        JobBatch batch = batch(Fixtures.input(Fixtures.sections(3)));
        List<JobOutcome> seen = new ArrayList<>();

        BatchReport report = new JobScheduler(calculation(solver), 2).run(batch, seen::add);

        assertEquals(3, report.outcomes.size());
        assertEquals(2, report.succeeded());
        assertEquals(1, report.failed());
        assertEquals(3, seen.size());
        JobOutcome failed = report.outcomes.stream().filter(o -> !o.isSuccess()).findFirst().orElseThrow();
        assertEquals("033/2019-06-22#1", failed.failure.jobId);
        assertEquals(JobState.SOLVING, failed.failure.state);
        assertInstanceOf(SolverException.class, failed.failure.cause);
        assertTrue(failed.failure.message().contains("code 1"));
    }

    @Test
    void jobThrowingAnErrorIsReportedAsFailed() {
        IrradianceSolver solver = request -> {
            throw new AssertionError("solver state corrupted");
        };
        JobBatch batch = batch(Fixtures.input(Fixtures.sections(3)));
        List<JobOutcome> seen = new ArrayList<>();

        BatchReport report = new JobScheduler(calculation(solver), 2).run(batch, seen::add);

        assertEquals(3, report.outcomes.size());
        assertEquals(3, report.failed());
        assertEquals(3, seen.size());
        for (JobOutcome outcome : report.outcomes) {
            assertEquals(JobState.FAILED, outcome.failure.state);
            assertInstanceOf(AssertionError.class, outcome.failure.cause);
            assertEquals(outcome.job.id(), outcome.failure.jobId);
        }
    }

    @Test
    void listenerFailureDoesNotStopTheBatch() {
        JobBatch batch = batch(Fixtures.input(Fixtures.sections(2)));
        AtomicInteger calls = new AtomicInteger();

        BatchReport report = new JobScheduler(calculation(request -> Fixtures.solved(request, 40.0)), 2).run(batch, outcome -> {
            calls.incrementAndGet();
            throw new IllegalStateException("listener broke");
        });

        assertEquals(2, calls.get());
        assertEquals(2, report.succeeded());
    }

    @Test
    void emptyBatchKeepsSkippedDays() {
        DayOutcome skipped = new DayOutcome("033", Fixtures.DAY, "sections: unavailable", null);

        BatchReport report = new JobScheduler(calculation(request -> Fixtures.solved(request, 40.0)), 2)
                .run(new JobBatch(List.of(), List.of(skipped)), null);

        assertTrue(report.outcomes.isEmpty());
        assertEquals(List.of(skipped), report.skippedDays);
        assertFalse(report.skippedDays.isEmpty());
    }

    static JobBatch batch(MeasurementInput input) {
        List<CalculationJob> jobs = new ArrayList<>();
        for (int i = 0; i < input.sections().size(); i++) {
            jobs.add(new CalculationJob(input, i));
        }
        return new JobBatch(jobs, List.of());
    }

    static IrradianceCalculation calculation(IrradianceSolver solver) {
        return new IrradianceCalculation(
                solver,
                new SpectrumCalibrator(0, 292.0, 0.0, 0.0, StraylightCorrection.APPLIED),
                new CosineCorrection(CosineCorrection.DEFAULT_INTEGRATION_STEPS),
                new ThresholdCorrectionPolicy(0.9),
                new CloudCoverResolver(true, 0.0),
                300.0);
    }

    private static final class ConcurrencyProbe implements IrradianceSolver {
        final AtomicInteger active = new AtomicInteger();
        final AtomicInteger maxActive = new AtomicInteger();

        @Override
        public SolverResult solve(SolverRequest request) throws SolverException {
            int now = active.incrementAndGet();
            maxActive.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(20);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new SolverException("interrupted", e);
            } finally {
                active.decrementAndGet();
            }
            return Fixtures.solved(request, 40.0);
        }
    }
}
