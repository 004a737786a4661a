package com.brewuv.runner;

import com.brewuv.config.Config;
import com.brewuv.input.DataUnavailableException;
import com.brewuv.input.InputProviders;
import com.brewuv.input.InputSpec;
import com.brewuv.input.MeasurementInput;
import com.brewuv.parse.MalformedInputException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.regex.Matcher;

/**
 * Builds one job per measurement section.
 * <p>
 * The sections of every day are resolved eagerly, in parallel, to know how many jobs the day has.
 * Batch modes (date range, directory) also resolve calibration and angular response up front and skip
 * days where either is missing or broken; the skip is recorded in the batch.
 */
public final class JobFactory {
    private static final Logger log = LogManager.getLogger(JobFactory.class);

    private final Config config;
    private final InputProviders providers;
    private final int initThreads;

    public JobFactory(Config config, InputProviders providers) {
        this.config = config;
        this.providers = providers;
        int configured = config.getInt("init.threads", 0);
        this.initThreads = configured > 0 ? configured : JobScheduler.defaultPoolSize(config);
    }

    public JobBatch constructJobsFor(JobSelection selection) throws IOException {
        switch (selection.mode) {
            case FILES:
                return build(List.of(specForFiles(selection)), false);
            case DATE_RANGE:
                return build(specsForRange(selection), true);
            case DIRECTORY:
                return build(specsForDirectory(selection), true);
            default:
                throw new IllegalArgumentException("unsupported selection mode " + selection.mode);
        }
    }

    InputSpec specForFiles(JobSelection selection) {
        if (selection.uvFile == null) {
            throw new IllegalArgumentException("a UV file is required");
        }
        String name = selection.uvFile.getFileName().toString();
        Matcher m = InstrumentFileNames.UV.matcher(name);
        LocalDate date = m.matches() ? InstrumentFileNames.dateOf(m) : null;
        if (date == null) {
            throw new IllegalArgumentException("UV file name '" + name + "' does not follow UVdddyy.bid");
        }
        return InputSpec.builder()
                .brewerId(m.group("brewerId"))
                .date(date)
                .uvFile(selection.uvFile)
                .bFile(selection.bFile)
                .uvrFile(selection.uvrFile)
                .arfFile(selection.arfFile)
                .parameterFile(selection.parameterFile)
                .build();
    }

    List<InputSpec> specsForRange(JobSelection selection) throws IOException {
        if (selection.brewerId == null || selection.from == null || selection.to == null) {
            throw new IllegalArgumentException("a date range needs a brewer id, a start and an end date");
        }
        if (selection.to.isBefore(selection.from)) {
            throw new IllegalArgumentException("end date " + selection.to + " is before start date " + selection.from);
        }
        FileIndex index = index(selection);
        Path calibration = selection.uvrFile != null ? selection.uvrFile : index.calibrationFile(selection.brewerId);
        List<InputSpec> specs = new ArrayList<>();
        for (LocalDate date = selection.from; !date.isAfter(selection.to); date = date.plusDays(1)) {
            specs.add(specFromIndex(index, selection.brewerId, date, calibration));
        }
        return specs;
    }

    List<InputSpec> specsForDirectory(JobSelection selection) throws IOException {
        FileIndex index = index(selection);
        List<InputSpec> specs = new ArrayList<>();
        for (String brewerId : index.brewerIds()) {
            Path calibration = index.calibrationFile(brewerId);
            for (LocalDate date : index.uvDates(brewerId)) {
                specs.add(specFromIndex(index, brewerId, date, calibration));
            }
        }
        return specs;
    }

    private static InputSpec specFromIndex(FileIndex index, String brewerId, LocalDate date, Path calibration) {
        return InputSpec.builder()
                .brewerId(brewerId)
                .date(date)
                .uvFile(index.uvFile(brewerId, date))
                .bFile(index.bFile(brewerId, date))
                .uvrFile(calibration)
                .arfFile(index.arfFile(brewerId))
                .parameterFile(index.parameterFile(brewerId, date.getYear()))
                .build();
    }

    private FileIndex index(JobSelection selection) throws IOException {
        Path inputDir = selection.inputDir != null ? selection.inputDir : config.getPath("input.dir");
        return FileIndex.scan(inputDir,
                config.getString("input.instr_subdir", "instr"),
                config.getString("input.uvdata_subdir", "uvdata"));
    }

    private JobBatch build(List<InputSpec> specs, boolean checkInstrumentData) {
        if (specs.isEmpty()) {
            return new JobBatch(List.of(), List.of());
        }
        List<DayPreparation> prepared = new ArrayList<>(specs.size());
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(initThreads, specs.size()));
        CompletionService<DayPreparation> completion = new ExecutorCompletionService<>(pool);
        Map<Future<DayPreparation>, InputSpec> submitted = new IdentityHashMap<>();
        try {
            for (InputSpec spec : specs) {
                submitted.put(completion.submit(() -> prepare(spec, checkInstrumentData)), spec);
            }
            for (int i = 0; i < specs.size(); i++) {
                Future<DayPreparation> future = completion.take();
                try {
                    prepared.add(future.get());
                } catch (ExecutionException e) {
                    InputSpec spec = submitted.get(future);
                    Throwable cause = e.getCause() == null ? e : e.getCause();
                    log.error("skipping {} for brewer {}: preparation crashed", spec.date, spec.brewerId, cause);
                    prepared.add(DayPreparation.skipped(spec,
                            new DayOutcome(spec.brewerId, spec.date, "preparation crashed: " + cause, cause)));
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while preparing inputs", e);
        } finally {
            pool.shutdown();
        }

        prepared.sort(Comparator.comparing((DayPreparation p) -> p.spec.brewerId).thenComparing(p -> p.spec.date));
        List<CalculationJob> jobs = new ArrayList<>();
        List<DayOutcome> skipped = new ArrayList<>();
        for (DayPreparation day : prepared) {
            if (day.skip != null) {
                skipped.add(day.skip);
                continue;
            }
            for (int index = 0; index < day.sectionCount; index++) {
                jobs.add(new CalculationJob(day.input, index));
            }
        }
        log.info("constructed {} jobs for {} days ({} skipped)", jobs.size(), specs.size(), skipped.size());
        return new JobBatch(jobs, skipped);
    }

    private DayPreparation prepare(InputSpec spec, boolean checkInstrumentData) {
        MeasurementInput input = MeasurementInput.forDay(spec, providers);
        String stage = "sections";
        try {
            int count = input.sections().size();
            if (checkInstrumentData) {
                stage = "calibration";
                input.calibration();
                stage = "angular response";
                input.angularResponse();
            }
            return DayPreparation.ready(spec, input, count);
        } catch (DataUnavailableException | MalformedInputException e) {
            log.warn("skipping {} for brewer {}: {} ({})", spec.date, spec.brewerId, stage, e.getMessage());
            return DayPreparation.skipped(spec, new DayOutcome(spec.brewerId, spec.date, stage + ": " + e.getMessage(), e));
        } catch (RuntimeException e) {
            log.error("skipping {} for brewer {}: unexpected error reading {}", spec.date, spec.brewerId, stage, e);
            return DayPreparation.skipped(spec, new DayOutcome(spec.brewerId, spec.date, stage + ": " + e, e));
        }
    }

    private static final class DayPreparation {
        final InputSpec spec;
        final MeasurementInput input;
        final int sectionCount;
        final DayOutcome skip;

        private DayPreparation(InputSpec spec, MeasurementInput input, int sectionCount, DayOutcome skip) {
            this.spec = spec;
            this.input = input;
            this.sectionCount = sectionCount;
            this.skip = skip;
        }

        static DayPreparation ready(InputSpec spec, MeasurementInput input, int sectionCount) {
            return new DayPreparation(spec, input, sectionCount, null);
        }

        static DayPreparation skipped(InputSpec spec, DayOutcome skip) {
            return new DayPreparation(spec, null, 0, skip);
        }
    }
}
