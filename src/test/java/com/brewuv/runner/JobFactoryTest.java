package com.brewuv.runner;

import com.brewuv.Fixtures;
import com.brewuv.config.Config;
import com.brewuv.core.diagnostics.Outcome;
import com.brewuv.data.EubrewnetClient;
import com.brewuv.input.DataUnavailableException;
import com.brewuv.input.InputProviders;
import com.brewuv.model.MeasurementSection;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobFactoryTest {

    @TempDir
    Path workingDir;

    @Test
    void explicitFilesGiveOneJobPerSection() throws Exception {
        JobBatch batch = factory(Map.of()).constructJobsFor(JobSelection.files(
                Fixtures.resource("input/uvdata/UV17319.033"),
                Fixtures.resource("input/uvdata/B17319.033"),
                Fixtures.resource("input/instr/UVR17319.033"),
                Fixtures.resource("input/instr/arf_033.dat"),
                null));

        assertEquals(3, batch.size());
        assertTrue(batch.skippedDays.isEmpty());
        assertEquals(List.of("033/2019-06-22#0", "033/2019-06-22#1", "033/2019-06-22#2"), ids(batch));
        assertSame(batch.jobs.get(0).input, batch.jobs.get(2).input);
    }

    @Test
    void explicitUvFileMustFollowNamingConvention() throws Exception {
        Path oddName = Files.copy(Fixtures.resource("input/uvdata/UV17319.033"), workingDir.resolve("scan.txt"));

        assertThrows(IllegalArgumentException.class,
                () -> factory(Map.of()).constructJobsFor(JobSelection.files(oddName, null, null, null, null)));
    }

    @Test
    void directoryScanFindsEveryDay() throws Exception {
        JobBatch batch = factory(Map.of()).constructJobsFor(JobSelection.directory(Fixtures.inputDir()));

        assertEquals(3, batch.size());
        assertTrue(batch.skippedDays.isEmpty());
    }

    @Test
    void dateRangeSkipsDaysWithoutMeasurements() throws Exception {
        JobBatch batch = factory(Map.of("input.dir", Fixtures.inputDir().toString()))
                .constructJobsFor(JobSelection.dateRange("033", LocalDate.of(2019, 6, 21), LocalDate.of(2019, 6, 23)));

        assertEquals(3, batch.size());
        assertEquals(2, batch.skippedDays.size());
        DayOutcome skipped = batch.skippedDays.get(0);
        assertEquals(LocalDate.of(2019, 6, 21), skipped.date);
        assertInstanceOf(DataUnavailableException.class, skipped.cause);
        assertEquals(LocalDate.of(2019, 6, 23), batch.skippedDays.get(1).date);
    }

    @Test
    void dayWithoutCalibrationIsSkipped() throws Exception {
        Path input = copyInputTree("UVR17319.033");

        JobBatch batch = factory(Map.of()).constructJobsFor(JobSelection.directory(input));

        assertEquals(0, batch.size());
        assertEquals(1, batch.skippedDays.size());
        assertTrue(batch.skippedDays.get(0).reason.startsWith("calibration"));
    }

    @Test
    void dayWithoutAngularResponseIsSkipped() throws Exception {
        Path input = copyInputTree("arf_033.dat");

        JobBatch batch = factory(Map.of()).constructJobsFor(JobSelection.directory(input));

        assertEquals(0, batch.size());
        assertEquals(1, batch.skippedDays.size());
        assertTrue(batch.skippedDays.get(0).reason.startsWith("angular response"));
    }

    @Test
    void malformedUvFileSkipsTheDay() throws Exception {
        Path input = copyInputTree(null);
        Files.writeString(input.resolve("uvdata").resolve("UV17319.033"), "garbage\n");

        JobBatch batch = factory(Map.of()).constructJobsFor(JobSelection.directory(input));

        assertEquals(0, batch.size());
        assertTrue(batch.skippedDays.get(0).reason.startsWith("sections"));
    }

    @Test
    void dayWhosePreparationThrowsAnErrorIsStillReported() throws Exception {
        Config config = config(Map.of("input.dir", Fixtures.inputDir().toString()));
        EubrewnetClient crashing = new EubrewnetClient(config) {
            @Override
            public Outcome<List<MeasurementSection>> fetchSections(String brewerId, LocalDate date) {
                throw new AssertionError("decoder state corrupted");
            }
        };
        JobFactory factory = new JobFactory(config, new InputProviders(config, crashing, null));

        JobBatch batch = factory.constructJobsFor(
                JobSelection.dateRange("033", LocalDate.of(2019, 6, 21), LocalDate.of(2019, 6, 22)));

        assertEquals(3, batch.size());
        assertEquals(1, batch.skippedDays.size());
        DayOutcome crashed = batch.skippedDays.get(0);
        assertEquals(LocalDate.of(2019, 6, 21), crashed.date);
        assertInstanceOf(AssertionError.class, crashed.cause);
        assertTrue(crashed.reason.startsWith("preparation crashed"));
    }

    @Test
    void invalidRangeIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> factory(Map.of()).constructJobsFor(
                JobSelection.dateRange("033", LocalDate.of(2019, 6, 23), LocalDate.of(2019, 6, 21))));
    }

    private JobFactory factory(Map<String, ?> overrides) {
        Config config = config(overrides);
        return new JobFactory(config, InputProviders.fromConfig(config));
    }

    private Config config(Map<String, ?> overrides) {
        Map<String, Object> props = new HashMap<>(overrides);
        props.put("init.threads", "2");
        return Config.fromConfigurationProperties(workingDir, props);
    }

    private Path copyInputTree(String omit) throws IOException {
        Path target = workingDir.resolve("input");
        Path source = Fixtures.inputDir();
        for (String sub : List.of("instr", "uvdata")) {
            Files.createDirectories(target.resolve(sub));
            try (Stream<Path> files = Files.list(source.resolve(sub))) {
                for (Path file : files.collect(Collectors.toList())) {
                    if (!file.getFileName().toString().equals(omit)) {
                        Files.copy(file, target.resolve(sub).resolve(file.getFileName()));
                    }
                }
            }
        }
        return target;
    }

    private static List<String> ids(JobBatch batch) {
        return batch.jobs.stream().map(CalculationJob::id).collect(Collectors.toList());
    }
}
