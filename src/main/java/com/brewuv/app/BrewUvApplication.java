package com.brewuv.app;

import com.brewuv.calc.IrradianceCalculation;
import com.brewuv.config.Config;
import com.brewuv.input.InputProviders;
import com.brewuv.output.LogOutputSink;
import com.brewuv.output.OutputStage;
import com.brewuv.runner.BatchReport;
import com.brewuv.runner.DayOutcome;
import com.brewuv.runner.JobBatch;
import com.brewuv.runner.JobFactory;
import com.brewuv.runner.JobOutcome;
import com.brewuv.runner.JobScheduler;
import com.brewuv.runner.JobSelection;
import com.brewuv.runner.ResultForwarder;
import com.brewuv.solver.LibradtranSolver;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.io.IoBuilder;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;

public final class BrewUvApplication {
    private static volatile boolean LOG_ROUTE_INSTALLED = false;

    public static void main(String[] args) {
        int exit = new BrewUvApplication().run(args);
        System.exit(exit);
    }

    public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (Exception e) {
            new HelpFormatter().printHelp("brewuv", options);
            System.err.println("ERROR: " + e.getMessage());
            return 2;
        }

        if (cmd.hasOption("help")) {
            new HelpFormatter().printHelp("brewuv", options);
            return 0;
        }

        Path workingDir = Path.of(".").toAbsolutePath().normalize();
        JobSelection selection;
        try {
            selection = selectionFrom(cmd, workingDir);
        } catch (IllegalArgumentException | DateTimeParseException e) {
            new HelpFormatter().printHelp("brewuv", options);
            System.err.println("ERROR: " + e.getMessage());
            return 2;
        }

        try {
            Config config = Config.load(workingDir);
            installLogRoutingIfNeeded(config);
            return runSelection(config, selection);
        } catch (Exception e) {
            System.err.println("FATAL: " + e.getMessage());
            e.printStackTrace();
            return 1;
        }
    }

    private int runSelection(Config config, JobSelection selection) throws Exception {
        Logger log = LogManager.getLogger(BrewUvApplication.class);
        Instant started = Instant.now();

        InputProviders providers = InputProviders.fromConfig(config);
        JobBatch batch = new JobFactory(config, providers).constructJobsFor(selection);
        IrradianceCalculation calculation = IrradianceCalculation.fromConfig(config, new LibradtranSolver(config));
        JobScheduler scheduler = JobScheduler.fromConfig(config, calculation);

        BatchReport report;
        try (OutputStage outputStage = OutputStage.fromConfig(config, new LogOutputSink())) {
            report = scheduler.run(batch, new ResultForwarder(outputStage));
        }

        for (DayOutcome day : report.skippedDays) {
            log.warn("skipped brewer={} date={}: {}", day.brewerId, day.date, day.reason);
        }
        for (JobOutcome outcome : report.outcomes) {
            if (!outcome.isSuccess()) {
                log.warn("failed {} while {}: {}", outcome.failure.jobId, outcome.failure.state, outcome.failure.message());
            }
        }
        log.info("done mode={} jobs={} succeeded={} failed={} skippedDays={} elapsed={}s",
                selection.mode,
                report.outcomes.size(),
                report.succeeded(),
                report.failed(),
                report.skippedDays.size(),
                Duration.between(started, Instant.now()).toSeconds());
        return 0;
    }

    static JobSelection selectionFrom(CommandLine cmd, Path workingDir) {
        if (cmd.hasOption("uv")) {
            return JobSelection.files(
                    path(cmd, "uv", workingDir),
                    path(cmd, "b", workingDir),
                    path(cmd, "uvr", workingDir),
                    path(cmd, "arf", workingDir),
                    path(cmd, "par", workingDir));
        }
        if (cmd.hasOption("brewer") || cmd.hasOption("from") || cmd.hasOption("to")) {
            String brewer = cmd.getOptionValue("brewer");
            String from = cmd.getOptionValue("from");
            if (brewer == null || from == null) {
                throw new IllegalArgumentException("--brewer and --from are required for a date range");
            }
            LocalDate start = LocalDate.parse(from.trim());
            String to = cmd.getOptionValue("to");
            LocalDate end = to == null ? start : LocalDate.parse(to.trim());
            return JobSelection.dateRange(brewer.trim(), start, end);
        }
        if (cmd.hasOption("scan")) {
            String dir = cmd.getOptionValue("scan");
            return JobSelection.directory(dir == null ? null : workingDir.resolve(dir.trim()).normalize());
        }
        throw new IllegalArgumentException("one of --uv, --brewer/--from or --scan is required");
    }

    private static Path path(CommandLine cmd, String option, Path workingDir) {
        String raw = cmd.getOptionValue(option);
        if (raw == null || raw.trim().isEmpty()) {
            return null;
        }
        return workingDir.resolve(raw.trim()).normalize();
    }

    private void installLogRoutingIfNeeded(Config config) {
        if (LOG_ROUTE_INSTALLED) {
            return;
        }
        synchronized (BrewUvApplication.class) {
            if (LOG_ROUTE_INSTALLED) {
                return;
            }
            try {
                Path logDir = config.getPath("outputs.dir").resolve("log");
                Files.createDirectories(logDir);
                System.setProperty("brewuv.log.dir", logDir.toAbsolutePath().toString());

                // Log4j must start before the streams are replaced so the console appender keeps the real stdout.
                LogManager.getLogger(BrewUvApplication.class);
                System.setOut(IoBuilder.forLogger("STDOUT").setLevel(Level.INFO).buildPrintStream());
                System.setErr(IoBuilder.forLogger("STDERR").setLevel(Level.ERROR).buildPrintStream());

                LOG_ROUTE_INSTALLED = true;
                System.out.println("Log4j routing enabled. dir=" + logDir.toAbsolutePath());
            } catch (Exception e) {
                System.err.println("WARN: failed to initialize log4j routing: " + e.getMessage());
            }
        }
    }

    static Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder().longOpt("uv").hasArg().argName("file").desc("Raw UV file (UVdddyy.bid)").build());
        options.addOption(Option.builder().longOpt("b").hasArg().argName("file").desc("Ozone file (Bdddyy.bid)").build());
        options.addOption(Option.builder().longOpt("uvr").hasArg().argName("file").desc("Calibration file (UVRdddyy.bid)").build());
        options.addOption(Option.builder().longOpt("arf").hasArg().argName("file").desc("Angular response file").build());
        options.addOption(Option.builder().longOpt("par").hasArg().argName("file").desc("Parameter file (par_yy.bid)").build());
        options.addOption(Option.builder().longOpt("brewer").hasArg().argName("id").desc("Brewer id for a date range").build());
        options.addOption(Option.builder().longOpt("from").hasArg().argName("yyyy-MM-dd").desc("First day of the range").build());
        options.addOption(Option.builder().longOpt("to").hasArg().argName("yyyy-MM-dd").desc("Last day of the range (default: --from)").build());
        options.addOption(Option.builder().longOpt("scan").hasArg().optionalArg(true).argName("dir")
                .desc("Process every UV file under dir (default: config input.dir)").build());
        options.addOption(Option.builder("h").longOpt("help").desc("Show help").build());
        return options;
    }
}
