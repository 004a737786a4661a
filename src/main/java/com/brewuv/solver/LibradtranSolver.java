package com.brewuv.solver;

import com.brewuv.config.Config;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs libRadtran's {@code uvspec} as an external process.
 * <p>
 * The input file is written to a temporary file fed on stdin; stdout is collected in a second temporary file.
 * Both files are removed and the process is killed on every exit path.
 */
public final class LibradtranSolver implements IrradianceSolver {
    private static final Logger log = LogManager.getLogger(LibradtranSolver.class);
    private static final List<String> OUTPUT_COLUMNS = List.of("sza", "edir", "edn", "eglo");

    private final List<String> command;
    private final String dataFilesPath;
    private final Path tmpDir;
    private final long timeoutSec;

    public LibradtranSolver(Config config) {
        this(
                Arrays.asList(config.getString("solver.command", "uvspec").trim().split("\\s+")),
                config.getString("solver.data_files_path", "/opt/libRadtran/data/"),
                config.getPath("tmp.dir"),
                config.getLong("solver.timeout_sec", 40L)
        );
    }

    public LibradtranSolver(List<String> command, String dataFilesPath, Path tmpDir, long timeoutSec) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("solver command is empty");
        }
        this.command = List.copyOf(command);
        this.dataFilesPath = dataFilesPath.endsWith("/") ? dataFilesPath : dataFilesPath + "/";
        this.tmpDir = tmpDir;
        this.timeoutSec = Math.max(1L, timeoutSec);
    }

    @Override
    public SolverResult solve(SolverRequest request) throws SolverException {
        if (request.wavelengthCount < 2) {
            throw new SolverException("at least 2 wavelengths are needed, got " + request.wavelengthCount);
        }
        Path input = null;
        Path output = null;
        Path errors = null;
        Process process = null;
        try {
            Files.createDirectories(tmpDir);
            input = Files.createTempFile(tmpDir, "input_", ".in");
            output = Files.createTempFile(tmpDir, "output_", ".out");
            errors = Files.createTempFile(tmpDir, "error_", ".log");
            Files.writeString(input, renderInput(request), StandardCharsets.UTF_8);

            process = new ProcessBuilder(command)
                    .redirectInput(input.toFile())
                    .redirectOutput(output.toFile())
                    .redirectError(errors.toFile())
                    .start();
            if (!process.waitFor(timeoutSec, TimeUnit.SECONDS)) {
                throw new SolverException("solver timed out after " + timeoutSec + "s");
            }
            int exit = process.exitValue();
            if (exit != 0) {
                throw new SolverException("solver exited with code " + exit + tail(errors));
            }
            return parseOutput(Files.readAllLines(output, StandardCharsets.UTF_8), request.wavelengthCount);
        } catch (IOException e) {
            throw new SolverException("failed to run solver " + command + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SolverException("interrupted while waiting for the solver", e);
        } finally {
            if (process != null && process.isAlive()) {
                process.destroyForcibly();
            }
            delete(input);
            delete(output);
            delete(errors);
        }
    }

    String renderInput(SolverRequest request) {
        StringBuilder sb = new StringBuilder();
        sb.append("data_files_path ").append(dataFilesPath).append('\n');
        sb.append("atmosphere_file ").append(dataFilesPath).append("atmmod/afglus.dat\n");
        sb.append("source solar ").append(dataFilesPath).append("solar_flux/atlas_plus_modtran\n");
        sb.append("aerosol_default\n");
        sb.append("rte_solver disort\n");
        sb.append("number_of_streams 8\n");
        sb.append("quiet\n");

        double longitude = request.position.longitude;
        // positive longitudes are west in the Brewer convention
        String hemisphere = longitude < 0 ? "E" : "W";
        line(sb, "wavelength", num(request.firstWavelength), num(request.lastWavelength));
        line(sb, "latitude", "N", num(request.position.latitude));
        line(sb, "longitude", hemisphere, num(Math.abs(longitude)));
        line(sb, "spline", num(request.firstWavelength), num(request.lastWavelength), num(request.wavelengthStep));
        line(sb, "mol_modify", "O3", num(request.ozone), "DU");
        line(sb, "time",
                String.valueOf(request.time.getYear()),
                String.valueOf(request.time.getMonthValue()),
                String.valueOf(request.time.getDayOfMonth()),
                String.valueOf(request.time.getHour()),
                String.valueOf(request.time.getMinute()),
                String.valueOf(request.time.getSecond()));
        line(sb, "pressure", num(request.pressure));
        line(sb, "albedo", num(request.albedo));
        line(sb, "aerosol_angstrom", num(request.alpha), num(request.beta));
        line(sb, "output_user", String.join(" ", OUTPUT_COLUMNS));
        return sb.toString();
    }

    static SolverResult parseOutput(List<String> lines, int expectedRows) throws SolverException {
        List<double[]> rows = new ArrayList<>();
        for (String raw : lines) {
            String line = raw.trim();
            if (line.isEmpty()) {
                continue;
            }
            String[] parts = line.split("\\s+");
            if (parts.length != OUTPUT_COLUMNS.size()) {
                throw new SolverException("expected " + OUTPUT_COLUMNS.size() + " columns but found "
                        + parts.length + " in '" + line + "'");
            }
            double[] row = new double[parts.length];
            for (int i = 0; i < parts.length; i++) {
                try {
                    row[i] = Double.parseDouble(parts[i]);
                } catch (NumberFormatException e) {
                    throw new SolverException("unparsable solver value '" + parts[i] + "'", e);
                }
            }
            rows.add(row);
        }
        if (rows.size() != expectedRows) {
            throw new SolverException("expected " + expectedRows + " solver rows but found " + rows.size());
        }
        double[] sza = new double[rows.size()];
        double[] edir = new double[rows.size()];
        double[] edn = new double[rows.size()];
        double[] eglo = new double[rows.size()];
        for (int i = 0; i < rows.size(); i++) {
            double[] row = rows.get(i);
            sza[i] = row[0];
            edir[i] = row[1];
            edn[i] = row[2];
            eglo[i] = row[3];
        }
        return new SolverResult(sza, edir, edn, eglo);
    }

    private static void line(StringBuilder sb, String key, String... values) {
        sb.append(key);
        for (String value : values) {
            sb.append(' ').append(value);
        }
        sb.append('\n');
    }

    private static String num(double value) {
        return BigDecimal.valueOf(value).toPlainString();
    }

    private static String tail(Path errors) {
        try {
            String text = Files.readString(errors, StandardCharsets.UTF_8).trim();
            if (text.isEmpty()) {
                return "";
            }
            return ": " + (text.length() > 500 ? text.substring(text.length() - 500) : text);
        } catch (IOException e) {
            return " (stderr unreadable: " + e.getMessage() + ")";
        }
    }

    private static void delete(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("failed to delete solver temp file {}: {}", path, e.getMessage());
        }
    }
}
