package com.brewuv;

import com.brewuv.core.diagnostics.CauseCode;
import com.brewuv.core.diagnostics.Outcome;
import com.brewuv.input.DataSource;
import com.brewuv.input.InputSpec;
import com.brewuv.input.MeasurementInput;
import com.brewuv.input.SourceChain;
import com.brewuv.model.AngularResponse;
import com.brewuv.model.CalibrationRecord;
import com.brewuv.model.MeasurementSection;
import com.brewuv.model.OzoneRecord;
import com.brewuv.model.ParameterTable;
import com.brewuv.model.Position;
import com.brewuv.model.RawSample;
import com.brewuv.model.SectionHeader;
import com.brewuv.solver.SolverRequest;
import com.brewuv.solver.SolverResult;

import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Shared test data: the classpath input tree and small in-memory days.
 */
public final class Fixtures {
    public static final LocalDate DAY = LocalDate.of(2019, 6, 22);
    public static final String BREWER = "033";

    private Fixtures() {
    }

    public static Path resource(String name) {
        URL url = Fixtures.class.getClassLoader().getResource(name);
        if (url == null) {
            throw new IllegalStateException("missing test resource " + name);
        }
        try {
            return Path.of(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }

    public static Path inputDir() {
        return resource("input");
    }

    /**
     * The fixture day with every local input file present.
     */
    public static InputSpec.InputSpecBuilder spec() {
        return InputSpec.builder()
                .brewerId(BREWER)
                .date(DAY)
                .uvFile(resource("input/uvdata/UV17319.033"))
                .bFile(resource("input/uvdata/B17319.033"))
                .uvrFile(resource("input/instr/UVR17319.033"))
                .arfFile(resource("input/instr/arf_033.dat"))
                .parameterFile(resource("input/instr/par_19.033"));
    }

    public static SectionHeader header() {
        return SectionHeader.builder()
                .scanType("uv")
                .integrationTime(0.2294)
                .deadTime(2.9e-8)
                .cycles(1)
                .date(DAY)
                .place("Madrid")
                .position(new Position(40.45, 3.72))
                .temperature(22.65)
                .pressure(940.0)
                .darkCount(100.0)
                .build();
    }

    /**
     * A scan starting at {@code startTime} minutes with 1000 events per wavelength.
     */
    public static MeasurementSection section(double startTime, double... wavelengths) {
        List<RawSample> samples = new ArrayList<>();
        for (int i = 0; i < wavelengths.length; i++) {
            samples.add(new RawSample(startTime + i * 0.1, wavelengths[i], i, 1000.0));
        }
        return new MeasurementSection(header(), samples);
    }

    public static List<MeasurementSection> sections(int count) {
        List<MeasurementSection> out = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            out.add(section(600.0 + i * 10, 290.0, 295.0, 300.0));
        }
        return out;
    }

    public static AngularResponse cosineResponse() {
        double[] angles = new double[91];
        double[] values = new double[91];
        for (int i = 0; i <= 90; i++) {
            angles[i] = i;
            values[i] = Math.cos(Math.toRadians(i));
        }
        values[90] = 0.0;
        return new AngularResponse(angles, values);
    }

    public static CalibrationRecord flatCalibration(double value) {
        return new CalibrationRecord(new double[]{280.0, 370.0}, new double[]{value, value});
    }

    public static MeasurementInput input(List<MeasurementSection> sections) {
        return input(sections, (date, position) -> Outcome.failure(CauseCode.NOT_CONFIGURED, "cloud-service"));
    }

    public static MeasurementInput input(List<MeasurementSection> sections, MeasurementInput.CloudLookup cloud) {
        return input(sections, ParameterTable.single(0.04, 1.3, 0.1), cloud);
    }

    public static MeasurementInput input(
            List<MeasurementSection> sections,
            ParameterTable parameters,
            MeasurementInput.CloudLookup cloud
    ) {
        InputSpec spec = InputSpec.builder().brewerId(BREWER).date(DAY).build();
        return new MeasurementInput(
                spec,
                SourceChain.of("sections", DataSource.of("memory", () -> Outcome.success(sections, "memory"))),
                SourceChain.of("ozone", DataSource.of("memory",
                        () -> Outcome.success(new OzoneRecord(new double[]{600.0, 700.0}, new double[]{310.0, 330.0}, "mkiii"), "memory"))),
                SourceChain.of("calibration", DataSource.of("memory", () -> Outcome.success(flatCalibration(2.0), "memory"))),
                SourceChain.of("angular response", DataSource.of("memory", () -> Outcome.success(cosineResponse(), "memory"))),
                SourceChain.of("parameters", DataSource.of("memory", () -> Outcome.success(parameters, "memory"))),
                cloud);
    }

    /**
     * Solver answer where direct and diffuse add up to global at every wavelength.
     */
    public static SolverResult solved(SolverRequest request, double sza) {
        int n = request.wavelengthCount;
        double[] szas = new double[n];
        double[] direct = new double[n];
        double[] diffuse = new double[n];
        double[] global = new double[n];
        Arrays.fill(szas, sza);
        Arrays.fill(direct, 0.6);
        Arrays.fill(diffuse, 0.4);
        Arrays.fill(global, 1.0);
        return new SolverResult(szas, direct, diffuse, global);
    }
}
