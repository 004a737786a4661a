package com.brewuv.input;

import com.brewuv.config.Config;
import com.brewuv.core.diagnostics.CauseCode;
import com.brewuv.core.diagnostics.Outcome;
import com.brewuv.model.AngularResponse;
import com.brewuv.model.CalibrationRecord;
import com.brewuv.model.CloudCoverSeries;
import com.brewuv.model.MeasurementSection;
import com.brewuv.model.OzoneRecord;
import com.brewuv.model.ParameterTable;
import com.brewuv.model.Position;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * All inputs of one (day, instrument) pair.
 * <p>
 * Each accessor resolves its dataset at most once per instance, through an ordered chain of sources,
 * and is safe to call from any number of jobs at the same time. Failures are kept and re-thrown:
 * {@link com.brewuv.parse.MalformedInputException} for a broken local file,
 * {@link DataUnavailableException} when no source has the data.
 */
public class MeasurementInput {
    public final InputSpec spec;

    private final Memoized<Sourced<List<MeasurementSection>>> sections;
    private final Memoized<Sourced<OzoneRecord>> ozone;
    private final Memoized<Sourced<CalibrationRecord>> calibration;
    private final Memoized<Sourced<AngularResponse>> angularResponse;
    private final Memoized<Sourced<ParameterTable>> parameters;
    private final Memoized<Outcome<CloudCoverSeries>> cloudCover;

    public MeasurementInput(
            InputSpec spec,
            SourceChain<List<MeasurementSection>> sections,
            SourceChain<OzoneRecord> ozone,
            SourceChain<CalibrationRecord> calibration,
            SourceChain<AngularResponse> angularResponse,
            SourceChain<ParameterTable> parameters,
            CloudLookup cloudLookup
    ) {
        this.spec = spec;
        this.sections = new Memoized<>(sections::resolve);
        this.ozone = new Memoized<>(ozone::resolve);
        this.calibration = new Memoized<>(calibration::resolve);
        this.angularResponse = new Memoized<>(angularResponse::resolve);
        this.parameters = new Memoized<>(parameters::resolve);
        this.cloudCover = new Memoized<>(() -> lookupCloudCover(cloudLookup));
    }

    /**
     * Cloud service lookup keyed by date and position.
     */
    @FunctionalInterface
    public interface CloudLookup {
        Outcome<CloudCoverSeries> fetch(LocalDate date, Position position);
    }

    /**
     * Standard source chains: local files first, then the instrument network when enabled, then configured defaults
     * for ozone and site parameters.
     */
    public static MeasurementInput forDay(InputSpec spec, InputProviders providers) {
        Config config = providers.config;
        String brewerId = spec.brewerId;
        LocalDate date = spec.date;

        List<DataSource<List<MeasurementSection>>> sectionSources = new ArrayList<>();
        sectionSources.add(new FileSource<>(spec.uvFile, providers.uvParser::parse));
        List<DataSource<OzoneRecord>> ozoneSources = new ArrayList<>();
        ozoneSources.add(new FileSource<>(spec.bFile, providers.ozoneParser::parse));
        List<DataSource<CalibrationRecord>> calibrationSources = new ArrayList<>();
        calibrationSources.add(new FileSource<>(spec.uvrFile, providers.calibrationParser::parse));

        if (providers.eubrewnet != null) {
            sectionSources.add(DataSource.of("eubrewnet", () -> providers.eubrewnet.fetchSections(brewerId, date)));
            ozoneSources.add(DataSource.of("eubrewnet", () -> providers.eubrewnet.fetchOzone(brewerId, date)));
            calibrationSources.add(DataSource.of("eubrewnet", () -> providers.eubrewnet.fetchCalibration(brewerId, date)));
        }

        double defaultOzone = config.getDouble("default.ozone", 300.0);
        ozoneSources.add(DataSource.of("default", () -> Outcome.success(OzoneRecord.constant(defaultOzone), "default")));

        ParameterTable defaultParameters = ParameterTable.single(
                config.getDouble("default.albedo", 0.04),
                config.getDouble("default.alpha", 1.3),
                config.getDouble("default.beta", 0.1));

        return new MeasurementInput(
                spec,
                new SourceChain<>("sections", sectionSources),
                new SourceChain<>("ozone", ozoneSources),
                new SourceChain<>("calibration", calibrationSources),
                SourceChain.of("angular response", new FileSource<>(spec.arfFile, providers.arfParser::parse)),
                SourceChain.of("parameters",
                        new FileSource<>(spec.parameterFile, providers.parameterParser::parse),
                        DataSource.of("default", () -> Outcome.success(defaultParameters, "default"))),
                providers.cloudCover == null
                        ? (d, p) -> Outcome.failure(CauseCode.NOT_CONFIGURED, "cloud-service")
                        : (d, p) -> providers.cloudCover.fetch(d, p.latitude, p.longitude)
        );
    }

    public String brewerId() {
        return spec.brewerId;
    }

    public LocalDate date() {
        return spec.date;
    }

    public List<MeasurementSection> sections() {
        return sections.get().value;
    }

    public Sourced<List<MeasurementSection>> sourcedSections() {
        return sections.get();
    }

    public Sourced<OzoneRecord> ozone() {
        return ozone.get();
    }

    public Sourced<CalibrationRecord> calibration() {
        return calibration.get();
    }

    public Sourced<AngularResponse> angularResponse() {
        return angularResponse.get();
    }

    public Sourced<ParameterTable> parameters() {
        return parameters.get();
    }

    /**
     * Cloud service series for the day at the position of the first section. Never throws for an
     * unavailable service; the failure is in the outcome.
     */
    public Outcome<CloudCoverSeries> cloudCover() {
        return cloudCover.get();
    }

    private Outcome<CloudCoverSeries> lookupCloudCover(CloudLookup lookup) {
        List<MeasurementSection> list = sections();
        if (list.isEmpty()) {
            return Outcome.failure(CauseCode.NO_DATA, "cloud-service", "no section to locate the instrument");
        }
        return lookup.fetch(spec.date, list.get(0).header.position);
    }

    @Override
    public String toString() {
        return "MeasurementInput{" + spec.label() + "}";
    }
}
