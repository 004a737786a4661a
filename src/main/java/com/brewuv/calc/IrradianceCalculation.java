package com.brewuv.calc;

import com.brewuv.config.Config;
import com.brewuv.input.MeasurementInput;
import com.brewuv.input.Sourced;
import com.brewuv.model.AngularResponse;
import com.brewuv.model.CalibrationRecord;
import com.brewuv.model.CosCorrection;
import com.brewuv.model.MeasurementSection;
import com.brewuv.model.OzoneRecord;
import com.brewuv.model.ParameterRow;
import com.brewuv.model.ParameterTable;
import com.brewuv.model.ResolvedParameters;
import com.brewuv.model.Result;
import com.brewuv.model.SectionHeader;
import com.brewuv.model.Spectrum;
import com.brewuv.model.StraylightCorrection;
import com.brewuv.solver.IrradianceSolver;
import com.brewuv.solver.SolverException;
import com.brewuv.solver.SolverRequest;
import com.brewuv.solver.SolverResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.LocalDateTime;

/**
 * Calibrated, cosine corrected spectrum of one section of a day.
 * <p>
 * Works only on job-local state; the day's {@link MeasurementInput} is the only shared object.
 */
public final class IrradianceCalculation {
    private static final Logger log = LogManager.getLogger(IrradianceCalculation.class);
    static final String STRAYLIGHT_DEFAULT_SOURCE = "straylight.default";

    static final double EARTH_RADIUS_M = 6_370_000.0;
    static final double OZONE_LAYER_HEIGHT_M = 22_000.0;

    private final IrradianceSolver solver;
    private final SpectrumCalibrator calibrator;
    private final CosineCorrection cosineCorrection;
    private final CosineCorrectionPolicy policy;
    private final CloudCoverResolver cloudCoverResolver;
    private final double defaultOzone;

    public IrradianceCalculation(
            IrradianceSolver solver,
            SpectrumCalibrator calibrator,
            CosineCorrection cosineCorrection,
            CosineCorrectionPolicy policy,
            CloudCoverResolver cloudCoverResolver,
            double defaultOzone
    ) {
        this.solver = solver;
        this.calibrator = calibrator;
        this.cosineCorrection = cosineCorrection;
        this.policy = policy;
        this.cloudCoverResolver = cloudCoverResolver;
        this.defaultOzone = defaultOzone;
    }

    public static IrradianceCalculation fromConfig(Config config, IrradianceSolver solver) {
        return new IrradianceCalculation(
                solver,
                SpectrumCalibrator.fromConfig(config),
                new CosineCorrection(config.getInt("correction.integration_steps", CosineCorrection.DEFAULT_INTEGRATION_STEPS)),
                ThresholdCorrectionPolicy.fromConfig(config),
                CloudCoverResolver.fromConfig(config),
                config.getDouble("default.ozone", 300.0));
    }

    /**
     * Runs all stages for section {@code sectionIndex}, recording each stage in {@code tracker}.
     * On failure the tracker holds the stage that failed.
     */
    public Result calculate(MeasurementInput input, int sectionIndex, StateTracker tracker) throws SolverException {
        tracker.moveTo(JobState.RESOLVING_INPUTS);
        MeasurementSection section = input.sections().get(sectionIndex);
        CalibrationRecord calibration = input.calibration().value;
        AngularResponse arf = input.angularResponse().value;
        Sourced<OzoneRecord> ozone = input.ozone();
        Sourced<ParameterTable> parameters = input.parameters();

        SectionHeader header = section.header;
        double firstTime = section.firstTime();
        int dayOfYear = header.date.getDayOfYear();
        ParameterRow row = parameters.value.rowFor(dayOfYear);
        double ozoneValue = ozone.value.valueAt(firstTime, defaultOzone);

        tracker.moveTo(JobState.CALIBRATING);
        StraylightCorrection forModel = ozone.value.straylightCorrection();
        StraylightCorrection straylight = calibrator.effectiveStraylight(forModel);
        String straylightSource = forModel == StraylightCorrection.UNDEFINED ? STRAYLIGHT_DEFAULT_SOURCE : ozone.source;
        if (forModel == StraylightCorrection.UNDEFINED) {
            log.debug("{} has no known brewer model from {}, straylight {} by default", input, ozone.source, straylight);
        }
        double temperatureCorrection = calibrator.temperatureCorrection(header);
        double[] calibrated = calibrator.calibrate(section, calibration, straylight);
        for (int i = 0; i < calibrated.length; i++) {
            calibrated[i] *= temperatureCorrection;
        }

        tracker.moveTo(JobState.SOLVING);
        double[] wavelengths = section.wavelengths();
        if (wavelengths.length < 2) {
            throw new SolverException("section " + sectionIndex + " of " + input + " has " + wavelengths.length
                    + " wavelengths, at least 2 are needed");
        }
        SolverResult solved = solver.solve(SolverRequest.builder()
                .firstWavelength(wavelengths[0])
                .lastWavelength(wavelengths[wavelengths.length - 1])
                .wavelengthStep(wavelengths[1] - wavelengths[0])
                .wavelengthCount(wavelengths.length)
                .position(header.position)
                .time(sampleTime(header, firstTime))
                .pressure(header.pressure)
                .ozone(ozoneValue)
                .albedo(row.albedo)
                .alpha(row.alpha)
                .beta(row.beta)
                .build());

        tracker.moveTo(JobState.CORRECTING);
        CloudCoverResolution cloud = cloudCoverResolver.resolve(input, parameters.value, dayOfYear, firstTime);
        CosCorrection model = policy.select(cloud.value);
        double[] factors = cosineCorrection.factors(model, arf, solved);
        double[] corrected = new double[calibrated.length];
        for (int i = 0; i < corrected.length; i++) {
            corrected[i] = calibrated[i] * factors[i];
        }

        double sza = solved.solarZenithAngle();
        Result result = Result.builder()
                .sectionIndex(sectionIndex)
                .brewerId(input.brewerId())
                .date(header.date)
                .header(header)
                .solarZenithAngle(sza)
                .airMass(airMass(sza))
                .temperatureCorrection(temperatureCorrection)
                .spectrum(new Spectrum(wavelengths, section.times(), section.events(), calibrated, corrected, factors))
                .parameters(ResolvedParameters.builder()
                        .ozone(ozoneValue)
                        .ozoneSource(ozone.source)
                        .albedo(row.albedo)
                        .alpha(row.alpha)
                        .beta(row.beta)
                        .parameterSource(parameters.source)
                        .cloudCover(cloud.value)
                        .cloudSource(cloud.source)
                        .straylightCorrection(straylight)
                        .straylightSource(straylightSource)
                        .build())
                .cosCorrection(model)
                .build();
        tracker.moveTo(JobState.DONE);
        log.debug("{} section {} done, model={} cloud={} ({})", input, sectionIndex, model, cloud.value, cloud.source);
        return result;
    }

    static LocalDateTime sampleTime(SectionHeader header, double minutes) {
        return header.date.atStartOfDay().plusSeconds((long) Math.floor(minutes * 60.0));
    }

    /**
     * Relative optical path through the ozone layer for a solar zenith angle in degrees.
     */
    public static double airMass(double szaDegrees) {
        double sinTheta = EARTH_RADIUS_M * Math.sin(Math.PI - Math.toRadians(szaDegrees)) / (EARTH_RADIUS_M + OZONE_LAYER_HEIGHT_M);
        return 1.0 / Math.cos(Math.asin(sinTheta));
    }
}
