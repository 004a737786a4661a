package com.brewuv.calc;

import com.brewuv.Fixtures;
import com.brewuv.config.Config;
import com.brewuv.model.MeasurementSection;
import com.brewuv.model.RawSample;
import com.brewuv.model.SectionHeader;
import com.brewuv.model.StraylightCorrection;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SpectrumCalibratorTest {

    @Test
    void countsAreDarkCorrectedScaledAndDividedByResponse() {
        SpectrumCalibrator calibrator = new SpectrumCalibrator(0, 292.0, 0.0, 0.0, StraylightCorrection.NOT_APPLIED);
        MeasurementSection section = section(0.0, new double[]{290.0, 300.0}, new double[]{150.0, 300.0});

        double[] calibrated = calibrator.calibrate(section, Fixtures.flatCalibration(2.0), StraylightCorrection.NOT_APPLIED);

        // dark 100, scale 4 / (1 cycle * 4 s) = 1
        assertArrayEquals(new double[]{25.0, 100.0}, calibrated, 1e-9);
    }

    @Test
    void straylightBelowCutoffIsSubtractedAndNegativesClamped() {
        SpectrumCalibrator calibrator = new SpectrumCalibrator(0, 292.0, 0.0, 0.0, StraylightCorrection.APPLIED);
        MeasurementSection section = section(0.0, new double[]{290.0, 291.0, 300.0}, new double[]{200.0, 220.0, 400.0});

        double[] calibrated = calibrator.calibrate(section, Fixtures.flatCalibration(1.0), StraylightCorrection.APPLIED);

        // mean below 292 nm is 210
        assertArrayEquals(new double[]{0.0, 0.0, 90.0}, calibrated, 1e-9);
    }

    @Test
    void linearityIterationsSolveDeadTimeEquation() {
        double deadTime = 1e-4;
        SpectrumCalibrator calibrator = new SpectrumCalibrator(25, 292.0, 0.0, 0.0, StraylightCorrection.NOT_APPLIED);
        MeasurementSection section = section(deadTime, new double[]{300.0}, new double[]{200.0});

        double rate = calibrator.calibrate(section, Fixtures.flatCalibration(1.0), StraylightCorrection.NOT_APPLIED)[0];

        assertEquals(100.0 * Math.exp(rate * deadTime), rate, 1e-9);
    }

    @Test
    void temperatureCorrectionIsLinearAroundReference() {
        SpectrumCalibrator calibrator = new SpectrumCalibrator(0, 292.0, 0.01, 20.0, StraylightCorrection.APPLIED);

        assertEquals(1.0265, calibrator.temperatureCorrection(Fixtures.header()), 1e-9);
    }

    @Test
    void unknownModelUsesConfiguredDefault() {
        Config config = Config.fromConfigurationProperties(Path.of("."), Map.of("straylight.default", "not_applied"));
        SpectrumCalibrator calibrator = SpectrumCalibrator.fromConfig(config);

        assertEquals(StraylightCorrection.NOT_APPLIED, calibrator.effectiveStraylight(StraylightCorrection.UNDEFINED));
        assertEquals(StraylightCorrection.APPLIED, calibrator.effectiveStraylight(StraylightCorrection.APPLIED));
    }

    @Test
    void invalidStraylightDefaultIsRejected() {
        Config config = Config.fromConfigurationProperties(Path.of("."), Map.of("straylight.default", "sometimes"));

        assertThrows(IllegalArgumentException.class, () -> SpectrumCalibrator.fromConfig(config));
    }

    private static MeasurementSection section(double deadTime, double[] wavelengths, double[] events) {
        SectionHeader header = Fixtures.header().toBuilder()
                .integrationTime(4.0)
                .cycles(1)
                .deadTime(deadTime)
                .darkCount(100.0)
                .build();
        RawSample[] samples = new RawSample[wavelengths.length];
        for (int i = 0; i < samples.length; i++) {
            samples[i] = new RawSample(600.0 + i, wavelengths[i], i, events[i]);
        }
        return new MeasurementSection(header, List.of(samples));
    }
}
