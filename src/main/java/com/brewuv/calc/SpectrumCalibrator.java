package com.brewuv.calc;

import com.brewuv.config.Config;
import com.brewuv.model.CalibrationRecord;
import com.brewuv.model.MeasurementSection;
import com.brewuv.model.RawSample;
import com.brewuv.model.SectionHeader;
import com.brewuv.model.StraylightCorrection;

import java.util.Locale;

/**
 * Converts raw counts of a scan to spectral irradiance.
 */
public final class SpectrumCalibrator {
    private final int linearityIterations;
    private final double straylightCutoff;
    private final double temperatureFactor;
    private final double temperatureRef;
    private final StraylightCorrection defaultStraylight;

    public SpectrumCalibrator(
            int linearityIterations,
            double straylightCutoff,
            double temperatureFactor,
            double temperatureRef,
            StraylightCorrection defaultStraylight
    ) {
        this.linearityIterations = Math.max(0, linearityIterations);
        this.straylightCutoff = straylightCutoff;
        this.temperatureFactor = temperatureFactor;
        this.temperatureRef = temperatureRef;
        this.defaultStraylight = defaultStraylight == StraylightCorrection.UNDEFINED
                ? StraylightCorrection.APPLIED
                : defaultStraylight;
    }

    public static SpectrumCalibrator fromConfig(Config config) {
        StraylightCorrection fallback;
        try {
            fallback = StraylightCorrection.valueOf(config.getString("straylight.default", "APPLIED").trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("straylight.default must be APPLIED or NOT_APPLIED", e);
        }
        return new SpectrumCalibrator(
                config.getInt("calibration.linearity_iterations", 25),
                config.getDouble("calibration.straylight_cutoff_nm", 292.0),
                config.getDouble("calibration.temperature_factor", 0.0),
                config.getDouble("calibration.temperature_ref", 0.0),
                fallback);
    }

    /**
     * Straylight setting for an instrument; unknown models use the configured default.
     */
    public StraylightCorrection effectiveStraylight(StraylightCorrection forModel) {
        return forModel == null || forModel == StraylightCorrection.UNDEFINED ? defaultStraylight : forModel;
    }

    public double temperatureCorrection(SectionHeader header) {
        return 1.0 + temperatureFactor * (header.temperature - temperatureRef);
    }

    /**
     * Dark and straylight removal, photon rate, dead time linearity, then division by the instrument response.
     * The temperature correction is not included.
     */
    public double[] calibrate(MeasurementSection section, CalibrationRecord calibration, StraylightCorrection straylight) {
        SectionHeader header = section.header;
        int n = section.size();
        double[] counts = new double[n];
        for (int i = 0; i < n; i++) {
            counts[i] = section.samples.get(i).events - header.darkCount;
        }

        if (straylight == StraylightCorrection.APPLIED) {
            double sum = 0.0;
            int below = 0;
            for (RawSample sample : section.samples) {
                if (sample.wavelength < straylightCutoff) {
                    sum += sample.events;
                    below++;
                }
            }
            if (below > 0) {
                double mean = sum / below;
                for (int i = 0; i < n; i++) {
                    counts[i] -= mean;
                }
            }
        }

        double scale = 4.0 / (header.cycles * header.integrationTime);
        double[] response = calibration.interpolate(section.wavelengths());
        double[] out = new double[n];
        for (int i = 0; i < n; i++) {
            double rate0 = counts[i] * scale;
            double rate = rate0;
            for (int k = 0; k < linearityIterations; k++) {
                rate = rate0 * Math.exp(rate * header.deadTime);
            }
            out[i] = Math.max(0.0, rate) / response[i];
        }
        return out;
    }
}
