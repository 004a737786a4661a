package com.brewuv.calc;

import com.brewuv.config.Config;
import com.brewuv.core.diagnostics.Outcome;
import com.brewuv.input.MeasurementInput;
import com.brewuv.model.CloudCoverSeries;
import com.brewuv.model.CloudSource;
import com.brewuv.model.ParameterTable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Cloud cover for a section: parameter file for the exact day, then the cloud service at the section time,
 * then the configured default, else none.
 */
public final class CloudCoverResolver {
    private static final Logger log = LogManager.getLogger(CloudCoverResolver.class);

    private final boolean correctionEnabled;
    private final Double defaultCloudCover;

    public CloudCoverResolver(boolean correctionEnabled, Double defaultCloudCover) {
        this.correctionEnabled = correctionEnabled;
        this.defaultCloudCover = defaultCloudCover;
    }

    public static CloudCoverResolver fromConfig(Config config) {
        return new CloudCoverResolver(
                config.getBoolean("correction.enabled", true),
                config.getOptionalDouble("correction.default_cloud_cover"));
    }

    public CloudCoverResolution resolve(MeasurementInput input, ParameterTable parameters, int dayOfYear, double time) {
        if (!correctionEnabled) {
            return CloudCoverResolution.NONE;
        }
        Double fromFile = parameters.cloudCover(dayOfYear);
        if (fromFile != null) {
            return new CloudCoverResolution(fromFile, CloudSource.PARAMETER_FILE);
        }
        Outcome<CloudCoverSeries> series = input.cloudCover();
        if (series.success) {
            return new CloudCoverResolution(series.value.valueAt(time), CloudSource.CLOUD_SERVICE);
        }
        if (defaultCloudCover != null) {
            log.debug("{} cloud service unavailable ({}), using default cloud cover {}",
                    input, series.describe(), defaultCloudCover);
            return new CloudCoverResolution(defaultCloudCover, CloudSource.DEFAULT);
        }
        return CloudCoverResolution.NONE;
    }
}
