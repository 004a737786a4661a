package com.brewuv.calc;

import com.brewuv.config.Config;
import com.brewuv.model.CosCorrection;

/**
 * Diffuse model strictly above the threshold, clear sky at or below it, none without a cloud value.
 */
public final class ThresholdCorrectionPolicy implements CosineCorrectionPolicy {
    public static final double DEFAULT_THRESHOLD = 0.9;

    private final double threshold;

    public ThresholdCorrectionPolicy(double threshold) {
        this.threshold = threshold;
    }

    public static ThresholdCorrectionPolicy fromConfig(Config config) {
        return new ThresholdCorrectionPolicy(config.getDouble("correction.cloud_threshold", DEFAULT_THRESHOLD));
    }

    public double threshold() {
        return threshold;
    }

    @Override
    public CosCorrection select(Double cloudCover) {
        if (cloudCover == null || cloudCover.isNaN()) {
            return CosCorrection.NONE;
        }
        return cloudCover > threshold ? CosCorrection.DIFFUSE : CosCorrection.CLEAR_SKY;
    }
}
