package com.brewuv.model;

/**
 * Per-wavelength arrays of one processed scan. All arrays have the same length.
 */
public final class Spectrum {
    private final double[] wavelengths;
    private final double[] times;
    private final double[] rawCounts;
    private final double[] calibrated;
    private final double[] corrected;
    private final double[] correctionFactors;

    public Spectrum(
            double[] wavelengths,
            double[] times,
            double[] rawCounts,
            double[] calibrated,
            double[] corrected,
            double[] correctionFactors
    ) {
        int n = wavelengths.length;
        if (times.length != n || rawCounts.length != n || calibrated.length != n
                || corrected.length != n || correctionFactors.length != n) {
            throw new IllegalArgumentException("spectrum arrays must all have length " + n);
        }
        this.wavelengths = wavelengths.clone();
        this.times = times.clone();
        this.rawCounts = rawCounts.clone();
        this.calibrated = calibrated.clone();
        this.corrected = corrected.clone();
        this.correctionFactors = correctionFactors.clone();
    }

    public int size() {
        return wavelengths.length;
    }

    public double[] wavelengths() {
        return wavelengths.clone();
    }

    public double[] times() {
        return times.clone();
    }

    public double[] rawCounts() {
        return rawCounts.clone();
    }

    /** Calibrated spectral irradiance before cosine correction. */
    public double[] calibrated() {
        return calibrated.clone();
    }

    public double[] corrected() {
        return corrected.clone();
    }

    public double[] correctionFactors() {
        return correctionFactors.clone();
    }
}
