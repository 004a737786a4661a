package com.brewuv.model;

/**
 * Instrument response per wavelength (nm), strictly ascending.
 */
public final class CalibrationRecord {
    private final double[] wavelengths;
    private final double[] values;

    public CalibrationRecord(double[] wavelengths, double[] values) {
        if (wavelengths.length != values.length) {
            throw new IllegalArgumentException("wavelengths and values differ in length");
        }
        if (wavelengths.length == 0) {
            throw new IllegalArgumentException("calibration has no values");
        }
        Interpolation.requireStrictlyAscending(wavelengths, "calibration wavelengths");
        this.wavelengths = wavelengths.clone();
        this.values = values.clone();
    }

    public double[] wavelengths() {
        return wavelengths.clone();
    }

    public double[] values() {
        return values.clone();
    }

    public double[] interpolate(double[] targetWavelengths) {
        return Interpolation.linear(wavelengths, values, targetWavelengths);
    }
}
