package com.brewuv.model;

import java.util.Arrays;

/**
 * Total column ozone measurements of one day, with the instrument model when the source knows it.
 */
public final class OzoneRecord {
    private final double[] times;
    private final double[] values;
    public final String brewerModel;

    public OzoneRecord(double[] times, double[] values, String brewerModel) {
        if (times.length != values.length) {
            throw new IllegalArgumentException("times and values differ in length: " + times.length + " != " + values.length);
        }
        this.times = times.clone();
        this.values = values.clone();
        this.brewerModel = brewerModel;
    }

    public static OzoneRecord constant(double value) {
        return new OzoneRecord(new double[]{0.0}, new double[]{value}, null);
    }

    public int size() {
        return values.length;
    }

    public double[] times() {
        return times.clone();
    }

    public double[] values() {
        return values.clone();
    }

    /**
     * Ozone in DU at {@code time} (minutes since midnight), nearest measurement wins.
     */
    public double valueAt(double time, double fallback) {
        if (values.length == 0) {
            return fallback;
        }
        if (values.length == 1) {
            return values[0];
        }
        return Interpolation.nearest(times, values, time);
    }

    public StraylightCorrection straylightCorrection() {
        return StraylightCorrection.forBrewerModel(brewerModel);
    }

    @Override
    public String toString() {
        return "OzoneRecord{model=" + brewerModel + ", values=" + Arrays.toString(values) + "}";
    }
}
