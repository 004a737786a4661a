package com.brewuv.model;

/**
 * Hourly cloud fraction from the cloud service, times in minutes since midnight.
 */
public final class CloudCoverSeries {
    private final double[] times;
    private final double[] values;

    public CloudCoverSeries(double[] times, double[] values) {
        if (times.length != values.length || times.length == 0) {
            throw new IllegalArgumentException("cloud cover series needs matching, non-empty times and values");
        }
        this.times = times.clone();
        this.values = values.clone();
    }

    public int size() {
        return values.length;
    }

    public double valueAt(double time) {
        if (values.length == 1) {
            return values[0];
        }
        return Interpolation.nearest(times, values, time);
    }
}
