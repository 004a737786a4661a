package com.brewuv.model;

/**
 * Relative instrument sensitivity per zenith angle in degrees, covering 0 to 90.
 */
public final class AngularResponse {
    private final double[] angles;
    private final double[] values;

    public AngularResponse(double[] angles, double[] values) {
        if (angles.length != values.length) {
            throw new IllegalArgumentException("angles and values differ in length");
        }
        if (angles.length == 0 || angles[0] != 0.0 || angles[angles.length - 1] != 90.0) {
            throw new IllegalArgumentException("angular response must cover 0 to 90 degrees");
        }
        Interpolation.requireStrictlyAscending(angles, "zenith angles");
        this.angles = angles.clone();
        this.values = values.clone();
    }

    public double[] angles() {
        return angles.clone();
    }

    public double[] values() {
        return values.clone();
    }

    public double valueAt(double angleDegrees) {
        return Interpolation.linear(angles, values, angleDegrees);
    }
}
