package com.brewuv.model;

import java.util.Arrays;
import java.util.Comparator;

/**
 * Numeric helpers shared by the records and the calculation.
 */
public final class Interpolation {

    private Interpolation() {
    }

    /**
     * Piecewise linear interpolation on ascending {@code xs}; values outside the domain take the nearest end value.
     */
    public static double linear(double[] xs, double[] ys, double x) {
        int n = xs.length;
        if (n == 0) {
            throw new IllegalArgumentException("cannot interpolate on an empty domain");
        }
        if (x <= xs[0]) {
            return ys[0];
        }
        if (x >= xs[n - 1]) {
            return ys[n - 1];
        }
        int hi = Arrays.binarySearch(xs, x);
        if (hi >= 0) {
            return ys[hi];
        }
        hi = -hi - 1;
        int lo = hi - 1;
        double t = (x - xs[lo]) / (xs[hi] - xs[lo]);
        return ys[lo] + t * (ys[hi] - ys[lo]);
    }

    public static double[] linear(double[] xs, double[] ys, double[] targets) {
        double[] out = new double[targets.length];
        for (int i = 0; i < targets.length; i++) {
            out[i] = linear(xs, ys, targets[i]);
        }
        return out;
    }

    /**
     * @throws IllegalArgumentException when {@code xs} is not strictly ascending
     */
    public static void requireStrictlyAscending(double[] xs, String what) {
        for (int i = 1; i < xs.length; i++) {
            if (!(xs[i] > xs[i - 1])) {
                throw new IllegalArgumentException(what + " not strictly ascending at index " + i
                        + " (" + xs[i - 1] + ", " + xs[i] + ")");
            }
        }
    }

    /**
     * Nearest-neighbour lookup with flat extrapolation. {@code xs} need not be sorted.
     * A target exactly between two samples takes the lower one.
     */
    public static double nearest(double[] xs, double[] ys, double x) {
        int n = xs.length;
        if (n == 0) {
            throw new IllegalArgumentException("cannot interpolate on an empty domain");
        }
        Integer[] order = new Integer[n];
        for (int i = 0; i < n; i++) {
            order[i] = i;
        }
        Arrays.sort(order, Comparator.comparingDouble(i -> xs[i]));
        for (int k = 0; k < n - 1; k++) {
            double mid = (xs[order[k]] + xs[order[k + 1]]) / 2.0;
            if (x <= mid) {
                return ys[order[k]];
            }
        }
        return ys[order[n - 1]];
    }

    /**
     * Trapezoidal integral of {@code ys} over {@code xs}.
     */
    public static double trapezoid(double[] ys, double[] xs) {
        double sum = 0.0;
        for (int i = 1; i < xs.length; i++) {
            sum += (xs[i] - xs[i - 1]) * (ys[i] + ys[i - 1]) / 2.0;
        }
        return sum;
    }

    public static double[] linspace(double start, double end, int count) {
        double[] out = new double[count];
        if (count == 1) {
            out[0] = start;
            return out;
        }
        double step = (end - start) / (count - 1);
        for (int i = 0; i < count; i++) {
            out[i] = start + i * step;
        }
        out[count - 1] = end;
        return out;
    }
}
