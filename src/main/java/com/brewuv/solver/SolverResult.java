package com.brewuv.solver;

/**
 * Solver output per wavelength: solar zenith angle (degrees), direct, diffuse downward and global irradiance.
 */
public final class SolverResult {
    private final double[] sza;
    private final double[] direct;
    private final double[] diffuse;
    private final double[] global;

    public SolverResult(double[] sza, double[] direct, double[] diffuse, double[] global) {
        int n = sza.length;
        if (direct.length != n || diffuse.length != n || global.length != n) {
            throw new IllegalArgumentException("solver columns differ in length");
        }
        this.sza = sza.clone();
        this.direct = direct.clone();
        this.diffuse = diffuse.clone();
        this.global = global.clone();
    }

    public int size() {
        return sza.length;
    }

    public double solarZenithAngle() {
        return sza.length == 0 ? Double.NaN : sza[0];
    }

    public double[] sza() {
        return sza.clone();
    }

    public double[] direct() {
        return direct.clone();
    }

    public double[] diffuse() {
        return diffuse.clone();
    }

    public double[] global() {
        return global.clone();
    }
}
