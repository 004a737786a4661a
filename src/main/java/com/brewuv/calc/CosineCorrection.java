package com.brewuv.calc;

import com.brewuv.model.AngularResponse;
import com.brewuv.model.CosCorrection;
import com.brewuv.model.Interpolation;
import com.brewuv.solver.SolverResult;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.WeakHashMap;

/**
 * Per-wavelength cosine correction factors.
 */
public final class CosineCorrection {
    public static final int DEFAULT_INTEGRATION_STEPS = 160;

    private final int integrationSteps;
    // keyed by identity; a day's angular response is shared by all of its jobs
    private final Map<AngularResponse, Double> diffuseResponses = Collections.synchronizedMap(new WeakHashMap<>());

    public CosineCorrection(int integrationSteps) {
        this.integrationSteps = Math.max(2, integrationSteps);
    }

    /**
     * {@code 2 ∫ ARF(θ) sin θ dθ} over [0, π/2]: the instrument's relative response to isotropic diffuse light.
     */
    public double diffuseResponse(AngularResponse arf) {
        double[] theta = Interpolation.linspace(0.0, Math.PI / 2.0, integrationSteps);
        double[] integrand = new double[theta.length];
        for (int i = 0; i < theta.length; i++) {
            integrand[i] = arf.valueAt(Math.toDegrees(theta[i])) * Math.sin(theta[i]);
        }
        return 2.0 * Interpolation.trapezoid(integrand, theta);
    }

    double cachedDiffuseResponse(AngularResponse arf) {
        return diffuseResponses.computeIfAbsent(arf, this::diffuseResponse);
    }

    int cachedResponseCount() {
        return diffuseResponses.size();
    }

    public double[] factors(CosCorrection model, AngularResponse arf, SolverResult solved) {
        int n = solved.size();
        double[] out = new double[n];
        switch (model) {
            case DIFFUSE: {
                Arrays.fill(out, 1.0 / cachedDiffuseResponse(arf));
                break;
            }
            case CLEAR_SKY: {
                double diffuse = cachedDiffuseResponse(arf);
                double szaDegrees = solved.solarZenithAngle();
                double directResponse = arf.valueAt(szaDegrees) / Math.cos(Math.toRadians(szaDegrees));
                double[] edir = solved.direct();
                double[] edn = solved.diffuse();
                double[] eglo = solved.global();
                for (int i = 0; i < n; i++) {
                    out[i] = 1.0 / (diffuse * edn[i] / eglo[i] + edir[i] / eglo[i] * directResponse);
                }
                break;
            }
            default:
                Arrays.fill(out, 1.0);
        }
        for (int i = 0; i < n; i++) {
            if (Double.isNaN(out[i]) || Double.isInfinite(out[i])) {
                out[i] = 1.0;
            }
        }
        return out;
    }
}
