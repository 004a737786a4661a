package com.brewuv.model;

import java.util.List;

/**
 * One spectral scan of a UV file.
 */
public final class MeasurementSection {
    public final SectionHeader header;
    public final List<RawSample> samples;

    public MeasurementSection(SectionHeader header, List<RawSample> samples) {
        if (header == null) {
            throw new IllegalArgumentException("header is required");
        }
        this.header = header;
        this.samples = samples == null ? List.of() : List.copyOf(samples);
    }

    public int size() {
        return samples.size();
    }

    public double[] wavelengths() {
        double[] out = new double[samples.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = samples.get(i).wavelength;
        }
        return out;
    }

    public double[] times() {
        double[] out = new double[samples.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = samples.get(i).time;
        }
        return out;
    }

    public double[] events() {
        double[] out = new double[samples.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = samples.get(i).events;
        }
        return out;
    }

    public double firstTime() {
        return samples.isEmpty() ? 0.0 : samples.get(0).time;
    }
}
