package com.brewuv.input;

import java.util.List;

/**
 * Every source of a dataset was tried and none had it.
 */
public class DataUnavailableException extends RuntimeException {
    private final String dataset;
    private final List<String> attempts;

    public DataUnavailableException(String dataset, List<String> attempts) {
        super(dataset + " unavailable" + (attempts.isEmpty() ? " (no source configured)" : ", tried " + String.join(", ", attempts)));
        this.dataset = dataset;
        this.attempts = List.copyOf(attempts);
    }

    public String getDataset() {
        return dataset;
    }

    public List<String> getAttempts() {
        return attempts;
    }
}
