package com.brewuv.input;

import com.brewuv.core.diagnostics.Outcome;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered fallback over data sources: the first successful source wins.
 */
public final class SourceChain<T> {
    private static final Logger log = LogManager.getLogger(SourceChain.class);

    private final String dataset;
    private final List<DataSource<T>> sources;

    public SourceChain(String dataset, List<DataSource<T>> sources) {
        this.dataset = dataset;
        this.sources = List.copyOf(sources);
    }

    @SafeVarargs
    public static <T> SourceChain<T> of(String dataset, DataSource<T>... sources) {
        return new SourceChain<>(dataset, List.of(sources));
    }

    public List<String> sourceNames() {
        List<String> names = new ArrayList<>(sources.size());
        for (DataSource<T> source : sources) {
            names.add(source.name());
        }
        return names;
    }

    /**
     * @throws DataUnavailableException when no source delivers
     */
    public Sourced<T> resolve() {
        List<String> attempts = new ArrayList<>(sources.size());
        for (DataSource<T> source : sources) {
            Outcome<T> outcome = source.fetch();
            if (outcome.success && outcome.value != null) {
                if (!attempts.isEmpty()) {
                    log.info("{} resolved from {} after {}", dataset, source.name(), attempts);
                }
                return new Sourced<>(outcome.value, source.name());
            }
            String attempt = source.name() + ":" + outcome.causeCode
                    + (outcome.message().isEmpty() ? "" : "(" + outcome.message() + ")");
            log.debug("{} not available from {}", dataset, attempt);
            attempts.add(attempt);
        }
        throw new DataUnavailableException(dataset, attempts);
    }
}
