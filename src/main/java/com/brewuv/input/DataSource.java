package com.brewuv.input;

import com.brewuv.core.diagnostics.Outcome;

import java.util.function.Supplier;

/**
 * One named place a dataset can come from. A source that does not have the data reports a failed
 * {@link Outcome}; only broken content (e.g. a malformed local file) is thrown.
 */
public interface DataSource<T> {

    String name();

    Outcome<T> fetch();

    static <T> DataSource<T> of(String name, Supplier<Outcome<T>> fetcher) {
        return new DataSource<>() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public Outcome<T> fetch() {
                return fetcher.get();
            }

            @Override
            public String toString() {
                return name;
            }
        };
    }
}
