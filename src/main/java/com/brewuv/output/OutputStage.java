package com.brewuv.output;

import com.brewuv.config.Config;
import com.brewuv.model.Result;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Output generation on its own pool, sized independently of the calculation workers.
 * Writer failures complete the returned future exceptionally and never reach the calculation side.
 */
public final class OutputStage implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(OutputStage.class);

    private final OutputSink sink;
    private final ExecutorService pool;
    private final int threads;

    public OutputStage(OutputSink sink, int threads) {
        this.sink = sink;
        this.threads = Math.max(1, threads);
        this.pool = Executors.newFixedThreadPool(this.threads);
    }

    public static OutputStage fromConfig(Config config, OutputSink sink) {
        int configured = config.getInt("output.threads", 0);
        return new OutputStage(sink, configured > 0 ? configured : Runtime.getRuntime().availableProcessors());
    }

    public int threads() {
        return threads;
    }

    public CompletableFuture<OutputArtifacts> submit(Result result) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return sink.write(result);
            } catch (IOException e) {
                log.error("output failed for {}: {}", resultId(result), e.getMessage());
                throw new UncheckedIOException(e);
            }
        }, pool);
    }

    static String resultId(Result result) {
        return result.brewerId + "/" + result.date + "/" + result.sectionIndex;
    }

    /**
     * Stops accepting results and waits for pending writes.
     */
    @Override
    public void close() {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(10, TimeUnit.MINUTES)) {
                log.warn("output stage did not finish within 10 minutes, {} writes abandoned", pool.shutdownNow().size());
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
