package com.brewuv.runner;

/**
 * Receives job outcomes as they complete, on the thread that called {@link JobScheduler#run}.
 */
@FunctionalInterface
public interface JobListener {

    void onOutcome(JobOutcome outcome);

    JobListener NONE = outcome -> {
    };
}
