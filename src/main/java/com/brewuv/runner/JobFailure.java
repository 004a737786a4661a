package com.brewuv.runner;

import com.brewuv.calc.JobState;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
public final class JobFailure {
    public final String jobId;
    /** Stage the job was in when it failed. */
    public final JobState state;
    public final Throwable cause;

    public String message() {
        String message = cause.getMessage();
        return cause.getClass().getSimpleName() + (message == null ? "" : ": " + message);
    }
}
