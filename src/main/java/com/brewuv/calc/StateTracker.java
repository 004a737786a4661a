package com.brewuv.calc;

/**
 * Last state a calculation reached, so a failure can be reported with the stage it happened in.
 */
public final class StateTracker {
    private volatile JobState state = JobState.PENDING;

    public void moveTo(JobState next) {
        this.state = next;
    }

    public JobState current() {
        return state;
    }
}
