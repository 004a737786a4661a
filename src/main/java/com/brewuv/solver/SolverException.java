package com.brewuv.solver;

/**
 * The radiative transfer solver failed, timed out or produced output that cannot be used.
 */
public class SolverException extends Exception {

    public SolverException(String message) {
        super(message);
    }

    public SolverException(String message, Throwable cause) {
        super(message, cause);
    }
}
