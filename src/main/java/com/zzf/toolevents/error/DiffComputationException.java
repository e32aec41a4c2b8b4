package com.zzf.toolevents.error;

/**
 * A turn diff tracker could not produce its diff.
 */
public class DiffComputationException extends Exception {

    public DiffComputationException(String message) {
        super(message);
    }

    public DiffComputationException(String message, Throwable cause) {
        super(message, cause);
    }
}
