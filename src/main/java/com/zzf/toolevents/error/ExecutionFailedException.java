package com.zzf.toolevents.error;

/**
 * The executor failed without producing structured output (spawn failure, IO error, ...).
 */
public class ExecutionFailedException extends ToolException {

    public ExecutionFailedException(String message) {
        super(message);
    }

    public ExecutionFailedException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String describe() {
        Throwable cause = getCause();
        if (cause == null) {
            return super.describe();
        }
        return super.describe() + " (" + cause.getClass().getSimpleName() + ": " + cause.getMessage() + ")";
    }
}
