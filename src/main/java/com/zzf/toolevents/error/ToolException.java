package com.zzf.toolevents.error;

/**
 * Base of every failure an executor can report for a tool invocation.
 */
public abstract class ToolException extends Exception {

    protected ToolException(String message) {
        super(message);
    }

    protected ToolException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Short diagnostic used in the text handed back to the model.
     */
    public String describe() {
        String msg = getMessage();
        if (msg == null || msg.trim().isEmpty()) {
            return getClass().getSimpleName();
        }
        return getClass().getSimpleName() + ": " + msg;
    }
}
