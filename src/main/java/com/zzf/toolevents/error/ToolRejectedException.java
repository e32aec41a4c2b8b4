package com.zzf.toolevents.error;

/**
 * The invocation never ran, e.g. the user declined the approval prompt.
 * The message is the rejection text as produced by the approval gate.
 */
public class ToolRejectedException extends ToolException {

    public ToolRejectedException(String message) {
        super(message == null ? "" : message);
    }
}
