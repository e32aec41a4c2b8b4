package com.zzf.toolevents.protocol;

/**
 * Wire names of the events emitted for a tool invocation.
 */
public enum EventType {
    EXEC_COMMAND_BEGIN("exec_command_begin"),
    EXEC_COMMAND_END("exec_command_end"),
    PATCH_APPLY_BEGIN("patch_apply_begin"),
    PATCH_APPLY_END("patch_apply_end"),
    TURN_DIFF("turn_diff");

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
