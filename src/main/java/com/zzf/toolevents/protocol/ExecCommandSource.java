package com.zzf.toolevents.protocol;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Who started an exec invocation.
 */
public enum ExecCommandSource {
    AGENT("agent"),
    USER_SHELL("user_shell"),
    UNIFIED_EXEC_STARTUP("unified_exec_startup"),
    UNIFIED_EXEC_INTERACTION("unified_exec_interaction");

    private final String wireName;

    ExecCommandSource(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
