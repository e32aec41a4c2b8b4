package com.zzf.toolevents.protocol;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Base of every message pushed through a {@link com.zzf.toolevents.session.Session}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ExecCommandBeginEvent.class, name = "exec_command_begin"),
        @JsonSubTypes.Type(value = ExecCommandEndEvent.class, name = "exec_command_end"),
        @JsonSubTypes.Type(value = PatchApplyBeginEvent.class, name = "patch_apply_begin"),
        @JsonSubTypes.Type(value = PatchApplyEndEvent.class, name = "patch_apply_end"),
        @JsonSubTypes.Type(value = TurnDiffEvent.class, name = "turn_diff")
})
public abstract class EventMsg {

    @JsonIgnore
    public abstract EventType getEventType();
}
