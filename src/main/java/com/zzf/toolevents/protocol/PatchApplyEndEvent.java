package com.zzf.toolevents.protocol;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
@EqualsAndHashCode(callSuper = false)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PatchApplyEndEvent extends EventMsg {
    String callId;
    String stdout;
    String stderr;
    boolean success;

    @Override
    public EventType getEventType() {
        return EventType.PATCH_APPLY_END;
    }
}
