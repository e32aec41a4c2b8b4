package com.zzf.toolevents.protocol;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.nio.file.Path;
import java.util.Map;

@Value
@Builder
@Jacksonized
@EqualsAndHashCode(callSuper = false)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PatchApplyBeginEvent extends EventMsg {
    String callId;
    boolean autoApproved;
    Map<Path, FileChange> changes;

    @Override
    public EventType getEventType() {
        return EventType.PATCH_APPLY_BEGIN;
    }
}
