package com.zzf.toolevents.protocol;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Aggregated unified diff of every file touched by patches in the current turn.
 */
@Value
@Builder
@Jacksonized
@EqualsAndHashCode(callSuper = false)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TurnDiffEvent extends EventMsg {
    String unifiedDiff;

    @Override
    public EventType getEventType() {
        return EventType.TURN_DIFF;
    }
}
