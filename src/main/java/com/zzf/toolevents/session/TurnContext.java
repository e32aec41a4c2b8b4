package com.zzf.toolevents.session;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

/**
 * The conversational turn a tool call belongs to. {@code subId} is the turn id
 * stamped on every event of the turn.
 */
@Value
@Builder
public class TurnContext {
    String subId;
    Path cwd;
}
