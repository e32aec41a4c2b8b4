package com.zzf.toolevents.protocol;

import lombok.Builder;
import lombok.Value;

/**
 * Envelope a session wraps around each {@link EventMsg} before handing it to
 * subscribers: the turn it belongs to, a per-session sequence number and the
 * time it was recorded.
 */
@Value
@Builder
public class Event {
    String id;
    long seq;
    String timestamp;
    EventMsg msg;
}
