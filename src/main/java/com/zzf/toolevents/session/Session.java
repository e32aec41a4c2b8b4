package com.zzf.toolevents.session;

import com.zzf.toolevents.protocol.EventMsg;

import java.util.concurrent.CompletableFuture;

/**
 * Outlet for tool events. Implementations hand the message to their transport
 * and complete the future once it was accepted; a failed future means the
 * transport rejected it.
 */
public interface Session {

    CompletableFuture<Void> sendEvent(TurnContext turn, EventMsg msg);
}
