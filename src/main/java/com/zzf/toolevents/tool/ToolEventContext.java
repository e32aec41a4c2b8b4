package com.zzf.toolevents.tool;

import com.zzf.toolevents.diff.SharedTurnDiffTracker;
import com.zzf.toolevents.session.Session;
import com.zzf.toolevents.session.TurnContext;
import lombok.Getter;

import java.util.Optional;

/**
 * Everything an emission needs to know about the invocation in flight. Built by
 * the caller for a single tool call and passed to each begin/finish call; never
 * keep one beyond that call.
 */
@Getter
public final class ToolEventContext {
    private final Session session;
    private final TurnContext turn;
    private final String callId;
    private final SharedTurnDiffTracker turnDiffTracker;

    private ToolEventContext(Session session, TurnContext turn, String callId, SharedTurnDiffTracker turnDiffTracker) {
        this.session = session;
        this.turn = turn;
        this.callId = callId;
        this.turnDiffTracker = turnDiffTracker;
    }

    public static ToolEventContext of(Session session, TurnContext turn, String callId) {
        return of(session, turn, callId, null);
    }

    public static ToolEventContext of(Session session, TurnContext turn, String callId, SharedTurnDiffTracker turnDiffTracker) {
        if (session == null) {
            throw new IllegalArgumentException("session is null");
        }
        if (turn == null) {
            throw new IllegalArgumentException("turn is null");
        }
        if (callId == null || callId.isBlank()) {
            throw new IllegalArgumentException("callId is blank");
        }
        return new ToolEventContext(session, turn, callId, turnDiffTracker);
    }

    public String getTurnId() {
        return turn.getSubId();
    }

    public Optional<SharedTurnDiffTracker> getTurnDiffTracker() {
        return Optional.ofNullable(turnDiffTracker);
    }
}
