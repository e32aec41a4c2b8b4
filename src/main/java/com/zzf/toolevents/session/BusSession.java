package com.zzf.toolevents.session;

import com.zzf.toolevents.bus.EventBus;
import com.zzf.toolevents.protocol.Event;
import com.zzf.toolevents.protocol.EventMsg;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Session backed by an {@link EventBus}: every message is stamped with a
 * sequence number, kept in a bounded journal and published under its wire type.
 */
@Slf4j
public class BusSession implements Session {
    public static final int DEFAULT_JOURNAL_SIZE = 512;

    private final String sessionId;
    private final EventBus bus;
    private final int journalSize;
    private final Object lock = new Object();
    private final Deque<Event> journal = new ArrayDeque<>();
    private long nextSeq;

    public BusSession(String sessionId, EventBus bus) {
        this(sessionId, bus, DEFAULT_JOURNAL_SIZE);
    }

    public BusSession(String sessionId, EventBus bus, int journalSize) {
        if (bus == null) {
            throw new IllegalArgumentException("bus is null");
        }
        this.sessionId = sessionId == null || sessionId.isBlank() ? "session" : sessionId.trim();
        this.bus = bus;
        this.journalSize = Math.max(1, journalSize);
    }

    public String getSessionId() {
        return sessionId;
    }

    @Override
    public CompletableFuture<Void> sendEvent(TurnContext turn, EventMsg msg) {
        if (msg == null) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("msg is null"));
        }
        Event event = record(turn, msg);
        String type = msg.getEventType().wireName();
        log.debug("session.event sessionId={} seq={} type={} turnId={}", sessionId, event.getSeq(), type, event.getId());
        return bus.publish(type, event);
    }

    public List<Event> getJournal() {
        synchronized (lock) {
            return new ArrayList<>(journal);
        }
    }

    public List<Event> getJournal(String turnId) {
        return getJournal().stream()
                .filter(e -> turnId == null || turnId.equals(e.getId()))
                .collect(Collectors.toList());
    }

    public long getLatestSeq() {
        synchronized (lock) {
            return nextSeq - 1;
        }
    }

    private Event record(TurnContext turn, EventMsg msg) {
        synchronized (lock) {
            Event event = Event.builder()
                    .id(turn == null ? null : turn.getSubId())
                    .seq(nextSeq++)
                    .timestamp(Instant.now().toString())
                    .msg(msg)
                    .build();
            journal.addLast(event);
            while (journal.size() > journalSize) {
                journal.removeFirst();
            }
            return event;
        }
    }
}
