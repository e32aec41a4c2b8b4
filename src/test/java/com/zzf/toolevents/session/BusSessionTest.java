package com.zzf.toolevents.session;

import com.zzf.toolevents.bus.EventBus;
import com.zzf.toolevents.protocol.Event;
import com.zzf.toolevents.protocol.TurnDiffEvent;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BusSessionTest {

    @Test
    void publishesEnvelopeUnderWireType() {
        EventBus bus = new EventBus();
        List<Event> delivered = new ArrayList<>();
        bus.subscribe("turn_diff", d -> delivered.add((Event) d.getPayload()));
        BusSession session = new BusSession("s-1", bus);
        TurnDiffEvent msg = TurnDiffEvent.builder().unifiedDiff("diff\n").build();

        session.sendEvent(TurnContext.builder().subId("turn-1").build(), msg).join();

        assertEquals(1, delivered.size());
        assertEquals("turn-1", delivered.get(0).getId());
        assertEquals(0L, delivered.get(0).getSeq());
        assertSame(msg, delivered.get(0).getMsg());
    }

    @Test
    void journalIsBoundedAndSequenced() {
        BusSession session = new BusSession("s-2", new EventBus(), 2);
        TurnContext t1 = TurnContext.builder().subId("t1").build();
        TurnContext t2 = TurnContext.builder().subId("t2").build();

        session.sendEvent(t1, TurnDiffEvent.builder().unifiedDiff("1").build());
        session.sendEvent(t1, TurnDiffEvent.builder().unifiedDiff("2").build());
        session.sendEvent(t2, TurnDiffEvent.builder().unifiedDiff("3").build());

        assertEquals(2, session.getJournal().size());
        assertEquals(1L, session.getJournal().get(0).getSeq());
        assertEquals(2L, session.getLatestSeq());
        assertEquals(1, session.getJournal("t2").size());
    }

    @Test
    void nullMessageFailsFuture() {
        BusSession session = new BusSession(null, new EventBus());

        assertTrue(session.sendEvent(null, null).isCompletedExceptionally());
        assertEquals("session", session.getSessionId());
    }

    @Test
    void subscriberFailureSurfacesAsFailedFuture() {
        EventBus bus = new EventBus();
        bus.subscribeAll(d -> {
            throw new IllegalStateException("transport closed");
        });
        BusSession session = new BusSessionFactory(bus, 8).open("s-3");

        assertTrue(session.sendEvent(null, TurnDiffEvent.builder().unifiedDiff("x").build()).isCompletedExceptionally());
        assertEquals(1, session.getJournal().size());
    }
}
