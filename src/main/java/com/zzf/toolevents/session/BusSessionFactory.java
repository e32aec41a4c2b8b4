package com.zzf.toolevents.session;

import com.zzf.toolevents.bus.EventBus;

public class BusSessionFactory {
    private final EventBus bus;
    private final int journalSize;

    public BusSessionFactory(EventBus bus, int journalSize) {
        this.bus = bus;
        this.journalSize = journalSize;
    }

    public BusSession open(String sessionId) {
        return new BusSession(sessionId, bus, journalSize);
    }
}
