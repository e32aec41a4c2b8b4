package com.zzf.toolevents.diff;

import com.zzf.toolevents.error.DiffComputationException;
import com.zzf.toolevents.protocol.FileChange;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Exclusive-lock wrapper shared by every patch call of a turn. Each method is a
 * single critical section; callers must not send events while inside one.
 */
public final class SharedTurnDiffTracker {
    private final TurnDiffTracker tracker;
    private final Object lock = new Object();

    public SharedTurnDiffTracker(TurnDiffTracker tracker) {
        if (tracker == null) {
            throw new IllegalArgumentException("tracker is null");
        }
        this.tracker = tracker;
    }

    public void onPatchBegin(Map<Path, FileChange> changes) {
        synchronized (lock) {
            tracker.onPatchBegin(changes);
        }
    }

    public Optional<String> getUnifiedDiff() throws DiffComputationException {
        synchronized (lock) {
            return tracker.getUnifiedDiff();
        }
    }

    /**
     * Whether the calling thread is inside one of this tracker's critical sections.
     */
    public boolean isHeldByCurrentThread() {
        return Thread.holdsLock(lock);
    }
}
