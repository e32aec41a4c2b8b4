package com.zzf.toolevents.diff;

import com.zzf.toolevents.error.DiffComputationException;
import com.zzf.toolevents.protocol.FileChange;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Accumulates the files touched by patches during one turn.
 * Not thread-safe; share it through {@link SharedTurnDiffTracker}.
 */
public interface TurnDiffTracker {

    /**
     * Called before a patch is applied so pre-images can be captured.
     */
    void onPatchBegin(Map<Path, FileChange> changes);

    /**
     * @return the unified diff of everything tracked so far, or empty when nothing changed
     */
    Optional<String> getUnifiedDiff() throws DiffComputationException;
}
