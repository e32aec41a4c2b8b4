package com.zzf.toolevents.diff;

import com.zzf.toolevents.project.ProjectContext;
import com.zzf.toolevents.shell.ShellService;

/**
 * Hands out one locked snapshot tracker per turn; every patch call of the turn
 * shares the instance returned here.
 */
public class TurnDiffTrackerFactory {
    private final ProjectContext projectContext;
    private final ShellService shellService;
    private final String snapshotDir;

    public TurnDiffTrackerFactory(ProjectContext projectContext, ShellService shellService, String snapshotDir) {
        this.projectContext = projectContext;
        this.shellService = shellService;
        this.snapshotDir = snapshotDir;
    }

    public SharedTurnDiffTracker newTurn() {
        return new SharedTurnDiffTracker(new SnapshotTurnDiffTracker(projectContext, shellService, snapshotDir));
    }
}
