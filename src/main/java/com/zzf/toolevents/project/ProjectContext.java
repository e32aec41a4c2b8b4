package com.zzf.toolevents.project;

import lombok.Data;

/**
 * Directory the agent works in. {@code worktree} is the root of the checked-out
 * tree and defaults to {@code directory}.
 */
@Data
public class ProjectContext {
    private String directory = System.getProperty("user.dir");
    private String worktree = System.getProperty("user.dir");
}
