package com.zzf.toolevents.diff;

import com.zzf.toolevents.error.DiffComputationException;
import com.zzf.toolevents.project.ProjectContext;
import com.zzf.toolevents.protocol.FileChange;
import com.zzf.toolevents.shell.ShellService;
import com.zzf.toolevents.shell.ShellService.ExecuteResult;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Git-backed {@link TurnDiffTracker} working in a private git dir, so the
 * worktree does not need to be a repository. The first time a patch touches a
 * path its current content is stored as a blob; the turn diff compares every
 * touched path against its own pre-image.
 */
@Slf4j
public class SnapshotTurnDiffTracker implements TurnDiffTracker {
    public static final String DEFAULT_SNAPSHOT_DIR = ".tool-events/snapshot";
    private static final String TURN_INDEX = "turn-index";
    private static final String FILE_MODE = "100644";

    private final ProjectContext projectContext;
    private final ShellService shellService;
    private final String snapshotDir;
    // Empty when the path did not exist before its first patch.
    private final Map<String, Optional<String>> baselines = new LinkedHashMap<>();
    private boolean initialized;

    public SnapshotTurnDiffTracker(ProjectContext projectContext, ShellService shellService) {
        this(projectContext, shellService, DEFAULT_SNAPSHOT_DIR);
    }

    public SnapshotTurnDiffTracker(ProjectContext projectContext, ShellService shellService, String snapshotDir) {
        this.projectContext = projectContext;
        this.shellService = shellService;
        this.snapshotDir = snapshotDir == null || snapshotDir.isBlank() ? DEFAULT_SNAPSHOT_DIR : snapshotDir;
    }

    private String gitdir() {
        return Paths.get(projectContext.getDirectory()).resolve(snapshotDir).toString();
    }

    @Override
    public void onPatchBegin(Map<Path, FileChange> changes) {
        if (changes == null || changes.isEmpty()) {
            return;
        }
        for (Map.Entry<Path, FileChange> entry : changes.entrySet()) {
            capture(relativize(entry.getKey()));
            if (entry.getValue() instanceof FileChange.Update update && update.getMovePath() != null) {
                capture(relativize(update.getMovePath()));
            }
        }
    }

    @Override
    public Optional<String> getUnifiedDiff() throws DiffComputationException {
        if (baselines.isEmpty()) {
            return Optional.empty();
        }
        Map<String, String> env = Collections.singletonMap("GIT_INDEX_FILE", Paths.get(gitdir(), TURN_INDEX).toString());
        List<String> paths = new ArrayList<>();

        run(env, "read-tree", "--empty");
        for (Map.Entry<String, Optional<String>> entry : baselines.entrySet()) {
            if (entry.getValue().isPresent()) {
                run(env, "update-index", "--add", "--cacheinfo", FILE_MODE, entry.getValue().get(), entry.getKey());
                paths.add(entry.getKey());
            }
        }
        String tree = run(env, "write-tree").trim();

        for (Map.Entry<String, Optional<String>> entry : baselines.entrySet()) {
            String path = entry.getKey();
            Optional<String> current = hashWorktreeFile(path);
            if (current.isPresent()) {
                run(env, "update-index", "--add", "--cacheinfo", FILE_MODE, current.get(), path);
                if (!paths.contains(path)) {
                    paths.add(path);
                }
            } else if (entry.getValue().isPresent()) {
                run(env, "update-index", "--force-remove", "--", path);
            }
        }
        if (paths.isEmpty()) {
            return Optional.empty();
        }

        List<String> diff = new ArrayList<>(Arrays.asList("-c", "core.quotepath=false",
                "diff", "--cached", "--no-ext-diff", "--no-color", tree, "--"));
        diff.addAll(paths);
        String text = run(env, diff.toArray(new String[0]));
        if (text.trim().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(text);
    }

    public Set<String> getTouchedPaths() {
        return Collections.unmodifiableSet(baselines.keySet());
    }

    private void capture(String path) {
        if (baselines.containsKey(path) || !ensureRepository()) {
            return;
        }
        try {
            baselines.put(path, hashWorktreeFile(path));
        } catch (DiffComputationException e) {
            log.warn("snapshot.preimage.fail path={} err={}", path, e.getMessage());
        }
    }

    private boolean ensureRepository() {
        if (initialized) {
            return true;
        }
        String gitDir = gitdir();
        File gitDirFile = new File(gitDir);
        if (!gitDirFile.exists()) {
            gitDirFile.mkdirs();
            ExecuteResult init = shellService.execute(git("init"), gitDir, projectContext.getWorktree(), Collections.emptyMap());
            if (init.getExitCode() != 0) {
                log.warn("Snapshot init failed in {}: {}", gitDir, init.getStderr());
                return false;
            }
            shellService.execute(git("config", "core.autocrlf", "false"), gitDir, projectContext.getWorktree(), Collections.emptyMap());
            log.info("Snapshot initialized at {}", gitDir);
        }
        initialized = true;
        return true;
    }

    private Optional<String> hashWorktreeFile(String path) throws DiffComputationException {
        Path file = worktreeRoot().resolve(path);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        String hash = run(Collections.emptyMap(), "hash-object", "-w", "--no-filters", "--", path).trim();
        if (hash.isEmpty()) {
            throw new DiffComputationException("git hash-object returned nothing for " + path);
        }
        return Optional.of(hash);
    }

    private String run(Map<String, String> env, String... args) throws DiffComputationException {
        ExecuteResult result = shellService.execute(git(args), gitdir(), projectContext.getWorktree(), env);
        if (result.getExitCode() != 0) {
            throw new DiffComputationException("git " + args[0] + " failed: " + result.getStderr());
        }
        return result.text() == null ? "" : result.text();
    }

    private Path worktreeRoot() {
        return Paths.get(projectContext.getWorktree()).toAbsolutePath().normalize();
    }

    private String relativize(Path path) {
        Path root = worktreeRoot();
        Path p = path.isAbsolute() ? path.normalize() : root.resolve(path).normalize();
        Path rel = p.startsWith(root) ? root.relativize(p) : p;
        return rel.toString().replace('\\', '/');
    }

    private static List<String> git(String... args) {
        List<String> command = new ArrayList<>();
        command.add("git");
        command.addAll(Arrays.asList(args));
        return command;
    }
}
