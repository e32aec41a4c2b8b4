package com.zzf.toolevents.shell;

import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Runs short helper processes (git) for the snapshot tracker.
 */
@Slf4j
public class ShellService {

    public ExecuteResult execute(List<String> command, String gitDir, String workTree) {
        return execute(command, gitDir, workTree, Collections.emptyMap());
    }

    /**
     * Runs {@code command} in {@code workTree} with {@code GIT_DIR} / {@code GIT_WORK_TREE}
     * exported when given, plus {@code extraEnv}. Output is returned byte for byte,
     * line endings included. Launch failures are reported as exit code -1.
     */
    public ExecuteResult execute(List<String> command, String gitDir, String workTree, Map<String, String> extraEnv) {
        try {
            ProcessBuilder pb = new ProcessBuilder(command);
            if (workTree != null) {
                pb.directory(new File(workTree));
            }
            Map<String, String> env = pb.environment();
            if (gitDir != null) env.put("GIT_DIR", gitDir);
            if (workTree != null) env.put("GIT_WORK_TREE", workTree);
            if (extraEnv != null) env.putAll(extraEnv);

            Process p = pb.start();
            CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> readAll(p.getErrorStream()));
            String stdout = readAll(p.getInputStream());
            int exitCode = p.waitFor();
            return new ExecuteResult(exitCode, stdout, stderr.join());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new ExecuteResult(-1, "", "interrupted");
        } catch (Exception e) {
            log.error("Failed to execute command: {}", command, e);
            return new ExecuteResult(-1, "", String.valueOf(e.getMessage()));
        }
    }

    private static String readAll(InputStream in) {
        try (InputStream stream = in) {
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (Exception e) {
            log.warn("shell.read.fail err={}", e.toString());
            return "";
        }
    }

    @Data
    @RequiredArgsConstructor
    public static class ExecuteResult {
        private final int exitCode;
        private final String stdout;
        private final String stderr;

        public String text() {
            return stdout;
        }
    }
}
