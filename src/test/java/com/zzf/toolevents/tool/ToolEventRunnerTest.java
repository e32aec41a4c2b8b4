package com.zzf.toolevents.tool;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.toolevents.error.ToolRejectedException;
import com.zzf.toolevents.exec.ExecOutputFormatter;
import com.zzf.toolevents.exec.ExecToolCallOutput;
import com.zzf.toolevents.protocol.ExecCommandEndEvent;
import com.zzf.toolevents.protocol.ExecCommandSource;
import com.zzf.toolevents.session.TurnContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.Arrays;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolEventRunnerTest {

    private RecordingSession session;
    private ToolEventRunner runner;
    private ToolEventContext ctx;
    private ToolEmitter emitter;

    @BeforeEach
    void setUp() {
        session = new RecordingSession();
        ExecOutputFormatter formatter = new ExecOutputFormatter(new ObjectMapper());
        ToolEventDispatcher dispatcher = new ToolEventDispatcher(formatter);
        runner = new ToolEventRunner(dispatcher, new ToolOutcomeNormalizer(dispatcher, formatter));
        ctx = ToolEventContext.of(session, TurnContext.builder().subId("t").build(), "run-1");
        emitter = ToolEmitter.shell(Arrays.asList("git", "status"), Paths.get("/repo"), ExecCommandSource.AGENT);
    }

    @Test
    void runsBeginExecuteFinish() {
        FunctionCallOutcome outcome = runner.run(emitter, ctx, () -> CompletableFuture.completedFuture(
                ExecToolCallOutput.builder().stdout("clean").aggregatedOutput("clean").build())).join();

        assertTrue(outcome.isSuccess());
        assertEquals(Arrays.asList("exec_command_begin", "exec_command_end"), session.types());
    }

    @Test
    void beginIsSentBeforeExecutionStarts() {
        runner.run(emitter, ctx, () -> {
            assertEquals(Arrays.asList("exec_command_begin"), session.types());
            return CompletableFuture.completedFuture(ExecToolCallOutput.builder().build());
        }).join();
    }

    @Test
    void cancelledExecutionStillEmitsEnd() {
        CompletableFuture<ExecToolCallOutput> execution = new CompletableFuture<>();
        CompletableFuture<FunctionCallOutcome> result = runner.run(emitter, ctx, () -> execution);

        execution.cancel(true);

        FunctionCallOutcome outcome = result.join();
        assertFalse(outcome.isSuccess());
        assertEquals("aborted", outcome.getContent());
        assertEquals(Arrays.asList("exec_command_begin", "exec_command_end"), session.types());
        assertEquals("aborted", session.get(1, ExecCommandEndEvent.class).getStderr());
    }

    @Test
    void throwingSupplierStillEmitsEnd() {
        FunctionCallOutcome outcome = runner.run(emitter, ctx, () -> {
            throw new IllegalStateException("executor offline");
        }).join();

        assertEquals("execution error: IllegalStateException: executor offline", outcome.getContent());
        assertEquals(-1, session.get(1, ExecCommandEndEvent.class).getExitCode());
    }

    @Test
    void rejectionFromExecutorIsNormalized() {
        FunctionCallOutcome outcome = runner.run(emitter, ctx,
                () -> CompletableFuture.failedFuture(new ToolRejectedException("rejected by user"))).join();

        assertEquals("exec command rejected by user", outcome.getContent());
    }
}
