package com.zzf.toolevents.tool;

import com.zzf.toolevents.exec.ExecToolCallOutput;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Drives one invocation through begin, execution and finish. The end event is
 * emitted on every path, including a cancelled or throwing execution.
 */
@Slf4j
public class ToolEventRunner {
    private final ToolEventDispatcher dispatcher;
    private final ToolOutcomeNormalizer normalizer;

    public ToolEventRunner(ToolEventDispatcher dispatcher, ToolOutcomeNormalizer normalizer) {
        if (dispatcher == null || normalizer == null) {
            throw new IllegalArgumentException("dispatcher and normalizer are required");
        }
        this.dispatcher = dispatcher;
        this.normalizer = normalizer;
    }

    public CompletableFuture<FunctionCallOutcome> run(ToolEmitter emitter, ToolEventContext ctx,
                                                      Supplier<CompletableFuture<ExecToolCallOutput>> execution) {
        long start = System.currentTimeMillis();
        return dispatcher.begin(emitter, ctx)
                .thenCompose(v -> execute(execution))
                .handle((output, error) -> normalizer.finish(emitter, ctx, output, error))
                .thenCompose(Function.identity())
                .whenComplete((outcome, error) -> {
                    if (error != null) {
                        log.warn("tool.run.fail callId={} kind={} err={}", ctx.getCallId(), emitter.kind(), error.toString());
                    } else {
                        log.info("tool.run callId={} kind={} success={} durationMs={}",
                                ctx.getCallId(), emitter.kind(), outcome.isSuccess(), System.currentTimeMillis() - start);
                    }
                });
    }

    private static CompletableFuture<ExecToolCallOutput> execute(Supplier<CompletableFuture<ExecToolCallOutput>> execution) {
        try {
            CompletableFuture<ExecToolCallOutput> future = execution.get();
            if (future == null) {
                return CompletableFuture.failedFuture(new IllegalStateException("execution returned no future"));
            }
            return future;
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
