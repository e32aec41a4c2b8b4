package com.zzf.toolevents.tool;

import com.zzf.toolevents.diff.SharedTurnDiffTracker;
import com.zzf.toolevents.error.DiffComputationException;
import com.zzf.toolevents.exec.ExecOutputFormatter;
import com.zzf.toolevents.exec.ExecToolCallOutput;
import com.zzf.toolevents.protocol.EventMsg;
import com.zzf.toolevents.protocol.ExecCommandBeginEvent;
import com.zzf.toolevents.protocol.ExecCommandEndEvent;
import com.zzf.toolevents.protocol.PatchApplyBeginEvent;
import com.zzf.toolevents.protocol.PatchApplyEndEvent;
import com.zzf.toolevents.protocol.TurnDiffEvent;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Maps every (emitter kind, stage) pair to exactly one outbound event.
 *
 * <p>Patch begin notifies the turn diff tracker before the begin event is sent.
 * Patch end is followed by a {@code turn_diff} event when the tracker has a
 * non-empty diff. The tracker lock is never held while sending, and a tracker
 * failure never fails the patch events.
 */
@Slf4j
public class ToolEventDispatcher {
    private final ExecOutputFormatter formatter;

    public ToolEventDispatcher(ExecOutputFormatter formatter) {
        if (formatter == null) {
            throw new IllegalArgumentException("formatter is null");
        }
        this.formatter = formatter;
    }

    public CompletableFuture<Void> begin(ToolEmitter emitter, ToolEventContext ctx) {
        return emit(emitter, ctx, ToolEventStage.begin());
    }

    public CompletableFuture<Void> emit(ToolEmitter emitter, ToolEventContext ctx, ToolEventStage stage) {
        return emitter.accept(new ToolEmitter.Visitor<CompletableFuture<Void>>() {
            @Override
            public CompletableFuture<Void> visitShell(ToolEmitter.Shell shell) {
                return emitExec(ctx, ExecEventMetadata.of(shell), stage);
            }

            @Override
            public CompletableFuture<Void> visitApplyPatch(ToolEmitter.ApplyPatch applyPatch) {
                return emitPatch(ctx, applyPatch, stage);
            }

            @Override
            public CompletableFuture<Void> visitUnifiedExec(ToolEmitter.UnifiedExec unifiedExec) {
                return emitExec(ctx, ExecEventMetadata.of(unifiedExec), stage);
            }
        });
    }

    private CompletableFuture<Void> emitExec(ToolEventContext ctx, ExecEventMetadata meta, ToolEventStage stage) {
        return stage.accept(new ToolEventStage.Visitor<CompletableFuture<Void>>() {
            @Override
            public CompletableFuture<Void> begin() {
                return send(ctx, ExecCommandBeginEvent.builder()
                        .callId(ctx.getCallId())
                        .turnId(ctx.getTurnId())
                        .command(meta.getCommand())
                        .cwd(meta.getCwd())
                        .parsedCmd(meta.getParsedCmd())
                        .source(meta.getSource())
                        .interactionInput(meta.getInteractionInput())
                        .build());
            }

            @Override
            public CompletableFuture<Void> success(ExecToolCallOutput output) {
                return emitExecEnd(ctx, meta, ExecCommandResultPayload.fromOutput(output, formatter));
            }

            @Override
            public CompletableFuture<Void> failure(ToolEventFailure failure) {
                return failure.accept(new ToolEventFailure.Visitor<CompletableFuture<Void>>() {
                    @Override
                    public CompletableFuture<Void> output(ExecToolCallOutput output) {
                        return emitExecEnd(ctx, meta, ExecCommandResultPayload.fromOutput(output, formatter));
                    }

                    @Override
                    public CompletableFuture<Void> message(String message) {
                        return emitExecEnd(ctx, meta, ExecCommandResultPayload.fromMessage(message));
                    }
                });
            }
        });
    }

    private CompletableFuture<Void> emitPatch(ToolEventContext ctx, ToolEmitter.ApplyPatch patch, ToolEventStage stage) {
        return stage.accept(new ToolEventStage.Visitor<CompletableFuture<Void>>() {
            @Override
            public CompletableFuture<Void> begin() {
                ctx.getTurnDiffTracker().ifPresent(tracker -> notifyPatchBegin(ctx, tracker, patch));
                return send(ctx, PatchApplyBeginEvent.builder()
                        .callId(ctx.getCallId())
                        .autoApproved(patch.isAutoApproved())
                        .changes(patch.getChanges())
                        .build());
            }

            @Override
            public CompletableFuture<Void> success(ExecToolCallOutput output) {
                return emitPatchEnd(ctx, output.getStdout(), output.getStderr(), output.getExitCode() == 0);
            }

            @Override
            public CompletableFuture<Void> failure(ToolEventFailure failure) {
                return failure.accept(new ToolEventFailure.Visitor<CompletableFuture<Void>>() {
                    @Override
                    public CompletableFuture<Void> output(ExecToolCallOutput output) {
                        return emitPatchEnd(ctx, output.getStdout(), output.getStderr(), output.getExitCode() == 0);
                    }

                    @Override
                    public CompletableFuture<Void> message(String message) {
                        return emitPatchEnd(ctx, "", message, false);
                    }
                });
            }
        });
    }

    private CompletableFuture<Void> emitExecEnd(ToolEventContext ctx, ExecEventMetadata meta, ExecCommandResultPayload payload) {
        return send(ctx, ExecCommandEndEvent.builder()
                .callId(ctx.getCallId())
                .turnId(ctx.getTurnId())
                .command(meta.getCommand())
                .cwd(meta.getCwd())
                .parsedCmd(meta.getParsedCmd())
                .source(meta.getSource())
                .interactionInput(meta.getInteractionInput())
                .stdout(payload.getStdout())
                .stderr(payload.getStderr())
                .aggregatedOutput(payload.getAggregatedOutput())
                .exitCode(payload.getExitCode())
                .duration(payload.getDuration())
                .formattedOutput(payload.getFormattedOutput())
                .build());
    }

    private CompletableFuture<Void> emitPatchEnd(ToolEventContext ctx, String stdout, String stderr, boolean success) {
        CompletableFuture<Void> sent = send(ctx, PatchApplyEndEvent.builder()
                .callId(ctx.getCallId())
                .stdout(stdout)
                .stderr(stderr)
                .success(success)
                .build());
        Optional<SharedTurnDiffTracker> tracker = ctx.getTurnDiffTracker();
        if (tracker.isEmpty()) {
            return sent;
        }
        return sent.thenCompose(v -> readTurnDiff(ctx, tracker.get())
                .map(diff -> send(ctx, TurnDiffEvent.builder().unifiedDiff(diff).build()))
                .orElseGet(() -> CompletableFuture.completedFuture(null)));
    }

    private Optional<String> readTurnDiff(ToolEventContext ctx, SharedTurnDiffTracker tracker) {
        try {
            return tracker.getUnifiedDiff().filter(diff -> !diff.isEmpty());
        } catch (DiffComputationException | RuntimeException e) {
            log.warn("tool.turn_diff.fail callId={} err={}", ctx.getCallId(), e.toString());
            return Optional.empty();
        }
    }

    private void notifyPatchBegin(ToolEventContext ctx, SharedTurnDiffTracker tracker, ToolEmitter.ApplyPatch patch) {
        try {
            tracker.onPatchBegin(patch.getChanges());
        } catch (RuntimeException e) {
            log.warn("tool.patch_begin.track.fail callId={} err={}", ctx.getCallId(), e.toString());
        }
    }

    private CompletableFuture<Void> send(ToolEventContext ctx, EventMsg msg) {
        log.debug("tool.event type={} callId={} turnId={}", msg.getEventType().wireName(), ctx.getCallId(), ctx.getTurnId());
        return ctx.getSession().sendEvent(ctx.getTurn(), msg);
    }
}
