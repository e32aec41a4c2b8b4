package com.zzf.toolevents.tool;

import com.zzf.toolevents.error.ExecutionFailedException;
import com.zzf.toolevents.error.SandboxException;
import com.zzf.toolevents.error.ToolException;
import com.zzf.toolevents.error.ToolRejectedException;
import com.zzf.toolevents.exec.ExecOutputFormatter;
import com.zzf.toolevents.exec.ExecToolCallOutput;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Turns the raw result of an execution into the text returned to the model and
 * the end stage emitted for the UI. Both are derived from the same values, and
 * the end event is sent before the returned future completes.
 */
@Slf4j
public class ToolOutcomeNormalizer {
    public static final String DEFAULT_ABORTED_MESSAGE = "aborted";
    static final String EXECUTION_ERROR_PREFIX = "execution error: ";

    private final ToolEventDispatcher dispatcher;
    private final ExecOutputFormatter formatter;
    private final RejectionNormalizer rejections;
    private final String abortedMessage;

    public ToolOutcomeNormalizer(ToolEventDispatcher dispatcher, ExecOutputFormatter formatter) {
        this(dispatcher, formatter, RejectionNormalizer.defaults(), DEFAULT_ABORTED_MESSAGE);
    }

    public ToolOutcomeNormalizer(ToolEventDispatcher dispatcher, ExecOutputFormatter formatter,
                                 RejectionNormalizer rejections, String abortedMessage) {
        if (dispatcher == null || formatter == null) {
            throw new IllegalArgumentException("dispatcher and formatter are required");
        }
        this.dispatcher = dispatcher;
        this.formatter = formatter;
        this.rejections = rejections == null ? RejectionNormalizer.defaults() : rejections;
        this.abortedMessage = abortedMessage == null || abortedMessage.isBlank() ? DEFAULT_ABORTED_MESSAGE : abortedMessage;
    }

    public CompletableFuture<FunctionCallOutcome> finish(ToolEmitter emitter, ToolEventContext ctx, ExecToolCallOutput output) {
        return finish(emitter, ctx, output, null);
    }

    public CompletableFuture<FunctionCallOutcome> finish(ToolEmitter emitter, ToolEventContext ctx, ToolException error) {
        return finish(emitter, ctx, null, error);
    }

    /**
     * Shaped for {@link CompletableFuture#handle}: exactly one of {@code output}
     * and {@code error} is expected to be non-null.
     */
    public CompletableFuture<FunctionCallOutcome> finish(ToolEmitter emitter, ToolEventContext ctx,
                                                         ExecToolCallOutput output, Throwable error) {
        Normalized normalized = normalize(output, error);
        return dispatcher.emit(emitter, ctx, normalized.getStage())
                .thenApply(v -> normalized.getOutcome());
    }

    Normalized normalize(ExecToolCallOutput output, Throwable error) {
        if (output != null && error == null) {
            String content = formatter.formatForModel(output);
            FunctionCallOutcome outcome = output.getExitCode() == 0
                    ? FunctionCallOutcome.ok(content)
                    : FunctionCallOutcome.respondToModel(content);
            return new Normalized(ToolEventStage.success(output), outcome);
        }

        Throwable cause = unwrap(error == null ? new ExecutionFailedException("executor returned no output") : error);

        if (cause instanceof ToolRejectedException) {
            return messageFailure(rejections.normalize(cause.getMessage()));
        }
        if (cause instanceof SandboxException) {
            SandboxException sandbox = (SandboxException) cause;
            boolean policyBlock = sandbox.getKind() == SandboxException.Kind.TIMEOUT
                    || sandbox.getKind() == SandboxException.Kind.DENIED;
            if (policyBlock && sandbox.getOutput().isPresent()) {
                ExecToolCallOutput blocked = sandbox.getOutput().get();
                return new Normalized(
                        ToolEventStage.failure(ToolEventFailure.output(blocked)),
                        FunctionCallOutcome.respondToModel(formatter.formatForModel(blocked)));
            }
        }
        if (cause instanceof CancellationException) {
            return messageFailure(abortedMessage);
        }
        if (!(cause instanceof ToolException)) {
            log.warn("tool.finish.unexpected err={}", cause.toString());
        }
        return messageFailure(EXECUTION_ERROR_PREFIX + describe(cause));
    }

    private static Normalized messageFailure(String message) {
        return new Normalized(
                ToolEventStage.failure(ToolEventFailure.message(message)),
                FunctionCallOutcome.respondToModel(message));
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String describe(Throwable error) {
        if (error instanceof ToolException) {
            return ((ToolException) error).describe();
        }
        String msg = error.getMessage();
        if (msg == null || msg.trim().isEmpty()) {
            return error.getClass().getSimpleName();
        }
        return error.getClass().getSimpleName() + ": " + msg;
    }

    @Value
    static class Normalized {
        ToolEventStage stage;
        FunctionCallOutcome outcome;
    }
}
