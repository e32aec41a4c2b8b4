package com.zzf.toolevents.error;

import com.zzf.toolevents.exec.ExecToolCallOutput;

import java.util.Locale;
import java.util.Optional;

/**
 * The sandbox stopped or refused the process. {@link Kind#TIMEOUT} and
 * {@link Kind#DENIED} carry the output captured so far.
 */
public class SandboxException extends ToolException {

    public enum Kind {
        TIMEOUT,
        DENIED,
        SIGNAL,
        SETUP
    }

    private final Kind kind;
    private final ExecToolCallOutput output;
    private final int signal;

    private SandboxException(Kind kind, String message, ExecToolCallOutput output, int signal, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.output = output;
        this.signal = signal;
    }

    public static SandboxException timeout(ExecToolCallOutput output) {
        return new SandboxException(Kind.TIMEOUT, "command timed out", output, 0, null);
    }

    public static SandboxException denied(ExecToolCallOutput output) {
        return new SandboxException(Kind.DENIED, "sandbox denied exec", output, 0, null);
    }

    public static SandboxException signal(int signal) {
        return new SandboxException(Kind.SIGNAL, "command was killed by signal " + signal, null, signal, null);
    }

    public static SandboxException setup(String message, Throwable cause) {
        return new SandboxException(Kind.SETUP, message, null, 0, cause);
    }

    public Kind getKind() {
        return kind;
    }

    public Optional<ExecToolCallOutput> getOutput() {
        return Optional.ofNullable(output);
    }

    public int getSignal() {
        return signal;
    }

    @Override
    public String describe() {
        return "sandbox " + kind.name().toLowerCase(Locale.ROOT) + ": " + getMessage();
    }
}
