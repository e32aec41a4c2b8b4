package com.zzf.toolevents.tool;

import com.zzf.toolevents.exec.ExecToolCallOutput;

/**
 * Lifecycle position of an invocation. Every call id goes through {@code begin}
 * followed by exactly one of {@code success} or {@code failure}.
 */
public abstract class ToolEventStage {
    private static final ToolEventStage BEGIN = new Begin();

    private ToolEventStage() {
    }

    public interface Visitor<R> {
        R begin();

        R success(ExecToolCallOutput output);

        R failure(ToolEventFailure failure);
    }

    public abstract <R> R accept(Visitor<R> visitor);

    public static ToolEventStage begin() {
        return BEGIN;
    }

    public static ToolEventStage success(ExecToolCallOutput output) {
        if (output == null) {
            throw new IllegalArgumentException("output is null");
        }
        return new Success(output);
    }

    public static ToolEventStage failure(ToolEventFailure failure) {
        if (failure == null) {
            throw new IllegalArgumentException("failure is null");
        }
        return new Failure(failure);
    }

    static final class Begin extends ToolEventStage {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.begin();
        }

        @Override
        public String toString() {
            return "Begin";
        }
    }

    static final class Success extends ToolEventStage {
        private final ExecToolCallOutput output;

        private Success(ExecToolCallOutput output) {
            this.output = output;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.success(output);
        }

        @Override
        public String toString() {
            return "Success(exit=" + output.getExitCode() + ")";
        }
    }

    static final class Failure extends ToolEventStage {
        private final ToolEventFailure failure;

        private Failure(ToolEventFailure failure) {
            this.failure = failure;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.failure(failure);
        }

        @Override
        public String toString() {
            return "Failure(" + failure + ")";
        }
    }
}
