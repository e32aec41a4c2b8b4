package com.zzf.toolevents.tool;

import com.zzf.toolevents.exec.ExecToolCallOutput;

/**
 * Why an invocation failed: either real executor output is available or only a message.
 */
public abstract class ToolEventFailure {

    private ToolEventFailure() {
    }

    public interface Visitor<R> {
        R output(ExecToolCallOutput output);

        R message(String message);
    }

    public abstract <R> R accept(Visitor<R> visitor);

    public static ToolEventFailure output(ExecToolCallOutput output) {
        if (output == null) {
            throw new IllegalArgumentException("output is null");
        }
        return new Output(output);
    }

    public static ToolEventFailure message(String message) {
        return new Message(message == null ? "" : message);
    }

    static final class Output extends ToolEventFailure {
        private final ExecToolCallOutput output;

        private Output(ExecToolCallOutput output) {
            this.output = output;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.output(output);
        }

        @Override
        public String toString() {
            return "Failure.Output(exit=" + output.getExitCode() + ")";
        }
    }

    static final class Message extends ToolEventFailure {
        private final String message;

        private Message(String message) {
            this.message = message;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.message(message);
        }

        @Override
        public String toString() {
            return "Failure.Message(" + message + ")";
        }
    }
}
