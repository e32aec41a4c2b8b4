package com.zzf.toolevents.tool;

import com.zzf.toolevents.exec.ExecOutputFormatter;
import com.zzf.toolevents.exec.ExecToolCallOutput;
import lombok.Value;

import java.time.Duration;

/**
 * Result half of an exec end event.
 */
@Value
class ExecCommandResultPayload {
    /** Exit code reported when no process ran. */
    static final int NO_PROCESS_EXIT_CODE = -1;

    String stdout;
    String stderr;
    String aggregatedOutput;
    int exitCode;
    Duration duration;
    String formattedOutput;

    static ExecCommandResultPayload fromOutput(ExecToolCallOutput output, ExecOutputFormatter formatter) {
        return new ExecCommandResultPayload(
                output.getStdout(),
                output.getStderr(),
                output.getAggregatedOutput(),
                output.getExitCode(),
                output.getDuration(),
                formatter.formatForDisplay(output)
        );
    }

    static ExecCommandResultPayload fromMessage(String message) {
        return new ExecCommandResultPayload("", message, message, NO_PROCESS_EXIT_CODE, Duration.ZERO, message);
    }
}
