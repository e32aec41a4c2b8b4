package com.zzf.toolevents.exec;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * What the executor produced for one run: separate and interleaved streams,
 * exit code and wall time. {@code timedOut} is set when the sandbox killed the
 * process at its deadline.
 */
@Value
@Builder(toBuilder = true)
public class ExecToolCallOutput {
    @Builder.Default
    String stdout = "";
    @Builder.Default
    String stderr = "";
    @Builder.Default
    String aggregatedOutput = "";
    int exitCode;
    @Builder.Default
    Duration duration = Duration.ZERO;
    boolean timedOut;
}
