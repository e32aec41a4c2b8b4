package com.zzf.toolevents.tool;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Text returned to the conversation for one tool call. When {@code success}
 * is false the content is an error the model should read and react to.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class FunctionCallOutcome {
    String content;
    boolean success;

    public static FunctionCallOutcome ok(String content) {
        return new FunctionCallOutcome(content == null ? "" : content, true);
    }

    public static FunctionCallOutcome respondToModel(String content) {
        return new FunctionCallOutcome(content == null ? "" : content, false);
    }
}
