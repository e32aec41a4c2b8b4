package com.zzf.toolevents.tool;

import com.zzf.toolevents.protocol.ExecCommandSource;
import com.zzf.toolevents.protocol.ParsedCommand;
import lombok.Value;

import java.nio.file.Path;
import java.util.List;

/**
 * Identifying fields shared by the begin and end events of an exec invocation.
 */
@Value
class ExecEventMetadata {
    List<String> command;
    Path cwd;
    List<ParsedCommand> parsedCmd;
    ExecCommandSource source;
    String interactionInput;

    static ExecEventMetadata of(ToolEmitter.Shell shell) {
        return new ExecEventMetadata(shell.getCommand(), shell.getCwd(), shell.getParsedCmd(), shell.getSource(), null);
    }

    static ExecEventMetadata of(ToolEmitter.UnifiedExec exec) {
        return new ExecEventMetadata(exec.getCommand(), exec.getCwd(), exec.getParsedCmd(), exec.getSource(),
                exec.getInteractionInput());
    }
}
