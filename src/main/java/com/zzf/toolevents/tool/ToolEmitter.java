package com.zzf.toolevents.tool;

import com.zzf.toolevents.parse.CommandParser;
import com.zzf.toolevents.parse.ShellCommandParser;
import com.zzf.toolevents.protocol.ExecCommandSource;
import com.zzf.toolevents.protocol.FileChange;
import com.zzf.toolevents.protocol.ParsedCommand;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Static description of one in-flight tool invocation, captured once when the
 * invocation starts so that its begin and end events carry identical metadata.
 *
 * <p>The set of kinds is closed: the constructor is private and every consumer
 * goes through {@link Visitor}, so a new kind fails to compile until each
 * dispatcher handles it.
 */
public abstract class ToolEmitter {
    private static final CommandParser DEFAULT_PARSER = new ShellCommandParser();

    private ToolEmitter() {
    }

    public interface Visitor<R> {
        R visitShell(Shell shell);

        R visitApplyPatch(ApplyPatch applyPatch);

        R visitUnifiedExec(UnifiedExec unifiedExec);
    }

    public abstract <R> R accept(Visitor<R> visitor);

    /**
     * Short name used in logs.
     */
    public abstract String kind();

    public static Shell shell(List<String> command, Path cwd, ExecCommandSource source) {
        return shell(command, cwd, source, DEFAULT_PARSER);
    }

    public static Shell shell(List<String> command, Path cwd, ExecCommandSource source, CommandParser parser) {
        List<String> argv = copyOf(command);
        return new Shell(argv, cwd, sourceOrAgent(source), parse(parser, argv));
    }

    public static ApplyPatch applyPatch(Map<Path, FileChange> changes, boolean autoApproved) {
        Map<Path, FileChange> copy = new LinkedHashMap<>();
        if (changes != null) {
            copy.putAll(changes);
        }
        return new ApplyPatch(Collections.unmodifiableMap(copy), autoApproved);
    }

    public static UnifiedExec unifiedExec(List<String> command, Path cwd, ExecCommandSource source, String interactionInput) {
        return unifiedExec(command, cwd, source, interactionInput, DEFAULT_PARSER);
    }

    public static UnifiedExec unifiedExec(List<String> command, Path cwd, ExecCommandSource source,
                                          String interactionInput, CommandParser parser) {
        List<String> argv = copyOf(command);
        return new UnifiedExec(argv, cwd, sourceOrAgent(source), interactionInput, parse(parser, argv));
    }

    private static List<String> copyOf(List<String> command) {
        if (command == null) {
            return Collections.emptyList();
        }
        List<String> copy = new ArrayList<>(command.size());
        for (String token : command) {
            copy.add(token == null ? "" : token);
        }
        return Collections.unmodifiableList(copy);
    }

    private static ExecCommandSource sourceOrAgent(ExecCommandSource source) {
        return source == null ? ExecCommandSource.AGENT : source;
    }

    private static List<ParsedCommand> parse(CommandParser parser, List<String> argv) {
        List<ParsedCommand> parsed = (parser == null ? DEFAULT_PARSER : parser).parse(argv);
        return parsed == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(parsed));
    }

    public static final class Shell extends ToolEmitter {
        private final List<String> command;
        private final Path cwd;
        private final ExecCommandSource source;
        private final List<ParsedCommand> parsedCmd;

        private Shell(List<String> command, Path cwd, ExecCommandSource source, List<ParsedCommand> parsedCmd) {
            this.command = command;
            this.cwd = cwd;
            this.source = source;
            this.parsedCmd = parsedCmd;
        }

        public List<String> getCommand() {
            return command;
        }

        public Path getCwd() {
            return cwd;
        }

        public ExecCommandSource getSource() {
            return source;
        }

        public List<ParsedCommand> getParsedCmd() {
            return parsedCmd;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitShell(this);
        }

        @Override
        public String kind() {
            return "shell";
        }
    }

    public static final class ApplyPatch extends ToolEmitter {
        private final Map<Path, FileChange> changes;
        private final boolean autoApproved;

        private ApplyPatch(Map<Path, FileChange> changes, boolean autoApproved) {
            this.changes = changes;
            this.autoApproved = autoApproved;
        }

        public Map<Path, FileChange> getChanges() {
            return changes;
        }

        public boolean isAutoApproved() {
            return autoApproved;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitApplyPatch(this);
        }

        @Override
        public String kind() {
            return "apply_patch";
        }
    }

    public static final class UnifiedExec extends ToolEmitter {
        private final List<String> command;
        private final Path cwd;
        private final ExecCommandSource source;
        private final String interactionInput;
        private final List<ParsedCommand> parsedCmd;

        private UnifiedExec(List<String> command, Path cwd, ExecCommandSource source,
                            String interactionInput, List<ParsedCommand> parsedCmd) {
            this.command = command;
            this.cwd = cwd;
            this.source = source;
            this.interactionInput = interactionInput;
            this.parsedCmd = parsedCmd;
        }

        public List<String> getCommand() {
            return command;
        }

        public Path getCwd() {
            return cwd;
        }

        public ExecCommandSource getSource() {
            return source;
        }

        public String getInteractionInput() {
            return interactionInput;
        }

        public List<ParsedCommand> getParsedCmd() {
            return parsedCmd;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUnifiedExec(this);
        }

        @Override
        public String kind() {
            return "unified_exec";
        }
    }
}
