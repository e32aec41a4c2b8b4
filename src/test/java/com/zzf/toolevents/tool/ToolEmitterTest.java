package com.zzf.toolevents.tool;

import com.zzf.toolevents.parse.CommandParser;
import com.zzf.toolevents.protocol.ExecCommandSource;
import com.zzf.toolevents.protocol.FileChange;
import com.zzf.toolevents.protocol.ParsedCommand;
import com.zzf.toolevents.session.TurnContext;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ToolEmitterTest {

    @Test
    void parserIsCalledOnceAtConstruction() {
        CommandParser parser = mock(CommandParser.class);
        when(parser.parse(anyList())).thenReturn(Collections.singletonList(ParsedCommand.unknown("make")));

        ToolEmitter.Shell shell = ToolEmitter.shell(Arrays.asList("make"), Paths.get("/p"), ExecCommandSource.AGENT, parser);
        shell.getParsedCmd();
        shell.getParsedCmd();

        verify(parser, times(1)).parse(anyList());
        assertEquals(Collections.singletonList(ParsedCommand.unknown("make")), shell.getParsedCmd());
    }

    @Test
    void commandIsCopied() {
        List<String> command = new ArrayList<>(Arrays.asList("echo", "a"));
        ToolEmitter.UnifiedExec exec = ToolEmitter.unifiedExec(command, Paths.get("/p"), null, null);

        command.add("b");

        assertEquals(Arrays.asList("echo", "a"), exec.getCommand());
        assertEquals(ExecCommandSource.AGENT, exec.getSource());
        assertThrows(UnsupportedOperationException.class, () -> exec.getCommand().add("c"));
    }

    @Test
    void nullInputsNeverFail() {
        ToolEmitter.Shell shell = ToolEmitter.shell(null, null, null);
        ToolEmitter.ApplyPatch patch = ToolEmitter.applyPatch(null, false);

        assertTrue(shell.getCommand().isEmpty());
        assertTrue(patch.getChanges().isEmpty());
    }

    @Test
    void nullCommandTokensBecomeEmpty() {
        ToolEmitter.Shell shell = ToolEmitter.shell(Arrays.asList("echo", null), Paths.get("/p"), ExecCommandSource.AGENT);

        assertEquals(Arrays.asList("echo", ""), shell.getCommand());
    }

    @Test
    void patchChangesAreSnapshotted() {
        Map<Path, FileChange> changes = new HashMap<>();
        changes.put(Paths.get("a"), FileChange.add("x"));
        ToolEmitter.ApplyPatch patch = ToolEmitter.applyPatch(changes, true);

        changes.clear();

        assertEquals(1, patch.getChanges().size());
        assertEquals("apply_patch", patch.kind());
    }

    @Test
    void visitorReachesEachKind() {
        ToolEmitter.Visitor<String> names = new ToolEmitter.Visitor<String>() {
            @Override
            public String visitShell(ToolEmitter.Shell shell) {
                return "shell";
            }

            @Override
            public String visitApplyPatch(ToolEmitter.ApplyPatch applyPatch) {
                return "patch";
            }

            @Override
            public String visitUnifiedExec(ToolEmitter.UnifiedExec unifiedExec) {
                return "unified";
            }
        };

        assertEquals("shell", ToolEmitter.shell(Arrays.asList("ls"), null, null).accept(names));
        assertEquals("patch", ToolEmitter.applyPatch(null, true).accept(names));
        assertEquals("unified", ToolEmitter.unifiedExec(Arrays.asList("ls"), null, null, "q").accept(names));
    }

    @Test
    void contextRejectsBlankCallId() {
        TurnContext turn = TurnContext.builder().subId("t").build();

        assertThrows(IllegalArgumentException.class, () -> ToolEventContext.of(new RecordingSession(), turn, " "));
    }
}
