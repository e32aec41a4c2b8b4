package com.zzf.toolevents.parse;

import com.zzf.toolevents.protocol.ParsedCommand;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ShellCommandParserTest {

    private final ShellCommandParser parser = new ShellCommandParser();

    @Test
    void unwrapsShellScriptAndRecognisesRead() {
        List<ParsedCommand> parsed = parser.parse(Arrays.asList("bash", "-lc", "cat README.md"));

        assertEquals(Collections.singletonList(ParsedCommand.read("cat README.md", "README.md", "README.md")), parsed);
    }

    @Test
    void skipsCdAndKeepsSearch() {
        List<ParsedCommand> parsed = parser.parse(Arrays.asList("bash", "-lc", "cd src && rg -n foo lib"));

        assertEquals(Collections.singletonList(ParsedCommand.search("rg -n foo lib", "foo", "lib")), parsed);
    }

    @Test
    void grepLineNumberFlagDoesNotEatQuery() {
        assertEquals(Collections.singletonList(ParsedCommand.search("grep -n TODO Main.java", "TODO", "Main.java")),
                parser.parse(Arrays.asList("grep", "-n", "TODO", "Main.java")));
    }

    @Test
    void explicitPatternFlag() {
        assertEquals(Collections.singletonList(ParsedCommand.search("grep -e foo src", "foo", "src")),
                parser.parse(Arrays.asList("grep", "-e", "foo", "src")));
    }

    @Test
    void dropsPipedFormatters() {
        List<ParsedCommand> parsed = parser.parse(Arrays.asList("bash", "-lc", "cat a.txt | head -n 5"));

        assertEquals(Collections.singletonList(ParsedCommand.read("cat a.txt", "a.txt", "a.txt")), parsed);
    }

    @Test
    void listings() {
        assertEquals(Collections.singletonList(ParsedCommand.listFiles("ls -la", null)),
                parser.parse(Arrays.asList("ls", "-la")));
        assertEquals(Collections.singletonList(ParsedCommand.listFiles("rg --files src", "src")),
                parser.parse(Arrays.asList("rg", "--files", "src")));
    }

    @Test
    void findByName() {
        assertEquals(Collections.singletonList(ParsedCommand.search("find . -name '*.java'", "*.java", ".")),
                parser.parse(Arrays.asList("bash", "-lc", "find . -name '*.java'")));
    }

    @Test
    void sedPrintRangeIsRead() {
        assertEquals(Collections.singletonList(ParsedCommand.read("sed -n 1,10p src/Main.java", "Main.java", "src/Main.java")),
                parser.parse(Arrays.asList("sed", "-n", "1,10p", "src/Main.java")));
    }

    @Test
    void unknownCommandsAndEmptyInput() {
        assertEquals(Collections.singletonList(ParsedCommand.unknown("python3 -m pytest")),
                parser.parse(Arrays.asList("python3", "-m", "pytest")));
        assertEquals(Collections.singletonList(ParsedCommand.unknown("")), parser.parse(Collections.emptyList()));
        assertEquals(Collections.singletonList(ParsedCommand.unknown("")), parser.parse(null));
    }

    @Test
    void consecutiveDuplicatesCollapse() {
        assertEquals(1, parser.parse(Arrays.asList("bash", "-lc", "cat a && cat a")).size());
    }

    @Test
    void backgroundOperatorSplitsCommands() {
        assertEquals(Arrays.asList(ParsedCommand.unknown("echo hi"), ParsedCommand.listFiles("ls", null)),
                parser.parse(Arrays.asList("bash", "-c", "echo hi & ls")));
    }

    @Test
    void tokenizerHonoursQuotes() {
        assertEquals(Arrays.asList("echo", "a b", "&&", "x\"y"),
                ShellCommandParser.tokenize("echo 'a b' && \"x\\\"y\""));
    }
}
