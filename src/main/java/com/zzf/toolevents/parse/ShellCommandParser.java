package com.zzf.toolevents.parse;

import com.zzf.toolevents.protocol.ParsedCommand;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Default {@link CommandParser}. Unwraps {@code bash -lc "<script>"} style
 * invocations, splits scripts on {@code && || ; |} and recognises the common
 * read / list / search commands. Everything else is reported as unknown.
 */
public class ShellCommandParser implements CommandParser {

    private static final Set<String> SHELLS = new HashSet<>(Arrays.asList("bash", "sh", "zsh", "dash"));
    private static final Set<String> SCRIPT_FLAGS = new HashSet<>(Arrays.asList("-c", "-lc", "-cl"));
    private static final Set<String> OPERATORS = new HashSet<>(Arrays.asList("&&", "||", ";", "|"));
    private static final Set<String> READERS = new HashSet<>(Arrays.asList("cat", "head", "tail", "less", "more", "nl", "bat"));
    private static final Set<String> LISTERS = new HashSet<>(Arrays.asList("ls", "tree", "eza", "exa"));
    private static final Set<String> SEARCHERS = new HashSet<>(Arrays.asList("rg", "grep", "egrep", "fgrep", "ag", "ack", "fd"));
    // Filters that only reshape piped output; they add nothing to the summary.
    private static final Set<String> FORMATTERS = new HashSet<>(Arrays.asList(
            "head", "tail", "wc", "sort", "uniq", "cut", "tr", "awk", "sed", "nl", "column", "xargs", "less", "more"));
    private static final Set<String> READ_FLAGS_WITH_VALUE = new HashSet<>(Arrays.asList(
            "-n", "-c", "--lines", "--bytes"));
    private static final Set<String> SEARCH_FLAGS_WITH_VALUE = new HashSet<>(Arrays.asList(
            "-m", "-A", "-B", "-C", "-g", "-t", "-e", "--glob", "--type", "--max-count"));

    @Override
    public List<ParsedCommand> parse(List<String> command) {
        if (command == null || command.isEmpty()) {
            return Collections.singletonList(ParsedCommand.unknown(""));
        }
        List<String> tokens = unwrapShell(command);
        List<List<String>> segments = new ArrayList<>();
        List<String> operatorsBefore = new ArrayList<>();
        List<String> current = new ArrayList<>();
        String lastOperator = null;
        for (String token : tokens) {
            if (OPERATORS.contains(token)) {
                if (!current.isEmpty()) {
                    segments.add(current);
                    operatorsBefore.add(lastOperator);
                }
                current = new ArrayList<>();
                lastOperator = token;
                continue;
            }
            current.add(token);
        }
        if (!current.isEmpty()) {
            segments.add(current);
            operatorsBefore.add(lastOperator);
        }

        List<ParsedCommand> out = new ArrayList<>();
        for (int i = 0; i < segments.size(); i++) {
            List<String> segment = segments.get(i);
            String name = baseName(segment.get(0));
            if ("cd".equals(name) && segments.size() > 1) {
                continue;
            }
            if ("|".equals(operatorsBefore.get(i)) && FORMATTERS.contains(name) && positionalArgs(segment, READ_FLAGS_WITH_VALUE).isEmpty()) {
                continue;
            }
            ParsedCommand parsed = classify(segment);
            if (out.isEmpty() || !out.get(out.size() - 1).equals(parsed)) {
                out.add(parsed);
            }
        }
        if (out.isEmpty()) {
            out.add(ParsedCommand.unknown(joinCommand(tokens)));
        }
        return Collections.unmodifiableList(out);
    }

    ParsedCommand classify(List<String> segment) {
        String cmd = joinCommand(segment);
        String name = baseName(segment.get(0));
        List<String> args = positionalArgs(segment, READ_FLAGS_WITH_VALUE);

        if (READERS.contains(name)) {
            if (args.isEmpty()) {
                return ParsedCommand.unknown(cmd);
            }
            String path = args.get(args.size() - 1);
            return ParsedCommand.read(cmd, baseName(path), path);
        }
        List<String> words = nonFlagWords(segment);
        if ("sed".equals(name) && segment.contains("-n") && words.size() >= 2) {
            String path = words.get(words.size() - 1);
            return ParsedCommand.read(cmd, baseName(path), path);
        }
        if (LISTERS.contains(name)) {
            return ParsedCommand.listFiles(cmd, args.isEmpty() ? null : args.get(0));
        }
        if ("rg".equals(name) && segment.contains("--files")) {
            return ParsedCommand.listFiles(cmd, args.isEmpty() ? null : args.get(0));
        }
        if (SEARCHERS.contains(name)) {
            List<String> searchArgs = positionalArgs(segment, SEARCH_FLAGS_WITH_VALUE);
            String pattern = valueAfter(segment, "-e");
            if (pattern != null) {
                return ParsedCommand.search(cmd, pattern, searchArgs.isEmpty() ? null : searchArgs.get(0));
            }
            String query = searchArgs.isEmpty() ? null : searchArgs.get(0);
            String path = searchArgs.size() > 1 ? searchArgs.get(1) : null;
            return ParsedCommand.search(cmd, query, path);
        }
        if ("find".equals(name)) {
            String path = segment.size() > 1 && !segment.get(1).startsWith("-") ? segment.get(1) : null;
            String query = valueAfter(segment, "-name");
            if (query == null) {
                query = valueAfter(segment, "-iname");
            }
            if (query == null) {
                return ParsedCommand.listFiles(cmd, path);
            }
            return ParsedCommand.search(cmd, query, path);
        }
        return ParsedCommand.unknown(cmd);
    }

    private List<String> unwrapShell(List<String> command) {
        if (command.size() == 3
                && SHELLS.contains(baseName(command.get(0)))
                && SCRIPT_FLAGS.contains(command.get(1))) {
            return tokenize(command.get(2));
        }
        return new ArrayList<>(command);
    }

    /**
     * Shell-like word splitting with single/double quotes, backslash escapes and
     * the control operators emitted as separate tokens.
     */
    static List<String> tokenize(String script) {
        List<String> tokens = new ArrayList<>();
        if (script == null) {
            return tokens;
        }
        StringBuilder word = new StringBuilder();
        boolean inWord = false;
        char quote = 0;
        for (int i = 0; i < script.length(); i++) {
            char c = script.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                } else if (c == '\\' && quote == '"' && i + 1 < script.length()) {
                    word.append(script.charAt(++i));
                } else {
                    word.append(c);
                }
                continue;
            }
            if (c == '\'' || c == '"') {
                quote = c;
                inWord = true;
                continue;
            }
            if (c == '\\' && i + 1 < script.length()) {
                word.append(script.charAt(++i));
                inWord = true;
                continue;
            }
            if (Character.isWhitespace(c)) {
                inWord = flush(tokens, word, inWord);
                continue;
            }
            if (c == '&' || c == '|' || c == ';') {
                inWord = flush(tokens, word, inWord);
                if ((c == '&' || c == '|') && i + 1 < script.length() && script.charAt(i + 1) == c) {
                    tokens.add(String.valueOf(c) + c);
                    i++;
                } else if (c == '&') {
                    tokens.add(";");
                } else {
                    tokens.add(String.valueOf(c));
                }
                continue;
            }
            word.append(c);
            inWord = true;
        }
        flush(tokens, word, inWord);
        return tokens;
    }

    private static boolean flush(List<String> tokens, StringBuilder word, boolean inWord) {
        if (inWord) {
            tokens.add(word.toString());
            word.setLength(0);
        }
        return false;
    }

    private static List<String> positionalArgs(List<String> segment, Set<String> flagsWithValue) {
        List<String> args = new ArrayList<>();
        for (int i = 1; i < segment.size(); i++) {
            String token = segment.get(i);
            if (token.startsWith("-")) {
                if (flagsWithValue.contains(token)) {
                    i++;
                }
                continue;
            }
            args.add(token);
        }
        return args;
    }

    private static List<String> nonFlagWords(List<String> segment) {
        List<String> words = new ArrayList<>();
        for (int i = 1; i < segment.size(); i++) {
            if (!segment.get(i).startsWith("-")) {
                words.add(segment.get(i));
            }
        }
        return words;
    }

    private static String valueAfter(List<String> segment, String flag) {
        int idx = segment.indexOf(flag);
        if (idx < 0 || idx + 1 >= segment.size()) {
            return null;
        }
        return segment.get(idx + 1);
    }

    static String joinCommand(List<String> tokens) {
        StringBuilder sb = new StringBuilder();
        for (String token : tokens) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(needsQuoting(token) ? "'" + token.replace("'", "'\\''") + "'" : token);
        }
        return sb.toString();
    }

    private static boolean needsQuoting(String token) {
        if (token.isEmpty()) {
            return true;
        }
        for (int i = 0; i < token.length(); i++) {
            char c = token.charAt(i);
            if (Character.isWhitespace(c) || "'\"\\$`*?&|;<>()".indexOf(c) >= 0) {
                return true;
            }
        }
        return false;
    }

    private static String baseName(String path) {
        if (path == null) {
            return "";
        }
        String normalized = path.replace('\\', '/');
        int idx = normalized.lastIndexOf('/');
        String name = idx >= 0 ? normalized.substring(idx + 1) : normalized;
        return name.toLowerCase(Locale.ROOT).endsWith(".exe") ? name.substring(0, name.length() - 4) : name;
    }
}
