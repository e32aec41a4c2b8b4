package com.zzf.toolevents.exec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders executor output for the UI and for the model.
 *
 * <p>Output beyond {@code maxBytes} or {@code maxLines} keeps its head and tail
 * with an elision marker between them; each half gets half of the byte budget.
 * The marker counts omitted lines, or omitted bytes when only the byte limit
 * was exceeded.
 */
public class ExecOutputFormatter {
    public static final int DEFAULT_MAX_BYTES = 10 * 1024;
    public static final int DEFAULT_MAX_LINES = 256;

    private final ObjectMapper mapper;
    private final int maxBytes;
    private final int maxLines;

    public ExecOutputFormatter(ObjectMapper mapper) {
        this(mapper, DEFAULT_MAX_BYTES, DEFAULT_MAX_LINES);
    }

    public ExecOutputFormatter(ObjectMapper mapper, int maxBytes, int maxLines) {
        if (maxBytes <= 0 || maxLines <= 1) {
            throw new IllegalArgumentException("maxBytes must be > 0 and maxLines > 1");
        }
        this.mapper = mapper;
        this.maxBytes = maxBytes;
        this.maxLines = maxLines;
    }

    /**
     * Human rendering of the aggregated output, used as {@code formatted_output}.
     */
    public String formatForDisplay(ExecToolCallOutput output) {
        String content = output.getAggregatedOutput() == null ? "" : output.getAggregatedOutput();
        if (output.isTimedOut()) {
            content = "command timed out after " + output.getDuration().toMillis() + " milliseconds\n" + content;
        }
        return truncate(content);
    }

    /**
     * JSON document handed back to the model: the display rendering plus exit code
     * and duration in seconds rounded to one decimal.
     */
    public String formatForModel(ExecToolCallOutput output) {
        ObjectNode root = mapper.createObjectNode();
        root.put("output", formatForDisplay(output));
        ObjectNode metadata = root.putObject("metadata");
        metadata.put("exit_code", output.getExitCode());
        metadata.put("duration_seconds", Math.round(output.getDuration().toMillis() / 100.0) / 10.0);
        try {
            return mapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("exec output serialization failed: " + e.getMessage(), e);
        }
    }

    String truncate(String content) {
        List<String> lines = splitLines(content);
        int totalLines = lines.size();
        int totalBytes = utf8Length(content);
        if (totalBytes <= maxBytes && totalLines <= maxLines) {
            return content;
        }
        int headBudget = maxBytes / 2;
        int tailBudget = maxBytes - headBudget;

        String head;
        String tail;
        String marker;
        if (totalLines > maxLines) {
            int headLines = maxLines / 2;
            int tailLines = maxLines - headLines;
            head = takeBytesPrefix(String.join("", lines.subList(0, headLines)), headBudget);
            tail = takeBytesSuffix(String.join("", lines.subList(totalLines - tailLines, totalLines)), tailBudget);
            int omitted = Math.max(0, totalLines - countLines(head) - countLines(tail));
            marker = "[... omitted " + omitted + " of " + totalLines + " lines ...]";
        } else {
            // Too many bytes on few lines: cut by bytes so both ends survive.
            head = takeBytesPrefix(content, headBudget);
            tail = takeBytesSuffix(content.substring(head.length()), tailBudget);
            int omitted = totalBytes - utf8Length(head) - utf8Length(tail);
            marker = "[... omitted " + omitted + " of " + totalBytes + " bytes ...]";
        }

        StringBuilder sb = new StringBuilder();
        sb.append("Total output lines: ").append(totalLines).append("\n\n");
        sb.append(head);
        if (!head.isEmpty() && !head.endsWith("\n")) {
            sb.append('\n');
        }
        sb.append("\n").append(marker).append("\n\n");
        sb.append(tail);
        return sb.toString();
    }

    // Lines keep their terminators so that joining them restores the input.
    private static List<String> splitLines(String content) {
        List<String> out = new ArrayList<>();
        int start = 0;
        for (int i = 0; i < content.length(); i++) {
            if (content.charAt(i) == '\n') {
                out.add(content.substring(start, i + 1));
                start = i + 1;
            }
        }
        if (start < content.length()) {
            out.add(content.substring(start));
        }
        return out;
    }

    private static int countLines(String text) {
        return splitLines(text).size();
    }

    private static int utf8Length(String text) {
        return text.getBytes(StandardCharsets.UTF_8).length;
    }

    private static String takeBytesPrefix(String text, int budget) {
        if (utf8Length(text) <= budget) {
            return text;
        }
        int used = 0;
        int end = 0;
        while (end < text.length()) {
            int cp = text.codePointAt(end);
            int len = new String(Character.toChars(cp)).getBytes(StandardCharsets.UTF_8).length;
            if (used + len > budget) {
                break;
            }
            used += len;
            end += Character.charCount(cp);
        }
        return text.substring(0, end);
    }

    private static String takeBytesSuffix(String text, int budget) {
        if (utf8Length(text) <= budget) {
            return text;
        }
        int used = 0;
        int start = text.length();
        while (start > 0) {
            int cp = text.codePointBefore(start);
            int len = new String(Character.toChars(cp)).getBytes(StandardCharsets.UTF_8).length;
            if (used + len > budget) {
                break;
            }
            used += len;
            start -= Character.charCount(cp);
        }
        return text.substring(start);
    }
}
