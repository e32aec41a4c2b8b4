package com.zzf.toolevents.exec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExecOutputFormatterTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void shortOutputIsUnchanged() {
        ExecOutputFormatter formatter = new ExecOutputFormatter(mapper);
        ExecToolCallOutput output = ExecToolCallOutput.builder().aggregatedOutput("a\nb\n").build();

        assertEquals("a\nb\n", formatter.formatForDisplay(output));
    }

    @Test
    void timeoutIsAnnounced() {
        ExecOutputFormatter formatter = new ExecOutputFormatter(mapper);
        ExecToolCallOutput output = ExecToolCallOutput.builder()
                .aggregatedOutput("x")
                .duration(Duration.ofSeconds(5))
                .timedOut(true)
                .build();

        assertEquals("command timed out after 5000 milliseconds\nx", formatter.formatForDisplay(output));
    }

    @Test
    void longOutputKeepsHeadAndTail() {
        ExecOutputFormatter formatter = new ExecOutputFormatter(mapper, 1000, 10);
        StringBuilder sb = new StringBuilder();
        for (int i = 1; i <= 30; i++) {
            sb.append("line ").append(i).append('\n');
        }

        String rendered = formatter.truncate(sb.toString());

        String expected = "Total output lines: 30\n\n"
                + "line 1\nline 2\nline 3\nline 4\nline 5\n"
                + "\n[... omitted 20 of 30 lines ...]\n\n"
                + "line 26\nline 27\nline 28\nline 29\nline 30\n";
        assertEquals(expected, rendered);
    }

    @Test
    void byteLimitAppliesToFewHugeLines() {
        ExecOutputFormatter formatter = new ExecOutputFormatter(mapper, 100, 256);
        String huge = "a".repeat(500) + "\n" + "b".repeat(500) + "\n";

        String rendered = formatter.truncate(huge);

        assertTrue(rendered.startsWith("Total output lines: 2\n\n"));
        assertTrue(rendered.contains("aaaa"));
        assertTrue(rendered.endsWith("bbbb\n"));
        assertTrue(rendered.length() < 200);
    }

    @Test
    void singleOverlongLineKeepsBothEnds() {
        ExecOutputFormatter formatter = new ExecOutputFormatter(mapper, 100, 256);

        String rendered = formatter.truncate("A".repeat(150) + "TAILMARK");

        String expected = "Total output lines: 1\n\n"
                + "A".repeat(50) + "\n"
                + "\n[... omitted 58 of 158 bytes ...]\n\n"
                + "A".repeat(42) + "TAILMARK";
        assertEquals(expected, rendered);
    }

    @Test
    void modelRenderingIsJsonWithMetadata() throws Exception {
        ExecOutputFormatter formatter = new ExecOutputFormatter(mapper);
        ExecToolCallOutput output = ExecToolCallOutput.builder()
                .aggregatedOutput("done\n")
                .exitCode(3)
                .duration(Duration.ofMillis(1234))
                .build();

        JsonNode json = mapper.readTree(formatter.formatForModel(output));

        assertEquals("done\n", json.get("output").asText());
        assertEquals(3, json.get("metadata").get("exit_code").asInt());
        assertEquals(1.2, json.get("metadata").get("duration_seconds").asDouble(), 1e-9);
    }

    @Test
    void rejectsDegenerateLimits() {
        assertThrows(IllegalArgumentException.class, () -> new ExecOutputFormatter(mapper, 0, 10));
        assertThrows(IllegalArgumentException.class, () -> new ExecOutputFormatter(mapper, 10, 1));
    }
}
