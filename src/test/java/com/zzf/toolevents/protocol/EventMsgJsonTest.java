package com.zzf.toolevents.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventMsgJsonTest {

    private final ObjectMapper mapper = new ObjectMapper().registerModule(new JavaTimeModule());

    @Test
    void execEndUsesSnakeCaseAndTypeTag() throws Exception {
        ExecCommandEndEvent event = ExecCommandEndEvent.builder()
                .callId("c1")
                .turnId("t1")
                .command(Arrays.asList("cat", "a.txt"))
                .cwd(Paths.get("/repo"))
                .parsedCmd(Collections.singletonList(ParsedCommand.read("cat a.txt", "a.txt", "a.txt")))
                .source(ExecCommandSource.USER_SHELL)
                .stdout("hi")
                .stderr("")
                .aggregatedOutput("hi")
                .exitCode(0)
                .duration(Duration.ofMillis(1500))
                .formattedOutput("hi")
                .build();

        JsonNode json = mapper.readTree(mapper.writeValueAsString(event));

        assertEquals("exec_command_end", json.get("type").asText());
        assertEquals("c1", json.get("call_id").asText());
        assertEquals("t1", json.get("turn_id").asText());
        assertEquals("/repo", json.get("cwd").asText());
        assertEquals("user_shell", json.get("source").asText());
        assertEquals("read", json.get("parsed_cmd").get(0).get("type").asText());
        assertEquals("hi", json.get("aggregated_output").asText());
        assertEquals(1.5, json.get("duration").asDouble(), 1e-9);
        assertFalse(json.has("interaction_input"));
        assertFalse(json.has("event_type"));
    }

    @Test
    void patchBeginSerializesChangesByPath() throws Exception {
        Map<Path, FileChange> changes = new LinkedHashMap<>();
        changes.put(Paths.get("a.txt"), FileChange.add("hello\n"));
        changes.put(Paths.get("b.txt"), FileChange.update("@@ -1 +1 @@", Paths.get("c.txt")));
        PatchApplyBeginEvent event = PatchApplyBeginEvent.builder()
                .callId("p1")
                .autoApproved(true)
                .changes(changes)
                .build();

        JsonNode json = mapper.readTree(mapper.writeValueAsString(event));

        assertEquals("patch_apply_begin", json.get("type").asText());
        assertTrue(json.get("auto_approved").asBoolean());
        assertEquals("add", json.get("changes").get("a.txt").get("type").asText());
        assertEquals("update", json.get("changes").get("b.txt").get("type").asText());
        assertEquals("c.txt", json.get("changes").get("b.txt").get("move_path").asText());
    }

    @Test
    void turnDiffRoundTripsThroughBaseType() throws Exception {
        String text = mapper.writeValueAsString(TurnDiffEvent.builder().unifiedDiff("diff\n").build());

        EventMsg back = mapper.readValue(text, EventMsg.class);

        assertEquals(EventType.TURN_DIFF, back.getEventType());
        assertEquals("diff\n", ((TurnDiffEvent) back).getUnifiedDiff());
    }
}
