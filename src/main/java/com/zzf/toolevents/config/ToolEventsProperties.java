package com.zzf.toolevents.config;

import com.zzf.toolevents.diff.SnapshotTurnDiffTracker;
import com.zzf.toolevents.exec.ExecOutputFormatter;
import com.zzf.toolevents.session.BusSession;
import com.zzf.toolevents.tool.RejectionNormalizer;
import com.zzf.toolevents.tool.ToolOutcomeNormalizer;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Binds {@code toolevents.*}. Map keys containing spaces must be written in
 * bracket form, e.g. {@code "[rejected by user]"}.
 */
@Data
@ConfigurationProperties(prefix = "toolevents")
public class ToolEventsProperties {
    private Map<String, String> rejectionRewrites = new LinkedHashMap<>(
            Map.of(RejectionNormalizer.USER_REJECTION, RejectionNormalizer.EXEC_USER_REJECTION));
    private String abortedMessage = ToolOutcomeNormalizer.DEFAULT_ABORTED_MESSAGE;
    private Output output = new Output();
    private Session session = new Session();
    private Snapshot snapshot = new Snapshot();

    @Data
    public static class Output {
        private int maxBytes = ExecOutputFormatter.DEFAULT_MAX_BYTES;
        private int maxLines = ExecOutputFormatter.DEFAULT_MAX_LINES;
    }

    @Data
    public static class Session {
        private int journalSize = BusSession.DEFAULT_JOURNAL_SIZE;
    }

    @Data
    public static class Snapshot {
        private String dir = SnapshotTurnDiffTracker.DEFAULT_SNAPSHOT_DIR;
    }
}
