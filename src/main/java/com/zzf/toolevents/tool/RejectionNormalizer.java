package com.zzf.toolevents.tool;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Rewrites known rejection texts into stable phrases. Matching is exact;
 * unknown texts pass through untouched.
 */
public class RejectionNormalizer {
    public static final String USER_REJECTION = "rejected by user";
    public static final String EXEC_USER_REJECTION = "exec command rejected by user";

    private final Map<String, String> rewrites;

    public RejectionNormalizer(Map<String, String> rewrites) {
        Map<String, String> copy = new LinkedHashMap<>();
        if (rewrites != null) {
            rewrites.forEach((from, to) -> {
                if (from != null && to != null) {
                    copy.put(from, to);
                }
            });
        }
        this.rewrites = Collections.unmodifiableMap(copy);
    }

    public static RejectionNormalizer defaults() {
        return new RejectionNormalizer(Map.of(USER_REJECTION, EXEC_USER_REJECTION));
    }

    public String normalize(String message) {
        String text = message == null ? "" : message;
        return rewrites.getOrDefault(text, text);
    }

    public Map<String, String> getRewrites() {
        return rewrites;
    }
}
