package com.zzf.toolevents.tool;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class RejectionNormalizerTest {

    @Test
    void defaultsRewriteOnlyTheCanonicalPhrase() {
        RejectionNormalizer normalizer = RejectionNormalizer.defaults();

        assertEquals("exec command rejected by user", normalizer.normalize("rejected by user"));
        assertEquals("rejected by user ", normalizer.normalize("rejected by user "));
        assertEquals("denied", normalizer.normalize("denied"));
        assertEquals("", normalizer.normalize(null));
    }

    @Test
    void nullEntriesAreIgnored() {
        Map<String, String> rewrites = new HashMap<>();
        rewrites.put("a", null);
        rewrites.put(null, "b");
        rewrites.put("c", "d");

        RejectionNormalizer normalizer = new RejectionNormalizer(rewrites);

        assertEquals(1, normalizer.getRewrites().size());
        assertEquals("a", normalizer.normalize("a"));
        assertEquals("d", normalizer.normalize("c"));
    }
}
