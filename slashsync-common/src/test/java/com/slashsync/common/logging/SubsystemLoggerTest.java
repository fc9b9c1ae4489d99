package com.slashsync.common.logging;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SubsystemLoggerTest {

    @Test
    void childExtendsSubsystemPath() {
        SubsystemLogger log = SubsystemLogger.create("sync").child("guild");
        assertEquals("sync/guild", log.getSubsystem());
    }

    @Test
    void formatMessageWithoutFields() {
        SubsystemLogger log = SubsystemLogger.create("dispatch");
        assertEquals("[dispatch] routed", log.formatMessage("routed", null));
    }

    @Test
    void formatMessageAppendsMetaInOrder() {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("strategy", "BULK_OVERWRITE");
        meta.put("writes", 1);
        SubsystemLogger log = SubsystemLogger.create("sync");
        assertEquals("[sync] done {strategy=BULK_OVERWRITE, writes=1}", log.formatMessage("done", meta));
    }

    @Test
    void contextComesFirstAndIsInheritedByChildren() {
        SubsystemLogger log = SubsystemLogger.create("sync").with("scope", "guild:42").child("guild");

        assertEquals(Map.of("scope", "guild:42"), log.getContext());
        assertEquals("[sync/guild] Synced {scope=guild:42, created=2}",
                log.formatMessage("Synced", Map.of("created", 2)));
    }

    @Test
    void metaOverridesContextOnClash() {
        SubsystemLogger log = SubsystemLogger.create("sync").with("scope", "global");
        assertEquals("[sync] x {scope=guild:1}", log.formatMessage("x", Map.of("scope", "guild:1")));
    }

    @Test
    void withDoesNotMutateTheParent() {
        SubsystemLogger parent = SubsystemLogger.create("sync");
        parent.with("scope", "global");
        assertTrue(parent.getContext().isEmpty());
    }

    @Test
    void loggingDoesNotThrow() {
        SubsystemLogger log = SubsystemLogger.create("sync").with("scope", "global");
        assertDoesNotThrow(() -> {
            log.info("info", Map.of("k", "v"));
            log.warn("warn");
            log.debug("debug");
            log.error("error", new RuntimeException("x"));
            log.error("error", Map.of("k", "v"));
        });
    }
}
