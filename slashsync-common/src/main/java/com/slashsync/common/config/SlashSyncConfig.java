package com.slashsync.common.config;

import lombok.Data;

/**
 * Root configuration type for SlashSync.
 */
@Data
public class SlashSyncConfig {

    /** Application (bot) identifier that owns the commands. */
    private String applicationId;

    /** Bot token, with or without the leading "Bot " prefix. */
    private String token;

    /** REST API base URL. */
    private String apiBaseUrl;

    /** Command synchronization settings. */
    private SyncConfig sync;

    /** HTTP client settings. */
    private HttpConfig http;

    // --- Nested config types ---

    @Data
    public static class SyncConfig {
        /**
         * Whether remote commands are rewritten to match local definitions.
         * When false only remote metadata is collected and bound.
         */
        private boolean enabled = true;

        /** Remote commands without a local definition are removed by bulk overwrites. */
        private boolean deleteNotExistingCommands = true;

        /** Run a full synchronization after a unit reload instead of re-binding. */
        private boolean syncOnUnitReload = false;

        /** Commands dropped by a unit reload are deleted instead of disabled. */
        private boolean deleteOnUnitReload = false;

        /** Process guild scopes concurrently. */
        private boolean concurrentGuilds = false;

        /** Per-guild fetch/write timeout; the guild is skipped when exceeded. */
        private long guildTimeoutMs = 10_000;
    }

    @Data
    public static class HttpConfig {
        private long connectTimeoutMs = 10_000;
        private long readTimeoutMs = 30_000;
    }
}
