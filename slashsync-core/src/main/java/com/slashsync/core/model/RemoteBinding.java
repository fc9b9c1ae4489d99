package com.slashsync.core.model;

import java.time.Instant;
import java.util.Map;

/**
 * Remote identity of a command in one scope, assigned by synchronization.
 *
 * @param id            remote command identifier
 * @param applicationId owning application
 * @param guildId       guild the entry lives in, {@code null} when global
 * @param version       remote version identifier, if reported
 * @param createdAt     creation time derived from the identifier
 * @param permissions   guild-specific permission overrides snapshot, never null
 */
public record RemoteBinding(long id, long applicationId, Long guildId, Long version,
        Instant createdAt, Map<String, Object> permissions) {

    /** First second of 2015, the epoch of platform snowflake identifiers. */
    public static final long SNOWFLAKE_EPOCH_MS = 1_420_070_400_000L;

    public RemoteBinding {
        permissions = permissions == null ? Map.of() : Map.copyOf(permissions);
    }

    /**
     * Build a binding from a remote command representation.
     */
    @SuppressWarnings("unchecked")
    public static RemoteBinding fromWire(Map<String, Object> wire) {
        long id = parseId(wire.get("id"));
        Object guild = wire.get("guild_id");
        Object version = wire.get("version");
        Object permissions = wire.get("permissions");
        return new RemoteBinding(
                id,
                parseId(wire.get("application_id")),
                guild == null ? null : parseId(guild),
                version == null ? null : parseId(version),
                createdAt(id),
                permissions instanceof Map<?, ?> map ? (Map<String, Object>) map : null);
    }

    /**
     * Creation time encoded in a snowflake identifier.
     */
    public static Instant createdAt(long snowflake) {
        return Instant.ofEpochMilli((snowflake >>> 22) + SNOWFLAKE_EPOCH_MS);
    }

    /**
     * Parse an identifier sent as a JSON string or number; absent means 0.
     */
    public static long parseId(Object raw) {
        if (raw == null)
            return 0L;
        if (raw instanceof Number n)
            return n.longValue();
        return Long.parseLong(raw.toString().trim());
    }
}
