package com.slashsync.core.model;

/**
 * Where a command is registered: globally or for one guild.
 *
 * @param guildId the guild identifier, {@code null} for the global scope
 */
public record Scope(Long guildId) {

    public static final Scope GLOBAL = new Scope(null);

    public Scope {
        if (guildId != null && guildId == 0L) {
            guildId = null;
        }
    }

    public static Scope guild(long guildId) {
        return new Scope(guildId);
    }

    public boolean isGlobal() {
        return guildId == null;
    }

    @Override
    public String toString() {
        return isGlobal() ? "global" : "guild:" + guildId;
    }
}
