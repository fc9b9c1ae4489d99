package com.slashsync.discord;

import java.util.List;

/**
 * Entities Discord hydrates in the {@code resolved} block of an interaction.
 */
public final class DiscordEntities {

    private DiscordEntities() {
    }

    public record User(long id, String username, String globalName, boolean bot) {

        /** Name shown in the client: global name when set, else username. */
        public String displayName() {
            return globalName != null && !globalName.isEmpty() ? globalName : username;
        }
    }

    /**
     * Guild member; {@code user} is taken from the matching entry of the
     * resolved users and may be null.
     */
    public record Member(User user, String nick, List<Long> roleIds, String permissions) {

        public String displayName() {
            if (nick != null && !nick.isEmpty())
                return nick;
            return user != null ? user.displayName() : null;
        }
    }

    public record Role(long id, String name, int color, String permissions) {
    }

    public record Channel(long id, int type, String name, Long parentId) {
    }

    public record Attachment(long id, String filename, String url, long size, String contentType) {
    }

    public record Message(long id, long channelId, String content, User author) {
    }
}
