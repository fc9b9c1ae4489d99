package com.slashsync.core.dispatch;

import lombok.Builder;
import lombok.Getter;

import java.util.Map;

/**
 * Entities the platform hydrated for the ids referenced by an interaction,
 * keyed by id. Entity values are whatever the transport layer parsed them
 * into.
 */
@Getter
@Builder
public class ResolvedData {

    public static final ResolvedData EMPTY = ResolvedData.builder().build();

    @Builder.Default
    private final Map<Long, Object> users = Map.of();
    @Builder.Default
    private final Map<Long, Object> members = Map.of();
    @Builder.Default
    private final Map<Long, Object> roles = Map.of();
    @Builder.Default
    private final Map<Long, Object> channels = Map.of();
    @Builder.Default
    private final Map<Long, Object> attachments = Map.of();
    @Builder.Default
    private final Map<Long, Object> messages = Map.of();

    public Object user(long id) {
        return users.get(id);
    }

    public Object member(long id) {
        return members.get(id);
    }

    public Object role(long id) {
        return roles.get(id);
    }

    public Object channel(long id) {
        return channels.get(id);
    }

    public Object attachment(long id) {
        return attachments.get(id);
    }

    public Object message(long id) {
        return messages.get(id);
    }
}
