package com.slashsync.core.model;

/**
 * Command surface kinds: chat-style slash commands and the two context-menu
 * surfaces.
 */
public enum CommandType {
    CHAT_INPUT(1, "chat_input"),
    USER(2, "user"),
    MESSAGE(3, "message");

    private final int value;
    private final String key;

    CommandType(int value, String key) {
        this.value = value;
        this.key = key;
    }

    public int value() {
        return value;
    }

    public String key() {
        return key;
    }

    /**
     * Resolve a wire value.
     *
     * @return the type, or {@code null} if unknown
     */
    public static CommandType fromValue(int value) {
        for (CommandType type : values()) {
            if (type.value == value)
                return type;
        }
        return null;
    }
}
