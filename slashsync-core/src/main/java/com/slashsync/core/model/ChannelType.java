package com.slashsync.core.model;

/**
 * Channel types a channel option can be restricted to.
 */
public enum ChannelType {
    GUILD_TEXT(0),
    DM(1),
    GUILD_VOICE(2),
    GROUP_DM(3),
    GUILD_CATEGORY(4),
    GUILD_ANNOUNCEMENT(5),
    ANNOUNCEMENT_THREAD(10),
    PUBLIC_THREAD(11),
    PRIVATE_THREAD(12),
    GUILD_STAGE_VOICE(13),
    GUILD_DIRECTORY(14),
    GUILD_FORUM(15);

    private final int value;

    ChannelType(int value) {
        this.value = value;
    }

    public int value() {
        return value;
    }

    public static ChannelType fromValue(int value) {
        for (ChannelType type : values()) {
            if (type.value == value)
                return type;
        }
        throw new CommandValidationException("Unknown channel type: " + value);
    }
}
