package com.slashsync.core.model;

/**
 * Application command option types and their wire values.
 */
public enum OptionType {
    SUB_COMMAND(1),
    SUB_COMMAND_GROUP(2),
    STRING(3),
    INTEGER(4),
    BOOLEAN(5),
    USER(6),
    CHANNEL(7),
    ROLE(8),
    MENTIONABLE(9),
    NUMBER(10),
    ATTACHMENT(11);

    private final int value;

    OptionType(int value) {
        this.value = value;
    }

    public int value() {
        return value;
    }

    /** Sub-commands and sub-command groups; compared by name, not slot. */
    public boolean isContainer() {
        return this == SUB_COMMAND || this == SUB_COMMAND_GROUP;
    }

    public boolean supportsChoices() {
        return this == STRING || this == INTEGER || this == NUMBER;
    }

    public boolean isNumeric() {
        return this == INTEGER || this == NUMBER;
    }

    /**
     * Resolve a wire value.
     *
     * @return the type, or {@code null} if unknown
     */
    public static OptionType fromValue(int value) {
        for (OptionType type : values()) {
            if (type.value == value)
                return type;
        }
        return null;
    }
}
