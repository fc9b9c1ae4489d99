package com.slashsync.core.node;

/**
 * Variant tag of a {@link CommandNode}.
 */
public enum NodeKind {
    SLASH_COMMAND,
    SUB_COMMAND_GROUP,
    SUB_COMMAND,
    USER_COMMAND,
    MESSAGE_COMMAND
}
