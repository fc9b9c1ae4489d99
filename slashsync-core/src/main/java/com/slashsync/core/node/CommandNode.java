package com.slashsync.core.node;

import java.util.Map;

/**
 * One addressable unit of the command tree.
 * <p>
 * Top-level commands are {@link ApplicationCommand}s; slash commands may carry
 * {@link SubCommandGroup}s and {@link SubCommand}s below them.
 */
public sealed interface CommandNode permits ApplicationCommand, SubCommandGroup, SubCommand {

    String getName();

    NodeKind getNodeKind();

    /**
     * Space separated path from the top-level command, e.g. {@code "config set"}.
     */
    String getQualifiedName();

    /**
     * Canonical request and comparison representation of this node.
     */
    Map<String, Object> toWire();

    /**
     * Structural equality against a representation fetched from the remote
     * service.
     */
    boolean matchesWire(Map<String, Object> remote);
}
