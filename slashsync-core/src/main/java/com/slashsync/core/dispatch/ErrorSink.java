package com.slashsync.core.dispatch;

import com.slashsync.core.node.CommandNode;

/**
 * Process-wide destination for dispatch failures nobody else handled.
 */
@FunctionalInterface
public interface ErrorSink {

    /**
     * @param node        the node involved, {@code null} when routing failed
     *                    before a node was found
     * @param interaction the interaction being dispatched
     * @param error       the failure
     */
    void report(CommandNode node, Interaction interaction, Throwable error);
}
