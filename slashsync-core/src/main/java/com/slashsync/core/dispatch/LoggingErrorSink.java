package com.slashsync.core.dispatch;

import com.slashsync.common.infra.ErrorUtils;
import com.slashsync.core.node.CommandNode;
import lombok.extern.slf4j.Slf4j;

/**
 * Default {@link ErrorSink}: logs the failure at ERROR level.
 */
@Slf4j
public class LoggingErrorSink implements ErrorSink {

    @Override
    public void report(CommandNode node, Interaction interaction, Throwable error) {
        String path = node == null ? String.valueOf(interaction.getCommandName()) : node.getQualifiedName();
        if (error instanceof CommandRoutingException) {
            log.error("Ignoring interaction {} for {}: {}", interaction.getId(), path,
                    ErrorUtils.formatErrorMessage(error));
        } else {
            log.error("Ignoring exception in command {} (interaction {})", path, interaction.getId(), error);
        }
    }
}
