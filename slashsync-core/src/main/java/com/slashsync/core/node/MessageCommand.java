package com.slashsync.core.node;

import com.slashsync.core.model.CommandType;
import lombok.Builder;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Context menu command shown on messages; the target is the message.
 */
public final class MessageCommand extends ContextMenuCommand {

    @Builder
    private MessageCommand(String name, Map<String, String> nameLocalizations, Long defaultMemberPermissions,
            Boolean allowDm, boolean nsfw, Collection<Long> guildIds, CommandHandlers.Handler handler,
            CommandHandlers.ErrorHandler errorHandler, List<CommandHandlers.Check> checks) {
        super(CommandType.MESSAGE, name, nameLocalizations, defaultMemberPermissions, allowDm, nsfw, guildIds,
                handler, errorHandler, checks);
    }

    @Override
    public NodeKind getNodeKind() {
        return NodeKind.MESSAGE_COMMAND;
    }
}
