package com.slashsync.core.node;

import com.slashsync.core.model.CommandType;
import lombok.Builder;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Context menu command shown on users; the target is the member, else the user.
 */
public final class UserCommand extends ContextMenuCommand {

    @Builder
    private UserCommand(String name, Map<String, String> nameLocalizations, Long defaultMemberPermissions,
            Boolean allowDm, boolean nsfw, Collection<Long> guildIds, CommandHandlers.Handler handler,
            CommandHandlers.ErrorHandler errorHandler, List<CommandHandlers.Check> checks) {
        super(CommandType.USER, name, nameLocalizations, defaultMemberPermissions, allowDm, nsfw, guildIds,
                handler, errorHandler, checks);
    }

    @Override
    public NodeKind getNodeKind() {
        return NodeKind.USER_COMMAND;
    }
}
