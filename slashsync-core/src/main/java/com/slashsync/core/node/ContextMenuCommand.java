package com.slashsync.core.node;

import com.slashsync.core.model.CommandOption;
import com.slashsync.core.model.CommandType;
import com.slashsync.core.model.CommandValidation;
import com.slashsync.core.model.Scope;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * A command invoked from a user's or a message's context menu. It has no
 * description and no options; the handler receives the target entity.
 */
public abstract sealed class ContextMenuCommand extends ApplicationCommand implements InvocableCommand
        permits UserCommand, MessageCommand {

    private final CommandHandlers handlers;

    protected ContextMenuCommand(CommandType type, String name, Map<String, String> nameLocalizations,
            Long defaultMemberPermissions, Boolean allowDm, boolean nsfw, Collection<Long> guildIds,
            CommandHandlers.Handler handler, CommandHandlers.ErrorHandler errorHandler,
            List<CommandHandlers.Check> checks) {
        super(type,
                CommandValidation.requireContextMenuName(name, type.key() + " command"),
                CommandValidation.contextMenuNameLocalizations(nameLocalizations, type.key() + " command " + name),
                defaultMemberPermissions, allowDm, nsfw, guildIds);
        this.handlers = new CommandHandlers(handler, null, errorHandler, checks);
    }

    @Override
    public CommandHandlers getHandlers() {
        return handlers;
    }

    @Override
    public List<CommandOption> getOptions() {
        return List.of();
    }

    @Override
    public Map<String, String> getConnector() {
        return Map.of();
    }

    @Override
    public List<InvocableCommand> invocables() {
        return List.of(this);
    }

    @Override
    public Map<String, Object> toWire(Scope scope) {
        return baseWire(scope, "", Map.of());
    }
}
