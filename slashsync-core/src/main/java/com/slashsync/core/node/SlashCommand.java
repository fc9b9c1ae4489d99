package com.slashsync.core.node;

import com.slashsync.core.model.CommandOption;
import com.slashsync.core.model.CommandType;
import com.slashsync.core.model.CommandValidation;
import com.slashsync.core.model.CommandValidationException;
import com.slashsync.core.model.Scope;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A chat input command. Either a leaf with options, invoked directly, or a
 * container of sub-commands and sub-command groups; never both.
 */
@Slf4j
public final class SlashCommand extends ApplicationCommand implements InvocableCommand {

    public static final String DEFAULT_DESCRIPTION = "No description provided";

    private final String description;
    private final Map<String, String> descriptionLocalizations;
    private final List<CommandOption> options;
    private final Map<String, String> connector;
    private final Map<String, CommandNode> children = new LinkedHashMap<>();
    private final CommandHandlers handlers;

    @Builder
    private SlashCommand(String name, String description, Map<String, String> nameLocalizations,
            Map<String, String> descriptionLocalizations, Long defaultMemberPermissions, Boolean allowDm,
            boolean nsfw, Collection<Long> guildIds, List<CommandOption> options, Map<String, String> connector,
            CommandHandlers.Handler handler, CommandHandlers.AutocompleteHandler autocompleteHandler,
            CommandHandlers.ErrorHandler errorHandler, List<CommandHandlers.Check> checks) {
        super(CommandType.CHAT_INPUT,
                CommandValidation.requireChatName(name, "slash command"),
                CommandValidation.nameLocalizations(nameLocalizations, "slash command " + name),
                defaultMemberPermissions, allowDm, nsfw, guildIds);
        this.description = CommandValidation.requireDescription(
                description == null ? DEFAULT_DESCRIPTION : description, "slash command " + name);
        this.descriptionLocalizations = Map.copyOf(
                CommandValidation.descriptionLocalizations(descriptionLocalizations, "slash command " + name));
        this.options = CommandValidation.requireLeafOptions(options, "slash command " + name);
        this.connector = CommandValidation.requireConnector(connector, this.options, "slash command " + name);
        this.handlers = new CommandHandlers(handler, autocompleteHandler, errorHandler, checks);
    }

    @Override
    public NodeKind getNodeKind() {
        return NodeKind.SLASH_COMMAND;
    }

    public String getDescription() {
        return description;
    }

    public Map<String, String> getDescriptionLocalizations() {
        return descriptionLocalizations;
    }

    @Override
    public List<CommandOption> getOptions() {
        return options;
    }

    @Override
    public Map<String, String> getConnector() {
        return connector;
    }

    @Override
    public CommandHandlers getHandlers() {
        return handlers;
    }

    // =========================================================================
    // Children
    // =========================================================================

    /**
     * Whether this command only groups sub-commands and cannot be invoked itself.
     */
    public synchronized boolean isContainer() {
        return !children.isEmpty();
    }

    public synchronized CommandNode getChild(String name) {
        return children.get(name);
    }

    public synchronized List<CommandNode> getChildren() {
        return List.copyOf(children.values());
    }

    public SubCommand addSubCommand(SubCommand subCommand) {
        attach(subCommand);
        subCommand.attachTo(this);
        return subCommand;
    }

    public SubCommandGroup addGroup(SubCommandGroup group) {
        attach(group);
        group.attachTo(this);
        return group;
    }

    private synchronized void attach(CommandNode child) {
        if (!options.isEmpty()) {
            throw new CommandValidationException(String.format(
                    "Slash command %s has options and cannot also have sub-commands", getName()));
        }
        if (children.containsKey(child.getName())) {
            throw new CommandValidationException(String.format(
                    "Duplicate name \"%s\" in sub-commands of %s", child.getName(), getName()));
        }
        CommandValidation.requireAtMost(children.size() + 1, CommandValidation.MAX_CHILDREN,
                "sub-commands and groups of " + getName());
        children.put(child.getName(), child);
        log.debug("Added {} {} to {}", child.getNodeKind(), child.getName(), getName());
    }

    @Override
    public List<InvocableCommand> invocables() {
        List<InvocableCommand> result = new ArrayList<>();
        result.add(this);
        for (CommandNode child : getChildren()) {
            if (child instanceof SubCommand sub) {
                result.add(sub);
            } else if (child instanceof SubCommandGroup group) {
                result.addAll(group.getSubCommands());
            }
        }
        return result;
    }

    // =========================================================================
    // Wire form
    // =========================================================================

    @Override
    public Map<String, Object> toWire(Scope scope) {
        Map<String, Object> wire = baseWire(scope, description, descriptionLocalizations);
        List<Map<String, Object>> optionWires = new ArrayList<>();
        if (isContainer()) {
            for (CommandNode child : getChildren()) {
                optionWires.add(child.toWire());
            }
        } else {
            options.forEach(option -> optionWires.add(option.toWire()));
        }
        if (!optionWires.isEmpty()) {
            wire.put("options", optionWires);
        }
        return wire;
    }
}
