package com.slashsync.core.node;

import com.slashsync.core.model.CommandOption;
import com.slashsync.core.model.CommandValidation;
import com.slashsync.core.model.OptionType;
import com.slashsync.core.model.WireComparison;
import lombok.Builder;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An invocable sub-command, attached either to a {@link SlashCommand} or to a
 * {@link SubCommandGroup}.
 */
public final class SubCommand implements CommandNode, InvocableCommand {

    private final String name;
    private final String description;
    private final Map<String, String> nameLocalizations;
    private final Map<String, String> descriptionLocalizations;
    private final List<CommandOption> options;
    private final Map<String, String> connector;
    private final CommandHandlers handlers;
    private volatile CommandNode parent;

    @Builder
    private SubCommand(String name, String description, Map<String, String> nameLocalizations,
            Map<String, String> descriptionLocalizations, List<CommandOption> options,
            Map<String, String> connector, CommandHandlers.Handler handler,
            CommandHandlers.AutocompleteHandler autocompleteHandler, CommandHandlers.ErrorHandler errorHandler,
            List<CommandHandlers.Check> checks) {
        this.name = CommandValidation.requireChatName(name, "sub-command");
        this.description = CommandValidation.requireDescription(
                description == null ? SlashCommand.DEFAULT_DESCRIPTION : description, "sub-command " + name);
        this.nameLocalizations = Map.copyOf(
                CommandValidation.nameLocalizations(nameLocalizations, "sub-command " + name));
        this.descriptionLocalizations = Map.copyOf(
                CommandValidation.descriptionLocalizations(descriptionLocalizations, "sub-command " + name));
        this.options = CommandValidation.requireLeafOptions(options, "sub-command " + name);
        this.connector = CommandValidation.requireConnector(connector, this.options, "sub-command " + name);
        this.handlers = new CommandHandlers(handler, autocompleteHandler, errorHandler, checks);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public NodeKind getNodeKind() {
        return NodeKind.SUB_COMMAND;
    }

    @Override
    public String getQualifiedName() {
        CommandNode current = parent;
        return current == null ? name : current.getQualifiedName() + " " + name;
    }

    public String getDescription() {
        return description;
    }

    public Map<String, String> getNameLocalizations() {
        return nameLocalizations;
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

    /**
     * The owning {@link SlashCommand} or {@link SubCommandGroup}.
     */
    public CommandNode getParent() {
        return parent;
    }

    void attachTo(CommandNode owner) {
        this.parent = owner;
    }

    @Override
    public Map<String, Object> toWire() {
        Map<String, Object> wire = new LinkedHashMap<>();
        wire.put("type", OptionType.SUB_COMMAND.value());
        wire.put("name", name);
        wire.put("name_localizations", nameLocalizations.isEmpty() ? null : new LinkedHashMap<>(nameLocalizations));
        wire.put("description", description);
        wire.put("description_localizations",
                descriptionLocalizations.isEmpty() ? null : new LinkedHashMap<>(descriptionLocalizations));
        List<Map<String, Object>> optionWires = new ArrayList<>();
        options.forEach(option -> optionWires.add(option.toWire()));
        wire.put("options", optionWires);
        return wire;
    }

    @Override
    public boolean matchesWire(Map<String, Object> remote) {
        return WireComparison.optionsMatch(List.of(toWire()), List.of(remote));
    }

    @Override
    public String toString() {
        return "SubCommand{" + getQualifiedName() + ", options=" + options.size() + "}";
    }
}
