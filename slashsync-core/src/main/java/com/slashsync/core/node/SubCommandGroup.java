package com.slashsync.core.node;

import com.slashsync.core.model.CommandValidation;
import com.slashsync.core.model.CommandValidationException;
import com.slashsync.core.model.OptionType;
import com.slashsync.core.model.WireComparison;
import lombok.Builder;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The middle layer of a three level command: {@code /command group sub}.
 * Holds between 1 and 25 sub-commands.
 */
public final class SubCommandGroup implements CommandNode {

    private final String name;
    private final String description;
    private final Map<String, String> nameLocalizations;
    private final Map<String, String> descriptionLocalizations;
    private final Map<String, SubCommand> subCommands = new LinkedHashMap<>();
    private volatile SlashCommand parent;

    @Builder
    private SubCommandGroup(String name, String description, Map<String, String> nameLocalizations,
            Map<String, String> descriptionLocalizations, List<SubCommand> subCommands) {
        this.name = CommandValidation.requireChatName(name, "sub-command group");
        this.description = CommandValidation.requireDescription(
                description == null ? SlashCommand.DEFAULT_DESCRIPTION : description, "sub-command group " + name);
        this.nameLocalizations = Map.copyOf(
                CommandValidation.nameLocalizations(nameLocalizations, "sub-command group " + name));
        this.descriptionLocalizations = Map.copyOf(
                CommandValidation.descriptionLocalizations(descriptionLocalizations, "sub-command group " + name));
        if (subCommands == null || subCommands.isEmpty()) {
            throw new CommandValidationException("A sub-command group needs at least one sub-command: " + name);
        }
        subCommands.forEach(this::addSubCommand);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public NodeKind getNodeKind() {
        return NodeKind.SUB_COMMAND_GROUP;
    }

    @Override
    public String getQualifiedName() {
        SlashCommand current = parent;
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

    public SlashCommand getParent() {
        return parent;
    }

    public synchronized SubCommand getSubCommand(String name) {
        return subCommands.get(name);
    }

    public synchronized List<SubCommand> getSubCommands() {
        return List.copyOf(subCommands.values());
    }

    public SubCommand addSubCommand(SubCommand subCommand) {
        synchronized (this) {
            if (subCommands.containsKey(subCommand.getName())) {
                throw new CommandValidationException(String.format(
                        "Duplicate name \"%s\" in sub-commands of group %s", subCommand.getName(), name));
            }
            CommandValidation.requireAtMost(subCommands.size() + 1, CommandValidation.MAX_CHILDREN,
                    "sub-commands of group " + name);
            subCommands.put(subCommand.getName(), subCommand);
        }
        subCommand.attachTo(this);
        return subCommand;
    }

    void attachTo(SlashCommand command) {
        this.parent = command;
    }

    @Override
    public Map<String, Object> toWire() {
        Map<String, Object> wire = new LinkedHashMap<>();
        wire.put("type", OptionType.SUB_COMMAND_GROUP.value());
        wire.put("name", name);
        wire.put("name_localizations", nameLocalizations.isEmpty() ? null : new LinkedHashMap<>(nameLocalizations));
        wire.put("description", description);
        wire.put("description_localizations",
                descriptionLocalizations.isEmpty() ? null : new LinkedHashMap<>(descriptionLocalizations));
        List<Map<String, Object>> children = new ArrayList<>();
        getSubCommands().forEach(sub -> children.add(sub.toWire()));
        wire.put("options", children);
        return wire;
    }

    @Override
    public boolean matchesWire(Map<String, Object> remote) {
        return WireComparison.optionsMatch(List.of(toWire()), List.of(remote));
    }

    @Override
    public String toString() {
        return "SubCommandGroup{" + getQualifiedName() + "}";
    }
}
