package com.slashsync.core.registry;

import com.slashsync.core.model.CommandType;
import com.slashsync.core.model.CommandValidationException;
import com.slashsync.core.model.RemoteBinding;
import com.slashsync.core.model.Scope;
import com.slashsync.core.node.ApplicationCommand;
import com.slashsync.core.node.CommandNode;
import com.slashsync.core.node.InvocableCommand;
import com.slashsync.core.node.SlashCommand;
import com.slashsync.core.node.SubCommand;
import com.slashsync.core.node.SubCommandGroup;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Locally defined commands, indexed per scope, per command type and per name,
 * plus a remote id index filled in by synchronization.
 * <p>
 * Created once and shared by the synchronization and dispatch engines.
 * Disabled commands leave the name index but stay reachable by remote id.
 */
@Slf4j
public class CommandRegistry {

    private final Map<Scope, Map<CommandType, Map<String, ApplicationCommand>>> index = new ConcurrentHashMap<>();
    private final Map<Long, ApplicationCommand> byId = new ConcurrentHashMap<>();
    private final Map<String, List<ApplicationCommand>> unitCommands = new ConcurrentHashMap<>();
    private final Map<Scope, List<Map<String, Object>>> unmanaged = new ConcurrentHashMap<>();

    // =========================================================================
    // Registration
    // =========================================================================

    /**
     * Register a top-level command in every scope it declares.
     *
     * @throws CommandValidationException if another command of the same type
     *                                    already uses the name in one of them
     */
    public synchronized <T extends ApplicationCommand> T register(T command) {
        for (Scope scope : command.getScopes()) {
            ApplicationCommand existing = slot(scope, command.getType()).get(command.getName());
            if (existing != null && existing != command) {
                throw new CommandValidationException(String.format(
                        "A %s command named \"%s\" is already registered in %s",
                        command.getType().key(), command.getName(), scope));
            }
        }
        for (Scope scope : command.getScopes()) {
            slot(scope, command.getType()).put(command.getName(), command);
        }
        command.getBindings().values().forEach(binding -> byId.put(binding.id(), command));
        log.debug("Registered {} command {} in {}", command.getType().key(), command.getName(), command.getScopes());
        return command;
    }

    public SubCommand registerSubCommand(String commandName, String groupName, SubCommand subCommand) {
        return registerSubCommand(commandName, groupName, subCommand, List.of());
    }

    /**
     * Attach a sub-command below {@code /commandName [groupName]}, creating the
     * slash command and the group when they do not exist yet.
     *
     * @param groupName {@code null} to attach directly to the slash command
     * @param guildIds  guilds of the slash command; empty for global
     * @throws CommandValidationException if an existing slash command of that
     *                                    name is declared for a different set of
     *                                    guilds, or is invocable itself
     */
    public synchronized SubCommand registerSubCommand(String commandName, String groupName, SubCommand subCommand,
            Collection<Long> guildIds) {
        Set<Long> guilds = guildIds == null ? Set.of() : new LinkedHashSet<>(guildIds);
        SlashCommand command = findSlashCommand(commandName, guilds);
        if (command == null) {
            command = register(SlashCommand.builder().name(commandName).guildIds(guilds).build());
        } else if (!command.isContainer() && command.getHandlers().getHandler() != null) {
            throw new CommandValidationException(String.format(
                    "Slash command %s has a handler and cannot also have sub-commands", commandName));
        }

        if (groupName == null) {
            return command.addSubCommand(subCommand);
        }
        CommandNode child = command.getChild(groupName);
        if (child == null) {
            command.addGroup(SubCommandGroup.builder().name(groupName).subCommands(List.of(subCommand)).build());
            return subCommand;
        }
        if (child instanceof SubCommandGroup group) {
            return group.addSubCommand(subCommand);
        }
        throw new CommandValidationException(String.format(
                "%s %s is a sub-command, not a sub-command group", commandName, groupName));
    }

    private SlashCommand findSlashCommand(String name, Set<Long> guilds) {
        List<Scope> scopes = new ArrayList<>();
        if (guilds.isEmpty()) {
            scopes.add(Scope.GLOBAL);
        } else {
            guilds.forEach(id -> scopes.add(Scope.guild(id)));
        }
        ApplicationCommand found = null;
        for (Scope scope : scopes) {
            ApplicationCommand candidate = get(scope, CommandType.CHAT_INPUT, name);
            if (candidate == null)
                continue;
            if (found != null && found != candidate || !candidate.getGuildIds().equals(guilds)) {
                throw new CommandValidationException(String.format(
                        "Slash command %s is registered for guilds %s, cannot add sub-commands for %s",
                        name, candidate.getGuildIds(), guilds));
            }
            found = candidate;
        }
        return (SlashCommand) found;
    }

    // =========================================================================
    // Lookup
    // =========================================================================

    public ApplicationCommand get(Scope scope, CommandType type, String name) {
        Map<CommandType, Map<String, ApplicationCommand>> byType = index.get(scope);
        if (byType == null)
            return null;
        Map<String, ApplicationCommand> byName = byType.get(type);
        return byName == null ? null : byName.get(name);
    }

    /**
     * Enabled commands of one scope, in registration order per type.
     */
    public List<ApplicationCommand> commands(Scope scope) {
        Map<CommandType, Map<String, ApplicationCommand>> byType = index.get(scope);
        if (byType == null)
            return List.of();
        List<ApplicationCommand> result = new ArrayList<>();
        synchronized (this) {
            byType.values().forEach(byName -> result.addAll(byName.values()));
        }
        return result;
    }

    /**
     * Every enabled command once, whatever the number of scopes it lives in.
     */
    public List<ApplicationCommand> allCommands() {
        Set<ApplicationCommand> result = new LinkedHashSet<>();
        commands(Scope.GLOBAL).forEach(result::add);
        guildScopes().forEach(scope -> result.addAll(commands(scope)));
        return new ArrayList<>(result);
    }

    /**
     * Guild scopes that have at least one registered command.
     */
    public Set<Scope> guildScopes() {
        Set<Scope> scopes = new LinkedHashSet<>();
        for (var entry : index.entrySet()) {
            if (!entry.getKey().isGlobal() && !commands(entry.getKey()).isEmpty()) {
                scopes.add(entry.getKey());
            }
        }
        return scopes;
    }

    /**
     * Look a command up by remote id, including disabled ones.
     */
    public ApplicationCommand findById(long id) {
        return byId.get(id);
    }

    // =========================================================================
    // Remote state
    // =========================================================================

    /**
     * Attach a remote identity to a command and index it by id.
     */
    public void bind(Scope scope, ApplicationCommand command, RemoteBinding binding) {
        Long previous = command.getId(scope);
        if (previous != null && previous != binding.id()) {
            byId.remove(previous, command);
        }
        command.bind(scope, binding);
        byId.put(binding.id(), command);
    }

    /**
     * Remember remote entries of a scope that have no local definition but were
     * kept because deletion is disabled.
     */
    public void recordUnmanaged(Scope scope, List<Map<String, Object>> entries) {
        if (entries.isEmpty()) {
            unmanaged.remove(scope);
        } else {
            unmanaged.put(scope, List.copyOf(entries));
        }
    }

    public List<Map<String, Object>> unmanagedCommands(Scope scope) {
        return unmanaged.getOrDefault(scope, List.of());
    }

    // =========================================================================
    // Removal
    // =========================================================================

    /**
     * Remove a command from the name index.
     *
     * @param fromCache {@code true} to forget its remote ids as well; otherwise
     *                  the command is disabled, its handlers cleared, and it stays
     *                  reachable through {@link #findById}
     */
    public synchronized void remove(ApplicationCommand command, boolean fromCache) {
        for (Scope scope : command.getScopes()) {
            Map<String, ApplicationCommand> byName = slot(scope, command.getType());
            byName.remove(command.getName(), command);
        }
        if (fromCache) {
            command.getBindings().values().forEach(binding -> byId.remove(binding.id(), command));
        } else {
            command.disable();
        }
        log.debug("Removed {} command {} (fromCache={})", command.getType().key(), command.getName(), fromCache);
    }

    // =========================================================================
    // Units
    // =========================================================================

    /**
     * Register every command of a unit and apply the unit's checks to them.
     */
    public synchronized List<ApplicationCommand> loadUnit(CommandUnit unit) {
        if (unitCommands.containsKey(unit.getName())) {
            throw new IllegalStateException("Unit already loaded: " + unit.getName());
        }
        List<ApplicationCommand> commands = List.copyOf(unit.commands());
        for (ApplicationCommand command : commands) {
            command.setUnitName(unit.getName());
            for (InvocableCommand node : command.invocables()) {
                node.getHandlers().setInheritedChecks(unit.checks());
            }
        }
        List<ApplicationCommand> registered = new ArrayList<>();
        try {
            for (ApplicationCommand command : commands) {
                registered.add(register(command));
            }
        } catch (RuntimeException e) {
            registered.forEach(command -> remove(command, true));
            throw e;
        }
        unitCommands.put(unit.getName(), registered);
        log.info("Loaded unit {} with {} command(s)", unit.getName(), registered.size());
        return registered;
    }

    /**
     * Remove every command of a unit.
     *
     * @param fromCache see {@link #remove(ApplicationCommand, boolean)}
     */
    public synchronized List<ApplicationCommand> unloadUnit(String name, boolean fromCache) {
        List<ApplicationCommand> commands = unitCommands.remove(name);
        if (commands == null)
            return List.of();
        commands.forEach(command -> remove(command, fromCache));
        log.info("Unloaded unit {} ({} command(s))", name, commands.size());
        return commands;
    }

    public Set<String> loadedUnits() {
        return Collections.unmodifiableSet(unitCommands.keySet());
    }

    /**
     * Replace a loaded unit with a fresh version of it.
     * <p>
     * Commands the new version still defines (same type, name and scopes) take
     * over the remote bindings of the old ones. Commands it no longer defines
     * are disabled and keep their bindings, or are dropped entirely when
     * {@code deleteRemoved} is set.
     */
    public synchronized UnitReload reloadUnit(CommandUnit unit, boolean deleteRemoved) {
        List<ApplicationCommand> previous = unitCommands.remove(unit.getName());
        Map<String, ApplicationCommand> oldByKey = new LinkedHashMap<>();
        if (previous != null) {
            for (ApplicationCommand old : previous) {
                oldByKey.put(key(old), old);
                remove(old, true);
            }
        }

        List<ApplicationCommand> loaded;
        try {
            loaded = loadUnit(unit);
        } catch (RuntimeException e) {
            if (previous != null) {
                previous.forEach(this::register);
                unitCommands.put(unit.getName(), previous);
            }
            log.warn("Reload of unit {} failed, keeping the loaded version: {}", unit.getName(), e.getMessage());
            throw e;
        }
        int rebound = 0;
        for (ApplicationCommand command : loaded) {
            ApplicationCommand old = oldByKey.remove(key(command));
            if (old == null)
                continue;
            old.getBindings().forEach((scope, binding) -> bind(scope, command, binding));
            rebound++;
        }

        List<ApplicationCommand> removed = new ArrayList<>(oldByKey.values());
        for (ApplicationCommand old : removed) {
            if (!deleteRemoved) {
                old.disable();
                old.getBindings().values().forEach(binding -> byId.put(binding.id(), old));
            }
            log.warn("{} command {} was removed from unit {}", old.getType().key(), old.getName(), unit.getName());
        }
        return new UnitReload(unit.getName(), loaded, removed, rebound);
    }

    private static String key(ApplicationCommand command) {
        return command.getType().key() + "/" + command.getName() + "/" + command.getGuildIds();
    }

    private Map<String, ApplicationCommand> slot(Scope scope, CommandType type) {
        return index.computeIfAbsent(scope, s -> Collections.synchronizedMap(new EnumMap<>(CommandType.class)))
                .computeIfAbsent(type, t -> Collections.synchronizedMap(new LinkedHashMap<>()));
    }
}
