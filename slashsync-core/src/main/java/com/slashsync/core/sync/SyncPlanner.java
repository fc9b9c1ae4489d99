package com.slashsync.core.sync;

import com.slashsync.core.model.CommandType;
import com.slashsync.core.model.Scope;
import com.slashsync.core.node.ApplicationCommand;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Diffs the local commands of a scope against the remote list and picks the
 * cheapest write. Pure: no I/O and no mutation of its inputs.
 */
public class SyncPlanner {

    public SyncPlan plan(Scope scope, List<ApplicationCommand> local, List<Map<String, Object>> remote,
            boolean deleteRemoved) {
        Map<CommandType, Map<String, ApplicationCommand>> localByType = new EnumMap<>(CommandType.class);
        for (ApplicationCommand command : local) {
            localByType.computeIfAbsent(command.getType(), t -> new LinkedHashMap<>())
                    .put(command.getName(), command);
        }

        List<SyncPlan.Staged> updates = new ArrayList<>();
        List<SyncPlan.Staged> carryOvers = new ArrayList<>();
        List<Map<String, Object>> removalCandidates = new ArrayList<>();
        Map<CommandType, Map<String, ApplicationCommand>> unmatched = new EnumMap<>(CommandType.class);
        localByType.forEach((type, byName) -> unmatched.put(type, new LinkedHashMap<>(byName)));

        for (Map<String, Object> entry : remote) {
            CommandType type = remoteType(entry);
            ApplicationCommand command = type == null ? null
                    : unmatched.getOrDefault(type, Map.of()).get(String.valueOf(entry.get("name")));
            if (command == null) {
                removalCandidates.add(entry);
                continue;
            }
            unmatched.get(type).remove(command.getName());
            if (command.matchesWire(entry, scope)) {
                carryOvers.add(new SyncPlan.Staged(command, entry));
            } else {
                updates.add(new SyncPlan.Staged(command, entry));
            }
        }

        List<ApplicationCommand> newCommands = new ArrayList<>();
        unmatched.values().forEach(byName -> newCommands.addAll(byName.values()));

        SyncStrategy strategy = strategy(newCommands.size(), updates.size(), removalCandidates.size(),
                deleteRemoved);
        return new SyncPlan(scope, newCommands, updates, carryOvers, removalCandidates, deleteRemoved, strategy);
    }

    static SyncStrategy strategy(int created, int updated, int removalCandidates, boolean deleteRemoved) {
        int changes = created + updated;
        if (changes == 0) {
            // kept removal candidates need no write
            return removalCandidates > 0 && deleteRemoved ? SyncStrategy.BULK_OVERWRITE : SyncStrategy.NONE;
        }
        if (changes == 1 && removalCandidates == 0) {
            return created == 1 ? SyncStrategy.CREATE : SyncStrategy.EDIT;
        }
        return SyncStrategy.BULK_OVERWRITE;
    }

    private static CommandType remoteType(Map<String, Object> entry) {
        Object type = entry.get("type");
        if (type == null)
            return CommandType.CHAT_INPUT;
        return type instanceof Number n ? CommandType.fromValue(n.intValue()) : null;
    }
}
