package com.slashsync.core.sync;

import com.slashsync.core.model.RemoteBinding;
import com.slashsync.core.model.Scope;
import com.slashsync.core.node.ApplicationCommand;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Staged changes for one scope.
 *
 * @param scope             the scope the plan applies to
 * @param newCommands       local commands with no remote entry
 * @param updates           local commands whose remote entry differs
 * @param carryOvers        local commands whose remote entry already matches
 * @param removalCandidates remote entries with no local command
 * @param deleteRemoved     whether removal candidates are dropped by a bulk
 *                          overwrite
 * @param strategy          the write to issue
 */
public record SyncPlan(Scope scope, List<ApplicationCommand> newCommands, List<Staged> updates,
        List<Staged> carryOvers, List<Map<String, Object>> removalCandidates, boolean deleteRemoved,
        SyncStrategy strategy) {

    /** Keys of a remote entry that are accepted back by a bulk overwrite. */
    private static final Set<String> WRITABLE_KEYS = Set.of("id", "type", "name", "name_localizations",
            "description", "description_localizations", "options", "default_member_permissions",
            "dm_permission", "nsfw");

    /**
     * A local command paired with its remote entry.
     */
    public record Staged(ApplicationCommand command, Map<String, Object> remote) {

        public long remoteId() {
            return RemoteBinding.parseId(remote.get("id"));
        }
    }

    public SyncPlan {
        newCommands = List.copyOf(newCommands);
        updates = List.copyOf(updates);
        carryOvers = List.copyOf(carryOvers);
        removalCandidates = List.copyOf(removalCandidates);
    }

    public boolean hasChanges() {
        return strategy != SyncStrategy.NONE;
    }

    /**
     * Full desired remote set: updates, new commands and carry-overs, plus the
     * removal candidates when they are kept.
     */
    public List<Map<String, Object>> bulkPayload() {
        List<Map<String, Object>> payload = new ArrayList<>();
        for (Staged update : updates) {
            payload.add(withId(update.command().toWire(scope), update.remoteId()));
        }
        for (ApplicationCommand command : newCommands) {
            payload.add(command.toWire(scope));
        }
        for (Staged carried : carryOvers) {
            payload.add(withId(carried.command().toWire(scope), carried.remoteId()));
        }
        if (!deleteRemoved) {
            for (Map<String, Object> remote : removalCandidates) {
                Map<String, Object> kept = new LinkedHashMap<>();
                remote.forEach((key, value) -> {
                    if (WRITABLE_KEYS.contains(key)) {
                        kept.put(key, value);
                    }
                });
                if (!scope.isGlobal()) {
                    kept.remove("dm_permission");
                }
                payload.add(kept);
            }
        }
        return payload;
    }

    private static Map<String, Object> withId(Map<String, Object> wire, long id) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("id", Long.toString(id));
        result.putAll(wire);
        return result;
    }

    @Override
    public String toString() {
        return "SyncPlan{" + scope + ", strategy=" + strategy + ", new=" + newCommands.size()
                + ", updates=" + updates.size() + ", carryOvers=" + carryOvers.size()
                + ", removalCandidates=" + removalCandidates.size() + "}";
    }
}
