package com.slashsync.core.sync;

import com.slashsync.core.model.RemoteBinding;
import com.slashsync.core.model.Scope;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * In-memory remote command store that records every call. Stored entries look
 * like what the platform returns: null fields dropped, ids and versions added.
 */
class FakeTransport implements CommandTransport {

    static final long APPLICATION_ID = 42L;

    final Map<Scope, List<Map<String, Object>>> remote = new HashMap<>();
    final List<String> calls = new ArrayList<>();
    final List<List<Map<String, Object>>> bulkPayloads = new ArrayList<>();
    final Set<Scope> forbidden = new HashSet<>();
    final Set<Scope> hanging = new HashSet<>();
    final Map<Scope, RuntimeException> failing = new HashMap<>();
    private long nextId = 1_000_000_000_000L;

    /**
     * Seed a remote entry as the platform would store it.
     */
    Map<String, Object> seed(Scope scope, Map<String, Object> wire) {
        Map<String, Object> stored = store(scope, wire, null);
        remote.computeIfAbsent(scope, s -> new ArrayList<>()).add(stored);
        return stored;
    }

    long writes() {
        return calls.stream().filter(call -> !call.startsWith("fetch")).count();
    }

    List<String> writeCalls() {
        return calls.stream().filter(call -> !call.startsWith("fetch")).toList();
    }

    @Override
    public CompletableFuture<List<Map<String, Object>>> fetchCommands(Scope scope) {
        return call("fetch " + scope, scope, () -> copy(remote.getOrDefault(scope, List.of())));
    }

    @Override
    public CompletableFuture<Map<String, Object>> createCommand(Scope scope, Map<String, Object> command) {
        return call("create " + scope + " " + command.get("name"), scope, () -> {
            Map<String, Object> stored = store(scope, command, null);
            List<Map<String, Object>> entries = remote.computeIfAbsent(scope, s -> new ArrayList<>());
            entries.removeIf(e -> e.get("name").equals(command.get("name")) && e.get("type").equals(command.get("type")));
            entries.add(stored);
            return stored;
        });
    }

    @Override
    public CompletableFuture<Map<String, Object>> editCommand(Scope scope, long commandId, Map<String, Object> command) {
        return call("edit " + scope + " " + command.get("name"), scope, () -> {
            List<Map<String, Object>> entries = remote.computeIfAbsent(scope, s -> new ArrayList<>());
            for (int i = 0; i < entries.size(); i++) {
                if (RemoteBinding.parseId(entries.get(i).get("id")) == commandId) {
                    Map<String, Object> stored = store(scope, command, Long.toString(commandId));
                    entries.set(i, stored);
                    return stored;
                }
            }
            throw new TransportException("Unknown application command", 404, 10063);
        });
    }

    @Override
    public CompletableFuture<List<Map<String, Object>>> bulkOverwriteCommands(Scope scope,
            List<Map<String, Object>> commands) {
        return call("bulk " + scope, scope, () -> {
            bulkPayloads.add(commands);
            List<Map<String, Object>> entries = new ArrayList<>();
            for (Map<String, Object> command : commands) {
                Object id = command.get("id");
                entries.add(store(scope, command, id == null ? null : id.toString()));
            }
            remote.put(scope, entries);
            return copy(entries);
        });
    }

    private interface Action<T> {
        T run();
    }

    private <T> CompletableFuture<T> call(String description, Scope scope, Action<T> action) {
        calls.add(description);
        if (hanging.contains(scope))
            return new CompletableFuture<>();
        if (forbidden.contains(scope))
            return CompletableFuture.failedFuture(new MissingAccessException("Missing Access", 403, 50001));
        if (failing.containsKey(scope))
            return CompletableFuture.failedFuture(failing.get(scope));
        try {
            return CompletableFuture.completedFuture(action.run());
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private Map<String, Object> store(Scope scope, Map<String, Object> wire, String id) {
        Map<String, Object> stored = new LinkedHashMap<>();
        stored.put("id", id != null ? id : Long.toString(nextId++ << 22));
        stored.put("application_id", Long.toString(APPLICATION_ID));
        if (!scope.isGlobal()) {
            stored.put("guild_id", Long.toString(scope.guildId()));
        }
        stored.put("version", Long.toString(nextId++));
        wire.forEach((key, value) -> {
            if (value != null && !key.equals("id")) {
                stored.put(key, value);
            }
        });
        return stored;
    }

    private static List<Map<String, Object>> copy(List<Map<String, Object>> entries) {
        List<Map<String, Object>> result = new ArrayList<>();
        entries.forEach(entry -> result.add(new LinkedHashMap<>(entry)));
        return result;
    }
}
