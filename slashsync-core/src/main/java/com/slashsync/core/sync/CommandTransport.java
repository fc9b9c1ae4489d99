package com.slashsync.core.sync;

import com.slashsync.core.model.Scope;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Remote command storage. Every call completes exceptionally with a
 * {@link MissingAccessException} when the application may not manage commands
 * in the scope, or another {@link TransportException} on any other failure.
 * Implementations do not retry.
 */
public interface CommandTransport {

    CompletableFuture<List<Map<String, Object>>> fetchCommands(Scope scope);

    CompletableFuture<Map<String, Object>> createCommand(Scope scope, Map<String, Object> command);

    CompletableFuture<Map<String, Object>> editCommand(Scope scope, long commandId, Map<String, Object> command);

    /**
     * Replace every command of the scope with the given set.
     */
    CompletableFuture<List<Map<String, Object>>> bulkOverwriteCommands(Scope scope, List<Map<String, Object>> commands);
}
