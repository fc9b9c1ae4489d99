package com.slashsync.core.sync;

import com.slashsync.common.config.SlashSyncConfig;
import com.slashsync.common.infra.ErrorUtils;
import com.slashsync.common.logging.SubsystemLogger;
import com.slashsync.core.model.CommandType;
import com.slashsync.core.model.RemoteBinding;
import com.slashsync.core.model.Scope;
import com.slashsync.core.node.ApplicationCommand;
import com.slashsync.core.registry.CommandRegistry;
import com.slashsync.core.registry.UnitReload;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Converges the remote command sets with the {@link CommandRegistry}.
 * <p>
 * Per scope the sequence fetch, diff, write, re-fetch, bind is strictly
 * ordered. The global scope runs first, then every guild scope, sequentially
 * or concurrently. A guild where the application lacks access, or that does
 * not answer within the configured timeout, is skipped. Any other failure
 * fails the pass with a {@link SyncException} once all scopes are done.
 */
@Slf4j
public class SyncEngine {

    private final CommandRegistry registry;
    private final CommandTransport transport;
    private final SlashSyncConfig.SyncConfig config;
    private final SyncPlanner planner = new SyncPlanner();
    private final SubsystemLogger globalLog = SubsystemLogger.create("sync").child("global");
    private final SubsystemLogger guildLog = SubsystemLogger.create("sync").child("guild");
    /** Guild scopes seen in earlier passes, so emptied guilds still get cleaned up. */
    private final Set<Scope> knownGuilds = ConcurrentHashMap.newKeySet();

    public SyncEngine(CommandRegistry registry, CommandTransport transport, SlashSyncConfig.SyncConfig config) {
        this.registry = registry;
        this.transport = transport;
        this.config = config;
    }

    // =========================================================================
    // Passes
    // =========================================================================

    public CompletableFuture<SyncReport> synchronize() {
        return synchronize(List.of());
    }

    /**
     * Synchronize the global scope and every guild scope.
     *
     * @param extraGuildIds guilds to check even if no local command targets them,
     *                      e.g. every guild the application is in
     */
    public CompletableFuture<SyncReport> synchronize(Collection<Long> extraGuildIds) {
        return runPass(extraGuildIds, this::synchronizeScope, "Synchronization");
    }

    /**
     * Bind remote metadata to local commands without writing anything.
     */
    public CompletableFuture<SyncReport> collect() {
        return runPass(List.of(), this::collectScope, "Collection");
    }

    /**
     * Follow up a unit reload: synchronize when configured to, otherwise keep
     * the bindings the registry carried over.
     */
    public CompletableFuture<SyncReport> afterReload(UnitReload reload) {
        if (config.isSyncOnUnitReload() || config.isDeleteOnUnitReload() && reload.hasRemovals()) {
            log.info("Unit {} reloaded, synchronizing commands", reload.unitName());
            return synchronize();
        }
        if (reload.hasRemovals()) {
            log.warn("{} command(s) removed from unit {} are disabled but still registered remotely",
                    reload.removed().size(), reload.unitName());
        }
        log.debug("Unit {} reloaded, {} command(s) re-bound from cache", reload.unitName(), reload.rebound());
        return CompletableFuture.completedFuture(SyncReport.empty());
    }

    // =========================================================================
    // Per scope
    // =========================================================================

    public CompletableFuture<SyncReport.ScopeReport> synchronizeScope(Scope scope) {
        SubsystemLogger slog = logFor(scope);
        slog.info("Checking for changes...");
        return transport.fetchCommands(scope).thenCompose(remote -> {
            SyncPlan plan = planner.plan(scope, registry.commands(scope), remote,
                    config.isDeleteNotExistingCommands());
            registry.recordUnmanaged(scope,
                    config.isDeleteNotExistingCommands() ? List.of() : plan.removalCandidates());
            slog.debug("Planned " + plan);

            CompletableFuture<?> write = switch (plan.strategy()) {
                case NONE -> null;
                case CREATE -> transport.createCommand(scope, plan.newCommands().get(0).toWire(scope));
                case EDIT -> {
                    SyncPlan.Staged update = plan.updates().get(0);
                    yield transport.editCommand(scope, update.remoteId(), update.command().toWire(scope));
                }
                case BULK_OVERWRITE -> transport.bulkOverwriteCommands(scope, plan.bulkPayload());
            };
            if (write == null) {
                slog.info("No changes", Map.of("commands", plan.carryOvers().size()));
                return CompletableFuture.completedFuture(SyncReport.ScopeReport.of(plan, bindAll(scope, remote)));
            }
            return write
                    .thenCompose(ignored -> transport.fetchCommands(scope))
                    .thenApply(fresh -> {
                        int bound = bindAll(scope, fresh);
                        slog.info("Synced commands", Map.of("strategy", plan.strategy(),
                                "created", plan.newCommands().size(), "updated", plan.updates().size()));
                        return SyncReport.ScopeReport.of(plan, bound);
                    });
        });
    }

    private CompletableFuture<SyncReport.ScopeReport> collectScope(Scope scope) {
        return transport.fetchCommands(scope).thenApply(remote -> {
            SyncPlan plan = planner.plan(scope, registry.commands(scope), remote, false);
            registry.recordUnmanaged(scope, plan.removalCandidates());
            int bound = bindAll(scope, remote);
            logFor(scope).debug("Collected remote commands", Map.of("bound", bound));
            return new SyncReport.ScopeReport(scope, SyncStrategy.NONE, 0, 0, 0,
                    plan.removalCandidates().size(), bound, null);
        });
    }

    /**
     * Bind every remote entry that has a local command of the same type and
     * name in the scope.
     *
     * @return number of local commands bound
     */
    int bindAll(Scope scope, List<Map<String, Object>> remote) {
        Map<String, ApplicationCommand> local = new LinkedHashMap<>();
        for (ApplicationCommand command : registry.commands(scope)) {
            local.put(command.getType().key() + "/" + command.getName(), command);
        }
        int bound = 0;
        for (Map<String, Object> entry : remote) {
            Object rawType = entry.get("type");
            CommandType type = rawType instanceof Number n ? CommandType.fromValue(n.intValue())
                    : CommandType.CHAT_INPUT;
            ApplicationCommand command = type == null ? null : local.get(type.key() + "/" + entry.get("name"));
            if (command == null)
                continue;
            RemoteBinding binding = RemoteBinding.fromWire(entry);
            if (binding.guildId() == null && !scope.isGlobal()) {
                binding = new RemoteBinding(binding.id(), binding.applicationId(), scope.guildId(),
                        binding.version(), binding.createdAt(), binding.permissions());
            }
            registry.bind(scope, command, binding);
            bound++;
        }
        return bound;
    }

    // =========================================================================
    // Fan-out
    // =========================================================================

    private record Outcome(SyncReport.ScopeReport report, Throwable failure) {
    }

    private CompletableFuture<SyncReport> runPass(Collection<Long> extraGuildIds,
            Function<Scope, CompletableFuture<SyncReport.ScopeReport>> perScope, String what) {
        Set<Scope> guilds = new LinkedHashSet<>(registry.guildScopes());
        guilds.addAll(knownGuilds);
        extraGuildIds.forEach(id -> guilds.add(Scope.guild(id)));
        knownGuilds.addAll(guilds);

        CompletableFuture<Outcome> global = guard(Scope.GLOBAL, perScope);
        CompletableFuture<List<Outcome>> outcomes;
        if (config.isConcurrentGuilds()) {
            List<CompletableFuture<Outcome>> futures = new ArrayList<>();
            futures.add(global);
            guilds.forEach(scope -> futures.add(guard(scope, perScope)));
            outcomes = CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new))
                    .thenApply(ignored -> futures.stream().map(CompletableFuture::join).toList());
        } else {
            CompletableFuture<List<Outcome>> chain = global.thenApply(first -> {
                List<Outcome> list = new ArrayList<>();
                list.add(first);
                return list;
            });
            for (Scope scope : guilds) {
                chain = chain.thenCompose(list -> guard(scope, perScope).thenApply(outcome -> {
                    list.add(outcome);
                    return list;
                }));
            }
            outcomes = chain;
        }

        return outcomes.thenApply(list -> {
            SyncException failure = null;
            List<SyncReport.ScopeReport> reports = new ArrayList<>();
            for (Outcome outcome : list) {
                if (outcome.failure() == null) {
                    reports.add(outcome.report());
                } else if (failure == null) {
                    failure = new SyncException(what + " failed: "
                            + ErrorUtils.formatErrorMessage(outcome.failure()), outcome.failure());
                } else {
                    failure.addSuppressed(outcome.failure());
                }
            }
            if (failure != null) {
                throw failure;
            }
            SyncReport report = new SyncReport(reports);
            log.info("{} finished: {} scope(s), {} write(s), {} skipped", what, reports.size(),
                    report.writes(), report.skippedScopes().size());
            return report;
        });
    }

    /**
     * Run one scope and turn every result into an {@link Outcome}. Guild
     * scopes get the configured timeout, and missing access or a timeout
     * becomes a skip.
     */
    private CompletableFuture<Outcome> guard(Scope scope,
            Function<Scope, CompletableFuture<SyncReport.ScopeReport>> perScope) {
        CompletableFuture<SyncReport.ScopeReport> future;
        try {
            future = perScope.apply(scope);
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        if (!scope.isGlobal() && config.getGuildTimeoutMs() > 0) {
            future = future.orTimeout(config.getGuildTimeoutMs(), TimeUnit.MILLISECONDS);
        }
        return future.handle((report, error) -> {
            if (error == null)
                return new Outcome(report, null);
            Throwable cause = ErrorUtils.unwrap(error);
            if (!scope.isGlobal() && cause instanceof MissingAccessException) {
                logFor(scope).warn("Missing access, skipping guild");
                return new Outcome(SyncReport.ScopeReport.skipped(scope, "missing access"), null);
            }
            if (!scope.isGlobal() && cause instanceof TimeoutException) {
                logFor(scope).warn("Timed out, skipping guild", Map.of("timeoutMs", config.getGuildTimeoutMs()));
                return new Outcome(SyncReport.ScopeReport.skipped(scope, "timed out"), null);
            }
            logFor(scope).error("Failed to synchronize", cause);
            return new Outcome(null, cause);
        });
    }

    private SubsystemLogger logFor(Scope scope) {
        return (scope.isGlobal() ? globalLog : guildLog).with("scope", scope);
    }
}
