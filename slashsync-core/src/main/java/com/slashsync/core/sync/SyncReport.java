package com.slashsync.core.sync;

import com.slashsync.core.model.Scope;

import java.util.List;

/**
 * Summary of a synchronization or collection pass.
 */
public record SyncReport(List<ScopeReport> scopes) {

    /**
     * Result for one scope.
     *
     * @param scope             the scope
     * @param strategy          the write that was issued
     * @param created           commands registered for the first time
     * @param updated           commands whose remote entry was rewritten
     * @param carriedOver       commands that already matched
     * @param removalCandidates remote entries without a local command
     * @param bound             local commands bound to a remote entry afterwards
     * @param skipReason        why the scope was skipped, {@code null} otherwise
     */
    public record ScopeReport(Scope scope, SyncStrategy strategy, int created, int updated, int carriedOver,
            int removalCandidates, int bound, String skipReason) {

        static ScopeReport of(SyncPlan plan, int bound) {
            return new ScopeReport(plan.scope(), plan.strategy(), plan.newCommands().size(), plan.updates().size(),
                    plan.carryOvers().size(), plan.removalCandidates().size(), bound, null);
        }

        static ScopeReport skipped(Scope scope, String reason) {
            return new ScopeReport(scope, SyncStrategy.NONE, 0, 0, 0, 0, 0, reason);
        }

        public boolean isSkipped() {
            return skipReason != null;
        }
    }

    public SyncReport {
        scopes = List.copyOf(scopes);
    }

    public static SyncReport empty() {
        return new SyncReport(List.of());
    }

    public ScopeReport scope(Scope scope) {
        return scopes.stream().filter(r -> r.scope().equals(scope)).findFirst().orElse(null);
    }

    public List<Scope> skippedScopes() {
        return scopes.stream().filter(ScopeReport::isSkipped).map(ScopeReport::scope).toList();
    }

    /**
     * Number of scopes where a write was issued.
     */
    public long writes() {
        return scopes.stream().filter(r -> r.strategy() != SyncStrategy.NONE).count();
    }
}
