package com.slashsync.core.registry;

import com.slashsync.core.node.ApplicationCommand;

import java.util.List;

/**
 * What a unit reload changed.
 *
 * @param unitName  the reloaded unit
 * @param loaded    commands registered by the new version of the unit
 * @param removed   commands of the old version that the new one no longer defines
 * @param rebound   loaded commands that took over the remote bindings of their
 *                  predecessor
 */
public record UnitReload(String unitName, List<ApplicationCommand> loaded, List<ApplicationCommand> removed,
        int rebound) {

    public UnitReload {
        loaded = List.copyOf(loaded);
        removed = List.copyOf(removed);
    }

    public boolean hasRemovals() {
        return !removed.isEmpty();
    }
}
