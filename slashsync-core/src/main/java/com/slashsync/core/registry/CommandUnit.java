package com.slashsync.core.registry;

import com.slashsync.core.node.ApplicationCommand;
import com.slashsync.core.node.CommandHandlers;

import java.util.List;

/**
 * A reloadable group of commands registered and removed together.
 * <p>
 * {@link #commands()} is called on every load and must build fresh command
 * values each time. Checks returned by {@link #checks()} run before the
 * commands' own checks.
 */
public interface CommandUnit {

    String getName();

    List<ApplicationCommand> commands();

    default List<CommandHandlers.Check> checks() {
        return List.of();
    }
}
