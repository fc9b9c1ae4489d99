package com.slashsync.core.dispatch;

/**
 * An interaction addressed a command, group or sub-command that is not
 * registered locally, or one that cannot be invoked.
 */
public class CommandRoutingException extends RuntimeException {

    private final String commandPath;

    public CommandRoutingException(String message, String commandPath) {
        super(message);
        this.commandPath = commandPath;
    }

    public String getCommandPath() {
        return commandPath;
    }
}
