package com.slashsync.core.dispatch;

/**
 * A check attached to a command returned {@code false}.
 */
public class CheckFailureException extends RuntimeException {

    private final String commandPath;
    private final int checkIndex;

    public CheckFailureException(String commandPath, int checkIndex) {
        super("The check functions for command " + commandPath + " failed.");
        this.commandPath = commandPath;
        this.checkIndex = checkIndex;
    }

    public String getCommandPath() {
        return commandPath;
    }

    public int getCheckIndex() {
        return checkIndex;
    }
}
