package com.slashsync.core.model;

/**
 * Raised while building the command tree when a name, description, option or
 * structural limit is invalid. Never produced by network activity.
 */
public class CommandValidationException extends RuntimeException {

    public CommandValidationException(String message) {
        super(message);
    }
}
