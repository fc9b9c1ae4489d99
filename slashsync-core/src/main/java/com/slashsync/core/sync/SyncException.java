package com.slashsync.core.sync;

/**
 * A synchronization pass failed. The first failure is the cause; failures of
 * other scopes are attached as suppressed exceptions.
 */
public class SyncException extends RuntimeException {

    public SyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
