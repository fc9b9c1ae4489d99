package com.slashsync.core.sync;

/**
 * Write operation chosen for one scope.
 */
public enum SyncStrategy {
    /** Remote already matches. */
    NONE,
    /** Exactly one new command and nothing else to change. */
    CREATE,
    /** Exactly one changed command and nothing else to change. */
    EDIT,
    /** Replace the whole remote set. */
    BULK_OVERWRITE
}
