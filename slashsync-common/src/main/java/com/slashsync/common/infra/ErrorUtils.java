package com.slashsync.common.infra;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Error formatting helpers.
 */
public final class ErrorUtils {

    private ErrorUtils() {
    }

    /**
     * Strip the {@link CompletionException} / {@link ExecutionException}
     * wrappers that asynchronous pipelines put around the real failure.
     */
    public static Throwable unwrap(Throwable err) {
        Throwable current = err;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Format an exception message safely.
     *
     * @return a non-null human-readable error string
     */
    public static String formatErrorMessage(Throwable err) {
        if (err == null)
            return "Error";
        Throwable root = unwrap(err);
        String msg = root.getMessage();
        if (msg != null && !msg.isEmpty()) {
            return msg;
        }
        return root.getClass().getSimpleName();
    }

    /**
     * Find the first throwable of the given type in the cause chain.
     */
    public static <T extends Throwable> T findCause(Throwable err, Class<T> type) {
        Throwable current = err;
        int depth = 0;
        while (current != null && depth++ < 16) {
            if (type.isInstance(current)) {
                return type.cast(current);
            }
            current = current.getCause();
        }
        return null;
    }
}
