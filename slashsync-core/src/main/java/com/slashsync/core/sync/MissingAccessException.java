package com.slashsync.core.sync;

/**
 * The application lacks the scope or permission to manage commands in a
 * guild (HTTP 403, error code 50001).
 */
public class MissingAccessException extends TransportException {

    public static final int MISSING_ACCESS_CODE = 50001;

    public MissingAccessException(String message, int status, int code) {
        super(message, status, code);
    }
}
