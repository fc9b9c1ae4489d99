package com.slashsync.core.sync;

/**
 * A remote call failed.
 */
public class TransportException extends RuntimeException {

    private final int status;
    private final int code;

    public TransportException(String message, int status, int code) {
        super(message);
        this.status = status;
        this.code = code;
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
        this.status = 0;
        this.code = 0;
    }

    /**
     * HTTP status, or 0 if no response was received.
     */
    public int getStatus() {
        return status;
    }

    /**
     * Platform error code from the response body, or 0.
     */
    public int getCode() {
        return code;
    }
}
