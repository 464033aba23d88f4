package com.example.goserver.ai;

/**
 * A single GTP command failed: error reply, timeout, or lost connection.
 */
public class GtpCommandException extends RuntimeException {

    private final boolean timeout;

    public GtpCommandException(String message) {
        this(message, false, null);
    }

    public GtpCommandException(String message, boolean timeout, Throwable cause) {
        super(message, cause);
        this.timeout = timeout;
    }

    public boolean isTimeout() {
        return timeout;
    }
}
