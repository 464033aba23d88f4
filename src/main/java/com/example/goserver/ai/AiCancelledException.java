package com.example.goserver.ai;

/**
 * The thread waiting on the engine was interrupted, usually because its game went away.
 * Never retried.
 */
public class AiCancelledException extends RuntimeException {

    public AiCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
