package com.example.goserver.ai;

/**
 * The engine process could not be started.
 */
public class AiUnavailableException extends RuntimeException {

    public AiUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
