package com.example.goserver.ai;

/**
 * The engine kept failing or timing out after the allowed restarts.
 */
public class AiUnresponsiveException extends RuntimeException {

    public AiUnresponsiveException(String message, Throwable cause) {
        super(message, cause);
    }
}
