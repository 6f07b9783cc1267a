package com.socmind.core.model;

/**
 * Thrown when a submitted task fails validation. The task never enters the state machine.
 */
public class InvalidTaskException extends RuntimeException {

    public InvalidTaskException(String message) {
        super(message);
    }
}
