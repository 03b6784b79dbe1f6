package com.sentinel.core.runner;

/**
 * Unchecked failure of a Sentinel collaborator (git, validation process, task list or
 * plan file). Inside a run it is captured and turns the result into ERROR.
 */
public class SentinelException extends RuntimeException {

    public SentinelException(String message) {
        super(message);
    }

    public SentinelException(String message, Throwable cause) {
        super(message, cause);
    }
}
