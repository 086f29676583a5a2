package io.sentex.core;

/**
 * Raised when an operation receives a collaborator it cannot work with,
 * such as a missing finder passed to merge.
 */
public class InvalidArgumentException extends SentexException {

    public InvalidArgumentException(String message) {
        super(message);
    }
}
