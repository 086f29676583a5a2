package io.sentex.core;

/**
 * Raised when data handed to the index cannot be indexed, e.g. a missing
 * sentence list or a {@code null} sentence inside it.
 */
public class InvalidInputException extends SentexException {

    public InvalidInputException(String message) {
        super(message);
    }

    public InvalidInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
