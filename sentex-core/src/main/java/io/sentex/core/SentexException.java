package io.sentex.core;

public class SentexException extends RuntimeException {

    public SentexException(Throwable cause) {
        super(cause);
    }

    public SentexException(String message, Throwable cause) {
        super(message, cause);
    }

    public SentexException(String message) {
        super(message);
    }

}
