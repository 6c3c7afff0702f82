package com.phillippitts.talkback.exception;

/**
 * Base exception for all talkBack application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class TalkBackException extends RuntimeException {

    public TalkBackException(String message) {
        super(message);
    }

    public TalkBackException(String message, Throwable cause) {
        super(message, cause);
    }

    public TalkBackException(Throwable cause) {
        super(cause);
    }
}
