package com.phillippitts.talkback.exception;

/**
 * Describes a failed language-model turn: the stream threw, or it completed with an empty response.
 * Never thrown out of the orchestrator; it is logged and carried in the session error event.
 */
public class GenerationException extends TalkBackException {

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
