package com.phillippitts.talkback.exception;

/**
 * Thrown when audio I/O or the speech-to-text stream cannot be started.
 * The session is returned to idle before this exception reaches the caller.
 */
public class SessionStartException extends TalkBackException {

    private final String stage;

    public SessionStartException(String stage, Throwable cause) {
        super("Session start failed during " + stage + ": " + cause.getMessage(), cause);
        this.stage = stage;
    }

    public String getStage() {
        return stage;
    }
}
