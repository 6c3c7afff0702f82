package com.phillippitts.talkback.service.orchestration;

/**
 * Who takes the first turn of a session.
 */
public enum SessionMode {
    /** Listen first; the assistant answers the user's first utterance. */
    USER_SPEAKS_FIRST,
    /** Lecture mode: the assistant opens the session, then listens for replies. */
    AI_SPEAKS_FIRST
}
