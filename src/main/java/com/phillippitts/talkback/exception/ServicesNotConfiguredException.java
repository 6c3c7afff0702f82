package com.phillippitts.talkback.exception;

import java.util.List;

/**
 * Thrown when a session start is attempted without one or more required collaborators.
 * Raised before any state transition, so the session stays idle.
 */
public class ServicesNotConfiguredException extends TalkBackException {

    private final List<String> missingServices;

    public ServicesNotConfiguredException(List<String> missingServices) {
        super("Required services not configured: " + missingServices);
        this.missingServices = List.copyOf(missingServices);
    }

    public List<String> getMissingServices() {
        return missingServices;
    }
}
