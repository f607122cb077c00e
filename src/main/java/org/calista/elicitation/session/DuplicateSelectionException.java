package org.calista.elicitation.session;

/**
 * A vignette id would be shown or recorded twice in one session. Always a bug; never recovered.
 */
public final class DuplicateSelectionException extends IllegalStateException {

    private final String sessionId;
    private final String vignetteId;

    public DuplicateSelectionException(String sessionId, String vignetteId) {
        super("vignette '" + vignetteId + "' already completed in session " + sessionId);
        this.sessionId = sessionId;
        this.vignetteId = vignetteId;
    }

    public String sessionId() {
        return sessionId;
    }

    public String vignetteId() {
        return vignetteId;
    }
}
