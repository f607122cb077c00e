package org.calista.elicitation.session;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One line of the session event log.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ElicitationEvent {

    public static final String SESSION_STARTED = "SESSION_STARTED";
    public static final String VIGNETTE_SHOWN = "VIGNETTE_SHOWN";
    public static final String CHOICE_RECORDED = "CHOICE_RECORDED";
    public static final String ADAPTIVE_STOPPED = "ADAPTIVE_STOPPED";
    public static final String SESSION_COMPLETED = "SESSION_COMPLETED";

    public String type;
    @JsonProperty("ts_epoch_ms")
    public long tsEpochMs;
    @JsonProperty("session_id")
    public String sessionId;
    @JsonProperty("vignette_id")
    public String vignetteId;
    @JsonProperty("option_id")
    public String optionId;
    public String phase;
    /** free text: stop reason, etc. */
    public String detail;

    public static ElicitationEvent of(String type, String sessionId, long tsEpochMs) {
        ElicitationEvent e = new ElicitationEvent();
        e.type = type;
        e.sessionId = sessionId;
        e.tsEpochMs = tsEpochMs;
        return e;
    }

    public static ElicitationEvent shown(String sessionId, String vignetteId, String phase, long tsEpochMs) {
        ElicitationEvent e = of(VIGNETTE_SHOWN, sessionId, tsEpochMs);
        e.vignetteId = vignetteId;
        e.phase = phase;
        return e;
    }

    public static ElicitationEvent choice(String sessionId, String vignetteId, String optionId, String phase, long tsEpochMs) {
        ElicitationEvent e = of(CHOICE_RECORDED, sessionId, tsEpochMs);
        e.vignetteId = vignetteId;
        e.optionId = optionId;
        e.phase = phase;
        return e;
    }

    public static ElicitationEvent adaptiveStopped(String sessionId, String reason, long tsEpochMs) {
        ElicitationEvent e = of(ADAPTIVE_STOPPED, sessionId, tsEpochMs);
        e.detail = reason;
        return e;
    }

    @Override
    public String toString() {
        return type + "{" + sessionId + (vignetteId == null ? "" : ", " + vignetteId)
                + (optionId == null ? "" : "->" + optionId) + "}";
    }
}
