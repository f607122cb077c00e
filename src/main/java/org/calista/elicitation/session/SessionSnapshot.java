package org.calista.elicitation.session;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.calista.elicitation.bayes.Observation;
import org.calista.elicitation.bayes.PreferenceEstimate;
import org.calista.elicitation.math.Matrices;
import org.calista.elicitation.profile.FeatureEncoder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Persisted form of a {@link SessionState} (one JSON document per session).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class SessionSnapshot {

    @JsonProperty("session_id")
    public String sessionId;

    @JsonProperty("posterior_mean")
    public double[] posteriorMean;

    @JsonProperty("posterior_covariance")
    public double[][] posteriorCovariance;

    @JsonProperty("fisher_information_matrix")
    public double[][] fisherInformationMatrix;

    @JsonProperty("completed_vignettes")
    public List<String> completedVignettes = new ArrayList<>();

    @JsonProperty("adaptive_vignettes_shown_count")
    public int adaptiveVignettesShownCount;

    @JsonProperty("adaptive_phase_complete")
    public boolean adaptivePhaseComplete;

    public List<Response> responses = new ArrayList<>();

    @JsonProperty("stop_reason")
    public String stopReason;

    @JsonProperty("encoding_version")
    public String encodingVersion = FeatureEncoder.VERSION;

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Response {
        @JsonProperty("vignette_id")
        public String vignetteId;
        @JsonProperty("chosen_option_id")
        public String chosenOptionId;

        public Response() {}

        public Response(String vignetteId, String chosenOptionId) {
            this.vignetteId = vignetteId;
            this.chosenOptionId = chosenOptionId;
        }
    }

    public static SessionSnapshot of(SessionState state) {
        Objects.requireNonNull(state, "state");
        SessionSnapshot s = new SessionSnapshot();
        s.sessionId = state.sessionId();
        s.posteriorMean = state.posterior().mean();
        s.posteriorCovariance = state.posterior().covarianceArray();
        s.fisherInformationMatrix = Matrices.toArray(state.fisherInformation());
        s.completedVignettes = new ArrayList<>(state.completedVignettes());
        s.adaptiveVignettesShownCount = state.adaptiveVignettesShownCount();
        s.adaptivePhaseComplete = state.adaptivePhaseComplete();
        for (Observation o : state.responses()) s.responses.add(new Response(o.vignetteId(), o.chosenOptionId()));
        s.stopReason = state.stopReason().orElse(null);
        return s;
    }

    /**
     * @throws IllegalArgumentException when the snapshot is structurally invalid
     */
    public void validate() {
        int d = FeatureEncoder.DIMENSIONS;
        if (sessionId == null || sessionId.isBlank()) throw new IllegalArgumentException("session_id is required");
        if (encodingVersion != null && !FeatureEncoder.VERSION.equals(encodingVersion)) {
            throw new IllegalArgumentException("snapshot encoded with " + encodingVersion + ", engine uses " + FeatureEncoder.VERSION);
        }
        if (posteriorMean == null || posteriorMean.length != d) throw new IllegalArgumentException("posterior_mean must have " + d + " values");
        requireSquare("posterior_covariance", posteriorCovariance, d);
        requireSquare("fisher_information_matrix", fisherInformationMatrix, d);
        if (completedVignettes == null) completedVignettes = new ArrayList<>();
        if (responses == null) responses = new ArrayList<>();
        if (adaptiveVignettesShownCount < 0) throw new IllegalArgumentException("adaptive_vignettes_shown_count must be >= 0");
        if (adaptiveVignettesShownCount > completedVignettes.size()) {
            throw new IllegalArgumentException("adaptive_vignettes_shown_count exceeds completed_vignettes");
        }
        if (!responses.isEmpty() && responses.size() != completedVignettes.size()) {
            throw new IllegalArgumentException("responses (" + responses.size() + ") do not match completed_vignettes ("
                    + completedVignettes.size() + ")");
        }
        for (int i = 0; i < responses.size(); i++) {
            Response r = responses.get(i);
            if (r == null || r.vignetteId == null || r.chosenOptionId == null) {
                throw new IllegalArgumentException("responses[" + i + "] is incomplete");
            }
            if (!r.vignetteId.equals(completedVignettes.get(i))) {
                throw new IllegalArgumentException("responses[" + i + "] is for " + r.vignetteId
                        + " but completed_vignettes[" + i + "] is " + completedVignettes.get(i));
            }
        }
    }

    /** Validates and rebuilds the state. */
    public SessionState toState() {
        validate();
        List<Observation> obs = new ArrayList<>(responses.size());
        for (Response r : responses) obs.add(new Observation(r.vignetteId, r.chosenOptionId));
        return SessionState.restored(sessionId,
                new PreferenceEstimate(posteriorMean, posteriorCovariance),
                Matrices.of(fisherInformationMatrix),
                completedVignettes, obs,
                adaptiveVignettesShownCount, adaptivePhaseComplete, stopReason);
    }

    private static void requireSquare(String name, double[][] m, int d) {
        if (m == null || m.length != d) throw new IllegalArgumentException(name + " must be " + d + "x" + d);
        for (double[] row : m) {
            if (row == null || row.length != d) throw new IllegalArgumentException(name + " must be " + d + "x" + d);
        }
    }
}
