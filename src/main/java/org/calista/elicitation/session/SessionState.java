package org.calista.elicitation.session;

import org.calista.elicitation.bayes.Observation;
import org.calista.elicitation.bayes.PreferenceEstimate;
import org.ejml.data.DMatrixRMaj;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * SessionState: everything one respondent's elicitation has accumulated.
 *
 * <ul>
 *   <li>completed vignettes and responses are append-only, ids never repeat</li>
 *   <li>the adaptive phase flag only moves false to true</li>
 *   <li>posterior and FIM are replaced wholesale on each answer</li>
 * </ul>
 *
 * Owned by a single session driver; not thread-safe.
 */
public final class SessionState {

    private final String sessionId;
    private final List<String> completed = new ArrayList<>();
    private final Set<String> completedIndex = new LinkedHashSet<>();
    private final List<Observation> responses = new ArrayList<>();
    private PreferenceEstimate posterior;
    private DMatrixRMaj fim;
    private int adaptiveShown;
    private boolean adaptiveComplete;
    private String stopReason;

    public SessionState(String sessionId, PreferenceEstimate prior, DMatrixRMaj initialFim) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        if (sessionId.isBlank()) throw new IllegalArgumentException("sessionId is blank");
        this.posterior = Objects.requireNonNull(prior, "prior");
        this.fim = Objects.requireNonNull(initialFim, "initialFim").copy();
    }

    /**
     * Rebuilds a state from persisted parts.
     */
    static SessionState restored(String sessionId, PreferenceEstimate posterior, DMatrixRMaj fim,
                                 List<String> completed, List<Observation> responses,
                                 int adaptiveShown, boolean adaptiveComplete, String stopReason) {
        SessionState s = new SessionState(sessionId, posterior, fim);
        for (String id : completed) {
            if (!s.completedIndex.add(id)) throw new DuplicateSelectionException(sessionId, id);
            s.completed.add(id);
        }
        s.responses.addAll(responses);
        s.adaptiveShown = adaptiveShown;
        s.adaptiveComplete = adaptiveComplete;
        s.stopReason = stopReason;
        return s;
    }

    public String sessionId() {
        return sessionId;
    }

    public List<String> completedVignettes() {
        return Collections.unmodifiableList(completed);
    }

    public boolean isCompleted(String vignetteId) {
        return completedIndex.contains(vignetteId);
    }

    public int completedCount() {
        return completed.size();
    }

    public List<Observation> responses() {
        return Collections.unmodifiableList(responses);
    }

    public PreferenceEstimate posterior() {
        return posterior;
    }

    /** Copy of the cumulative Fisher information. */
    public DMatrixRMaj fisherInformation() {
        return fim.copy();
    }

    public int adaptiveVignettesShownCount() {
        return adaptiveShown;
    }

    public boolean adaptivePhaseComplete() {
        return adaptiveComplete;
    }

    public Optional<String> stopReason() {
        return Optional.ofNullable(stopReason);
    }

    // ---------------------------------------------------------------------
    // Mutation (session driver only)
    // ---------------------------------------------------------------------

    /**
     * Appends an answered vignette with the estimates it produced.
     *
     * @throws DuplicateSelectionException when the vignette was already completed
     */
    public void recordAnswer(Observation observation, PreferenceEstimate newPosterior, DMatrixRMaj newFim, boolean adaptive) {
        Objects.requireNonNull(observation, "observation");
        Objects.requireNonNull(newPosterior, "newPosterior");
        Objects.requireNonNull(newFim, "newFim");
        if (!completedIndex.add(observation.vignetteId())) {
            throw new DuplicateSelectionException(sessionId, observation.vignetteId());
        }
        completed.add(observation.vignetteId());
        responses.add(observation);
        posterior = newPosterior;
        fim = newFim.copy();
        if (adaptive) adaptiveShown++;
    }

    /** Marks the adaptive phase done. Later calls keep the first reason. */
    public void completeAdaptivePhase(String reason) {
        if (adaptiveComplete) return;
        adaptiveComplete = true;
        stopReason = reason;
    }

    @Override
    public String toString() {
        return "SessionState{" + sessionId
                + ", completed=" + completed.size()
                + ", adaptiveShown=" + adaptiveShown
                + ", adaptiveComplete=" + adaptiveComplete + "}";
    }
}
