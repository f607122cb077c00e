package org.calista.elicitation.engine;

import org.calista.elicitation.bayes.LikelihoodFunction;
import org.calista.elicitation.bayes.Observation;
import org.calista.elicitation.bayes.PosteriorManager;
import org.calista.elicitation.bayes.PreferenceEstimate;
import org.calista.elicitation.info.FisherInformationCalculator;
import org.calista.elicitation.info.StoppingDecision;
import org.calista.elicitation.info.StoppingDiagnostics;
import org.calista.elicitation.session.DuplicateSelectionException;
import org.calista.elicitation.session.ElicitationEvent;
import org.calista.elicitation.session.EventStore;
import org.calista.elicitation.session.SessionSnapshot;
import org.calista.elicitation.session.SessionState;
import org.calista.elicitation.vignette.UserContext;
import org.calista.elicitation.vignette.Vignette;
import org.calista.elicitation.vignette.VignetteLibrary;
import org.ejml.data.DMatrixRMaj;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * ElicitationSession: drives one respondent through the study.
 *
 * <p>
 * Turn loop: {@link #nextVignette} asks the engine for a vignette, {@link #recordChoice} folds the
 * answer into the posterior and the cumulative Fisher information (evaluated at the updated mean),
 * counts adaptive answers and, once the static beginning is done, applies the stopping rule.
 * STOP is sticky. Every step is appended to the event log first, so {@link #replay} of that log
 * rebuilds the same state.
 * </p>
 *
 * <p>Single-threaded: callers keep at most one call in flight per session. Background pre-warm tasks
 * only ever see immutable vignettes.</p>
 */
public final class ElicitationSession {
    private static final Logger log = LoggerFactory.getLogger(ElicitationSession.class);

    private final String sessionId;
    private final VignetteEngine engine;
    private final EventStore events;      // nullable: no event log
    private final PrewarmCache prewarm;   // nullable: no personalization
    private final Clock clock;

    private SessionState state;
    private PosteriorManager posterior;
    private StoppingDecision lastDecision;
    private UserContext context = UserContext.empty();
    private String presented;             // id handed out by nextVignette and not yet answered
    private boolean started;
    private boolean completionLogged;
    private boolean replaying;

    private ElicitationSession(Builder b) {
        this.sessionId = b.sessionId;
        this.engine = b.engine;
        this.events = b.events;
        this.prewarm = b.prewarm;
        this.clock = b.clock;
        reset();
    }

    public static Builder builder(VignetteEngine engine) {
        return new Builder(engine);
    }

    public static final class Builder {
        private final VignetteEngine engine;
        private String sessionId;
        private EventStore events;
        private PrewarmCache prewarm;
        private Clock clock = Clock.systemUTC();

        private Builder(VignetteEngine engine) {
            this.engine = Objects.requireNonNull(engine, "engine");
        }

        public Builder sessionId(String sessionId) {
            this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
            return this;
        }

        public Builder events(EventStore events) {
            this.events = events;
            return this;
        }

        public Builder prewarm(PrewarmCache prewarm) {
            this.prewarm = prewarm;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public ElicitationSession build() {
            if (sessionId == null || sessionId.isBlank()) throw new IllegalStateException("sessionId is required");
            return new ElicitationSession(this);
        }
    }

    private void reset() {
        this.posterior = new PosteriorManager(engine.config());
        this.state = new SessionState(sessionId, posterior.current(), FisherInformationCalculator.zero());
        this.lastDecision = null;
        this.presented = null;
        this.started = false;
        this.completionLogged = false;
    }

    // ---------------------------------------------------------------------
    // Turn loop
    // ---------------------------------------------------------------------

    /**
     * Logs the session start and pre-warms the static vignettes. Idempotent.
     */
    public void start(UserContext userContext) throws IOException {
        this.context = Objects.requireNonNull(userContext, "userContext");
        if (started) return;
        started = true;
        append(ElicitationEvent.of(ElicitationEvent.SESSION_STARTED, sessionId, clock.millis()));
        prewarmUpcoming();
        log.info("Session {} started ({})", sessionId, userContext);
    }

    /**
     * @return the vignette to show, empty once the session is complete
     */
    public Optional<Vignette> nextVignette(UserContext userContext) throws IOException {
        Objects.requireNonNull(userContext, "userContext");
        if (!started) start(userContext);
        this.context = userContext;

        boolean wasComplete = state.adaptivePhaseComplete();
        Optional<Vignette> next = engine.selectNextVignette(state, userContext);
        if (!wasComplete && state.adaptivePhaseComplete()) {
            String reason = state.stopReason().orElse(VignetteEngine.EXHAUSTED_REASON);
            append(ElicitationEvent.adaptiveStopped(sessionId, reason, clock.millis()));
        }

        if (next.isEmpty()) {
            presented = null;
            if (!completionLogged) {
                completionLogged = true;
                append(ElicitationEvent.of(ElicitationEvent.SESSION_COMPLETED, sessionId, clock.millis()));
                log.info("Session {} complete after {} vignettes", sessionId, state.completedCount());
            }
            return next;
        }

        Vignette v = next.get();
        presented = v.vignetteId();
        append(ElicitationEvent.shown(sessionId, v.vignetteId(), phaseOf(v).name(), clock.millis()));
        Vignette shown = (prewarm == null) ? v : prewarm.resolve(v);
        prewarmUpcoming();
        return Optional.of(shown);
    }

    /**
     * Records the respondent's answer.
     *
     * @throws IllegalArgumentException    unknown vignette or option id
     * @throws DuplicateSelectionException the vignette was already answered
     * @throws IllegalStateException       the vignette is not the one {@link #nextVignette} last returned
     */
    public PreferenceEstimate recordChoice(String vignetteId, String optionId) throws IOException {
        Objects.requireNonNull(vignetteId, "vignetteId");
        Objects.requireNonNull(optionId, "optionId");
        Vignette v = engine.library().find(vignetteId)
                .orElseThrow(() -> new IllegalArgumentException("unknown vignette: " + vignetteId));
        if (state.isCompleted(vignetteId)) throw new DuplicateSelectionException(sessionId, vignetteId);
        if (v.option(optionId).isEmpty()) {
            throw new IllegalArgumentException("unknown option '" + optionId + "' for vignette " + vignetteId);
        }
        // replayed logs carry their own presentation order
        if (!replaying && !vignetteId.equals(presented)) {
            throw new IllegalStateException("vignette " + vignetteId + " was not presented in session " + sessionId
                    + (presented == null ? "" : "; awaiting an answer to " + presented));
        }
        presented = null;

        append(ElicitationEvent.choice(sessionId, vignetteId, optionId, phaseOf(v).name(), clock.millis()));
        return apply(v, optionId);
    }

    private PreferenceEstimate apply(Vignette v, String optionId) throws IOException {
        LikelihoodFunction fn = engine.likelihood().createLikelihoodFunction(v, optionId);
        Observation obs = fn.observation();
        PreferenceEstimate updated = posterior.update(fn, obs);
        DMatrixRMaj fim = engine.fisher().accumulate(state.fisherInformation(), v, updated.mean());
        state.recordAnswer(obs, updated, fim, engine.library().isAdaptive(v.vignetteId()));

        if (log.isDebugEnabled()) {
            log.debug("Session {}: {} -> {} | n={} det={} maxVar={}", sessionId, v.vignetteId(), optionId,
                    state.completedCount(), FisherInformationCalculator.dEfficiency(fim), updated.maxVariance());
        }

        if (engine.config().enabled() && !state.adaptivePhaseComplete() && engine.staticBeginningComplete(state)) {
            lastDecision = engine.evaluateStopping(state);
            if (lastDecision.isStop()) {
                state.completeAdaptivePhase(lastDecision.reason());
                log.info("Session {}: adaptive phase stopped after {} vignettes ({} adaptive): {}",
                        sessionId, state.completedCount(), state.adaptiveVignettesShownCount(), lastDecision.reason());
                append(ElicitationEvent.adaptiveStopped(sessionId, lastDecision.reason(), clock.millis()));
            }
        }
        return updated;
    }

    // ---------------------------------------------------------------------
    // Persistence
    // ---------------------------------------------------------------------

    public SessionSnapshot snapshot() {
        return SessionSnapshot.of(state);
    }

    /**
     * Replaces this session's state with a persisted one. Recorded responses are re-bound to the
     * library so later posterior updates still see every answer.
     *
     * @throws IllegalArgumentException when the snapshot is invalid, belongs to another session or
     *                                  references vignettes the library does not have
     */
    public void restore(SessionSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        if (!sessionId.equals(snapshot.sessionId)) {
            throw new IllegalArgumentException("snapshot is for session " + snapshot.sessionId + ", not " + sessionId);
        }
        SessionState restored = snapshot.toState();
        VignetteLibrary lib = engine.library();

        for (String id : restored.completedVignettes()) {
            if (!lib.contains(id)) throw new IllegalArgumentException("snapshot references unknown vignette: " + id);
        }
        List<LikelihoodFunction> history = new ArrayList<>(restored.responses().size());
        for (Observation o : restored.responses()) {
            Vignette v = lib.find(o.vignetteId()).orElseThrow();
            history.add(engine.likelihood().createLikelihoodFunction(v, o.chosenOptionId()));
        }
        if (history.isEmpty() && restored.completedCount() > 0) {
            log.warn("Snapshot for {} has no responses; the restored posterior becomes the prior for later answers", sessionId);
        }

        PosteriorManager pm = new PosteriorManager(engine.config());
        pm.restore(restored.posterior(), history);

        this.posterior = pm;
        this.state = restored;
        this.started = true;
        this.completionLogged = false;
        this.lastDecision = null;
        this.presented = null;
        log.info("Session {} restored: {} completed, adaptive complete={}", sessionId,
                restored.completedCount(), restored.adaptivePhaseComplete());
    }

    /**
     * Rebuilds state from an event log, starting from the prior. Only this session's events count.
     *
     * @throws IllegalStateException when the session already has answers
     */
    public void replay(List<ElicitationEvent> log) throws IOException {
        Objects.requireNonNull(log, "log");
        if (state.completedCount() > 0) throw new IllegalStateException("replay needs a fresh session");
        reset();
        replaying = true;
        try {
            for (ElicitationEvent e : log) {
                if (e == null || !sessionId.equals(e.sessionId) || e.type == null) continue;
                switch (e.type) {
                    case ElicitationEvent.CHOICE_RECORDED:
                        recordChoice(e.vignetteId, e.optionId);
                        break;
                    case ElicitationEvent.ADAPTIVE_STOPPED:
                        state.completeAdaptivePhase(e.detail);
                        break;
                    case ElicitationEvent.SESSION_COMPLETED:
                        completionLogged = true;
                        break;
                    default:
                        break;
                }
            }
        } finally {
            replaying = false;
            started = true;
        }
    }

    // ---------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------

    public String sessionId() {
        return sessionId;
    }

    public SessionState state() {
        return state;
    }

    public PreferenceEstimate posterior() {
        return state.posterior();
    }

    public DMatrixRMaj fisherInformation() {
        return state.fisherInformation();
    }

    public Phase phase() {
        return engine.currentPhase(state);
    }

    public boolean isComplete() {
        return phase() == Phase.COMPLETE;
    }

    public Optional<StoppingDecision> lastStoppingDecision() {
        return Optional.ofNullable(lastDecision);
    }

    public StoppingDiagnostics diagnostics() {
        return engine.stopping().diagnostics(state.completedCount(), state.posterior(), state.fisherInformation());
    }

    // ---------------------------------------------------------------------

    private Phase phaseOf(Vignette v) {
        VignetteLibrary lib = engine.library();
        if (lib.isStaticBeginning(v.vignetteId())) return Phase.STATIC_BEGINNING;
        if (lib.isAdaptive(v.vignetteId())) return Phase.ADAPTIVE;
        return Phase.STATIC_END;
    }

    private void prewarmUpcoming() {
        if (prewarm == null) return;
        prewarm.prewarmAll(engine.upcomingStaticVignettes(state), context);
    }

    private void append(ElicitationEvent e) throws IOException {
        if (events == null || replaying) return;
        events.append(e);
    }
}
