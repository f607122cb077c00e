package org.calista.elicitation.engine;

import org.calista.elicitation.bayes.LikelihoodCalculator;
import org.calista.elicitation.core.AdaptiveConfig;
import org.calista.elicitation.info.FisherInformationCalculator;
import org.calista.elicitation.info.StoppingCriterion;
import org.calista.elicitation.info.StoppingDecision;
import org.calista.elicitation.select.DEfficiencyOptimizer;
import org.calista.elicitation.session.DuplicateSelectionException;
import org.calista.elicitation.session.SessionState;
import org.calista.elicitation.vignette.UserContext;
import org.calista.elicitation.vignette.Vignette;
import org.calista.elicitation.vignette.VignetteLibrary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * VignetteEngine: picks the next vignette of a session.
 *
 * <p>
 * Phases follow {@code completed_vignettes}: the static beginning in fixed order, then D-optimal adaptive
 * picks until the session's adaptive phase is complete (or the pool runs dry), then the static end in
 * fixed order. Static picks are positional: the next one is {@code list[|completed ∩ list|]}.
 * </p>
 *
 * <p>Stateless and immutable: one engine serves any number of sessions concurrently. The only state
 * touched is the {@link SessionState} passed in, which the caller serializes per session.</p>
 */
public final class VignetteEngine {
    private static final Logger log = LoggerFactory.getLogger(VignetteEngine.class);

    public static final String EXHAUSTED_REASON = "adaptive candidate pool exhausted";

    private final AdaptiveConfig config;
    private final VignetteLibrary library;
    private final LikelihoodCalculator likelihood;
    private final FisherInformationCalculator fisher;
    private final StoppingCriterion stopping;
    private final DEfficiencyOptimizer optimizer;

    public VignetteEngine(AdaptiveConfig config, VignetteLibrary library) {
        this.config = Objects.requireNonNull(config, "config");
        this.library = Objects.requireNonNull(library, "library");
        this.likelihood = new LikelihoodCalculator(config.temperature());
        this.fisher = new FisherInformationCalculator(likelihood, config.fimRegularization());
        this.stopping = new StoppingCriterion(config);
        this.optimizer = new DEfficiencyOptimizer(fisher);
    }

    public AdaptiveConfig config() {
        return config;
    }

    public VignetteLibrary library() {
        return library;
    }

    public LikelihoodCalculator likelihood() {
        return likelihood;
    }

    public FisherInformationCalculator fisher() {
        return fisher;
    }

    public StoppingCriterion stopping() {
        return stopping;
    }

    public DEfficiencyOptimizer optimizer() {
        return optimizer;
    }

    // ---------------------------------------------------------------------
    // Selection
    // ---------------------------------------------------------------------

    /**
     * @return the next vignette, empty only when every phase is exhausted
     * @throws DuplicateSelectionException if the pick would repeat a completed vignette
     */
    public Optional<Vignette> selectNextVignette(SessionState state, UserContext userContext) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(userContext, "userContext");

        markExhaustedPool(state);
        Phase phase = currentPhase(state);

        Optional<Vignette> next;
        switch (phase) {
            case STATIC_BEGINNING:
                next = Optional.of(positional(library.staticBeginning(), state));
                break;
            case ADAPTIVE:
                next = optimizer.selectBestCandidate(remainingAdaptive(state), state.fisherInformation(), state.posterior().mean());
                if (next.isEmpty()) {
                    // every remaining candidate was filtered out
                    state.completeAdaptivePhase(EXHAUSTED_REASON);
                    log.info("Session {}: {}, moving to static end", state.sessionId(), EXHAUSTED_REASON);
                    return selectNextVignette(state, userContext);
                }
                break;
            case STATIC_END:
                next = Optional.of(positional(library.staticEnd(), state));
                break;
            default:
                next = Optional.empty();
        }

        next.ifPresent(v -> {
            if (state.isCompleted(v.vignetteId())) throw new DuplicateSelectionException(state.sessionId(), v.vignetteId());
            log.debug("Session {} [{}] -> {}", state.sessionId(), phase, v.vignetteId());
        });
        return next;
    }

    public Phase currentPhase(SessionState state) {
        Objects.requireNonNull(state, "state");
        if (completedIn(library.staticBeginning(), state) < library.staticBeginning().size()) return Phase.STATIC_BEGINNING;
        if (config.enabled() && !state.adaptivePhaseComplete() && !remainingAdaptive(state).isEmpty()) return Phase.ADAPTIVE;
        if (completedIn(library.staticEnd(), state) < library.staticEnd().size()) return Phase.STATIC_END;
        return Phase.COMPLETE;
    }

    /** Static vignettes not yet completed: the rest of the beginning, then the end. */
    public List<Vignette> upcomingStaticVignettes(SessionState state) {
        Objects.requireNonNull(state, "state");
        List<Vignette> out = new ArrayList<>();
        for (Vignette v : library.staticBeginning()) if (!state.isCompleted(v.vignetteId())) out.add(v);
        for (Vignette v : library.staticEnd()) if (!state.isCompleted(v.vignetteId())) out.add(v);
        return out;
    }

    /** Adaptive candidates not yet completed, in library order. */
    public List<Vignette> remainingAdaptive(SessionState state) {
        List<Vignette> out = new ArrayList<>();
        for (Vignette v : library.adaptive()) if (!state.isCompleted(v.vignetteId())) out.add(v);
        return out;
    }

    /**
     * Stopping rule for the session's current numbers; n counts every completed vignette.
     */
    public StoppingDecision evaluateStopping(SessionState state) {
        return stopping.evaluate(state.completedCount(), state.posterior(), state.fisherInformation());
    }

    public boolean staticBeginningComplete(SessionState state) {
        return completedIn(library.staticBeginning(), state) >= library.staticBeginning().size();
    }

    // ---------------------------------------------------------------------

    private void markExhaustedPool(SessionState state) {
        if (!config.enabled() || state.adaptivePhaseComplete()) return;
        if (!staticBeginningComplete(state)) return;
        if (!remainingAdaptive(state).isEmpty()) return;
        state.completeAdaptivePhase(EXHAUSTED_REASON);
        log.info("Session {}: {}, moving to static end", state.sessionId(), EXHAUSTED_REASON);
    }

    private static Vignette positional(List<Vignette> list, SessionState state) {
        Vignette v = list.get(completedIn(list, state));
        if (state.isCompleted(v.vignetteId())) throw new DuplicateSelectionException(state.sessionId(), v.vignetteId());
        return v;
    }

    private static int completedIn(List<Vignette> list, SessionState state) {
        int n = 0;
        for (Vignette v : list) if (state.isCompleted(v.vignetteId())) n++;
        return n;
    }
}
