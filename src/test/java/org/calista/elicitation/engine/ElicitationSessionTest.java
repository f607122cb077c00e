package org.calista.elicitation.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.elicitation.Fixtures;
import org.calista.elicitation.core.AdaptiveConfig;
import org.calista.elicitation.info.StoppingDecision;
import org.calista.elicitation.io.FileIO;
import org.calista.elicitation.math.Matrices;
import org.calista.elicitation.session.DuplicateSelectionException;
import org.calista.elicitation.session.ElicitationEvent;
import org.calista.elicitation.session.EventStore;
import org.calista.elicitation.session.SessionSnapshot;
import org.calista.elicitation.vignette.UserContext;
import org.calista.elicitation.vignette.Vignette;
import org.calista.elicitation.vignette.VignetteLibrary;
import org.calista.elicitation.vignette.VignetteLibraryLoader;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.*;

class ElicitationSessionTest {

    /** Cares most about pay and culture, dislikes social-heavy work. */
    private static final double[] RESPONDENT = {1.2, 0.4, 0.3, 0.8, -0.2, -0.6, 1.0};

    private static final UserContext CTX = new UserContext("nurse", "health", "mid");
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);

    private static VignetteLibrary bundled;

    @TempDir
    Path tempDir;

    @BeforeAll
    static void loadLibrary() throws IOException {
        bundled = new VignetteLibraryLoader(Fixtures.mapper()).loadFromClasspath("vignettes");
    }

    private static ElicitationSession session(String id, AdaptiveConfig cfg, VignetteLibrary lib, EventStore events) {
        return ElicitationSession.builder(new VignetteEngine(cfg, lib))
                .sessionId(id)
                .events(events)
                .clock(CLOCK)
                .build();
    }

    private EventStore eventStore() {
        FileIO io = new FileIO(tempDir);
        return new EventStore(io, Fixtures.mapper(), io.resolve("events.jsonl"));
    }

    /** Answers until the session is complete or {@code limit} answers were given. */
    private static List<String> run(ElicitationSession s, int limit) throws IOException {
        List<String> shown = new ArrayList<>();
        while (shown.size() < limit) {
            Optional<Vignette> next = s.nextVignette(CTX);
            if (next.isEmpty()) break;
            Vignette v = next.get();
            shown.add(v.vignetteId());
            s.recordChoice(v.vignetteId(), Fixtures.answer(v, RESPONDENT));
        }
        return shown;
    }

    @Test
    void fullSession_followsThePhases() throws IOException {
        ElicitationSession s = session("e2e", AdaptiveConfig.defaults(), bundled, null);
        List<String> shown = run(s, 100);

        assertThat(shown.subList(0, 4))
                .containsExactly("static_begin_001", "static_begin_002", "static_begin_003", "static_begin_004");
        assertThat(shown.subList(shown.size() - 2, shown.size())).containsExactly("static_end_001", "static_end_002");
        assertThat(shown).doesNotHaveDuplicates().hasSizeBetween(8, 16);
        assertThat(shown.subList(4, shown.size() - 2)).allMatch(bundled::isAdaptive);

        assertThat(s.isComplete()).isTrue();
        assertThat(s.phase()).isEqualTo(Phase.COMPLETE);
        assertThat(s.state().stopReason()).isPresent();
        assertThat(s.state().adaptiveVignettesShownCount()).isEqualTo(shown.size() - 6);
        assertThat(s.nextVignette(CTX)).isEmpty();
    }

    @Test
    void fullSession_learnsTheRespondentsLeanings() throws IOException {
        ElicitationSession s = session("learn", AdaptiveConfig.defaults(), bundled, null);
        run(s, 100);

        double[] mean = s.posterior().mean();
        double agreement = 0.0;
        for (int i = 0; i < mean.length; i++) agreement += mean[i] * RESPONDENT[i];
        assertThat(agreement).isPositive();
        assertThat(s.posterior().maxVariance()).isLessThan(1.0);
    }

    @Test
    void sameAnswers_giveTheSameSession() throws IOException {
        ElicitationSession a = session("same", AdaptiveConfig.defaults(), bundled, null);
        ElicitationSession b = session("same", AdaptiveConfig.defaults(), bundled, null);

        assertThat(run(a, 100)).isEqualTo(run(b, 100));
        assertThat(a.posterior().mean()).containsExactly(b.posterior().mean(), within(0.0));
    }

    @Test
    void stop_isStickyAndRecorded() throws IOException {
        ElicitationSession s = session("sticky", AdaptiveConfig.defaults(), bundled, null);
        run(s, 100);

        assertThat(s.lastStoppingDecision()).isPresent();
        assertThat(s.lastStoppingDecision().orElseThrow().isStop()).isTrue();
        assertThat(s.state().adaptivePhaseComplete()).isTrue();
        assertThat(s.diagnostics().vignettesShown).isEqualTo(s.state().completedCount());
    }

    @Test
    void maxVignettes_capsTheAdaptivePhase() throws IOException {
        AdaptiveConfig cfg = Fixtures.config(c -> {
            c.stopping.minVignettes = 5;
            c.stopping.maxVignettes = 7;
            c.stopping.fimDetThreshold = 1e300;
            c.stopping.maxVarianceThreshold = 1e-9;
        });
        ElicitationSession s = session("cap", cfg, bundled, null);
        List<String> shown = run(s, 100);

        assertThat(shown).hasSize(7 + 2);
        assertThat(s.state().adaptiveVignettesShownCount()).isEqualTo(3);
        assertThat(s.state().stopReason().orElseThrow()).contains("maximum 7");
    }

    @Test
    void disabledAdaptive_showsOnlyStaticVignettes() throws IOException {
        ElicitationSession s = session("off", Fixtures.config(c -> c.enabled = false), bundled, null);
        List<String> shown = run(s, 100);

        assertThat(shown).containsExactly("static_begin_001", "static_begin_002", "static_begin_003",
                "static_begin_004", "static_end_001", "static_end_002");
        assertThat(s.isComplete()).isTrue();
        assertThat(s.lastStoppingDecision()).isEmpty();
    }

    @Test
    void exhaustedPool_movesOnToTheEnd() throws IOException {
        List<Vignette> set = Fixtures.spanningSet("v");
        VignetteLibrary lib = new VignetteLibrary(set.subList(0, 1), set.subList(1, 2), set.subList(2, 3));
        AdaptiveConfig cfg = Fixtures.config(c -> {
            c.stopping.minVignettes = 20;
            c.stopping.maxVignettes = 50;
        });
        EventStore events = eventStore();
        ElicitationSession s = session("dry", cfg, lib, events);

        assertThat(run(s, 100)).containsExactly("v01", "v02", "v03");
        assertThat(s.state().stopReason()).contains(VignetteEngine.EXHAUSTED_REASON);
        assertThat(events.readSession("dry")).filteredOn(e -> ElicitationEvent.ADAPTIVE_STOPPED.equals(e.type))
                .extracting(e -> e.detail)
                .containsExactly(VignetteEngine.EXHAUSTED_REASON);
    }

    @Test
    void eventLog_tracesTheWholeSession() throws IOException {
        EventStore events = eventStore();
        ElicitationSession s = session("log", AdaptiveConfig.defaults(), bundled, events);
        List<String> shown = run(s, 100);

        List<ElicitationEvent> log = events.readSession("log");
        assertThat(log.get(0).type).isEqualTo(ElicitationEvent.SESSION_STARTED);
        assertThat(log.get(log.size() - 1).type).isEqualTo(ElicitationEvent.SESSION_COMPLETED);
        assertThat(log).filteredOn(e -> ElicitationEvent.CHOICE_RECORDED.equals(e.type))
                .extracting(e -> e.vignetteId)
                .isEqualTo(shown);
        assertThat(log).filteredOn(e -> ElicitationEvent.ADAPTIVE_STOPPED.equals(e.type)).hasSize(1);
        assertThat(log).filteredOn(e -> ElicitationEvent.VIGNETTE_SHOWN.equals(e.type))
                .extracting(e -> e.phase)
                .startsWith("STATIC_BEGINNING")
                .endsWith("STATIC_END")
                .contains("ADAPTIVE");
        assertThat(log).allMatch(e -> e.tsEpochMs == CLOCK.millis());
    }

    @Test
    void replay_rebuildsTheSameState() throws IOException {
        EventStore events = eventStore();
        ElicitationSession live = session("r1", AdaptiveConfig.defaults(), bundled, events);
        run(live, 100);
        int logged = events.readAll().size();

        ElicitationSession replayed = session("r1", AdaptiveConfig.defaults(), bundled, events);
        replayed.replay(events.readSession("r1"));

        assertThat(replayed.state().completedVignettes()).isEqualTo(live.state().completedVignettes());
        assertThat(replayed.posterior().mean()).containsExactly(live.posterior().mean(), within(1e-12));
        assertThat(replayed.state().stopReason()).isEqualTo(live.state().stopReason());
        assertThat(replayed.isComplete()).isTrue();
        // replay does not write
        assertThat(events.readAll()).hasSize(logged);
        // completion was already logged
        assertThat(replayed.nextVignette(CTX)).isEmpty();
        assertThat(events.readAll()).hasSize(logged);
    }

    @Test
    void replay_ofAPartialLogResumesMidSession() throws IOException {
        EventStore events = eventStore();
        ElicitationSession live = session("r2", AdaptiveConfig.defaults(), bundled, events);
        run(live, 5);

        ElicitationSession replayed = session("r2", AdaptiveConfig.defaults(), bundled, events);
        replayed.replay(events.readSession("r2"));

        assertThat(replayed.nextVignette(CTX)).map(Vignette::vignetteId)
                .isEqualTo(live.nextVignette(CTX).map(Vignette::vignetteId));
    }

    @Test
    void replay_needsAFreshSession() throws IOException {
        ElicitationSession s = session("busy", AdaptiveConfig.defaults(), bundled, null);
        run(s, 1);
        assertThatThrownBy(() -> s.replay(List.of())).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void restore_continuesExactlyLikeTheOriginal() throws IOException {
        ElicitationSession original = session("snap", AdaptiveConfig.defaults(), bundled, null);
        run(original, 6);

        ObjectMapper om = Fixtures.mapper();
        SessionSnapshot snap = om.readValue(om.writeValueAsString(original.snapshot()), SessionSnapshot.class);
        ElicitationSession resumed = session("snap", AdaptiveConfig.defaults(), bundled, null);
        resumed.restore(snap);

        assertThat(resumed.state().completedVignettes()).isEqualTo(original.state().completedVignettes());
        assertThat(run(resumed, 100)).isEqualTo(run(original, 100));
        assertThat(resumed.posterior().mean()).containsExactly(original.posterior().mean(), within(1e-9));
    }

    @Test
    void restore_rejectsForeignOrUnknownSnapshots() throws IOException {
        ElicitationSession other = session("other", AdaptiveConfig.defaults(), bundled, null);
        run(other, 2);
        ElicitationSession s = session("mine", AdaptiveConfig.defaults(), bundled, null);

        assertThatThrownBy(() -> s.restore(other.snapshot()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("other");

        SessionSnapshot unknown = session("mine", AdaptiveConfig.defaults(), bundled, null).snapshot();
        unknown.completedVignettes = List.of("retired_vignette");
        assertThatThrownBy(() -> s.restore(unknown))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("retired_vignette");
    }

    @Test
    void recordChoice_validatesInput() throws IOException {
        EventStore events = eventStore();
        ElicitationSession s = session("input", AdaptiveConfig.defaults(), bundled, events);
        Vignette first = s.nextVignette(CTX).orElseThrow();
        s.recordChoice(first.vignetteId(), "A");
        int logged = events.readAll().size();

        assertThatThrownBy(() -> s.recordChoice("no_such_vignette", "A")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> s.recordChoice("static_begin_002", "C")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> s.recordChoice(first.vignetteId(), "B")).isInstanceOf(DuplicateSelectionException.class);

        assertThat(s.state().completedCount()).isEqualTo(1);
        assertThat(events.readAll()).hasSize(logged);
    }

    @Test
    void recordChoice_rejectsVignettesThatWereNotPresented() throws IOException {
        EventStore events = eventStore();
        ElicitationSession s = session("order", AdaptiveConfig.defaults(), bundled, events);
        assertThatThrownBy(() -> s.recordChoice("static_begin_001", "A")).isInstanceOf(IllegalStateException.class);

        Vignette first = s.nextVignette(CTX).orElseThrow();
        assertThat(first.vignetteId()).isEqualTo("static_begin_001");
        int logged = events.readAll().size();

        assertThatThrownBy(() -> s.recordChoice("static_begin_002", "A"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("static_begin_001");
        String adaptiveId = bundled.adaptive().get(0).vignetteId();
        assertThatThrownBy(() -> s.recordChoice(adaptiveId, "A")).isInstanceOf(IllegalStateException.class);

        assertThat(s.state().completedCount()).isZero();
        assertThat(s.state().adaptiveVignettesShownCount()).isZero();
        assertThat(events.readAll()).hasSize(logged);

        s.recordChoice(first.vignetteId(), "A");
        assertThatThrownBy(() -> s.recordChoice("static_begin_002", "A")).isInstanceOf(IllegalStateException.class);

        run(s, 100);
        assertThat(s.isComplete()).isTrue();
        assertThat(s.state().completedVignettes()).doesNotHaveDuplicates();
    }

    @Test
    void alternatingAnswers_fromTheDefaultPrior_stopAtTheMaximum() throws IOException {
        AdaptiveConfig cfg = Fixtures.config(a -> {
            a.stopping.minVignettes = 6;
            a.stopping.maxVignettes = 10;
        });
        double[] firstMean = null;
        double[][] firstCov = null;
        for (int round = 0; round < 2; round++) {
            VignetteLibrary lib = new VignetteLibrary(Fixtures.spanningSet("e"), Fixtures.spanningSet("x"), List.of());
            ElicitationSession s = session("alternating", cfg, lib, null);
            int answered = 0;
            Optional<Vignette> next;
            while ((next = s.nextVignette(CTX)).isPresent()) {
                s.recordChoice(next.get().vignetteId(), (answered % 2 == 0) ? "A" : "B");
                answered++;
            }

            assertThat(answered).isEqualTo(10);
            assertThat(Matrices.rank(s.fisherInformation())).isEqualTo(7);
            StoppingDecision decision = s.lastStoppingDecision().orElseThrow();
            assertThat(decision.isStop()).isTrue();
            assertThat(decision.rule()).isEqualTo(StoppingDecision.Rule.MAXIMUM_REACHED);
            assertThat(s.state().stopReason()).hasValueSatisfying(r -> assertThat(r).contains("maximum 10"));
            assertThat(s.state().adaptiveVignettesShownCount()).isZero();
            assertThat(s.isComplete()).isTrue();

            double[] mean = s.posterior().mean();
            double[][] cov = s.posterior().covarianceArray();
            if (firstMean == null) {
                firstMean = mean;
                firstCov = cov;
            } else {
                assertThat(mean).containsExactly(firstMean, within(1e-9));
                for (int i = 0; i < cov.length; i++) {
                    assertThat(cov[i]).containsExactly(firstCov[i], within(1e-9));
                }
            }
        }
    }

    @Test
    void personalizedText_isShownWhenReady() throws IOException {
        Executor direct = Runnable::run;
        VignettePersonalizer personalizer = (v, c) -> v.withScenarioText("As a " + c.role() + ": " + v.scenarioText());
        ElicitationSession s = ElicitationSession.builder(new VignetteEngine(AdaptiveConfig.defaults(), bundled))
                .sessionId("personal")
                .prewarm(new PrewarmCache(personalizer, direct))
                .clock(CLOCK)
                .build();

        Vignette shown = s.nextVignette(CTX).orElseThrow();

        assertThat(shown.scenarioText()).startsWith("As a nurse: ");
        assertThat(shown.sameDesignAs(bundled.find("static_begin_001").orElseThrow())).isTrue();
    }

    @Test
    void builder_requiresSessionId() {
        assertThatThrownBy(() -> ElicitationSession.builder(new VignetteEngine(AdaptiveConfig.defaults(), bundled)).build())
                .isInstanceOf(IllegalStateException.class);
    }
}
