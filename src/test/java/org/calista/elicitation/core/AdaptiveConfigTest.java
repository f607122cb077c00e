package org.calista.elicitation.core;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class AdaptiveConfigTest {

    @Test
    void defaults_matchTheDocumentedValues() {
        AdaptiveConfig c = AdaptiveConfig.defaults();
        assertThat(c.enabled()).isTrue();
        assertThat(c.priorMean()).containsOnly(0.0).hasSize(7);
        assertThat(c.priorVariance()).isEqualTo(1.0);
        assertThat(c.minVignettes()).isEqualTo(6);
        assertThat(c.maxVignettes()).isEqualTo(14);
        assertThat(c.fimDetThreshold()).isEqualTo(1e4);
        assertThat(c.maxVarianceThreshold()).isEqualTo(0.65);
        assertThat(c.temperature()).isEqualTo(1.0);
        assertThat(c.maxNewtonIterations()).isEqualTo(50);
        assertThat(c.convergenceTolerance()).isEqualTo(1e-6);
        assertThat(c.uncertaintyThreshold()).isEqualTo(0.3);
        assertThat(c.fimRegularization()).isEqualTo(1e-8);
        assertThat(c.covarianceRegularization()).isEqualTo(1e-6);
    }

    @Test
    void invalidSettings_reportEveryViolationAtOnce() {
        AdaptiveSettings s = new AdaptiveSettings();
        s.prior.mean = new ArrayList<>(List.of(0.0, 0.0));
        s.prior.variance = 0.0;
        s.stopping.minVignettes = 20;
        s.model.temperature = -1.0;

        assertThatThrownBy(() -> AdaptiveConfig.of(s))
                .isInstanceOfSatisfying(ConfigurationException.class, e -> assertThat(e.violations())
                        .hasSize(4)
                        .anySatisfy(v -> assertThat(v).startsWith("prior.mean"))
                        .anySatisfy(v -> assertThat(v).startsWith("prior.variance"))
                        .anySatisfy(v -> assertThat(v).startsWith("stopping.min_vignettes"))
                        .anySatisfy(v -> assertThat(v).startsWith("model.temperature")));
    }

    @Test
    void nonFiniteValues_areRejected() {
        AdaptiveSettings s = new AdaptiveSettings();
        s.stopping.fimDetThreshold = Double.POSITIVE_INFINITY;
        s.prior.mean.set(3, Double.NaN);
        assertThatThrownBy(() -> AdaptiveConfig.of(s))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("prior.mean[3]")
                .hasMessageContaining("fim_det_threshold");
    }

    @Test
    void missingSections_areViolations() {
        AdaptiveSettings s = new AdaptiveSettings();
        s.model = null;
        s.storage = null;
        assertThatThrownBy(() -> AdaptiveConfig.of(s))
                .hasMessageContaining("model section is missing")
                .hasMessageContaining("storage section is missing");
    }

    @Test
    void priorMean_isDefensivelyCopied() {
        AdaptiveConfig c = AdaptiveConfig.defaults();
        c.priorMean()[0] = 9.0;
        assertThat(c.priorMean()[0]).isZero();
    }

    @Test
    void env_overridesAndParsesVectors() {
        AdaptiveSettings s = new AdaptiveSettings();
        List<String> errors = new ArrayList<>();
        s.applyEnv(Map.of(
                "ADAPTIVE_MIN_VIGNETTES", "4",
                "ADAPTIVE_ENABLED", "no",
                "ADAPTIVE_PRIOR_MEAN", "[1, 0, 0, 0, 0, 0, -1]",
                "ADAPTIVE_SOMETHING_ELSE", "ignored",
                "PATH", "/usr/bin"), errors);

        assertThat(errors).isEmpty();
        AdaptiveConfig c = AdaptiveConfig.of(s);
        assertThat(c.minVignettes()).isEqualTo(4);
        assertThat(c.enabled()).isFalse();
        assertThat(c.priorMean()).containsExactly(1, 0, 0, 0, 0, 0, -1);
    }

    @Test
    void env_parseErrorsAreCollected() {
        AdaptiveSettings s = new AdaptiveSettings();
        List<String> errors = new ArrayList<>();
        s.applyEnv(Map.of("ADAPTIVE_TEMPERATURE", "warm", "ADAPTIVE_ENABLED", "maybe"), errors);

        assertThat(errors).hasSize(2);
        assertThat(s.model.temperature).isEqualTo(1.0);
    }
}
