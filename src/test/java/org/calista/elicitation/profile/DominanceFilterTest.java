package org.calista.elicitation.profile;

import org.calista.elicitation.Fixtures;
import org.calista.elicitation.vignette.Vignette;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class DominanceFilterTest {

    @Test
    void featuresDominate_needsStrictImprovement() {
        assertThat(DominanceFilter.featuresDominate(new double[]{1, 1}, new double[]{1, 0})).isTrue();
        assertThat(DominanceFilter.featuresDominate(new double[]{1, 1}, new double[]{1, 1})).isFalse();
        assertThat(DominanceFilter.featuresDominate(new double[]{1, 0}, new double[]{0, 1})).isFalse();
    }

    @Test
    void featuresDominate_ignoresRoundOffBelowTolerance() {
        assertThat(DominanceFilter.featuresDominate(new double[]{1, 1 - 1e-9}, new double[]{0, 1})).isTrue();
    }

    @Test
    void isDominated_eitherDirection() {
        assertThat(DominanceFilter.isDominated(Fixtures.dominated("d"))).isTrue();
        assertThat(DominanceFilter.isDominated(
                Fixtures.vignette("d2", Map.of(), Map.of("wage", 30_000.0)))).isTrue();
        assertThat(DominanceFilter.isDominated(Fixtures.spanningSet("v").get(0))).isFalse();
    }

    @Test
    void spanningSet_hasNoDominatedVignette() {
        assertThat(DominanceFilter.filter(Fixtures.spanningSet("v"))).hasSize(10);
    }

    @Test
    void filter_keepsOrder() {
        List<Vignette> in = new ArrayList<>(Fixtures.spanningSet("v").subList(0, 3));
        in.add(1, Fixtures.dominated("dom"));
        assertThat(DominanceFilter.filter(in)).extracting(Vignette::vignetteId).containsExactly("v01", "v02", "v03");
    }

    @Test
    void hasPairwiseDominance_onRawAttributes() {
        assertThat(DominanceFilter.hasPairwiseDominance(Fixtures.job(Map.of("job_security", 1.0)), Fixtures.baseline())).isTrue();
        assertThat(DominanceFilter.hasPairwiseDominance(Fixtures.baseline(), Fixtures.baseline())).isFalse();
    }

    @Test
    void quasiDominance_countsBetterDimensions() {
        double[] fa = {1, 1, 1, 1, 1, 0, 0};
        double[] fb = {0, 0, 0, 0, 0, 1, 0};
        assertThat(DominanceFilter.hasQuasiDominance(fa, fb, 5)).isTrue();
        assertThat(DominanceFilter.hasQuasiDominance(fa, fb, 6)).isFalse();
    }

    @Test
    void excessiveWageGap_usesRatio() {
        Profile low = new Profile(Fixtures.job(Map.of("wage", 15_000.0)));
        Profile high = new Profile(Fixtures.job(Map.of("wage", 30_000.0)));
        Profile mid = new Profile(Fixtures.job(Map.of("wage", 20_000.0)));
        assertThat(DominanceFilter.hasExcessiveWageGap(low, high)).isTrue();
        assertThat(DominanceFilter.hasExcessiveWageGap(low, mid)).isFalse();
        assertThat(DominanceFilter.hasExcessiveWageGap(new Profile(Map.of()), high)).isFalse();
    }

    @Test
    void excessiveWageGap_readsSalaryAlias() {
        Profile low = new Profile(Map.of("salary", 15_000.0, "career_growth", 1.0));
        Profile high = new Profile(Map.of("salary", 30_000.0));
        assertThat(DominanceFilter.hasExcessiveWageGap(low, high)).isTrue();
        assertThat(DominanceFilter.hasExcessiveWageGap(low, new Profile(Map.of("wage", 20_000.0)))).isFalse();
    }

    @Test
    void attributeCancellation_detectsOpposingMovesInsideADimension() {
        // flexibility up, commute 15 -> 60 down: work-life balance mean diff (1 - 1) / 2 = 0
        Profile a = new Profile(Fixtures.job(Map.of("flexibility", 1.0, "commute_time", 60.0)));
        Profile b = new Profile(Fixtures.job(Map.of("commute_time", 15.0)));
        assertThat(DominanceFilter.hasAttributeCancellation(a, b)).isTrue();

        Profile c = new Profile(Fixtures.job(Map.of("flexibility", 1.0)));
        assertThat(DominanceFilter.hasAttributeCancellation(c, new Profile(Fixtures.baseline()))).isFalse();
    }
}
