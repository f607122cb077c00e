package org.calista.elicitation.offline;

import org.calista.elicitation.bayes.LikelihoodCalculator;
import org.calista.elicitation.info.FisherInformationCalculator;
import org.calista.elicitation.profile.FeatureEncoder;
import org.calista.elicitation.profile.Profile;
import org.calista.elicitation.profile.ProfileGenerator;
import org.calista.elicitation.profile.ProfilePair;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.*;

class AdaptiveLibraryBuilderTest {

    private static final double[] PRIOR_MEAN = new double[FeatureEncoder.DIMENSIONS];

    private final FisherInformationCalculator fisher = new FisherInformationCalculator(new LikelihoodCalculator(1.0), 0.0);
    private final List<ProfilePair> candidates =
            new ProfileGenerator(DesignSpaces.tradeOffs()).generateCandidates(2_000, new Random(11));

    @Test
    void build_skipsStaticPairsAndRepeats() {
        StaticDesign design = new StaticDesignBuilder(fisher).select(candidates, 6, 4, PRIOR_MEAN, 1.0);
        AdaptiveLibraryBuilder builder = new AdaptiveLibraryBuilder(fisher);

        List<ProfilePair> pool = builder.build(candidates, 12, design.all(), PRIOR_MEAN);

        assertThat(pool).hasSize(12);
        for (int i = 0; i < pool.size(); i++) {
            ProfilePair p = pool.get(i);
            assertThat(builder.isEligible(p)).isTrue();
            assertThat(StaticDesignBuilder.containsSame(design.all(), p)).isFalse();
            assertThat(StaticDesignBuilder.containsSame(pool.subList(0, i), p)).isFalse();
        }
    }

    @Test
    void build_isDeterministicForTheSameCandidates() {
        AdaptiveLibraryBuilder builder = new AdaptiveLibraryBuilder(fisher, 0.5);
        assertThat(builder.build(candidates, 8, List.of(), PRIOR_MEAN))
                .isEqualTo(builder.build(candidates, 8, List.of(), PRIOR_MEAN));
    }

    @Test
    void pureInformativeness_takesTheMostInformativePairFirst() {
        AdaptiveLibraryBuilder builder = new AdaptiveLibraryBuilder(fisher, 0.0);
        List<ProfilePair> pool = builder.build(candidates, 1, List.of(), PRIOR_MEAN);

        double best = Double.NEGATIVE_INFINITY;
        for (ProfilePair p : candidates) {
            if (builder.isEligible(p)) best = Math.max(best, builder.informativeness(p, PRIOR_MEAN));
        }
        assertThat(builder.informativeness(pool.get(0), PRIOR_MEAN)).isEqualTo(best);
    }

    @Test
    void diversity_isOneForTheFirstPickAndZeroForAParallelDirection() {
        double[] d = {1, 0, 0, 0, 0, 0, 0};
        assertThat(AdaptiveLibraryBuilder.diversity(d, List.of())).isEqualTo(1.0);
        assertThat(AdaptiveLibraryBuilder.diversity(d, List.of(new double[]{-2, 0, 0, 0, 0, 0, 0})))
                .isCloseTo(0.0, within(1e-6));
        assertThat(AdaptiveLibraryBuilder.diversity(d, List.of(new double[]{0, 0, 1, 0, 0, 0, 0})))
                .isCloseTo(1.0, within(1e-6));
    }

    @Test
    void isEligible_rejectsAttributeCancellation() {
        // flexibility gained, commute lost: work-life balance stays flat
        Profile a = new Profile(Map.of("wage", 25_000.0, "flexibility", 1.0, "commute_time", 60.0));
        Profile b = new Profile(Map.of("wage", 20_000.0, "flexibility", 0.0, "commute_time", 15.0));
        ProfilePair pair = new ProfilePair(a, b);

        assertThat(new AdaptiveLibraryBuilder(fisher).isEligible(pair)).isFalse();
        assertThat(new StaticDesignBuilder(fisher).isEligible(pair)).isTrue();
    }

    @Test
    void constructor_rejectsWeightOutsideUnitInterval() {
        assertThatThrownBy(() -> new AdaptiveLibraryBuilder(fisher, 1.5)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new AdaptiveLibraryBuilder(fisher, -0.1)).isInstanceOf(IllegalArgumentException.class);
    }
}
