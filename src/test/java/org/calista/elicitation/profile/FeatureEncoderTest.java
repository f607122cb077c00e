package org.calista.elicitation.profile;

import org.calista.elicitation.Fixtures;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class FeatureEncoderTest {

    @Test
    void encode_baselineJob() {
        double[] f = FeatureEncoder.encode(Fixtures.baseline());
        // commute 30 -> 2/3
        assertThat(f).containsExactly(new double[]{2.5, 5.0 / 9.0, 0.0, 1.0 / 3.0, 0.0, 0.0, 0.0}, within(1e-12));
    }

    @Test
    void encode_absentGroupsAreZero_unknownIgnored() {
        double[] f = FeatureEncoder.encode(Map.of("career_growth", 1.0, "free_lunch", 1.0));
        assertThat(f).containsExactly(new double[]{0, 0, 1, 0, 0, 0, 0}, within(1e-12));
    }

    @Test
    void encode_averagesOnlyPresentTerms() {
        double[] f = FeatureEncoder.encode(Map.of("remote_work", 1.0, "task_variety", 1.0));
        assertThat(f[1]).isEqualTo(1.0);
        assertThat(f[5]).isEqualTo(1.0);
    }

    @Test
    void encode_acceptsAliases() {
        double[] f = FeatureEncoder.encode(Map.of("salary", 30_000.0, "remote", 1.0, "culture_alignment", 1.0));
        assertThat(f[0]).isEqualTo(3.0);
        assertThat(f[1]).isEqualTo(1.0);
        assertThat(f[6]).isEqualTo(1.0);
    }

    @Test
    void commuteScore_clampsAtZero() {
        assertThat(FeatureEncoder.commuteScore(15)).isEqualTo(1.0);
        assertThat(FeatureEncoder.commuteScore(60)).isEqualTo(0.0);
        assertThat(FeatureEncoder.commuteScore(90)).isEqualTo(0.0);
    }

    @Test
    void moreIsBetter_onEveryDimension() {
        Map<String, Double> worse = Fixtures.job(Map.of("physical_demand", 1.0, "commute_time", 60.0));
        double[] fBase = FeatureEncoder.encode(Fixtures.baseline());
        double[] fWorse = FeatureEncoder.encode(worse);
        assertThat(fWorse[1]).isLessThan(fBase[1]);
        assertThat(fWorse[3]).isLessThan(fBase[3]);
    }
}
