package org.calista.elicitation.info;

import org.calista.elicitation.Fixtures;
import org.calista.elicitation.bayes.LikelihoodCalculator;
import org.calista.elicitation.math.Matrices;
import org.calista.elicitation.vignette.Vignette;
import org.ejml.data.DMatrixRMaj;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class FisherInformationCalculatorTest {

    private final FisherInformationCalculator fisher = new FisherInformationCalculator(new LikelihoodCalculator(1.0), 1e-8);
    private final List<Vignette> set = Fixtures.spanningSet("v");

    @Test
    void computeFim_isWeightedOuterProductPlusRidge() {
        DMatrixRMaj fim = fisher.computeFim(set.get(0), new double[7]);
        // delta = [0.5, 0, -1, 0, 0, 0, 0], p(1-p) = 0.25
        assertThat(fim.get(0, 0)).isCloseTo(0.25 * 0.25 + 1e-8, within(1e-15));
        assertThat(fim.get(0, 2)).isCloseTo(-0.125, within(1e-15));
        assertThat(fim.get(4, 4)).isCloseTo(1e-8, within(1e-15));
    }

    @Test
    void computeFim_shrinksWhenTheChoiceIsPredictable() {
        double[] confident = {10, 0, 0, 0, 0, 0, 0};
        assertThat(fisher.computeFim(set.get(0), confident).get(0, 0))
                .isLessThan(fisher.computeFim(set.get(0), new double[7]).get(0, 0));
    }

    @Test
    void computeFim_isSymmetricAndPositiveSemidefinite() {
        DMatrixRMaj fim = fisher.computeFim(set.get(8), new double[]{0.2, -0.4, 0, 0.3, 0, 0, 0.1});
        for (int i = 0; i < 7; i++) {
            for (int j = 0; j < 7; j++) assertThat(fim.get(i, j)).isEqualTo(fim.get(j, i));
        }
        assertThat(Matrices.symmetricEigenvalues(fim)[0]).isGreaterThanOrEqualTo(0.0);
    }

    @Test
    void cumulative_overSpanningSetHasFullRank() {
        FisherInformationCalculator noRidge = new FisherInformationCalculator(new LikelihoodCalculator(1.0), 0.0);
        DMatrixRMaj sum = noRidge.computeCumulativeFim(set, new double[7]);
        assertThat(Matrices.rank(sum)).isEqualTo(7);
        assertThat(FisherInformationCalculator.dEfficiency(sum)).isPositive();
    }

    @Test
    void accumulate_neverDecreasesInformation() {
        DMatrixRMaj cum = FisherInformationCalculator.zero();
        double[] theta = {0.3, 0, -0.2, 0, 0.5, 0, 0};
        for (Vignette v : set) {
            DMatrixRMaj next = fisher.accumulate(cum, v, theta);
            DMatrixRMaj diff = Matrices.add(next, scaled(cum, -1.0));
            assertThat(Matrices.symmetricEigenvalues(diff)[0]).isGreaterThanOrEqualTo(-1e-12);
            cum = next;
        }
    }

    @Test
    void expectedGain_isDeterminantIncrease() {
        DMatrixRMaj current = Matrices.diagonal(7, 1.0);
        double gain = fisher.expectedGain(set.get(4), new double[7], current);
        // det(I + 0.25 d d^T) = 1 + 0.25 |d|^2 with |d|^2 = 2, plus the ridge
        assertThat(gain).isCloseTo(0.5, within(1e-6));
    }

    @Test
    void dEfficiency_isDeterminantClampedAtZero() {
        assertThat(FisherInformationCalculator.dEfficiency(Matrices.diagonal(2, 3.0))).isCloseTo(9.0, within(1e-12));
        DMatrixRMaj neg = Matrices.of(new double[][]{{1, 0}, {0, -1}});
        assertThat(FisherInformationCalculator.dEfficiency(neg)).isZero();
    }

    @Test
    void informationPerDimension_isDiagonal() {
        assertThat(FisherInformationCalculator.informationPerDimension(Matrices.diagonal(3, 2.0)))
                .containsExactly(2.0, 2.0, 2.0);
    }

    private static DMatrixRMaj scaled(DMatrixRMaj m, double s) {
        DMatrixRMaj out = m.copy();
        for (int i = 0; i < out.getNumElements(); i++) out.data[i] *= s;
        return out;
    }
}
