package org.calista.elicitation.info;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.elicitation.bayes.LikelihoodCalculator;
import org.calista.elicitation.math.Matrices;
import org.calista.elicitation.profile.FeatureEncoder;
import org.calista.elicitation.vignette.Vignette;
import org.ejml.data.DMatrixRMaj;

import java.util.Objects;

/**
 * Expected information a binary choice carries about theta.
 *
 * <p>I(v, theta) = p(1 - p) d dᵀ + λI, with d = f(A) - f(B), p = P(A | theta) and λ the
 * configured regularization. Each term is PSD, so a running sum never decreases in the Loewner order.</p>
 */
public final class FisherInformationCalculator {
    private static final Logger log = LogManager.getLogger(FisherInformationCalculator.class);

    private final LikelihoodCalculator likelihood;
    private final double regularization;

    public FisherInformationCalculator(LikelihoodCalculator likelihood, double regularization) {
        this.likelihood = Objects.requireNonNull(likelihood, "likelihood");
        if (!(regularization >= 0.0)) throw new IllegalArgumentException("regularization must be >= 0");
        this.regularization = regularization;
    }

    public static DMatrixRMaj zero() {
        return Matrices.zeros(FeatureEncoder.DIMENSIONS);
    }

    public DMatrixRMaj computeFim(Vignette vignette, double[] theta) {
        Objects.requireNonNull(vignette, "vignette");
        Objects.requireNonNull(theta, "theta");
        return computeFim(vignette.optionA().features(), vignette.optionB().features(), theta);
    }

    /** Same as {@link #computeFim(Vignette, double[])} for raw feature vectors (offline design). */
    public DMatrixRMaj computeFim(double[] fa, double[] fb, double[] theta) {
        Objects.requireNonNull(theta, "theta");
        double p = likelihood.choiceProbability(theta, fa, fb);
        DMatrixRMaj fim = Matrices.outer(Matrices.subtract(fa, fb), p * (1.0 - p));
        return Matrices.addDiagonal(fim, regularization);
    }

    /** cumulative + I(v, theta) as a new matrix. */
    public DMatrixRMaj accumulate(DMatrixRMaj cumulative, Vignette vignette, double[] theta) {
        Objects.requireNonNull(cumulative, "cumulative");
        return Matrices.add(cumulative, computeFim(vignette, theta));
    }

    public DMatrixRMaj computeCumulativeFim(Iterable<Vignette> vignettes, double[] theta) {
        Objects.requireNonNull(vignettes, "vignettes");
        DMatrixRMaj sum = zero();
        for (Vignette v : vignettes) sum = accumulate(sum, v, theta);
        return sum;
    }

    /** det(fim), negative round-off clamped to 0. */
    public static double dEfficiency(DMatrixRMaj fim) {
        double det = Matrices.determinant(fim);
        return (det > 0.0 && Double.isFinite(det)) ? det : 0.0;
    }

    public static double[] informationPerDimension(DMatrixRMaj fim) {
        return Matrices.diag(fim);
    }

    /** det(current + I(v, theta)) - det(current). */
    public double expectedGain(Vignette vignette, double[] theta, DMatrixRMaj current) {
        Objects.requireNonNull(current, "current");
        double before = Matrices.determinant(current);
        double after = Matrices.determinant(accumulate(current, vignette, theta));
        double gain = after - before;
        log.trace("expectedGain {}: {}", vignette.vignetteId(), gain);
        return gain;
    }
}
