package org.calista.elicitation.bayes;

import org.calista.elicitation.profile.FeatureEncoder;
import org.calista.elicitation.vignette.Vignette;
import org.calista.elicitation.vignette.VignetteOption;

import java.util.Objects;

/**
 * Binary logit (two-alternative MNL) choice model over encoded features.
 *
 * <p>P(A over B) = σ(theta·(f(A) - f(B)) / temperature); temperature 1.0 is the standard MNL.
 * Probabilities are kept strictly inside (0, 1).</p>
 */
public final class LikelihoodCalculator {

    /** Probabilities are clamped to [EPS, 1 - EPS]. */
    public static final double PROBABILITY_EPS = 1e-12;

    private final double temperature;

    public LikelihoodCalculator(double temperature) {
        if (!(temperature > 0.0) || !Double.isFinite(temperature)) {
            throw new IllegalArgumentException("temperature must be > 0, got " + temperature);
        }
        this.temperature = temperature;
    }

    public double temperature() {
        return temperature;
    }

    public double[] extractFeatures(VignetteOption option) {
        Objects.requireNonNull(option, "option");
        return FeatureEncoder.encode(option.attributes());
    }

    public double choiceProbability(double[] theta, double[] featuresA, double[] featuresB) {
        return choiceProbability(theta, featuresA, featuresB, temperature);
    }

    public double choiceProbability(double[] theta, double[] featuresA, double[] featuresB, double temperature) {
        Objects.requireNonNull(theta, "theta");
        Objects.requireNonNull(featuresA, "featuresA");
        Objects.requireNonNull(featuresB, "featuresB");
        if (!(temperature > 0.0)) throw new IllegalArgumentException("temperature must be > 0, got " + temperature);
        if (theta.length != featuresA.length || featuresA.length != featuresB.length) {
            throw new IllegalArgumentException("dimension mismatch");
        }
        double z = 0.0;
        for (int i = 0; i < theta.length; i++) z += theta[i] * (featuresA[i] - featuresB[i]);
        return clampProbability(sigmoid(z / temperature));
    }

    /**
     * Probability of the option actually chosen.
     *
     * @throws IllegalArgumentException for an option id the vignette does not have
     */
    public double likelihood(double[] theta, Vignette vignette, String chosenOptionId) {
        Objects.requireNonNull(vignette, "vignette");
        VignetteOption chosen = vignette.option(chosenOptionId)
                .orElseThrow(() -> new IllegalArgumentException(
                        "unknown option '" + chosenOptionId + "' for vignette " + vignette.vignetteId()));
        VignetteOption other = vignette.otherThan(chosenOptionId);
        return choiceProbability(theta, extractFeatures(chosen), extractFeatures(other));
    }

    public LikelihoodFunction createLikelihoodFunction(Vignette vignette, String chosenOptionId) {
        Objects.requireNonNull(vignette, "vignette");
        VignetteOption chosen = vignette.option(chosenOptionId)
                .orElseThrow(() -> new IllegalArgumentException(
                        "unknown option '" + chosenOptionId + "' for vignette " + vignette.vignetteId()));
        VignetteOption other = vignette.otherThan(chosenOptionId);
        return new LikelihoodFunction(new Observation(vignette.vignetteId(), chosenOptionId),
                extractFeatures(chosen), extractFeatures(other), temperature);
    }

    // ---------------------------------------------------------------------

    /** Logistic function without overflow for large |z|. */
    public static double sigmoid(double z) {
        if (z >= 0.0) return 1.0 / (1.0 + Math.exp(-z));
        double e = Math.exp(z);
        return e / (1.0 + e);
    }

    static double clampProbability(double p) {
        if (Double.isNaN(p)) return 0.5;
        return Math.min(1.0 - PROBABILITY_EPS, Math.max(PROBABILITY_EPS, p));
    }
}
