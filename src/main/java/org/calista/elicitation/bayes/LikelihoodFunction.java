package org.calista.elicitation.bayes;

import org.calista.elicitation.math.Matrices;
import org.ejml.data.DMatrixRMaj;

import java.util.Arrays;
import java.util.Objects;

/**
 * Likelihood of one fixed observation as a function of the preference vector theta.
 *
 * <p>With d = f(chosen) - f(other) and z = theta·d / T: L = σ(z),
 * grad log L = (1 - σ(z)) d / T, hess log L = -σ(z)(1 - σ(z)) d dᵀ / T².</p>
 */
public final class LikelihoodFunction {

    private final Observation observation;
    private final double[] delta;
    private final double temperature;

    LikelihoodFunction(Observation observation, double[] chosenFeatures, double[] otherFeatures, double temperature) {
        this.observation = Objects.requireNonNull(observation, "observation");
        this.delta = Matrices.subtract(chosenFeatures, otherFeatures);
        if (!(temperature > 0.0)) throw new IllegalArgumentException("temperature must be > 0");
        this.temperature = temperature;
    }

    public Observation observation() {
        return observation;
    }

    /** f(chosen) - f(other) (copy). */
    public double[] delta() {
        return Arrays.copyOf(delta, delta.length);
    }

    public double temperature() {
        return temperature;
    }

    public double utilityGap(double[] theta) {
        return Matrices.dot(theta, delta) / temperature;
    }

    public double likelihood(double[] theta) {
        return LikelihoodCalculator.clampProbability(LikelihoodCalculator.sigmoid(utilityGap(theta)));
    }

    /** log σ(z), evaluated without overflow for large |z|. */
    public double logLikelihood(double[] theta) {
        double z = utilityGap(theta);
        if (z >= 0.0) return -Math.log1p(Math.exp(-z));
        return z - Math.log1p(Math.exp(z));
    }

    public double[] gradient(double[] theta) {
        double p = LikelihoodCalculator.sigmoid(utilityGap(theta));
        double w = (1.0 - p) / temperature;
        double[] g = new double[delta.length];
        for (int i = 0; i < g.length; i++) g[i] = w * delta[i];
        return g;
    }

    public DMatrixRMaj hessian(double[] theta) {
        double p = LikelihoodCalculator.sigmoid(utilityGap(theta));
        return Matrices.outer(delta, -p * (1.0 - p) / (temperature * temperature));
    }
}
