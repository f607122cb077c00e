package org.calista.elicitation.bayes;

import org.calista.elicitation.math.Matrices;
import org.calista.elicitation.profile.PreferenceDimension;
import org.ejml.data.DMatrixRMaj;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Random;

/**
 * Gaussian belief over the 7-d preference vector: mean and covariance. Immutable.
 */
public final class PreferenceEstimate {

    private final double[] mean;
    private final DMatrixRMaj covariance;

    public PreferenceEstimate(double[] mean, DMatrixRMaj covariance) {
        Objects.requireNonNull(mean, "mean");
        Objects.requireNonNull(covariance, "covariance");
        if (covariance.numRows != mean.length || covariance.numCols != mean.length) {
            throw new IllegalArgumentException("covariance must be " + mean.length + "x" + mean.length
                    + ", got " + covariance.numRows + "x" + covariance.numCols);
        }
        for (double v : mean) {
            if (!Double.isFinite(v)) throw new IllegalArgumentException("mean must be finite: " + Arrays.toString(mean));
        }
        this.mean = Arrays.copyOf(mean, mean.length);
        this.covariance = covariance.copy();
    }

    public PreferenceEstimate(double[] mean, double[][] covariance) {
        this(mean, Matrices.of(covariance));
    }

    /** N(priorMean, priorVariance · I) */
    public static PreferenceEstimate fromPrior(double[] priorMean, double priorVariance) {
        return new PreferenceEstimate(priorMean, Matrices.diagonal(priorMean.length, priorVariance));
    }

    public int dimensions() {
        return mean.length;
    }

    public double[] mean() {
        return Arrays.copyOf(mean, mean.length);
    }

    public DMatrixRMaj covariance() {
        return covariance.copy();
    }

    public double[][] covarianceArray() {
        return Matrices.toArray(covariance);
    }

    public double variance(int dim) {
        return covariance.get(dim, dim);
    }

    public double[] variances() {
        return Matrices.diag(covariance);
    }

    public double maxVariance() {
        return Arrays.stream(variances()).max().orElse(0.0);
    }

    public double minVariance() {
        return Arrays.stream(variances()).min().orElse(0.0);
    }

    public double meanVariance() {
        return Arrays.stream(variances()).average().orElse(0.0);
    }

    public double correlation(int i, int j) {
        double denom = Math.sqrt(variance(i) * variance(j));
        if (!(denom > 0.0)) return 0.0;
        return covariance.get(i, j) / denom;
    }

    /** dimension key -> posterior mean, in index order (seven dimensions only). */
    public Map<String, Double> meanByDimension() {
        Map<String, Double> out = new LinkedHashMap<>();
        int n = Math.min(mean.length, PreferenceDimension.COUNT);
        for (int i = 0; i < n; i++) out.put(PreferenceDimension.at(i).key(), mean[i]);
        return out;
    }

    /**
     * Draws {@code n} samples from N(mean, covariance) with the given RNG.
     *
     * @throws IllegalStateException when the covariance is not positive definite
     */
    public double[][] sample(int n, Random random) {
        Objects.requireNonNull(random, "random");
        if (n < 0) throw new IllegalArgumentException("n must be >= 0");
        DMatrixRMaj l = Matrices.choleskyLower(covariance);
        if (l == null) throw new IllegalStateException("covariance is not positive definite");
        int d = mean.length;
        double[][] out = new double[n][];
        double[] z = new double[d];
        for (int s = 0; s < n; s++) {
            for (int i = 0; i < d; i++) z[i] = random.nextGaussian();
            double[] x = Matrices.multiply(l, z);
            for (int i = 0; i < d; i++) x[i] += mean[i];
            out[s] = x;
        }
        return out;
    }

    @Override
    public String toString() {
        return "PreferenceEstimate{mean=" + Arrays.toString(mean) + ", variances=" + Arrays.toString(variances()) + "}";
    }
}
