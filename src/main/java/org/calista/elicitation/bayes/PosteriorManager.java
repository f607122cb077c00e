package org.calista.elicitation.bayes;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.elicitation.core.AdaptiveConfig;
import org.calista.elicitation.math.Matrices;
import org.ejml.data.DMatrixRMaj;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * PosteriorManager: Laplace-approximated Bayesian update of the preference estimate.
 *
 * <p>
 * Each update re-fits the MAP of the full posterior (every observation so far plus the Gaussian prior)
 * by Newton-Raphson from the current mean, then takes the inverse Hessian at the mode as the covariance.
 * Numerical trouble is recovered locally: step-halving on a non-decreasing step, diagonal regularization
 * of a near-singular Hessian, and the previous covariance kept when even that fails.
 * </p>
 *
 * <p>Not thread-safe; one instance per session.</p>
 */
public final class PosteriorManager {
    private static final Logger log = LogManager.getLogger(PosteriorManager.class);

    private static final int MAX_HALVINGS = 30;

    private double[] priorMean;
    private DMatrixRMaj priorPrecision;
    private final int maxIterations;
    private final double tolerance;
    private final double covarianceRegularization;

    private final List<LikelihoodFunction> observations = new ArrayList<>();
    private PreferenceEstimate current;

    public PosteriorManager(AdaptiveConfig config) {
        Objects.requireNonNull(config, "config");
        this.priorMean = config.priorMean();
        this.priorPrecision = Matrices.diagonal(priorMean.length, 1.0 / config.priorVariance());
        this.maxIterations = config.maxNewtonIterations();
        this.tolerance = config.convergenceTolerance();
        this.covarianceRegularization = config.covarianceRegularization();
        this.current = PreferenceEstimate.fromPrior(priorMean, config.priorVariance());
    }

    public PreferenceEstimate current() {
        return current;
    }

    public int observationCount() {
        return observations.size();
    }

    public List<Observation> observations() {
        List<Observation> out = new ArrayList<>(observations.size());
        for (LikelihoodFunction f : observations) out.add(f.observation());
        return out;
    }

    /**
     * Resumes from a persisted estimate; {@code history} are the likelihoods of all answers so far.
     *
     * <p>Without history the estimate itself becomes the prior for later updates
     * (mean, inverse covariance as precision).</p>
     */
    public void restore(PreferenceEstimate estimate, List<LikelihoodFunction> history) {
        Objects.requireNonNull(estimate, "estimate");
        Objects.requireNonNull(history, "history");
        if (estimate.dimensions() != priorMean.length) {
            throw new IllegalArgumentException("estimate has " + estimate.dimensions() + " dimensions, expected " + priorMean.length);
        }
        if (history.isEmpty()) {
            DMatrixRMaj precision = Matrices.invertSpd(estimate.covariance());
            if (precision == null) precision = Matrices.invertSpd(Matrices.addDiagonal(estimate.covariance(), covarianceRegularization));
            if (precision == null) {
                log.warn("Restored covariance is not invertible; keeping the configured prior");
            } else {
                priorMean = estimate.mean();
                priorPrecision = precision;
            }
        }
        observations.clear();
        observations.addAll(history);
        current = estimate;
    }

    /**
     * Adds one answer and re-estimates.
     *
     * @param fn          likelihood bound to the answer
     * @param observation the answer itself; must be the one {@code fn} was built for
     */
    public PreferenceEstimate update(LikelihoodFunction fn, Observation observation) {
        Objects.requireNonNull(fn, "fn");
        Objects.requireNonNull(observation, "observation");
        if (!fn.observation().equals(observation)) {
            throw new IllegalArgumentException("likelihood is bound to " + fn.observation() + ", not " + observation);
        }
        observations.add(fn);

        double[] theta = current.mean();
        double objective = objective(theta);
        double[] best = theta;
        double bestObjective = objective;
        boolean converged = false;
        int iter = 0;

        for (; iter < maxIterations; iter++) {
            double[] g = gradient(theta);
            DMatrixRMaj h = hessian(theta);

            double[] step = Matrices.solveSpd(h, g);
            if (step == null) step = Matrices.solveSpd(Matrices.addDiagonal(h, covarianceRegularization), g);
            if (step == null) {
                log.warn("Newton step failed: Hessian not positive definite even after regularization (iter={})", iter);
                break;
            }

            double t = 1.0;
            double[] next = axpy(theta, -t, step);
            double nextObjective = objective(next);
            int halvings = 0;
            while (!(nextObjective <= objective) && halvings < MAX_HALVINGS) {
                t *= 0.5;
                next = axpy(theta, -t, step);
                nextObjective = objective(next);
                halvings++;
            }

            double stepNorm = t * Matrices.norm(step);
            theta = next;
            objective = nextObjective;
            if (objective < bestObjective) {
                best = theta;
                bestObjective = objective;
            }
            if (stepNorm < tolerance) {
                converged = true;
                break;
            }
        }

        if (!converged) {
            log.warn("Newton-Raphson did not converge in {} iterations (observations={}); using best iterate (objective={})",
                    maxIterations, observations.size(), bestObjective);
        } else {
            log.debug("Newton-Raphson converged after {} iterations (objective={})", iter + 1, bestObjective);
        }

        current = new PreferenceEstimate(best, covarianceAt(best));
        return current;
    }

    // ---------------------------------------------------------------------
    // Negative log posterior
    // ---------------------------------------------------------------------

    double objective(double[] theta) {
        double nll = 0.0;
        for (LikelihoodFunction f : observations) nll -= f.logLikelihood(theta);
        double[] d = Matrices.subtract(theta, priorMean);
        return nll + 0.5 * Matrices.quadraticForm(priorPrecision, d);
    }

    double[] gradient(double[] theta) {
        double[] g = Matrices.multiply(priorPrecision, Matrices.subtract(theta, priorMean));
        for (LikelihoodFunction f : observations) {
            double[] gl = f.gradient(theta);
            for (int i = 0; i < g.length; i++) g[i] -= gl[i];
        }
        return g;
    }

    DMatrixRMaj hessian(double[] theta) {
        DMatrixRMaj h = priorPrecision.copy();
        for (LikelihoodFunction f : observations) {
            DMatrixRMaj hl = f.hessian(theta);
            for (int i = 0; i < h.getNumElements(); i++) h.data[i] -= hl.data[i];
        }
        return h;
    }

    private DMatrixRMaj covarianceAt(double[] mode) {
        DMatrixRMaj h = Matrices.symmetrize(hessian(mode));
        double[] ev = Matrices.symmetricEigenvalues(h);
        if (ev[0] < covarianceRegularization) {
            log.warn("Hessian near-singular (min eigenvalue={}); adding {} to the diagonal", ev[0], covarianceRegularization);
            h = Matrices.addDiagonal(h, covarianceRegularization);
        }
        DMatrixRMaj cov = Matrices.invertSpd(h);
        if (cov == null) {
            log.warn("Hessian not invertible after regularization; keeping previous covariance");
            return current.covariance();
        }
        return cov;
    }

    private static double[] axpy(double[] x, double a, double[] y) {
        double[] out = Arrays.copyOf(x, x.length);
        for (int i = 0; i < out.length; i++) out[i] += a * y[i];
        return out;
    }
}
