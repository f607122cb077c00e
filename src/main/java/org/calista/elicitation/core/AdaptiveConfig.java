package org.calista.elicitation.core;

import org.calista.elicitation.profile.PreferenceDimension;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * AdaptiveConfig: validated, immutable model configuration shared by every session.
 *
 * <p>Built only through {@link #of(AdaptiveSettings)}: either every value is valid and the whole
 * config is produced, or a {@link ConfigurationException} lists all violations and nothing is applied.</p>
 */
public final class AdaptiveConfig {

    private final boolean enabled;
    private final double[] priorMean;
    private final double priorVariance;
    private final int minVignettes;
    private final int maxVignettes;
    private final double fimDetThreshold;
    private final double maxVarianceThreshold;
    private final double temperature;
    private final int maxNewtonIterations;
    private final double convergenceTolerance;
    private final double uncertaintyThreshold;
    private final double fimRegularization;
    private final double covarianceRegularization;

    private final String libraryDir;
    private final boolean libraryOnClasspath;
    private final String baseDir;
    private final String sessionsDir;
    private final String eventLog;

    private AdaptiveConfig(AdaptiveSettings s, double[] priorMean) {
        this.enabled = s.enabled;
        this.priorMean = priorMean;
        this.priorVariance = s.prior.variance;
        this.minVignettes = s.stopping.minVignettes;
        this.maxVignettes = s.stopping.maxVignettes;
        this.fimDetThreshold = s.stopping.fimDetThreshold;
        this.maxVarianceThreshold = s.stopping.maxVarianceThreshold;
        this.uncertaintyThreshold = s.stopping.uncertaintyThreshold;
        this.temperature = s.model.temperature;
        this.maxNewtonIterations = s.model.maxNewtonIterations;
        this.convergenceTolerance = s.model.convergenceTolerance;
        this.fimRegularization = s.model.fimRegularization;
        this.covarianceRegularization = s.model.covarianceRegularization;
        this.libraryDir = s.library.dir;
        this.libraryOnClasspath = s.library.classpath;
        this.baseDir = s.storage.baseDir;
        this.sessionsDir = s.storage.sessionsDir;
        this.eventLog = s.storage.eventLog;
    }

    public static AdaptiveConfig defaults() {
        return of(new AdaptiveSettings());
    }

    /**
     * @throws ConfigurationException listing every violation found
     */
    public static AdaptiveConfig of(AdaptiveSettings s) {
        Objects.requireNonNull(s, "settings");
        List<String> errors = new ArrayList<>();
        double[] mean = checkSettings(s, errors);
        if (!errors.isEmpty()) throw new ConfigurationException(errors);
        return new AdaptiveConfig(s, mean);
    }

    private static double[] checkSettings(AdaptiveSettings s, List<String> errors) {
        double[] mean = null;
        if (s.prior == null) {
            errors.add("prior section is missing");
        } else {
            if (s.prior.mean == null || s.prior.mean.size() != PreferenceDimension.COUNT) {
                errors.add("prior.mean must have " + PreferenceDimension.COUNT + " values, got "
                        + (s.prior.mean == null ? "none" : s.prior.mean.size()));
            } else {
                mean = new double[PreferenceDimension.COUNT];
                for (int i = 0; i < mean.length; i++) {
                    Double v = s.prior.mean.get(i);
                    if (v == null || !Double.isFinite(v)) errors.add("prior.mean[" + i + "] must be finite");
                    else mean[i] = v;
                }
            }
            positive("prior.variance", s.prior.variance, errors);
        }

        if (s.stopping == null) {
            errors.add("stopping section is missing");
        } else {
            if (s.stopping.minVignettes < 0) errors.add("stopping.min_vignettes must be >= 0");
            if (s.stopping.maxVignettes < 1) errors.add("stopping.max_vignettes must be >= 1");
            if (s.stopping.minVignettes > s.stopping.maxVignettes) {
                errors.add("stopping.min_vignettes (" + s.stopping.minVignettes + ") must be <= max_vignettes ("
                        + s.stopping.maxVignettes + ")");
            }
            positive("stopping.fim_det_threshold", s.stopping.fimDetThreshold, errors);
            positive("stopping.max_variance_threshold", s.stopping.maxVarianceThreshold, errors);
            positive("stopping.uncertainty_threshold", s.stopping.uncertaintyThreshold, errors);
        }

        if (s.model == null) {
            errors.add("model section is missing");
        } else {
            positive("model.temperature", s.model.temperature, errors);
            if (s.model.maxNewtonIterations < 1) errors.add("model.max_newton_iterations must be >= 1");
            positive("model.convergence_tolerance", s.model.convergenceTolerance, errors);
            positive("model.fim_regularization", s.model.fimRegularization, errors);
            positive("model.covariance_regularization", s.model.covarianceRegularization, errors);
        }

        if (s.library == null || s.library.dir == null || s.library.dir.isBlank()) errors.add("library.dir is required");
        if (s.storage == null) {
            errors.add("storage section is missing");
        } else {
            if (s.storage.baseDir == null || s.storage.baseDir.isBlank()) errors.add("storage.base_dir is required");
            if (s.storage.sessionsDir == null || s.storage.sessionsDir.isBlank()) errors.add("storage.sessions_dir is required");
            if (s.storage.eventLog == null || s.storage.eventLog.isBlank()) errors.add("storage.event_log is required");
        }
        return mean;
    }

    private static void positive(String name, double v, List<String> errors) {
        if (!Double.isFinite(v) || v <= 0.0) errors.add(name + " must be > 0, got " + v);
    }

    // -------------------- Accessors --------------------

    public boolean enabled() {
        return enabled;
    }

    public double[] priorMean() {
        return Arrays.copyOf(priorMean, priorMean.length);
    }

    public double priorVariance() {
        return priorVariance;
    }

    public int minVignettes() {
        return minVignettes;
    }

    public int maxVignettes() {
        return maxVignettes;
    }

    public double fimDetThreshold() {
        return fimDetThreshold;
    }

    public double maxVarianceThreshold() {
        return maxVarianceThreshold;
    }

    public double temperature() {
        return temperature;
    }

    public int maxNewtonIterations() {
        return maxNewtonIterations;
    }

    public double convergenceTolerance() {
        return convergenceTolerance;
    }

    public double uncertaintyThreshold() {
        return uncertaintyThreshold;
    }

    public double fimRegularization() {
        return fimRegularization;
    }

    public double covarianceRegularization() {
        return covarianceRegularization;
    }

    public String libraryDir() {
        return libraryDir;
    }

    public boolean libraryOnClasspath() {
        return libraryOnClasspath;
    }

    public String baseDir() {
        return baseDir;
    }

    public String sessionsDir() {
        return sessionsDir;
    }

    public String eventLog() {
        return eventLog;
    }

    @Override
    public String toString() {
        return "AdaptiveConfig{enabled=" + enabled
                + ", priorMean=" + Arrays.toString(priorMean)
                + ", priorVariance=" + priorVariance
                + ", min=" + minVignettes
                + ", max=" + maxVignettes
                + ", fimDetThreshold=" + fimDetThreshold
                + ", maxVarianceThreshold=" + maxVarianceThreshold
                + ", temperature=" + temperature
                + ", maxNewtonIterations=" + maxNewtonIterations
                + ", convergenceTolerance=" + convergenceTolerance
                + ", uncertaintyThreshold=" + uncertaintyThreshold
                + ", fimRegularization=" + fimRegularization
                + ", covarianceRegularization=" + covarianceRegularization + "}";
    }
}
