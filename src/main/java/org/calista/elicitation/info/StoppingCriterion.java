package org.calista.elicitation.info;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.elicitation.bayes.PreferenceEstimate;
import org.calista.elicitation.core.AdaptiveConfig;
import org.calista.elicitation.math.Matrices;
import org.calista.elicitation.profile.PreferenceDimension;
import org.ejml.data.DMatrixRMaj;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * StoppingCriterion: decides whether the adaptive phase continues.
 *
 * <p>Rules in precedence order:</p>
 * <ol>
 *   <li>n &lt; min_vignettes: CONTINUE (overrides everything else)</li>
 *   <li>n &gt;= max_vignettes: STOP</li>
 *   <li>det(fim) &gt; fim_det_threshold: STOP</li>
 *   <li>max posterior variance &lt; max_variance_threshold: STOP</li>
 *   <li>otherwise CONTINUE</li>
 * </ol>
 * Stateless; making STOP sticky is the session's job.
 */
public final class StoppingCriterion {
    private static final Logger log = LogManager.getLogger(StoppingCriterion.class);

    private final int minVignettes;
    private final int maxVignettes;
    private final double fimDetThreshold;
    private final double maxVarianceThreshold;
    private final double uncertaintyThreshold;

    public StoppingCriterion(AdaptiveConfig config) {
        Objects.requireNonNull(config, "config");
        this.minVignettes = config.minVignettes();
        this.maxVignettes = config.maxVignettes();
        this.fimDetThreshold = config.fimDetThreshold();
        this.maxVarianceThreshold = config.maxVarianceThreshold();
        this.uncertaintyThreshold = config.uncertaintyThreshold();
    }

    public StoppingDecision evaluate(int vignettesShown, PreferenceEstimate posterior, DMatrixRMaj fim) {
        Objects.requireNonNull(posterior, "posterior");
        Objects.requireNonNull(fim, "fim");

        if (vignettesShown < minVignettes) {
            return decision(StoppingDecision.State.CONTINUE, StoppingDecision.Rule.BELOW_MINIMUM,
                    "shown " + vignettesShown + " < minimum " + minVignettes);
        }
        if (vignettesShown >= maxVignettes) {
            return decision(StoppingDecision.State.STOP, StoppingDecision.Rule.MAXIMUM_REACHED,
                    "shown " + vignettesShown + " >= maximum " + maxVignettes);
        }
        double det = Matrices.determinant(fim);
        if (det > fimDetThreshold) {
            return decision(StoppingDecision.State.STOP, StoppingDecision.Rule.INFORMATION_SUFFICIENT,
                    String.format(Locale.ROOT, "det(FIM) %.4g > threshold %.4g", det, fimDetThreshold));
        }
        double maxVar = posterior.maxVariance();
        if (maxVar < maxVarianceThreshold) {
            return decision(StoppingDecision.State.STOP, StoppingDecision.Rule.UNCERTAINTY_LOW,
                    String.format(Locale.ROOT, "max posterior variance %.4f < threshold %.4f", maxVar, maxVarianceThreshold));
        }
        return decision(StoppingDecision.State.CONTINUE, StoppingDecision.Rule.UNCERTAINTY_HIGH,
                String.format(Locale.ROOT, "det(FIM) %.4g, max variance %.4f: keep asking", det, maxVar));
    }

    public boolean shouldContinue(int vignettesShown, PreferenceEstimate posterior, DMatrixRMaj fim) {
        return evaluate(vignettesShown, posterior, fim).shouldContinue();
    }

    public StoppingDiagnostics diagnostics(int vignettesShown, PreferenceEstimate posterior, DMatrixRMaj fim) {
        Objects.requireNonNull(posterior, "posterior");
        Objects.requireNonNull(fim, "fim");
        return new StoppingDiagnostics(vignettesShown, minVignettes, maxVignettes,
                Matrices.determinant(fim), fimDetThreshold, posterior.variances(), maxVarianceThreshold);
    }

    /** Dimensions whose posterior variance is still above uncertainty_threshold. */
    public List<PreferenceDimension> uncertainDimensions(PreferenceEstimate posterior) {
        Objects.requireNonNull(posterior, "posterior");
        double[] var = posterior.variances();
        List<PreferenceDimension> out = new ArrayList<>();
        for (int i = 0; i < Math.min(var.length, PreferenceDimension.COUNT); i++) {
            if (var[i] > uncertaintyThreshold) out.add(PreferenceDimension.at(i));
        }
        return out;
    }

    private static StoppingDecision decision(StoppingDecision.State state, StoppingDecision.Rule rule, String reason) {
        StoppingDecision d = new StoppingDecision(state, rule, reason);
        log.debug("stopping: {}", d);
        return d;
    }
}
