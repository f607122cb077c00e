package org.calista.elicitation.select;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.elicitation.info.FisherInformationCalculator;
import org.calista.elicitation.math.Matrices;
import org.calista.elicitation.profile.DominanceFilter;
import org.calista.elicitation.vignette.Vignette;
import org.ejml.data.DMatrixRMaj;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Greedy one-step D-optimal choice of the next vignette.
 *
 * <p>
 * Scores every non-dominated candidate by det(cumulative + I(candidate, theta)) and takes the maximum;
 * equal scores resolve to the earlier candidate. When no candidate yields a positive determinant the
 * maximum trace (A-optimality) is used instead, with a warning.
 * </p>
 */
public final class DEfficiencyOptimizer {
    private static final Logger log = LogManager.getLogger(DEfficiencyOptimizer.class);

    private final FisherInformationCalculator fisher;

    public DEfficiencyOptimizer(FisherInformationCalculator fisher) {
        this.fisher = Objects.requireNonNull(fisher, "fisher");
    }

    /**
     * @return empty when no non-dominated candidate is left
     */
    public Optional<Vignette> selectBestCandidate(List<Vignette> candidates, DMatrixRMaj cumulativeFim, double[] theta) {
        List<Scored<Vignette>> ranked = rankCandidates(candidates, cumulativeFim, theta);
        if (ranked.isEmpty()) {
            log.debug("selectBestCandidate: no eligible candidates");
            return Optional.empty();
        }
        Scored<Vignette> best = ranked.get(0);
        log.debug("selectBestCandidate: {} (score={}, pool={})", best.item.vignetteId(), best.score, ranked.size());
        return Optional.of(best.item);
    }

    /**
     * Non-dominated candidates, best first. Scores are determinants, or traces when every
     * determinant is degenerate.
     */
    public List<Scored<Vignette>> rankCandidates(List<Vignette> candidates, DMatrixRMaj cumulativeFim, double[] theta) {
        Objects.requireNonNull(candidates, "candidates");
        Objects.requireNonNull(cumulativeFim, "cumulativeFim");
        Objects.requireNonNull(theta, "theta");

        List<Vignette> eligible = new ArrayList<>(candidates.size());
        List<DMatrixRMaj> updated = new ArrayList<>(candidates.size());
        boolean anyPositive = false;
        List<Double> dets = new ArrayList<>(candidates.size());

        for (Vignette v : candidates) {
            if (DominanceFilter.isDominated(v)) {
                log.debug("rankCandidates: skipping dominated {}", v.vignetteId());
                continue;
            }
            DMatrixRMaj m = fisher.accumulate(cumulativeFim, v, theta);
            double det = Matrices.determinant(m);
            if (det > 0.0 && Double.isFinite(det)) anyPositive = true;
            eligible.add(v);
            updated.add(m);
            dets.add(det);
        }
        if (eligible.isEmpty()) return List.of();

        List<Scored<Vignette>> out = new ArrayList<>(eligible.size());
        if (anyPositive) {
            for (int i = 0; i < eligible.size(); i++) {
                double d = dets.get(i);
                out.add(Scored.of(eligible.get(i), Double.isFinite(d) ? d : Double.NEGATIVE_INFINITY, i));
            }
        } else {
            log.warn("All {} candidate determinants are degenerate (<= 0); falling back to max trace", eligible.size());
            for (int i = 0; i < eligible.size(); i++) {
                out.add(Scored.of(eligible.get(i), Matrices.trace(updated.get(i)), i));
            }
        }
        Collections.sort(out);
        return out;
    }
}
