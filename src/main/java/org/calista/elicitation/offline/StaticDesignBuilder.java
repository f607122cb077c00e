package org.calista.elicitation.offline;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.elicitation.info.FisherInformationCalculator;
import org.calista.elicitation.math.Matrices;
import org.calista.elicitation.profile.DominanceFilter;
import org.calista.elicitation.profile.FeatureEncoder;
import org.calista.elicitation.profile.ProfilePair;
import org.ejml.data.DMatrixRMaj;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Greedy D-optimal choice of the static vignettes.
 *
 * <p>
 * Starts from the prior information {@code I / prior_variance} and, round by round, adds the
 * candidate pair whose information (at the prior mean) raises det(FIM) the most. Pairs with
 * strict or quasi dominance, an excessive wage gap or identical encodings are never taken.
 * The first {@code numBeginning} picks open the session, the rest close it.
 * </p>
 */
public final class StaticDesignBuilder {
    private static final Logger log = LogManager.getLogger(StaticDesignBuilder.class);

    private final FisherInformationCalculator fisher;
    private final int quasiDominanceThreshold;
    private final double maxWageRatio;

    public StaticDesignBuilder(FisherInformationCalculator fisher) {
        this(fisher, DominanceFilter.DEFAULT_QUASI_DOMINANCE_THRESHOLD, DominanceFilter.DEFAULT_MAX_WAGE_RATIO);
    }

    public StaticDesignBuilder(FisherInformationCalculator fisher, int quasiDominanceThreshold, double maxWageRatio) {
        this.fisher = Objects.requireNonNull(fisher, "fisher");
        if (quasiDominanceThreshold < 1) throw new IllegalArgumentException("quasiDominanceThreshold must be >= 1");
        if (!(maxWageRatio >= 1.0)) throw new IllegalArgumentException("maxWageRatio must be >= 1");
        this.quasiDominanceThreshold = quasiDominanceThreshold;
        this.maxWageRatio = maxWageRatio;
    }

    /**
     * @param candidates    candidate pool, scanned in order (ties keep the earlier pair)
     * @param numStatic     total static pairs wanted
     * @param numBeginning  how many of them open the session
     * @param priorMean     theta at which information is evaluated
     * @param priorVariance prior variance, {@code > 0}
     * @return the design; fewer pairs than asked when the pool runs dry
     */
    public StaticDesign select(List<ProfilePair> candidates, int numStatic, int numBeginning,
                               double[] priorMean, double priorVariance) {
        Objects.requireNonNull(candidates, "candidates");
        Objects.requireNonNull(priorMean, "priorMean");
        if (numStatic < 0 || numBeginning < 0 || numBeginning > numStatic) {
            throw new IllegalArgumentException("need 0 <= numBeginning <= numStatic");
        }
        if (!(priorVariance > 0.0)) throw new IllegalArgumentException("priorVariance must be > 0");

        List<ProfilePair> eligible = new ArrayList<>();
        for (ProfilePair p : candidates) {
            if (isEligible(p)) eligible.add(p);
        }
        log.info("Static design: {} of {} candidates eligible, selecting {}", eligible.size(), candidates.size(), numStatic);

        DMatrixRMaj current = Matrices.diagonal(FeatureEncoder.DIMENSIONS, 1.0 / priorVariance);
        List<ProfilePair> selected = new ArrayList<>(numStatic);

        for (int round = 0; round < numStatic; round++) {
            double baseDet = Matrices.determinant(current);
            ProfilePair best = null;
            DMatrixRMaj bestFim = null;
            double bestGain = Double.NEGATIVE_INFINITY;

            for (ProfilePair p : eligible) {
                if (containsSame(selected, p)) continue;
                DMatrixRMaj fim = fisher.computeFim(p.a().features(), p.b().features(), priorMean);
                double gain = Matrices.determinant(Matrices.add(current, fim)) - baseDet;
                if (gain > bestGain) {
                    bestGain = gain;
                    best = p;
                    bestFim = fim;
                }
            }

            if (best == null) {
                log.warn("No eligible pair left in round {}; static design stops at {}", round + 1, selected.size());
                break;
            }
            selected.add(best);
            current = Matrices.add(current, bestFim);
            log.debug("Static round {}: gain={} det={}", round + 1, bestGain, Matrices.determinant(current));
        }

        int split = Math.min(numBeginning, selected.size());
        StaticDesign design = new StaticDesign(selected.subList(0, split), selected.subList(split, selected.size()), current);
        log.info("Static design: {} beginning, {} end, det(FIM)={}", design.beginning().size(), design.end().size(),
                Matrices.determinant(current));
        return design;
    }

    boolean isEligible(ProfilePair p) {
        double[] fa = p.a().features();
        double[] fb = p.b().features();
        if (Matrices.norm(Matrices.subtract(fa, fb)) <= DominanceFilter.TOLERANCE) return false;
        if (DominanceFilter.hasQuasiDominance(fa, fb, quasiDominanceThreshold)) return false;
        return !DominanceFilter.hasExcessiveWageGap(p.a(), p.b(), maxWageRatio);
    }

    static boolean containsSame(List<ProfilePair> pairs, ProfilePair p) {
        for (ProfilePair q : pairs) {
            if (q.sameProfilesAs(p)) return true;
        }
        return false;
    }
}
