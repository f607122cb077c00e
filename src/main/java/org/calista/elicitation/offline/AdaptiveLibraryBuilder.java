package org.calista.elicitation.offline;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.elicitation.info.FisherInformationCalculator;
import org.calista.elicitation.math.Matrices;
import org.calista.elicitation.profile.DominanceFilter;
import org.calista.elicitation.profile.ProfilePair;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Picks the pool the online optimizer chooses from.
 *
 * <p>
 * Greedy on {@code (1 - w) * informativeness + w * diversity}:
 * informativeness is det(I(pair, prior mean) + 1e-8 I), diversity is the smallest cosine
 * distance {@code 1 - |cos|} between the pair's difference vector and those already picked
 * (1 for the first pick). Static pairs, attribute cancellation, quasi dominance and
 * excessive wage gaps are excluded.
 * </p>
 */
public final class AdaptiveLibraryBuilder {
    private static final Logger log = LogManager.getLogger(AdaptiveLibraryBuilder.class);

    public static final double DEFAULT_DIVERSITY_WEIGHT = 0.3;
    static final double INFORMATIVENESS_RIDGE = 1e-8;
    private static final double COSINE_EPS = 1e-8;

    private final FisherInformationCalculator fisher;
    private final double diversityWeight;

    public AdaptiveLibraryBuilder(FisherInformationCalculator fisher) {
        this(fisher, DEFAULT_DIVERSITY_WEIGHT);
    }

    public AdaptiveLibraryBuilder(FisherInformationCalculator fisher, double diversityWeight) {
        this.fisher = Objects.requireNonNull(fisher, "fisher");
        if (!(diversityWeight >= 0.0 && diversityWeight <= 1.0)) {
            throw new IllegalArgumentException("diversityWeight must be in [0, 1]");
        }
        this.diversityWeight = diversityWeight;
    }

    public double diversityWeight() {
        return diversityWeight;
    }

    /**
     * @param candidates candidate pool, scanned in order (ties keep the earlier pair)
     * @param size       pairs wanted
     * @param excluded   pairs already used by the static design (either orientation)
     * @param priorMean  theta at which informativeness is evaluated
     */
    public List<ProfilePair> build(List<ProfilePair> candidates, int size, List<ProfilePair> excluded, double[] priorMean) {
        Objects.requireNonNull(candidates, "candidates");
        Objects.requireNonNull(excluded, "excluded");
        Objects.requireNonNull(priorMean, "priorMean");
        if (size < 0) throw new IllegalArgumentException("size must be >= 0");

        List<ProfilePair> eligible = new ArrayList<>();
        List<Double> informativeness = new ArrayList<>();
        for (ProfilePair p : candidates) {
            if (StaticDesignBuilder.containsSame(excluded, p) || !isEligible(p)) continue;
            eligible.add(p);
            informativeness.add(informativeness(p, priorMean));
        }
        log.info("Adaptive library: {} of {} candidates eligible, selecting {}", eligible.size(), candidates.size(), size);

        List<ProfilePair> selected = new ArrayList<>(size);
        List<double[]> selectedDeltas = new ArrayList<>(size);
        boolean[] used = new boolean[eligible.size()];

        for (int round = 0; round < size; round++) {
            int best = -1;
            double bestScore = Double.NEGATIVE_INFINITY;
            for (int i = 0; i < eligible.size(); i++) {
                if (used[i]) continue;
                ProfilePair p = eligible.get(i);
                if (StaticDesignBuilder.containsSame(selected, p)) continue;
                double score = (1.0 - diversityWeight) * informativeness.get(i)
                        + diversityWeight * diversity(p.delta(), selectedDeltas);
                if (score > bestScore) {
                    bestScore = score;
                    best = i;
                }
            }
            if (best < 0) {
                log.warn("No eligible pair left in round {}; adaptive library stops at {}", round + 1, selected.size());
                break;
            }
            used[best] = true;
            ProfilePair pick = eligible.get(best);
            selected.add(pick);
            selectedDeltas.add(pick.delta());
            if ((round + 1) % 10 == 0) log.debug("Adaptive library: {} selected", round + 1);
        }

        log.info("Adaptive library built with {} pairs", selected.size());
        return selected;
    }

    boolean isEligible(ProfilePair p) {
        double[] fa = p.a().features();
        double[] fb = p.b().features();
        if (Matrices.norm(Matrices.subtract(fa, fb)) <= DominanceFilter.TOLERANCE) return false;
        if (DominanceFilter.hasAttributeCancellation(p.a(), p.b())) return false;
        if (DominanceFilter.hasQuasiDominance(fa, fb, DominanceFilter.DEFAULT_QUASI_DOMINANCE_THRESHOLD)) return false;
        return !DominanceFilter.hasExcessiveWageGap(p.a(), p.b());
    }

    double informativeness(ProfilePair p, double[] theta) {
        return Matrices.determinant(Matrices.addDiagonal(
                fisher.computeFim(p.a().features(), p.b().features(), theta), INFORMATIVENESS_RIDGE));
    }

    /** Smallest 1 - |cos| to the already selected difference vectors; 1 when none are selected. */
    static double diversity(double[] delta, List<double[]> selected) {
        if (selected.isEmpty()) return 1.0;
        double min = Double.POSITIVE_INFINITY;
        double n = Matrices.norm(delta);
        for (double[] s : selected) {
            double cos = Matrices.dot(delta, s) / (n * Matrices.norm(s) + COSINE_EPS);
            min = Math.min(min, 1.0 - Math.abs(cos));
        }
        return min;
    }
}
