package org.calista.elicitation.profile;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.elicitation.vignette.Vignette;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Pareto dominance over encoded features.
 *
 * <p>
 * A pair where one side is at least as good on every dimension and strictly better on one carries
 * almost no information (the choice is near-deterministic), so it never reaches a library or the
 * online selector. The quasi-dominance, wage-gap and cancellation checks are stricter heuristics
 * used only while designing libraries offline.
 * </p>
 */
public final class DominanceFilter {
    private static final Logger log = LogManager.getLogger(DominanceFilter.class);

    public static final double TOLERANCE = 1e-6;
    public static final int DEFAULT_QUASI_DOMINANCE_THRESHOLD = 5;
    public static final double DEFAULT_MAX_WAGE_RATIO = 1.67;
    public static final double CANCELLATION_THRESHOLD = 0.15;

    /** Attribute groups averaged into a single dimension by {@link FeatureEncoder}. */
    private static final Map<String, List<String>> AGGREGATED_GROUPS = Map.of(
            "work_environment", List.of("physical_demand", "remote_work", "commute_time"),
            "work_life_balance", List.of("flexibility", "commute_time"),
            "task_preference", List.of("task_variety", "social_interaction"));

    private DominanceFilter() {}

    // ---------------------------------------------------------------------
    // Strict dominance
    // ---------------------------------------------------------------------

    /** fa >= fb everywhere (within tolerance) and fa > fb somewhere. */
    public static boolean featuresDominate(double[] fa, double[] fb) {
        Objects.requireNonNull(fa, "fa");
        Objects.requireNonNull(fb, "fb");
        if (fa.length != fb.length) throw new IllegalArgumentException("dimension mismatch: " + fa.length + " vs " + fb.length);
        boolean strictlyBetter = false;
        for (int i = 0; i < fa.length; i++) {
            double d = fa[i] - fb[i];
            if (d < -TOLERANCE) return false;
            if (d > TOLERANCE) strictlyBetter = true;
        }
        return strictlyBetter;
    }

    /** Dominance in either direction; identical profiles are never dominated. */
    public static boolean hasPairwiseDominance(Map<String, Double> profileA, Map<String, Double> profileB) {
        return hasFeatureDominance(FeatureEncoder.encode(profileA), FeatureEncoder.encode(profileB));
    }

    public static boolean hasPairwiseDominance(Profile a, Profile b) {
        Objects.requireNonNull(a, "a");
        Objects.requireNonNull(b, "b");
        return hasFeatureDominance(a.features(), b.features());
    }

    public static boolean hasFeatureDominance(double[] fa, double[] fb) {
        return featuresDominate(fa, fb) || featuresDominate(fb, fa);
    }

    public static boolean isDominated(Vignette v) {
        Objects.requireNonNull(v, "vignette");
        return hasFeatureDominance(v.optionA().features(), v.optionB().features());
    }

    /** Keeps non-dominated vignettes in their original order. */
    public static List<Vignette> filter(List<Vignette> vignettes) {
        Objects.requireNonNull(vignettes, "vignettes");
        List<Vignette> out = new ArrayList<>(vignettes.size());
        for (Vignette v : vignettes) {
            if (isDominated(v)) {
                log.debug("filter: dominated vignette removed: {}", v.vignetteId());
                continue;
            }
            out.add(v);
        }
        return out;
    }

    // ---------------------------------------------------------------------
    // Offline design heuristics
    // ---------------------------------------------------------------------

    /** Strict dominance, or one side strictly better in at least {@code threshold} dimensions. */
    public static boolean hasQuasiDominance(double[] fa, double[] fb, int threshold) {
        if (hasFeatureDominance(fa, fb)) return true;
        int aBetter = 0;
        int bBetter = 0;
        for (int i = 0; i < fa.length; i++) {
            double d = fa[i] - fb[i];
            if (d > TOLERANCE) aBetter++;
            else if (d < -TOLERANCE) bBetter++;
        }
        return aBetter >= threshold || bBetter >= threshold;
    }

    public static boolean hasQuasiDominance(ProfilePair pair, int threshold) {
        return hasQuasiDominance(pair.a().features(), pair.b().features(), threshold);
    }

    /**
     * Wage ratio above {@code maxRatio} (anchoring on pay). Pairs without wage on both sides pass.
     */
    public static boolean hasExcessiveWageGap(Profile a, Profile b, double maxRatio) {
        double wa = wageOf(a);
        double wb = wageOf(b);
        if (wa <= 0.0 || wb <= 0.0) return false;
        return Math.max(wa, wb) / Math.min(wa, wb) > maxRatio;
    }

    /** {@code wage}, else its {@code salary} alias, else 0. */
    static double wageOf(Profile p) {
        Double w = p.attributes().get("wage");
        if (w == null) w = p.attributes().get("salary");
        return (w == null) ? 0.0 : w;
    }

    public static boolean hasExcessiveWageGap(Profile a, Profile b) {
        return hasExcessiveWageGap(a, b, DEFAULT_MAX_WAGE_RATIO);
    }

    /**
     * True when attributes inside an averaged dimension move in opposite directions and the
     * averaged difference nearly vanishes (|mean diff| below 0.15).
     */
    public static boolean hasAttributeCancellation(Profile a, Profile b) {
        Objects.requireNonNull(a, "a");
        Objects.requireNonNull(b, "b");
        for (List<String> group : AGGREGATED_GROUPS.values()) {
            List<Double> diffs = new ArrayList<>(group.size());
            for (String attr : group) {
                Double va = a.attributes().get(attr);
                Double vb = b.attributes().get(attr);
                if (va == null || vb == null) continue;
                diffs.add(oriented(attr, va) - oriented(attr, vb));
            }
            if (diffs.size() < 2) continue;

            boolean pos = false;
            boolean neg = false;
            double sum = 0.0;
            for (double d : diffs) {
                if (d > 0.01) pos = true;
                if (d < -0.01) neg = true;
                sum += d;
            }
            if (pos && neg && Math.abs(sum / diffs.size()) < CANCELLATION_THRESHOLD) return true;
        }
        return false;
    }

    private static double oriented(String attr, double raw) {
        switch (attr) {
            case "commute_time":
                return FeatureEncoder.commuteScore(raw);
            case "physical_demand":
                return 1.0 - raw;
            default:
                return raw;
        }
    }
}
