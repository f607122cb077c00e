package org.calista.elicitation.offline;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.elicitation.profile.AttributeSpec;
import org.calista.elicitation.profile.Profile;
import org.calista.elicitation.profile.ProfileGenerator;
import org.calista.elicitation.profile.ProfilePair;
import org.calista.elicitation.vignette.Vignette;
import org.calista.elicitation.vignette.VignetteOption;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Turns designed profile pairs into presentable {@link Vignette}s.
 *
 * <p>The category is taken from the attribute that differs most (normalized by its range);
 * below {@value #MIXED_THRESHOLD} it is {@value #MIXED}.</p>
 */
public final class VignetteConverter {
    private static final Logger log = LogManager.getLogger(VignetteConverter.class);

    public static final String MIXED = "mixed";
    static final double MIXED_THRESHOLD = 0.1;

    private static final Map<String, String> CATEGORY_BY_ATTRIBUTE = Map.of(
            "wage", "financial",
            "physical_demand", "work_environment",
            "flexibility", "work_life_balance",
            "commute_time", "work_environment",
            "job_security", "job_security",
            "remote_work", "work_environment",
            "career_growth", "career_advancement",
            "task_variety", "task_preferences",
            "social_interaction", "task_preferences",
            "company_values", "values_culture");

    private static final Map<String, String> SCENARIO_BY_CATEGORY = Map.of(
            "financial", "Consider these two job opportunities with different compensation packages:",
            "work_environment", "Consider these two job opportunities with different work environments:",
            "job_security", "Consider these two job opportunities with different levels of job security:",
            "career_advancement", "Consider these two job opportunities with different growth potential:",
            "work_life_balance", "Consider these two job opportunities with different work-life balance:",
            MIXED, "Consider these two job opportunities with different trade-offs:");

    private final ProfileGenerator generator;

    public VignetteConverter(ProfileGenerator generator) {
        this.generator = Objects.requireNonNull(generator, "generator");
    }

    public String inferCategory(ProfilePair pair) {
        Objects.requireNonNull(pair, "pair");
        String bestAttr = null;
        double bestDiff = Double.NEGATIVE_INFINITY;
        for (AttributeSpec a : generator.space().attributes) {
            double va = pair.a().get(a.name, 0.0);
            double vb = pair.b().get(a.name, 0.0);
            double diff;
            if (a.isOrdered()) {
                double range = a.range();
                diff = (range > 0.0) ? Math.abs(va - vb) / range : 0.0;
            } else {
                diff = Math.abs(va - vb);
            }
            if (diff > bestDiff) {
                bestDiff = diff;
                bestAttr = a.name;
            }
        }
        if (bestAttr == null || bestDiff < MIXED_THRESHOLD) return MIXED;
        String category = CATEGORY_BY_ATTRIBUTE.getOrDefault(bestAttr, MIXED);
        log.trace("category {} from {} (diff={})", category, bestAttr, bestDiff);
        return category;
    }

    public static String scenarioText(String category) {
        String t = SCENARIO_BY_CATEGORY.get(category);
        return (t != null) ? t : SCENARIO_BY_CATEGORY.get(MIXED);
    }

    /** "Option A: Job with KES 25,000/month", or a generic title without a wage. */
    public static String optionTitle(String optionId, Profile profile) {
        double wage = profile.get("wage", 0.0);
        if (wage > 0.0) {
            return String.format(Locale.ROOT, "Option %s: Job with KES %,d/month", optionId, Math.round(wage));
        }
        return "Option " + optionId + ": Job Opportunity";
    }

    public Vignette convert(ProfilePair pair, String vignetteId) {
        Objects.requireNonNull(pair, "pair");
        String category = inferCategory(pair);
        List<VignetteOption> options = List.of(
                option("A", pair.a()),
                option("B", pair.b()));
        return new Vignette(vignetteId, category, scenarioText(category), options);
    }

    /** Ids are {@code prefix_001}, {@code prefix_002}, ... in list order. */
    public List<Vignette> convertAll(List<ProfilePair> pairs, String idPrefix) {
        Objects.requireNonNull(pairs, "pairs");
        Objects.requireNonNull(idPrefix, "idPrefix");
        List<Vignette> out = new ArrayList<>(pairs.size());
        for (int i = 0; i < pairs.size(); i++) {
            out.add(convert(pairs.get(i), String.format(Locale.ROOT, "%s_%03d", idPrefix, i + 1)));
        }
        log.info("Converted {} pairs to vignettes (prefix {})", out.size(), idPrefix);
        return out;
    }

    private VignetteOption option(String id, Profile p) {
        return new VignetteOption(id, optionTitle(id, p), generator.describe(p), p.attributes());
    }
}
