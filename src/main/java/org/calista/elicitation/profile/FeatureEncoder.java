package org.calista.elicitation.profile;

import java.util.Map;
import java.util.Objects;

/**
 * The single attribute to feature mapping (encoding table {@value #VERSION}).
 *
 * <p>
 * Used identically by profile generation, dominance checks, the likelihood and the Fisher
 * information computation. Every dimension is oriented "higher is better".
 * </p>
 *
 * <pre>
 * idx dimension          attributes                                   encoding
 * 0   financial          wage (salary)                                wage / 10000
 * 1   work environment   physical_demand, remote_work (remote),       mean of present terms:
 *                        commute_time                                 1 - physical_demand, remote_work,
 *                                                                     max(0, (60 - commute) / 45)
 * 2   career growth      career_growth                                level
 * 3   work-life balance  flexibility, commute_time                    mean of present terms:
 *                                                                     flexibility, max(0, (60 - commute) / 45)
 * 4   job security       job_security                                 level
 * 5   task preference    task_variety, social_interaction             mean of present terms
 * 6   values / culture   company_values (culture_alignment)           level
 * </pre>
 *
 * Absent groups encode to 0; unknown attributes are ignored.
 */
public final class FeatureEncoder {

    public static final String VERSION = "v1";
    public static final int DIMENSIONS = PreferenceDimension.COUNT;

    public static final double WAGE_SCALE = 10_000.0;
    public static final double COMMUTE_WORST_MINUTES = 60.0;
    public static final double COMMUTE_RANGE_MINUTES = 45.0;

    private FeatureEncoder() {}

    public static double[] encode(Map<String, Double> attrs) {
        Objects.requireNonNull(attrs, "attrs");
        double[] f = new double[DIMENSIONS];

        Double wage = first(attrs, "wage", "salary");
        if (wage != null) f[0] = wage / WAGE_SCALE;

        Double commute = attrs.get("commute_time");
        Double commuteScore = (commute == null) ? null : commuteScore(commute);

        // work environment
        double env = 0.0;
        int envN = 0;
        Double physical = attrs.get("physical_demand");
        if (physical != null) { env += 1.0 - physical; envN++; }
        Double remote = first(attrs, "remote_work", "remote");
        if (remote != null) { env += remote; envN++; }
        if (commuteScore != null) { env += commuteScore; envN++; }
        if (envN > 0) f[1] = env / envN;

        Double growth = attrs.get("career_growth");
        if (growth != null) f[2] = growth;

        // work-life balance
        double wlb = 0.0;
        int wlbN = 0;
        Double flex = attrs.get("flexibility");
        if (flex != null) { wlb += flex; wlbN++; }
        if (commuteScore != null) { wlb += commuteScore; wlbN++; }
        if (wlbN > 0) f[3] = wlb / wlbN;

        Double security = attrs.get("job_security");
        if (security != null) f[4] = security;

        double task = 0.0;
        int taskN = 0;
        Double variety = attrs.get("task_variety");
        if (variety != null) { task += variety; taskN++; }
        Double social = attrs.get("social_interaction");
        if (social != null) { task += social; taskN++; }
        if (taskN > 0) f[5] = task / taskN;

        Double values = first(attrs, "company_values", "culture_alignment");
        if (values != null) f[6] = values;

        return f;
    }

    /** 15 min -> 1.0, 60 min -> 0.0, never negative. */
    public static double commuteScore(double minutes) {
        return Math.max(0.0, (COMMUTE_WORST_MINUTES - minutes) / COMMUTE_RANGE_MINUTES);
    }

    private static Double first(Map<String, Double> attrs, String key, String alias) {
        Double v = attrs.get(key);
        return (v != null) ? v : attrs.get(alias);
    }
}
