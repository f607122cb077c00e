package org.calista.elicitation;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.elicitation.core.AdaptiveConfig;
import org.calista.elicitation.core.AdaptiveSettings;
import org.calista.elicitation.core.ElicitationKernel;
import org.calista.elicitation.vignette.Vignette;
import org.calista.elicitation.vignette.VignetteLibrary;
import org.calista.elicitation.vignette.VignetteOption;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Shared test data: a baseline job and small trade-off vignettes around it.
 */
public final class Fixtures {

    private Fixtures() {}

    /** KES 25,000, 30 min commute, every binary attribute at its base level. */
    public static Map<String, Double> baseline() {
        Map<String, Double> m = new LinkedHashMap<>();
        m.put("wage", 25_000.0);
        m.put("physical_demand", 0.0);
        m.put("flexibility", 0.0);
        m.put("commute_time", 30.0);
        m.put("job_security", 0.0);
        m.put("remote_work", 0.0);
        m.put("career_growth", 0.0);
        m.put("task_variety", 0.0);
        m.put("social_interaction", 0.0);
        m.put("company_values", 0.0);
        return m;
    }

    public static Map<String, Double> job(Map<String, Double> changes) {
        Map<String, Double> m = baseline();
        m.putAll(changes);
        return m;
    }

    public static Vignette vignette(String id, Map<String, Double> changesA, Map<String, Double> changesB) {
        return new Vignette(id, null, "Which job would you take?", List.of(
                new VignetteOption("A", "Job A", "", job(changesA)),
                new VignetteOption("B", "Job B", "", job(changesB))));
    }

    /**
     * Ten non-dominated trade-offs whose difference vectors span all seven dimensions.
     */
    public static List<Vignette> spanningSet(String prefix) {
        List<Vignette> out = new ArrayList<>();
        out.add(vignette(prefix + "01", Map.of("wage", 30_000.0), Map.of("career_growth", 1.0)));
        out.add(vignette(prefix + "02", Map.of("job_security", 1.0), Map.of("flexibility", 1.0)));
        out.add(vignette(prefix + "03", Map.of("remote_work", 1.0), Map.of("company_values", 1.0)));
        out.add(vignette(prefix + "04", Map.of("task_variety", 1.0), Map.of("wage", 30_000.0)));
        out.add(vignette(prefix + "05", Map.of("career_growth", 1.0), Map.of("job_security", 1.0)));
        out.add(vignette(prefix + "06", Map.of("flexibility", 1.0), Map.of("company_values", 1.0)));
        out.add(vignette(prefix + "07", Map.of("wage", 20_000.0, "company_values", 1.0), Map.of()));
        out.add(vignette(prefix + "08", Map.of("social_interaction", 1.0), Map.of("remote_work", 1.0)));
        out.add(vignette(prefix + "09", Map.of("commute_time", 15.0), Map.of("job_security", 1.0)));
        out.add(vignette(prefix + "10", Map.of("physical_demand", 1.0, "wage", 35_000.0), Map.of()));
        return out;
    }

    /** A wins on pay alone: dominated. */
    public static Vignette dominated(String id) {
        return vignette(id, Map.of("wage", 30_000.0), Map.of());
    }

    /** begin: 2, adaptive: 6, end: 2, all from the spanning set. */
    public static VignetteLibrary smallLibrary() {
        List<Vignette> s = spanningSet("v");
        return new VignetteLibrary(s.subList(0, 2), s.subList(2, 8), s.subList(8, 10));
    }

    public static AdaptiveConfig config(Consumer<AdaptiveSettings> tweak) {
        AdaptiveSettings s = new AdaptiveSettings();
        tweak.accept(s);
        return AdaptiveConfig.of(s);
    }

    public static ObjectMapper mapper() {
        return ElicitationKernel.Builder.defaultMapper();
    }

    /** Respondent who always picks the option with the higher utility under {@code theta}. */
    public static String answer(Vignette v, double[] theta) {
        double ua = 0.0;
        double ub = 0.0;
        double[] fa = v.optionA().features();
        double[] fb = v.optionB().features();
        for (int i = 0; i < theta.length; i++) {
            ua += theta[i] * fa[i];
            ub += theta[i] * fb[i];
        }
        return (ua >= ub) ? v.optionA().optionId() : v.optionB().optionId();
    }
}
