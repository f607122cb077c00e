package org.calista.elicitation.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * AdaptiveSettings: raw, mutable configuration as read from JSON and the environment.
 *
 * <ul>
 *   <li>defaults live in the field initializers</li>
 *   <li>nothing here is validated; {@link AdaptiveConfig#of(AdaptiveSettings)} does that in one step</li>
 * </ul>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class AdaptiveSettings {

    public static final String ENV_PREFIX = "ADAPTIVE_";

    public boolean enabled = true;
    public Prior prior = new Prior();
    public Stopping stopping = new Stopping();
    public Model model = new Model();
    public Library library = new Library();
    public Storage storage = new Storage();

    // -------------------- Sections --------------------

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Prior {
        public List<Double> mean = new ArrayList<>(List.of(0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0));
        public double variance = 1.0;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Stopping {
        @JsonProperty("min_vignettes")
        public int minVignettes = 6;
        @JsonProperty("max_vignettes")
        public int maxVignettes = 14;
        @JsonProperty("fim_det_threshold")
        public double fimDetThreshold = 1e4;
        @JsonProperty("max_variance_threshold")
        public double maxVarianceThreshold = 0.65;
        @JsonProperty("uncertainty_threshold")
        public double uncertaintyThreshold = 0.3;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Model {
        public double temperature = 1.0;
        @JsonProperty("max_newton_iterations")
        public int maxNewtonIterations = 50;
        @JsonProperty("convergence_tolerance")
        public double convergenceTolerance = 1e-6;
        @JsonProperty("fim_regularization")
        public double fimRegularization = 1e-8;
        @JsonProperty("covariance_regularization")
        public double covarianceRegularization = 1e-6;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Library {
        /** Directory of the three library files (classpath or sandbox-relative). */
        public String dir = "vignettes";
        /** true: load from the classpath; false: from {@code storage.base_dir/dir}. */
        public boolean classpath = true;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Storage {
        @JsonProperty("base_dir")
        public String baseDir = "data";
        @JsonProperty("sessions_dir")
        public String sessionsDir = "sessions";
        @JsonProperty("event_log")
        public String eventLog = "events.jsonl";
    }

    // -------------------- Environment overlay --------------------

    /**
     * Applies {@code ADAPTIVE_*} overrides. Unparseable values are reported into {@code errors}
     * and leave the field untouched.
     */
    public void applyEnv(Map<String, String> env, List<String> errors) {
        if (env == null || env.isEmpty()) return;
        if (prior == null) prior = new Prior();
        if (stopping == null) stopping = new Stopping();
        if (model == null) model = new Model();

        for (Map.Entry<String, String> e : env.entrySet()) {
            String key = e.getKey();
            if (key == null || !key.startsWith(ENV_PREFIX)) continue;
            String name = key.substring(ENV_PREFIX.length()).toLowerCase(Locale.ROOT);
            String raw = (e.getValue() == null) ? "" : e.getValue().trim();
            try {
                switch (name) {
                    case "enabled": enabled = parseBoolean(raw); break;
                    case "prior_mean": prior.mean = parseVector(raw); break;
                    case "prior_variance": prior.variance = Double.parseDouble(raw); break;
                    case "min_vignettes": stopping.minVignettes = Integer.parseInt(raw); break;
                    case "max_vignettes": stopping.maxVignettes = Integer.parseInt(raw); break;
                    case "fim_det_threshold": stopping.fimDetThreshold = Double.parseDouble(raw); break;
                    case "max_variance_threshold": stopping.maxVarianceThreshold = Double.parseDouble(raw); break;
                    case "uncertainty_threshold": stopping.uncertaintyThreshold = Double.parseDouble(raw); break;
                    case "temperature": model.temperature = Double.parseDouble(raw); break;
                    case "max_newton_iterations": model.maxNewtonIterations = Integer.parseInt(raw); break;
                    case "convergence_tolerance": model.convergenceTolerance = Double.parseDouble(raw); break;
                    case "fim_regularization": model.fimRegularization = Double.parseDouble(raw); break;
                    case "covariance_regularization": model.covarianceRegularization = Double.parseDouble(raw); break;
                    default:
                        // other ADAPTIVE_* variables belong to someone else
                        break;
                }
            } catch (IllegalArgumentException ex) {
                errors.add(key + ": cannot parse '" + raw + "'");
            }
        }
    }

    private static boolean parseBoolean(String raw) {
        String s = raw.toLowerCase(Locale.ROOT);
        if (s.equals("true") || s.equals("1") || s.equals("yes")) return true;
        if (s.equals("false") || s.equals("0") || s.equals("no")) return false;
        throw new IllegalArgumentException("not a boolean: " + raw);
    }

    private static List<Double> parseVector(String raw) {
        String s = raw;
        if (s.startsWith("[") && s.endsWith("]")) s = s.substring(1, s.length() - 1);
        List<Double> out = new ArrayList<>();
        if (s.isBlank()) return out;
        for (String part : s.split(",")) out.add(Double.parseDouble(part.trim()));
        return out;
    }
}
