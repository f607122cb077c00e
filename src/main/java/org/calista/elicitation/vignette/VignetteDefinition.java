package org.calista.elicitation.vignette;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Wire form of a vignette in library files:
 * {@code {vignette_id, category?, scenario_text, options: [{option_id, title, description, attributes}]}}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class VignetteDefinition {

    @JsonProperty("vignette_id")
    public String vignetteId;

    public String category;

    @JsonProperty("scenario_text")
    public String scenarioText;

    public List<OptionDefinition> options = new ArrayList<>();

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class OptionDefinition {
        @JsonProperty("option_id")
        public String optionId;
        public String title;
        public String description;
        public Map<String, Double> attributes = new LinkedHashMap<>();
    }

    /**
     * @throws IllegalArgumentException when the definition does not describe a valid vignette
     */
    public Vignette toVignette() {
        if (vignetteId == null || vignetteId.isBlank()) throw new IllegalArgumentException("vignette_id is required");
        if (options == null) throw new IllegalArgumentException("vignette '" + vignetteId + "' has no options");
        List<VignetteOption> opts = new ArrayList<>(options.size());
        for (OptionDefinition o : options) {
            if (o == null) throw new IllegalArgumentException("vignette '" + vignetteId + "' has a null option");
            if (o.optionId == null || o.optionId.isBlank()) {
                throw new IllegalArgumentException("vignette '" + vignetteId + "': option_id is required");
            }
            opts.add(new VignetteOption(o.optionId, o.title, o.description,
                    o.attributes == null ? Map.of() : o.attributes));
        }
        return new Vignette(vignetteId, category, scenarioText, opts);
    }

    public static VignetteDefinition of(Vignette v) {
        VignetteDefinition d = new VignetteDefinition();
        d.vignetteId = v.vignetteId();
        d.category = v.category().orElse(null);
        d.scenarioText = v.scenarioText();
        for (VignetteOption o : v.options()) {
            OptionDefinition od = new OptionDefinition();
            od.optionId = o.optionId();
            od.title = o.title();
            od.description = o.description();
            od.attributes = new LinkedHashMap<>(o.attributes());
            d.options.add(od);
        }
        return d;
    }
}
