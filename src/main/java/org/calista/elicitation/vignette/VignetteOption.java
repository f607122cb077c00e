package org.calista.elicitation.vignette;

import org.calista.elicitation.profile.FeatureEncoder;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One of the two alternatives of a {@link Vignette}. Immutable.
 */
public final class VignetteOption {

    private final String optionId;
    private final String title;
    private final String description;
    private final Map<String, Double> attributes;
    private final double[] features;

    public VignetteOption(String optionId, String title, String description, Map<String, Double> attributes) {
        this.optionId = requireText(optionId, "optionId");
        this.title = (title == null) ? "" : title;
        this.description = (description == null) ? "" : description;
        Objects.requireNonNull(attributes, "attributes");
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        this.features = FeatureEncoder.encode(this.attributes);
    }

    public String optionId() {
        return optionId;
    }

    public String title() {
        return title;
    }

    public String description() {
        return description;
    }

    public Map<String, Double> attributes() {
        return attributes;
    }

    /** Encoded feature vector (copy). */
    public double[] features() {
        return Arrays.copyOf(features, features.length);
    }

    public VignetteOption withText(String newTitle, String newDescription) {
        return new VignetteOption(optionId, newTitle, newDescription, attributes);
    }

    static String requireText(String s, String name) {
        Objects.requireNonNull(s, name);
        if (s.isBlank()) throw new IllegalArgumentException(name + " is blank");
        return s;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VignetteOption)) return false;
        VignetteOption other = (VignetteOption) o;
        return optionId.equals(other.optionId)
                && title.equals(other.title)
                && description.equals(other.description)
                && attributes.equals(other.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(optionId, title, description, attributes);
    }

    @Override
    public String toString() {
        return "VignetteOption{" + optionId + ", " + attributes + "}";
    }
}
