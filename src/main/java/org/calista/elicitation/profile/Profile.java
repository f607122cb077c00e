package org.calista.elicitation.profile;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable job profile: attribute name to raw level, with its encoded feature vector.
 */
public final class Profile {

    private final Map<String, Double> attributes;
    private final double[] features;

    public Profile(Map<String, Double> attributes) {
        Objects.requireNonNull(attributes, "attributes");
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        this.features = FeatureEncoder.encode(this.attributes);
    }

    public Map<String, Double> attributes() {
        return attributes;
    }

    public double get(String name, double fallback) {
        Double v = attributes.get(name);
        return (v == null) ? fallback : v;
    }

    /** Copy of the encoded feature vector. */
    public double[] features() {
        return Arrays.copyOf(features, features.length);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Profile)) return false;
        return attributes.equals(((Profile) o).attributes);
    }

    @Override
    public int hashCode() {
        return attributes.hashCode();
    }

    @Override
    public String toString() {
        return "Profile" + attributes;
    }
}
