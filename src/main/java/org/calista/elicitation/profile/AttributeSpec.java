package org.calista.elicitation.profile;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * One attribute of the job design space, as declared in {@code preference_parameters.json}.
 *
 * <p>Ordered attributes enumerate their numeric levels; binary attributes always take 0 (base level)
 * or 1 (alternative level) and their two labels are indexed by that value.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class AttributeSpec {

    public static final String ORDERED = "ordered";
    public static final String BINARY = "binary";

    public String name;
    public String label;
    /** ordered|binary ("categorical" is accepted as binary). */
    public String type = BINARY;
    public List<Level> levels = new ArrayList<>();

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Level {
        public double value;
        public String label;

        public Level() {}

        public Level(double value, String label) {
            this.value = value;
            this.label = label;
        }
    }

    public AttributeSpec() {}

    public AttributeSpec(String name, String label, String type, List<Level> levels) {
        this.name = name;
        this.label = label;
        this.type = type;
        this.levels = new ArrayList<>(levels);
    }

    public void validate() {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("attribute.name is required");
        if (label == null || label.isBlank()) label = name;
        type = (type == null) ? BINARY : type.trim().toLowerCase(Locale.ROOT);
        if ("categorical".equals(type)) type = BINARY;
        if (!ORDERED.equals(type) && !BINARY.equals(type)) {
            throw new IllegalArgumentException("attribute '" + name + "': unknown type " + type);
        }
        if (levels == null || levels.isEmpty()) throw new IllegalArgumentException("attribute '" + name + "': levels are required");
        if (BINARY.equals(type) && levels.size() != 2) {
            throw new IllegalArgumentException("attribute '" + name + "': binary attributes need exactly 2 levels, got " + levels.size());
        }
    }

    public boolean isOrdered() {
        return ORDERED.equals(type);
    }

    /** Raw values this attribute can take inside a profile. */
    public List<Double> values() {
        List<Double> out = new ArrayList<>(levels.size());
        if (isOrdered()) {
            for (Level l : levels) out.add(l.value);
        } else {
            out.add(0.0);
            out.add(1.0);
        }
        return out;
    }

    public double range() {
        List<Double> v = values();
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double x : v) {
            min = Math.min(min, x);
            max = Math.max(max, x);
        }
        return max - min;
    }

    public Optional<String> labelFor(double value) {
        if (isOrdered()) {
            for (Level l : levels) {
                if (Double.compare(l.value, value) == 0) return Optional.ofNullable(l.label);
            }
            return Optional.empty();
        }
        int idx = (int) Math.round(value);
        if (idx < 0 || idx >= levels.size()) return Optional.empty();
        return Optional.ofNullable(levels.get(idx).label);
    }
}
