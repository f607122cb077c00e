package org.calista.elicitation.profile;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * The attribute universe profiles are drawn from ({@code preference_parameters.json}).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class DesignSpace {

    public static final String DEFAULT_RESOURCE = "preference_parameters.json";

    public List<AttributeSpec> attributes = new ArrayList<>();

    /** attribute -> positive|negative|neutral (documentation only; dominance works on encoded features). */
    @JsonProperty("attribute_directions")
    public Map<String, String> attributeDirections = new LinkedHashMap<>();

    public void validate() {
        if (attributes == null || attributes.isEmpty()) throw new IllegalArgumentException("design space has no attributes");
        Set<String> seen = new HashSet<>();
        for (AttributeSpec a : attributes) {
            Objects.requireNonNull(a, "attribute");
            a.validate();
            if (!seen.add(a.name)) throw new IllegalArgumentException("duplicate attribute: " + a.name);
        }
        if (attributeDirections == null) attributeDirections = new LinkedHashMap<>();
    }

    public Optional<AttributeSpec> attribute(String name) {
        for (AttributeSpec a : attributes) {
            if (a.name.equals(name)) return Optional.of(a);
        }
        return Optional.empty();
    }

    /** Product of per-attribute level counts. */
    public long totalCombinations() {
        long total = 1L;
        for (AttributeSpec a : attributes) total *= a.values().size();
        return total;
    }

    public static DesignSpace read(ObjectMapper mapper, InputStream in) throws IOException {
        Objects.requireNonNull(mapper, "mapper");
        Objects.requireNonNull(in, "in");
        DesignSpace ds = mapper.readValue(in, DesignSpace.class);
        try {
            ds.validate();
        } catch (IllegalArgumentException e) {
            throw new IOException("invalid design space: " + e.getMessage(), e);
        }
        return ds;
    }

    public static DesignSpace fromClasspath(ObjectMapper mapper) throws IOException {
        try (InputStream in = DesignSpace.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) throw new IOException("classpath resource not found: " + DEFAULT_RESOURCE);
            return read(mapper, in);
        }
    }
}
