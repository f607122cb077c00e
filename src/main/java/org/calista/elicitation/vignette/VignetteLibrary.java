package org.calista.elicitation.vignette;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The three ordered vignette lists of a study plus an id index.
 *
 * <p>Immutable; vignette ids are unique across all three lists.</p>
 */
public final class VignetteLibrary {

    private final List<Vignette> staticBeginning;
    private final List<Vignette> adaptive;
    private final List<Vignette> staticEnd;
    private final Map<String, Vignette> byId;

    public VignetteLibrary(List<Vignette> staticBeginning, List<Vignette> adaptive, List<Vignette> staticEnd) {
        this.staticBeginning = List.copyOf(Objects.requireNonNull(staticBeginning, "staticBeginning"));
        this.adaptive = List.copyOf(Objects.requireNonNull(adaptive, "adaptive"));
        this.staticEnd = List.copyOf(Objects.requireNonNull(staticEnd, "staticEnd"));

        Map<String, Vignette> idx = new LinkedHashMap<>();
        for (List<Vignette> list : List.of(this.staticBeginning, this.adaptive, this.staticEnd)) {
            for (Vignette v : list) {
                if (idx.putIfAbsent(v.vignetteId(), v) != null) {
                    throw new IllegalArgumentException("duplicate vignette id: " + v.vignetteId());
                }
            }
        }
        this.byId = Collections.unmodifiableMap(idx);
    }

    public static VignetteLibrary empty() {
        return new VignetteLibrary(List.of(), List.of(), List.of());
    }

    public List<Vignette> staticBeginning() {
        return staticBeginning;
    }

    public List<Vignette> adaptive() {
        return adaptive;
    }

    public List<Vignette> staticEnd() {
        return staticEnd;
    }

    public Optional<Vignette> find(String vignetteId) {
        return Optional.ofNullable(byId.get(vignetteId));
    }

    public boolean contains(String vignetteId) {
        return byId.containsKey(vignetteId);
    }

    public boolean isStaticBeginning(String vignetteId) {
        Vignette v = byId.get(vignetteId);
        return v != null && staticBeginning.contains(v);
    }

    public boolean isAdaptive(String vignetteId) {
        Vignette v = byId.get(vignetteId);
        return v != null && adaptive.contains(v);
    }

    public boolean isStaticEnd(String vignetteId) {
        Vignette v = byId.get(vignetteId);
        return v != null && staticEnd.contains(v);
    }

    /** All vignettes: beginning, adaptive, end. */
    public List<Vignette> all() {
        return new ArrayList<>(byId.values());
    }

    public int size() {
        return byId.size();
    }

    @Override
    public String toString() {
        return "VignetteLibrary{staticBeginning=" + staticBeginning.size()
                + ", adaptive=" + adaptive.size()
                + ", staticEnd=" + staticEnd.size() + "}";
    }
}
