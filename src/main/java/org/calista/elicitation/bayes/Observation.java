package org.calista.elicitation.bayes;

import java.util.Objects;

/**
 * One answered vignette: which option the respondent picked.
 */
public final class Observation {

    private final String vignetteId;
    private final String chosenOptionId;

    public Observation(String vignetteId, String chosenOptionId) {
        this.vignetteId = Objects.requireNonNull(vignetteId, "vignetteId");
        this.chosenOptionId = Objects.requireNonNull(chosenOptionId, "chosenOptionId");
    }

    public String vignetteId() {
        return vignetteId;
    }

    public String chosenOptionId() {
        return chosenOptionId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Observation)) return false;
        Observation other = (Observation) o;
        return vignetteId.equals(other.vignetteId) && chosenOptionId.equals(other.chosenOptionId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(vignetteId, chosenOptionId);
    }

    @Override
    public String toString() {
        return vignetteId + "->" + chosenOptionId;
    }
}
