package org.calista.elicitation.offline;

import org.calista.elicitation.profile.ProfilePair;
import org.ejml.data.DMatrixRMaj;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Result of {@link StaticDesignBuilder}: pairs shown before and after the adaptive phase,
 * plus the information they accumulate on top of the prior.
 */
public final class StaticDesign {

    private final List<ProfilePair> beginning;
    private final List<ProfilePair> end;
    private final DMatrixRMaj fim;

    StaticDesign(List<ProfilePair> beginning, List<ProfilePair> end, DMatrixRMaj fim) {
        this.beginning = List.copyOf(Objects.requireNonNull(beginning, "beginning"));
        this.end = List.copyOf(Objects.requireNonNull(end, "end"));
        this.fim = Objects.requireNonNull(fim, "fim").copy();
    }

    public List<ProfilePair> beginning() {
        return beginning;
    }

    public List<ProfilePair> end() {
        return end;
    }

    /** Beginning followed by end, in selection order. */
    public List<ProfilePair> all() {
        List<ProfilePair> out = new ArrayList<>(beginning);
        out.addAll(end);
        return out;
    }

    /** Prior information plus every selected pair, evaluated at the prior mean. */
    public DMatrixRMaj fim() {
        return fim.copy();
    }
}
