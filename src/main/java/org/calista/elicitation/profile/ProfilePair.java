package org.calista.elicitation.profile;

import org.calista.elicitation.math.Matrices;

import java.util.Objects;

/**
 * Candidate vignette before conversion: option A and option B profiles.
 */
public final class ProfilePair {

    private final Profile a;
    private final Profile b;

    public ProfilePair(Profile a, Profile b) {
        this.a = Objects.requireNonNull(a, "a");
        this.b = Objects.requireNonNull(b, "b");
    }

    public Profile a() {
        return a;
    }

    public Profile b() {
        return b;
    }

    /** f(a) - f(b) */
    public double[] delta() {
        return Matrices.subtract(a.features(), b.features());
    }

    /** Same two profiles regardless of order. */
    public boolean sameProfilesAs(ProfilePair other) {
        if (other == null) return false;
        return (a.equals(other.a) && b.equals(other.b)) || (a.equals(other.b) && b.equals(other.a));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProfilePair)) return false;
        ProfilePair p = (ProfilePair) o;
        return a.equals(p.a) && b.equals(p.b);
    }

    @Override
    public int hashCode() {
        return 31 * a.hashCode() + b.hashCode();
    }

    @Override
    public String toString() {
        return "ProfilePair{a=" + a.attributes() + ", b=" + b.attributes() + "}";
    }
}
