package org.calista.elicitation.vignette;

import java.util.Objects;

/**
 * Who the respondent is. Passed through to personalization only; never enters the numeric core.
 */
public final class UserContext {

    private static final UserContext EMPTY = new UserContext("", "", "");

    private final String role;
    private final String industry;
    private final String experienceLevel;

    public UserContext(String role, String industry, String experienceLevel) {
        this.role = (role == null) ? "" : role.trim();
        this.industry = (industry == null) ? "" : industry.trim();
        this.experienceLevel = (experienceLevel == null) ? "" : experienceLevel.trim();
    }

    public static UserContext empty() {
        return EMPTY;
    }

    public String role() {
        return role;
    }

    public String industry() {
        return industry;
    }

    public String experienceLevel() {
        return experienceLevel;
    }

    public boolean isEmpty() {
        return role.isEmpty() && industry.isEmpty() && experienceLevel.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UserContext)) return false;
        UserContext u = (UserContext) o;
        return role.equals(u.role) && industry.equals(u.industry) && experienceLevel.equals(u.experienceLevel);
    }

    @Override
    public int hashCode() {
        return Objects.hash(role, industry, experienceLevel);
    }

    @Override
    public String toString() {
        return "UserContext{role='" + role + "', industry='" + industry + "', experience='" + experienceLevel + "'}";
    }
}
