package org.calista.elicitation.profile;

/**
 * The seven latent job-preference dimensions, in feature-vector index order.
 */
public enum PreferenceDimension {
    FINANCIAL("financial_importance"),
    WORK_ENVIRONMENT("work_environment_importance"),
    CAREER_GROWTH("career_growth_importance"),
    WORK_LIFE_BALANCE("work_life_balance_importance"),
    JOB_SECURITY("job_security_importance"),
    TASK_PREFERENCE("task_preference_importance"),
    VALUES_CULTURE("values_culture_importance");

    public static final int COUNT = 7;

    private final String key;

    PreferenceDimension(String key) {
        this.key = key;
    }

    /** Stable external name (reports, snapshots). */
    public String key() {
        return key;
    }

    public int index() {
        return ordinal();
    }

    public static PreferenceDimension at(int index) {
        return values()[index];
    }
}
