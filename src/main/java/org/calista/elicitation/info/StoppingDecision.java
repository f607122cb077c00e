package org.calista.elicitation.info;

import java.util.Objects;

/**
 * Outcome of one stopping evaluation: the state, the rule that fired and a readable reason.
 */
public final class StoppingDecision {

    public enum State { CONTINUE, STOP }

    public enum Rule {
        BELOW_MINIMUM,
        MAXIMUM_REACHED,
        INFORMATION_SUFFICIENT,
        UNCERTAINTY_LOW,
        UNCERTAINTY_HIGH,
        CANDIDATES_EXHAUSTED
    }

    private final State state;
    private final Rule rule;
    private final String reason;

    public StoppingDecision(State state, Rule rule, String reason) {
        this.state = Objects.requireNonNull(state, "state");
        this.rule = Objects.requireNonNull(rule, "rule");
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public State state() {
        return state;
    }

    public Rule rule() {
        return rule;
    }

    public String reason() {
        return reason;
    }

    public boolean shouldContinue() {
        return state == State.CONTINUE;
    }

    public boolean isStop() {
        return state == State.STOP;
    }

    @Override
    public String toString() {
        return state + " (" + rule + "): " + reason;
    }
}
