package org.calista.elicitation.engine;

/**
 * Session phases, in the order a respondent goes through them.
 */
public enum Phase {
    STATIC_BEGINNING,
    ADAPTIVE,
    STATIC_END,
    COMPLETE
}
