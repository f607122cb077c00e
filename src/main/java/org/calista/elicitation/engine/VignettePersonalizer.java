package org.calista.elicitation.engine;

import org.calista.elicitation.vignette.UserContext;
import org.calista.elicitation.vignette.Vignette;

/**
 * Rewrites the presentation text of a vignette for a respondent (e.g. an external LLM call).
 *
 * <p>Implementations may only change text; the vignette id, option ids and attributes must be kept.
 * Calls run off the session thread and see only immutable inputs.</p>
 */
@FunctionalInterface
public interface VignettePersonalizer {

    Vignette personalize(Vignette base, UserContext context) throws Exception;

    static VignettePersonalizer identity() {
        return (base, context) -> base;
    }
}
