package org.calista.elicitation.core;

import java.util.List;

/**
 * Invalid or unreadable configuration. Fatal at startup: the engine refuses to run on a bad model.
 */
public final class ConfigurationException extends RuntimeException {

    private final List<String> violations;

    public ConfigurationException(List<String> violations) {
        super("Invalid adaptive configuration: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
        this.violations = List.of(message);
    }

    public List<String> violations() {
        return violations;
    }
}
