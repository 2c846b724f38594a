package com.libragraph.keeper.core.error;

import java.util.List;

/**
 * Raised before any service is started when identities are empty or not unique.
 * Carries every violation found, not just the first.
 */
public class ServiceValidationException extends SupervisorException {

    private final List<String> violations;

    public ServiceValidationException(List<String> violations) {
        super("invalid service: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> violations() {
        return violations;
    }
}
