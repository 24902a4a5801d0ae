package com.finplan.core.statements;

import com.finplan.core.model.ProjectionException;

import java.util.List;

/**
 * Statement configuration is out of range. Carries every violation, not just the first.
 */
public class StatementValidationException extends ProjectionException {

    private final List<String> violations;

    public StatementValidationException(List<String> violations) {
        super("Invalid statement configuration: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
