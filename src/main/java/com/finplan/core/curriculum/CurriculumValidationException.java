package com.finplan.core.curriculum;

import com.finplan.core.model.ProjectionException;

import java.util.List;

public class CurriculumValidationException extends ProjectionException {

    private final List<String> violations;

    public CurriculumValidationException(List<String> violations) {
        super("Invalid curriculum data: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
