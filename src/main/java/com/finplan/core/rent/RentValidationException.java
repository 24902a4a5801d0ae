package com.finplan.core.rent;

import com.finplan.core.model.ProjectionException;

import java.util.List;

public class RentValidationException extends ProjectionException {

    private final List<String> violations;

    public RentValidationException(RentModelType type, List<String> violations) {
        super("Invalid " + type + " rent model: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
