package com.finplan.core.formula;

/**
 * A driver a formula may reference by display name.
 *
 * @param driverId id of the referenced driver
 * @param name     display name as written in formulas; {@code null} when the id is unknown to the catalog
 */
public record FormulaReference(String driverId, String name) {

    public boolean isResolved() {
        return name != null && !name.isBlank();
    }
}
