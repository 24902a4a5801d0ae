package com.finplan.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * A named scalar quantity tracked per year, either supplied as input or derived from a formula.
 *
 * @param id           opaque identifier, unique within a scenario
 * @param name         display name; formulas reference dependencies by this name
 * @param formula      arithmetic formula text, or {@code null} for pure input drivers
 * @param dependencies ids of the drivers this formula reads, in declaration order
 * @param kind         value kind (numeric only)
 * @param category     free-form tag such as "revenue", "cost" or "assumption"
 */
public record Driver(
    String id,
    String name,
    String formula,
    List<String> dependencies,
    ValueKind kind,
    String category
) implements Serializable {

    public Driver {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Driver id must not be blank");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Driver name must not be blank: " + id);
        }
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        kind = kind == null ? ValueKind.NUMERIC : kind;
    }

    /** Input driver without formula. */
    public static Driver input(String id, String name, String category) {
        return new Driver(id, name, null, List.of(), ValueKind.NUMERIC, category);
    }

    public static Driver calculated(String id, String name, String formula,
                                    List<String> dependencies, String category) {
        return new Driver(id, name, formula, dependencies, ValueKind.NUMERIC, category);
    }

    public boolean hasFormula() {
        return formula != null && !formula.isBlank();
    }
}
