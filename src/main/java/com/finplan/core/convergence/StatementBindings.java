package com.finplan.core.convergence;

import java.io.Serializable;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Maps statement lines to the drivers that supply them.
 */
public final class StatementBindings implements Serializable {

    private final Map<StatementLine, String> driverIds;

    private StatementBindings(Map<StatementLine, String> driverIds) {
        this.driverIds = Collections.unmodifiableMap(new EnumMap<>(driverIds));
    }

    public static StatementBindings of(Map<StatementLine, String> driverIds) {
        var copy = new EnumMap<StatementLine, String>(StatementLine.class);
        driverIds.forEach((line, id) -> {
            if (id != null && !id.isBlank()) {
                copy.put(line, id);
            }
        });
        return new StatementBindings(copy);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<String> driverFor(StatementLine line) {
        return Optional.ofNullable(driverIds.get(line));
    }

    public Map<StatementLine, String> asMap() {
        return driverIds;
    }

    @Override
    public String toString() {
        return "StatementBindings" + driverIds;
    }

    public static final class Builder {
        private final Map<StatementLine, String> driverIds = new EnumMap<>(StatementLine.class);

        public Builder bind(StatementLine line, String driverId) {
            driverIds.put(line, driverId);
            return this;
        }

        public StatementBindings build() {
            return StatementBindings.of(driverIds);
        }
    }
}
