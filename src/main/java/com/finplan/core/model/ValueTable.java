package com.finplan.core.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Sparse (driver, year) value store shared by the projection pipeline and the statement engine.
 * <p>
 * A slot is either absent (not computed yet, or no data) or holds a {@link DriverValue} with its
 * provenance. Not thread-safe: one table belongs to one scenario run.
 */
public class ValueTable {

    private final Map<String, Map<Integer, DriverValue>> slots = new LinkedHashMap<>();

    public ValueTable() {
    }

    public ValueTable(Collection<DriverValue> seed) {
        if (seed != null) {
            seed.forEach(this::put);
        }
    }

    public OptionalDouble get(String driverId, int year) {
        var value = find(driverId, year);
        return value.isPresent() ? OptionalDouble.of(value.get().value()) : OptionalDouble.empty();
    }

    public Optional<DriverValue> find(String driverId, int year) {
        var byYear = slots.get(driverId);
        if (byYear == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byYear.get(year));
    }

    public boolean contains(String driverId, int year) {
        return find(driverId, year).isPresent();
    }

    public void put(DriverValue value) {
        slots.computeIfAbsent(value.driverId(), k -> new LinkedHashMap<>()).put(value.year(), value);
    }

    public void put(String driverId, int year, double value, Provenance provenance) {
        put(new DriverValue(driverId, year, value, provenance));
    }

    /**
     * True when the engine may write the slot: it is empty or holds an engine-produced value.
     */
    public boolean isWritable(String driverId, int year) {
        return find(driverId, year).map(v -> v.provenance().isEngineWritable()).orElse(true);
    }

    public List<DriverValue> values() {
        var all = new ArrayList<DriverValue>();
        slots.values().forEach(byYear -> all.addAll(byYear.values()));
        all.sort(Comparator.comparing(DriverValue::driverId).thenComparingInt(DriverValue::year));
        return all;
    }

    public List<DriverValue> valuesWith(Provenance provenance) {
        return values().stream().filter(v -> v.provenance() == provenance).toList();
    }

    public int size() {
        return slots.values().stream().mapToInt(Map::size).sum();
    }

    /** Independent copy; later writes to either table are not visible in the other. */
    public ValueTable copy() {
        var copy = new ValueTable();
        slots.forEach((driverId, byYear) -> copy.slots.put(driverId, new LinkedHashMap<>(byYear)));
        return copy;
    }
}
