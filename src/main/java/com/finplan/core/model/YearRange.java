package com.finplan.core.model;

import java.io.Serializable;
import java.util.stream.IntStream;

/**
 * Inclusive range of years.
 */
public record YearRange(int start, int end) implements Serializable {

    public YearRange {
        if (end < start) {
            throw new IllegalArgumentException("Year range end " + end + " is before start " + start);
        }
    }

    public static YearRange of(int start, int end) {
        return new YearRange(start, end);
    }

    public boolean contains(int year) {
        return year >= start && year <= end;
    }

    public int size() {
        return end - start + 1;
    }

    public IntStream years() {
        return IntStream.rangeClosed(start, end);
    }
}
