package com.finplan.core.curriculum;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * Curricula of a school over several years and the drivers their totals feed.
 *
 * @param years             one entry per (curriculum, year)
 * @param salaries          base salaries per curriculum identifier
 * @param cpiRates          CPI rate per year; a missing year means 0
 * @param salaryBaseYear    year the base salaries refer to
 * @param revenueDriverId   driver receiving total revenue, {@code null} to skip
 * @param staffCostDriverId driver receiving total staff costs, {@code null} to skip
 */
public record CurriculumPlan(
    List<CurriculumYear> years,
    Map<String, CurriculumSalaries> salaries,
    Map<Integer, Double> cpiRates,
    int salaryBaseYear,
    String revenueDriverId,
    String staffCostDriverId
) implements Serializable {

    public CurriculumPlan {
        years = years == null ? List.of() : List.copyOf(years);
        salaries = salaries == null ? Map.of() : Map.copyOf(salaries);
        cpiRates = cpiRates == null ? Map.of() : Map.copyOf(cpiRates);
    }

    public double cpiRate(int year) {
        return cpiRates.getOrDefault(year, 0.0);
    }
}
