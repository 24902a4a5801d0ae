package com.finplan.core.curriculum;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Totals of every curriculum in one year.
 *
 * @param year            fiscal year
 * @param totalRevenue    revenue summed over curricula
 * @param totalStudents   students summed over curricula
 * @param totalCapacity   capacity summed over curricula
 * @param utilizationPct  total students / total capacity in percent, 0 without capacity
 * @param totalStaffCosts staff costs summed over curricula
 * @param curricula       per-curriculum figures in input order
 */
public record CurriculumAggregate(
    int year,
    double totalRevenue,
    double totalStudents,
    double totalCapacity,
    double utilizationPct,
    double totalStaffCosts,
    List<CurriculumFinancials> curricula
) implements Serializable {

    public CurriculumAggregate {
        curricula = List.copyOf(curricula);
    }

    public Map<String, Double> revenueByCurriculum() {
        var map = new LinkedHashMap<String, Double>();
        curricula.forEach(c -> map.put(c.curriculum(), c.revenue()));
        return map;
    }

    public Map<String, Double> studentsByCurriculum() {
        var map = new LinkedHashMap<String, Double>();
        curricula.forEach(c -> map.put(c.curriculum(), c.students()));
        return map;
    }

    public Map<String, Double> staffCostsByCurriculum() {
        var map = new LinkedHashMap<String, Double>();
        curricula.forEach(c -> map.put(c.curriculum(), c.staffCosts().total()));
        return map;
    }

    /** Revenue per student across curricula, 0 without students. */
    public double averageTuition() {
        return totalStudents == 0 ? 0 : totalRevenue / totalStudents;
    }

    public double staffCostPerStudent() {
        return totalStudents == 0 ? 0 : totalStaffCosts / totalStudents;
    }

    /** Revenue per square metre of built-up area, 0 when the area is 0. */
    public double revenuePerSqm(double buaSize) {
        return buaSize == 0 ? 0 : totalRevenue / buaSize;
    }
}
