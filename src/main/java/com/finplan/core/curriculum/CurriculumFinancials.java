package com.finplan.core.curriculum;

import java.io.Serializable;

/**
 * Revenue and staff costs of one curriculum in one year.
 *
 * @param curriculum      curriculum identifier
 * @param year            fiscal year
 * @param students        enrolled students
 * @param capacity        seats available
 * @param utilizationPct  students / capacity in percent, 0 without capacity
 * @param tuitionBase     tuition before CPI steps
 * @param tuitionAdjusted tuition after CPI steps
 * @param revenue         students × adjusted tuition
 * @param staffCosts      teacher and non-teacher costs
 */
public record CurriculumFinancials(
    String curriculum,
    int year,
    double students,
    double capacity,
    double utilizationPct,
    double tuitionBase,
    double tuitionAdjusted,
    double revenue,
    StaffCosts staffCosts
) implements Serializable {}
