package com.finplan.core.curriculum;

import com.finplan.core.model.YearDomain;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Intake and staffing of one curriculum in one year.
 *
 * @param curriculum      curriculum identifier, e.g. {@code FR} or {@code IB}
 * @param year            fiscal year
 * @param capacity        seats available
 * @param students        enrolled students
 * @param tuition         tuition per student before CPI steps
 * @param teacherRatio    teachers per student, e.g. 0.15
 * @param nonTeacherRatio non-teaching staff per student
 * @param cpiFrequency    tuition is stepped up by CPI every this many years (1, 2 or 3)
 * @param cpiBaseYear     year the base tuition refers to
 */
public record CurriculumYear(
    String curriculum,
    int year,
    double capacity,
    double students,
    double tuition,
    double teacherRatio,
    double nonTeacherRatio,
    int cpiFrequency,
    int cpiBaseYear
) implements Serializable {

    /** Every problem with this entry, empty when valid. */
    public List<String> validate(YearDomain domain) {
        var errors = new ArrayList<String>();
        String prefix = curriculum + " " + year + ": ";
        if (curriculum == null || curriculum.isBlank()) {
            errors.add(prefix + "Curriculum identifier is required");
        }
        if (capacity <= 0) {
            errors.add(prefix + "Capacity must be greater than 0");
        }
        if (students < 0) {
            errors.add(prefix + "Students cannot be negative");
        }
        if (students > capacity) {
            errors.add(prefix + "Students cannot exceed capacity");
        }
        if (tuition <= 0) {
            errors.add(prefix + "Tuition must be greater than 0");
        }
        if (teacherRatio <= 0 || teacherRatio >= 1) {
            errors.add(prefix + "Teacher ratio must be between 0 and 1");
        }
        if (nonTeacherRatio <= 0 || nonTeacherRatio >= 1) {
            errors.add(prefix + "Non-teacher ratio must be between 0 and 1");
        }
        if (cpiFrequency < 1 || cpiFrequency > 3) {
            errors.add(prefix + "CPI frequency must be 1, 2, or 3 years");
        }
        if (year < domain.firstYear() || year > domain.lastYear()) {
            errors.add(prefix + "Year must be between " + domain.firstYear() + " and " + domain.lastYear());
        }
        return errors;
    }
}
