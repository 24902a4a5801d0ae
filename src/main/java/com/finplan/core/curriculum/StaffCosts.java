package com.finplan.core.curriculum;

import java.io.Serializable;

/**
 * @param teacherCosts    students × teacher ratio × teacher salary
 * @param nonTeacherCosts students × non-teacher ratio × non-teacher salary
 * @param total           sum of both
 */
public record StaffCosts(double teacherCosts, double nonTeacherCosts, double total) implements Serializable {

    public static StaffCosts of(double teacherCosts, double nonTeacherCosts) {
        return new StaffCosts(teacherCosts, nonTeacherCosts, teacherCosts + nonTeacherCosts);
    }
}
