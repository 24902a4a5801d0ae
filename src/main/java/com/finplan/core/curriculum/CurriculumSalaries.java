package com.finplan.core.curriculum;

import java.io.Serializable;

/**
 * Base-year salaries of a curriculum's staff.
 *
 * @param teacher    teacher salary in the salary base year
 * @param nonTeacher non-teaching staff salary in the salary base year
 */
public record CurriculumSalaries(double teacher, double nonTeacher) implements Serializable {}
