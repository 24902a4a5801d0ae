package com.finplan.core.curriculum;

import com.finplan.core.model.DriverValue;
import com.finplan.core.model.Provenance;
import com.finplan.core.model.ValueTable;
import com.finplan.core.model.YearDomain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Derives revenue and staff costs per curriculum and sums them per year.
 *
 * <p>Tuition steps up by CPI every {@code cpiFrequency} years from its base year. Salaries grow by CPI
 * every year from the salary base year. Staff headcount follows enrolment through the teacher and
 * non-teacher ratios.
 */
@Service
public class CurriculumCalculator {

    private static final Logger log = LoggerFactory.getLogger(CurriculumCalculator.class);

    /**
     * {@code baseTuition × (1 + cpiRate)^floor((year − baseYear) / frequency)}.
     */
    public static double tuitionWithCpi(double baseTuition, int year, int baseYear, int frequency, double cpiRate) {
        return baseTuition * Math.pow(1 + cpiRate, Math.floorDiv(year - baseYear, frequency));
    }

    public static double salaryWithCpi(double baseSalary, int year, int baseYear, double cpiRate) {
        return baseSalary * Math.pow(1 + cpiRate, year - baseYear);
    }

    public CurriculumFinancials financials(CurriculumYear data, CurriculumSalaries salaries, double cpiRate,
                                           int salaryBaseYear) {
        double tuition = tuitionWithCpi(data.tuition(), data.year(), data.cpiBaseYear(), data.cpiFrequency(), cpiRate);
        double teacherSalary = salaryWithCpi(salaries.teacher(), data.year(), salaryBaseYear, cpiRate);
        double nonTeacherSalary = salaryWithCpi(salaries.nonTeacher(), data.year(), salaryBaseYear, cpiRate);
        var staff = StaffCosts.of(
                data.students() * data.teacherRatio() * teacherSalary,
                data.students() * data.nonTeacherRatio() * nonTeacherSalary);
        double utilization = data.capacity() > 0 ? data.students() / data.capacity() * 100 : 0;
        return new CurriculumFinancials(data.curriculum(), data.year(), data.students(), data.capacity(),
                utilization, data.tuition(), tuition, data.students() * tuition, staff);
    }

    /**
     * Sums curricula of a single year.
     *
     * @throws CurriculumValidationException if the entries span several years or a curriculum has no salaries
     */
    public CurriculumAggregate aggregate(List<CurriculumYear> curricula, Map<String, CurriculumSalaries> salaries,
                                         double cpiRate, int salaryBaseYear) {
        if (curricula.isEmpty()) {
            throw new CurriculumValidationException(List.of("No curricula to aggregate"));
        }
        int year = curricula.get(0).year();
        var errors = new ArrayList<String>();
        for (var c : curricula) {
            if (c.year() != year) {
                errors.add("Year mismatch: " + curricula.get(0).curriculum() + "=" + year
                        + ", " + c.curriculum() + "=" + c.year());
            }
            if (!salaries.containsKey(c.curriculum())) {
                errors.add("No salaries for curriculum " + c.curriculum());
            }
        }
        if (!errors.isEmpty()) {
            throw new CurriculumValidationException(errors);
        }

        var financials = new ArrayList<CurriculumFinancials>(curricula.size());
        double revenue = 0;
        double students = 0;
        double capacity = 0;
        double staff = 0;
        for (var c : curricula) {
            var f = financials(c, salaries.get(c.curriculum()), cpiRate, salaryBaseYear);
            financials.add(f);
            revenue += f.revenue();
            students += f.students();
            capacity += f.capacity();
            staff += f.staffCosts().total();
        }
        double utilization = capacity > 0 ? students / capacity * 100 : 0;
        return new CurriculumAggregate(year, revenue, students, capacity, utilization, staff, financials);
    }

    /**
     * Aggregates every year that all curricula of the plan cover, ascending.
     *
     * @throws CurriculumValidationException listing every invalid entry
     */
    public List<CurriculumAggregate> project(CurriculumPlan plan, YearDomain domain) {
        var errors = new ArrayList<String>();
        Map<String, Map<Integer, CurriculumYear>> byCurriculum = new LinkedHashMap<>();
        for (var entry : plan.years()) {
            errors.addAll(entry.validate(domain));
            var years = byCurriculum.computeIfAbsent(entry.curriculum(), k -> new TreeMap<>());
            if (years.put(entry.year(), entry) != null) {
                errors.add(entry.curriculum() + " " + entry.year() + ": Duplicate entry");
            }
        }
        if (!errors.isEmpty()) {
            throw new CurriculumValidationException(errors);
        }

        var results = new ArrayList<CurriculumAggregate>();
        if (byCurriculum.isEmpty()) {
            return results;
        }
        var common = new TreeMap<>(byCurriculum.values().iterator().next());
        byCurriculum.values().forEach(years -> common.keySet().retainAll(years.keySet()));
        for (int year : common.keySet()) {
            var entries = byCurriculum.values().stream().map(years -> years.get(year)).toList();
            results.add(aggregate(entries, plan.salaries(), plan.cpiRate(year), plan.salaryBaseYear()));
        }
        log.debug("Aggregated {} curricula over {} common years", byCurriculum.size(), results.size());
        return results;
    }

    /**
     * Writes total revenue and staff costs into the plan's drivers as {@link Provenance#CALCULATED}.
     * Historical years and immutable slots are left untouched.
     */
    public List<DriverValue> writeTo(CurriculumPlan plan, List<CurriculumAggregate> aggregates, ValueTable table,
                                     YearDomain domain) {
        var written = new ArrayList<DriverValue>();
        for (var a : aggregates) {
            if (domain.isHistorical(a.year())) {
                continue;
            }
            write(plan.revenueDriverId(), a.year(), a.totalRevenue(), table, written);
            write(plan.staffCostDriverId(), a.year(), a.totalStaffCosts(), table, written);
        }
        log.info("Wrote {} curriculum values", written.size());
        return written;
    }

    private static void write(String driverId, int year, double amount, ValueTable table, List<DriverValue> written) {
        if (driverId == null || !table.isWritable(driverId, year)) {
            return;
        }
        var value = new DriverValue(driverId, year, amount, Provenance.CALCULATED);
        table.put(value);
        written.add(value);
    }
}
