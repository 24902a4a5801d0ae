package com.finplan.core.formula;

import com.finplan.core.model.Driver;
import com.finplan.core.model.Provenance;
import com.finplan.core.model.ValueTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FormulaEvaluatorTest {

    private FormulaEvaluator evaluator;
    private ValueTable table;
    private Map<String, Driver> catalog;

    @BeforeEach
    void setUp() {
        evaluator = new FormulaEvaluator();
        table = new ValueTable();
        catalog = new LinkedHashMap<>();
    }

    private Driver input(String id, String name) {
        var d = Driver.input(id, name, "assumption");
        catalog.put(id, d);
        return d;
    }

    private Driver calculated(String id, String name, String formula, String... deps) {
        var d = Driver.calculated(id, name, formula, List.of(deps), "calculated");
        catalog.put(id, d);
        return d;
    }

    private double eval(Driver driver, int year) {
        return evaluator.evaluate(driver, catalog, year, table);
    }

    @Nested
    @DisplayName("Dependency substitution")
    class Substitution {

        @Test
        @DisplayName("Revenue = Students * Tuition reads both inputs for the target year")
        void multipliesInputs() {
            input("students", "Students");
            input("tuition", "Tuition");
            var revenue = calculated("revenue", "Revenue", "Students * Tuition", "students", "tuition");
            table.put("students", 2025, 500, Provenance.MANUAL);
            table.put("tuition", 2025, 1000, Provenance.MANUAL);

            assertEquals(500_000.0, eval(revenue, 2025));
        }

        @Test
        @DisplayName("longer names are substituted before names they contain")
        void longestNameFirst() {
            input("fee", "Fee");
            input("tuitionFee", "Tuition Fee");
            var total = calculated("total", "Total", "Tuition Fee + Fee", "fee", "tuitionFee");
            table.put("fee", 2026, 5, Provenance.MANUAL);
            table.put("tuitionFee", 2026, 1000, Provenance.MANUAL);

            assertEquals(1005.0, eval(total, 2026));
        }

        @Test
        @DisplayName("a name embedded in a longer identifier is not substituted")
        void wholeWordOnly() {
            input("rate", "Rate");
            var d = calculated("x", "X", "Rates * 2", "rate");
            table.put("rate", 2025, 2, Provenance.MANUAL);

            var e = assertThrows(FormulaEvaluationException.class, () -> eval(d, 2025));
            assertEquals("Rates * 2", e.getFormula());
            assertTrue(e.getMessage().contains("Rates"));
        }

        @Test
        @DisplayName("negative dependency values keep their sign")
        void negativeValues() {
            input("a", "A");
            var d = calculated("x", "X", "10 - A", "a");
            table.put("a", 2025, -5, Provenance.MANUAL);

            assertEquals(15.0, eval(d, 2025));
        }

        @Test
        @DisplayName("values printed in exponent form still parse")
        void largeValues() {
            input("a", "A");
            var d = calculated("x", "X", "A / 1000", "a");
            table.put("a", 2025, 1.0e12, Provenance.MANUAL);

            assertEquals(1.0e9, eval(d, 2025));
        }
    }

    @Nested
    @DisplayName("Year tokens and cross-year references")
    class Years {

        @Test
        @DisplayName("CURRENT_YEAR and PREV_YEAR become numbers")
        void temporalTokens() {
            var d = calculated("x", "X", "CURRENT_YEAR - PREV_YEAR + CURRENT_YEAR - 2000");
            assertEquals(26.0, eval(d, 2025));
        }

        @Test
        @DisplayName("a driver may read its own previous year")
        void selfPreviousYear() {
            input("growth", "Growth");
            var revenue = calculated("revenue", "Revenue", "Revenue[PREV_YEAR] * (1 + Growth)", "growth");
            table.put("revenue", 2024, 100, Provenance.IMPORTED);
            table.put("growth", 2025, 0.1, Provenance.MANUAL);

            assertEquals(110.0, eval(revenue, 2025), 1e-9);
        }

        @Test
        @DisplayName("a dependency may be read at an explicit year")
        void dependencyAtExplicitYear() {
            input("students", "Students");
            var d = calculated("x", "Delta", "Students - Students[2024]", "students");
            table.put("students", 2024, 400, Provenance.IMPORTED);
            table.put("students", 2025, 450, Provenance.MANUAL);

            assertEquals(50.0, eval(d, 2025));
        }

        @Test
        @DisplayName("an unqualified self reference is rejected")
        void unqualifiedSelfReference() {
            var d = calculated("revenue", "Revenue", "Revenue * 2");
            table.put("revenue", 2025, 1, Provenance.MANUAL);

            assertThrows(FormulaEvaluationException.class, () -> eval(d, 2025));
        }

        @Test
        @DisplayName("a self reference to the same year is rejected")
        void sameYearSelfReference() {
            var d = calculated("revenue", "Revenue", "Revenue[CURRENT_YEAR] + 1");
            table.put("revenue", 2025, 1, Provenance.MANUAL);

            assertThrows(FormulaEvaluationException.class, () -> eval(d, 2025));
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("an absent value is never read as zero")
        void missingValue() {
            input("students", "Students");
            var d = calculated("x", "X", "Students * 2", "students");

            var e = assertThrows(MissingDependencyValueException.class, () -> eval(d, 2027));
            assertEquals("students", e.getDriverId());
            assertEquals(2027, e.getYear());
            assertTrue(e.getMessage().contains("Students"));
        }

        @Test
        @DisplayName("a dependency id missing from the catalog is reported as a missing value")
        void unknownDependency() {
            var d = calculated("x", "X", "1 + 1", "ghost");

            var e = assertThrows(MissingDependencyValueException.class, () -> eval(d, 2025));
            assertEquals("ghost", e.getDriverId());
        }

        @Test
        @DisplayName("division by zero fails with the formula text")
        void divisionByZero() {
            input("a", "A");
            input("b", "B");
            var d = calculated("x", "X", "A / B", "a", "b");
            table.put("a", 2025, 10, Provenance.MANUAL);
            table.put("b", 2025, 0, Provenance.MANUAL);

            var e = assertThrows(FormulaEvaluationException.class, () -> eval(d, 2025));
            assertEquals("A / B", e.getFormula());
        }

        @Test
        @DisplayName("syntax errors fail with FormulaEvaluationException")
        void syntaxError() {
            assertThrows(FormulaEvaluationException.class, () -> evaluator.evaluateExpression("2 +"));
            assertThrows(FormulaEvaluationException.class, () -> evaluator.evaluateExpression("(1 + 2"));
            assertThrows(FormulaEvaluationException.class, () -> evaluator.evaluateExpression("1 = 1"));
            assertThrows(FormulaEvaluationException.class, () -> evaluator.evaluateExpression("1 $ 2"));
        }

        @Test
        @DisplayName("a year index outside the int range fails with the formula text")
        void oversizedYearIndex() {
            input("a", "A");
            var d = calculated("x", "X", "A[99999999999]", "a");

            var e = assertThrows(FormulaEvaluationException.class, () -> eval(d, 2025));
            assertEquals("A[99999999999]", e.getFormula());
            assertTrue(e.getMessage().contains("99999999999"));
        }

        @Test
        @DisplayName("ROUND rejects digit counts that overflow the scale")
        void roundOutOfRange() {
            assertThrows(FormulaEvaluationException.class, () -> evaluator.evaluateExpression("ROUND(5, 400)"));
            assertThrows(FormulaEvaluationException.class, () -> evaluator.evaluateExpression("ROUND(5, -400)"));
            assertEquals(2.13, evaluator.evaluateExpression("ROUND(2.125, 2)"), 1e-9);
            assertEquals(1.0E20, evaluator.evaluateExpression("ROUND(1E20)"));
        }

        @Test
        @DisplayName("an empty formula is rejected")
        void emptyFormula() {
            assertThrows(FormulaEvaluationException.class,
                    () -> evaluator.evaluate(" ", null, List.of(), 2025, table));
        }

        @Test
        @DisplayName("host functions are not reachable")
        void unknownFunction() {
            assertThrows(FormulaEvaluationException.class, () -> evaluator.evaluateExpression("exit(1)"));
            assertThrows(FormulaEvaluationException.class, () -> evaluator.evaluateExpression("SQRT(4)"));
        }
    }

    @Nested
    @DisplayName("Expression grammar")
    class Grammar {

        @Test
        @DisplayName("operator precedence and unary minus")
        void precedence() {
            assertEquals(14.0, evaluator.evaluateExpression("2 + 3 * 4"));
            assertEquals(20.0, evaluator.evaluateExpression("(2 + 3) * 4"));
            assertEquals(6.0, evaluator.evaluateExpression("-2 * -3"));
            assertEquals(1.0, evaluator.evaluateExpression("10 - 6 - 3"));
            assertEquals(2.5, evaluator.evaluateExpression("10 / 2 / 2"));
        }

        @Test
        @DisplayName("number literals in decimal and exponent form")
        void literals() {
            assertEquals(1500.001, evaluator.evaluateExpression("1.5E3 + 1e-3"), 1e-9);
            assertEquals(0.5, evaluator.evaluateExpression(".5"));
        }

        @Test
        @DisplayName("comparisons yield 1 or 0")
        void comparisons() {
            assertEquals(1.0, evaluator.evaluateExpression("2 > 1"));
            assertEquals(0.0, evaluator.evaluateExpression("2 <= 1"));
            assertEquals(1.0, evaluator.evaluateExpression("3 == 3"));
            assertEquals(1.0, evaluator.evaluateExpression("3 != 4"));
        }

        @Test
        @DisplayName("whitelisted functions")
        void functions() {
            assertEquals(1.0, evaluator.evaluateExpression("MIN(3, 1, 2)"));
            assertEquals(3.0, evaluator.evaluateExpression("MAX(3, 1, 2)"));
            assertEquals(4.0, evaluator.evaluateExpression("ABS(-4)"));
            assertEquals(3.0, evaluator.evaluateExpression("ROUND(2.5)"));
            assertEquals(3.14, evaluator.evaluateExpression("ROUND(3.14159, 2)"));
            assertEquals(7.0, evaluator.evaluateExpression("IF(1 > 0, 7, 9)"));
        }

        @Test
        @DisplayName("IF evaluates only the selected branch")
        void lazyIf() {
            assertEquals(0.0, evaluator.evaluateExpression("IF(0 == 0, 0, 1 / 0)"));
        }

        @Test
        @DisplayName("wrong arity is rejected")
        void arity() {
            assertThrows(FormulaEvaluationException.class, () -> evaluator.evaluateExpression("ABS(1, 2)"));
            assertThrows(FormulaEvaluationException.class, () -> evaluator.evaluateExpression("IF(1, 2)"));
        }
    }
}
