package com.finplan.core.formula;

import com.finplan.core.model.Driver;
import com.finplan.core.model.ValueTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Evaluates a driver formula for one target year.
 *
 * <p>Evaluation runs in three passes over the formula text:
 * <ol>
 *   <li>{@code PREV_YEAR} and {@code CURRENT_YEAR} become {@code year - 1} and {@code year};</li>
 *   <li>each dependency display name, longest first, becomes its value from the {@link ValueTable}.
 *       A name followed by {@code [yyyy]} reads that year instead of the target year;</li>
 *   <li>the remaining closed expression is parsed and evaluated by {@link FormulaParser}.</li>
 * </ol>
 * A driver may reference itself only year-qualified and only for an earlier year.
 */
@Service
public class FormulaEvaluator {

    private static final Logger log = LoggerFactory.getLogger(FormulaEvaluator.class);

    private static final String WORD_BEFORE = "(?<![A-Za-z0-9_])";
    private static final String WORD_AFTER = "(?![A-Za-z0-9_])";
    private static final String YEAR_SUFFIX = "(\\s*\\[\\s*(-?\\d+)\\s*\\])?";
    private static final Pattern PREV_YEAR = Pattern.compile(WORD_BEFORE + "PREV_YEAR" + WORD_AFTER);
    private static final Pattern CURRENT_YEAR = Pattern.compile(WORD_BEFORE + "CURRENT_YEAR" + WORD_AFTER);

    /**
     * Evaluates {@code driver}'s formula, resolving its declared dependency ids against {@code catalog}.
     * A dependency id missing from the catalog fails with {@link MissingDependencyValueException}.
     */
    public double evaluate(Driver driver, Map<String, Driver> catalog, int year, ValueTable table) {
        var references = new ArrayList<FormulaReference>();
        for (String depId : driver.dependencies()) {
            Driver dep = catalog.get(depId);
            references.add(new FormulaReference(depId, dep != null ? dep.name() : null));
        }
        return evaluate(driver.formula(), new FormulaReference(driver.id(), driver.name()), references, year, table);
    }

    /**
     * @param formula      formula text as authored
     * @param self         the driver owning the formula, or {@code null} for an anonymous expression
     * @param dependencies declared dependencies in declaration order
     * @param year         target year
     * @param table        values visible to the formula
     * @return the finite result
     * @throws MissingDependencyValueException when a referenced slot is absent
     * @throws FormulaEvaluationException      when the text is not a valid expression or is not finite
     */
    public double evaluate(String formula, FormulaReference self, List<FormulaReference> dependencies,
                           int year, ValueTable table) {
        if (formula == null || formula.isBlank()) {
            throw new FormulaEvaluationException(String.valueOf(formula), "formula is empty");
        }
        for (FormulaReference dep : dependencies) {
            if (!dep.isResolved()) {
                throw new MissingDependencyValueException(dep.driverId(), null, year);
            }
        }

        String text = PREV_YEAR.matcher(formula).replaceAll(String.valueOf(year - 1));
        text = CURRENT_YEAR.matcher(text).replaceAll(String.valueOf(year));

        var ordered = new ArrayList<FormulaReference>(dependencies);
        if (self != null && self.isResolved()) {
            ordered.add(self);
        }
        ordered.sort(Comparator.comparingInt((FormulaReference r) -> r.name().length()).reversed());

        for (FormulaReference ref : ordered) {
            boolean isSelf = self != null && ref == self;
            text = substitute(formula, text, ref, isSelf, year, table);
        }

        log.trace("Formula '{}' for {} reduced to '{}'", formula, year, text);
        return evaluateExpression(formula, text);
    }

    /**
     * Evaluates a closed arithmetic expression with no driver references.
     */
    public double evaluateExpression(String expression) {
        return evaluateExpression(expression, expression);
    }

    private double evaluateExpression(String formula, String closed) {
        try {
            return FormulaParser.parse(closed).evaluate();
        } catch (FormulaSyntaxException e) {
            throw new FormulaEvaluationException(formula, e.getMessage(), e);
        }
    }

    private String substitute(String formula, String text, FormulaReference ref, boolean isSelf,
                              int year, ValueTable table) {
        Pattern pattern = Pattern.compile(WORD_BEFORE + Pattern.quote(ref.name()) + WORD_AFTER + YEAR_SUFFIX);
        Matcher matcher = pattern.matcher(text);
        var out = new StringBuilder();
        while (matcher.find()) {
            int targetYear = year;
            if (matcher.group(2) != null) {
                try {
                    targetYear = Integer.parseInt(matcher.group(2));
                } catch (NumberFormatException e) {
                    throw new FormulaEvaluationException(formula, "invalid year '" + matcher.group(2) + "'", e);
                }
            }
            if (isSelf && (matcher.group(2) == null || targetYear >= year)) {
                throw new FormulaEvaluationException(formula,
                        "driver '" + ref.name() + "' may only reference its own earlier years");
            }
            final int lookupYear = targetYear;
            double value = table.get(ref.driverId(), lookupYear).orElseThrow(
                    () -> new MissingDependencyValueException(ref.driverId(), ref.name(), lookupYear));
            matcher.appendReplacement(out, Matcher.quoteReplacement("(" + value + ")"));
        }
        matcher.appendTail(out);
        return out.toString();
    }
}
