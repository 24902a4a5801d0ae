package com.finplan.core.formula;

import java.util.List;
import java.util.function.DoubleBinaryOperator;

/**
 * Parsed expression tree. Every node checks that it produces a finite number.
 */
sealed interface FormulaNode {

    double evaluate();

    private static double finite(double value, String what) {
        if (!Double.isFinite(value)) {
            throw new FormulaSyntaxException(what + " produced a non-finite result (" + value + ")");
        }
        return value;
    }

    record Literal(double value) implements FormulaNode {
        @Override
        public double evaluate() {
            return finite(value, "Literal");
        }
    }

    record Negate(FormulaNode operand) implements FormulaNode {
        @Override
        public double evaluate() {
            return -operand.evaluate();
        }
    }

    record Binary(Operator operator, FormulaNode left, FormulaNode right) implements FormulaNode {
        @Override
        public double evaluate() {
            double l = left.evaluate();
            double r = right.evaluate();
            if (operator == Operator.DIVIDE && r == 0.0) {
                throw new FormulaSyntaxException("Division by zero");
            }
            return finite(operator.apply(l, r), "Operator '" + operator.symbol + "'");
        }
    }

    record Call(Function function, List<FormulaNode> arguments) implements FormulaNode {
        @Override
        public double evaluate() {
            return finite(function.apply(arguments), function.name());
        }
    }

    enum Operator {
        ADD("+", (a, b) -> a + b),
        SUBTRACT("-", (a, b) -> a - b),
        MULTIPLY("*", (a, b) -> a * b),
        DIVIDE("/", (a, b) -> a / b),
        LESS("<", (a, b) -> a < b ? 1 : 0),
        LESS_EQUAL("<=", (a, b) -> a <= b ? 1 : 0),
        GREATER(">", (a, b) -> a > b ? 1 : 0),
        GREATER_EQUAL(">=", (a, b) -> a >= b ? 1 : 0),
        EQUAL("==", (a, b) -> a == b ? 1 : 0),
        NOT_EQUAL("!=", (a, b) -> a != b ? 1 : 0);

        private final String symbol;
        private final DoubleBinaryOperator op;

        Operator(String symbol, DoubleBinaryOperator op) {
            this.symbol = symbol;
            this.op = op;
        }

        double apply(double a, double b) {
            return op.applyAsDouble(a, b);
        }
    }

    /** Whitelisted pure functions. IF evaluates only the selected branch. */
    enum Function {
        MIN(2, -1) {
            @Override
            double apply(List<FormulaNode> args) {
                return args.stream().mapToDouble(FormulaNode::evaluate).min().orElseThrow();
            }
        },
        MAX(2, -1) {
            @Override
            double apply(List<FormulaNode> args) {
                return args.stream().mapToDouble(FormulaNode::evaluate).max().orElseThrow();
            }
        },
        ABS(1, 1) {
            @Override
            double apply(List<FormulaNode> args) {
                return Math.abs(args.get(0).evaluate());
            }
        },
        ROUND(1, 2) {
            @Override
            double apply(List<FormulaNode> args) {
                double value = args.get(0).evaluate();
                if (args.size() == 1) {
                    return roundHalfUp(value);
                }
                double digits = args.get(1).evaluate();
                double scale = Math.pow(10, Math.rint(digits));
                double scaled = value * scale;
                if (!Double.isFinite(digits) || scale == 0.0 || !Double.isFinite(scale) || !Double.isFinite(scaled)) {
                    throw new FormulaSyntaxException("ROUND digits out of range: " + digits);
                }
                return roundHalfUp(scaled) / scale;
            }
        },
        IF(3, 3) {
            @Override
            double apply(List<FormulaNode> args) {
                return args.get(0).evaluate() != 0 ? args.get(1).evaluate() : args.get(2).evaluate();
            }
        };

        private final int minArgs;
        private final int maxArgs;

        Function(int minArgs, int maxArgs) {
            this.minArgs = minArgs;
            this.maxArgs = maxArgs;
        }

        abstract double apply(List<FormulaNode> args);

        void checkArity(int count) {
            if (count < minArgs || (maxArgs >= 0 && count > maxArgs)) {
                String expected = maxArgs < 0 ? "at least " + minArgs
                        : minArgs == maxArgs ? String.valueOf(minArgs) : minArgs + " to " + maxArgs;
                throw new FormulaSyntaxException(name() + " expects " + expected + " argument(s), got " + count);
            }
        }

        /** {@link Math#round(double)} without the clamp to the long range. */
        private static double roundHalfUp(double value) {
            if (Math.abs(value) >= 0x1p52) {
                return value;
            }
            return Math.round(value);
        }

        static Function lookup(String name) {
            for (Function f : values()) {
                if (f.name().equals(name)) {
                    return f;
                }
            }
            return null;
        }
    }
}
