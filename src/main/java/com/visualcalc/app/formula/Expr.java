package com.visualcalc.app.formula;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Immutable expression tree of a single formula.
 * Trees are built by {@link FormulaParser} and only live for one parse/evaluate round.
 */
public abstract class Expr {

    public interface Visitor<R> {
        R visitNumber(Number number);
        R visitConstant(Constant constant);
        R visitReference(Reference reference);
        R visitNegate(Negate negate);
        R visitBinary(Binary binary);
        R visitCall(Call call);
    }

    public abstract <R> R accept(Visitor<R> visitor);

    /**
     * Numeric literal such as {@code 2.5} or {@code 1e3}.
     */
    public static final class Number extends Expr {
        private final double value;

        public Number(double value) {
            this.value = value;
        }

        public double getValue() {
            return value;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNumber(this);
        }

        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    /**
     * Named constant (pi, e, tau, inf, nan). Never a cell reference.
     */
    public static final class Constant extends Expr {
        private final String name;
        private final double value;

        public Constant(String name, double value) {
            this.name = name;
            this.value = value;
        }

        public String getName() {
            return name;
        }

        public double getValue() {
            return value;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitConstant(this);
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * Read of another cell, by normalized name.
     */
    public static final class Reference extends Expr {
        private final String name;

        public Reference(String name) {
            this.name = name;
        }

        public String getName() {
            return name;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitReference(this);
        }

        @Override
        public String toString() {
            return name;
        }
    }

    public static final class Negate extends Expr {
        private final Expr operand;

        public Negate(Expr operand) {
            this.operand = operand;
        }

        public Expr getOperand() {
            return operand;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNegate(this);
        }

        @Override
        public String toString() {
            return "(-" + operand + ")";
        }
    }

    public static final class Binary extends Expr {
        private final Operator operator;
        private final Expr left;
        private final Expr right;

        public Binary(Operator operator, Expr left, Expr right) {
            this.operator = operator;
            this.left = left;
            this.right = right;
        }

        public Operator getOperator() {
            return operator;
        }

        public Expr getLeft() {
            return left;
        }

        public Expr getRight() {
            return right;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBinary(this);
        }

        @Override
        public String toString() {
            return "(" + left + " " + operator.getSymbol() + " " + right + ")";
        }
    }

    /**
     * Function call. The name is kept as written (lower-cased); whether it
     * exists in the {@link FunctionLibrary} is only checked at evaluation time.
     */
    public static final class Call extends Expr {
        private final String function;
        private final List<Expr> arguments;

        public Call(String function, List<Expr> arguments) {
            this.function = function;
            this.arguments = Collections.unmodifiableList(arguments);
        }

        public String getFunction() {
            return function;
        }

        public List<Expr> getArguments() {
            return arguments;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCall(this);
        }

        @Override
        public String toString() {
            return function + arguments.stream().map(Expr::toString)
                    .collect(Collectors.joining(", ", "(", ")"));
        }
    }
}
