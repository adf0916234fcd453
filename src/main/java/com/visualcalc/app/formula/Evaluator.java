package com.visualcalc.app.formula;

import com.visualcalc.app.models.CellValue;
import com.visualcalc.app.models.ErrorKind;

import java.util.List;
import java.util.function.Function;

/**
 * Evaluates an expression tree against a read-only view of cell values.
 *
 * The view returns null for a name that is not a defined cell.
 * Errors propagate upward unchanged; operands are evaluated left to right
 * so the first error met is the one reported.
 */
public final class Evaluator {

    private Evaluator() {
    }

    public static CellValue evaluate(Expr expr, Function<String, CellValue> snapshot) {
        try {
            return CellValue.of(expr.accept(new Walker(snapshot)));
        } catch (FormulaEvaluationException e) {
            return CellValue.error(e.getKind());
        }
    }

    private static final class Walker implements Expr.Visitor<Double> {

        private final Function<String, CellValue> snapshot;

        Walker(Function<String, CellValue> snapshot) {
            this.snapshot = snapshot;
        }

        @Override
        public Double visitNumber(Expr.Number number) {
            return number.getValue();
        }

        @Override
        public Double visitConstant(Expr.Constant constant) {
            return constant.getValue();
        }

        @Override
        public Double visitReference(Expr.Reference reference) {
            CellValue value = snapshot.apply(reference.getName());
            if (value == null) {
                throw new FormulaEvaluationException(ErrorKind.UNDEFINED_REFERENCE,
                        "Unknown cell: " + reference.getName());
            }
            if (value.hasError()) {
                throw new FormulaEvaluationException(value.getError(),
                        "Cell " + reference.getName() + " holds " + value.getError());
            }
            return value.getValue();
        }

        @Override
        public Double visitNegate(Expr.Negate negate) {
            return -negate.getOperand().accept(this);
        }

        @Override
        public Double visitBinary(Expr.Binary binary) {
            double left = binary.getLeft().accept(this);
            double right = binary.getRight().accept(this);
            switch (binary.getOperator()) {
                case ADD:
                    return left + right;
                case SUBTRACT:
                    return left - right;
                case MULTIPLY:
                    return left * right;
                case DIVIDE:
                    if (right == 0) {
                        throw new FormulaEvaluationException(ErrorKind.DIVISION_BY_ZERO, "Division by zero");
                    }
                    return left / right;
                case MODULO:
                    return modulo(left, right);
                case POWER:
                    return power(left, right);
                case LESS:
                    return bool(left < right);
                case LESS_EQUAL:
                    return bool(left <= right);
                case GREATER:
                    return bool(left > right);
                case GREATER_EQUAL:
                    return bool(left >= right);
                case EQUAL:
                    return bool(left == right);
                case NOT_EQUAL:
                    return bool(left != right);
                default:
                    throw new IllegalStateException("Unhandled operator " + binary.getOperator());
            }
        }

        @Override
        public Double visitCall(Expr.Call call) {
            FunctionLibrary.Definition definition = FunctionLibrary.lookup(call.getFunction());
            if (definition == null) {
                throw new FormulaEvaluationException(ErrorKind.INVALID_FUNCTION,
                        "Unknown function: " + call.getFunction());
            }
            List<Expr> arguments = call.getArguments();
            if (arguments.size() != definition.getArity()) {
                throw new FormulaEvaluationException(ErrorKind.INVALID_FUNCTION,
                        definition.getName() + "() takes " + definition.getArity()
                                + " argument(s), got " + arguments.size());
            }
            double[] args = new double[arguments.size()];
            boolean nanInput = false;
            for (int i = 0; i < args.length; i++) {
                args[i] = arguments.get(i).accept(this);
                nanInput |= Double.isNaN(args[i]);
            }
            double result = definition.apply(args);
            if (Double.isNaN(result) && !nanInput) {
                throw new FormulaEvaluationException(ErrorKind.DOMAIN_ERROR,
                        definition.getName() + "() is outside its domain");
            }
            return result;
        }

        private static double modulo(double left, double right) {
            if (right == 0) {
                throw new FormulaEvaluationException(ErrorKind.DIVISION_BY_ZERO, "Modulo by zero");
            }
            // result takes the sign of the divisor
            double r = left % right;
            if (r != 0 && (r < 0) != (right < 0)) {
                r += right;
            }
            return r;
        }

        private static double power(double base, double exponent) {
            if (base == 0 && exponent < 0) {
                throw new FormulaEvaluationException(ErrorKind.DIVISION_BY_ZERO, "Zero raised to a negative power");
            }
            double result = Math.pow(base, exponent);
            if (Double.isNaN(result) && !Double.isNaN(base) && !Double.isNaN(exponent)) {
                throw new FormulaEvaluationException(ErrorKind.DOMAIN_ERROR,
                        "Negative base " + base + " with fractional exponent " + exponent);
            }
            return result;
        }

        private static double bool(boolean b) {
            return b ? 1.0 : 0.0;
        }
    }
}
