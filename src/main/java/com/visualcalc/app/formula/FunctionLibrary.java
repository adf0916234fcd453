package com.visualcalc.app.formula;

import com.visualcalc.app.models.ErrorKind;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Whitelist of the numeric functions and constants a formula may use.
 * Every function has a fixed arity and is a pure function of its arguments.
 * Lookups are case-insensitive.
 */
public final class FunctionLibrary {

    /**
     * Implementation of one whitelisted function. May throw
     * {@link FormulaEvaluationException} with DOMAIN_ERROR for arguments outside its domain.
     */
    @FunctionalInterface
    public interface NumericFunction {
        double apply(double[] args);
    }

    public static final class Definition {
        private final String name;
        private final int arity;
        private final NumericFunction body;

        Definition(String name, int arity, NumericFunction body) {
            this.name = name;
            this.arity = arity;
            this.body = body;
        }

        public String getName() {
            return name;
        }

        public int getArity() {
            return arity;
        }

        public double apply(double[] args) {
            return body.apply(args);
        }
    }

    private static final Map<String, Definition> FUNCTIONS = new HashMap<>();
    private static final Map<String, Double> CONSTANTS = new HashMap<>();

    static {
        CONSTANTS.put("pi", Math.PI);
        CONSTANTS.put("e", Math.E);
        CONSTANTS.put("tau", 2 * Math.PI);
        CONSTANTS.put("inf", Double.POSITIVE_INFINITY);
        CONSTANTS.put("nan", Double.NaN);

        unary("sqrt", Math::sqrt);
        unary("exp", Math::exp);
        unary("expm1", Math::expm1);
        unary("log", x -> Math.log(positive("log", x)));
        unary("log10", x -> Math.log10(positive("log10", x)));
        unary("log2", x -> Math.log(positive("log2", x)) / Math.log(2));
        unary("log1p", x -> {
            if (x <= -1) {
                throw domain("log1p", x);
            }
            return Math.log1p(x);
        });
        unary("sin", Math::sin);
        unary("cos", Math::cos);
        unary("tan", Math::tan);
        unary("asin", Math::asin);
        unary("acos", Math::acos);
        unary("atan", Math::atan);
        unary("sinh", Math::sinh);
        unary("cosh", Math::cosh);
        unary("tanh", Math::tanh);
        unary("asinh", x -> Math.signum(x) * Math.log(Math.abs(x) + Math.sqrt(x * x + 1)));
        unary("acosh", x -> Math.log(x + Math.sqrt(x * x - 1)));
        unary("atanh", x -> {
            if (Math.abs(x) >= 1) {
                throw domain("atanh", x);
            }
            return 0.5 * Math.log((1 + x) / (1 - x));
        });
        unary("degrees", Math::toDegrees);
        unary("radians", Math::toRadians);
        unary("fabs", Math::abs);
        unary("abs", Math::abs);
        unary("floor", Math::floor);
        unary("ceil", Math::ceil);
        unary("trunc", x -> x < 0 ? Math.ceil(x) : Math.floor(x));
        unary("round", Math::rint);
        unary("factorial", FunctionLibrary::factorial);
        unary("isqrt", x -> Math.floor(Math.sqrt(nonNegativeInteger("isqrt", x))));

        binary("atan2", Math::atan2);
        binary("hypot", Math::hypot);
        binary("pow", (x, y) -> {
            if (x == 0 && y < 0) {
                throw domain("pow", x);
            }
            return Math.pow(x, y);
        });
        binary("fmod", (x, y) -> {
            if (y == 0) {
                throw domain("fmod", y);
            }
            return x % y;
        });
        binary("copysign", Math::copySign);
        binary("gcd", (x, y) -> gcd(integer("gcd", x), integer("gcd", y)));
        binary("lcm", (x, y) -> {
            long a = integer("lcm", x);
            long b = integer("lcm", y);
            if (a == 0 || b == 0) {
                return 0;
            }
            // product can exceed long range
            return Math.abs((double) (a / (long) gcd(a, b)) * b);
        });
        binary("min", Math::min);
        binary("max", Math::max);

        register("if", 3, args -> args[0] != 0 ? args[1] : args[2]);
    }

    private FunctionLibrary() {
    }

    /**
     * Returns the definition registered under {@code name}, or null if the name is not whitelisted.
     */
    public static Definition lookup(String name) {
        return FUNCTIONS.get(name.toLowerCase(Locale.ROOT));
    }

    /**
     * Returns the value of a named constant, or null if {@code name} is not one.
     */
    public static Double constant(String name) {
        return CONSTANTS.get(name.toLowerCase(Locale.ROOT));
    }

    public static Set<String> functionNames() {
        return Collections.unmodifiableSet(FUNCTIONS.keySet());
    }

    public static Set<String> constantNames() {
        return Collections.unmodifiableSet(CONSTANTS.keySet());
    }

    /**
     * True if {@code name} is taken by a function or a constant and so cannot name a cell.
     */
    public static boolean isReserved(String name) {
        String key = name.toLowerCase(Locale.ROOT);
        return FUNCTIONS.containsKey(key) || CONSTANTS.containsKey(key) || "math".equals(key);
    }

    // ----------------------------------------------------------------
    // Registration and domain helpers
    // ----------------------------------------------------------------

    private interface Unary {
        double apply(double x);
    }

    private interface BinaryFn {
        double apply(double x, double y);
    }

    private static void register(String name, int arity, NumericFunction body) {
        FUNCTIONS.put(name, new Definition(name, arity, body));
    }

    private static void unary(String name, Unary fn) {
        register(name, 1, args -> fn.apply(args[0]));
    }

    private static void binary(String name, BinaryFn fn) {
        register(name, 2, args -> fn.apply(args[0], args[1]));
    }

    private static FormulaEvaluationException domain(String function, double arg) {
        return new FormulaEvaluationException(ErrorKind.DOMAIN_ERROR,
                function + "() is not defined for " + arg);
    }

    private static double positive(String function, double x) {
        if (x <= 0) {
            throw domain(function, x);
        }
        return x;
    }

    private static long integer(String function, double x) {
        if (Double.isNaN(x) || Double.isInfinite(x) || x != Math.rint(x) || Math.abs(x) > 9.007199254740992E15) {
            throw domain(function, x);
        }
        return (long) x;
    }

    private static double nonNegativeInteger(String function, double x) {
        if (x < 0) {
            throw domain(function, x);
        }
        return integer(function, x);
    }

    private static double factorial(double x) {
        long n = (long) nonNegativeInteger("factorial", x);
        if (n > 170) {
            // beyond 170! a double overflows
            return Double.POSITIVE_INFINITY;
        }
        double result = 1;
        for (long i = 2; i <= n; i++) {
            result *= i;
        }
        return result;
    }

    private static double gcd(long a, long b) {
        a = Math.abs(a);
        b = Math.abs(b);
        while (b != 0) {
            long t = a % b;
            a = b;
            b = t;
        }
        return a;
    }
}
