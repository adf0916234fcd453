package com.visualcalc.app.formula;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Recursive-descent parser turning a formula string into an {@link Expr} tree.
 *
 * Grammar, lowest precedence first:
 * <pre>
 * comparison := additive [ ("<" | "<=" | ">" | ">=" | "==" | "!=") additive ]
 * additive   := term { ("+" | "-") term }
 * term       := unary { ("*" | "/" | "%") unary }
 * unary      := ("-" | "+") unary | power
 * power      := primary [ ("**" | "^") unary ]
 * primary    := number | name | name "(" [ comparison { "," comparison } ] ")" | "(" comparison ")"
 * </pre>
 * The caret is an alias of {@code **}: both build the same POWER node, so
 * {@code 2^3^2} is {@code 2**(3**2)} and {@code -2^2} is {@code -(2**2)}.
 * A leading {@code math.} qualifier on function and constant names is accepted and dropped.
 *
 * Parsing never looks at cell values.
 */
public final class FormulaParser {

    private static final String MATH_QUALIFIER = "math";
    // Nesting of parentheses, signs and exponents
    static final int MAX_DEPTH = 200;

    private final String formula;
    private int pos;
    private int depth;

    private FormulaParser(String formula) {
        this.formula = formula;
    }

    /**
     * Parses a complete formula.
     *
     * @throws FormulaSyntaxException if the formula is empty or malformed
     */
    public static Expr parse(String formula) {
        if (formula == null) {
            throw new FormulaSyntaxException("Empty formula", 0);
        }
        FormulaParser parser = new FormulaParser(formula);
        parser.skipWhitespace();
        if (parser.atEnd()) {
            throw new FormulaSyntaxException("Empty formula", 0);
        }
        Expr expr = parser.parseComparison();
        parser.skipWhitespace();
        if (!parser.atEnd()) {
            if (parser.peek() == ')') {
                throw new FormulaSyntaxException("Unbalanced ')'", parser.pos);
            }
            throw new FormulaSyntaxException("Unexpected trailing content '" + formula.substring(parser.pos) + "'", parser.pos);
        }
        return expr;
    }

    private Expr parseComparison() {
        Expr left = parseAdditive();
        Operator op = comparisonOperator();
        if (op == null) {
            return left;
        }
        Expr right = parseAdditive();
        if (comparisonOperator() != null) {
            throw new FormulaSyntaxException("Chained comparisons are not supported", pos);
        }
        return new Expr.Binary(op, left, right);
    }

    private Operator comparisonOperator() {
        if (eat("<=")) return Operator.LESS_EQUAL;
        if (eat(">=")) return Operator.GREATER_EQUAL;
        if (eat("==")) return Operator.EQUAL;
        if (eat("!=")) return Operator.NOT_EQUAL;
        if (eat("<")) return Operator.LESS;
        if (eat(">")) return Operator.GREATER;
        return null;
    }

    private Expr parseAdditive() {
        Expr x = parseTerm();
        while (true) {
            if (eat("+")) {
                x = new Expr.Binary(Operator.ADD, x, parseTerm());
            } else if (eat("-")) {
                x = new Expr.Binary(Operator.SUBTRACT, x, parseTerm());
            } else {
                return x;
            }
        }
    }

    private Expr parseTerm() {
        Expr x = parseUnary();
        while (true) {
            // "**" must not be read as two multiplications
            if (!lookingAt("**") && eat("*")) {
                x = new Expr.Binary(Operator.MULTIPLY, x, parseUnary());
            } else if (eat("/")) {
                x = new Expr.Binary(Operator.DIVIDE, x, parseUnary());
            } else if (eat("%")) {
                x = new Expr.Binary(Operator.MODULO, x, parseUnary());
            } else {
                return x;
            }
        }
    }

    private Expr parseUnary() {
        if (++depth > MAX_DEPTH) {
            throw new FormulaSyntaxException("Formula is nested too deeply", pos);
        }
        try {
            if (eat("-")) {
                return new Expr.Negate(parseUnary());
            }
            if (eat("+")) {
                return parseUnary();
            }
            return parsePower();
        } finally {
            depth--;
        }
    }

    private Expr parsePower() {
        Expr base = parsePrimary();
        if (eat("**") || eat("^")) {
            // right operand goes back through unary, which makes the operator right-associative
            return new Expr.Binary(Operator.POWER, base, parseUnary());
        }
        return base;
    }

    private Expr parsePrimary() {
        skipWhitespace();
        if (atEnd()) {
            throw new FormulaSyntaxException("Unexpected end of formula", pos);
        }
        int start = pos;
        char c = peek();
        if (c == '(') {
            pos++;
            Expr inner = parseComparison();
            if (!eat(")")) {
                throw new FormulaSyntaxException("Unbalanced '(' opened", start);
            }
            return inner;
        }
        if (isDigit(c) || c == '.') {
            return parseNumber();
        }
        if (isNameStart(c)) {
            return parseName();
        }
        throw new FormulaSyntaxException("Unexpected character '" + c + "'", start);
    }

    private Expr parseNumber() {
        int start = pos;
        while (!atEnd() && isDigit(peek())) pos++;
        if (!atEnd() && peek() == '.') {
            pos++;
            while (!atEnd() && isDigit(peek())) pos++;
        }
        if (pos - start == 1 && formula.charAt(start) == '.') {
            throw new FormulaSyntaxException("Invalid number '.'", start);
        }
        if (!atEnd() && (peek() == 'e' || peek() == 'E')) {
            int mark = pos;
            pos++;
            if (!atEnd() && (peek() == '+' || peek() == '-')) pos++;
            if (atEnd() || !isDigit(peek())) {
                // not an exponent after all, e.g. "2e" - leave it for the caller to reject
                pos = mark;
            } else {
                while (!atEnd() && isDigit(peek())) pos++;
            }
        }
        return new Expr.Number(Double.parseDouble(formula.substring(start, pos)));
    }

    private Expr parseName() {
        int start = pos;
        String name = readName();
        skipWhitespace();
        if (name.equalsIgnoreCase(MATH_QUALIFIER) && !atEnd() && peek() == '.') {
            pos++;
            skipWhitespace();
            if (atEnd() || !isNameStart(peek())) {
                throw new FormulaSyntaxException("Expected a name after 'math.'", pos);
            }
            start = pos;
            name = readName();
            if (!lookingAt("(") && FunctionLibrary.constant(name) == null) {
                throw new FormulaSyntaxException("Unknown constant 'math." + name + "'", start);
            }
        }
        if (eat("(")) {
            return new Expr.Call(name.toLowerCase(Locale.ROOT), parseArguments(start));
        }
        Double constant = FunctionLibrary.constant(name);
        if (constant != null) {
            return new Expr.Constant(name.toLowerCase(Locale.ROOT), constant);
        }
        return new Expr.Reference(CellNames.normalizeReference(name));
    }

    private List<Expr> parseArguments(int callStart) {
        List<Expr> args = new ArrayList<>();
        if (eat(")")) {
            return args;
        }
        do {
            args.add(parseComparison());
        } while (eat(","));
        if (!eat(")")) {
            skipWhitespace();
            if (atEnd()) {
                throw new FormulaSyntaxException("Unbalanced '(' in call", callStart);
            }
            throw new FormulaSyntaxException("Expected ',' or ')' but found '" + peek() + "'", pos);
        }
        return args;
    }

    private String readName() {
        int start = pos;
        while (!atEnd() && isNamePart(peek())) pos++;
        return formula.substring(start, pos);
    }

    // ----------------------------------------------------------------
    // Character helpers
    // ----------------------------------------------------------------

    private boolean eat(String token) {
        skipWhitespace();
        if (formula.startsWith(token, pos)) {
            pos += token.length();
            return true;
        }
        return false;
    }

    private boolean lookingAt(String token) {
        skipWhitespace();
        return formula.startsWith(token, pos);
    }

    private void skipWhitespace() {
        while (!atEnd() && Character.isWhitespace(peek())) pos++;
    }

    private boolean atEnd() {
        return pos >= formula.length();
    }

    private char peek() {
        return formula.charAt(pos);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isNameStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isNamePart(char c) {
        return isNameStart(c) || isDigit(c);
    }
}
