package com.visualcalc.app.formula;

import java.util.Collections;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Raw cell content classified as a numeric literal, a parsed formula or
 * an unparsable formula. Instances are short-lived: the engine keeps the raw
 * string and re-classifies it whenever the cell is evaluated.
 */
public final class CellContent {

    private static final Pattern NUMERIC_LITERAL = Pattern.compile(
            "[+-]?((\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?|(?i:inf|infinity|nan))");

    private final Double literal;
    private final Expr formula;
    private final FormulaSyntaxException syntaxError;

    private CellContent(Double literal, Expr formula, FormulaSyntaxException syntaxError) {
        this.literal = literal;
        this.formula = formula;
        this.syntaxError = syntaxError;
    }

    /**
     * Classifies {@code raw}. Content starting with {@code formulaMarker} is always a
     * formula; otherwise a numeric literal is a literal and anything else a formula.
     */
    public static CellContent classify(String raw, String formulaMarker) {
        String text = raw == null ? "" : raw.trim();
        if (formulaMarker != null && !formulaMarker.isEmpty() && text.startsWith(formulaMarker)) {
            return parseFormula(text.substring(formulaMarker.length()));
        }
        if (NUMERIC_LITERAL.matcher(text).matches()) {
            return new CellContent(parseLiteral(text), null, null);
        }
        return parseFormula(text);
    }

    private static CellContent parseFormula(String text) {
        try {
            return new CellContent(null, FormulaParser.parse(text), null);
        } catch (FormulaSyntaxException e) {
            return new CellContent(null, null, e);
        }
    }

    private static double parseLiteral(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        String unsigned = lower.startsWith("-") || lower.startsWith("+") ? lower.substring(1) : lower;
        if (unsigned.startsWith("inf")) {
            return lower.startsWith("-") ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        }
        if (unsigned.equals("nan")) {
            return Double.NaN;
        }
        return Double.parseDouble(text);
    }

    public boolean isLiteral() {
        return literal != null;
    }

    public boolean isFormula() {
        return formula != null;
    }

    public boolean hasSyntaxError() {
        return syntaxError != null;
    }

    public double getLiteral() {
        return literal;
    }

    public Expr getFormula() {
        return formula;
    }

    public FormulaSyntaxException getSyntaxError() {
        return syntaxError;
    }

    /**
     * Cells this content reads. Literals and unparsable formulas read nothing.
     */
    public Set<String> references() {
        return formula == null ? Collections.emptySet() : ReferenceExtractor.extract(formula);
    }
}
