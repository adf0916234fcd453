package com.visualcalc.app.formula;

import com.visualcalc.app.exceptions.InvalidCellNameException;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalization rules for cell names. Names are case-insensitive and stored upper-cased.
 */
public final class CellNames {

    private static final Pattern NAME_PATTERN = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private CellNames() {
    }

    /**
     * Validates and normalizes a name given by a caller, e.g. " e1 " -> "E1".
     *
     * @throws InvalidCellNameException if the name is malformed or collides with a function or constant
     */
    public static String normalize(String name) {
        if (name == null) {
            throw new InvalidCellNameException("Cell name must not be null");
        }
        String trimmed = name.trim();
        if (!NAME_PATTERN.matcher(trimmed).matches()) {
            throw new InvalidCellNameException("Invalid cell name: '" + name + "'");
        }
        if (FunctionLibrary.isReserved(trimmed)) {
            throw new InvalidCellNameException("Cell name '" + trimmed + "' is reserved for a function or constant");
        }
        return trimmed.toUpperCase(Locale.ROOT);
    }

    // Identifiers inside a formula are already lexically valid
    static String normalizeReference(String identifier) {
        return identifier.toUpperCase(Locale.ROOT);
    }
}
