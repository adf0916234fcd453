package com.visualcalc.app.formula;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ReferenceExtractorTest {

    private static Set<String> refs(String formula) {
        return ReferenceExtractor.extract(FormulaParser.parse(formula));
    }

    @Test
    void testCollectsEveryReferenceOnce() {
        assertEquals(new LinkedHashSet<>(Arrays.asList("A1", "B1", "C1")), refs("A1 + b1 * (A1 - c1) / B1"));
    }

    @Test
    void testFunctionsAndConstantsAreNotReferences() {
        assertEquals(Set.of("X"), refs("sqrt(x) + pi + e + tau + inf + nan + math.cos(0)"));
        assertTrue(refs("max(1, 2) ^ 2").isEmpty());
    }

    @Test
    void testWalksIntoCallArguments() {
        assertEquals(Set.of("A", "B", "C"), refs("IF(A > 0, max(B, 1), -C)"));
    }
}
