package com.visualcalc.app.formula;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Collects the distinct cell names an expression reads.
 * Function names and constants are not references.
 */
public final class ReferenceExtractor implements Expr.Visitor<Void> {

    private final Set<String> references = new LinkedHashSet<>();

    private ReferenceExtractor() {
    }

    /**
     * Returns the referenced cell names in order of first appearance.
     */
    public static Set<String> extract(Expr expr) {
        ReferenceExtractor extractor = new ReferenceExtractor();
        expr.accept(extractor);
        return Collections.unmodifiableSet(extractor.references);
    }

    @Override
    public Void visitNumber(Expr.Number number) {
        return null;
    }

    @Override
    public Void visitConstant(Expr.Constant constant) {
        return null;
    }

    @Override
    public Void visitReference(Expr.Reference reference) {
        references.add(reference.getName());
        return null;
    }

    @Override
    public Void visitNegate(Expr.Negate negate) {
        return negate.getOperand().accept(this);
    }

    @Override
    public Void visitBinary(Expr.Binary binary) {
        binary.getLeft().accept(this);
        return binary.getRight().accept(this);
    }

    @Override
    public Void visitCall(Expr.Call call) {
        for (Expr argument : call.getArguments()) {
            argument.accept(this);
        }
        return null;
    }
}
