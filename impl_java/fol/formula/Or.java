package fol.formula;

import fol.Substitution;

public record Or(Formula left, Formula right) implements BinaryFormula {
    public Or {
        if (left == null || right == null) throw new IllegalArgumentException("Disjunction needs two operands");
    }

    @Override
    public Formula applySub(Substitution substitution) {
        return new Or(left.applySub(substitution), right.applySub(substitution));
    }

    @Override
    public String connective() {
        return "∨";
    }

    @Override
    public String prefixToken() {
        return "v";
    }

    @Override
    public String toString() {
        return "(" + left + " " + connective() + " " + right + ")";
    }
}
