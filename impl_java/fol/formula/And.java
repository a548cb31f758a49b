package fol.formula;

import fol.Substitution;

public record And(Formula left, Formula right) implements BinaryFormula {
    public And {
        if (left == null || right == null) throw new IllegalArgumentException("Conjunction needs two operands");
    }

    @Override
    public Formula applySub(Substitution substitution) {
        return new And(left.applySub(substitution), right.applySub(substitution));
    }

    @Override
    public String connective() {
        return "∧";
    }

    @Override
    public String prefixToken() {
        return "^";
    }

    @Override
    public String toString() {
        return "(" + left + " " + connective() + " " + right + ")";
    }
}
