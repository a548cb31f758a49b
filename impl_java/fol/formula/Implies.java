package fol.formula;

import fol.Substitution;

public record Implies(Formula left, Formula right) implements BinaryFormula {
    public Implies {
        if (left == null || right == null) throw new IllegalArgumentException("Implication needs two operands");
    }

    @Override
    public Formula applySub(Substitution substitution) {
        return new Implies(left.applySub(substitution), right.applySub(substitution));
    }

    @Override
    public String connective() {
        return "→";
    }

    @Override
    public String prefixToken() {
        return ">";
    }

    @Override
    public String toString() {
        return "(" + left + " " + connective() + " " + right + ")";
    }
}
