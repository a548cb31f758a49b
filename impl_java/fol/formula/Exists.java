package fol.formula;

import fol.Substitution;
import fol.term.Variable;

public record Exists(Variable var, Formula formula) implements QuantifiedFormula {
    public Exists {
        if (var == null || formula == null) throw new IllegalArgumentException("Quantifier needs a variable and a body");
    }

    @Override
    public Formula applySub(Substitution substitution) {
        // Avoid substituting the bound variable
        Substitution pruned = substitution.without(var);
        return new Exists(var, formula.applySub(pruned));
    }

    @Override
    public String quantifier() {
        return "∃";
    }

    @Override
    public String prefixToken() {
        return "E";
    }

    @Override
    public String toString() {
        return quantifier() + var + "." + formula;
    }
}
