package fol.formula;

import fol.NonLogicalSymbol;
import fol.Substitution;
import fol.term.Term;
import fol.term.Variable;

import java.util.Set;

public record Not(Formula formula) implements Formula {
    public Not {
        if (formula == null) throw new IllegalArgumentException("Negation of nothing");
    }

    @Override
    public Formula applySub(Substitution substitution) {
        return new Not(formula.applySub(substitution));
    }

    @Override
    public String toString() {
        return "¬" + formula;
    }

    @Override
    public String toPrefixString() {
        return "(~ " + formula.toPrefixString() + ")";
    }

    @Override
    public Set<Variable> freeVars() {
        return formula.freeVars();
    }

    @Override
    public Set<Variable> boundVars() {
        return formula.boundVars();
    }

    @Override
    public Set<Term> subterms() {
        return formula.subterms();
    }

    @Override
    public Set<Formula> subformulas() {
        Set<Formula> out = formula.subformulas();
        out.add(this);
        return out;
    }

    @Override
    public Set<NonLogicalSymbol> functionSymbols() {
        return formula.functionSymbols();
    }

    @Override
    public Set<NonLogicalSymbol> predicateSymbols() {
        return formula.predicateSymbols();
    }

    @Override
    public boolean isSubstitutible(Variable var, Term term) {
        return formula.isSubstitutible(var, term);
    }
}
