package fol.formula;

import fol.NonLogicalSymbol;
import fol.Substitution;
import fol.term.Term;
import fol.term.Variable;

import java.util.HashSet;
import java.util.Set;

/**
 * Equality between two terms. Equality of formulas is structural, so {@code s = t} and {@code t = s} differ.
 */
public record Equals(Term left, Term right) implements Formula {
    public Equals {
        if (left == null || right == null) throw new IllegalArgumentException("Equality needs two terms");
    }

    public boolean isReflexive() {
        return left.equals(right);
    }

    @Override
    public Formula applySub(Substitution substitution) {
        return new Equals(left.applySub(substitution), right.applySub(substitution));
    }

    @Override
    public String toString() {
        return left.toString() + " = " + right.toString();
    }

    @Override
    public String toPrefixString() {
        return "(= " + left.toPrefixString() + " " + right.toPrefixString() + ")";
    }

    @Override
    public Set<Variable> freeVars() {
        Set<Variable> out = left.vars();
        out.addAll(right.vars());
        return out;
    }

    @Override
    public Set<Variable> boundVars() {
        return new HashSet<>();
    }

    @Override
    public Set<Term> subterms() {
        Set<Term> out = left.subterms();
        out.addAll(right.subterms());
        return out;
    }

    @Override
    public Set<Formula> subformulas() {
        return new HashSet<>(Set.of(this));
    }

    @Override
    public Set<NonLogicalSymbol> functionSymbols() {
        Set<NonLogicalSymbol> out = left.functionSymbols();
        out.addAll(right.functionSymbols());
        return out;
    }

    @Override
    public Set<NonLogicalSymbol> predicateSymbols() {
        return new HashSet<>();
    }

    @Override
    public boolean isSubstitutible(Variable var, Term term) {
        return true;
    }
}
