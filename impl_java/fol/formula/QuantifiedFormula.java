package fol.formula;

import fol.NonLogicalSymbol;
import fol.term.Term;
import fol.term.Variable;

import java.util.Set;

/**
 * A formula binding {@link #var()} in {@link #formula()}.
 */
public sealed interface QuantifiedFormula extends Formula permits Forall, Exists {
    Variable var();

    Formula formula();

    String quantifier();

    String prefixToken();

    /**
     * Instantiates the bound variable with {@code t}.
     */
    default Formula apply(Term t) {
        return formula().substitute(var(), t);
    }

    @Override
    default String toPrefixString() {
        return "(" + prefixToken() + " " + var().toPrefixString() + " " + formula().toPrefixString() + ")";
    }

    @Override
    default Set<Variable> freeVars() {
        Set<Variable> out = formula().freeVars();
        out.remove(var());
        return out;
    }

    @Override
    default Set<Variable> boundVars() {
        Set<Variable> out = formula().boundVars();
        out.add(var());
        return out;
    }

    @Override
    default Set<Term> subterms() {
        return formula().subterms();
    }

    @Override
    default Set<Formula> subformulas() {
        Set<Formula> out = formula().subformulas();
        out.add(this);
        return out;
    }

    @Override
    default Set<NonLogicalSymbol> functionSymbols() {
        return formula().functionSymbols();
    }

    @Override
    default Set<NonLogicalSymbol> predicateSymbols() {
        return formula().predicateSymbols();
    }

    @Override
    default boolean isSubstitutible(Variable var, Term term) {
        // var is shadowed below this binder, nothing gets replaced
        if (var().equals(var)) return true;
        if (formula().freeVars().contains(var) && term.vars().contains(var())) return false;
        return formula().isSubstitutible(var, term);
    }
}
