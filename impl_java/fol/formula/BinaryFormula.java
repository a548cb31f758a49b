package fol.formula;

import fol.NonLogicalSymbol;
import fol.term.Term;
import fol.term.Variable;

import java.util.Set;

/**
 * A connective over two ordered subformulas.
 */
public sealed interface BinaryFormula extends Formula permits And, Or, Implies {
    Formula left();

    Formula right();

    /**
     * @return the connective as printed between the operands, e.g. {@code ∧}
     */
    String connective();

    /**
     * @return the connective token of the prefix syntax, e.g. {@code ^}
     */
    String prefixToken();

    @Override
    default String toPrefixString() {
        return "(" + prefixToken() + " " + left().toPrefixString() + " " + right().toPrefixString() + ")";
    }

    @Override
    default Set<Variable> freeVars() {
        Set<Variable> out = left().freeVars();
        out.addAll(right().freeVars());
        return out;
    }

    @Override
    default Set<Variable> boundVars() {
        Set<Variable> out = left().boundVars();
        out.addAll(right().boundVars());
        return out;
    }

    @Override
    default Set<Term> subterms() {
        Set<Term> out = left().subterms();
        out.addAll(right().subterms());
        return out;
    }

    @Override
    default Set<Formula> subformulas() {
        Set<Formula> out = left().subformulas();
        out.addAll(right().subformulas());
        out.add(this);
        return out;
    }

    @Override
    default Set<NonLogicalSymbol> functionSymbols() {
        Set<NonLogicalSymbol> out = left().functionSymbols();
        out.addAll(right().functionSymbols());
        return out;
    }

    @Override
    default Set<NonLogicalSymbol> predicateSymbols() {
        Set<NonLogicalSymbol> out = left().predicateSymbols();
        out.addAll(right().predicateSymbols());
        return out;
    }

    @Override
    default boolean isSubstitutible(Variable var, Term term) {
        return left().isSubstitutible(var, term) && right().isSubstitutible(var, term);
    }
}
