package fol.formula;

import fol.NonLogicalSymbol;
import fol.Substitution;
import fol.term.Term;
import fol.term.Variable;

import java.util.Set;

/**
 * A first-order formula. Every operation here recurses on the formula structure, including the
 * generated {@code equals} and {@code hashCode} of the records, so stack use grows with nesting depth.
 * {@link fol.syntax.Parser} bounds the depth of what it builds; formulas assembled directly from
 * constructors carry no such bound and must be kept shallow enough for the thread's stack.
 */
public sealed interface Formula permits Predicate, Equals, Not, BinaryFormula, QuantifiedFormula {
    /**
     * Replaces the free occurrences of the substituted variables. Bound occurrences are left alone,
     * but no renaming happens: check {@link #isSubstitutible(Variable, Term)} first.
     */
    Formula applySub(Substitution substitution);

    /**
     * Get a set of the current free variables inside the formula
     * @return set of free variables in the current formula
     */
    Set<Variable> freeVars();

    /**
     * Get the variables named by some binder inside the formula. A variable can be both free and bound
     * in the same formula.
     * @return set of bound variables
     */
    Set<Variable> boundVars();

    /**
     * Get every term reachable through predicate and function arguments.
     *
     * @return a set of the terms inside the formula
     */
    Set<Term> subterms();

    /**
     * @return every formula reachable through connectives and quantifiers, this one included
     */
    Set<Formula> subformulas();

    Set<NonLogicalSymbol> functionSymbols();

    Set<NonLogicalSymbol> predicateSymbols();

    /**
     * Whether {@code term} can replace the free occurrences of {@code var} without any of its variables
     * being captured by a binder.
     */
    boolean isSubstitutible(Variable var, Term term);

    /**
     * @return the formula in the parenthesized prefix syntax read by {@link fol.syntax.Parser}
     */
    String toPrefixString();

    default Formula substitute(Variable var, Term term) {
        return applySub(Substitution.of(var, term));
    }
}
