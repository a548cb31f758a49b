package fol.term;

import fol.NonLogicalSymbol;
import fol.Substitution;

import java.util.Set;

public sealed interface Term permits Function, Variable {
    Term applySub(Substitution substitution);

    Set<Variable> vars();

    /**
     * Get every term reachable through function arguments, the term itself included.
     *
     * @return the set of subterms
     */
    Set<Term> subterms();

    Set<NonLogicalSymbol> functionSymbols();

    /**
     * @return the term in the parenthesized prefix syntax read by {@link fol.syntax.Parser}
     */
    String toPrefixString();
}
