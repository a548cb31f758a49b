package lk.rules;

import fol.formula.Formula;
import fol.formula.QuantifiedFormula;
import fol.term.Term;
import fol.term.Variable;
import lk.Sequent;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Side conditions shared by the quantifier rules.
 */
final class Quantifiers {

    private Quantifiers() {
    }

    /**
     * Whether {@code instance} is {@code quantified} with its bound variable replaced by some term of
     * {@code instance}, or by the bound variable itself. A body that rebinds its own variable is never instantiated.
     */
    static boolean isInstance(QuantifiedFormula quantified, Formula instance) {
        Variable var = quantified.var();
        Formula body = quantified.formula();
        if (body.boundVars().contains(var)) return false;
        Set<Term> candidates = instance.subterms();
        candidates.add(var);
        for (Term t : candidates) {
            if (body.isSubstitutible(var, t) && quantified.apply(t).equals(instance)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Whether {@code instance} is {@code quantified} instantiated with an eigenvariable: a variable free
     * neither in {@code context} nor in {@code quantified} (unless it is the bound variable).
     */
    static boolean isGeneralization(QuantifiedFormula quantified, Formula instance, Collection<Formula> context) {
        Variable var = quantified.var();
        Formula body = quantified.formula();
        Set<Variable> candidates = instance.freeVars();
        candidates.add(var);
        Set<Variable> contextVars = Sequent.freeVars(context);
        Set<Variable> quantifiedVars = quantified.freeVars();
        for (Variable y : candidates) {
            if (contextVars.contains(y)) continue;
            if (!y.equals(var) && quantifiedVars.contains(y)) continue;
            if (body.isSubstitutible(var, y) && quantified.apply(y).equals(instance)) {
                return true;
            }
        }
        return false;
    }

    static Collection<Formula> union(Collection<Formula> first, Collection<Formula> second) {
        Set<Formula> out = new HashSet<>(first);
        out.addAll(second);
        return out;
    }
}
