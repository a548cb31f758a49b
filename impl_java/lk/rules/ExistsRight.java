package lk.rules;

import fol.formula.Exists;
import lk.Sequent;

/**
 * From {@code Γ ⇒ Δ, φ[t/x]} infer {@code Γ ⇒ Δ, ∃x.φ}.
 */
public class ExistsRight extends UnaryRule {

    @Override
    boolean isValid(Sequent premise, Sequent conclusion) {
        if (!(conclusion.sucLast() instanceof Exists exists)) return false;
        return premise.antecedent().equals(conclusion.antecedent())
                && premise.sucButLast().equals(conclusion.sucButLast())
                && Quantifiers.isInstance(exists, premise.sucLast());
    }
}
