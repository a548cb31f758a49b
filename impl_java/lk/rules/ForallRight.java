package lk.rules;

import fol.formula.Forall;
import lk.Sequent;

/**
 * From {@code Γ ⇒ Δ, φ[y/x]} infer {@code Γ ⇒ Δ, ∀x.φ}, where the eigenvariable y is not free in Γ or Δ.
 */
public class ForallRight extends UnaryRule {

    @Override
    boolean isValid(Sequent premise, Sequent conclusion) {
        if (!(conclusion.sucLast() instanceof Forall forall)) return false;
        return premise.antecedent().equals(conclusion.antecedent())
                && premise.sucButLast().equals(conclusion.sucButLast())
                && Quantifiers.isGeneralization(forall, premise.sucLast(),
                        Quantifiers.union(premise.antecedent(), premise.sucButLast()));
    }
}
