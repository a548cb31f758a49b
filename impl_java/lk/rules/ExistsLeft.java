package lk.rules;

import fol.formula.Exists;
import lk.Sequent;

/**
 * From {@code φ[y/x], Γ ⇒ Δ} infer {@code ∃x.φ, Γ ⇒ Δ}, where the eigenvariable y is not free in Γ or Δ.
 */
public class ExistsLeft extends UnaryRule {

    @Override
    boolean isValid(Sequent premise, Sequent conclusion) {
        if (!(conclusion.antFirst() instanceof Exists exists)) return false;
        return premise.succedent().equals(conclusion.succedent())
                && premise.antButFirst().equals(conclusion.antButFirst())
                && Quantifiers.isGeneralization(exists, premise.antFirst(),
                        Quantifiers.union(premise.succedent(), premise.antButFirst()));
    }
}
