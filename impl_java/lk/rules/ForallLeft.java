package lk.rules;

import fol.formula.Forall;
import lk.Sequent;

/**
 * From {@code φ[t/x], Γ ⇒ Δ} infer {@code ∀x.φ, Γ ⇒ Δ}, for a term t taken from the instance.
 */
public class ForallLeft extends UnaryRule {

    @Override
    boolean isValid(Sequent premise, Sequent conclusion) {
        if (!(conclusion.antFirst() instanceof Forall forall)) return false;
        return premise.antButFirst().equals(conclusion.antButFirst())
                && premise.succedent().equals(conclusion.succedent())
                && Quantifiers.isInstance(forall, premise.antFirst());
    }
}
