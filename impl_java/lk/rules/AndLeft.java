package lk.rules;

import fol.formula.And;
import lk.Sequent;

/**
 * From {@code φ, Γ ⇒ Δ} (or {@code ψ, Γ ⇒ Δ}) infer {@code φ ∧ ψ, Γ ⇒ Δ}.
 */
public class AndLeft extends UnaryRule {
    private final boolean first;

    /**
     * @param first whether the premise keeps the left conjunct ({@code ∧L1}) or the right one ({@code ∧L2})
     */
    public AndLeft(boolean first) {
        this.first = first;
    }

    @Override
    boolean isValid(Sequent premise, Sequent conclusion) {
        if (!(conclusion.antFirst() instanceof And and)) return false;
        return premise.antFirst().equals(first ? and.left() : and.right())
                && premise.antButFirst().equals(conclusion.antButFirst())
                && premise.succedent().equals(conclusion.succedent());
    }
}
