package lk.rules;

import fol.formula.Or;
import lk.Sequent;

/**
 * From {@code Γ ⇒ Δ, φ} (or {@code Γ ⇒ Δ, ψ}) infer {@code Γ ⇒ Δ, φ ∨ ψ}.
 */
public class OrRight extends UnaryRule {
    private final boolean first;

    public OrRight(boolean first) {
        this.first = first;
    }

    @Override
    boolean isValid(Sequent premise, Sequent conclusion) {
        if (!(conclusion.sucLast() instanceof Or or)) return false;
        return premise.sucLast().equals(first ? or.left() : or.right())
                && premise.antecedent().equals(conclusion.antecedent())
                && premise.sucButLast().equals(conclusion.sucButLast());
    }
}
