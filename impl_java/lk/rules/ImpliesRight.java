package lk.rules;

import fol.formula.Implies;
import lk.Sequent;

/**
 * From {@code φ, Γ ⇒ Δ, ψ} infer {@code Γ ⇒ Δ, φ → ψ}.
 */
public class ImpliesRight extends UnaryRule {

    @Override
    boolean isValid(Sequent premise, Sequent conclusion) {
        if (!(conclusion.sucLast() instanceof Implies implies)) return false;
        return implies.left().equals(premise.antFirst())
                && implies.right().equals(premise.sucLast())
                && premise.antButFirst().equals(conclusion.antecedent())
                && premise.sucButLast().equals(conclusion.sucButLast());
    }
}
